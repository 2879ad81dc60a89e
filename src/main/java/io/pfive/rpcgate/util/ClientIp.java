// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.util;

import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.server.Request;

import java.util.List;
import java.util.Locale;

/// Determines the address of the client that originated a request. Proxies and CDNs report the
/// original client in one of several headers, which are checked in a fixed order before falling
/// back on the address of the socket itself.
public abstract class ClientIp {

    public static final List<String> HEADERS = List.of(
            "x-client-ip",
            "x-forwarded-for",
            "cf-connecting-ip",
            "fastly-client-ip",
            "true-client-ip",
            "x-real-ip",
            "x-cluster-client-ip",
            "x-forwarded",
            "forwarded-for",
            "forwarded"
    );

    public static Ret<String> fromRequest (Request request) {
        Ret<String> fromHeaders = fromHeaders(request.getHeaders());
        if (fromHeaders.isOk()) {
            return fromHeaders;
        }
        String remote = Request.getRemoteAddr(request);
        if (remote == null || remote.isBlank()) {
            return Ret.err("Couldn't determine client IP");
        }
        return Ret.ok(remote);
    }

    public static Ret<String> fromHeaders (HttpFields headers) {
        for (String name : HEADERS) {
            String value = headers.get(name);
            if (value == null || value.isBlank()) continue;
            String address = firstAddress(name, value);
            if (address != null && !address.isEmpty()) {
                return Ret.ok(address);
            }
        }
        return Ret.err("No client address header present.");
    }

    /// Extract one address from a header value. Forwarding headers hold a comma-separated chain
    /// where the first entry is the original client. An IPv4 address may carry a port suffix.
    static String firstAddress (String headerName, String value) {
        String first = value.split(",")[0].trim();
        if (headerName.equals("forwarded")) {
            first = forwardedFor(first);
            if (first == null) return null;
        }
        if (first.startsWith("\"") && first.endsWith("\"") && first.length() >= 2) {
            first = first.substring(1, first.length() - 1);
        }
        if (first.startsWith("[")) {
            int close = first.indexOf(']');
            return close > 0 ? first.substring(1, close) : first;
        }
        if (first.chars().filter(c -> c == ':').count() == 1) {
            return first.substring(0, first.indexOf(':'));
        }
        return first;
    }

    /// The standard Forwarded header packs several directives into each element: for=, by=, proto=.
    private static String forwardedFor (String element) {
        for (String directive : element.split(";")) {
            String trimmed = directive.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("for=")) {
                return trimmed.substring(4).trim();
            }
        }
        return null;
    }

}
