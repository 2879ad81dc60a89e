// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.http.handler;

import com.google.common.collect.ImmutableMap;
import org.eclipse.jetty.http.HttpFields;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/// Headers added to every response, built while the server is assembled and only read afterwards.
/// Adding a header that is already present appends the new value after a comma instead of
/// replacing it, so repeated additions are never deduplicated.
public class HeaderPolicy {

    private static final String CORS_PREFIX = "access-control-";

    // Insertion order is kept so responses list headers in the order they were configured.
    private final Map<String, String> headers = new LinkedHashMap<>();

    /// The static cross-origin policy: all common methods, JSON bodies, preflight cached for a day.
    public static HeaderPolicy withCorsDefaults () {
        HeaderPolicy policy = new HeaderPolicy();
        policy.addHeader("Access-Control-Allow-Methods", "DELETE, HEAD, PUT, POST, PATCH, GET, OPTIONS");
        policy.addHeader("Access-Control-Allow-Headers", "Content-Type");
        policy.addHeader("Access-Control-Max-Age", "86400");
        return policy;
    }

    /// Header names are case-insensitive, so they are stored lower-cased and trimmed.
    public void addHeader (String header, String value) {
        String cleanHeader = header.toLowerCase(Locale.ROOT).trim();
        headers.merge(cleanHeader, value, (existing, added) -> existing + ", " + added);
    }

    /// Copy the policy onto a response. A preflight response only receives the cross-origin headers.
    public void applyTo (HttpFields.Mutable responseHeaders, boolean preflight) {
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (preflight && !header.getKey().startsWith(CORS_PREFIX)) {
                continue;
            }
            responseHeaders.put(header.getKey(), header.getValue());
        }
    }

    public ImmutableMap<String, String> snapshot () {
        return ImmutableMap.copyOf(headers);
    }

}
