// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import org.eclipse.jetty.http.HttpFields;

/// A call as understood by the gateway, whichever wire format it arrived in. It is created once
/// per call by RequestNormalizer, passed to hooks and implementations, and discarded after the
/// response is written. The version decides which response envelope will be produced.
///
/// @param version the protocol generation the request was recognized as.
/// @param id unique per call, generated when the client did not supply one.
/// @param name the call name, looked up in the interface description.
/// @param args the raw arguments before any type checking.
/// @param ip the client address, which is required.
/// @param headers the transport headers of the HTTP request, read-only.
public record RpcRequest (
        ProtocolVersion version,
        String id,
        String name,
        JsonNode args,
        DeviceInfo deviceInfo,
        RequestExtra extra,
        String ip,
        HttpFields headers
) {
    public RpcRequest {
        Preconditions.checkNotNull(version, "Protocol version is required.");
        Preconditions.checkNotNull(id, "Request ID is required.");
        Preconditions.checkNotNull(name, "Call name is required.");
        Preconditions.checkNotNull(deviceInfo, "Device info is required.");
        Preconditions.checkNotNull(extra, "Extra values are required, even if empty.");
        Preconditions.checkArgument(ip != null && !ip.isBlank(), "Client IP is required.");
        headers = headers == null ? HttpFields.EMPTY : headers.asImmutable();
    }
}
