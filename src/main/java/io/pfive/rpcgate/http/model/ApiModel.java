// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.http.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.pfive.rpcgate.protocol.RpcError;

/// Group together simple HTTP API response types used only for structuring JSON responses.
/// Record component names are the JSON member names, and null components are written as null.
public abstract class ApiModel {

    public record ErrorBody (String type, String message) {
        public static ErrorBody fromError (RpcError error) {
            return error == null ? null : new ErrorBody(error.type(), error.message());
        }
    }

    /// Oldest envelope, echoing the request and device IDs and reporting timing and host.
    public record ResponseV1 (
            String id,
            String deviceId,
            boolean ok,
            JsonNode result,
            ErrorBody error,
            double duration,
            String host
    ) { }

    /// Session-aware envelope. Carries no timing or host information.
    public record ResponseV2 (
            String requestId,
            String deviceId,
            String sessionId,
            boolean ok,
            JsonNode result,
            ErrorBody error
    ) { }

    /// Current envelope. The request ID travels in a response header instead of the body.
    public record ResponseV3 (JsonNode result, ErrorBody error, double duration, String host) { }

    /// Written when a request failed before it could be understood, so no version is known.
    public record FallbackResponse (ErrorBody error) { }

    public record HealthResponse (boolean ok) { }

}
