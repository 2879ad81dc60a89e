// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.exception;

/// Throw this when a request body cannot be understood as any known protocol version. No request
/// context exists yet, so the response is the bare fallback error envelope.
public class RequestParseException extends FatalException {

    public RequestParseException (String message) {
        super("Failed to understand request: " + message);
    }

    public RequestParseException (String message, Throwable cause) {
        super("Failed to understand request: " + message, cause);
    }

}
