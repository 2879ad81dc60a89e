// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.exception;

/// Superclass for all exceptions that carry an error type from the API's error taxonomy. Call
/// implementations, hooks and the codec throw these to bail out of a call. The dispatcher catches
/// them and converts them into an error reply whose type is type() and whose message is the
/// exception message, so no implementation needs to build reply objects by hand. Any other
/// exception reaching the dispatcher is reported with the generic Fatal type.
public abstract class RpcException extends RuntimeException {

    public static final String FATAL = "Fatal";

    public RpcException (String message) {
        super(message);
    }

    public RpcException (String message, Throwable cause) {
        super(message, cause);
    }

    /// The name of the error type, as listed in the interface description.
    public abstract String type ();

}
