// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.protocol;

import io.pfive.rpcgate.exception.RpcException;
import org.eclipse.jetty.http.HttpStatus;

/// An error as it leaves the gateway: a type name from the API's error taxonomy and a message.
public record RpcError (String type, String message) {

    public RpcError {
        if (type == null || type.isBlank()) type = RpcException.FATAL;
        if (message == null) message = "";
    }

    public static RpcError fatal (String message) {
        return new RpcError(RpcException.FATAL, message);
    }

    /// The type comes from RpcException.type(). All other throwables are Fatal. When the
    /// throwable has no message its class name stands in.
    public static RpcError fromThrowable (Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null || message.isEmpty()) {
            message = briefThrowableMessage(throwable);
        }
        if (throwable instanceof RpcException rpcException) {
            return new RpcError(rpcException.type(), message);
        }
        return new RpcError(RpcException.FATAL, message);
    }

    public RpcError withType (String newType) {
        return new RpcError(newType, message);
    }

    public boolean isFatal () {
        return RpcException.FATAL.equals(type);
    }

    /// Fatal errors are the server's fault. Any other type was anticipated by the API, so it is
    /// reported as a problem with the request.
    public int httpStatus () {
        return isFatal() ? HttpStatus.INTERNAL_SERVER_ERROR_500 : HttpStatus.BAD_REQUEST_400;
    }

    /// Create a one-line message consisting of only the exception class name and its message (if
    /// any). Some exceptions may be constructed with no message so getMessage returns null.
    public static String briefThrowableMessage (Throwable throwable) {
        String message = throwable.getMessage();
        String className = throwable.getClass().getSimpleName();
        if (message == null) {
            return className;
        } else {
            return className + ": " + message;
        }
    }

}
