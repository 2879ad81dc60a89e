// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.exception;

/// An error that is never part of a call's declared contract. Clients see it with status 500.
public class FatalException extends RpcException {

    public FatalException (String message) {
        super(message);
    }

    public FatalException (String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String type () {
        return FATAL;
    }

}
