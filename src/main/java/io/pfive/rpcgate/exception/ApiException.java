// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.exception;

import com.google.common.base.Preconditions;

/// An error of a type named by the application, usually one a call declares it may throw, such as
/// NotFound or InvalidArgument. Types not declared by the failing call are reported as Fatal.
public class ApiException extends RpcException {

    private final String type;

    public ApiException (String type, String message) {
        super(message);
        Preconditions.checkArgument(type != null && !type.isBlank(), "Error type must not be blank.");
        this.type = type;
    }

    @Override
    public String type () {
        return type;
    }

}
