// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.dispatch;

import io.pfive.rpcgate.exception.RpcException;
import io.pfive.rpcgate.protocol.RpcReply;
import io.pfive.rpcgate.schema.ApiSchema;
import io.pfive.rpcgate.schema.CallDescription;
import io.pfive.rpcgate.util.Ret;

import java.util.Set;

/// Restricts the error types a call may report to those it declares with throws annotations. An
/// error of any other type is reported as Fatal with its message unchanged, so internal failure
/// categories never reach clients as if they were part of the API. A call that declares nothing is
/// unrestricted.
public class ErrorTaxonomy {

    private final ApiSchema schema;

    public ErrorTaxonomy (ApiSchema schema) {
        this.schema = schema;
    }

    public RpcReply enforce (String callName, RpcReply reply) {
        if (reply.isOk()) {
            return reply;
        }
        Ret<Set<String>> declaredErrors = schema.lookupCall(callName).map(CallDescription::declaredErrors);
        if (declaredErrors.isErr()) {
            return reply;
        }
        Set<String> declared = declaredErrors.get();
        if (declared.isEmpty() || declared.contains(reply.error().type())) {
            return reply;
        }
        return RpcReply.err(reply.error().withType(RpcException.FATAL));
    }

}
