// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import io.pfive.rpcgate.ApiConfig;
import io.pfive.rpcgate.exception.FatalException;
import io.pfive.rpcgate.exception.RpcException;
import io.pfive.rpcgate.protocol.RpcReply;
import io.pfive.rpcgate.protocol.RpcRequest;
import io.pfive.rpcgate.schema.CallDescription;
import io.pfive.rpcgate.util.Ret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Optional;

/// Runs one call to completion and always produces a reply, never an exception. The steps are
/// strictly sequential: look up the call, run the pre-call hook, decode the arguments, invoke the
/// implementation, encode the result, run the post-call hook.
///
/// A call that is missing from either the interface description or the implementation table is
/// answered with a Fatal error before any hook runs, so hooks only ever see calls that exist.
/// Failures anywhere after that point become error replies that the post-call hook can still
/// inspect or replace.
public class CallDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final ApiConfig api;

    public CallDispatcher (ApiConfig api) {
        this.api = api;
    }

    public RpcReply dispatch (RpcRequest request) {
        String name = request.name();
        Ret<CallDescription> description = api.schema().lookupCall(name);
        CallImplementation implementation = api.implementation(name);
        if (description.isErr() || implementation == null) {
            return RpcReply.err(new FatalException("Function does not exist: " + name));
        }
        RpcReply reply = invoke(request, description.get(), implementation);
        try {
            Optional<RpcReply> replacement = api.hooks().onRequestEnd(request, reply);
            if (replacement.isPresent()) {
                reply = replacement.get();
            }
        } catch (Exception e) {
            reply = failure(name, e);
        }
        return reply;
    }

    private RpcReply invoke (RpcRequest request, CallDescription call, CallImplementation implementation) {
        String name = request.name();
        try {
            RequestStartOutcome outcome = api.hooks().onRequestStart(request);
            if (outcome instanceof RequestStartOutcome.ShortCircuit shortCircuit) {
                return shortCircuit.reply();
            }
            JsonNode typeTable = api.schema().typeTable();
            JsonNode args = api.codec().decode(typeTable, name + ".args", call.argsType(), request.args());
            Object ret = implementation.call(request, args);
            return RpcReply.ok(api.codec().encode(typeTable, name + ".ret", call.returnType(), ret));
        } catch (Exception e) {
            return failure(name, e);
        }
    }

    /// RpcExceptions are expected in normal operation and carry their own type, so don't log stack
    /// traces for them. Anything else is a bug in the implementation or a hook.
    private static RpcReply failure (String name, Exception e) {
        if (!(e instanceof RpcException)) {
            LOG.warn("Unexpected exception in call {}()", name, e);
        }
        return RpcReply.err(e);
    }

}
