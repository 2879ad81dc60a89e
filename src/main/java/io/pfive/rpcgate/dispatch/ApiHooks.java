// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.dispatch;

import io.pfive.rpcgate.protocol.RpcReply;
import io.pfive.rpcgate.protocol.RpcRequest;

import java.util.Optional;

/// Application callbacks around the request lifecycle. All methods have do-nothing defaults so an
/// application overrides only what it needs. Authentication, rate limiting and auditing policy
/// live here, outside the gateway.
public interface ApiHooks {

    ApiHooks NONE = new ApiHooks() { };

    /// Answers GET on the RPC root. Throwing counts as unhealthy.
    default boolean onHealthCheck () throws Exception {
        return true;
    }

    /// Runs before arguments are decoded, only for calls that exist.
    default RequestStartOutcome onRequestStart (RpcRequest request) throws Exception {
        return RequestStartOutcome.proceed();
    }

    /// Runs after the call (or the short-circuit reply) with the reply so far. Returning a reply
    /// replaces it. Error types in the replacement are still subject to the declared-throws check.
    default Optional<RpcReply> onRequestEnd (RpcRequest request, RpcReply reply) throws Exception {
        return Optional.empty();
    }

}
