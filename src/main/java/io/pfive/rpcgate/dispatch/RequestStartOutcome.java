// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.dispatch;

import io.pfive.rpcgate.protocol.RpcReply;

/// What the pre-call hook decided: let the call run, or answer it directly with a reply of its
/// own (for example to reject an unauthenticated client) without decoding arguments or invoking
/// the implementation.
public interface RequestStartOutcome {

    record Proceed () implements RequestStartOutcome { }

    record ShortCircuit (RpcReply reply) implements RequestStartOutcome {
        public ShortCircuit {
            if (reply == null) throw new IllegalArgumentException("Short-circuit reply must not be null.");
        }
    }

    static RequestStartOutcome proceed () {
        return new Proceed();
    }

    static RequestStartOutcome reply (RpcReply reply) {
        return new ShortCircuit(reply);
    }

}
