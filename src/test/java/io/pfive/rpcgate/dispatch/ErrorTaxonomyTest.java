// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.dispatch;

import com.fasterxml.jackson.databind.node.BooleanNode;
import io.pfive.rpcgate.TestApis;
import io.pfive.rpcgate.protocol.RpcError;
import io.pfive.rpcgate.protocol.RpcReply;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class ErrorTaxonomyTest {

    private final ErrorTaxonomy taxonomy = new ErrorTaxonomy(TestApis.schema());

    @Test
    void declaredTypePassesThrough () {
        RpcReply reply = RpcReply.err(new RpcError("NotFound", "No user"));
        assertSame(reply, taxonomy.enforce("getUser", reply));
    }

    @Test
    void undeclaredTypeBecomesFatalKeepingMessage () {
        RpcReply reply = taxonomy.enforce("getUser", RpcReply.err(new RpcError("Other", "Something")));
        assertEquals(RpcError.fatal("Something"), reply.error());
    }

    @Test
    void callsWithoutDeclarationsAreUnrestricted () {
        RpcReply reply = RpcReply.err(new RpcError("Anything", "x"));
        assertSame(reply, taxonomy.enforce("ping", reply));
        assertSame(reply, taxonomy.enforce("doesNotExist", reply));
    }

    @Test
    void successIsUntouched () {
        RpcReply reply = RpcReply.ok(BooleanNode.TRUE);
        assertSame(reply, taxonomy.enforce("getUser", reply));
    }

}
