// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.protocol;

import io.pfive.rpcgate.exception.ApiException;
import io.pfive.rpcgate.exception.CodecException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RpcErrorTest {

    @Test
    void blankTypeBecomesFatal () {
        RpcError error = new RpcError(" ", null);
        assertTrue(error.isFatal());
        assertEquals("", error.message());
    }

    @Test
    void typeComesFromRpcExceptions () {
        assertEquals(new RpcError("NotFound", "gone"), RpcError.fromThrowable(new ApiException("NotFound", "gone")));
        assertEquals("Fatal", RpcError.fromThrowable(new CodecException("a.b", "bad")).type());
        assertEquals("Fatal", RpcError.fromThrowable(new IllegalStateException("broken")).type());
    }

    @Test
    void missingMessageUsesClassName () {
        assertEquals("NullPointerException", RpcError.fromThrowable(new NullPointerException()).message());
    }

    @Test
    void statusFollowsType () {
        assertEquals(500, RpcError.fatal("x").httpStatus());
        assertEquals(400, new RpcError("Forbidden", "x").httpStatus());
    }

    @Test
    void replyHoldsExactlyOneSide () {
        RpcReply ok = RpcReply.ok(null);
        assertTrue(ok.isOk());
        assertTrue(ok.result().isNull());
        assertNull(ok.error());
        RpcReply err = RpcReply.err(RpcError.fatal("x"));
        assertFalse(err.isOk());
        assertNull(err.result());
        assertThrows(IllegalArgumentException.class, () -> RpcReply.err((RpcError) null));
    }

}
