// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.google.common.base.MoreObjects;

/// The outcome of a call, containing either an encoded result or an error.
///
/// This is the monomorphic, two-field form: exactly one of result or error is non-null, which the
/// private constructor and factory methods guarantee. A call returning nothing has a JSON null
/// result, never a Java null one.
public final class RpcReply {

    private final JsonNode result;
    private final RpcError error;

    private RpcReply (JsonNode result, RpcError error) {
        this.result = result;
        this.error = error;
    }

    public static RpcReply ok (JsonNode result) {
        return new RpcReply(result == null ? NullNode.getInstance() : result, null);
    }

    public static RpcReply err (RpcError error) {
        if (error == null) {
            throw new IllegalArgumentException("Error must not be null.");
        }
        return new RpcReply(null, error);
    }

    public static RpcReply err (Throwable throwable) {
        return err(RpcError.fromThrowable(throwable));
    }

    public boolean isErr () {
        return error != null;
    }

    public boolean isOk () {
        return error == null;
    }

    /// The encoded result, or null if this is an error.
    public JsonNode result () {
        return result;
    }

    /// The error, or null if this is a success.
    public RpcError error () {
        return error;
    }

    @Override
    public String toString () {
        return MoreObjects.toStringHelper(this).omitNullValues().add("result", result).add("error", error).toString();
    }

}
