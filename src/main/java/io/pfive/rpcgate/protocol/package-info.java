// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// The wire protocol of the RPC endpoint. Three generations of request bodies are in use by
/// deployed clients. RequestNormalizer maps each of them onto one RpcRequest, and ResponseEncoder
/// maps an RpcReply back onto the response envelope of the generation the request came in.
package io.pfive.rpcgate.protocol;
