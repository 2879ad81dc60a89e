// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.pfive.rpcgate.exception.CodecException;

/// Converts between wire-safe JSON values and values checked against a declared type. Both
/// operations are pure and throw CodecException on a type mismatch. The path names the value
/// being converted in error messages.
public interface ValueCodec {

    JsonNode decode (JsonNode typeTable, String path, JsonNode type, JsonNode value) throws CodecException;

    /// The value may be any object Jackson can convert to a tree, including a JsonNode or null.
    JsonNode encode (JsonNode typeTable, String path, JsonNode type, Object value) throws CodecException;

}
