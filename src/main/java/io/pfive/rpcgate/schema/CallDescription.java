// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableSet;

import java.util.Set;

/// One entry of the function table. The argument type is an inline struct whose fields are the
/// call's named arguments. An empty declaredErrors set means the call is unrestricted.
public record CallDescription (String name, JsonNode argsType, JsonNode returnType, Set<String> declaredErrors) {
    public CallDescription {
        declaredErrors = ImmutableSet.copyOf(declaredErrors);
    }
}
