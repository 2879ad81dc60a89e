// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.codegen;

import io.pfive.rpcgate.schema.ApiSchema;

/// Produces the source text of client or server stubs for one target platform. Generators are
/// external; the gateway only serves their output.
@FunctionalInterface
public interface TargetGenerator {
    String generate (ApiSchema schema) throws Exception;
}
