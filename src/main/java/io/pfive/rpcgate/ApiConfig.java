// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate;

import com.google.common.base.Preconditions;
import io.pfive.rpcgate.codegen.Target;
import io.pfive.rpcgate.codegen.TargetGenerator;
import io.pfive.rpcgate.dispatch.ApiHooks;
import io.pfive.rpcgate.dispatch.CallImplementation;
import io.pfive.rpcgate.schema.ApiSchema;
import io.pfive.rpcgate.schema.ValueCodec;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/// Everything an application supplies to serve its API: the compiled interface description, the
/// codec for its types, one implementation per call, lifecycle hooks and optional stub generators.
/// Assemble this fully before constructing the server. It is only read once requests are served.
public class ApiConfig {

    private final ApiSchema schema;
    private final ValueCodec codec;
    private final Map<String, CallImplementation> implementations = new HashMap<>();
    private final Map<Target, TargetGenerator> generators = new EnumMap<>(Target.class);
    private ApiHooks hooks = ApiHooks.NONE;

    public ApiConfig (ApiSchema schema, ValueCodec codec) {
        this.schema = Preconditions.checkNotNull(schema);
        this.codec = Preconditions.checkNotNull(codec);
    }

    public ApiConfig implement (String callName, CallImplementation implementation) {
        Preconditions.checkNotNull(implementation, "Implementation of %s must not be null.", callName);
        implementations.put(callName, implementation);
        return this;
    }

    public ApiConfig hooks (ApiHooks hooks) {
        this.hooks = Preconditions.checkNotNull(hooks);
        return this;
    }

    public ApiConfig generator (Target target, TargetGenerator generator) {
        generators.put(target, Preconditions.checkNotNull(generator));
        return this;
    }

    public ApiSchema schema () {
        return schema;
    }

    public ValueCodec codec () {
        return codec;
    }

    public ApiHooks hooks () {
        return hooks;
    }

    /// @return the implementation of the named call, or null if the application has none.
    public CallImplementation implementation (String callName) {
        return implementations.get(callName);
    }

    /// @return the generator for the target, or null if none was registered.
    public TargetGenerator generator (Target target) {
        return generators.get(target);
    }

}
