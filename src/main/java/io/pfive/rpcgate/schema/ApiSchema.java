// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.pfive.rpcgate.util.Ret;

/// Read-only view of a compiled interface description.
public interface ApiSchema {

    /// Find the argument type, return type and declared errors of a call.
    /// Unknown names yield an Err rather than an exception, since clients can send anything.
    Ret<CallDescription> lookupCall (String name);

    /// Named types referenced from argument and return types, keyed by type name.
    JsonNode typeTable ();

    /// The whole description as a JSON document, served for introspection.
    JsonNode fullDescription ();

}
