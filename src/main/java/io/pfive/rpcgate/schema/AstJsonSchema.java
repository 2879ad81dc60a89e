// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.pfive.rpcgate.util.JettyUtil;
import io.pfive.rpcgate.util.Ret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/// An ApiSchema backed by the JSON form of a compiled interface description. The document has the
/// following top-level members, all others are ignored but still served by fullDescription():
/// - typeTable: named types, each an inline struct object, an enum (array of strings) or a type name.
/// - functionTable: one entry per call, {"args": {argName: type, ...}, "ret": type}.
/// - annotations: keyed by target such as "fn.getUser", each an array of {"type", "value"} objects.
///   Annotations with type "throws" name the error types that call may return.
public class AstJsonSchema implements ApiSchema {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());
    private static final String THROWS_ANNOTATION = "throws";

    private final JsonNode description;
    private final JsonNode typeTable;
    private final ImmutableMap<String, CallDescription> calls;

    public AstJsonSchema (JsonNode description) {
        Preconditions.checkArgument(description != null && description.isObject(),
                "Interface description must be a JSON object.");
        this.description = description.deepCopy();
        JsonNode types = description.path("typeTable");
        this.typeTable = types.isObject() ? types.deepCopy() : JsonNodeFactory.instance.objectNode();
        JsonNode annotations = description.path("annotations");
        ImmutableMap.Builder<String, CallDescription> builder = ImmutableMap.builder();
        Iterator<Map.Entry<String, JsonNode>> functions = description.path("functionTable").fields();
        while (functions.hasNext()) {
            Map.Entry<String, JsonNode> function = functions.next();
            String name = function.getKey();
            JsonNode args = function.getValue().path("args");
            if (!args.isObject()) {
                args = JsonNodeFactory.instance.objectNode();
            }
            JsonNode ret = function.getValue().has("ret") ? function.getValue().get("ret") : TextNode.valueOf("void");
            builder.put(name, new CallDescription(name, args, ret, declaredErrors(annotations, name)));
        }
        this.calls = builder.build();
        LOG.info("Loaded interface description with {} calls and {} named types.", calls.size(), typeTable.size());
    }

    public static AstJsonSchema fromFile (Path path) throws IOException {
        return new AstJsonSchema(JettyUtil.objectMapper.readTree(path.toFile()));
    }

    private static Set<String> declaredErrors (JsonNode annotations, String callName) {
        Set<String> errors = new LinkedHashSet<>();
        for (JsonNode annotation : annotations.path("fn." + callName)) {
            if (THROWS_ANNOTATION.equals(annotation.path("type").asText())) {
                errors.add(annotation.path("value").asText());
            }
        }
        return errors;
    }

    @Override
    public Ret<CallDescription> lookupCall (String name) {
        CallDescription call = calls.get(name);
        if (call == null) {
            return Ret.err("Function does not exist: " + name);
        }
        return Ret.ok(call);
    }

    @Override
    public JsonNode typeTable () {
        return typeTable;
    }

    @Override
    public JsonNode fullDescription () {
        return description;
    }

}
