// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.pfive.rpcgate.exception.ApiException;
import io.pfive.rpcgate.schema.AstJsonSchema;
import io.pfive.rpcgate.schema.JsonTypeCodec;
import io.pfive.rpcgate.util.JettyUtil;

/// Interface descriptions shared by tests.
public abstract class TestApis {

    public static final String AST = """
            {
              "typeTable": {
                "User": {"id": "string", "name": "string", "email": "string?"},
                "Color": ["red", "green"]
              },
              "functionTable": {
                "ping": {"args": {}, "ret": "bool"},
                "echo": {"args": {"text": "string"}, "ret": "string"},
                "getUser": {"args": {"id": "string"}, "ret": "User"},
                "paint": {"args": {"color": "Color"}, "ret": "void"},
                "unimplemented": {"args": {}}
              },
              "annotations": {
                "fn.getUser": [
                  {"type": "throws", "value": "NotFound"},
                  {"type": "description", "value": "Look up one user."}
                ]
              }
            }
            """;

    public static JsonNode astJson () {
        try {
            return JettyUtil.objectMapper.readTree(AST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    public static AstJsonSchema schema () {
        return new AstJsonSchema(astJson());
    }

    /// An ApiConfig where ping, echo and getUser are implemented. getUser knows only user "u1".
    public static ApiConfig api () {
        return new ApiConfig(schema(), new JsonTypeCodec(JettyUtil.objectMapper))
                .implement("ping", (request, args) -> true)
                .implement("echo", (request, args) -> args.get("text").asText())
                .implement("getUser", (request, args) -> {
                    String id = args.get("id").asText();
                    if (id.equals("u1")) {
                        return new User("u1", "Ada", null);
                    }
                    if (id.equals("boom")) {
                        throw new ApiException("Other", "Not a declared error");
                    }
                    throw new ApiException("NotFound", "No user " + id);
                });
    }

    public record User (String id, String name, String email) { }

}
