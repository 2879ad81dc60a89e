// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.pfive.rpcgate.util.JettyUtil;

/// The fixed shape of each request generation, written in the same type language as the interface
/// description so the regular codec can check a body before any field is read from it. Each
/// constant is a type table whose "Request" entry describes the whole body.
public abstract class RequestShapes {

    public static final String ROOT_TYPE = "Request";

    public static final JsonNode V1 = parse("""
            {
              "Request": {
                "args": "json",
                "device": {
                  "id": "string?",
                  "language": "string?",
                  "platform": "json?",
                  "timezone": "string?",
                  "type": "string?",
                  "version": "string?"
                },
                "id": "string",
                "name": "string"
              }
            }
            """);

    public static final JsonNode V2 = parse("""
            {
              "Request": {
                "args": "json",
                "deviceId": "string",
                "info": {
                  "browserUserAgent": "string?",
                  "language": "string",
                  "type": "string"
                },
                "name": "string",
                "partnerId": "string?",
                "requestId": "string",
                "sessionId": "string?"
              }
            }
            """);

    public static final JsonNode V3 = parse("""
            {
              "DeviceInfo": {
                "browserUserAgent": "string?",
                "id": "string?",
                "language": "string?",
                "platform": "json?",
                "timezone": "string?",
                "type": "string?",
                "version": "string?"
              },
              "Request": {
                "args": "json",
                "deviceInfo": "DeviceInfo?",
                "extra": "json?",
                "name": "string",
                "requestId": "string?"
              }
            }
            """);

    public static JsonNode forVersion (ProtocolVersion version) {
        return switch (version) {
            case V1 -> V1;
            case V2 -> V2;
            case V3 -> V3;
        };
    }

    private static JsonNode parse (String json) {
        try {
            return JettyUtil.objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Built-in request shape is not valid JSON.", e);
        }
    }

}
