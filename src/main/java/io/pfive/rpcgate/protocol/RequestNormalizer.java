// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pfive.rpcgate.exception.CodecException;
import io.pfive.rpcgate.exception.RequestParseException;
import io.pfive.rpcgate.schema.ValueCodec;
import io.pfive.rpcgate.util.JettyUtil;
import io.pfive.rpcgate.util.RandomId;
import org.eclipse.jetty.http.HttpFields;

import java.io.IOException;

/// Recognizes which protocol generation a request body belongs to and maps it onto an RpcRequest.
///
/// Classification looks only at which top-level members are present, in this order: an explicit
/// version number wins, then requestId means version 2, then device means version 1, and anything
/// else is taken to be the current version 3. A body that is really a damaged version 1 or 2
/// request will therefore fail the version 3 shape check; no attempt is made to guess.
///
/// Every failure, whether malformed JSON, an unknown version or a shape mismatch, is reported as a
/// RequestParseException so the call never reaches dispatch.
public class RequestNormalizer {

    private final ValueCodec codec;

    public RequestNormalizer (ValueCodec codec) {
        this.codec = codec;
    }

    /// Parse, classify and normalize a request body in one step.
    public RpcRequest normalize (String body, String ip, HttpFields headers) {
        JsonNode payload = parse(body);
        return normalize(classify(payload), payload, ip, headers);
    }

    public static JsonNode parse (String body) {
        final JsonNode payload;
        try {
            payload = JettyUtil.objectMapper.readTree(body);
        } catch (IOException e) {
            throw new RequestParseException("body is not valid JSON.", e);
        }
        if (payload == null || !payload.isObject()) {
            throw new RequestParseException("body should be a JSON object.");
        }
        return payload;
    }

    public ProtocolVersion classify (JsonNode payload) {
        if (payload.has("version")) {
            JsonNode version = payload.get("version");
            double number = version.asDouble();
            if (!version.isNumber() || number != Math.rint(number)) {
                throw new RequestParseException("version should be a number, got " + version);
            }
            return ProtocolVersion.fromNumber((int) number).getOrThrow(RequestParseException::new);
        } else if (payload.has("requestId")) {
            return ProtocolVersion.V2;
        } else if (payload.has("device")) {
            return ProtocolVersion.V1;
        }
        return ProtocolVersion.V3;
    }

    public RpcRequest normalize (ProtocolVersion version, JsonNode payload, String ip, HttpFields headers) {
        final JsonNode parsed;
        try {
            parsed = codec.decode(RequestShapes.forVersion(version), "root",
                    TextNode.valueOf(RequestShapes.ROOT_TYPE), payload);
        } catch (CodecException e) {
            throw new RequestParseException(e.getMessage(), e);
        }
        return switch (version) {
            case V1 -> fromV1(parsed, ip, headers);
            case V2 -> fromV2(parsed, ip, headers);
            case V3 -> fromV3(parsed, ip, headers);
        };
    }

    private static RpcRequest fromV1 (JsonNode parsed, String ip, HttpFields headers) {
        JsonNode device = parsed.get("device");
        String id = text(parsed, "id");
        JsonNode platform = device.get("platform");
        String type = firstNonEmpty(text(device, "type"), platform.isTextual() ? platform.asText() : null, "");
        DeviceInfo deviceInfo = new DeviceInfo(
                firstNonEmpty(text(device, "id"), id),
                text(device, "language"),
                platform.isNull() ? null : platform,
                text(device, "timezone"),
                type,
                text(device, "version")
        );
        return new RpcRequest(ProtocolVersion.V1, id, text(parsed, "name"), parsed.get("args"),
                deviceInfo, new RequestExtra.None(), ip, headers);
    }

    private static RpcRequest fromV2 (JsonNode parsed, String ip, HttpFields headers) {
        JsonNode info = parsed.get("info");
        ObjectNode platform = JsonNodeFactory.instance.objectNode();
        platform.put("browserUserAgent", firstNonEmpty(text(info, "browserUserAgent"), null));
        DeviceInfo deviceInfo = new DeviceInfo(
                text(parsed, "deviceId"),
                text(info, "language"),
                platform,
                null,
                text(info, "type"),
                ""
        );
        RequestExtra extra = new RequestExtra.Session(text(parsed, "partnerId"), text(parsed, "sessionId"));
        return new RpcRequest(ProtocolVersion.V2, text(parsed, "requestId"), text(parsed, "name"),
                parsed.get("args"), deviceInfo, extra, ip, headers);
    }

    private static RpcRequest fromV3 (JsonNode parsed, String ip, HttpFields headers) {
        JsonNode device = parsed.get("deviceInfo");
        if (device.isNull()) {
            device = JsonNodeFactory.instance.objectNode();
        }
        ObjectNode platform = JsonNodeFactory.instance.objectNode();
        JsonNode suppliedPlatform = device.path("platform");
        if (suppliedPlatform.isObject()) {
            platform.setAll((ObjectNode) suppliedPlatform);
        }
        platform.put("browserUserAgent", firstNonEmpty(text(device, "browserUserAgent"), null));
        DeviceInfo deviceInfo = new DeviceInfo(
                firstNonEmpty(text(device, "id"), RandomId.createRandomHexId()),
                firstNonEmpty(text(device, "language"), null),
                platform,
                firstNonEmpty(text(device, "timezone"), null),
                firstNonEmpty(text(device, "type"), "api"),
                firstNonEmpty(text(device, "version"), null)
        );
        // Only an object can be merged into the extra values. Anything else is treated as absent.
        JsonNode suppliedExtra = parsed.get("extra");
        ObjectNode extra = suppliedExtra.isObject()
                ? (ObjectNode) suppliedExtra
                : JsonNodeFactory.instance.objectNode();
        return new RpcRequest(ProtocolVersion.V3,
                firstNonEmpty(text(parsed, "requestId"), RandomId.createRandomHexId()),
                text(parsed, "name"), parsed.get("args"), deviceInfo, new RequestExtra.Open(extra), ip, headers);
    }

    /// The value of a string member, or null when it is absent or JSON null.
    private static String text (JsonNode object, String field) {
        JsonNode value = object.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) return null;
        return value.asText();
    }

    /// Clients of all generations send empty strings where they mean "not set".
    private static String firstNonEmpty (String... candidates) {
        for (int i = 0; i < candidates.length - 1; i++) {
            if (candidates[i] != null && !candidates[i].isEmpty()) return candidates[i];
        }
        return candidates[candidates.length - 1];
    }

}
