// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import io.pfive.rpcgate.exception.RequestParseException;
import io.pfive.rpcgate.schema.JsonTypeCodec;
import io.pfive.rpcgate.util.JettyUtil;
import io.pfive.rpcgate.util.RandomId;
import org.eclipse.jetty.http.HttpFields;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequestNormalizerTest {

    private static final String IP = "192.0.2.1";

    private final RequestNormalizer normalizer = new RequestNormalizer(new JsonTypeCodec(JettyUtil.objectMapper));

    private RpcRequest normalize (String body) {
        return normalizer.normalize(body, IP, HttpFields.EMPTY);
    }

    private String failure (String body) {
        return assertThrows(RequestParseException.class, () -> normalize(body)).getMessage();
    }

    @Test
    void classificationPrecedence () {
        assertEquals(ProtocolVersion.V1, normalizer.classify(RequestNormalizer.parse("{\"version\": 1}")));
        assertEquals(ProtocolVersion.V3, normalizer.classify(RequestNormalizer.parse("{\"version\": 3, \"requestId\": \"r\"}")));
        assertEquals(ProtocolVersion.V2, normalizer.classify(RequestNormalizer.parse("{\"requestId\": \"r\", \"device\": {}}")));
        assertEquals(ProtocolVersion.V1, normalizer.classify(RequestNormalizer.parse("{\"device\": {}}")));
        assertEquals(ProtocolVersion.V3, normalizer.classify(RequestNormalizer.parse("{}")));
    }

    @Test
    void unknownOrMistypedVersionIsRejected () {
        assertThrows(RequestParseException.class, () -> normalizer.classify(RequestNormalizer.parse("{\"version\": 7}")));
        assertThrows(RequestParseException.class, () -> normalizer.classify(RequestNormalizer.parse("{\"version\": \"2\"}")));
        assertThrows(RequestParseException.class, () -> normalizer.classify(RequestNormalizer.parse("{\"version\": 2.5}")));
    }

    @Test
    void bodyMustBeJsonObject () {
        assertTrue(failure("not json").startsWith("Failed to understand request: "));
        failure("[1, 2]");
        failure("\"text\"");
    }

    @Test
    void version1 () {
        RpcRequest request = normalize("""
                {"id": "r1", "name": "ping", "args": {},
                 "device": {"id": "d1", "platform": "android", "language": "pt"}}
                """);
        assertEquals(ProtocolVersion.V1, request.version());
        assertEquals("r1", request.id());
        assertEquals("ping", request.name());
        assertEquals("d1", request.deviceInfo().id());
        assertEquals("pt", request.deviceInfo().language());
        // Without a type, a textual platform stands in.
        assertEquals("android", request.deviceInfo().type());
        assertInstanceOf(RequestExtra.None.class, request.extra());
        assertEquals(IP, request.ip());
    }

    @Test
    void version1DeviceIdFallsBackToRequestId () {
        RpcRequest request = normalize("{\"id\": \"r1\", \"name\": \"ping\", \"args\": {}, \"device\": {\"id\": \"\"}}");
        assertEquals("r1", request.deviceInfo().id());
        assertEquals("", request.deviceInfo().type());
        assertNull(request.deviceInfo().platform());
    }

    @Test
    void version1RequiresId () {
        assertTrue(failure("{\"name\": \"ping\", \"args\": {}, \"device\": {}}").contains("root.id"));
    }

    @Test
    void version2 () {
        RpcRequest request = normalize("""
                {"requestId": "r2", "deviceId": "d2", "name": "ping", "args": {}, "sessionId": "s2",
                 "info": {"language": "en", "type": "web", "browserUserAgent": "Firefox"}}
                """);
        assertEquals(ProtocolVersion.V2, request.version());
        assertEquals("r2", request.id());
        assertEquals("d2", request.deviceInfo().id());
        assertEquals("web", request.deviceInfo().type());
        assertEquals("", request.deviceInfo().version());
        assertEquals("Firefox", request.deviceInfo().platform().get("browserUserAgent").asText());
        RequestExtra.Session session = assertInstanceOf(RequestExtra.Session.class, request.extra());
        assertEquals("s2", session.sessionId());
        assertNull(session.partnerId());
    }

    @Test
    void version2RequiresInfo () {
        assertTrue(failure("{\"requestId\": \"r2\", \"deviceId\": \"d2\", \"name\": \"ping\", \"args\": {}}")
                .contains("root.info"));
    }

    @Test
    void version3FillsDefaults () {
        RpcRequest request = normalize("{\"name\": \"ping\", \"args\": {}}");
        assertEquals(ProtocolVersion.V3, request.version());
        assertTrue(RandomId.validRandomHexId(request.id()));
        assertTrue(RandomId.validRandomHexId(request.deviceInfo().id()));
        assertNotEquals(request.id(), request.deviceInfo().id());
        assertEquals("api", request.deviceInfo().type());
        assertTrue(request.deviceInfo().platform().get("browserUserAgent").isNull());
        assertEquals(0, request.extra().values().size());
    }

    @Test
    void version3KeepsSuppliedValues () {
        RpcRequest request = normalize("""
                {"version": 3, "requestId": "r3", "name": "ping", "args": {"a": 1},
                 "deviceInfo": {"id": "d3", "type": "ios", "platform": {"os": "17.1"}, "browserUserAgent": "Safari"},
                 "extra": {"tenant": "acme"}}
                """);
        assertEquals("r3", request.id());
        assertEquals("d3", request.deviceInfo().id());
        assertEquals("ios", request.deviceInfo().type());
        JsonNode platform = request.deviceInfo().platform();
        assertEquals("17.1", platform.get("os").asText());
        assertEquals("Safari", platform.get("browserUserAgent").asText());
        assertEquals("acme", request.extra().values().get("tenant").asText());
        assertEquals(1, request.args().get("a").asInt());
    }

    @Test
    void version3EmptyRequestIdIsReplaced () {
        RpcRequest request = normalize("{\"requestId\": \"\", \"version\": 3, \"name\": \"ping\", \"args\": null}");
        assertTrue(RandomId.validRandomHexId(request.id()));
    }

    @Test
    void version3NonObjectExtraIsDropped () {
        RpcRequest request = normalize("{\"name\": \"ping\", \"args\": {}, \"extra\": [1]}");
        assertEquals(0, request.extra().values().size());
        assertInstanceOf(RequestExtra.Open.class, request.extra());
    }

    @Test
    void version3RequiresName () {
        assertEquals("Failed to understand request: Invalid type at 'root.name', expected string, got undefined",
                failure("{\"args\": {}}"));
    }

}
