// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import io.pfive.rpcgate.exception.ApiException;
import io.pfive.rpcgate.schema.JsonTypeCodec;
import io.pfive.rpcgate.util.JettyUtil;
import org.eclipse.jetty.http.HttpFields;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseEncoderTest {

    private final RequestNormalizer normalizer = new RequestNormalizer(new JsonTypeCodec(JettyUtil.objectMapper));
    private final ResponseEncoder encoder = new ResponseEncoder("test-host");

    private RpcRequest request (String body) {
        return normalizer.normalize(body, "192.0.2.1", HttpFields.EMPTY);
    }

    private static JsonNode body (EncodedResponse response) throws IOException {
        return JettyUtil.objectMapper.readTree(response.bodyBytes());
    }

    @Test
    void version1Success () throws IOException {
        RpcRequest request = request("{\"id\": \"r1\", \"device\": {\"id\": \"d1\"}, \"name\": \"ping\", \"args\": {}}");
        EncodedResponse response = encoder.encode(request, RpcReply.ok(BooleanNode.TRUE), 0.25);
        assertEquals(200, response.status());
        assertTrue(response.headers().isEmpty());
        JsonNode body = body(response);
        assertEquals("r1", body.get("id").asText());
        assertEquals("d1", body.get("deviceId").asText());
        assertTrue(body.get("ok").asBoolean());
        assertTrue(body.get("result").asBoolean());
        assertTrue(body.get("error").isNull());
        assertEquals(0.25, body.get("duration").asDouble());
        assertEquals("test-host", body.get("host").asText());
    }

    @Test
    void version2Error () throws IOException {
        RpcRequest request = request("""
                {"requestId": "r2", "deviceId": "d2", "name": "getUser", "args": {},
                 "info": {"language": "en", "type": "web"}}
                """);
        EncodedResponse response = encoder.encode(request, RpcReply.err(new ApiException("NotFound", "No user")), 0.1);
        assertEquals(400, response.status());
        JsonNode body = body(response);
        assertEquals("r2", body.get("requestId").asText());
        assertEquals("d2", body.get("deviceId").asText());
        assertTrue(body.get("sessionId").isNull());
        assertFalse(body.get("ok").asBoolean());
        assertTrue(body.get("result").isNull());
        assertEquals("NotFound", body.get("error").get("type").asText());
        assertEquals("No user", body.get("error").get("message").asText());
        assertFalse(body.has("duration"));
        assertFalse(body.has("host"));
    }

    @Test
    void version3CarriesRequestIdHeader () throws IOException {
        RpcRequest request = request("{\"version\": 3, \"requestId\": \"r3\", \"name\": \"ping\", \"args\": {}}");
        EncodedResponse response = encoder.encode(request, RpcReply.err(RpcError.fatal("Boom")), 0.5);
        assertEquals(500, response.status());
        assertEquals("r3", response.headers().get(ResponseEncoder.REQUEST_ID_HEADER));
        JsonNode body = body(response);
        assertEquals("Fatal", body.get("error").get("type").asText());
        assertTrue(body.get("result").isNull());
        assertEquals("test-host", body.get("host").asText());
        assertEquals(4, body.size());
    }

    @Test
    void fallbackIsAlwaysServerError () throws IOException {
        EncodedResponse response = encoder.encodeWithoutContext(RpcError.fatal("Couldn't determine client IP"));
        assertEquals(500, response.status());
        JsonNode body = body(response);
        assertEquals(1, body.size());
        assertEquals("Couldn't determine client IP", body.get("error").get("message").asText());
    }

}
