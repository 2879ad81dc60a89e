// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.BufferUtil;
import org.eclipse.jetty.util.Callback;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/// Static utility methods for writing responses from Jetty handlers. Every method here writes the
/// complete response and completes the callback, so a handler can simply return its result.
public abstract class JettyUtil {

    // Object mapper with a module to handle Guava collection types like ImmutableMap. Threadsafe.
    public static final ObjectMapper objectMapper = new ObjectMapper().registerModule(new GuavaModule());

    public static final String MIME_TYPE_JSON_UTF8 = "application/json; charset=utf-8";
    public static final String MIME_TYPE_JSON = "application/json";
    public static final String MIME_TYPE_OCTET_STREAM = "application/octet-stream";

    public static boolean respond (int code, String message, Response response, Callback callback) {
        response.setStatus(code);
        response.write(true, wrapString(message), callback);
        return true;
    }

    /// Respond with a status code and no body at all, leaving headers as they are.
    public static boolean respondEmpty (int code, Response response, Callback callback) {
        response.setStatus(code);
        response.write(true, BufferUtil.EMPTY_BUFFER, callback);
        return true;
    }

    /// Respond with an object serialized as JSON and the given status code. Any Content-Type
    /// already set on the response is replaced.
    public static boolean respondJson (int code, Object object, Response response, Callback callback) {
        return respondBytes(code, MIME_TYPE_JSON_UTF8, jsonBytes(object), response, callback);
    }

    public static boolean respondBytes (int code, String contentType, byte[] bytes, Response response, Callback callback) {
        response.setStatus(code);
        response.getHeaders().put(HttpHeader.CONTENT_TYPE, contentType);
        response.write(true, ByteBuffer.wrap(bytes), callback);
        return true;
    }

    /// Convert a String to a UTF-8 ByteBuffer, typically for writing to an HTTP response body.
    public static ByteBuffer wrapString (String string) {
        return ByteBuffer.wrap(string.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] jsonBytes (Object object) {
        try {
            return objectMapper.writeValueAsBytes(object);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Could not convert object to JSON.", e);
        }
    }

}
