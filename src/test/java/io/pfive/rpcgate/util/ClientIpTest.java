// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.util;

import org.eclipse.jetty.http.HttpFields;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClientIpTest {

    @Test
    void firstEntryOfForwardingChainIsTheClient () {
        assertEquals("203.0.113.7", ClientIp.firstAddress("x-forwarded-for", "203.0.113.7, 10.0.0.1, 10.0.0.2"));
    }

    @Test
    void ipv4PortIsRemoved () {
        assertEquals("203.0.113.7", ClientIp.firstAddress("x-real-ip", "203.0.113.7:51000"));
    }

    @Test
    void ipv6AddressIsKeptWhole () {
        assertEquals("2001:db8::1", ClientIp.firstAddress("x-client-ip", "2001:db8::1"));
        assertEquals("2001:db8::1", ClientIp.firstAddress("x-client-ip", "[2001:db8::1]:443"));
    }

    @Test
    void forwardedHeaderUsesForDirective () {
        assertEquals("192.0.2.60", ClientIp.firstAddress("forwarded", "proto=http;for=192.0.2.60;by=203.0.113.43"));
        assertEquals("2001:db8:cafe::17", ClientIp.firstAddress("forwarded", "for=\"[2001:db8:cafe::17]:4711\""));
    }

    @Test
    void headersAreCheckedInOrder () {
        HttpFields headers = HttpFields.build()
                .put("X-Real-IP", "198.51.100.2")
                .put("CF-Connecting-IP", "198.51.100.1")
                .asImmutable();
        assertEquals("198.51.100.1", ClientIp.fromHeaders(headers).get());
    }

    @Test
    void noHeadersIsAnError () {
        assertTrue(ClientIp.fromHeaders(HttpFields.EMPTY).isErr());
        HttpFields blank = HttpFields.build().put("X-Forwarded-For", " ").asImmutable();
        assertTrue(ClientIp.fromHeaders(blank).isErr());
    }

}
