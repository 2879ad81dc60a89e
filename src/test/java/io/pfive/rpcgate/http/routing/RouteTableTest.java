// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.http.routing;

import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RouteTableTest {

    private static Handler stub () {
        return new Handler.Abstract() {
            @Override
            public boolean handle (Request request, Response response, Callback callback) {
                return false;
            }
        };
    }

    @Test
    void exactMatchBeatsPattern () {
        RouteTable routes = new RouteTable();
        Handler pattern = stub();
        Handler exact = stub();
        routes.register("GET", RouteMatcher.pattern("^/ast"), pattern);
        routes.register("GET", RouteMatcher.exact("/ast.json"), exact);
        assertSame(exact, routes.resolve("GET", "/ast.json").get().handler());
        assertSame(pattern, routes.resolve("GET", "/ast.yaml").get().handler());
    }

    @Test
    void longestPatternMatchWins () {
        RouteTable routes = new RouteTable();
        Handler broad = stub();
        Handler specific = stub();
        routes.register("GET", RouteMatcher.pattern("^/play"), broad);
        routes.register("GET", RouteMatcher.pattern("^/playground/assets"), specific);
        assertSame(specific, routes.resolve("GET", "/playground/assets/app.js").get().handler());
        assertSame(broad, routes.resolve("GET", "/playground/index.html").get().handler());
    }

    @Test
    void tiesGoToFirstRegistered () {
        RouteTable routes = new RouteTable();
        Handler first = stub();
        Handler second = stub();
        routes.register("GET", RouteMatcher.pattern("^/docs"), first);
        routes.register("GET", RouteMatcher.pattern("^/doc."), second);
        assertSame(first, routes.resolve("GET", "/docs/x").get().handler());
    }

    @Test
    void methodMustMatch () {
        RouteTable routes = new RouteTable();
        routes.register("GET", RouteMatcher.exact("/ast.json"), stub());
        var result = routes.resolve("POST", "/ast.json");
        assertTrue(result.isErr());
        assertEquals("No route for POST /ast.json", result.errorMessage());
    }

    @Test
    void patternIsAnchoredAtStart () {
        assertEquals(-1, RouteMatcher.pattern("/playground").matchLength("/x/playground"));
        assertEquals(11, RouteMatcher.pattern("/playground").matchLength("/playground/index.html"));
    }

}
