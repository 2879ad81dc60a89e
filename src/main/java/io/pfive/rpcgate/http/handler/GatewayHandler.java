// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.http.handler;

import io.pfive.rpcgate.ApiConfig;
import io.pfive.rpcgate.dispatch.CallDispatcher;
import io.pfive.rpcgate.dispatch.ErrorTaxonomy;
import io.pfive.rpcgate.exception.RequestParseException;
import io.pfive.rpcgate.http.model.ApiModel.HealthResponse;
import io.pfive.rpcgate.http.routing.RouteMatcher;
import io.pfive.rpcgate.http.routing.RouteTable;
import io.pfive.rpcgate.protocol.EncodedResponse;
import io.pfive.rpcgate.protocol.RequestNormalizer;
import io.pfive.rpcgate.protocol.ResponseEncoder;
import io.pfive.rpcgate.protocol.RpcError;
import io.pfive.rpcgate.protocol.RpcReply;
import io.pfive.rpcgate.protocol.RpcRequest;
import io.pfive.rpcgate.util.ClientIp;
import io.pfive.rpcgate.util.JettyUtil;
import io.pfive.rpcgate.util.NanoTimer;
import io.pfive.rpcgate.util.Ret;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.http.HttpURI;
import org.eclipse.jetty.io.Content;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// The request pipeline of the gateway. Every request passes through here in this order:
/// 1. Cross-origin headers are applied. An OPTIONS preflight is answered at once with 200.
/// 2. The configured URL prefix is stripped, and a matching route (generated sources, the
///    interface description, the playground) takes over the whole response.
/// 3. Anything else is the RPC endpoint: HEAD answers 200, GET runs the health check, methods
///    other than POST are rejected with 400.
/// 4. A POST body is read in full, normalized into an RpcRequest, dispatched, checked against the
///    call's declared errors, encoded for the request's protocol version and logged.
///
/// Each request is handled on its own Jetty thread and all per-call state is local to handle(),
/// so concurrent calls never see each other's requests or replies. The route table and header
/// policy are only modified while the server is being assembled.
///
/// Route handlers are children of this handler so Jetty starts, stops and attaches them to the
/// server along with it.
public class GatewayHandler extends Handler.AbstractContainer {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());
    private static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";

    private final ApiConfig api;
    private final RouteTable routes;
    private final HeaderPolicy headerPolicy;
    private final boolean dynamicCorsOrigin;
    private final String ignoredUrlPrefix;
    private final RequestNormalizer normalizer;
    private final CallDispatcher dispatcher;
    private final ErrorTaxonomy taxonomy;
    private final ResponseEncoder encoder;

    public GatewayHandler (
            ApiConfig api,
            RouteTable routes,
            HeaderPolicy headerPolicy,
            boolean dynamicCorsOrigin,
            String ignoredUrlPrefix,
            String host
    ) {
        this.api = api;
        this.routes = routes;
        this.headerPolicy = headerPolicy;
        this.dynamicCorsOrigin = dynamicCorsOrigin;
        this.ignoredUrlPrefix = ignoredUrlPrefix == null ? "" : ignoredUrlPrefix;
        this.normalizer = new RequestNormalizer(api.codec());
        this.dispatcher = new CallDispatcher(api);
        this.taxonomy = new ErrorTaxonomy(api.schema());
        this.encoder = new ResponseEncoder(host);
        for (RouteTable.Entry entry : routes.entries()) {
            addBean(entry.handler());
        }
    }

    /// Register a handler for a non-RPC path. Call this only before the server starts.
    public void addHttpHandler (String method, RouteMatcher matcher, Handler handler) {
        routes.register(method, matcher, handler);
        addBean(handler);
        if (getServer() != null) {
            handler.setServer(getServer());
        }
    }

    @Override
    public List<Handler> getHandlers () {
        List<Handler> handlers = new ArrayList<>();
        for (RouteTable.Entry entry : routes.entries()) {
            handlers.add(entry.handler());
        }
        return handlers;
    }

    @Override
    public void setServer (Server server) {
        super.setServer(server);
        for (Handler handler : getHandlers()) {
            handler.setServer(server);
        }
    }

    @Override
    public boolean handle (Request request, Response response, Callback callback) throws Exception {
        NanoTimer timer = new NanoTimer();
        String method = request.getMethod();
        boolean preflight = HttpMethod.OPTIONS.is(method);
        applyHeaders(request, response.getHeaders(), preflight);
        if (preflight) {
            return JettyUtil.respondEmpty(HttpStatus.OK_200, response, callback);
        }

        String path = Request.getPathInContext(request);
        boolean stripped = !ignoredUrlPrefix.isEmpty() && path.startsWith(ignoredUrlPrefix);
        if (stripped) {
            path = path.substring(ignoredUrlPrefix.length());
        }
        Ret<RouteTable.Entry> route = routes.resolve(method, path);
        if (route.isOk()) {
            LOG.info("HTTP {} {}", method, path);
            Request routed = stripped ? withPath(request, path) : request;
            return route.get().handler().handle(routed, response, callback);
        }

        response.getHeaders().put(HttpHeader.CONTENT_TYPE, JettyUtil.MIME_TYPE_JSON_UTF8);
        if (HttpMethod.HEAD.is(method)) {
            return JettyUtil.respondEmpty(HttpStatus.OK_200, response, callback);
        }
        if (HttpMethod.GET.is(method)) {
            return respondHealth(response, callback);
        }
        if (!HttpMethod.POST.is(method)) {
            return JettyUtil.respondEmpty(HttpStatus.BAD_REQUEST_400, response, callback);
        }

        final String body;
        try {
            body = Content.Source.asString(request, StandardCharsets.UTF_8);
        } catch (IOException e) {
            // The connection broke while the body was arriving. There is no one left to answer.
            LOG.warn("Failed to read request body: {}", e.toString());
            callback.failed(e);
            return true;
        }
        return respondRpc(request, body, timer, response, callback);
    }

    /// Route handlers see the path with the ignored prefix already removed.
    private static Request withPath (Request request, String path) {
        return new Request.Wrapper(request) {
            @Override
            public HttpURI getHttpURI () {
                return HttpURI.build(super.getHttpURI()).path(path).asImmutable();
            }
        };
    }

    private void applyHeaders (Request request, HttpFields.Mutable responseHeaders, boolean preflight) {
        String origin = request.getHeaders().get(HttpHeader.ORIGIN);
        if (dynamicCorsOrigin && origin != null && !origin.isEmpty()) {
            responseHeaders.put(ALLOW_ORIGIN, origin);
            responseHeaders.put(HttpHeader.VARY, "Origin");
        }
        headerPolicy.applyTo(responseHeaders, preflight);
    }

    private boolean respondHealth (Response response, Callback callback) {
        boolean ok;
        try {
            ok = api.hooks().onHealthCheck();
        } catch (Exception e) {
            LOG.warn("Health check failed: {}", e.toString());
            ok = false;
        }
        int status = ok ? HttpStatus.OK_200 : HttpStatus.INTERNAL_SERVER_ERROR_500;
        return JettyUtil.respondJson(status, new HealthResponse(ok), response, callback);
    }

    private boolean respondRpc (Request request, String body, NanoTimer timer, Response response, Callback callback) {
        Ret<String> clientIp = ClientIp.fromRequest(request);
        if (clientIp.isErr()) {
            LOG.warn("Rejected request: {}", clientIp.errorMessage());
            return write(encoder.encodeWithoutContext(RpcError.fatal(clientIp.errorMessage())), response, callback);
        }
        final RpcRequest rpcRequest;
        try {
            rpcRequest = normalizer.normalize(body, clientIp.get(), request.getHeaders());
        } catch (RequestParseException e) {
            LOG.warn("Rejected request from {}: {}", clientIp.get(), e.getMessage());
            return write(encoder.encodeWithoutContext(RpcError.fromThrowable(e)), response, callback);
        }
        RpcReply reply = taxonomy.enforce(rpcRequest.name(), dispatcher.dispatch(rpcRequest));
        double duration = timer.getElapsedSeconds();
        EncodedResponse encoded = encoder.encode(rpcRequest, reply, duration);
        LOG.info("{} [{}s] {}() -> {}", rpcRequest.id(), NanoTimer.formatSeconds(duration), rpcRequest.name(),
                reply.isOk() ? "OK" : reply.error().type());
        return write(encoded, response, callback);
    }

    private static boolean write (EncodedResponse encoded, Response response, Callback callback) {
        for (Map.Entry<String, String> header : encoded.headers().entrySet()) {
            response.getHeaders().put(header.getKey(), header.getValue());
        }
        return JettyUtil.respondBytes(encoded.status(), JettyUtil.MIME_TYPE_JSON_UTF8, encoded.bodyBytes(), response, callback);
    }

}
