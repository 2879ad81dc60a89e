// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate;

import io.pfive.rpcgate.codegen.Target;
import io.pfive.rpcgate.http.handler.AstJsonHandler;
import io.pfive.rpcgate.http.handler.ExceptionHandler;
import io.pfive.rpcgate.http.handler.GatewayHandler;
import io.pfive.rpcgate.http.handler.HeaderPolicy;
import io.pfive.rpcgate.http.handler.PlaygroundHandler;
import io.pfive.rpcgate.http.handler.TargetSourceHandler;
import io.pfive.rpcgate.http.routing.RouteMatcher;
import io.pfive.rpcgate.http.routing.RouteTable;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.gzip.GzipHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;

/// Assembles the Jetty server for one API. The handler chain from the outside in is:
/// gzip compression (optional), the exception handler that turns anything unexpected into a JSON
/// error, then the gateway handler holding the RPC endpoint and its auxiliary routes.
/// All routes are registered here before the server starts and never change afterwards.
public class RpcServer {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final Configuration config;
    private final Server server;
    private final ServerConnector connector;
    private final GatewayHandler gateway;
    private final HeaderPolicy headerPolicy = HeaderPolicy.withCorsDefaults();

    public RpcServer (ApiConfig api, Configuration config) {
        this.config = config;
        server = new Server();
        connector = new ServerConnector(server);
        connector.setPort(config.httpPort);
        server.addConnector(connector);

        RouteTable routes = new RouteTable();
        for (Target target : Target.values()) {
            routes.register(HttpMethod.GET.asString(), RouteMatcher.exact(target.path), new TargetSourceHandler(target, api));
        }
        routes.register(HttpMethod.GET.asString(), RouteMatcher.exact("/ast.json"), new AstJsonHandler(api.schema()));
        if (Files.isDirectory(config.playgroundPath)) {
            routes.register(HttpMethod.GET.asString(), RouteMatcher.pattern("^" + PlaygroundHandler.MOUNT),
                    new PlaygroundHandler(config.playgroundPath));
        } else {
            LOG.info("No playground bundle at {}, playground will not be served.", config.playgroundPath);
        }
        gateway = new GatewayHandler(api, routes, headerPolicy, config.dynamicCorsOrigin, config.ignoredUrlPrefix,
                localHostName());

        // The exception handler sits inside gzip so its error bodies are compressed like any other.
        Handler handler = new ExceptionHandler(gateway);
        if (config.enableGzip) {
            GzipHandler gzipHandler = new GzipHandler();
            gzipHandler.setMinGzipSize(1024);
            gzipHandler.addIncludedMethods("POST");
            gzipHandler.setHandler(handler);
            handler = gzipHandler;
        }
        server.setHandler(handler);
    }

    /// Headers added here appear on every response. Call before listen().
    public RpcServer addHeader (String header, String value) {
        headerPolicy.addHeader(header, value);
        return this;
    }

    /// The gateway handler, for registering additional routes before listen().
    public GatewayHandler gateway () {
        return gateway;
    }

    /// Bind the configured port and start serving. Port 0 binds an ephemeral port, see port().
    public void listen () throws Exception {
        server.start();
        LOG.info("Listening on {}:{}", localHostName(), port());
    }

    public int port () {
        return connector.getLocalPort();
    }

    public void join () throws InterruptedException {
        server.join();
    }

    /// Stop accepting connections and shut down. Safe to call on a server that never started.
    public void close () throws Exception {
        server.stop();
    }

    public static String localHostName () {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            LOG.warn("Could not determine local host name: {}", e.toString());
            return "localhost";
        }
    }

}
