// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.http.handler;

import io.pfive.rpcgate.util.JettyUtil;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.http.HttpURI;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.server.handler.ResourceHandler;
import org.eclipse.jetty.util.Callback;
import org.eclipse.jetty.util.resource.ResourceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.List;

/// Serves the static bundle of the developer playground UI mounted under /playground. The mount
/// point itself maps to index.html and everything below it maps to the same relative path in the
/// bundle directory. Files are served read-only by Jetty's ResourceHandler, with ETags and without
/// directory listings.
public class PlaygroundHandler extends Handler.Wrapper {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());
    public static final String MOUNT = "/playground";

    public PlaygroundHandler (Path bundleDirectory) {
        ResourceHandler resourceHandler = new ResourceHandler();
        resourceHandler.setBaseResource(ResourceFactory.of(resourceHandler).newResource(bundleDirectory));
        resourceHandler.setDirAllowed(false);
        resourceHandler.setEtags(true);
        resourceHandler.setWelcomeFiles(List.of("index.html"));
        setHandler(resourceHandler);
    }

    @Override
    public boolean handle (Request request, Response response, Callback callback) throws Exception {
        String path = Request.getPathInContext(request);
        String bundlePath = bundlePath(path);
        Request rewritten = new Request.Wrapper(request) {
            @Override
            public HttpURI getHttpURI () {
                return HttpURI.build(super.getHttpURI()).path(bundlePath).asImmutable();
            }
        };
        try {
            if (super.handle(rewritten, response, callback)) {
                return true;
            }
            return JettyUtil.respond(HttpStatus.NOT_FOUND_404, "Not found: " + path, response, callback);
        } catch (Exception e) {
            LOG.error("Failed to serve playground file {}", path, e);
            return JettyUtil.respond(HttpStatus.INTERNAL_SERVER_ERROR_500, e.toString(), response, callback);
        }
    }

    /// Translate a request path to a path within the bundle directory.
    public static String bundlePath (String requestPath) {
        if (requestPath.endsWith(MOUNT)) {
            return requestPath.replaceFirst(MOUNT, "/index.html");
        }
        String stripped = requestPath.replaceFirst(MOUNT, "");
        return stripped.startsWith("/") ? stripped : "/" + stripped;
    }

}
