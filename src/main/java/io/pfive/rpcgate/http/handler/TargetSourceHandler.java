// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.http.handler;

import io.pfive.rpcgate.ApiConfig;
import io.pfive.rpcgate.codegen.Target;
import io.pfive.rpcgate.codegen.TargetGenerator;
import io.pfive.rpcgate.util.JettyUtil;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;

/// Serves the generated stub source for one target platform as a download. Source is generated on
/// every request. If generation fails, or no generator was registered for the target, the response
/// is a 500 with the error text as its body.
public class TargetSourceHandler extends Handler.Abstract {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final Target target;
    private final ApiConfig api;

    public TargetSourceHandler (Target target, ApiConfig api) {
        this.target = target;
        this.api = api;
    }

    @Override
    public boolean handle (Request request, Response response, Callback callback) throws Exception {
        response.getHeaders().put(HttpHeader.CONTENT_TYPE, JettyUtil.MIME_TYPE_OCTET_STREAM);
        try {
            TargetGenerator generator = api.generator(target);
            if (generator == null) {
                throw new IllegalStateException("No generator registered for " + target.path);
            }
            byte[] source = generator.generate(api.schema()).getBytes(StandardCharsets.UTF_8);
            return JettyUtil.respondBytes(HttpStatus.OK_200, JettyUtil.MIME_TYPE_OCTET_STREAM, source, response, callback);
        } catch (Exception e) {
            LOG.error("Failed to generate source for {}", target.path, e);
            return JettyUtil.respond(HttpStatus.INTERNAL_SERVER_ERROR_500, e.toString(), response, callback);
        }
    }

}
