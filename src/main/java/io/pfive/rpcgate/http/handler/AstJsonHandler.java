// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.http.handler;

import io.pfive.rpcgate.schema.ApiSchema;
import io.pfive.rpcgate.util.JettyUtil;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;

/// Serves the compiled interface description as a JSON document, for tooling and the playground.
public class AstJsonHandler extends Handler.Abstract {

    private final ApiSchema schema;

    public AstJsonHandler (ApiSchema schema) {
        this.schema = schema;
    }

    @Override
    public boolean handle (Request request, Response response, Callback callback) throws Exception {
        byte[] bytes = JettyUtil.jsonBytes(schema.fullDescription());
        return JettyUtil.respondBytes(HttpStatus.OK_200, JettyUtil.MIME_TYPE_JSON, bytes, response, callback);
    }

}
