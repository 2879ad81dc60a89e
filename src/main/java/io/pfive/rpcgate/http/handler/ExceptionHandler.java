// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.http.handler;

import io.pfive.rpcgate.http.model.ApiModel.ErrorBody;
import io.pfive.rpcgate.http.model.ApiModel.FallbackResponse;
import io.pfive.rpcgate.protocol.RpcError;
import io.pfive.rpcgate.util.JettyUtil;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.invoke.MethodHandles;

/// This handler wraps the gateway to catch any exceptions that escape it. Failures inside a call
/// are already turned into replies by the dispatcher, so anything reaching this point is
/// unexpected: the whole stack trace is logged and the client receives the fallback error envelope
/// with a 500 status instead of a bare connection failure or an HTML error page.
public class ExceptionHandler extends Handler.Wrapper {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public ExceptionHandler (Handler handler) {
        super(handler);
    }

    @Override
    public boolean handle (Request request, Response response, Callback callback) throws Exception {
        try {
            return super.handle(request, response, callback);
        } catch (Throwable t) {
            condenseAndLog(t);
            if (response.isCommitted()) {
                // Part of a response has already gone out, the connection can only be abandoned.
                callback.failed(t);
                return true;
            }
            ErrorBody error = ErrorBody.fromError(RpcError.fromThrowable(t));
            return JettyUtil.respondJson(HttpStatus.INTERNAL_SERVER_ERROR_500, new FallbackResponse(error), response, callback);
        }
    }

    public static String condenseAndLog (Throwable throwable) {
        StringWriter stringWriter = new StringWriter();
        PrintWriter printWriter = new PrintWriter(stringWriter);
        throwable.printStackTrace(printWriter);
        String trace = stringWriter.toString();
        LOG.info("Reporting error in HTTP response: \n" + trace);
        return RpcError.briefThrowableMessage(throwable);
    }

}
