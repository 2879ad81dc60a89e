// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.protocol;

import com.google.common.collect.ImmutableMap;
import io.pfive.rpcgate.http.model.ApiModel.ErrorBody;
import io.pfive.rpcgate.http.model.ApiModel.FallbackResponse;
import io.pfive.rpcgate.http.model.ApiModel.ResponseV1;
import io.pfive.rpcgate.http.model.ApiModel.ResponseV2;
import io.pfive.rpcgate.http.model.ApiModel.ResponseV3;
import org.eclipse.jetty.http.HttpStatus;

/// Builds the response for a reply in the envelope of the request's protocol version. The status
/// code follows the same rule for all versions: 200 on success, 500 for a Fatal error, 400 for any
/// other error type. The reply is expected to have passed through ErrorTaxonomy already.
public class ResponseEncoder {

    public static final String REQUEST_ID_HEADER = "x-request-id";

    private final String host;

    /// @param host the name of this machine, reported in the envelopes that include it.
    public ResponseEncoder (String host) {
        this.host = host;
    }

    public EncodedResponse encode (RpcRequest request, RpcReply reply, double durationSeconds) {
        int status = statusFor(reply);
        ErrorBody error = ErrorBody.fromError(reply.error());
        return switch (request.version()) {
            case V1 -> new EncodedResponse(status, ImmutableMap.of(), new ResponseV1(
                    request.id(),
                    request.deviceInfo().id(),
                    reply.isOk(),
                    reply.result(),
                    error,
                    durationSeconds,
                    host
            ));
            case V2 -> new EncodedResponse(status, ImmutableMap.of(), new ResponseV2(
                    request.id(),
                    request.deviceInfo().id(),
                    request.extra() instanceof RequestExtra.Session session ? session.sessionId() : null,
                    reply.isOk(),
                    reply.result(),
                    error
            ));
            case V3 -> new EncodedResponse(status, ImmutableMap.of(REQUEST_ID_HEADER, request.id()), new ResponseV3(
                    reply.result(),
                    error,
                    durationSeconds,
                    host
            ));
        };
    }

    /// The response for a request that failed before an RpcRequest existed. It has no version
    /// specific shape and is always a server error.
    public EncodedResponse encodeWithoutContext (RpcError error) {
        return new EncodedResponse(HttpStatus.INTERNAL_SERVER_ERROR_500, ImmutableMap.of(),
                new FallbackResponse(ErrorBody.fromError(error)));
    }

    public static int statusFor (RpcReply reply) {
        return reply.isErr() ? reply.error().httpStatus() : HttpStatus.OK_200;
    }

}
