// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import io.pfive.rpcgate.protocol.RpcRequest;

/// The code behind one call of the API. The arguments have already been checked against the
/// declared argument type, and the returned value will be checked against the declared return
/// type. Throw an ApiException to report one of the call's declared error types.
@FunctionalInterface
public interface CallImplementation {
    Object call (RpcRequest request, JsonNode args) throws Exception;
}
