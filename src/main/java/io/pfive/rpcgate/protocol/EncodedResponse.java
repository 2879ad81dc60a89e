// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.protocol;

import com.google.common.collect.ImmutableMap;
import io.pfive.rpcgate.util.JettyUtil;

/// A response ready to be written: status code, headers specific to this response, and the
/// envelope object that becomes the JSON body.
public record EncodedResponse (int status, ImmutableMap<String, String> headers, Object envelope) {

    public byte[] bodyBytes () {
        return JettyUtil.jsonBytes(envelope);
    }

}
