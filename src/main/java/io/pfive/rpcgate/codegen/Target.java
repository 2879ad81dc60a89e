// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.codegen;

/// Platforms for which generated stub source can be downloaded, with the path serving each one.
public enum Target {
    NODE_SERVER("/targets/node/api.ts"),
    NODE_CLIENT("/targets/node/client.ts"),
    WEB_CLIENT("/targets/web/client.ts"),
    FLUTTER_CLIENT("/targets/flutter/client.dart");

    public final String path;

    Target (String path) {
        this.path = path;
    }
}
