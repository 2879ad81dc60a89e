// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate;

import io.pfive.rpcgate.schema.AstJsonSchema;
import io.pfive.rpcgate.schema.JsonTypeCodec;
import io.pfive.rpcgate.util.JettyUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.FileSystems;
import java.nio.file.Path;

/// Starts a gateway for the interface description named in the configuration. No calls are
/// implemented, so every call answers with a Fatal error. This is useful for checking that an
/// interface description loads, and for serving the playground and generated sources. Applications
/// embed RpcServer with their own ApiConfig instead.
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static void main (String[] args) throws Exception {
        // Debugging configuration and deployment can be easier when we know the current directory.
        Path currentDir = FileSystems.getDefault().getPath("").toAbsolutePath();
        LOG.info("Current working directory is: {}", currentDir.toString());

        Configuration config = Configuration.load();
        AstJsonSchema schema = AstJsonSchema.fromFile(config.astPath);
        ApiConfig api = new ApiConfig(schema, new JsonTypeCodec(JettyUtil.objectMapper));
        RpcServer server = new RpcServer(api, config);
        server.listen();
        server.join();
    }

}
