// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/// Options for one gateway instance, read from a properties file. Any key that is absent takes its
/// default, so an empty or missing file gives a working server on port 8000.
/// Unlike a global settings holder this is instantiated, so tests can run servers side by side.
public class Configuration {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    /// System property naming the properties file. Relative paths resolve against the working directory.
    public static final String PATH_PROPERTY = "rpcgate.config";
    public static final String DEFAULT_PATH = "conf/conf.properties";

    public final int httpPort;
    public final String ignoredUrlPrefix;
    public final boolean dynamicCorsOrigin;
    public final boolean enableGzip;
    public final Path astPath;
    public final Path playgroundPath;

    private final Properties properties;

    public Configuration (Properties properties) {
        this.properties = properties;
        httpPort = intVal("http-port", 8000);
        ignoredUrlPrefix = stringVal("ignored-url-prefix", "");
        dynamicCorsOrigin = boolVal("dynamic-cors-origin", true);
        enableGzip = boolVal("enable-gzip", true);
        astPath = Path.of(stringVal("ast-path", "conf/ast.json"));
        playgroundPath = Path.of(stringVal("playground-path", "static/playground"));
    }

    /// Defaults for every key.
    public Configuration () {
        this(new Properties());
    }

    public static Configuration load () {
        return load(Path.of(System.getProperty(PATH_PROPERTY, DEFAULT_PATH)));
    }

    public static Configuration load (Path file) {
        Properties properties = new Properties();
        if (!Files.exists(file)) {
            LOG.warn("Configuration file {} not found, using defaults.", file.toAbsolutePath());
            return new Configuration(properties);
        }
        try (FileReader reader = new FileReader(file.toFile())) {
            properties.load(reader);
        } catch (IOException e) {
            throw new RuntimeException("Could not read configuration file " + file, e);
        }
        return new Configuration(properties);
    }

    private String stringVal (String key, String defaultValue) {
        String val = properties.getProperty(key);
        return val == null ? defaultValue : val.trim();
    }

    private int intVal (String key, int defaultValue) {
        String val = properties.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key);
            throw new RuntimeException(message, e);
        }
    }

    private boolean boolVal (String key, boolean defaultValue) {
        String val = properties.getProperty(key);
        if (val == null) return defaultValue;
        val = val.trim();
        if (val.equalsIgnoreCase("true")) return true;
        if (val.equalsIgnoreCase("yes")) return true;
        if (val.equalsIgnoreCase("false")) return false;
        if (val.equalsIgnoreCase("no")) return false;
        var message = String.format("Boolean value '%s' for configuration key '%s' must be true/false/yes/no.", val, key);
        throw new RuntimeException(message);
    }

}
