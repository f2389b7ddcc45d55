package com.biospec.server.util;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class ConfigSourceResolver {

    public static final String CONFIG_FILE_PROPERTY = "biospec.config.file";
    public static final String DEFAULT_RESOURCE = "/pipeline_config.json";

    /**
     * Describes where the pipeline configuration is read from, for logging.
     */
    public static String describeConfigSource() {
        String sysProp = System.getProperty(CONFIG_FILE_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return "file:" + sysProp;
        }
        return "classpath:" + DEFAULT_RESOURCE;
    }

    /**
     * Opens the pipeline configuration.
     * 1. File named by the {@code biospec.config.file} system property
     * 2. {@code /pipeline_config.json} on the classpath
     */
    public static InputStream openConfig() throws IOException {
        String sysProp = System.getProperty(CONFIG_FILE_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            Path path = Paths.get(sysProp);
            if (!Files.isRegularFile(path)) {
                throw new FileNotFoundException("Config file not found: " + path.toAbsolutePath());
            }
            return new FileInputStream(path.toFile());
        }

        InputStream is = ConfigSourceResolver.class.getResourceAsStream(DEFAULT_RESOURCE);
        if (is == null) {
            throw new FileNotFoundException(DEFAULT_RESOURCE + " not found on classpath");
        }
        return is;
    }
}
