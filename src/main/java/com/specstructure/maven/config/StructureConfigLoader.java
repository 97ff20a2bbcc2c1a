package com.specstructure.maven.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.apache.maven.plugin.logging.Log;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@link StructureConfig} from the project, falling back to the bundled defaults.
 */
public class StructureConfigLoader {

    public static final String PROJECT_CONFIG = ".specstructure/config.yaml";
    static final String DEFAULT_RESOURCE = "/specstructure/default-config.yaml";

    private static final Yaml yaml = new Yaml();

    /**
     * Loads the project config under {@code baseDir}, or the classpath defaults if the
     * project has none.
     */
    public static StructureConfig load(Path baseDir, Log log) throws IOException {
        if (baseDir != null) {
            Path configPath = baseDir.resolve(PROJECT_CONFIG);
            if (Files.exists(configPath)) {
                log.debug("Using project config: " + configPath);
                return load(configPath);
            }
        }
        log.debug("Using default config: " + DEFAULT_RESOURCE);
        return loadFromResource(DEFAULT_RESOURCE);
    }

    /**
     * Loads configuration from a YAML file.
     */
    public static StructureConfig load(Path configPath) throws IOException {
        try (InputStream inputStream = Files.newInputStream(configPath)) {
            return parse(inputStream, configPath.toString());
        }
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static StructureConfig loadFromResource(String resourcePath) throws IOException {
        try (InputStream inputStream = StructureConfigLoader.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return parse(inputStream, resourcePath);
        }
    }

    @SuppressWarnings("unchecked")
    private static StructureConfig parse(InputStream inputStream, String label) throws IOException {
        Object data;
        try {
            data = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new IOException("Cannot parse " + label + ": " + e.getMessage(), e);
        }
        if (data == null) {
            return new StructureConfig();
        }
        if (!(data instanceof Map)) {
            throw new IOException("Config " + label + " must be a mapping");
        }
        return StructureConfig.fromMap((Map<String, Object>) data);
    }
}
