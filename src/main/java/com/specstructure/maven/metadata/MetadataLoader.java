package com.specstructure.maven.metadata;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads analysis metadata from YAML.
 */
public class MetadataLoader {

    /**
     * Loads metadata from a YAML file.
     *
     * @throws MetadataException if the file is missing, is not valid YAML, or lacks {@code class_name}
     */
    public static StructureMetadata load(Path metadataPath) throws MetadataException {
        if (!Files.isRegularFile(metadataPath)) {
            throw new MetadataException("Metadata file not found: " + metadataPath);
        }
        try (InputStream inputStream = Files.newInputStream(metadataPath)) {
            return parse(new Yaml().load(inputStream), metadataPath.toString());
        } catch (IOException e) {
            throw new MetadataException("Cannot read metadata file: " + metadataPath, e);
        } catch (YAMLException e) {
            throw new MetadataException("Cannot parse metadata YAML " + metadataPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads metadata from YAML text.
     */
    public static StructureMetadata loadFromString(String yamlText) throws MetadataException {
        try (Reader reader = new StringReader(yamlText)) {
            return parse(new Yaml().load(reader), "(inline)");
        } catch (IOException e) {
            throw new MetadataException("Cannot read metadata", e);
        } catch (YAMLException e) {
            throw new MetadataException("Cannot parse metadata YAML: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static StructureMetadata parse(Object data, String label) throws MetadataException {
        if (!(data instanceof Map)) {
            throw new MetadataException("Metadata must be a mapping: " + label);
        }
        StructureMetadata metadata = StructureMetadata.fromMap((Map<String, Object>) data);
        if (metadata.getClassName() == null || metadata.getClassName().isBlank()) {
            throw new MetadataException("Missing class_name in metadata: " + label);
        }
        return metadata;
    }

    private MetadataLoader() {
    }
}
