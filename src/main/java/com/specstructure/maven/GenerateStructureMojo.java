package com.specstructure.maven;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import com.specstructure.maven.config.StructureConfig;
import com.specstructure.maven.metadata.MetadataLoader;
import com.specstructure.maven.metadata.StructureMetadata;
import com.specstructure.maven.structure.StructureMode;
import com.specstructure.maven.structure.StructureRenderer;

/**
 * Renders the RSpec skeleton for a metadata document, as a full spec file or as bare
 * method blocks for {@code apply-blocks}.
 */
@Mojo(name = "generate-structure", requiresProject = false)
public class GenerateStructureMojo extends AbstractSpecStructureMojo {

    @Parameter(property = "specstructure.metadata", required = true)
    private File metadata;

    @Parameter(property = "specstructure.structureMode", defaultValue = "fragment")
    private String structureMode;

    /**
     * Where to write the rendered text. Logged when not set.
     */
    @Parameter(property = "specstructure.output")
    private File output;

    @Override
    public void execute() throws MojoExecutionException {
        StructureConfig config = loadConfig();

        try {
            StructureMode mode = StructureMode.fromString(structureMode);
            StructureMetadata document = MetadataLoader.load(resolve(metadata));
            getLog().info("SpecStructure: Rendering " + mode.label() + " structure for " + document.getClassName());

            StructureRenderer.Rendering rendering = new StructureRenderer(resolveHelper(config),
                    createTemplateEngine(config)).render(document, mode);
            for (String warning : rendering.getWarnings()) {
                getLog().warn("SpecStructure: " + warning);
            }

            if (output == null) {
                getLog().info(System.lineSeparator() + rendering.getText());
                return;
            }

            Path outputPath = resolve(output);
            if (outputPath.getParent() != null) {
                Files.createDirectories(outputPath.getParent());
            }
            String text = rendering.getText();
            Files.writeString(outputPath, text.endsWith("\n") ? text : text + "\n", StandardCharsets.UTF_8);
            getLog().info("SpecStructure: Wrote " + outputPath);
        } catch (SpecStructureException e) {
            throw new MojoExecutionException(e.getMessage(), e);
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to generate spec structure", e);
        }
    }
}
