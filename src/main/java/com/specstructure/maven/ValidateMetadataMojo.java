package com.specstructure.maven;

import java.io.File;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import com.specstructure.maven.metadata.MetadataException;
import com.specstructure.maven.metadata.MetadataLoader;
import com.specstructure.maven.metadata.MetadataValidator;
import com.specstructure.maven.metadata.StructureMetadata;

/**
 * Checks a metadata document before it is rendered.
 */
@Mojo(name = "validate-metadata", requiresProject = false)
public class ValidateMetadataMojo extends AbstractSpecStructureMojo {

    @Parameter(property = "specstructure.metadata", required = true)
    private File metadata;

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        StructureMetadata document;
        try {
            document = MetadataLoader.load(resolve(metadata));
        } catch (MetadataException e) {
            throw new MojoExecutionException(e.getMessage(), e);
        }

        MetadataValidator.Result result = new MetadataValidator().validate(document);
        for (String warning : result.getWarnings()) {
            getLog().warn("SpecStructure: " + warning);
        }
        for (String error : result.getErrors()) {
            getLog().error("SpecStructure: " + error);
        }

        if (!result.isValid()) {
            throw new MojoFailureException("Metadata validation failed with " + result.getErrors().size()
                    + " error(s): " + metadata);
        }
        getLog().info("SpecStructure: " + metadata + " is valid");
    }
}
