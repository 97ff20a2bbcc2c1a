package com.specstructure.maven;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import com.specstructure.maven.blocks.MarkerStripper;
import com.specstructure.maven.blocks.SpecLines;

/**
 * Removes the {@code rspec-testing:} marker comments from a finished spec.
 */
@Mojo(name = "strip-markers", requiresProject = false)
public class StripMarkersMojo extends AbstractSpecStructureMojo {

    @Parameter(property = "specstructure.target", required = true)
    private File target;

    @Override
    public void execute() throws MojoExecutionException {
        Path targetPath = resolve(target);
        if (!Files.isRegularFile(targetPath)) {
            throw new MojoExecutionException("Target spec not found: " + targetPath);
        }

        try {
            List<String> lines = SpecLines.read(targetPath);
            List<String> stripped = MarkerStripper.strip(lines);
            int removed = lines.size() - stripped.size();
            if (removed == 0) {
                getLog().info("SpecStructure: No markers in " + targetPath);
                return;
            }
            SpecLines.write(targetPath, stripped);
            getLog().info("SpecStructure: Removed " + removed + " marker line(s) from " + targetPath);
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to strip markers from " + targetPath, e);
        }
    }
}
