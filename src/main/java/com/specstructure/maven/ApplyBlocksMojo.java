package com.specstructure.maven;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import com.specstructure.maven.blocks.ConflictException;
import com.specstructure.maven.blocks.ConflictPolicy;
import com.specstructure.maven.blocks.MethodBlockPatcher;
import com.specstructure.maven.blocks.PatchMode;
import com.specstructure.maven.blocks.PatchReport;
import com.specstructure.maven.blocks.PatchResult;
import com.specstructure.maven.blocks.SpecLines;
import com.specstructure.maven.config.StructureConfig;

/**
 * Merges generated method blocks into an existing spec file.
 * <p>
 * A conflict under {@code onConflict=error} fails the build without touching the target;
 * every other problem is reported as an execution error.
 */
@Mojo(name = "apply-blocks", requiresProject = false)
public class ApplyBlocksMojo extends AbstractSpecStructureMojo {

    @Parameter(property = "specstructure.target", required = true)
    private File target;

    @Parameter(property = "specstructure.fragment", required = true)
    private File fragment;

    /**
     * insert, replace or upsert. Falls back to the project config, then upsert.
     */
    @Parameter(property = "specstructure.mode")
    private String mode;

    /**
     * error, overwrite or skip. Falls back to the project config, then error.
     */
    @Parameter(property = "specstructure.onConflict")
    private String onConflict;

    @Parameter(property = "specstructure.only")
    private String only;

    @Parameter(property = "specstructure.reportFormat")
    private String reportFormat;

    /**
     * Log the patched spec instead of writing it.
     */
    @Parameter(property = "specstructure.dryRun", defaultValue = "false")
    private boolean dryRun;

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        StructureConfig config = loadConfig();
        Path targetPath = resolve(target);
        Path fragmentPath = resolve(fragment);

        try {
            PatchMode patchMode = PatchMode.fromString(StructureConfig.pick(mode, config.getMode(), "upsert"));
            ConflictPolicy policy = ConflictPolicy.fromString(
                    StructureConfig.pick(onConflict, config.getOnConflict(), "error"));
            PatchReport.Format format = PatchReport.Format.fromString(
                    StructureConfig.pick(reportFormat, config.getReportFormat(), "text"));
            List<String> onlyMethodIds = splitList(only);

            if (!Files.isRegularFile(targetPath)) {
                throw new MojoExecutionException("Target spec not found: " + targetPath);
            }
            if (!Files.isRegularFile(fragmentPath)) {
                throw new MojoExecutionException("Blocks file not found: " + fragmentPath);
            }

            getLog().info("SpecStructure: Applying " + fragmentPath + " to " + targetPath + " (mode="
                    + patchMode.label() + ", conflict=" + policy.label() + ")");

            PatchResult result = new MethodBlockPatcher(patchMode, policy)
                    .apply(SpecLines.read(targetPath), SpecLines.read(fragmentPath), onlyMethodIds);

            if (dryRun) {
                getLog().info(System.lineSeparator() + SpecLines.join(result.getLines()));
            } else if (result.isModified()) {
                SpecLines.write(targetPath, result.getLines());
            }

            String report = PatchReport.of(result)
                    .with("spec_path", targetPath.toString())
                    .with("blocks_path", fragmentPath.toString())
                    .with("dry_run", dryRun)
                    .render(format);
            getLog().info(report);
        } catch (ConflictException e) {
            getLog().error("SpecStructure: " + e.getMessage());
            throw new MojoFailureException(e.getMessage(), e);
        } catch (SpecStructureException e) {
            throw new MojoExecutionException(e.getMessage(), e);
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to apply blocks to " + targetPath, e);
        }
    }
}
