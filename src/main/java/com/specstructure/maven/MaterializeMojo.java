package com.specstructure.maven;

import java.io.File;
import java.io.IOException;
import java.util.Map;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import com.specstructure.maven.blocks.ConflictException;
import com.specstructure.maven.blocks.ConflictPolicy;
import com.specstructure.maven.blocks.PatchReport;
import com.specstructure.maven.blocks.SpecLines;
import com.specstructure.maven.config.StructureConfig;
import com.specstructure.maven.materialize.MaterializeResult;
import com.specstructure.maven.materialize.SpecMaterializer;
import com.specstructure.maven.metadata.MetadataLoader;
import com.specstructure.maven.metadata.StructureMetadata;

/**
 * Creates or updates the spec file for a metadata document in one step.
 */
@Mojo(name = "materialize", requiresProject = false)
public class MaterializeMojo extends AbstractSpecStructureMojo {

    @Parameter(property = "specstructure.metadata", required = true)
    private File metadata;

    /**
     * Target spec. Defaults to the document's {@code spec_path}.
     */
    @Parameter(property = "specstructure.spec")
    private File spec;

    @Parameter(property = "specstructure.onNewConflict", defaultValue = "error")
    private String onNewConflict;

    /**
     * Comma separated {@code METHOD_ID=ACTION} overrides for new methods.
     */
    @Parameter(property = "specstructure.newConflicts")
    private String newConflicts;

    @Parameter(property = "specstructure.only")
    private String only;

    @Parameter(property = "specstructure.reportFormat")
    private String reportFormat;

    @Parameter(property = "specstructure.dryRun", defaultValue = "false")
    private boolean dryRun;

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        StructureConfig config = loadConfig();

        try {
            StructureMetadata document = MetadataLoader.load(resolve(metadata));
            File specFile = spec;
            if (specFile == null) {
                if (document.getSpecPath() == null || document.getSpecPath().isBlank()) {
                    throw new MojoExecutionException("No spec given and metadata has no spec_path");
                }
                specFile = new File(document.getSpecPath());
            }

            ConflictPolicy policy = ConflictPolicy.fromString(onNewConflict);
            Map<String, ConflictPolicy> overrides = SpecMaterializer.parseNewConflicts(splitList(newConflicts));
            PatchReport.Format format = PatchReport.Format.fromString(
                    StructureConfig.pick(reportFormat, config.getReportFormat(), "text"));

            SpecMaterializer materializer = new SpecMaterializer(getLog(), createTemplateEngine(config),
                    resolveHelper(config));
            MaterializeResult result = materializer.materialize(document, resolve(specFile), policy, overrides,
                    splitList(only), dryRun);

            if (dryRun) {
                getLog().info(System.lineSeparator() + SpecLines.join(result.getLines()));
            }
            getLog().info(new PatchReport("materialize", policy.label(), result.getOperations())
                    .with("spec_path", result.getSpecPath().toString())
                    .with("created", result.isCreated())
                    .with("dry_run", dryRun)
                    .render(format));
        } catch (ConflictException e) {
            getLog().error("SpecStructure: " + e.getMessage()
                    + " (set specstructure.newConflicts=" + e.getMethodId() + "=overwrite or =skip)");
            throw new MojoFailureException(e.getMessage(), e);
        } catch (SpecStructureException e) {
            throw new MojoExecutionException(e.getMessage(), e);
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to materialize spec", e);
        }
    }
}
