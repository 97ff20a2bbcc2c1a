package com.specstructure.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;

import com.specstructure.maven.SpecStructureException;
import com.specstructure.maven.blocks.ConflictException;
import com.specstructure.maven.blocks.ConflictPolicy;
import com.specstructure.maven.blocks.MarkerStripper;
import com.specstructure.maven.blocks.MethodBlockPatcher;
import com.specstructure.maven.blocks.PatchMode;
import com.specstructure.maven.blocks.PatchReport;
import com.specstructure.maven.blocks.PatchResult;
import com.specstructure.maven.blocks.SpecLines;
import com.specstructure.maven.config.StructureConfig;
import com.specstructure.maven.config.StructureConfigLoader;
import com.specstructure.maven.materialize.MaterializeResult;
import com.specstructure.maven.materialize.SpecMaterializer;
import com.specstructure.maven.metadata.MetadataLoader;
import com.specstructure.maven.metadata.MetadataValidator;
import com.specstructure.maven.metadata.StructureMetadata;
import com.specstructure.maven.structure.StructureMode;
import com.specstructure.maven.structure.StructureRenderer;
import com.specstructure.maven.template.MustacheTemplateEngine;
import com.specstructure.maven.template.TemplateEngine;
import com.specstructure.maven.template.TemplateLoader;

/**
 * Command-line entry point mirroring the plugin goals.
 * <p>
 * Exit codes: 0 success, 1 fatal error, 2 conflict under the {@code error} policy (or
 * warnings for {@code render} and {@code validate}). Rendered or dry-run text goes to
 * stdout; operation reports and diagnostics go to stderr.
 */
public class SpecStructureCli {

    static final int OK = 0;
    static final int FAILED = 1;
    static final int NEEDS_ATTENTION = 2;

    private final PrintStream out;
    private final PrintStream err;
    private final Path workingDir;
    private final Log log;

    SpecStructureCli(PrintStream out, PrintStream err, Path workingDir, Log log) {
        this.out = out;
        this.err = err;
        this.workingDir = workingDir;
        this.log = log;
    }

    public static void main(String[] args) {
        Path workingDir = Path.of("").toAbsolutePath();
        System.exit(new SpecStructureCli(System.out, System.err, workingDir, new SystemStreamLog()).run(args));
    }

    int run(String[] args) {
        if (args.length == 0 || "--help".equals(args[0]) || "help".equals(args[0])) {
            printUsage(args.length == 0 ? err : out);
            return args.length == 0 ? FAILED : OK;
        }

        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            switch (command) {
                case "render":
                    return render(CliOptions.parse(rest, Set.of("structure-mode", "helper", "template-dir"),
                            Set.of()));
                case "apply":
                    return apply(CliOptions.parse(rest, Set.of("spec", "blocks", "mode", "conflict", "only", "format"),
                            Set.of("dry-run")));
                case "materialize":
                    return materialize(CliOptions.parse(rest, Set.of("metadata", "spec", "on-new-conflict",
                            "new-conflict", "only", "format", "helper", "template-dir"), Set.of("dry-run")));
                case "strip":
                    return strip(CliOptions.parse(rest, Set.of("spec"), Set.of("dry-run")));
                case "validate":
                    return validate(CliOptions.parse(rest, Set.of("metadata"), Set.of()));
                default:
                    err.println("Error: Unknown command: " + command);
                    printUsage(err);
                    return FAILED;
            }
        } catch (IllegalArgumentException e) {
            err.println("Invalid argument: " + e.getMessage());
            printUsage(err);
            return FAILED;
        } catch (ConflictException e) {
            err.println("Conflict: " + e.getMessage());
            return NEEDS_ATTENTION;
        } catch (SpecStructureException e) {
            err.println("Error: " + e.getMessage());
            return FAILED;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return FAILED;
        }
    }

    private int render(CliOptions options) throws SpecStructureException, IOException {
        Path metadataPath = requirePath(options.valueOrPositional("metadata"), "metadata file");
        StructureMode mode = StructureMode.fromString(
                options.value("structure-mode") != null ? options.value("structure-mode") : "fragment");
        StructureConfig config = StructureConfigLoader.load(workingDir, log);

        StructureMetadata metadata = MetadataLoader.load(metadataPath);
        StructureRenderer.Rendering rendering = new StructureRenderer(
                StructureConfig.pick(options.value("helper"), config.getHelper(), null),
                templateEngine(options, config)).render(metadata, mode);

        out.println(rendering.getText());
        for (String warning : rendering.getWarnings()) {
            err.println("Warning: " + warning);
        }
        return rendering.hasWarnings() ? NEEDS_ATTENTION : OK;
    }

    private int apply(CliOptions options) throws SpecStructureException, IOException {
        Path specPath = requirePath(options.value("spec"), "--spec");
        Path blocksPath = requirePath(options.value("blocks"), "--blocks");
        StructureConfig config = StructureConfigLoader.load(workingDir, log);

        PatchMode mode = PatchMode.fromString(StructureConfig.pick(options.value("mode"), config.getMode(), "upsert"));
        ConflictPolicy policy = ConflictPolicy.fromString(
                StructureConfig.pick(options.value("conflict"), config.getOnConflict(), "error"));
        PatchReport.Format format = PatchReport.Format.fromString(
                StructureConfig.pick(options.value("format"), config.getReportFormat(), "text"));
        boolean dryRun = options.flag("dry-run");

        PatchResult result = new MethodBlockPatcher(mode, policy)
                .apply(SpecLines.read(specPath), SpecLines.read(blocksPath), options.all("only"));

        if (dryRun) {
            out.print(SpecLines.join(result.getLines()));
        } else if (result.isModified()) {
            SpecLines.write(specPath, result.getLines());
        }

        err.println(PatchReport.of(result)
                .with("spec_path", specPath.toString())
                .with("blocks_path", blocksPath.toString())
                .with("dry_run", dryRun)
                .render(format));
        return OK;
    }

    private int materialize(CliOptions options) throws SpecStructureException, IOException {
        Path metadataPath = requirePath(options.valueOrPositional("metadata"), "--metadata");
        StructureConfig config = StructureConfigLoader.load(workingDir, log);
        StructureMetadata metadata = MetadataLoader.load(metadataPath);

        String spec = options.value("spec") != null ? options.value("spec") : metadata.getSpecPath();
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("--spec is required when metadata has no spec_path");
        }
        ConflictPolicy policy = ConflictPolicy.fromString(
                options.value("on-new-conflict") != null ? options.value("on-new-conflict") : "error");
        Map<String, ConflictPolicy> overrides = SpecMaterializer.parseNewConflicts(options.all("new-conflict"));
        PatchReport.Format format = PatchReport.Format.fromString(
                StructureConfig.pick(options.value("format"), config.getReportFormat(), "text"));
        boolean dryRun = options.flag("dry-run");

        SpecMaterializer materializer = new SpecMaterializer(log, templateEngine(options, config),
                StructureConfig.pick(options.value("helper"), config.getHelper(), null));
        MaterializeResult result = materializer.materialize(metadata, workingDir.resolve(spec), policy, overrides,
                options.all("only"), dryRun);

        if (dryRun) {
            out.print(SpecLines.join(result.getLines()));
        }
        for (String warning : result.getWarnings()) {
            err.println("Warning: " + warning);
        }
        err.println(new PatchReport("materialize", policy.label(), result.getOperations())
                .with("spec_path", result.getSpecPath().toString())
                .with("created", result.isCreated())
                .with("dry_run", dryRun)
                .render(format));
        return OK;
    }

    private int strip(CliOptions options) throws IOException {
        Path specPath = requirePath(options.valueOrPositional("spec"), "spec file");
        List<String> lines = SpecLines.read(specPath);
        List<String> stripped = MarkerStripper.strip(lines);

        if (options.flag("dry-run")) {
            out.print(SpecLines.join(stripped));
        } else if (stripped.size() != lines.size()) {
            SpecLines.write(specPath, stripped);
        }
        err.println("Removed " + (lines.size() - stripped.size()) + " marker line(s) from " + specPath);
        return OK;
    }

    private int validate(CliOptions options) throws SpecStructureException {
        Path metadataPath = requirePath(options.valueOrPositional("metadata"), "metadata file");
        MetadataValidator.Result result = new MetadataValidator().validate(MetadataLoader.load(metadataPath));

        for (String error : result.getErrors()) {
            err.println("Error: " + error);
        }
        for (String warning : result.getWarnings()) {
            err.println("Warning: " + warning);
        }
        if (!result.isValid()) {
            return FAILED;
        }
        out.println("Metadata is valid: " + metadataPath);
        return result.getWarnings().isEmpty() ? OK : NEEDS_ATTENTION;
    }

    private TemplateEngine templateEngine(CliOptions options, StructureConfig config) {
        String dir = StructureConfig.pick(options.value("template-dir"), config.getTemplateDir(), null);
        Path userTemplates = dir == null ? null : workingDir.resolve(dir);
        return new MustacheTemplateEngine(new TemplateLoader(userTemplates, log));
    }

    private Path requirePath(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing " + what);
        }
        Path path = workingDir.resolve(value);
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("file not found: " + path);
        }
        return path;
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: SpecStructureCli <command> [options]");
        stream.println("  render <metadata.yml> [--structure-mode=full|fragment] [--helper=NAME] [--template-dir=DIR]");
        stream.println("  apply --spec=PATH --blocks=PATH [--mode=insert|replace|upsert]");
        stream.println("        [--conflict=error|overwrite|skip] [--only=METHOD_ID]... [--format=text|json] [--dry-run]");
        stream.println("  materialize --metadata=PATH [--spec=PATH] [--on-new-conflict=error|overwrite|skip]");
        stream.println("        [--new-conflict=METHOD_ID=ACTION]... [--only=METHOD_ID]... [--format=text|json] [--dry-run]");
        stream.println("  strip <spec.rb> [--dry-run]");
        stream.println("  validate <metadata.yml>");
    }
}
