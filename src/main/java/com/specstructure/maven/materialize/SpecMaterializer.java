package com.specstructure.maven.materialize;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.maven.plugin.logging.Log;

import com.specstructure.maven.SpecStructureException;
import com.specstructure.maven.blocks.ApplyException;
import com.specstructure.maven.blocks.ConflictException;
import com.specstructure.maven.blocks.ConflictPolicy;
import com.specstructure.maven.blocks.DescribeBlockFinder;
import com.specstructure.maven.blocks.MethodBlock;
import com.specstructure.maven.blocks.MethodBlockExtractor;
import com.specstructure.maven.blocks.MethodBlockPatcher;
import com.specstructure.maven.blocks.PatchMode;
import com.specstructure.maven.blocks.PatchOperation;
import com.specstructure.maven.blocks.PatchResult;
import com.specstructure.maven.blocks.SpecLines;
import com.specstructure.maven.metadata.MetadataException;
import com.specstructure.maven.metadata.MethodDefinition;
import com.specstructure.maven.metadata.StructureMetadata;
import com.specstructure.maven.structure.StructureMode;
import com.specstructure.maven.structure.StructureRenderer;
import com.specstructure.maven.template.TemplateEngine;

/**
 * Brings a spec file in line with a metadata document.
 * <p>
 * Creates the spec from the wrapper template when it does not exist, renders the method
 * blocks and patches them in one method at a time. Methods marked {@code method_mode: new}
 * are inserted and go through the conflict policy; all others are upserted. Every
 * conflict is checked before the file is touched; a hand-written describe block for the
 * method counts as present even without markers.
 */
public class SpecMaterializer {

    public static final String WRAPPER_TEMPLATE = "spec-wrapper.rb.mustache";

    private final Log log;
    private final TemplateEngine templateEngine;
    private final String helper;

    public SpecMaterializer(Log log, TemplateEngine templateEngine, String helper) {
        this.log = log;
        this.templateEngine = templateEngine;
        this.helper = helper;
    }

    /**
     * @param metadata          the document to materialize
     * @param specPath          target spec file
     * @param onNewConflict     policy for new methods that already have a block
     * @param newConflicts      per-method overrides of {@code onNewConflict}, keyed by method id
     * @param onlyMethodIds     restrict to these method ids; empty means all
     * @param dryRun            compute the result without writing
     * @throws ConflictException if a new method already has a block under {@link ConflictPolicy#ERROR}
     */
    public MaterializeResult materialize(StructureMetadata metadata, Path specPath, ConflictPolicy onNewConflict,
            Map<String, ConflictPolicy> newConflicts, List<String> onlyMethodIds, boolean dryRun)
            throws SpecStructureException, IOException {
        String className = metadata.getClassName();
        if (metadata.getMethods().isEmpty()) {
            throw new MetadataException("Metadata for " + className + " declares no methods");
        }

        List<MethodDefinition> selected = selectMethods(metadata, onlyMethodIds);

        boolean created = !Files.exists(specPath);
        List<String> lines;
        if (created) {
            lines = SpecLines.split(renderWrapper(className));
            log.info("SpecStructure: Creating " + specPath);
        } else {
            lines = SpecLines.read(specPath);
            checkNewMethodConflicts(lines, selected, className, onNewConflict, newConflicts, specPath);
        }

        StructureRenderer.Rendering rendering = new StructureRenderer(helper, templateEngine)
                .render(metadata, StructureMode.FRAGMENT);
        for (String warning : rendering.getWarnings()) {
            log.warn("SpecStructure: " + warning);
        }
        List<String> fragment = SpecLines.split(rendering.getText());

        List<PatchOperation> operations = new ArrayList<>();
        for (MethodDefinition method : selected) {
            String methodId = method.methodId(className);
            PatchMode mode = method.isNew() ? PatchMode.INSERT : PatchMode.UPSERT;
            ConflictPolicy policy = newConflicts.getOrDefault(methodId, onNewConflict);

            PatchResult result = new MethodBlockPatcher(mode, policy).apply(lines, fragment, List.of(methodId));
            lines = result.getLines();
            for (PatchOperation operation : result.getOperations()) {
                log.debug("SpecStructure: " + operation);
                operations.add(operation);
            }
        }

        if (!dryRun) {
            if (specPath.getParent() != null) {
                Files.createDirectories(specPath.getParent());
            }
            SpecLines.write(specPath, lines);
        }

        return new MaterializeResult(specPath, created, lines, operations, rendering.getWarnings());
    }

    private static List<MethodDefinition> selectMethods(StructureMetadata metadata, List<String> onlyMethodIds)
            throws ApplyException {
        String className = metadata.getClassName();
        if (onlyMethodIds == null || onlyMethodIds.isEmpty()) {
            return metadata.getMethods();
        }

        Set<String> requested = new LinkedHashSet<>(onlyMethodIds);
        List<MethodDefinition> selected = new ArrayList<>();
        for (MethodDefinition method : metadata.getMethods()) {
            if (requested.remove(method.methodId(className))) {
                selected.add(method);
            }
        }
        if (!requested.isEmpty()) {
            throw new ApplyException("Requested method_id(s) not found in metadata: " + String.join(", ", requested));
        }
        return selected;
    }

    private void checkNewMethodConflicts(List<String> lines, List<MethodDefinition> selected, String className,
            ConflictPolicy onNewConflict, Map<String, ConflictPolicy> newConflicts, Path specPath)
            throws SpecStructureException {
        Map<String, MethodBlock> markerBlocks = MethodBlockExtractor.extract(lines);

        Map<String, String> descriptors = new LinkedHashMap<>();
        for (MethodDefinition method : selected) {
            String methodId = method.methodId(className);
            if (method.isNew() && !markerBlocks.containsKey(methodId)) {
                descriptors.put(methodId, method.descriptor());
            }
        }
        Map<String, MethodBlock> describeBlocks = DescribeBlockFinder.find(lines, descriptors);

        for (MethodDefinition method : selected) {
            String methodId = method.methodId(className);
            if (!method.isNew()) {
                continue;
            }
            String detectedBy = markerBlocks.containsKey(methodId) ? "markers"
                    : describeBlocks.containsKey(methodId) ? "describe" : null;
            if (detectedBy == null) {
                continue;
            }
            ConflictPolicy policy = newConflicts.getOrDefault(methodId, onNewConflict);
            log.warn("SpecStructure: " + methodId + " is marked new but " + specPath
                    + " already has it (detected by " + detectedBy + ", action " + policy.label() + ")");
            if (policy == ConflictPolicy.ERROR) {
                throw new ConflictException(methodId);
            }
        }
    }

    private String renderWrapper(String className) throws IOException {
        Map<String, Object> context = new HashMap<>();
        context.put("className", className);
        context.put("helper", helper == null || helper.isBlank() ? null : helper);
        return templateEngine.render(WRAPPER_TEMPLATE, context);
    }

    /**
     * Parses {@code METHOD_ID=ACTION} entries, e.g. {@code Invoice#total=skip}.
     */
    public static Map<String, ConflictPolicy> parseNewConflicts(List<String> entries) throws ApplyException {
        Map<String, ConflictPolicy> result = new HashMap<>();
        if (entries == null) {
            return result;
        }
        for (String entry : entries) {
            int separator = entry.lastIndexOf('=');
            if (separator <= 0 || separator == entry.length() - 1) {
                throw new ApplyException("Conflict override must be METHOD_ID=ACTION: " + entry);
            }
            result.put(entry.substring(0, separator).trim(),
                    ConflictPolicy.fromString(entry.substring(separator + 1)));
        }
        return result;
    }
}
