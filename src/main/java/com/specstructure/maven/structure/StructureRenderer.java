package com.specstructure.maven.structure;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.specstructure.maven.metadata.StructureMetadata;
import com.specstructure.maven.template.TemplateEngine;

/**
 * Metadata document in, RSpec text out: resolves behaviors, builds the context forest
 * and renders it.
 */
public class StructureRenderer {

    /**
     * Rendered text plus the non-fatal issues met along the way.
     */
    public static class Rendering {
        private final String text;
        private final List<String> warnings;

        Rendering(String text, List<String> warnings) {
            this.text = text;
            this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        }

        public String getText() {
            return text;
        }

        public List<String> getWarnings() {
            return warnings;
        }

        public boolean hasWarnings() {
            return !warnings.isEmpty();
        }
    }

    static final String NO_METHODS_WARNING = "No methods found in metadata; generated a minimal spec";

    private final String helper;
    private final TemplateEngine templateEngine;

    public StructureRenderer(String helper, TemplateEngine templateEngine) {
        this.helper = helper;
        this.templateEngine = templateEngine;
    }

    public Rendering render(StructureMetadata metadata, StructureMode mode) throws IOException {
        SpecCodeGenerator generator = new SpecCodeGenerator(metadata.getClassName(), helper, templateEngine);

        if (metadata.getMethods().isEmpty()) {
            return new Rendering(generator.renderMinimal(), List.of(NO_METHODS_WARNING));
        }

        ContextTreeBuilder builder = new ContextTreeBuilder(metadata.getClassName(),
                new BehaviorResolver(metadata.getBehaviors()));
        List<MethodTree> trees = builder.build(metadata.getMethods());
        return new Rendering(generator.render(trees, mode), builder.getWarnings());
    }
}
