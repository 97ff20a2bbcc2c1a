package com.specstructure.maven.structure;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.specstructure.maven.blocks.Marker;
import com.specstructure.maven.template.TemplateEngine;

/**
 * Renders method trees as RSpec source.
 * <p>
 * Every method becomes a {@code describe '<descriptor>' do ... end} block whose body is
 * wrapped in {@code method_begin}/{@code method_end} markers, so the output of either mode
 * can be fed straight to the block patcher. Fragment mode joins the blocks with a blank
 * line; full mode hands them to the {@value #SPEC_TEMPLATE} template as {@code body}.
 */
public class SpecCodeGenerator {

    public static final String SPEC_TEMPLATE = "spec-file.rb.mustache";

    private static final String INDENT = "  ";

    private final String className;
    private final String helper;
    private final TemplateEngine templateEngine;

    /**
     * @param className      the class under test, used in the outer describe and in method ids
     * @param helper         spec helper to require in full mode, or {@code null}
     * @param templateEngine renders the full-mode file; may be {@code null} if only fragments are rendered
     */
    public SpecCodeGenerator(String className, String helper, TemplateEngine templateEngine) {
        this.className = className;
        this.helper = helper;
        this.templateEngine = templateEngine;
    }

    public String render(List<MethodTree> trees, StructureMode mode) throws IOException {
        return mode == StructureMode.FULL ? renderFull(trees) : renderFragment(trees);
    }

    public String renderFragment(List<MethodTree> trees) {
        List<String> blocks = new ArrayList<>();
        for (MethodTree tree : trees) {
            blocks.add(String.join("\n", methodBlock(tree, 1)));
        }
        return String.join("\n\n", blocks);
    }

    public String renderFull(List<MethodTree> trees) throws IOException {
        return renderFile(renderFragment(trees));
    }

    /**
     * A spec file with one placeholder example, for documents that declare no methods.
     */
    public String renderMinimal() throws IOException {
        List<String> lines = new ArrayList<>();
        appendExample(lines, INDENT, Placeholders.BEHAVIOR_DESCRIPTION);
        return renderFile(String.join("\n", lines));
    }

    private String renderFile(String body) throws IOException {
        if (templateEngine == null) {
            throw new IOException("No template engine configured for full mode");
        }
        Map<String, Object> context = new HashMap<>();
        context.put("className", className);
        context.put("helper", helper == null || helper.isBlank() ? null : helper);
        context.put("body", body);
        return templateEngine.render(SPEC_TEMPLATE, context);
    }

    List<String> methodBlock(MethodTree tree, int indentLevel) {
        String indent = INDENT.repeat(indentLevel);
        String inner = indent + INDENT;

        List<String> lines = new ArrayList<>();
        lines.add(indent + "describe '" + escape(tree.getDescriptor()) + "' do");
        lines.add(inner + Marker.begin(tree.getMethodId(), tree.getDescriptor()));

        if (tree.isClassMethod()) {
            lines.add(inner + "subject(:result) { described_class." + tree.getName() + " }  # TODO: Add parameters");
        } else {
            lines.add(inner + "subject(:result) { instance." + tree.getName() + " }  # TODO: Add parameters");
            lines.add("");
            lines.add(inner + "let(:instance) { described_class.new }");
        }

        lines.add("");
        lines.add(inner + Placeholders.COMMON_SETUP);
        lines.add("");

        if (tree.getContexts().isEmpty()) {
            for (ItBlock sideEffect : tree.getSideEffects()) {
                appendExample(lines, inner, sideEffect.getDescription());
                lines.add("");
            }
            appendExample(lines, inner, Placeholders.BEHAVIOR_DESCRIPTION);
        } else {
            boolean first = true;
            for (ContextNode context : tree.getContexts()) {
                if (!first) {
                    lines.add("");
                }
                appendContext(lines, context, indentLevel + 1);
                first = false;
            }
        }

        lines.add(inner + Marker.end(tree.getMethodId()));
        lines.add(indent + "end");
        return lines;
    }

    private void appendContext(List<String> lines, ContextNode context, int indentLevel) {
        String indent = INDENT.repeat(indentLevel);
        String inner = indent + INDENT;

        if (context.isSkipped()) {
            lines.add(indent + "# SKIPPED: " + context.getSkipReason() + " - context '" + escape(context.getTitle()) + "'");
            return;
        }

        lines.add(indent + "context '" + escape(context.getTitle()) + "' do");
        if (context.getSourceLine() != null) {
            lines.add(inner + "# Logic: " + context.getSourceLine());
        }
        if (context.getLetBlock() != null) {
            lines.add(inner + context.getLetBlock());
        }
        lines.add(inner + Placeholders.SETUP_CODE);
        lines.add("");

        for (ItBlock itBlock : context.getItBlocks()) {
            appendExample(lines, inner, itBlock.getDescription());
        }

        List<ContextNode> children = context.getChildren();
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                lines.add("");
            }
            appendContext(lines, children.get(i), indentLevel + 1);
        }

        lines.add(indent + "end");
    }

    private static void appendExample(List<String> lines, String indent, String description) {
        lines.add(indent + "it '" + escape(description) + "' do");
        lines.add(indent + INDENT + Placeholders.EXPECTATION);
        lines.add(indent + "end");
    }

    /**
     * Escapes text for a single-quoted Ruby string literal.
     */
    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\\", "\\\\").replace("'", "\\'");
    }
}
