package com.specstructure.maven.structure;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.specstructure.maven.metadata.MetadataLoader;
import com.specstructure.maven.metadata.StructureMetadata;

class ContextTreeBuilderTest {

    private StructureMetadata metadata;

    @BeforeEach
    void setUp() throws Exception {
        metadata = MetadataLoader.load(Path.of("src/test/resources/fixtures/invoice-metadata.yml"));
    }

    private List<MethodTree> build(StructureMetadata document) {
        return new ContextTreeBuilder(document.getClassName(), new BehaviorResolver(document.getBehaviors()))
                .build(document.getMethods());
    }

    @Test
    void testBuild_MethodIdentity() {
        List<MethodTree> trees = build(metadata);

        assertThat(trees).extracting(MethodTree::getMethodId)
                .containsExactly("Billing::Invoice#total", "Billing::Invoice.build");
        assertThat(trees).extracting(MethodTree::getDescriptor).containsExactly("#total", ".build");
        assertThat(trees.get(1).isClassMethod()).isTrue();
    }

    @Test
    void testBuild_HappyPathFirstAtRoot() {
        List<ContextNode> roots = build(metadata).get(0).getContexts();

        assertThat(roots).extracting(ContextNode::getValue).containsExactly("authenticated", "not_authenticated");
        assertThat(roots).extracting(ContextNode::getWord).containsOnly("when");
        assertThat(roots.get(1).getDescription()).isEqualTo("the user is NOT authenticated");
    }

    @Test
    void testBuild_ChildrenFollowWhenParent() {
        ContextNode authenticated = build(metadata).get(0).getContexts().get(0);

        assertThat(authenticated.isLeaf()).isFalse();
        assertThat(authenticated.getItBlocks()).isEmpty();
        assertThat(authenticated.getChildren()).extracting(ContextNode::getTitle)
                .containsExactly("with line items", "but no line items");
        assertThat(authenticated.getSourceLine()).isEqualTo("invoice.rb:12-14");
    }

    @Test
    void testBuild_LeafGetsSideEffectsThenBehavior() {
        ContextNode withItems = build(metadata).get(0).getContexts().get(0).getChildren().get(0);

        assertThat(withItems.isLeaf()).isTrue();
        assertThat(withItems.getItBlocks()).extracting(ItBlock::getDescription)
                .containsExactly("sends a receipt email", "returns the sum of line items");
        assertThat(withItems.getItBlocks()).extracting(ItBlock::isSideEffect).containsExactly(true, false);
        assertThat(withItems.getLetBlock()).isEqualTo("let(:line_items) { true }");
    }

    @Test
    void testBuild_TerminalGetsOnlyItsBehavior() {
        ContextNode notAuthenticated = build(metadata).get(0).getContexts().get(1);

        assertThat(notAuthenticated.isTerminal()).isTrue();
        assertThat(notAuthenticated.getChildren()).isEmpty();
        assertThat(notAuthenticated.getItBlocks()).extracting(ItBlock::getDescription)
                .containsExactly("raises an authorization error");
    }

    @Test
    void testBuild_TerminalNeverGrowsChildren() throws Exception {
        StructureMetadata document = MetadataLoader.loadFromString("""
                class_name: Gate
                methods:
                  - name: open
                    type: instance
                    characteristics:
                      - name: locked
                        type: boolean
                        level: 1
                        values:
                          - value: unlocked
                          - value: locked
                            terminal: true
                      - name: key
                        type: presence
                        level: 2
                        depends_on: locked
                        when_parent: [locked, unlocked]
                        values:
                          - value: present
                          - value: absent
                """);

        List<ContextNode> roots = build(document).get(0).getContexts();

        assertThat(roots).extracting(ContextNode::getValue).containsExactly("locked", "unlocked");
        assertThat(roots.get(0).getChildren()).isEmpty();
        assertThat(roots.get(1).getChildren()).hasSize(2);
    }

    @Test
    void testBuild_DisabledBehaviorSkipsLeaf() {
        List<ContextNode> currencies = build(metadata).get(1).getContexts();

        assertThat(currencies.get(0).isSkipped()).isFalse();
        assertThat(currencies.get(0).getItBlocks()).extracting(ItBlock::getDescription)
                .containsExactly("builds a dollar invoice");

        ContextNode eur = currencies.get(1);
        assertThat(eur.isSkipped()).isTrue();
        assertThat(eur.getSkipReason()).isEqualTo(ContextTreeBuilder.BEHAVIOR_DISABLED);
        assertThat(eur.getItBlocks()).isEmpty();
        assertThat(eur.getTitle()).isEqualTo("when currency is eur");
    }

    @Test
    void testBuild_DisabledSideEffectIsDropped() throws Exception {
        StructureMetadata document = MetadataLoader.loadFromString("""
                class_name: Mailer
                behaviors:
                  - id: audit
                    description: writes an audit entry
                    enabled: false
                  - id: sends
                    description: sends the mail
                methods:
                  - name: deliver
                    type: instance
                    side_effects:
                      - type: audit
                        behavior_id: audit
                    characteristics:
                      - name: mode
                        type: enum
                        level: 1
                        values:
                          - value: now
                            behavior_id: sends
                """);

        MethodTree tree = build(document).get(0);

        assertThat(tree.getSideEffects()).isEmpty();
        assertThat(tree.getContexts().get(0).getItBlocks()).extracting(ItBlock::getDescription)
                .containsExactly("sends the mail");
    }

    @Test
    void testBuild_SiblingRootsAreParallel() throws Exception {
        StructureMetadata document = MetadataLoader.loadFromString("""
                class_name: Report
                methods:
                  - name: render
                    type: instance
                    characteristics:
                      - name: format
                        type: enum
                        level: 1
                        values:
                          - value: pdf
                          - value: csv
                      - name: cached
                        type: boolean
                        level: 1
                        values:
                          - value: "true"
                          - value: "false"
                """);

        List<ContextNode> roots = build(document).get(0).getContexts();

        assertThat(roots).extracting(ContextNode::getTitle).containsExactly(
                "when format is pdf", "when format is csv", "when true", "when false");
        assertThat(roots).allMatch(ContextNode::isLeaf);
    }

    @Test
    void testBuild_WarnsOnMissingCharacteristicsAndUnknownBehaviors() throws Exception {
        StructureMetadata document = MetadataLoader.loadFromString("""
                class_name: Plain
                methods:
                  - name: call
                    type: instance
                  - name: run
                    type: instance
                    characteristics:
                      - name: mode
                        type: enum
                        level: 1
                        values:
                          - value: fast
                            behavior_id: ghost
                """);
        ContextTreeBuilder builder = new ContextTreeBuilder("Plain", new BehaviorResolver(document.getBehaviors()));

        List<MethodTree> trees = builder.build(document.getMethods());

        assertThat(trees.get(0).getContexts()).isEmpty();
        assertThat(trees.get(1).getContexts().get(0).getItBlocks()).extracting(ItBlock::getDescription)
                .containsExactly(Placeholders.BEHAVIOR_DESCRIPTION);
        assertThat(builder.getWarnings())
                .anyMatch(w -> w.contains("'call' has no characteristics"))
                .anyMatch(w -> w.contains("Unknown behavior_id 'ghost'"));
    }
}
