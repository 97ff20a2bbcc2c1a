package com.specstructure.maven.metadata;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

class MetadataValidatorTest {

    private final MetadataValidator validator = new MetadataValidator();

    @Test
    void testValidate_FixtureIsValid() throws Exception {
        MetadataValidator.Result result = validator.validate(
                MetadataLoader.load(Path.of("src/test/resources/fixtures/invoice-metadata.yml")));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void testValidate_ReportsStructuralErrors() throws Exception {
        MetadataValidator.Result result = validator.validate(
                MetadataLoader.load(Path.of("src/test/resources/fixtures/invalid-metadata.yml")));

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).anyMatch(e -> e.contains("duplicate: ok"));
        assertThat(result.getErrors()).anyMatch(e -> e.contains("methods[0].type must be one of: instance, class"));
        assertThat(result.getErrors()).anyMatch(e -> e.contains("characteristics[0].type must be one of"));
        assertThat(result.getErrors()).anyMatch(e -> e.contains("when_parent value 'missing'"));
        assertThat(result.getErrors()).anyMatch(e -> e.contains("level must be 2"));
    }

    @Test
    void testValidate_UnknownDependsOn() throws Exception {
        MetadataValidator.Result result = validator.validate(MetadataLoader.loadFromString("""
                class_name: Widget
                methods:
                  - name: call
                    type: instance
                    characteristics:
                      - name: child
                        type: boolean
                        level: 2
                        depends_on: ghost
                        when_parent: [x]
                        values:
                          - value: yes_child
                          - value: no_child
                """));

        assertThat(result.getErrors()).anyMatch(e -> e.contains("unknown characteristic 'ghost'"));
    }

    @Test
    void testValidate_RootMustBeLevelOne() throws Exception {
        MetadataValidator.Result result = validator.validate(MetadataLoader.loadFromString("""
                class_name: Widget
                methods:
                  - name: call
                    type: instance
                    characteristics:
                      - name: root
                        type: enum
                        level: 2
                        values:
                          - value: a
                """));

        assertThat(result.getErrors()).anyMatch(e -> e.contains("level must be 1"));
    }

    @Test
    void testValidate_WhenParentWithoutDependsOn() throws Exception {
        MetadataValidator.Result result = validator.validate(MetadataLoader.loadFromString("""
                class_name: Widget
                methods:
                  - name: call
                    type: instance
                    characteristics:
                      - name: root
                        type: enum
                        level: 1
                        when_parent: [a]
                        values:
                          - value: a
                """));

        assertThat(result.getErrors()).anyMatch(e -> e.contains("when_parent requires depends_on"));
    }

    @Test
    void testValidate_DetectsCycle() throws Exception {
        MetadataValidator.Result result = validator.validate(MetadataLoader.loadFromString("""
                class_name: Widget
                methods:
                  - name: call
                    type: instance
                    characteristics:
                      - name: a
                        type: enum
                        level: 2
                        depends_on: b
                        when_parent: [x]
                        values:
                          - value: x
                      - name: b
                        type: enum
                        level: 3
                        depends_on: a
                        when_parent: [x]
                        values:
                          - value: x
                """));

        assertThat(result.getErrors()).anyMatch(e -> e.contains("depends_on cycle"));
    }

    @Test
    void testValidate_UnknownBehaviorIsWarning() throws Exception {
        MetadataValidator.Result result = validator.validate(MetadataLoader.loadFromString("""
                class_name: Widget
                methods:
                  - name: call
                    type: instance
                    side_effects:
                      - type: log
                        behavior_id: writes_log
                    characteristics:
                      - name: root
                        type: enum
                        level: 1
                        values:
                          - value: a
                            behavior_id: does_a
                """));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings())
                .anyMatch(w -> w.contains("writes_log"))
                .anyMatch(w -> w.contains("does_a"));
    }

    @Test
    void testValidate_WarnsOnCombinatorialExplosion() throws Exception {
        StringBuilder yaml = new StringBuilder("""
                class_name: Widget
                methods:
                  - name: call
                    type: instance
                    characteristics:
                """);
        for (int i = 0; i < 5; i++) {
            yaml.append("      - name: c").append(i).append('\n')
                    .append("        type: enum\n")
                    .append("        level: 1\n")
                    .append("        values:\n")
                    .append("          - value: a\n")
                    .append("          - value: b\n");
        }

        MetadataValidator.Result result = validator.validate(MetadataLoader.loadFromString(yaml.toString()));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).anyMatch(w -> w.contains("Potential combinatorial explosion"));
    }
}
