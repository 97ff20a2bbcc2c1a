package com.specstructure.maven.metadata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

class MetadataLoaderTest {

    private static final Path FIXTURE = Path.of("src/test/resources/fixtures/invoice-metadata.yml");

    @Test
    void testLoad_ReadsDocument() throws Exception {
        StructureMetadata metadata = MetadataLoader.load(FIXTURE);

        assertThat(metadata.getClassName()).isEqualTo("Billing::Invoice");
        assertThat(metadata.getSpecPath()).isEqualTo("spec/models/billing/invoice_spec.rb");
        assertThat(metadata.getBehaviors()).hasSize(5);
        assertThat(metadata.getMethods()).extracting(MethodDefinition::getName).containsExactly("total", "build");
    }

    @Test
    void testLoad_ReadsCharacteristics() throws Exception {
        MethodDefinition total = MetadataLoader.load(FIXTURE).getMethods().get(0);

        assertThat(total.isNew()).isTrue();
        assertThat(total.methodId("Billing::Invoice")).isEqualTo("Billing::Invoice#total");
        assertThat(total.getSideEffects()).hasSize(1);

        Characteristic lineItems = total.findCharacteristic("line_items");
        assertThat(lineItems.getLevel()).isEqualTo(2);
        assertThat(lineItems.getDependsOn()).isEqualTo("user_authenticated");
        assertThat(lineItems.getWhenParent()).containsExactly("authenticated");
        assertThat(lineItems.isRoot()).isFalse();

        Characteristic auth = total.findCharacteristic("user_authenticated");
        assertThat(auth.getSourceLine()).isEqualTo("invoice.rb:12-14");
        assertThat(auth.getValues().get(0).isTerminal()).isTrue();
        assertThat(auth.getValues().get(0).getBehaviorId()).isEqualTo("raises_unauthorized");
    }

    @Test
    void testLoad_ClassMethodIdentity() throws Exception {
        MethodDefinition build = MetadataLoader.load(FIXTURE).getMethods().get(1);

        assertThat(build.isClassMethod()).isTrue();
        assertThat(build.descriptor()).isEqualTo(".build");
        assertThat(build.methodId("Billing::Invoice")).isEqualTo("Billing::Invoice.build");
        assertThat(build.getCharacteristics().get(0).getValues().get(0).getBehavior())
                .isEqualTo("builds a dollar invoice");
    }

    @Test
    void testLoad_DisabledBehavior() throws Exception {
        StructureMetadata metadata = MetadataLoader.load(FIXTURE);

        assertThat(metadata.getBehaviors())
                .filteredOn(behavior -> !behavior.isEnabled())
                .extracting(Behavior::getId)
                .containsExactly("legacy_rounding");
    }

    @Test
    void testLoad_MissingFile() {
        MetadataException e = assertThrows(MetadataException.class,
                () -> MetadataLoader.load(Path.of("src/test/resources/fixtures/nope.yml")));

        assertThat(e.getMessage()).contains("Metadata file not found");
    }

    @Test
    void testLoadFromString_MissingClassName() {
        MetadataException e = assertThrows(MetadataException.class,
                () -> MetadataLoader.loadFromString("methods: []\n"));

        assertThat(e.getMessage()).contains("class_name");
    }

    @Test
    void testLoadFromString_NotAMapping() {
        assertThrows(MetadataException.class, () -> MetadataLoader.loadFromString("- just\n- a list\n"));
    }

    @Test
    void testLoadFromString_BrokenYaml() {
        MetadataException e = assertThrows(MetadataException.class,
                () -> MetadataLoader.loadFromString("class_name: [unclosed\n"));

        assertThat(e.getMessage()).contains("Cannot parse metadata YAML");
    }

    @Test
    void testLoadFromString_ScalarValuesBecomeStrings() throws Exception {
        StructureMetadata metadata = MetadataLoader.loadFromString("""
                class_name: Flag
                methods:
                  - name: call
                    type: instance
                    characteristics:
                      - name: enabled
                        type: boolean
                        level: 1
                        values:
                          - value: true
                          - value: false
                """);

        Characteristic enabled = metadata.getMethods().get(0).getCharacteristics().get(0);
        assertThat(enabled.getValues()).extracting(CharacteristicValue::getValue).containsExactly("true", "false");
    }
}
