package com.specstructure.maven;

import static com.specstructure.maven.MojoTestSupport.setField;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GenerateStructureMojoTest {

    @Mock
    private Log log;

    private GenerateStructureMojo mojo;
    private Path testBaseDir;

    @BeforeEach
    void setUp() throws Exception {
        testBaseDir = MojoTestSupport.testBaseDir(getClass());
        mojo = new GenerateStructureMojo();
        mojo.setLog(log);
        setField(mojo, "metadata", new File("src/test/resources/fixtures/invoice-metadata.yml"));
        setField(mojo, "structureMode", "fragment");
    }

    @Test
    void testExecute_LogsFragmentWithoutOutput() throws Exception {
        mojo.execute();

        verify(log).info(contains("Rendering fragment structure for Billing::Invoice"));
        verify(log).info(contains("# rspec-testing:method_begin method_id=\"Billing::Invoice#total\""));
    }

    @Test
    void testExecute_WritesFullSpec() throws Exception {
        Path output = testBaseDir.resolve("spec/invoice_spec.rb");
        setField(mojo, "structureMode", "full");
        setField(mojo, "output", output.toFile());
        setField(mojo, "helper", "rails_helper");

        mojo.execute();

        String content = Files.readString(output);
        assertThat(content).startsWith("# frozen_string_literal: true\n\nrequire 'rails_helper'\n");
        assertThat(content).contains("RSpec.describe Billing::Invoice do\n  describe '#total' do\n");
        assertThat(content).endsWith("end\n");
        verify(log, atLeastOnce()).info(contains("Wrote"));
    }

    @Test
    void testExecute_FragmentFileEndsWithNewline() throws Exception {
        Path output = testBaseDir.resolve("blocks.rb");
        setField(mojo, "output", output.toFile());

        mojo.execute();

        String content = Files.readString(output);
        assertThat(content).startsWith("  describe '#total' do\n");
        assertThat(content).endsWith("  end\n");
    }

    @Test
    void testExecute_WarnsForMetadataWithoutMethods() throws Exception {
        Path metadata = testBaseDir.resolve("empty.yml");
        Files.writeString(metadata, "class_name: Empty\n");
        setField(mojo, "metadata", metadata.toFile());

        mojo.execute();

        verify(log).warn(contains("No methods found in metadata"));
        verify(log).info(contains("RSpec.describe Empty do"));
    }

    @Test
    void testExecute_UnknownStructureMode() throws Exception {
        setField(mojo, "structureMode", "outline");

        assertThrows(MojoExecutionException.class, () -> mojo.execute());
    }

    @Test
    void testExecute_MissingMetadata() throws Exception {
        setField(mojo, "metadata", testBaseDir.resolve("missing.yml").toFile());

        assertThrows(MojoExecutionException.class, () -> mojo.execute());
    }
}
