package com.specstructure.maven;

import static com.specstructure.maven.MojoTestSupport.setField;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.verify;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MaterializeMojoTest {

    @Mock
    private Log log;

    private MaterializeMojo mojo;
    private Path testBaseDir;

    @BeforeEach
    void setUp() throws Exception {
        testBaseDir = MojoTestSupport.testBaseDir(getClass());
        mojo = new MaterializeMojo();
        mojo.setLog(log);
        setField(mojo, "metadata", new File("src/test/resources/fixtures/invoice-metadata.yml"));
        setField(mojo, "onNewConflict", "error");
    }

    private Path copyExistingSpec() throws Exception {
        Path spec = testBaseDir.resolve("invoice_spec.rb");
        Files.copy(Path.of("src/test/resources/fixtures/invoice_spec.rb"), spec, StandardCopyOption.REPLACE_EXISTING);
        setField(mojo, "spec", spec.toFile());
        return spec;
    }

    @Test
    void testExecute_CreatesSpec() throws Exception {
        Path spec = testBaseDir.resolve("spec/models/billing/invoice_spec.rb");
        setField(mojo, "spec", spec.toFile());

        mojo.execute();

        assertThat(Files.readString(spec)).contains("describe '#total' do", "describe '.build' do");
        verify(log).info(contains("Creating"));
        verify(log).info(contains("inserted: Billing::Invoice.build"));
    }

    @Test
    void testExecute_ConflictFailsBuild() throws Exception {
        Path spec = copyExistingSpec();
        String before = Files.readString(spec);

        assertThrows(MojoFailureException.class, () -> mojo.execute());

        assertThat(Files.readString(spec)).isEqualTo(before);
        verify(log).error(contains("specstructure.newConflicts=Billing::Invoice#total=overwrite"));
    }

    @Test
    void testExecute_NewConflictOverride() throws Exception {
        Path spec = copyExistingSpec();
        setField(mojo, "newConflicts", "Billing::Invoice#total=skip");
        setField(mojo, "reportFormat", "json");

        mojo.execute();

        assertThat(Files.readString(spec)).contains("is written by hand", "describe '.build' do");
        verify(log).info(contains("\"mode\" : \"materialize\""));
    }

    @Test
    void testExecute_UnknownPolicy() throws Exception {
        copyExistingSpec();
        setField(mojo, "onNewConflict", "ask");

        assertThrows(MojoExecutionException.class, () -> mojo.execute());
    }

    @Test
    void testExecute_NoSpecPath() throws Exception {
        Path metadata = testBaseDir.resolve("nospec.yml");
        Files.writeString(metadata, """
                class_name: Widget
                methods:
                  - name: call
                    type: instance
                """);
        setField(mojo, "metadata", metadata.toFile());

        MojoExecutionException e = assertThrows(MojoExecutionException.class, () -> mojo.execute());

        assertThat(e.getMessage()).contains("spec_path");
    }
}
