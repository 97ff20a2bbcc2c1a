package com.specstructure.maven;

import static com.specstructure.maven.MojoTestSupport.setField;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.verify;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StripMarkersMojoTest {

    @Mock
    private Log log;

    private StripMarkersMojo mojo;
    private Path spec;

    @BeforeEach
    void setUp() throws Exception {
        Path testBaseDir = MojoTestSupport.testBaseDir(getClass());
        spec = testBaseDir.resolve("invoice_spec.rb");
        Files.copy(Path.of("src/test/resources/fixtures/invoice_spec.rb"), spec, StandardCopyOption.REPLACE_EXISTING);

        mojo = new StripMarkersMojo();
        mojo.setLog(log);
        setField(mojo, "target", spec.toFile());
    }

    @Test
    void testExecute_RemovesMarkers() throws Exception {
        mojo.execute();

        String content = Files.readString(spec);
        assertThat(content).doesNotContain("rspec-testing:");
        assertThat(content).contains("  describe '#total' do\n    subject(:result) { instance.total }\n");
        verify(log).info(contains("Removed 2 marker line(s)"));
    }

    @Test
    void testExecute_SecondRunIsNoop() throws Exception {
        mojo.execute();
        String once = Files.readString(spec);

        mojo.execute();

        assertThat(Files.readString(spec)).isEqualTo(once);
        verify(log).info(contains("No markers in"));
    }

    @Test
    void testExecute_MissingTarget() throws Exception {
        setField(mojo, "target", spec.resolveSibling("missing_spec.rb").toFile());

        assertThrows(MojoExecutionException.class, () -> mojo.execute());
    }
}
