package com.structds;

import com.structds.cli.ExitCodes;
import com.structds.core.model.Dataset;
import com.structds.core.model.Repository;
import com.structds.core.model.SourceModule;
import com.structds.core.serializer.DatasetReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Command line tests running each subcommand against a small checkout.
 */
@DisplayName("StructDS command line")
class StructDsCLITest {

    @TempDir
    Path tempDir;

    private Path checkout;

    @BeforeEach
    void createCheckout() throws IOException {
        checkout = tempDir.resolve("checkout");
        write("demo/__init__.py", "");
        write("demo/core.py", """
            class Client(Base):
                def __init__(self, url: str) -> None:
                    self.url = url

                def close(self):
                    pass

            def connect(url: str) -> Client:
                return Client(url)
            """);
        write("tests/test_core.py", "def test_connect():\n    assert connect('x')\n");
        write("demo/legacy.py", "def legacy(:)\n    pass\n");
    }

    @Test
    @DisplayName("extract writes the filtered dataset and the run report")
    void extract_writesDatasetAndReport() throws IOException {
        Path output = tempDir.resolve("out/dataset.json");
        Path report = tempDir.resolve("out/report.json");

        int exitCode = execute("extract", checkout.toString(), "--name", "demo", "--tag", "v1.0",
            "--filters", "TestModuleFilter,EmptyFilter", "-w", "2", "-o", output.toString(),
            "--report", report.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        Dataset dataset = new DatasetReader().read(output);
        Repository repository = dataset.repositories().get(0);
        assertThat(repository.name()).isEqualTo("demo");
        assertThat(repository.pypiTag()).isEqualTo("v1.0");
        assertThat(repository.modules()).extracting(SourceModule::filePath).containsExactly("demo/core.py");
        assertThat(Files.readString(report)).contains("\"syntax_error\"", "tests/test_core.py");
    }

    @Test
    @DisplayName("extract rejects an unknown filter before writing anything")
    void extract_unknownFilter_returnsConfigurationError() {
        Path output = tempDir.resolve("dataset.json");

        int exitCode = execute("extract", checkout.toString(), "--filters", "UnknownFilter", "-o", output.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIGURATION_ERROR);
        assertThat(output).doesNotExist();
    }

    @Test
    @DisplayName("extract fails with an I/O error for a missing checkout")
    void extract_missingCheckout_returnsIoError() {
        int exitCode = execute("extract", tempDir.resolve("missing").toString(),
            "-o", tempDir.resolve("dataset.json").toString());

        assertThat(exitCode).isEqualTo(ExitCodes.IO_ERROR);
    }

    @Test
    @DisplayName("extract reads filters from the configuration file of the checkout")
    void extract_usesConfigurationFile() throws IOException {
        write("structds.yaml", """
            filters:
              - NoStringTypeFilter
              - EmptyFilter
            """);
        Path output = tempDir.resolve("dataset.json");

        int exitCode = execute("extract", checkout.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        SourceModule core = new DatasetReader().read(output).repositories().get(0).modules().get(0);
        assertThat(core.filePath()).isEqualTo("demo/core.py");
        assertThat(core.classes().get(0).methods()).hasSize(1);
    }

    @Test
    @DisplayName("extract aborts on a malformed configuration file")
    void extract_malformedConfiguration_returnsConfigurationError() throws IOException {
        write("structds.yaml", "filters: [EmptyFilter\nextraction: : :\n");
        Path output = tempDir.resolve("dataset.json");

        int exitCode = execute("extract", checkout.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIGURATION_ERROR);
        assertThat(output).doesNotExist();
    }

    @Test
    @DisplayName("extract reports Python 2 files as syntax errors")
    void extract_python2Source_isReportedAsSyntaxError() throws IOException {
        write("demo/py2.py", "print \"hello\"\n");
        Path output = tempDir.resolve("dataset.json");
        Path report = tempDir.resolve("report.json");

        int exitCode = execute("extract", checkout.toString(), "-o", output.toString(), "--report", report.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(Files.readString(report)).contains("demo/py2.py", "\"syntax_error\"");
        assertThat(new DatasetReader().read(output).repositories().get(0).modules())
            .extracting(SourceModule::filePath)
            .doesNotContain("demo/py2.py");
    }

    @Test
    @DisplayName("filter re-applies a chain to an existing dataset")
    void filter_appliesChainToDataset() throws IOException {
        Path extracted = tempDir.resolve("all.json");
        Path filtered = tempDir.resolve("str.json");
        Path report = tempDir.resolve("exclusions.json");
        assertThat(execute("extract", checkout.toString(), "--name", "demo", "-o", extracted.toString()))
            .isEqualTo(ExitCodes.OK);

        int exitCode = execute("filter", extracted.toString(), "--filters", "StrTypeFilter,EmptyFilter",
            "-o", filtered.toString(), "--report", report.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        Repository repository = new DatasetReader().read(filtered).repositories().get(0);
        assertThat(repository.modules()).extracting(SourceModule::filePath).containsExactly("demo/core.py");
        assertThat(Files.readString(report)).contains("tests/test_core.py");
    }

    @Test
    @DisplayName("filter rejects an unknown filter")
    void filter_unknownFilter_returnsConfigurationError() {
        Path extracted = tempDir.resolve("all.json");
        execute("extract", checkout.toString(), "-o", extracted.toString());

        int exitCode = execute("filter", extracted.toString(), "--filters", "Nope", "-o",
            tempDir.resolve("out.json").toString());

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIGURATION_ERROR);
    }

    @Test
    @DisplayName("stats and provide read a written dataset")
    void statsAndProvide_readDataset() {
        Path extracted = tempDir.resolve("all.json");
        Path callables = tempDir.resolve("callables");
        execute("extract", checkout.toString(), "--name", "demo", "-o", extracted.toString());

        assertThat(execute("stats", extracted.toString())).isEqualTo(ExitCodes.OK);
        assertThat(execute("stats", extracted.toString(), "--json")).isEqualTo(ExitCodes.OK);
        assertThat(execute("provide", extracted.toString(), "-o", callables.toString())).isEqualTo(ExitCodes.OK);

        assertThat(callables.resolve("demo/demo.core/connect.py")).exists();
        assertThat(callables.resolve("demo/demo.core/Client/__init__.py")).exists();
    }

    @Test
    @DisplayName("provide --without-type-annotations writes untyped callables")
    void provide_withoutTypeAnnotations_stripsAnnotations() throws IOException {
        Path extracted = tempDir.resolve("all.json");
        Path callables = tempDir.resolve("untyped");
        execute("extract", checkout.toString(), "--name", "demo", "-o", extracted.toString());

        int exitCode = execute("provide", extracted.toString(), "-o", callables.toString(),
            "--without-type-annotations");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(Files.readString(callables.resolve("demo/demo.core/connect.py")))
            .isEqualTo("def connect(url):\n    return Client(url)\n");
        assertThat(Files.readString(callables.resolve("demo/demo.core/Client/__init__.py")))
            .isEqualTo("def __init__(self, url):\n        self.url = url\n");
    }

    @Test
    @DisplayName("stats --latex-output writes a LaTeX table")
    void stats_latexOutput_writesTable() throws IOException {
        Path extracted = tempDir.resolve("all.json");
        Path table = tempDir.resolve("paper/stats.tex");
        execute("extract", checkout.toString(), "--name", "demo", "-o", extracted.toString());

        int exitCode = execute("stats", extracted.toString(), "--latex-output", table.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(Files.readString(table))
            .contains("\\begin{tabular}")
            .contains("    demo & ");
    }

    @Test
    @DisplayName("stats fails with an I/O error for a missing dataset")
    void stats_missingDataset_returnsIoError() {
        assertThat(execute("stats", tempDir.resolve("missing.json").toString())).isEqualTo(ExitCodes.IO_ERROR);
    }

    @Test
    @DisplayName("list succeeds")
    void list_returnsOk() {
        assertThat(execute("list")).isEqualTo(ExitCodes.OK);
    }

    private int execute(String... args) {
        return StructDsCLI.commandLine().execute(args);
    }

    private void write(String relative, String content) throws IOException {
        Path file = checkout.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
