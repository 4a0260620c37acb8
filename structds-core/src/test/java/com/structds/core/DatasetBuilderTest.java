package com.structds.core;

import com.structds.core.config.ConfigurationException;
import com.structds.core.config.DatasetConfig;
import com.structds.core.extraction.FailureKind;
import com.structds.core.extractor.ParsedSource.ModuleRecord;
import com.structds.core.extractor.SourceSyntaxException;
import com.structds.core.extractor.python.PythonSourceExtractor;
import com.structds.core.filter.FilterRegistry;
import com.structds.core.model.ClassDefinition;
import com.structds.core.model.Repository;
import com.structds.core.model.RepositoryIdentity;
import com.structds.core.model.SourceModule;
import com.structds.core.serializer.RunReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link DatasetBuilder}.
 */
class DatasetBuilderTest {

    private static final RepositoryIdentity IDENTITY =
        new RepositoryIdentity("demo", "https://example.org/demo", "v1.0", "0123abcd");

    @TempDir
    Path root;

    @Test
    void build_extractsAndFiltersRepository() throws IOException {
        write("demo/core.py", """
            class Service(Base, Mixin):
                def __init__(self, name: str):
                    self.name = name

                def untyped(self):
                    pass
            """);
        write("demo/util.py", "def helper(x):\n    return x\n");
        write("tests/test_core.py", "def test_service(): pass\n");

        DatasetConfig config = configWith(List.of("TestModuleFilter", "NoStringTypeFilter", "EmptyFilter"));
        DatasetBuilder.Result result = new DatasetBuilder(config).build(root, IDENTITY);

        Repository repository = result.repository().orElseThrow();
        assertThat(repository.identity()).isEqualTo(IDENTITY);
        assertThat(repository.modules()).extracting(SourceModule::filePath).containsExactly("demo/core.py");
        ClassDefinition service = repository.modules().get(0).classes().get(0);
        assertThat(service.superclasses()).containsExactly("Base", "Mixin");
        assertThat(service.constructor()).isPresent();
        assertThat(service.methods()).hasSize(1);

        assertThat(result.extraction().repository().modules()).hasSize(3);
        assertThat(result.filters()).containsExactly("TestModuleFilter", "NoStringTypeFilter", "EmptyFilter");
    }

    @Test
    void build_syntaxError_isRecordedNotFatal() throws IOException {
        write("demo/a.py", "def a(): pass\n");
        write("demo/b.py", "def b(): pass\n");
        write("demo/broken.py", "def broken(:\n");

        DatasetBuilder.Result result = new DatasetBuilder(configWith(List.of())).build(root, IDENTITY);

        assertThat(result.repository().orElseThrow().modules()).extracting(SourceModule::filePath)
            .containsExactly("demo/a.py", "demo/b.py");
        RunReport report = result.toRunReport();
        assertThat(report.repository()).isEqualTo("demo");
        assertThat(report.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.filePath()).isEqualTo("demo/broken.py");
            assertThat(failure.kind()).isEqualTo(FailureKind.SYNTAX_ERROR);
        });
        assertThat(report.statistics().filesDiscovered()).isEqualTo(3);
        assertThat(report.exclusions()).isEmpty();
    }

    @Test
    void build_unknownFilter_failsBeforeReadingFiles() throws IOException {
        write("demo/a.py", "def a(): pass\n");
        AtomicInteger calls = new AtomicInteger();
        PythonSourceExtractor counting = new PythonSourceExtractor() {
            @Override
            public ModuleRecord extract(String filePath, String text) throws SourceSyntaxException {
                calls.incrementAndGet();
                return super.extract(filePath, text);
            }
        };
        DatasetBuilder builder = new DatasetBuilder(counting, FilterRegistry.defaults(),
            configWith(List.of("EmptyFilter", "UnknownFilter")));

        assertThatThrownBy(() -> builder.build(root, IDENTITY))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("UnknownFilter");
        assertThat(calls).hasValue(0);
    }

    @Test
    void build_unknownFilter_failsEvenForMissingRoot() {
        DatasetBuilder builder = new DatasetBuilder(configWith(List.of("UnknownFilter")));

        assertThatThrownBy(() -> builder.build(root.resolve("missing"), IDENTITY))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void build_everythingFiltered_returnsNoRepository() throws IOException {
        write("tests/test_a.py", "def test_a(): pass\n");

        DatasetBuilder.Result result = new DatasetBuilder(configWith(List.of("TestModuleFilter", "EmptyFilter")))
            .build(root, IDENTITY);

        assertThat(result.repository()).isEmpty();
        assertThat(result.toRunReport().exclusions()).hasSize(2);
    }

    @Test
    void build_isDeterministic() throws IOException {
        for (int i = 0; i < 12; i++) {
            write("demo/m" + i + ".py", "def f" + i + "(x: int) -> int:\n    return x\n");
        }
        DatasetConfig config = configWith(List.of("NoStringTypeFilter"));

        Repository first = new DatasetBuilder(config).build(root, IDENTITY).repository().orElseThrow();
        Repository second = new DatasetBuilder(config).build(root, IDENTITY).repository().orElseThrow();

        assertThat(second).isEqualTo(first);
    }

    private static DatasetConfig configWith(List<String> filters) {
        return DatasetConfig.defaults()
            .withExtraction(new DatasetConfig.ExtractionConfig(2, 60L, null))
            .withFilters(filters);
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
