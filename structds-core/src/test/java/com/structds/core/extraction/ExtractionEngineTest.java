package com.structds.core.extraction;

import com.structds.core.assembler.EntityAssembler;
import com.structds.core.config.ConfigurationException;
import com.structds.core.extractor.ParsedSource.ModuleRecord;
import com.structds.core.extractor.SourceExtractor;
import com.structds.core.extractor.SourceSyntaxException;
import com.structds.core.extractor.python.PythonSourceExtractor;
import com.structds.core.loader.SourceSet;
import com.structds.core.loader.SourceUnit;
import com.structds.core.loader.UnreadableSource;
import com.structds.core.model.RepositoryIdentity;
import com.structds.core.model.SourceModule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ExtractionEngine}.
 */
class ExtractionEngineTest {

    private static final RepositoryIdentity IDENTITY = new RepositoryIdentity("demo", "https://example.org/demo", "1.0", "abc");

    private final EntityAssembler assembler = new EntityAssembler("__init__");

    @Test
    void extract_syntaxErrorInOneFile_keepsTheOthers() {
        SourceSet sources = new SourceSet(List.of(
            new SourceUnit("pkg/a.py", "def a(x: int) -> int:\n    return x\n"),
            new SourceUnit("pkg/bad.py", "def broken(:)\n    pass\n"),
            new SourceUnit("pkg/c.py", "class C:\n    def m(self):\n        pass\n")
        ), List.of());

        ExtractionResult result = engine(new PythonSourceExtractor(), 4, Duration.ZERO).extract(IDENTITY, sources);

        assertThat(result.repository().modules()).extracting(SourceModule::filePath)
            .containsExactly("pkg/a.py", "pkg/c.py");
        assertThat(result.failures()).hasSize(1);
        ExtractionFailure failure = result.failures().get(0);
        assertThat(failure.filePath()).isEqualTo("pkg/bad.py");
        assertThat(failure.kind()).isEqualTo(FailureKind.SYNTAX_ERROR);
        assertThat(failure.line()).isEqualTo(1);
        assertThat(failure.column()).isEqualTo(12);

        ExtractionStatistics statistics = result.statistics();
        assertThat(statistics.filesDiscovered()).isEqualTo(3);
        assertThat(statistics.filesParsed()).isEqualTo(2);
        assertThat(statistics.filesFailed()).isEqualTo(1);
        assertThat(statistics.errorCounts()).containsEntry("SYNTAX_ERROR", 1);
        assertThat(result.hasFailures()).isTrue();
    }

    @Test
    void extract_python2PrintStatement_isSyntaxError() {
        SourceSet sources = new SourceSet(List.of(
            new SourceUnit("legacy.py", "print \"x\"\n"),
            new SourceUnit("modern.py", "print(\"x\")\n")
        ), List.of());

        ExtractionResult result = engine(new PythonSourceExtractor(), 2, Duration.ZERO).extract(IDENTITY, sources);

        assertThat(result.repository().modules()).extracting(SourceModule::filePath).containsExactly("modern.py");
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.filePath()).isEqualTo("legacy.py");
            assertThat(failure.kind()).isEqualTo(FailureKind.SYNTAX_ERROR);
            assertThat(failure.message()).isEqualTo("invalid syntax");
        });
    }

    @Test
    void extract_moduleOrderFollowsSourceOrderRegardlessOfWorkers() {
        List<SourceUnit> units = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            units.add(new SourceUnit(String.format("m%02d.py", i), "def f" + i + "():\n    pass\n"));
        }
        SourceSet sources = new SourceSet(units, List.of());

        ExtractionResult single = engine(new PythonSourceExtractor(), 1, Duration.ZERO).extract(IDENTITY, sources);
        ExtractionResult parallel = engine(new PythonSourceExtractor(), 8, Duration.ZERO).extract(IDENTITY, sources);

        assertThat(parallel.repository()).isEqualTo(single.repository());
        assertThat(parallel.repository().modules()).hasSize(40);
    }

    @Test
    void extract_unreadableSources_becomeIoFailures() {
        SourceSet sources = new SourceSet(
            List.of(new SourceUnit("ok.py", "x = 1\n")),
            List.of(new UnreadableSource("broken.py", "MalformedInputException: Input length = 1")));

        ExtractionResult result = engine(new PythonSourceExtractor(), 2, Duration.ZERO).extract(IDENTITY, sources);

        assertThat(result.repository().modules()).hasSize(1);
        assertThat(result.failures()).extracting(ExtractionFailure::kind).containsExactly(FailureKind.IO_FAILURE);
        assertThat(result.statistics().filesDiscovered()).isEqualTo(2);
        assertThat(result.statistics().filesFailed()).isEqualTo(1);
    }

    @Test
    void extract_extractorCrash_becomesInternalError() {
        SourceExtractor crashing = new StubExtractor() {
            @Override
            public ModuleRecord extract(String filePath, String text) {
                if (filePath.equals("boom.py")) {
                    throw new IllegalStateException("boom");
                }
                return new ModuleRecord(filePath, List.of(), List.of());
            }
        };
        SourceSet sources = new SourceSet(List.of(
            new SourceUnit("boom.py", ""),
            new SourceUnit("fine.py", "")
        ), List.of());

        ExtractionResult result = engine(crashing, 2, Duration.ZERO).extract(IDENTITY, sources);

        assertThat(result.repository().modules()).extracting(SourceModule::filePath).containsExactly("fine.py");
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.kind()).isEqualTo(FailureKind.INTERNAL_ERROR);
            assertThat(failure.message()).contains("boom");
        });
    }

    @Test
    void extract_timeoutExpires_cancelsUnfinishedFiles() {
        CountDownLatch never = new CountDownLatch(1);
        SourceExtractor slow = new StubExtractor() {
            @Override
            public ModuleRecord extract(String filePath, String text) {
                if (filePath.equals("slow.py")) {
                    try {
                        never.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException("interrupted", e);
                    }
                }
                return new ModuleRecord(filePath, List.of(), List.of());
            }
        };
        SourceSet sources = new SourceSet(List.of(
            new SourceUnit("a.py", ""),
            new SourceUnit("slow.py", "")
        ), List.of());

        ExtractionResult result = engine(slow, 2, Duration.ofMillis(500)).extract(IDENTITY, sources);

        assertThat(result.repository().modules()).extracting(SourceModule::filePath).containsExactly("a.py");
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.filePath()).isEqualTo("slow.py");
            assertThat(failure.kind()).isEqualTo(FailureKind.CANCELLED);
        });
    }

    @Test
    void extract_noSources_returnsEmptyRepository() {
        ExtractionResult result = engine(new PythonSourceExtractor(), 2, Duration.ZERO)
            .extract(IDENTITY, new SourceSet(List.of(), List.of()));

        assertThat(result.repository().modules()).isEmpty();
        assertThat(result.failures()).isEmpty();
        assertThat(result.statistics().getSuccessRate()).isZero();
    }

    @Test
    void constructor_invalidWorkers_throws() {
        assertThatThrownBy(() -> engine(new PythonSourceExtractor(), 0, Duration.ZERO))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("workers");
    }

    @Test
    void constructor_negativeTimeout_throws() {
        assertThatThrownBy(() -> engine(new PythonSourceExtractor(), 1, Duration.ofSeconds(-1)))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("timeout");
    }

    private ExtractionEngine engine(SourceExtractor extractor, int workers, Duration timeout) {
        return new ExtractionEngine(extractor, assembler, workers, timeout);
    }

    private abstract static class StubExtractor implements SourceExtractor {
        @Override
        public String getLanguage() {
            return "python";
        }

        @Override
        public String getFileExtension() {
            return "py";
        }

        @Override
        public String getInitializerName() {
            return "__init__";
        }

        @Override
        public abstract ModuleRecord extract(String filePath, String text) throws SourceSyntaxException;

        @Override
        public String removeTypeAnnotations(String filePath, String text) {
            return text;
        }
    }
}
