package com.structds.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileUtilsTest {

    @Test
    void matchesAny_recursivePattern_matchesAtAnyDepth() {
        List<PathMatcher> matchers = FileUtils.globMatchers(List.of("**/__pycache__/**"));

        assertThat(FileUtils.matchesAny(matchers, "__pycache__/a.py")).isTrue();
        assertThat(FileUtils.matchesAny(matchers, "pkg/__pycache__/a.py")).isTrue();
        assertThat(FileUtils.matchesAny(matchers, "pkg/a.py")).isFalse();
    }

    @Test
    void directoryMatchers_stripRecursiveSuffix() {
        List<PathMatcher> matchers = FileUtils.directoryMatchers(List.of(".git/**", "docs/*.py", "**/.venv/**"));

        assertThat(FileUtils.matchesAny(matchers, ".git")).isTrue();
        assertThat(FileUtils.matchesAny(matchers, ".venv")).isTrue();
        assertThat(FileUtils.matchesAny(matchers, "sub/.venv")).isTrue();
        assertThat(FileUtils.matchesAny(matchers, "docs")).isFalse();
    }

    @Test
    void matchesAny_emptyPath_isFalse() {
        assertThat(FileUtils.matchesAny(FileUtils.globMatchers(List.of("**")), "")).isFalse();
    }

    @Test
    void relativePath_usesForwardSlashes() {
        Path root = Path.of("repo");

        assertThat(FileUtils.relativePath(root, root.resolve("pkg").resolve("a.py"))).isEqualTo("pkg/a.py");
        assertThat(FileUtils.relativePath(root, root)).isEmpty();
    }

    @Test
    void getExtension_handlesDotfilesAndMissingExtension() {
        assertThat(FileUtils.getExtension(Path.of("pkg/mod.py"))).isEqualTo("py");
        assertThat(FileUtils.getExtension(Path.of(".gitignore"))).isEmpty();
        assertThat(FileUtils.getExtension(Path.of("Makefile"))).isEmpty();
    }
}
