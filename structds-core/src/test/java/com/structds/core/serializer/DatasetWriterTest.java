package com.structds.core.serializer;

import com.fasterxml.jackson.databind.JsonNode;
import com.structds.core.extraction.ExtractionFailure;
import com.structds.core.extraction.ExtractionStatistics;
import com.structds.core.extraction.FailureKind;
import com.structds.core.filter.FilterExclusion;
import com.structds.core.filter.FilterScope;
import com.structds.core.model.ClassDefinition;
import com.structds.core.model.FieldDescriptor;
import com.structds.core.model.FunctionDefinition;
import com.structds.core.model.MethodDefinition;
import com.structds.core.model.Parameter;
import com.structds.core.model.ParameterKind;
import com.structds.core.model.Repository;
import com.structds.core.model.SourceModule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DatasetWriter} and {@link DatasetReader}.
 */
class DatasetWriterTest {

    @TempDir
    Path tempDir;

    private final DatasetWriter writer = new DatasetWriter();
    private final DatasetReader reader = new DatasetReader();

    static Repository sampleRepository() {
        FunctionDefinition function = new FunctionDefinition("load",
            List.of(new Parameter("path", "str", 3, 10, ParameterKind.POSITIONAL),
                new Parameter("options", null, 3, 21, ParameterKind.VAR_KEYWORD)),
            "@cache", null, "    return open(path)", "pkg/io.py", 3, 5);
        MethodDefinition init = new MethodDefinition("__init__",
            List.of(Parameter.positional("self", null, 7, 18)), "", null, "        self.x = 1", true, 7, 9);
        ClassDefinition reader = new ClassDefinition("Reader", List.of(init), List.of("Base"),
            List.of(new FieldDescriptor("mode", "str")), "pkg/io.py");
        SourceModule module = new SourceModule("pkg.io", "pkg/io.py", List.of(function), List.of(reader));
        return new Repository("demo", "https://example.org/demo", "1.0", "abc123", List.of(module));
    }

    @Test
    void write_usesSnakeCaseFieldsAndExplicitNulls() throws IOException {
        Path target = tempDir.resolve("out/dataset.json");

        writer.write(List.of(sampleRepository()), target);

        JsonNode root = DatasetJson.mapper().readTree(target.toFile());
        assertThat(root.isArray()).isTrue();
        JsonNode repository = root.get(0);
        assertThat(repository.get("pypi_tag").asText()).isEqualTo("1.0");
        assertThat(repository.get("git_commit_hash").asText()).isEqualTo("abc123");

        JsonNode module = repository.get("modules").get(0);
        assertThat(module.get("file_path").asText()).isEqualTo("pkg/io.py");

        JsonNode function = module.get("functions").get(0);
        assertThat(function.has("return")).isTrue();
        assertThat(function.get("return").isNull()).isTrue();
        assertThat(function.get("line_number").asInt()).isEqualTo(3);
        assertThat(function.get("col_offset").asInt()).isEqualTo(5);
        assertThat(function.get("signature").asText()).isEqualTo("load(path: str, **options)");
        assertThat(function.get("full_signature").asText()).isEqualTo("@cache\nload(path: str, **options)");
        assertThat(function.get("parameters").get(1).get("kind").asText()).isEqualTo("var_keyword");

        JsonNode method = module.get("classes").get(0).get("methods").get(0);
        assertThat(method.get("constructor").asBoolean()).isTrue();
        assertThat(method.has("has_type_information")).isFalse();
    }

    @Test
    void read_restoresWrittenRepository() throws IOException {
        Path target = tempDir.resolve("dataset.json");
        writer.write(List.of(sampleRepository()), target);

        assertThat(reader.read(target).repositories()).containsExactly(sampleRepository());
    }

    @Test
    void asyncFlag_survivesWriteAndRead() throws IOException {
        FunctionDefinition fetch = new FunctionDefinition("fetch",
            List.of(Parameter.positional("url", null, 1, 17)), "", null, "    return await get(url)",
            "m.py", 1, 11, true);
        MethodDefinition run = new MethodDefinition("run",
            List.of(Parameter.positional("self", null, 3, 19)), "", null, "        pass", false, 3, 15, true);
        Repository repository = new Repository("demo", "", "", "", List.of(new SourceModule("m", "m.py",
            List.of(fetch), List.of(new ClassDefinition("Job", List.of(run), List.of(), List.of(), "m.py")))));
        Path target = tempDir.resolve("async.json");

        writer.write(List.of(repository), target);

        JsonNode function = DatasetJson.mapper().readTree(target.toFile())
            .get(0).get("modules").get(0).get("functions").get(0);
        assertThat(function.get("async").asBoolean()).isTrue();
        assertThat(function.get("full_signature").asText()).isEqualTo("async fetch(url)");

        Repository restored = reader.read(target).repositories().get(0);
        assertThat(restored).isEqualTo(repository);
        assertThat(restored.modules().get(0).functions().get(0).async()).isTrue();
        assertThat(restored.modules().get(0).classes().get(0).methods().get(0).async()).isTrue();
    }

    @Test
    void read_recomputesStoredSignatures() throws IOException {
        Path target = tempDir.resolve("edited.json");
        Files.writeString(target, """
            [{
              "name": "demo",
              "modules": [{
                "name": "m",
                "file_path": "m.py",
                "functions": [{
                  "identifier": "f",
                  "parameters": [{"identifier": "x", "type": "int", "line_number": 1, "col_offset": 7}],
                  "annotations": "",
                  "return": "int",
                  "body": "pass",
                  "signature": "stale()",
                  "full_signature": "stale()",
                  "line_number": 1,
                  "col_offset": 5,
                  "extra": true
                }]
              }]
            }]
            """);

        FunctionDefinition function = reader.read(target).repositories().get(0).modules().get(0).functions().get(0);

        assertThat(function.signature()).isEqualTo("f(x: int) -> int");
        assertThat(function.parameters().get(0).kind()).isEqualTo(ParameterKind.POSITIONAL);
        assertThat(function.async()).isFalse();
    }

    @Test
    void read_singleRepositoryObject_isAccepted() throws IOException {
        Path target = tempDir.resolve("single.json");
        Files.writeString(target, writer.toJson(sampleRepository()));

        assertThat(reader.read(target).repositories()).containsExactly(sampleRepository());
    }

    @Test
    void writeReport_keepsFailuresAndExclusionsApart() throws IOException {
        RunReport report = new RunReport("demo", List.of("EmptyFilter"),
            new ExtractionStatistics.Builder().filesDiscovered(2).incrementFilesParsed().incrementFilesFailed()
                .addError("SYNTAX_ERROR", "bad.py:1:1: SYNTAX_ERROR invalid syntax").build(),
            List.of(new ExtractionFailure("bad.py", FailureKind.SYNTAX_ERROR, "invalid syntax", 1, 1)),
            List.of(new FilterExclusion("EmptyFilter", FilterScope.MODULE, "demo", "empty.py")));
        Path target = tempDir.resolve("report.json");

        writer.writeReport(report, target);

        JsonNode root = DatasetJson.mapper().readTree(target.toFile());
        assertThat(root.get("failures").get(0).get("kind").asText()).isEqualTo("syntax_error");
        assertThat(root.get("exclusions").get(0).get("scope").asText()).isEqualTo("MODULE");
        assertThat(root.get("statistics").get("files_failed").asInt()).isEqualTo(1);
        assertThat(root.get("statistics").has("summary")).isFalse();
        assertThat(DatasetJson.mapper().treeToValue(root, RunReport.class)).isEqualTo(report);
    }
}
