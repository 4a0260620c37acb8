package com.structds.core.assembler;

import com.structds.core.extractor.ParsedSource.ClassRecord;
import com.structds.core.extractor.ParsedSource.FunctionRecord;
import com.structds.core.extractor.ParsedSource.ModuleRecord;
import com.structds.core.model.ClassDefinition;
import com.structds.core.model.FunctionDefinition;
import com.structds.core.model.MethodDefinition;
import com.structds.core.model.Parameter;
import com.structds.core.model.Repository;
import com.structds.core.model.RepositoryIdentity;
import com.structds.core.model.SourceModule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link EntityAssembler}.
 */
class EntityAssemblerTest {

    private final EntityAssembler assembler = new EntityAssembler("__init__");

    @Test
    void moduleName_dropsExtensionAndUsesDots() {
        assertThat(EntityAssembler.moduleName("src/pkg/core.py")).isEqualTo("src.pkg.core");
        assertThat(EntityAssembler.moduleName("pkg/__init__.py")).isEqualTo("pkg.__init__");
        assertThat(EntityAssembler.moduleName("setup.py")).isEqualTo("setup");
    }

    @Test
    void assembleModule_mapsFunctionsAndClasses() {
        FunctionRecord helper = new FunctionRecord("helper",
            List.of(Parameter.positional("x", "int", 4, 12)),
            List.of("@cache", "@trace(level=2)"), "int", "    return x", 4, 5, false);
        FunctionRecord init = new FunctionRecord("__init__",
            List.of(Parameter.positional("self", null, 8, 18)), List.of(), null, "        pass", 8, 9, false);
        FunctionRecord run = new FunctionRecord("run",
            List.of(Parameter.positional("self", null, 10, 13)), List.of(), null, "        pass", 10, 9, true);
        ClassRecord worker = new ClassRecord("Worker", List.of("Base"), List.of(), List.of(init, run), List.of(), 7);

        SourceModule module = assembler.assembleModule(
            new ModuleRecord("pkg/jobs.py", List.of(helper), List.of(worker)));

        assertThat(module.name()).isEqualTo("pkg.jobs");
        assertThat(module.filePath()).isEqualTo("pkg/jobs.py");

        FunctionDefinition function = module.functions().get(0);
        assertThat(function.annotations()).isEqualTo("@cache\n@trace(level=2)");
        assertThat(function.file()).isEqualTo("pkg/jobs.py");
        assertThat(function.fullSignature()).isEqualTo("@cache\n@trace(level=2)\nhelper(x: int) -> int");

        ClassDefinition type = module.classes().get(0);
        assertThat(type.file()).isEqualTo("pkg/jobs.py");
        assertThat(type.superclasses()).containsExactly("Base");
        assertThat(type.methods()).extracting(MethodDefinition::identifier).containsExactly("__init__", "run");
        assertThat(type.methods()).extracting(MethodDefinition::constructor).containsExactly(true, false);
        assertThat(type.constructor()).map(MethodDefinition::identifier).hasValue("__init__");
    }

    @Test
    void assembleModule_carriesAsyncFlag() {
        FunctionRecord fetch = new FunctionRecord("fetch", List.of(), List.of("@retry"), null, "    pass", 2, 11, true);
        FunctionRecord poll = new FunctionRecord("poll",
            List.of(Parameter.positional("self", null, 5, 20)), List.of(), null, "        pass", 5, 15, true);
        ClassRecord client = new ClassRecord("Client", List.of(), List.of(), List.of(poll), List.of(), 4);

        SourceModule module = assembler.assembleModule(
            new ModuleRecord("net.py", List.of(fetch), List.of(client)));

        FunctionDefinition function = module.functions().get(0);
        assertThat(function.async()).isTrue();
        assertThat(function.fullSignature()).isEqualTo("@retry\nasync fetch()");
        MethodDefinition method = module.classes().get(0).methods().get(0);
        assertThat(method.async()).isTrue();
        assertThat(method.fullSignature()).isEqualTo("async poll(self)");
    }

    @Test
    void assemble_keepsIdentityAndModuleOrder() {
        RepositoryIdentity identity = new RepositoryIdentity("demo", "https://example.org/demo", "1.0", "abc123");

        Repository repository = assembler.assemble(identity, List.of(
            new ModuleRecord("b.py", List.of(), List.of()),
            new ModuleRecord("a.py", List.of(), List.of())
        ));

        assertThat(repository.identity()).isEqualTo(identity);
        assertThat(repository.modules()).extracting(SourceModule::filePath).containsExactly("b.py", "a.py");
    }

    @Test
    void assemble_duplicatePaths_throws() {
        RepositoryIdentity identity = new RepositoryIdentity("demo", null, null, null);
        List<ModuleRecord> modules = List.of(
            new ModuleRecord("a.py", List.of(), List.of()),
            new ModuleRecord("a.py", List.of(), List.of())
        );

        assertThatThrownBy(() -> assembler.assemble(identity, modules))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate module path");
    }
}
