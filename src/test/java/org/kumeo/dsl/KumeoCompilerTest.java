package org.kumeo.dsl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.kumeo.dsl.error.CompilationException;
import org.kumeo.dsl.error.LexError;
import org.kumeo.dsl.error.ParseError;
import org.kumeo.dsl.error.SemanticErrors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class KumeoCompilerTest {

    private static final String VALID = """
        workflow Alerts {
            source: NATS("events")
            target: NATS("alerts")
            agents: [LLM(id: "triage", engine: "ollama/llama3", prompt: "Classify {{input}}")]
        }
        """;

    @Test
    void compile_validSource_returnsProgram() throws CompilationException {
        var program = KumeoCompiler.create().compile(VALID);

        assertEquals("Alerts", program.workflows().get(0).name());
    }

    @Test
    void compile_fullFixture_succeeds() throws CompilationException {
        var program = KumeoCompiler.create().compile(Fixtures.load("pipeline.kumeo"));

        assertEquals(1, program.integrations().size());
    }

    @Test
    void compile_semanticErrors_throwWholeBatch() {
        var exception = assertThrows(CompilationException.class,
                                     () -> KumeoCompiler.create().compile(Fixtures.load("invalid.kumeo")));

        var errors = assertInstanceOf(SemanticErrors.class, exception.error());
        assertEquals(6, errors.size());
        assertThat(exception.format(Fixtures.load("invalid.kumeo"), "invalid.kumeo"))
            .contains("--> invalid.kumeo:1:10")
            .contains("error[E0210]");
    }

    @Test
    void compile_lexError_isSingleError() {
        var exception = assertThrows(CompilationException.class, () -> KumeoCompiler.create().compile("workflow $"));

        assertInstanceOf(LexError.class, exception.error());
    }

    @Test
    void compile_parseError_isSingleError() {
        var exception = assertThrows(CompilationException.class,
                                     () -> KumeoCompiler.create().compile("workflow W { source NATS }"));

        assertInstanceOf(ParseError.UnexpectedInput.class, exception.error());
        assertEquals(1, exception.error().diagnostics().size());
    }

    @Test
    void compile_withAnalysisDisabled_skipsSemanticChecks() throws CompilationException {
        var compiler = KumeoCompiler.builder()
                                    .semanticAnalysis(false)
                                    .build();

        var program = compiler.compile("workflow Lonely { }");

        assertTrue(program.workflows().get(0).source().isEmpty());
        assertFalse(compiler.config().semanticAnalysis());
    }

    @Test
    void parse_inputOverConfiguredLimit_isRejected() {
        var compiler = KumeoCompiler.builder()
                                    .maxInputSize(10)
                                    .build();

        assertThrows(IllegalArgumentException.class, () -> compiler.parse(VALID));
    }

    @Test
    void config_nonPositiveLimit_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CompilerConfig(0, 16, true));
        assertThrows(IllegalArgumentException.class, () -> new CompilerConfig(100, 0, true));
        assertThrows(IllegalArgumentException.class, () -> KumeoCompiler.builder().maxInputSize(-1).build());
        assertThrows(IllegalArgumentException.class, () -> KumeoCompiler.builder().maxNestingDepth(-1).build());
    }

    @Test
    void check_deeplyNestedValue_reportsParseErrorInsteadOfOverflowing() {
        var levels = 20_000;
        var source = "workflow W {\n    monitor: {k: " + "[".repeat(levels) + "]".repeat(levels) + "}\n}";

        var report = KumeoCompiler.create().check(source);

        assertFalse(report.isValid());
        assertTrue(report.program().isEmpty());
        var issue = report.errors().get(0);
        assertEquals("E0103", issue.code());
        assertThat(issue.message()).contains("nested deeper than 128 levels");
        assertEquals(2, issue.line());
    }

    @Test
    void parse_nestingWithinConfiguredDepth_succeeds() throws CompilationException {
        var compiler = KumeoCompiler.builder()
                                    .maxNestingDepth(3)
                                    .build();

        compiler.parse("workflow W { monitor: {a: [{b: 1}]} }");
        var exception = assertThrows(CompilationException.class,
                                     () -> compiler.parse("workflow W { monitor: {a: [[{b: 1}]]} }"));
        assertInstanceOf(ParseError.InvalidConstruct.class, exception.error());
        assertEquals(3, compiler.config().maxNestingDepth());
    }

    @Test
    void analyze_returnsBatchWithoutThrowing() throws CompilationException {
        var compiler = KumeoCompiler.create();

        var result = compiler.analyze(compiler.parse("workflow W { }"));

        assertEquals(2, result.errorCount());
    }

    @Test
    void check_validSource_reportsValid() {
        var report = KumeoCompiler.create().check(VALID);

        assertTrue(report.isValid());
        assertTrue(report.program().isPresent());
        assertTrue(report.errors().isEmpty());
    }

    @Test
    void check_semanticErrors_keepsProgramAndListsEveryError() {
        var report = KumeoCompiler.create().check(Fixtures.load("invalid.kumeo"));

        assertFalse(report.isValid());
        assertTrue(report.program().isPresent());
        assertEquals(6, report.errors().size());
        var first = report.errors().get(0);
        assertEquals("E0203", first.code());
        assertEquals("Workflow 'Broken' has no target", first.message());
        assertEquals(1, first.line());
        assertEquals(10, first.column());
    }

    @Test
    void check_parseError_reportsWithoutThrowing() {
        var report = KumeoCompiler.create().check("workflow Main {\n    source NATS(\"in\")\n}");

        assertFalse(report.isValid());
        assertTrue(report.program().isEmpty());
        var issue = report.errors().get(0);
        assertEquals("E0101", issue.code());
        assertEquals(2, issue.line());
        assertEquals(12, issue.column());
    }

    @Test
    void check_toJson_rendersValidityAndErrors() throws Exception {
        var report = KumeoCompiler.create().check("workflow Main { source: NATS(\"in\") }");

        var json = new ObjectMapper().readTree(report.toJson());

        assertFalse(json.get("valid").asBoolean());
        assertEquals(1, json.get("errors").size());
        var error = json.get("errors").get(0);
        assertEquals("E0203", error.get("code").asText());
        assertEquals("Workflow 'Main' has no target", error.get("message").asText());
        assertEquals(1, error.get("line").asInt());
        assertEquals(10, error.get("column").asInt());
    }

    @Test
    void check_lexError_reportsLocation() {
        var report = KumeoCompiler.create().check("workflow A {\n    source: @\n}");

        var issue = report.errors().get(0);
        assertEquals("E0001", issue.code());
        assertEquals(2, issue.line());
        assertEquals(13, issue.column());
    }

    @Test
    void compiler_isReusableAcrossCalls() throws CompilationException {
        var compiler = KumeoCompiler.create();

        assertFalse(compiler.check("workflow W { }").isValid());
        assertEquals(1, compiler.compile(VALID).workflows().size());
    }
}
