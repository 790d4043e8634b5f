package org.kumeo.dsl.error;

import org.junit.jupiter.api.Test;
import org.kumeo.dsl.lexer.Lexer;
import org.kumeo.dsl.parser.Parser;
import org.kumeo.dsl.semantic.SemanticAnalyzer;
import org.kumeo.dsl.tree.LineIndex;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    @Test
    void format_semanticError_rendersHeaderSnippetAndHelp() throws CompilationException {
        var source = "workflow Main { }";
        var result = new SemanticAnalyzer().analyze(Parser.parse(source));

        var rendered = result.errors()
                             .get(0)
                             .toDiagnostic()
                             .format(source, "main.kumeo");

        assertEquals("""
                     error[E0202]: Workflow 'Main' has no source
                       --> main.kumeo:1:10
                       |
                     1 | workflow Main { }
                       |          ^^^^
                       |
                       = help: add a section such as source: NATS("events")
                     """, rendered);
    }

    @Test
    void format_lexError_labelsInvalidToken() {
        var source = "workflow A {\n    source: @\n}";
        var exception = assertThrows(CompilationException.class, () -> Lexer.tokenize(source));

        var rendered = exception.format(source, "a.kumeo");

        assertThat(rendered).contains("error[E0001]: Unexpected character")
                            .contains("--> a.kumeo:2:13")
                            .contains("2 |     source: @")
                            .contains("^ invalid token");
    }

    @Test
    void format_semanticBatch_rendersEveryError() throws CompilationException {
        var source = "workflow Main { }";
        var result = new SemanticAnalyzer().analyze(Parser.parse(source));

        var rendered = result.formatDiagnostics(source, "main.kumeo");

        assertThat(rendered).contains("error[E0202]")
                            .contains("error[E0203]");
    }

    @Test
    void format_duplicateName_labelsBothDeclarations() throws CompilationException {
        var source = """
            workflow Main { }
            subworkflow S { input: ["a"] output: ["b"] }
            workflow Main { }
            """;
        var result = new SemanticAnalyzer().analyze(Parser.parse(source));

        var rendered = result.errors()
                             .get(0)
                             .toDiagnostic()
                             .format(source, "dup.kumeo");

        assertEquals("""
                     error[E0201]: Duplicate workflow name: Main
                       --> dup.kumeo:3:10
                       |
                     1 | workflow Main { }
                       |          ---- first declared here
                     ...
                     3 | workflow Main { }
                       |          ^^^^ declared again here
                       |
                       = help: workflows and subworkflows share one namespace
                     """, rendered);
    }

    @Test
    void format_labelsOnOneLine_areOrderedByColumn() {
        var source = "first line\nsecond line";
        var lines = LineIndex.of(source);
        var diagnostic = Diagnostic.error("E0206", "Conflict", lines.span(18, 22))
                                   .withLabel("here")
                                   .withSecondaryLabel(lines.span(11, 17), "and here");

        var rendered = diagnostic.format(source, null);

        assertThat(rendered).contains("  --> 2:8")
                            .contains("2 | second line\n")
                            .contains("  | ------ and here ^^^^ here\n")
                            .doesNotContain("first line");
    }

    @Test
    void format_carriageReturns_areStripped() {
        var source = "workflow A {\r\n  oops\r\n}";
        var diagnostic = Diagnostic.error(null, "Odd", LineIndex.of(source).span(16, 20));

        var rendered = diagnostic.format(source, "crlf.kumeo");

        assertFalse(rendered.contains("\r"));
        assertTrue(rendered.startsWith("error: Odd\n"));
    }

    @Test
    void semanticErrors_requireAtLeastOneError() {
        assertThrows(IllegalArgumentException.class, () -> new SemanticErrors(List.of()));
    }
}
