package org.kumeo.dsl.json;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.kumeo.dsl.ast.Program;
import org.kumeo.dsl.error.CompileError;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of checking one source text, suitable for tooling.
 *
 * @param program the parsed program; empty when lexing or parsing failed
 * @param errors  every reported error in order; empty iff the source is valid
 */
public record CheckReport(Optional<Program> program, List<Issue> errors) {

    /**
     * One reported error with a 1-based position.
     */
    public record Issue(String code, String message, int line, int column) {}

    public CheckReport {
        errors = List.copyOf(errors);
    }

    public static CheckReport valid(Program program) {
        return new CheckReport(Optional.of(program), List.of());
    }

    /**
     * Report for a failed attempt.
     *
     * @param program the program if parsing succeeded and only analysis failed
     */
    public static CheckReport failed(Optional<Program> program, CompileError error) {
        var issues = error.diagnostics()
                          .stream()
                          .map(diagnostic -> new Issue(diagnostic.code(),
                                                       diagnostic.message(),
                                                       diagnostic.span().start().line(),
                                                       diagnostic.span().start().column()))
                          .toList();
        return new CheckReport(program, issues);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public ObjectNode toTree() {
        var root = ProgramJsonWriter.MAPPER.createObjectNode();
        root.put("valid", isValid());
        var array = root.putArray("errors");
        for (var issue : errors) {
            var node = array.addObject();
            node.put("code", issue.code());
            node.put("message", issue.message());
            node.put("line", issue.line());
            node.put("column", issue.column());
        }
        return root;
    }

    public String toJson() {
        return ProgramJsonWriter.write(toTree());
    }
}
