package org.kumeo.dsl.semantic;

import org.kumeo.dsl.ast.Program;
import org.kumeo.dsl.error.CompilationException;
import org.kumeo.dsl.error.SemanticError;
import org.kumeo.dsl.error.SemanticErrors;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of semantic analysis: the analyzed program and every error found, in report order.
 * The program is valid iff {@code errors} is empty.
 */
public record AnalysisResult(Program program, List<SemanticError> errors) {

    public AnalysisResult {
        errors = List.copyOf(errors);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int errorCount() {
        return errors.size();
    }

    public Optional<SemanticError> firstError() {
        return errors.stream()
                     .findFirst();
    }

    /**
     * The batch as a compile error; empty when analysis succeeded.
     */
    public Optional<SemanticErrors> toErrors() {
        return isSuccess()
               ? Optional.empty()
               : Optional.of(new SemanticErrors(errors));
    }

    /**
     * The program when valid, otherwise a {@link CompilationException} carrying the whole batch.
     */
    public Program orThrow() throws CompilationException {
        if (hasErrors()) {
            throw new CompilationException(new SemanticErrors(errors));
        }
        return program;
    }

    /**
     * Render every error as a Rust-style diagnostic against the source text.
     */
    public String formatDiagnostics(String source, String filename) {
        var sb = new StringBuilder();
        for (var error : errors) {
            sb.append(error.toDiagnostic()
                           .format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }
}
