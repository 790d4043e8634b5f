package org.kumeo.dsl.error;

import org.kumeo.dsl.tree.SourceLocation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The complete, ordered batch of semantic errors found in one program. Never empty.
 */
public record SemanticErrors(List<SemanticError> errors) implements CompileError {

    public SemanticErrors {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("SemanticErrors requires at least one error");
        }
        errors = List.copyOf(errors);
    }

    public SemanticError first() {
        return errors.get(0);
    }

    public int size() {
        return errors.size();
    }

    @Override
    public SourceLocation location() {
        return first().span()
                      .start();
    }

    @Override
    public String message() {
        return errors.stream()
                     .map(SemanticError::message)
                     .collect(Collectors.joining("\n"));
    }

    @Override
    public List<Diagnostic> diagnostics() {
        return errors.stream()
                     .map(SemanticError::toDiagnostic)
                     .toList();
    }
}
