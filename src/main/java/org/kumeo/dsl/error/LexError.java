package org.kumeo.dsl.error;

import org.kumeo.dsl.tree.SourceLocation;
import org.kumeo.dsl.tree.SourceSpan;

import java.util.List;

/**
 * Invalid character span found by the lexer.
 *
 * @param span   offending span
 * @param text   offending source text
 * @param reason what is wrong with it
 */
public record LexError(SourceSpan span, String text, String reason) implements CompileError {
    public static final String CODE = "E0001";

    @Override
    public SourceLocation location() {
        return span.start();
    }

    @Override
    public String message() {
        return reason + " at " + location() + ": '" + text + "'";
    }

    @Override
    public List<Diagnostic> diagnostics() {
        return List.of(Diagnostic.error(CODE, reason, span)
                                 .withLabel("invalid token"));
    }
}
