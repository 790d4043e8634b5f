package org.kumeo.dsl.error;

import org.kumeo.dsl.tree.SourceLocation;

import java.util.List;

/**
 * Failure of one compile attempt.
 *
 * <p>Lexical and syntactic errors are single and fatal; semantic errors arrive as one batch.
 */
public sealed interface CompileError permits LexError, ParseError, SemanticErrors {
    SourceLocation location();

    String message();

    /**
     * Renderable diagnostics for this error, in report order.
     */
    List<Diagnostic> diagnostics();
}
