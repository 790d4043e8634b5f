package org.kumeo.dsl.error;

import org.kumeo.dsl.tree.SourceLocation;

/**
 * Thrown when a compile attempt fails. The carried {@link CompileError} is the result of the attempt.
 */
public class CompilationException extends Exception {
    private static final long serialVersionUID = 1L;

    private final transient CompileError error;

    public CompilationException(CompileError error) {
        super(error.message());
        this.error = error;
    }

    public CompileError error() {
        return error;
    }

    public SourceLocation location() {
        return error.location();
    }

    /**
     * Render all diagnostics of the carried error against the source text.
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        for (var diagnostic : error.diagnostics()) {
            sb.append(diagnostic.format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }
}
