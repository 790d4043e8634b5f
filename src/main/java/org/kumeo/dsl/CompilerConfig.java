package org.kumeo.dsl;

import org.kumeo.dsl.lexer.Lexer;
import org.kumeo.dsl.parser.Parser;

/**
 * Compiler configuration options.
 *
 * @param maxInputSize      largest accepted source text, in characters
 * @param maxNestingDepth   deepest accepted nesting of object and array values
 * @param semanticAnalysis  whether {@link KumeoCompiler#compile(String)} runs semantic analysis
 */
public record CompilerConfig(int maxInputSize, int maxNestingDepth, boolean semanticAnalysis) {
    public static final CompilerConfig DEFAULT =
        new CompilerConfig(Lexer.DEFAULT_MAX_INPUT_SIZE, Parser.DEFAULT_MAX_NESTING_DEPTH, true);

    public CompilerConfig {
        if (maxInputSize <= 0) {
            throw new IllegalArgumentException("maxInputSize must be positive, got " + maxInputSize);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
    }
}
