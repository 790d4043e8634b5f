package org.kumeo.dsl.lexer;

import org.kumeo.dsl.tree.SourceLocation;
import org.kumeo.dsl.tree.SourceSpan;

/**
 * A classified slice of source text.
 *
 * @param kind  token class
 * @param text  exact source text of the token
 * @param value decoded value; differs from {@code text} only for string literals
 * @param span  location in the source
 */
public record Token(TokenKind kind, String text, String value, SourceSpan span) {

    public static Token of(TokenKind kind, String text, SourceSpan span) {
        return new Token(kind, text, text, span);
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public SourceLocation location() {
        return span.start();
    }

    /**
     * Description used when this token is reported as unexpected.
     */
    public String describe() {
        return switch (kind) {
            case IDENTIFIER -> "identifier '" + text + "'";
            case STRING -> "string " + text;
            case INTEGER, FLOAT -> "number " + text;
            case EOF -> "end of input";
            default -> kind.isKeyword() ? "keyword '" + text + "'" : "'" + text + "'";
        };
    }
}
