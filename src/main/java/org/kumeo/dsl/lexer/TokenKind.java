package org.kumeo.dsl.lexer;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Token classes of the Kumeo language.
 */
public enum TokenKind {
    // Keywords
    WORKFLOW("workflow", true),
    SUBWORKFLOW("subworkflow", true),
    INTEGRATION("integration", true),
    SOURCE("source", true),
    TARGET("target", true),
    CONTEXT("context", true),
    AGENTS("agents", true),
    PREPROCESSORS("preprocessors", true),
    INPUT("input", true),
    OUTPUT("output", true),
    MONITOR("monitor", true),
    DEPLOYMENT("deployment", true),
    MAPPING("mapping", true),
    // Reserved for future constructs
    USE("use", true),
    CONFIG("config", true),
    IF("if", true),
    ELSE("else", true),
    FOR("for", true),
    IN("in", true),
    MATCH("match", true),
    WHEN("when", true),

    // Literals
    IDENTIFIER("identifier", false),
    STRING("string literal", false),
    INTEGER("integer literal", false),
    FLOAT("float literal", false),
    TRUE("true", false),
    FALSE("false", false),
    NULL("null", false),

    // Operators
    ASSIGN("=", false),
    EQUAL("==", false),
    NOT_EQUAL("!=", false),
    LESS("<", false),
    GREATER(">", false),
    LESS_EQUAL("<=", false),
    GREATER_EQUAL(">=", false),
    PLUS("+", false),
    MINUS("-", false),
    STAR("*", false),
    SLASH("/", false),
    PERCENT("%", false),
    BANG("!", false),
    AND("&&", false),
    OR("||", false),

    // Punctuation
    DOT(".", false),
    COLON(":", false),
    COMMA(",", false),
    SEMICOLON(";", false),
    LPAREN("(", false),
    RPAREN(")", false),
    LBRACE("{", false),
    RBRACE("}", false),
    LBRACKET("[", false),
    RBRACKET("]", false),

    EOF("end of input", false);

    private static final Map<String, TokenKind> WORDS = new HashMap<>();

    static {
        for (var kind : values()) {
            if (kind.keyword) {
                WORDS.put(kind.text, kind);
            }
        }
        WORDS.put(TRUE.text, TRUE);
        WORDS.put(FALSE.text, FALSE);
        WORDS.put(NULL.text, NULL);
    }

    private final String text;
    private final boolean keyword;

    TokenKind(String text, boolean keyword) {
        this.text = text;
        this.keyword = keyword;
    }

    /**
     * Keyword or literal kind for a scanned word, if the word is reserved.
     */
    public static Optional<TokenKind> reservedWord(String word) {
        return Optional.ofNullable(WORDS.get(word));
    }

    public boolean isKeyword() {
        return keyword;
    }

    /**
     * Human-readable form used in error messages.
     */
    public String describe() {
        return switch (this) {
            case IDENTIFIER, STRING, INTEGER, FLOAT, EOF -> text;
            default -> "'" + text + "'";
        };
    }
}
