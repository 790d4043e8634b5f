package org.kumeo.dsl.lexer;

import org.kumeo.dsl.error.CompilationException;
import org.kumeo.dsl.error.LexError;
import org.kumeo.dsl.tree.LineIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for Kumeo source text.
 *
 * <p>Stops at the first invalid character; there is no error recovery.
 */
public final class Lexer {
    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    public static final int DEFAULT_MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;
    private static final String TRIPLE_QUOTE = "\"\"\"";

    private final String input;
    private final LineIndex lines;
    private int pos;

    private Lexer(String input) {
        this.input = input;
        this.lines = LineIndex.of(input);
        this.pos = 0;
    }

    public static List<Token> tokenize(String input) throws CompilationException {
        return tokenize(input, DEFAULT_MAX_INPUT_SIZE);
    }

    public static List<Token> tokenize(String input, int maxInputSize) throws CompilationException {
        if (input.length() > maxInputSize) {
            throw new IllegalArgumentException(
            "Source input exceeds maximum size of " + maxInputSize + " characters");
        }
        var tokens = new Lexer(input).tokenizeAll();
        log.trace("Tokenized {} characters into {} tokens", input.length(), tokens.size());
        return tokens;
    }

    private List<Token> tokenizeAll() throws CompilationException {
        var tokens = new ArrayList<Token>();
        skipWhitespaceAndComments();
        while (!isAtEnd()) {
            tokens.add(nextToken());
            skipWhitespaceAndComments();
        }
        tokens.add(Token.of(TokenKind.EOF, "", lines.span(pos, pos)));
        return tokens;
    }

    private Token nextToken() throws CompilationException {
        int start = pos;
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanWord(start);
        }
        if (input.startsWith(TRIPLE_QUOTE, pos)) {
            return scanRawString(start);
        }
        if (c == '"') {
            return scanString(start);
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        return scanOperator(start);
    }

    private Token scanWord(int start) {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            pos++;
        }
        var word = input.substring(start, pos);
        var kind = TokenKind.reservedWord(word)
                            .orElse(TokenKind.IDENTIFIER);
        return token(kind, start);
    }

    private Token scanString(int start) throws CompilationException {
        pos++;
        // skip opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                int escapeStart = pos++;
                sb.append(scanEscapeSequence(escapeStart));
            } else {
                sb.append(input.charAt(pos++));
            }
        }
        if (isAtEnd()) {
            throw error(start, pos, "Unterminated string literal");
        }
        pos++;
        // skip closing quote
        return new Token(TokenKind.STRING, input.substring(start, pos), sb.toString(), lines.span(start, pos));
    }

    private Token scanRawString(int start) throws CompilationException {
        int contentStart = start + TRIPLE_QUOTE.length();
        int close = input.indexOf(TRIPLE_QUOTE, contentStart);
        if (close < 0) {
            pos = input.length();
            throw error(start, pos, "Unterminated triple-quoted string literal");
        }
        pos = close + TRIPLE_QUOTE.length();
        return new Token(TokenKind.STRING,
                         input.substring(start, pos),
                         input.substring(contentStart, close),
                         lines.span(start, pos));
    }

    private Token scanNumber(int start) {
        skipDigits();
        boolean isFloat = false;
        if (!isAtEnd() && peek() == '.' && isDigitAt(pos + 1)) {
            isFloat = true;
            pos++;
            skipDigits();
            if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
                int exponentStart = pos + 1;
                if (exponentStart < input.length()
                    && (input.charAt(exponentStart) == '+' || input.charAt(exponentStart) == '-')) {
                    exponentStart++;
                }
                if (isDigitAt(exponentStart)) {
                    pos = exponentStart;
                    skipDigits();
                }
            }
        }
        return token(isFloat ? TokenKind.FLOAT : TokenKind.INTEGER, start);
    }

    private Token scanOperator(int start) throws CompilationException {
        char c = input.charAt(pos++);
        var kind = switch (c) {
            case '=' -> match('=') ? TokenKind.EQUAL : TokenKind.ASSIGN;
            case '!' -> match('=') ? TokenKind.NOT_EQUAL : TokenKind.BANG;
            case '<' -> match('=') ? TokenKind.LESS_EQUAL : TokenKind.LESS;
            case '>' -> match('=') ? TokenKind.GREATER_EQUAL : TokenKind.GREATER;
            case '&' -> match('&') ? TokenKind.AND : null;
            case '|' -> match('|') ? TokenKind.OR : null;
            case '+' -> TokenKind.PLUS;
            case '-' -> TokenKind.MINUS;
            case '*' -> TokenKind.STAR;
            case '/' -> TokenKind.SLASH;
            case '%' -> TokenKind.PERCENT;
            case '.' -> TokenKind.DOT;
            case ':' -> TokenKind.COLON;
            case ',' -> TokenKind.COMMA;
            case ';' -> TokenKind.SEMICOLON;
            case '(' -> TokenKind.LPAREN;
            case ')' -> TokenKind.RPAREN;
            case '{' -> TokenKind.LBRACE;
            case '}' -> TokenKind.RBRACE;
            case '[' -> TokenKind.LBRACKET;
            case ']' -> TokenKind.RBRACKET;
            default -> null;
        };
        if (kind == null) {
            pos = start + Character.charCount(input.codePointAt(start));
            throw error(start, pos, "Unexpected character");
        }
        return token(kind, start);
    }

    private char scanEscapeSequence(int escapeStart) throws CompilationException {
        char c = input.charAt(pos++);
        return switch (c) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case '\\' -> '\\';
            case '\'' -> '\'';
            case '"' -> '"';
            case '0' -> '\0';
            case 'u' -> scanUnicodeEscape(escapeStart);
            default -> throw error(escapeStart, pos, "Unknown escape sequence");
        };
    }

    private char scanUnicodeEscape(int escapeStart) throws CompilationException {
        int value = 0;
        for (int i = 0; i < 4; i++) {
            int digit = isAtEnd() || peek() > 'f' ? -1 : Character.digit(peek(), 16);
            if (digit < 0) {
                throw error(escapeStart, pos, "Invalid unicode escape, expected four hex digits");
            }
            value = value * 16 + digit;
            pos++;
        }
        return (char) value;
    }

    private void skipWhitespaceAndComments() throws CompilationException {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                pos++;
            } else if (input.startsWith("//", pos)) {
                while (!isAtEnd() && peek() != '\n') {
                    pos++;
                }
            } else if (input.startsWith("/*", pos)) {
                int start = pos;
                int close = input.indexOf("*/", pos + 2);
                if (close < 0) {
                    throw error(start, start + 2, "Unterminated block comment");
                }
                pos = close + 2;
            } else {
                break;
            }
        }
    }

    private void skipDigits() {
        while (!isAtEnd() && isDigit(peek())) {
            pos++;
        }
    }

    private boolean match(char expected) {
        if (!isAtEnd() && peek() == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private Token token(TokenKind kind, int start) {
        return Token.of(kind, input.substring(start, pos), lines.span(start, pos));
    }

    private CompilationException error(int start, int end, String reason) {
        var span = lines.span(start, end);
        return new CompilationException(new LexError(span, input.substring(start, end), reason));
    }

    private boolean isDigitAt(int index) {
        return index < input.length() && isDigit(input.charAt(index));
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
