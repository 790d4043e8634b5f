package org.kumeo.dsl.lexer;

import org.junit.jupiter.api.Test;
import org.kumeo.dsl.Fixtures;
import org.kumeo.dsl.error.CompilationException;
import org.kumeo.dsl.error.LexError;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static List<TokenKind> kinds(String source) throws CompilationException {
        return Lexer.tokenize(source)
                    .stream()
                    .map(Token::kind)
                    .toList();
    }

    @Test
    void tokenize_emptyInput_yieldsOnlyEof() throws CompilationException {
        var tokens = Lexer.tokenize("");

        assertEquals(1, tokens.size());
        assertTrue(tokens.get(0).is(TokenKind.EOF));
    }

    @Test
    void tokenize_keywordsAndIdentifiers_areDistinguished() throws CompilationException {
        assertThat(kinds("workflow Main source agents myAgent"))
            .containsExactly(TokenKind.WORKFLOW, TokenKind.IDENTIFIER, TokenKind.SOURCE,
                             TokenKind.AGENTS, TokenKind.IDENTIFIER, TokenKind.EOF);
    }

    @Test
    void tokenize_reservedWords_areKeywords() throws CompilationException {
        var tokens = Lexer.tokenize("use config if else for in match when");

        assertTrue(tokens.stream()
                         .filter(token -> !token.is(TokenKind.EOF))
                         .allMatch(token -> token.kind().isKeyword()));
    }

    @Test
    void tokenize_literals_classifiesEachKind() throws CompilationException {
        assertThat(kinds("\"text\" 42 3.14 true false null"))
            .containsExactly(TokenKind.STRING, TokenKind.INTEGER, TokenKind.FLOAT,
                             TokenKind.TRUE, TokenKind.FALSE, TokenKind.NULL, TokenKind.EOF);
    }

    @Test
    void tokenize_floatWithExponent_isSingleToken() throws CompilationException {
        var tokens = Lexer.tokenize("1.5e-3");

        assertEquals(TokenKind.FLOAT, tokens.get(0).kind());
        assertEquals("1.5e-3", tokens.get(0).text());
    }

    @Test
    void tokenize_integerFollowedByDot_isNotFloat() throws CompilationException {
        assertThat(kinds("1.x")).containsExactly(TokenKind.INTEGER, TokenKind.DOT, TokenKind.IDENTIFIER,
                                                 TokenKind.EOF);
    }

    @Test
    void tokenize_stringEscapes_areDecoded() throws CompilationException {
        var token = Lexer.tokenize("\"a\\n\\t\\\"b\\\\ \\u0041\"").get(0);

        assertEquals(TokenKind.STRING, token.kind());
        assertEquals("a\n\t\"b\\ A", token.value());
        assertEquals("\"a\\n\\t\\\"b\\\\ \\u0041\"", token.text());
    }

    @Test
    void tokenize_tripleQuotedString_keepsContentRaw() throws CompilationException {
        var token = Lexer.tokenize("\"\"\"line one\n\\n \"quoted\" x\"\"\"").get(0);

        assertEquals(TokenKind.STRING, token.kind());
        assertEquals("line one\n\\n \"quoted\" x", token.value());
    }

    @Test
    void tokenize_operators_prefersTwoCharacterForms() throws CompilationException {
        assertThat(kinds("== != <= >= && || = < > ! + - * / %"))
            .containsExactly(TokenKind.EQUAL, TokenKind.NOT_EQUAL, TokenKind.LESS_EQUAL, TokenKind.GREATER_EQUAL,
                             TokenKind.AND, TokenKind.OR, TokenKind.ASSIGN, TokenKind.LESS, TokenKind.GREATER,
                             TokenKind.BANG, TokenKind.PLUS, TokenKind.MINUS, TokenKind.STAR, TokenKind.SLASH,
                             TokenKind.PERCENT, TokenKind.EOF);
    }

    @Test
    void tokenize_comments_areSkipped() throws CompilationException {
        assertThat(kinds("// line comment\nworkflow /* block\ncomment */ Main"))
            .containsExactly(TokenKind.WORKFLOW, TokenKind.IDENTIFIER, TokenKind.EOF);
    }

    @Test
    void tokenize_tracksLineAndColumn() throws CompilationException {
        var tokens = Lexer.tokenize("workflow Main {\n    source: NATS(\"in\")\n}");

        var source = tokens.get(3);
        assertEquals(TokenKind.SOURCE, source.kind());
        assertEquals(2, source.location().line());
        assertEquals(5, source.location().column());
        assertEquals(20, source.location().offset());

        var eof = tokens.get(tokens.size() - 1);
        assertEquals(3, eof.location().line());
        assertEquals(2, eof.location().column());
    }

    @Test
    void tokenize_unexpectedCharacter_reportsExactLocation() {
        var exception = assertThrows(CompilationException.class,
                                     () -> Lexer.tokenize("workflow A {\n    source: @\n}"));

        var error = assertInstanceOf(LexError.class, exception.error());
        assertEquals("Unexpected character", error.reason());
        assertEquals("@", error.text());
        assertEquals(2, error.location().line());
        assertEquals(13, error.location().column());
        assertEquals(25, error.location().offset());
        assertEquals("Unexpected character at 2:13: '@'", exception.getMessage());
    }

    @Test
    void tokenize_unterminatedString_fails() {
        var exception = assertThrows(CompilationException.class, () -> Lexer.tokenize("source: \"open"));

        var error = assertInstanceOf(LexError.class, exception.error());
        assertEquals("Unterminated string literal", error.reason());
        assertEquals(9, error.location().column());
    }

    @Test
    void tokenize_unterminatedBlockComment_fails() {
        var exception = assertThrows(CompilationException.class, () -> Lexer.tokenize("workflow /* never closed"));

        var error = assertInstanceOf(LexError.class, exception.error());
        assertEquals("Unterminated block comment", error.reason());
        assertEquals("/*", error.text());
    }

    @Test
    void tokenize_oversizedInput_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> Lexer.tokenize("workflow A {}", 5));
    }

    @Test
    void describe_rendersTokensForMessages() throws CompilationException {
        var tokens = Lexer.tokenize("source foo \"s\" 7 :");

        assertEquals("keyword 'source'", tokens.get(0).describe());
        assertEquals("identifier 'foo'", tokens.get(1).describe());
        assertEquals("string \"s\"", tokens.get(2).describe());
        assertEquals("number 7", tokens.get(3).describe());
        assertEquals("':'", tokens.get(4).describe());
        assertEquals("end of input", tokens.get(5).describe());
    }

    @Test
    void tokenize_malformedFixture_reportsExactLocation() {
        var exception = assertThrows(CompilationException.class,
                                     () -> Lexer.tokenize(Fixtures.load("malformed.kumeo")));

        var error = assertInstanceOf(LexError.class, exception.error());
        assertEquals("#", error.text());
        assertEquals(4, error.location().line());
        assertEquals(28, error.location().column());
        assertEquals(132, error.location().offset());
    }

    @Test
    void tokenize_nonAsciiBeforeToken_countsCharacters() throws CompilationException {
        var tokens = Lexer.tokenize("\"日本語\" // ü\n  cafe");

        var string = tokens.get(0);
        assertEquals("日本語", string.value());
        assertEquals(5, string.span().end().offset());
        var word = tokens.get(1);
        assertEquals(2, word.location().line());
        assertEquals(3, word.location().column());
        assertEquals(13, word.location().offset());

        var exception = assertThrows(CompilationException.class, () -> Lexer.tokenize("\"é\" é"));
        var error = assertInstanceOf(LexError.class, exception.error());
        assertEquals(5, error.location().column());
        assertEquals(4, error.location().offset());
    }

    @Test
    void tokenize_unknownEscape_fails() {
        var exception = assertThrows(CompilationException.class, () -> Lexer.tokenize("x: \"a\\qb\""));

        var error = assertInstanceOf(LexError.class, exception.error());
        assertEquals("Unknown escape sequence", error.reason());
        assertEquals("\\q", error.text());
        assertEquals(6, error.location().column());
    }

    @Test
    void tokenize_shortUnicodeEscape_fails() {
        var exception = assertThrows(CompilationException.class, () -> Lexer.tokenize("\"\\u12g4\""));

        var error = assertInstanceOf(LexError.class, exception.error());
        assertEquals("Invalid unicode escape, expected four hex digits", error.reason());
        assertEquals("\\u12", error.text());
    }
}
