package org.kumeo.dsl.parser;

import org.kumeo.dsl.ast.Agent;
import org.kumeo.dsl.ast.AgentType;
import org.kumeo.dsl.ast.Argument;
import org.kumeo.dsl.ast.Context;
import org.kumeo.dsl.ast.Integration;
import org.kumeo.dsl.ast.Mapping;
import org.kumeo.dsl.ast.PathExpr;
import org.kumeo.dsl.ast.Program;
import org.kumeo.dsl.ast.Source;
import org.kumeo.dsl.ast.Subworkflow;
import org.kumeo.dsl.ast.Target;
import org.kumeo.dsl.ast.TransportKind;
import org.kumeo.dsl.ast.Value;
import org.kumeo.dsl.ast.Workflow;
import org.kumeo.dsl.error.CompilationException;
import org.kumeo.dsl.error.ParseError;
import org.kumeo.dsl.lexer.Lexer;
import org.kumeo.dsl.lexer.Token;
import org.kumeo.dsl.lexer.TokenKind;
import org.kumeo.dsl.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for Kumeo programs.
 * Converts a token stream into a {@link Program}, failing on the first syntax error.
 */
public final class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private static final Set<TokenKind> WORKFLOW_SECTIONS = EnumSet.of(
        TokenKind.SOURCE, TokenKind.TARGET, TokenKind.CONTEXT, TokenKind.PREPROCESSORS,
        TokenKind.AGENTS, TokenKind.MONITOR, TokenKind.DEPLOYMENT);
    private static final Set<TokenKind> SUBWORKFLOW_SECTIONS = EnumSet.of(
        TokenKind.INPUT, TokenKind.OUTPUT, TokenKind.CONTEXT, TokenKind.AGENTS);
    private static final Set<TokenKind> INTEGRATION_SECTIONS = EnumSet.of(
        TokenKind.WORKFLOW, TokenKind.SUBWORKFLOW, TokenKind.MAPPING);
    private static final Set<TokenKind> MAPPING_SECTIONS = EnumSet.of(TokenKind.INPUT, TokenKind.OUTPUT);

    public static final int DEFAULT_MAX_NESTING_DEPTH = 128;

    private final List<Token> tokens;
    private final int maxNestingDepth;
    private int pos;
    private int depth;

    private Parser(List<Token> tokens, int maxNestingDepth) {
        this.tokens = tokens;
        this.maxNestingDepth = maxNestingDepth;
        this.pos = 0;
        this.depth = 0;
    }

    /**
     * Tokenize and parse source text.
     */
    public static Program parse(String source) throws CompilationException {
        return parse(Lexer.tokenize(source));
    }

    public static Program parse(String source, int maxInputSize) throws CompilationException {
        return parse(Lexer.tokenize(source, maxInputSize));
    }

    /**
     * Tokenize and parse source text, rejecting object and array values nested deeper than
     * {@code maxNestingDepth}.
     */
    public static Program parse(String source, int maxInputSize, int maxNestingDepth)
    throws CompilationException {
        return parse(Lexer.tokenize(source, maxInputSize), maxNestingDepth);
    }

    /**
     * Parse a token stream produced by {@link Lexer}. The stream must end with an EOF token.
     */
    public static Program parse(List<Token> tokens) throws CompilationException {
        return parse(tokens, DEFAULT_MAX_NESTING_DEPTH);
    }

    public static Program parse(List<Token> tokens, int maxNestingDepth) throws CompilationException {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
        var program = new Parser(tokens, maxNestingDepth).parseProgram();
        log.debug("Parsed program: {} workflows, {} subworkflows, {} integrations",
                  program.workflows().size(),
                  program.subworkflows().size(),
                  program.integrations().size());
        return program;
    }

    private Program parseProgram() throws CompilationException {
        var workflows = new ArrayList<Workflow>();
        var subworkflows = new ArrayList<Subworkflow>();
        var integrations = new ArrayList<Integration>();

        while (!isAtEnd()) {
            var token = peek();
            switch (token.kind()) {
                case WORKFLOW -> workflows.add(parseWorkflow());
                case SUBWORKFLOW -> subworkflows.add(parseSubworkflow());
                case INTEGRATION -> integrations.add(parseIntegration());
                default -> throw unexpected(token, "'workflow', 'subworkflow' or 'integration'");
            }
        }
        return new Program(workflows, subworkflows, integrations);
    }

    // === Top-level blocks ===

    private Workflow parseWorkflow() throws CompilationException {
        expect(TokenKind.WORKFLOW, "'workflow'");
        var name = expect(TokenKind.IDENTIFIER, "workflow name");
        expect(TokenKind.LBRACE, "'{'");

        Source source = null;
        Target target = null;
        Context context = null;
        List<Agent> preprocessors = null;
        List<Agent> agents = List.of();
        Map<String, Value> monitor = null;
        Map<String, Value> deployment = null;

        var seen = EnumSet.noneOf(TokenKind.class);
        while (!peek().is(TokenKind.RBRACE)) {
            var section = sectionHeader(WORKFLOW_SECTIONS, seen, "workflow section or '}'");
            switch (section.kind()) {
                case SOURCE -> source = parseSource();
                case TARGET -> target = parseTarget();
                case CONTEXT -> context = parseContext();
                case PREPROCESSORS -> preprocessors = parseAgentList();
                case AGENTS -> agents = parseAgentList();
                case MONITOR -> monitor = parseObjectEntries();
                case DEPLOYMENT -> deployment = parseObjectEntries();
                default -> throw unexpected(section, "workflow section");
            }
        }
        expect(TokenKind.RBRACE, "'}'");

        return new Workflow(name.text(),
                            Optional.ofNullable(source),
                            Optional.ofNullable(target),
                            Optional.ofNullable(context),
                            Optional.ofNullable(preprocessors),
                            agents,
                            Optional.ofNullable(monitor),
                            Optional.ofNullable(deployment),
                            name.span());
    }

    private Subworkflow parseSubworkflow() throws CompilationException {
        expect(TokenKind.SUBWORKFLOW, "'subworkflow'");
        var name = expect(TokenKind.IDENTIFIER, "subworkflow name");
        expect(TokenKind.LBRACE, "'{'");

        List<String> input = null;
        List<String> output = null;
        Context context = null;
        List<Agent> agents = List.of();

        var seen = EnumSet.noneOf(TokenKind.class);
        while (!peek().is(TokenKind.RBRACE)) {
            var section = sectionHeader(SUBWORKFLOW_SECTIONS, seen, "subworkflow section or '}'");
            switch (section.kind()) {
                case INPUT -> input = parseNameList();
                case OUTPUT -> output = parseNameList();
                case CONTEXT -> context = parseContext();
                case AGENTS -> agents = parseAgentList();
                default -> throw unexpected(section, "subworkflow section");
            }
        }
        expect(TokenKind.RBRACE, "'}'");

        return new Subworkflow(name.text(),
                               Optional.ofNullable(input),
                               Optional.ofNullable(output),
                               Optional.ofNullable(context),
                               agents,
                               name.span());
    }

    private Integration parseIntegration() throws CompilationException {
        var keyword = expect(TokenKind.INTEGRATION, "'integration'");
        expect(TokenKind.LBRACE, "'{'");

        Token workflow = null;
        Token subworkflow = null;
        var mapping = Mapping.EMPTY;

        var seen = EnumSet.noneOf(TokenKind.class);
        while (!peek().is(TokenKind.RBRACE)) {
            var section = sectionHeader(INTEGRATION_SECTIONS, seen, "integration section or '}'");
            switch (section.kind()) {
                case WORKFLOW -> workflow = expect(TokenKind.IDENTIFIER, "workflow name");
                case SUBWORKFLOW -> subworkflow = expect(TokenKind.IDENTIFIER, "subworkflow name");
                case MAPPING -> mapping = parseMapping();
                default -> throw unexpected(section, "integration section");
            }
        }
        var close = expect(TokenKind.RBRACE, "'}'");

        if (workflow == null) {
            throw invalid(close, "Integration requires a 'workflow' reference");
        }
        if (subworkflow == null) {
            throw invalid(close, "Integration requires a 'subworkflow' reference");
        }
        return new Integration(workflow.text(),
                               subworkflow.text(),
                               mapping,
                               workflow.span(),
                               subworkflow.span(),
                               keyword.span());
    }

    /**
     * Consume {@code section ':'}, rejecting unknown and repeated sections.
     */
    private Token sectionHeader(Set<TokenKind> allowed, Set<TokenKind> seen, String expected)
    throws CompilationException {
        var section = peek();
        if (!allowed.contains(section.kind())) {
            throw unexpected(section, expected);
        }
        if (!seen.add(section.kind())) {
            throw new CompilationException(new ParseError.Duplicate(section.location(),
                                                                    "section '" + section.text() + "'"));
        }
        advance();
        expect(TokenKind.COLON, "':'");
        return section;
    }

    // === Mapping ===

    private Mapping parseMapping() throws CompilationException {
        expect(TokenKind.LBRACE, "'{'");
        Map<String, PathExpr> input = Map.of();
        Map<String, PathExpr> output = Map.of();

        var seen = EnumSet.noneOf(TokenKind.class);
        while (!peek().is(TokenKind.RBRACE)) {
            var direction = sectionHeader(MAPPING_SECTIONS, seen, "'input', 'output' or '}'");
            var paths = parsePathMap();
            if (direction.is(TokenKind.INPUT)) {
                input = paths;
            } else {
                output = paths;
            }
            if (peek().is(TokenKind.COMMA)) {
                advance();
            }
        }
        expect(TokenKind.RBRACE, "'}'");
        return new Mapping(input, output);
    }

    private Map<String, PathExpr> parsePathMap() throws CompilationException {
        var entries = new LinkedHashMap<String, PathExpr>();
        parseDelimited(TokenKind.LBRACE, TokenKind.RBRACE, "field mapping", () -> {
            var key = parseKey();
            expect(TokenKind.COLON, "':'");
            var path = parseMappedPath();
            if (entries.put(key.value(), path) != null) {
                throw new CompilationException(new ParseError.Duplicate(key.location(),
                                                                        "mapping key '" + key.value() + "'"));
            }
            return path;
        });
        return entries;
    }

    private PathExpr parseMappedPath() throws CompilationException {
        var token = peek();
        if (token.is(TokenKind.STRING)) {
            advance();
            if (token.value().isEmpty()) {
                throw invalid(token, "Mapping path must not be empty");
            }
            return PathExpr.parse(token.value());
        }
        if (isWord(token)) {
            return parsePath();
        }
        throw unexpected(token, "path expression");
    }

    // === Tagged values ===

    /**
     * A parsed {@code Tag(arg, key: value, ...)} before interpretation.
     */
    private record TagCall(Token tag, List<Argument> arguments) {
        SourceSpan span() {
            return tag.span();
        }

        String name() {
            return tag.text();
        }
    }

    private TagCall parseTagCall(String expected) throws CompilationException {
        var tag = expect(TokenKind.IDENTIFIER, expected);
        var arguments = new ArrayList<Argument>();
        parseDelimited(TokenKind.LPAREN, TokenKind.RPAREN, "argument", () -> {
            var argument = parseArgument();
            arguments.add(argument);
            return argument;
        });
        return new TagCall(tag, arguments);
    }

    private Argument parseArgument() throws CompilationException {
        var token = peek();
        if ((isWord(token) || token.is(TokenKind.STRING)) && peekAt(1).is(TokenKind.COLON)) {
            var key = parseKey();
            expect(TokenKind.COLON, "':'");
            return Argument.named(key.value(), parseValue());
        }
        return Argument.positional(parseValue());
    }

    private Source parseSource() throws CompilationException {
        var call = parseTagCall("source type");
        var kind = TransportKind.fromTag(call.name());
        if (kind.isPresent()) {
            var endpoint = endpointArguments(call, "channel", "topic");
            return new Source.Transport(kind.get(), endpoint.name(), endpoint.options(), call.span());
        }
        return new Source.Custom(call.name(), positionalOnly(call), call.span());
    }

    private Target parseTarget() throws CompilationException {
        var call = parseTagCall("target type");
        var kind = TransportKind.fromTag(call.name());
        if (kind.isPresent()) {
            if (!kind.get().isTargetCapable()) {
                throw invalid(call.tag(), call.name() + " can only be used as a source");
            }
            var endpoint = endpointArguments(call, "channel", "topic");
            return new Target.Transport(kind.get(), endpoint.name(), endpoint.options(), call.span());
        }
        return new Target.Custom(call.name(), positionalOnly(call), call.span());
    }

    private Context parseContext() throws CompilationException {
        var call = parseTagCall("context type");
        return switch (call.name()) {
            case "KnowledgeBase" -> {
                var endpoint = endpointArguments(call, "name", "name");
                yield new Context.KnowledgeBase(endpoint.name(), endpoint.options(), call.span());
            }
            case "BayesianNetwork" -> {
                var endpoint = endpointArguments(call, "name", "name");
                yield new Context.BayesianNetwork(endpoint.name(), endpoint.options(), call.span());
            }
            case "Database" -> databaseContext(call);
            default -> new Context.Custom(call.name(), positionalOnly(call), call.span());
        };
    }

    private record Endpoint(String name, Map<String, Value> options) {}

    /**
     * Interpret {@code Tag("name", {options})}; the name may also be given by key, and other named
     * arguments become options.
     */
    private Endpoint endpointArguments(TagCall call, String nameKey, String aliasKey) throws CompilationException {
        String name = null;
        var options = new LinkedHashMap<String, Value>();
        int positional = 0;

        for (var argument : call.arguments()) {
            if (argument instanceof Argument.Named named) {
                if (named.key().equals(nameKey) || named.key().equals(aliasKey)) {
                    if (name != null) {
                        throw new CompilationException(new ParseError.Duplicate(call.tag().location(),
                                                                                nameKey + " of " + call.name()));
                    }
                    name = requireString(call, named.value(), nameKey);
                } else if (options.put(named.key(), named.value()) != null) {
                    throw new CompilationException(new ParseError.Duplicate(call.tag().location(),
                                                                            "option '" + named.key() + "'"));
                }
                continue;
            }
            positional++;
            if (positional == 1 && name == null) {
                name = requireString(call, argument.value(), nameKey);
            } else if (positional <= 2 && argument.value() instanceof Value.ObjectValue object) {
                for (var entry : object.entries().entrySet()) {
                    if (options.put(entry.getKey(), entry.getValue()) != null) {
                        throw new CompilationException(new ParseError.Duplicate(call.tag().location(),
                                                                                "option '" + entry.getKey() + "'"));
                    }
                }
            } else {
                throw invalid(call.tag(), call.name() + " takes a " + nameKey + " and an optional options object");
            }
        }
        if (name == null) {
            throw invalid(call.tag(), call.name() + " requires a " + nameKey);
        }
        return new Endpoint(name, options);
    }

    private Context databaseContext(TagCall call) throws CompilationException {
        var values = new ArrayList<String>();
        String driver = null;
        String connection = null;
        for (var argument : call.arguments()) {
            if (argument instanceof Argument.Named named) {
                switch (named.key()) {
                    case "driver", "type" -> driver = requireString(call, named.value(), named.key());
                    case "connection" -> connection = requireString(call, named.value(), named.key());
                    default -> throw invalid(call.tag(), "Database does not accept argument '" + named.key() + "'");
                }
            } else {
                values.add(requireString(call, argument.value(), "argument"));
            }
        }
        if (driver == null && !values.isEmpty()) {
            driver = values.remove(0);
        }
        if (connection == null && !values.isEmpty()) {
            connection = values.remove(0);
        }
        if (driver == null || connection == null || !values.isEmpty()) {
            throw invalid(call.tag(), "Database requires a driver and a connection string");
        }
        return new Context.Database(driver, connection, call.span());
    }

    private List<Value> positionalOnly(TagCall call) throws CompilationException {
        var values = new ArrayList<Value>();
        for (var argument : call.arguments()) {
            if (argument instanceof Argument.Named named) {
                throw invalid(call.tag(),
                              "Custom tag " + call.name() + " takes positional arguments only, found '" + named.key() + "'");
            }
            values.add(argument.value());
        }
        return values;
    }

    private String requireString(TagCall call, Value value, String what) throws CompilationException {
        if (value instanceof Value.StringValue string) {
            return string.value();
        }
        throw invalid(call.tag(), call.name() + " expects a string " + what);
    }

    // === Agents ===

    private List<Agent> parseAgentList() throws CompilationException {
        var agents = new ArrayList<Agent>();
        parseDelimited(TokenKind.LBRACKET, TokenKind.RBRACKET, "agent", () -> {
            var agent = parseAgent();
            agents.add(agent);
            return agent;
        });
        return agents;
    }

    private Agent parseAgent() throws CompilationException {
        var call = parseTagCall("agent type");
        String id = null;
        var config = new ArrayList<Argument>();
        for (var argument : call.arguments()) {
            if (argument instanceof Argument.Named named && named.key().equals("id")) {
                if (id != null) {
                    throw new CompilationException(new ParseError.Duplicate(call.tag().location(),
                                                                            "agent id argument"));
                }
                id = agentId(call, named.value());
            } else {
                config.add(argument);
            }
        }
        return new Agent(Optional.ofNullable(id), AgentType.fromTag(call.name()), config, call.span());
    }

    private String agentId(TagCall call, Value value) throws CompilationException {
        if (value instanceof Value.StringValue string) {
            return string.value();
        }
        if (value instanceof Value.PathValue path && path.path().components().size() == 1) {
            return path.path().components().get(0);
        }
        throw invalid(call.tag(), "Agent id must be a string or an identifier");
    }

    private List<String> parseNameList() throws CompilationException {
        var names = new ArrayList<String>();
        parseDelimited(TokenKind.LBRACKET, TokenKind.RBRACKET, "parameter name", () -> {
            var token = peek();
            if (!token.is(TokenKind.STRING) && !token.is(TokenKind.IDENTIFIER)) {
                throw unexpected(token, "parameter name");
            }
            advance();
            names.add(token.value());
            return token;
        });
        return names;
    }

    // === Values ===

    private Value parseValue() throws CompilationException {
        var token = peek();
        return switch (token.kind()) {
            case STRING -> {
                advance();
                yield Value.string(token.value());
            }
            case INTEGER, FLOAT -> {
                advance();
                yield Value.number(number(token));
            }
            case MINUS -> {
                advance();
                var literal = peek();
                if (!literal.is(TokenKind.INTEGER) && !literal.is(TokenKind.FLOAT)) {
                    throw unexpected(literal, "number");
                }
                advance();
                yield Value.number(-number(literal));
            }
            case TRUE -> {
                advance();
                yield Value.bool(true);
            }
            case FALSE -> {
                advance();
                yield Value.bool(false);
            }
            case NULL -> {
                advance();
                yield Value.nullValue();
            }
            case LBRACE -> Value.object(parseObjectEntries());
            case LBRACKET -> Value.array(parseArrayElements());
            default -> {
                if (isWord(token)) {
                    yield Value.path(parsePath());
                }
                throw unexpected(token, "value");
            }
        };
    }

    private static double number(Token token) throws CompilationException {
        var value = Double.parseDouble(token.text());
        if (!Double.isFinite(value)) {
            throw new CompilationException(new ParseError.InvalidConstruct(token.location(),
                                                                           "Number literal out of range"));
        }
        return value;
    }

    private Map<String, Value> parseObjectEntries() throws CompilationException {
        var entries = new LinkedHashMap<String, Value>();
        enterNested();
        parseDelimited(TokenKind.LBRACE, TokenKind.RBRACE, "object entry", () -> {
            var key = parseKey();
            expect(TokenKind.COLON, "':'");
            var value = parseValue();
            if (entries.put(key.value(), value) != null) {
                throw new CompilationException(new ParseError.Duplicate(key.location(),
                                                                        "key '" + key.value() + "'"));
            }
            return value;
        });
        depth--;
        return entries;
    }

    private List<Value> parseArrayElements() throws CompilationException {
        var elements = new ArrayList<Value>();
        enterNested();
        parseDelimited(TokenKind.LBRACKET, TokenKind.RBRACKET, "value", () -> {
            var value = parseValue();
            elements.add(value);
            return value;
        });
        depth--;
        return elements;
    }

    private PathExpr parsePath() throws CompilationException {
        var components = new ArrayList<String>();
        components.add(expectWord("path component").text());
        while (peek().is(TokenKind.DOT)) {
            advance();
            components.add(expectWord("path component").text());
        }
        return new PathExpr(components);
    }

    private Token parseKey() throws CompilationException {
        var token = peek();
        if (isWord(token) || token.is(TokenKind.STRING)) {
            advance();
            return token;
        }
        throw unexpected(token, "key");
    }

    // === Helpers ===

    private void enterNested() throws CompilationException {
        if (++depth > maxNestingDepth) {
            throw new CompilationException(new ParseError.InvalidConstruct(
                peek().location(), "Values nested deeper than " + maxNestingDepth + " levels"));
        }
    }

    @FunctionalInterface
    private interface ElementParser<T> {
        T parse() throws CompilationException;
    }

    /**
     * Parse {@code open (element (',' element)* ','?)? close}.
     */
    private <T> void parseDelimited(TokenKind open, TokenKind close, String element, ElementParser<T> parser)
    throws CompilationException {
        expect(open, open.describe());
        while (!peek().is(close)) {
            if (isAtEnd()) {
                throw unexpected(peek(), element + " or " + close.describe());
            }
            parser.parse();
            if (peek().is(TokenKind.COMMA)) {
                advance();
            } else if (!peek().is(close)) {
                throw unexpected(peek(), "',' or " + close.describe());
            }
        }
        advance();
    }

    private boolean isWord(Token token) {
        return token.is(TokenKind.IDENTIFIER) || token.kind().isKeyword();
    }

    private Token expectWord(String expected) throws CompilationException {
        var token = peek();
        if (!isWord(token)) {
            throw unexpected(token, expected);
        }
        advance();
        return token;
    }

    private Token expect(TokenKind kind, String expected) throws CompilationException {
        var token = peek();
        if (!token.is(kind)) {
            throw unexpected(token, expected);
        }
        advance();
        return token;
    }

    private boolean isAtEnd() {
        return peek().is(TokenKind.EOF);
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++;
        }
    }

    private CompilationException unexpected(Token token, String expected) {
        if (token.is(TokenKind.EOF)) {
            return new CompilationException(new ParseError.UnexpectedEof(token.location(), expected));
        }
        return new CompilationException(new ParseError.UnexpectedInput(token.location(), token.describe(), expected));
    }

    private CompilationException invalid(Token token, String reason) {
        return new CompilationException(new ParseError.InvalidConstruct(token.location(), reason));
    }
}
