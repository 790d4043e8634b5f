package org.kumeo.dsl;

import org.kumeo.dsl.ast.Program;
import org.kumeo.dsl.error.CompilationException;
import org.kumeo.dsl.json.CheckReport;
import org.kumeo.dsl.parser.Parser;
import org.kumeo.dsl.semantic.AnalysisResult;
import org.kumeo.dsl.semantic.SemanticAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Entry point for compiling Kumeo source text.
 *
 * <p>Example usage:
 * <pre>{@code
 * var program = KumeoCompiler.create()
 *                            .compile("""
 *     workflow Alerts {
 *         source: NATS("events")
 *         target: NATS("alerts")
 *         agents: [LLM(id: "triage", engine: "ollama/llama3", prompt: "Classify {{input}}")]
 *     }
 *     """);
 * }</pre>
 *
 * <p>Every call uses fresh lexer, parser and analyzer instances, so one compiler may be shared
 * between threads.
 */
public final class KumeoCompiler {
    private static final Logger log = LoggerFactory.getLogger(KumeoCompiler.class);

    private final CompilerConfig config;

    private KumeoCompiler(CompilerConfig config) {
        this.config = config;
    }

    public static KumeoCompiler create() {
        return create(CompilerConfig.DEFAULT);
    }

    public static KumeoCompiler create(CompilerConfig config) {
        return new KumeoCompiler(config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public CompilerConfig config() {
        return config;
    }

    /**
     * Lex and parse source text without semantic checks.
     */
    public Program parse(String source) throws CompilationException {
        var program = Parser.parse(source, config.maxInputSize(), config.maxNestingDepth());
        log.debug("Parsed {} characters", source.length());
        return program;
    }

    /**
     * Check a parsed program, collecting every semantic error.
     */
    public AnalysisResult analyze(Program program) {
        var result = new SemanticAnalyzer().analyze(program);
        if (result.hasErrors()) {
            log.debug("Semantic analysis failed with {} errors", result.errorCount());
        }
        return result;
    }

    /**
     * Parse and, unless disabled in the configuration, analyze source text.
     *
     * @throws CompilationException carrying a lex error, a parse error or the full batch of semantic errors
     */
    public Program compile(String source) throws CompilationException {
        var program = parse(source);
        if (!config.semanticAnalysis()) {
            return program;
        }
        var validated = analyze(program).orThrow();
        log.debug("Compiled {} workflows, {} subworkflows, {} integrations",
                  validated.workflows().size(),
                  validated.subworkflows().size(),
                  validated.integrations().size());
        return validated;
    }

    /**
     * Parse and analyze source text, reporting failures instead of throwing them.
     */
    public CheckReport check(String source) {
        try {
            return report(parse(source));
        } catch (CompilationException e) {
            log.debug("Check failed before analysis: {}", e.getMessage());
            return CheckReport.failed(Optional.empty(), e.error());
        }
    }

    private CheckReport report(Program program) {
        var result = analyze(program);
        return result.toErrors()
                     .map(errors -> CheckReport.failed(Optional.of(program), errors))
                     .orElseGet(() -> CheckReport.valid(program));
    }

    public static final class Builder {
        private int maxInputSize = CompilerConfig.DEFAULT.maxInputSize();
        private int maxNestingDepth = CompilerConfig.DEFAULT.maxNestingDepth();
        private boolean semanticAnalysis = CompilerConfig.DEFAULT.semanticAnalysis();

        private Builder() {}

        public Builder maxInputSize(int maxInputSize) {
            this.maxInputSize = maxInputSize;
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder semanticAnalysis(boolean enabled) {
            this.semanticAnalysis = enabled;
            return this;
        }

        public KumeoCompiler build() {
            return create(new CompilerConfig(maxInputSize, maxNestingDepth, semanticAnalysis));
        }
    }
}
