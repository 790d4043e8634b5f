package org.kumeo.dsl.error;

import org.kumeo.dsl.tree.SourceSpan;

import java.util.Optional;

/**
 * One violated program invariant. Never fatal on its own; collected into {@link SemanticErrors}.
 *
 * @param firstDeclared for duplicates, where the name or id was first declared
 */
public record SemanticError(Code code, String message, SourceSpan span, Optional<SourceSpan> firstDeclared) {

    public enum Code {
        DUPLICATE_NAME("E0201"),
        MISSING_SOURCE("E0202"),
        MISSING_TARGET("E0203"),
        EMPTY_CHANNEL("E0204"),
        MISSING_AGENT_ID("E0205"),
        DUPLICATE_AGENT_ID("E0206"),
        MISSING_ARGUMENT("E0207"),
        MISSING_INPUT("E0208"),
        MISSING_OUTPUT("E0209"),
        UNKNOWN_WORKFLOW("E0210"),
        UNKNOWN_SUBWORKFLOW("E0211");

        private final String id;

        Code(String id) {
            this.id = id;
        }

        public String id() {
            return id;
        }
    }

    public static SemanticError of(Code code, SourceSpan span, String message) {
        return new SemanticError(code, message, span, Optional.empty());
    }

    public static SemanticError duplicate(Code code, SourceSpan span, String message, SourceSpan firstDeclared) {
        return new SemanticError(code, message, span, Optional.of(firstDeclared));
    }

    public Diagnostic toDiagnostic() {
        var diagnostic = firstDeclared.map(first -> Diagnostic.error(code.id(), message, span)
                                                              .withLabel("declared again here")
                                                              .withSecondaryLabel(first, "first declared here"))
                                      .orElseGet(() -> Diagnostic.error(code.id(), message, span));
        var help = switch (code) {
            case DUPLICATE_NAME -> "workflows and subworkflows share one namespace";
            case MISSING_SOURCE -> "add a section such as source: NATS(\"events\")";
            case MISSING_TARGET -> "add a section such as target: NATS(\"results\")";
            case EMPTY_CHANNEL, DUPLICATE_AGENT_ID, UNKNOWN_WORKFLOW, UNKNOWN_SUBWORKFLOW -> null;
            case MISSING_AGENT_ID -> "add id: \"...\" to the agent's arguments";
            case MISSING_ARGUMENT -> "required arguments are passed by name, e.g. key: value";
            case MISSING_INPUT -> "declare parameters such as input: [\"text\"]";
            case MISSING_OUTPUT -> "declare parameters such as output: [\"result\"]";
        };
        return help == null ? diagnostic : diagnostic.withHelp(help);
    }

    @Override
    public String toString() {
        return code.id() + " " + span.start() + ": " + message;
    }
}
