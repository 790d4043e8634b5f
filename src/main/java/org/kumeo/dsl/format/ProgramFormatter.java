package org.kumeo.dsl.format;

import org.kumeo.dsl.ast.Agent;
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

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pretty-prints a {@link Program} back to Kumeo source in canonical layout.
 *
 * <p>Output re-parses to a program with the same content, and formatting that program again
 * yields the same text.
 */
public final class ProgramFormatter {
    private static final String INDENT = "    ";
    private static final Pattern WORD = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");
    private static final Set<String> LITERAL_WORDS = Set.of("true", "false", "null");

    private final StringBuilder sb = new StringBuilder();

    private ProgramFormatter() {}

    public static String format(Program program) {
        var formatter = new ProgramFormatter();
        formatter.emitProgram(program);
        return formatter.sb.toString();
    }

    private void emitProgram(Program program) {
        boolean first = true;
        for (var workflow : program.workflows()) {
            first = separate(first);
            emitWorkflow(workflow);
        }
        for (var subworkflow : program.subworkflows()) {
            first = separate(first);
            emitSubworkflow(subworkflow);
        }
        for (var integration : program.integrations()) {
            first = separate(first);
            emitIntegration(integration);
        }
    }

    private boolean separate(boolean first) {
        if (!first) {
            sb.append("\n");
        }
        return false;
    }

    private void emitWorkflow(Workflow workflow) {
        sb.append("workflow ").append(workflow.name()).append(" {\n");
        workflow.source().ifPresent(source -> section("source", source.accept(new TagPrinter())));
        workflow.target().ifPresent(target -> section("target", target.accept(new TagPrinter())));
        workflow.context().ifPresent(context -> section("context", context.accept(new TagPrinter())));
        workflow.preprocessors().ifPresent(agents -> agentSection("preprocessors", agents));
        if (!workflow.agents().isEmpty()) {
            agentSection("agents", workflow.agents());
        }
        workflow.monitor().ifPresent(monitor -> section("monitor", object(monitor)));
        workflow.deployment().ifPresent(deployment -> section("deployment", object(deployment)));
        sb.append("}\n");
    }

    private void emitSubworkflow(Subworkflow subworkflow) {
        sb.append("subworkflow ").append(subworkflow.name()).append(" {\n");
        subworkflow.input().ifPresent(names -> section("input", nameList(names)));
        subworkflow.output().ifPresent(names -> section("output", nameList(names)));
        subworkflow.context().ifPresent(context -> section("context", context.accept(new TagPrinter())));
        if (!subworkflow.agents().isEmpty()) {
            agentSection("agents", subworkflow.agents());
        }
        sb.append("}\n");
    }

    private void emitIntegration(Integration integration) {
        sb.append("integration {\n");
        section("workflow", integration.workflow());
        section("subworkflow", integration.subworkflow());
        var mapping = integration.mapping();
        if (!mapping.isEmpty()) {
            emitMapping(mapping);
        }
        sb.append("}\n");
    }

    private void emitMapping(Mapping mapping) {
        sb.append(INDENT).append("mapping: {\n");
        if (!mapping.input().isEmpty()) {
            sb.append(INDENT).append(INDENT).append("input: ").append(pathMap(mapping.input())).append("\n");
        }
        if (!mapping.output().isEmpty()) {
            sb.append(INDENT).append(INDENT).append("output: ").append(pathMap(mapping.output())).append("\n");
        }
        sb.append(INDENT).append("}\n");
    }

    private void section(String name, String content) {
        sb.append(INDENT).append(name).append(": ").append(content).append("\n");
    }

    private void agentSection(String name, List<Agent> agents) {
        if (agents.isEmpty()) {
            section(name, "[]");
            return;
        }
        sb.append(INDENT).append(name).append(": [\n");
        for (int i = 0; i < agents.size(); i++) {
            sb.append(INDENT).append(INDENT).append(agent(agents.get(i)));
            if (i < agents.size() - 1) {
                sb.append(",");
            }
            sb.append("\n");
        }
        sb.append(INDENT).append("]\n");
    }

    // === Inline forms ===

    private static String agent(Agent agent) {
        var args = new StringBuilder();
        agent.id()
             .ifPresent(id -> args.append("id: ").append(quote(id)));
        for (var argument : agent.config()) {
            if (args.length() > 0) {
                args.append(", ");
            }
            args.append(argument(argument));
        }
        return agent.type().name() + "(" + args + ")";
    }

    private static String argument(Argument argument) {
        return argument.accept(new Argument.Visitor<>() {
            @Override
            public String visitPositional(Argument.Positional positional) {
                return value(positional.value());
            }

            @Override
            public String visitNamed(Argument.Named named) {
                return key(named.key()) + ": " + value(named.value());
            }
        });
    }

    private static String nameList(List<String> names) {
        var parts = names.stream()
                         .map(ProgramFormatter::quote)
                         .toList();
        return "[" + String.join(", ", parts) + "]";
    }

    private static String pathMap(Map<String, PathExpr> paths) {
        var parts = paths.entrySet()
                         .stream()
                         .map(entry -> key(entry.getKey()) + ": " + path(entry.getValue()))
                         .toList();
        return "{" + String.join(", ", parts) + "}";
    }

    /**
     * Tag call with a channel or name first and an optional option bag second.
     */
    private static String endpoint(String tag, String name, Map<String, Value> options) {
        if (options.isEmpty()) {
            return tag + "(" + quote(name) + ")";
        }
        return tag + "(" + quote(name) + ", " + object(options) + ")";
    }

    private static String custom(String tag, List<Value> arguments) {
        var parts = arguments.stream()
                             .map(ProgramFormatter::value)
                             .toList();
        return tag + "(" + String.join(", ", parts) + ")";
    }

    private static final class TagPrinter implements Source.Visitor<String>, Target.Visitor<String>,
                                                     Context.Visitor<String> {
        @Override
        public String visitTransport(Source.Transport source) {
            return transport(source.kind(), source.channel(), source.options());
        }

        @Override
        public String visitCustom(Source.Custom source) {
            return custom(source.tag(), source.arguments());
        }

        @Override
        public String visitTransport(Target.Transport target) {
            return transport(target.kind(), target.channel(), target.options());
        }

        @Override
        public String visitCustom(Target.Custom target) {
            return custom(target.tag(), target.arguments());
        }

        @Override
        public String visitKnowledgeBase(Context.KnowledgeBase context) {
            return endpoint("KnowledgeBase", context.name(), context.options());
        }

        @Override
        public String visitBayesianNetwork(Context.BayesianNetwork context) {
            return endpoint("BayesianNetwork", context.name(), context.options());
        }

        @Override
        public String visitDatabase(Context.Database context) {
            return "Database(" + quote(context.driver()) + ", " + quote(context.connection()) + ")";
        }

        @Override
        public String visitCustom(Context.Custom context) {
            return custom(context.tag(), context.arguments());
        }

        private static String transport(TransportKind kind, String channel, Map<String, Value> options) {
            return endpoint(kind.tag(), channel, options);
        }
    }

    // === Values ===

    static String value(Value value) {
        return value.accept(new Value.Visitor<>() {
            @Override
            public String visitString(Value.StringValue string) {
                return quote(string.value());
            }

            @Override
            public String visitNumber(Value.NumberValue number) {
                return number.isIntegral()
                       ? Long.toString((long) number.value())
                       : Double.toString(number.value());
            }

            @Override
            public String visitBoolean(Value.BooleanValue bool) {
                return Boolean.toString(bool.value());
            }

            @Override
            public String visitNull(Value.NullValue nullValue) {
                return "null";
            }

            @Override
            public String visitObject(Value.ObjectValue object) {
                return object(object.entries());
            }

            @Override
            public String visitArray(Value.ArrayValue array) {
                var parts = array.elements()
                                 .stream()
                                 .map(ProgramFormatter::value)
                                 .toList();
                return "[" + String.join(", ", parts) + "]";
            }

            @Override
            public String visitPath(Value.PathValue path) {
                return path(path.path());
            }
        });
    }

    private static String object(Map<String, Value> entries) {
        var parts = entries.entrySet()
                           .stream()
                           .map(entry -> key(entry.getKey()) + ": " + value(entry.getValue()))
                           .toList();
        return "{" + String.join(", ", parts) + "}";
    }

    private static String path(PathExpr path) {
        boolean bare = path.components()
                           .stream()
                           .allMatch(ProgramFormatter::isWord);
        return bare ? path.toString() : quote(path.toString());
    }

    private static String key(String key) {
        return isWord(key) ? key : quote(key);
    }

    private static boolean isWord(String text) {
        return WORD.matcher(text).matches() && !LITERAL_WORDS.contains(text);
    }

    static String quote(String text) {
        var sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
