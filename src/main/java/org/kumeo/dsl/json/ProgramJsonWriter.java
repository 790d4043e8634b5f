package org.kumeo.dsl.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.kumeo.dsl.ast.Agent;
import org.kumeo.dsl.ast.Argument;
import org.kumeo.dsl.ast.Context;
import org.kumeo.dsl.ast.Integration;
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

/**
 * Jackson rendering of a {@link Program}. Tagged variants become objects with a {@code "type"} field.
 */
public final class ProgramJsonWriter {
    static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = MAPPER.getNodeFactory();

    private ProgramJsonWriter() {}

    public static String toJson(Program program) {
        return write(toTree(program));
    }

    public static ObjectNode toTree(Program program) {
        var root = NODES.objectNode();
        var workflows = root.putArray("workflows");
        program.workflows()
               .forEach(workflow -> workflows.add(workflow(workflow)));
        var subworkflows = root.putArray("subworkflows");
        program.subworkflows()
               .forEach(subworkflow -> subworkflows.add(subworkflow(subworkflow)));
        var integrations = root.putArray("integrations");
        program.integrations()
               .forEach(integration -> integrations.add(integration(integration)));
        return root;
    }

    /**
     * Pretty-printed JSON text of a tree built by this package.
     */
    static String write(JsonNode node) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter()
                         .writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON tree", e);
        }
    }

    private static ObjectNode workflow(Workflow workflow) {
        var node = NODES.objectNode();
        node.put("name", workflow.name());
        workflow.source()
                .ifPresent(source -> node.set("source", source.accept(TAGS)));
        workflow.target()
                .ifPresent(target -> node.set("target", target.accept(TAGS)));
        workflow.context()
                .ifPresent(context -> node.set("context", context.accept(TAGS)));
        workflow.preprocessors()
                .ifPresent(agents -> node.set("preprocessors", agents(agents)));
        node.set("agents", agents(workflow.agents()));
        workflow.monitor()
                .ifPresent(monitor -> node.set("monitor", object(monitor)));
        workflow.deployment()
                .ifPresent(deployment -> node.set("deployment", object(deployment)));
        return node;
    }

    private static ObjectNode subworkflow(Subworkflow subworkflow) {
        var node = NODES.objectNode();
        node.put("name", subworkflow.name());
        subworkflow.input()
                   .ifPresent(names -> node.set("input", strings(names)));
        subworkflow.output()
                   .ifPresent(names -> node.set("output", strings(names)));
        subworkflow.context()
                   .ifPresent(context -> node.set("context", context.accept(TAGS)));
        node.set("agents", agents(subworkflow.agents()));
        return node;
    }

    private static ObjectNode integration(Integration integration) {
        var node = NODES.objectNode();
        node.put("workflow", integration.workflow());
        node.put("subworkflow", integration.subworkflow());
        var mapping = node.putObject("mapping");
        mapping.set("input", paths(integration.mapping().input()));
        mapping.set("output", paths(integration.mapping().output()));
        return node;
    }

    private static ArrayNode agents(List<Agent> agents) {
        var array = NODES.arrayNode();
        for (var agent : agents) {
            var node = array.addObject();
            node.put("type", agent.type().name());
            if (agent.type().isCustom()) {
                node.put("custom", true);
            }
            agent.id()
                 .ifPresent(id -> node.put("id", id));
            var arguments = node.putArray("arguments");
            for (var argument : agent.config()) {
                var entry = arguments.addObject();
                if (argument instanceof Argument.Named named) {
                    entry.put("name", named.key());
                }
                entry.set("value", value(argument.value()));
            }
        }
        return array;
    }

    private static ArrayNode strings(List<String> values) {
        var array = NODES.arrayNode();
        values.forEach(array::add);
        return array;
    }

    private static ObjectNode paths(Map<String, PathExpr> paths) {
        var node = NODES.objectNode();
        paths.forEach((key, path) -> node.put(key, path.toString()));
        return node;
    }

    private static ObjectNode object(Map<String, Value> entries) {
        var node = NODES.objectNode();
        entries.forEach((key, value) -> node.set(key, value(value)));
        return node;
    }

    private static ObjectNode tagged(String type) {
        var node = NODES.objectNode();
        node.put("type", type);
        return node;
    }

    private static ObjectNode endpoint(String type, String nameField, String name, Map<String, Value> options) {
        var node = tagged(type);
        node.put(nameField, name);
        node.set("options", object(options));
        return node;
    }

    private static ObjectNode custom(String tag, List<Value> arguments) {
        var node = tagged(tag);
        node.put("custom", true);
        var array = node.putArray("arguments");
        arguments.forEach(argument -> array.add(value(argument)));
        return node;
    }

    private static ObjectNode transport(TransportKind kind, String channel, Map<String, Value> options) {
        return endpoint(kind.tag(), "channel", channel, options);
    }

    private static final TagWriter TAGS = new TagWriter();

    private static final class TagWriter implements Source.Visitor<JsonNode>, Target.Visitor<JsonNode>,
                                                    Context.Visitor<JsonNode> {
        @Override
        public JsonNode visitTransport(Source.Transport source) {
            return transport(source.kind(), source.channel(), source.options());
        }

        @Override
        public JsonNode visitCustom(Source.Custom source) {
            return custom(source.tag(), source.arguments());
        }

        @Override
        public JsonNode visitTransport(Target.Transport target) {
            return transport(target.kind(), target.channel(), target.options());
        }

        @Override
        public JsonNode visitCustom(Target.Custom target) {
            return custom(target.tag(), target.arguments());
        }

        @Override
        public JsonNode visitKnowledgeBase(Context.KnowledgeBase context) {
            return endpoint("KnowledgeBase", "name", context.name(), context.options());
        }

        @Override
        public JsonNode visitBayesianNetwork(Context.BayesianNetwork context) {
            return endpoint("BayesianNetwork", "name", context.name(), context.options());
        }

        @Override
        public JsonNode visitDatabase(Context.Database context) {
            var node = tagged("Database");
            node.put("driver", context.driver());
            node.put("connection", context.connection());
            return node;
        }

        @Override
        public JsonNode visitCustom(Context.Custom context) {
            return custom(context.tag(), context.arguments());
        }
    }

    static JsonNode value(Value value) {
        return value.accept(new Value.Visitor<>() {
            @Override
            public JsonNode visitString(Value.StringValue string) {
                return NODES.textNode(string.value());
            }

            @Override
            public JsonNode visitNumber(Value.NumberValue number) {
                return number.isIntegral()
                       ? NODES.numberNode((long) number.value())
                       : NODES.numberNode(number.value());
            }

            @Override
            public JsonNode visitBoolean(Value.BooleanValue bool) {
                return NODES.booleanNode(bool.value());
            }

            @Override
            public JsonNode visitNull(Value.NullValue nullValue) {
                return NODES.nullNode();
            }

            @Override
            public JsonNode visitObject(Value.ObjectValue object) {
                return object(object.entries());
            }

            @Override
            public JsonNode visitArray(Value.ArrayValue array) {
                var node = NODES.arrayNode();
                array.elements()
                     .forEach(element -> node.add(value(element)));
                return node;
            }

            @Override
            public JsonNode visitPath(Value.PathValue path) {
                var node = tagged("Path");
                node.put("path", path.path().toString());
                return node;
            }
        });
    }
}
