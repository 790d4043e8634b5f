package org.kumeo.dsl.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.kumeo.dsl.Fixtures;
import org.kumeo.dsl.ast.Program;
import org.kumeo.dsl.error.CompilationException;
import org.kumeo.dsl.parser.Parser;

import static org.junit.jupiter.api.Assertions.*;

class ProgramJsonWriterTest {

    @Test
    void toTree_fullFixture_rendersTaggedVariants() throws CompilationException {
        var tree = ProgramJsonWriter.toTree(Parser.parse(Fixtures.load("pipeline.kumeo")));

        var workflow = tree.get("workflows").get(0);
        assertEquals("DocumentTriage", workflow.get("name").asText());
        assertEquals("NATS", workflow.get("source").get("type").asText());
        assertEquals("documents.incoming", workflow.get("source").get("channel").asText());
        assertEquals("triage", workflow.get("source").get("options").get("queue").asText());
        assertEquals("Kafka", workflow.get("target").get("type").asText());
        assertEquals("KnowledgeBase", workflow.get("context").get("type").asText());
        assertEquals(300, workflow.get("context").get("options").get("refresh").asInt());

        var classifier = workflow.get("agents").get(0);
        assertEquals("LLM", classifier.get("type").asText());
        assertEquals("classifier", classifier.get("id").asText());
        assertEquals("engine", classifier.get("arguments").get(0).get("name").asText());
        assertEquals(2, workflow.get("preprocessors").size());
        assertEquals(0.95, workflow.get("monitor").get("alert_threshold").asDouble());
        assertTrue(workflow.get("deployment").get("replicas").isIntegralNumber());

        var subworkflow = tree.get("subworkflows").get(0);
        assertEquals("Database", subworkflow.get("context").get("type").asText());
        assertEquals("text", subworkflow.get("input").get(0).asText());

        var integration = tree.get("integrations").get(0);
        assertEquals("event.payload.body", integration.get("mapping").get("input").get("text").asText());
    }

    @Test
    void toTree_customVariants_areFlagged() throws CompilationException {
        var tree = ProgramJsonWriter.toTree(Parser.parse("""
            workflow W {
                source: Webhook("orders")
                agents: [Translator(id: "t", "es")]
                monitor: {ref: event.id}
            }
            """));

        var workflow = tree.get("workflows").get(0);
        assertEquals("Webhook", workflow.get("source").get("type").asText());
        assertTrue(workflow.get("source").get("custom").asBoolean());
        assertEquals("orders", workflow.get("source").get("arguments").get(0).asText());

        var agent = workflow.get("agents").get(0);
        assertTrue(agent.get("custom").asBoolean());
        assertFalse(agent.get("arguments").get(0).has("name"));

        var ref = workflow.get("monitor").get("ref");
        assertEquals("Path", ref.get("type").asText());
        assertEquals("event.id", ref.get("path").asText());
        assertFalse(workflow.has("target"));
    }

    @Test
    void toJson_emptyProgram_isParseableJson() throws Exception {
        var json = ProgramJsonWriter.toJson(Program.EMPTY);

        var parsed = new ObjectMapper().readTree(json);
        assertEquals(0, parsed.get("workflows").size());
        assertEquals(0, parsed.get("subworkflows").size());
        assertEquals(0, parsed.get("integrations").size());
    }
}
