package org.kumeo.dsl.ast;

import org.kumeo.dsl.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Top-level pipeline definition.
 *
 * @param preprocessors agents run before {@code agents}
 * @param monitor       opaque monitoring metadata
 * @param deployment    opaque deployment metadata
 * @param span          span of the workflow name
 */
public record Workflow(
 String name,
 Optional<Source> source,
 Optional<Target> target,
 Optional<Context> context,
 Optional<List<Agent>> preprocessors,
 List<Agent> agents,
 Optional<Map<String, Value>> monitor,
 Optional<Map<String, Value>> deployment,
 SourceSpan span) {

    public Workflow {
        preprocessors = preprocessors.map(List::copyOf);
        agents = List.copyOf(agents);
        monitor = monitor.map(AstMaps::orderedCopy);
        deployment = deployment.map(AstMaps::orderedCopy);
    }

    /**
     * Preprocessors followed by agents, the scope of agent-id uniqueness.
     */
    public List<Agent> allAgents() {
        var all = new ArrayList<Agent>(preprocessors.map(List::size).orElse(0) + agents.size());
        preprocessors.ifPresent(all::addAll);
        all.addAll(agents);
        return all;
    }
}
