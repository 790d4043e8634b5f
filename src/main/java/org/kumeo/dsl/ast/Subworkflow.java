package org.kumeo.dsl.ast;

import org.kumeo.dsl.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Reusable pipeline fragment with explicit parameters.
 *
 * @param span span of the subworkflow name
 */
public record Subworkflow(
 String name,
 Optional<List<String>> input,
 Optional<List<String>> output,
 Optional<Context> context,
 List<Agent> agents,
 SourceSpan span) {

    public Subworkflow {
        input = input.map(List::copyOf);
        output = output.map(List::copyOf);
        agents = List.copyOf(agents);
    }
}
