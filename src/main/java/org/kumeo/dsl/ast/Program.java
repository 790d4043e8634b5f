package org.kumeo.dsl.ast;

import java.util.List;
import java.util.Optional;

/**
 * A parsed compilation unit.
 */
public record Program(List<Workflow> workflows, List<Subworkflow> subworkflows, List<Integration> integrations) {

    public static final Program EMPTY = new Program(List.of(), List.of(), List.of());

    public Program {
        workflows = List.copyOf(workflows);
        subworkflows = List.copyOf(subworkflows);
        integrations = List.copyOf(integrations);
    }

    public Optional<Workflow> workflow(String name) {
        return workflows.stream()
                        .filter(w -> w.name().equals(name))
                        .findFirst();
    }

    public Optional<Subworkflow> subworkflow(String name) {
        return subworkflows.stream()
                           .filter(s -> s.name().equals(name))
                           .findFirst();
    }

    public boolean isEmpty() {
        return workflows.isEmpty() && subworkflows.isEmpty() && integrations.isEmpty();
    }
}
