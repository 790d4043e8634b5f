package org.kumeo.dsl.semantic;

import org.kumeo.dsl.ast.Agent;
import org.kumeo.dsl.ast.Integration;
import org.kumeo.dsl.ast.Program;
import org.kumeo.dsl.ast.Source;
import org.kumeo.dsl.ast.Subworkflow;
import org.kumeo.dsl.ast.Target;
import org.kumeo.dsl.ast.Workflow;
import org.kumeo.dsl.error.SemanticError;
import org.kumeo.dsl.error.SemanticError.Code;
import org.kumeo.dsl.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks the invariants a parsed program must satisfy and collects every violation.
 *
 * <p>Runs two passes: declarations go into the {@link SymbolTable} first, then each workflow,
 * subworkflow and integration is checked in program order. All state is reset at the start of
 * {@link #analyze(Program)}, so an instance may be reused but not shared between threads.
 */
public final class SemanticAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final SymbolTable symbols = new SymbolTable();
    private final Map<String, SourceSpan> agentIds = new HashMap<>();
    private final List<SemanticError> errors = new ArrayList<>();

    public AnalysisResult analyze(Program program) {
        symbols.clear();
        agentIds.clear();
        errors.clear();

        declareAll(program);

        for (var workflow : program.workflows()) {
            checkWorkflow(workflow);
        }
        for (var subworkflow : program.subworkflows()) {
            checkSubworkflow(subworkflow);
        }
        for (var integration : program.integrations()) {
            checkIntegration(integration);
        }

        log.debug("Analyzed {} declarations: {} errors", symbols.size(), errors.size());
        return new AnalysisResult(program, errors);
    }

    /**
     * Snapshot of the declarations seen by the last {@link #analyze(Program)} call.
     */
    public SymbolTable symbols() {
        return symbols.copy();
    }

    // === Pass 1 ===

    private void declareAll(Program program) {
        for (var workflow : program.workflows()) {
            declare(workflow.name(), SymbolTable.Kind.WORKFLOW, workflow.span());
        }
        for (var subworkflow : program.subworkflows()) {
            declare(subworkflow.name(), SymbolTable.Kind.SUBWORKFLOW, subworkflow.span());
        }
    }

    private void declare(String name, SymbolTable.Kind kind, SourceSpan span) {
        symbols.declare(name, kind, span)
               .ifPresent(existing -> report(SemanticError.duplicate(Code.DUPLICATE_NAME,
                                                                     span,
                                                                     "Duplicate " + kind.display() + " name: " + name,
                                                                     existing.span())));
    }

    // === Pass 2 ===

    private void checkWorkflow(Workflow workflow) {
        var name = workflow.name();
        if (workflow.source().isEmpty()) {
            report(Code.MISSING_SOURCE, workflow.span(), "Workflow '" + name + "' has no source");
        }
        if (workflow.target().isEmpty()) {
            report(Code.MISSING_TARGET, workflow.span(), "Workflow '" + name + "' has no target");
        }
        workflow.source()
                .flatMap(SemanticAnalyzer::sourceChannel)
                .filter(String::isBlank)
                .ifPresent(channel -> report(Code.EMPTY_CHANNEL,
                                             workflow.source().get().span(),
                                             "Workflow '" + name + "' source has an empty channel"));
        workflow.target()
                .flatMap(SemanticAnalyzer::targetChannel)
                .filter(String::isBlank)
                .ifPresent(channel -> report(Code.EMPTY_CHANNEL,
                                             workflow.target().get().span(),
                                             "Workflow '" + name + "' target has an empty channel"));

        checkAgents(name, workflow.allAgents());
    }

    private void checkSubworkflow(Subworkflow subworkflow) {
        var name = subworkflow.name();
        checkAgents(name, subworkflow.agents());

        if (subworkflow.input().map(List::isEmpty).orElse(true)) {
            report(Code.MISSING_INPUT, subworkflow.span(),
                   "Subworkflow '" + name + "' must declare at least one input");
        }
        if (subworkflow.output().map(List::isEmpty).orElse(true)) {
            report(Code.MISSING_OUTPUT, subworkflow.span(),
                   "Subworkflow '" + name + "' must declare at least one output");
        }
    }

    private void checkIntegration(Integration integration) {
        if (!symbols.isDeclared(integration.workflow(), SymbolTable.Kind.WORKFLOW)) {
            report(Code.UNKNOWN_WORKFLOW, integration.workflowSpan(),
                   "Integration references unknown workflow: " + integration.workflow());
        }
        if (!symbols.isDeclared(integration.subworkflow(), SymbolTable.Kind.SUBWORKFLOW)) {
            report(Code.UNKNOWN_SUBWORKFLOW, integration.subworkflowSpan(),
                   "Integration references unknown subworkflow: " + integration.subworkflow());
        }
    }

    /**
     * Agent ids are unique within one workflow or subworkflow, not across the program.
     */
    private void checkAgents(String owner, List<Agent> agents) {
        agentIds.clear();
        for (var agent : agents) {
            checkAgent(owner, agent);
        }
    }

    private void checkAgent(String owner, Agent agent) {
        var type = agent.type();
        if (agent.id().isEmpty()) {
            report(Code.MISSING_AGENT_ID, agent.span(),
                   type + " agent in '" + owner + "' has no id");
        } else {
            var id = agent.id().get();
            var first = agentIds.putIfAbsent(id, agent.span());
            if (first != null) {
                report(SemanticError.duplicate(Code.DUPLICATE_AGENT_ID,
                                               agent.span(),
                                               "Duplicate agent ID: " + id,
                                               first));
            }
        }

        for (var key : RequiredArguments.of(type.kind())) {
            if (!agent.hasNamedArgument(key)) {
                report(Code.MISSING_ARGUMENT, agent.span(),
                       type + " agent '" + agent.displayName() + "' is missing required argument '" + key + "'");
            }
        }
    }

    private void report(Code code, SourceSpan span, String message) {
        report(SemanticError.of(code, span, message));
    }

    private void report(SemanticError error) {
        log.trace("Semantic error: {}", error);
        errors.add(error);
    }

    private static Optional<String> sourceChannel(Source source) {
        return source instanceof Source.Transport transport
               ? Optional.of(transport.channel())
               : Optional.empty();
    }

    private static Optional<String> targetChannel(Target target) {
        return target instanceof Target.Transport transport
               ? Optional.of(transport.channel())
               : Optional.empty();
    }
}
