package org.kumeo.dsl.semantic;

import org.kumeo.dsl.ast.AgentKind;

import java.util.List;

/**
 * Named arguments each built-in agent kind must be given.
 */
public final class RequiredArguments {

    private RequiredArguments() {}

    public static List<String> of(AgentKind kind) {
        return switch (kind) {
            case LLM -> List.of("engine", "prompt");
            case ML_MODEL -> List.of("model_path");
            case BAYESIAN_NETWORK -> List.of("network_path");
            case DECISION_MATRIX -> List.of("matrix_definition");
            case HUMAN_IN_LOOP -> List.of("notification_channel");
            case ROUTER -> List.of("routing_rules");
            case AGGREGATOR -> List.of("aggregation_method");
            case RULE_ENGINE -> List.of("rules");
            case DATA_NORMALIZER -> List.of("normalization_method");
            case MISSING_VALUE_HANDLER -> List.of("handling_strategy");
            case CUSTOM -> List.of();
        };
    }
}
