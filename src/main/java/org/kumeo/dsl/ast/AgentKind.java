package org.kumeo.dsl.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Built-in agent tags, plus {@link #CUSTOM} for any other tag.
 */
public enum AgentKind {
    LLM("LLM"),
    ML_MODEL("MLModel"),
    BAYESIAN_NETWORK("BayesianNetwork"),
    DECISION_MATRIX("DecisionMatrix"),
    HUMAN_IN_LOOP("HumanInLoop"),
    ROUTER("Router"),
    AGGREGATOR("Aggregator"),
    RULE_ENGINE("RuleEngine"),
    DATA_NORMALIZER("DataNormalizer"),
    MISSING_VALUE_HANDLER("MissingValueHandler"),
    CUSTOM(null);

    private final String tag;

    AgentKind(String tag) {
        this.tag = tag;
    }

    /**
     * Source tag of a built-in kind; empty for {@link #CUSTOM}.
     */
    public Optional<String> tag() {
        return Optional.ofNullable(tag);
    }

    public static Optional<AgentKind> fromTag(String tag) {
        return Arrays.stream(values())
                     .filter(kind -> kind.tag != null && kind.tag.equals(tag))
                     .findFirst();
    }
}
