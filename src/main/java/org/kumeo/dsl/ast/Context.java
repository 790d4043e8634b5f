package org.kumeo.dsl.ast;

import org.kumeo.dsl.tree.SourceSpan;

import java.util.List;
import java.util.Map;

/**
 * Auxiliary knowledge resource consulted by a workflow or subworkflow.
 */
public sealed interface Context {
    SourceSpan span();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitKnowledgeBase(KnowledgeBase context);

        R visitBayesianNetwork(BayesianNetwork context);

        R visitDatabase(Database context);

        R visitCustom(Custom context);
    }

    record KnowledgeBase(String name, Map<String, Value> options, SourceSpan span) implements Context {
        public KnowledgeBase {
            options = AstMaps.orderedCopy(options);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitKnowledgeBase(this);
        }
    }

    record BayesianNetwork(String name, Map<String, Value> options, SourceSpan span) implements Context {
        public BayesianNetwork {
            options = AstMaps.orderedCopy(options);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBayesianNetwork(this);
        }
    }

    /**
     * @param driver     database type, e.g. {@code "postgres"}
     * @param connection connection string, not interpreted
     */
    record Database(String driver, String connection, SourceSpan span) implements Context {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDatabase(this);
        }
    }

    record Custom(String tag, List<Value> arguments, SourceSpan span) implements Context {
        public Custom {
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCustom(this);
        }
    }
}
