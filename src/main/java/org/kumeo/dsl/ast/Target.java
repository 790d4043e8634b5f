package org.kumeo.dsl.ast;

import org.kumeo.dsl.tree.SourceSpan;

import java.util.List;
import java.util.Map;

/**
 * Where a workflow emits its results.
 */
public sealed interface Target {
    SourceSpan span();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitTransport(Transport target);

        R visitCustom(Custom target);
    }

    /**
     * Built-in transport. {@link TransportKind#TIMER} is rejected by the parser.
     *
     * @param options option bag; empty when none was given
     */
    record Transport(TransportKind kind, String channel, Map<String, Value> options, SourceSpan span) implements Target {
        public Transport {
            if (!kind.isTargetCapable()) {
                throw new IllegalArgumentException(kind.tag() + " cannot be used as a target");
            }
            options = AstMaps.orderedCopy(options);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTransport(this);
        }
    }

    record Custom(String tag, List<Value> arguments, SourceSpan span) implements Target {
        public Custom {
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCustom(this);
        }
    }
}
