package org.kumeo.dsl.ast;

import org.kumeo.dsl.tree.SourceSpan;

import java.util.List;
import java.util.Map;

/**
 * Where a workflow consumes events from.
 */
public sealed interface Source {
    SourceSpan span();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitTransport(Transport source);

        R visitCustom(Custom source);
    }

    /**
     * Built-in transport, e.g. {@code NATS("events", {queue: "workers"})}.
     *
     * @param options option bag; empty when none was given
     */
    record Transport(TransportKind kind, String channel, Map<String, Value> options, SourceSpan span) implements Source {
        public Transport {
            options = AstMaps.orderedCopy(options);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTransport(this);
        }
    }

    /**
     * Any other tag; arguments are kept positionally.
     */
    record Custom(String tag, List<Value> arguments, SourceSpan span) implements Source {
        public Custom {
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCustom(this);
        }
    }
}
