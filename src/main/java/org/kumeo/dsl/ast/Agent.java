package org.kumeo.dsl.ast;

import org.kumeo.dsl.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * One pipeline stage.
 *
 * @param id     agent id, lifted from the {@code id:} argument
 * @param type   agent type tag
 * @param config remaining arguments in source order
 * @param span   span of the type tag
 */
public record Agent(Optional<String> id, AgentType type, List<Argument> config, SourceSpan span) {

    public Agent {
        config = List.copyOf(config);
    }

    /**
     * Value of the first named argument with the given key.
     */
    public Optional<Value> namedArgument(String key) {
        return config.stream()
                     .filter(Argument.Named.class::isInstance)
                     .map(Argument.Named.class::cast)
                     .filter(named -> named.key().equals(key))
                     .map(Argument.Named::value)
                     .findFirst();
    }

    public boolean hasNamedArgument(String key) {
        return namedArgument(key).isPresent();
    }

    /**
     * Id for messages; agents without an id are shown by their type.
     */
    public String displayName() {
        return id.orElse("<unnamed " + type.name() + ">");
    }
}
