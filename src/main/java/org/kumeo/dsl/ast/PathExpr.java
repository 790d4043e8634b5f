package org.kumeo.dsl.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Dotted identifier chain, e.g. {@code event.payload.text}.
 */
public record PathExpr(List<String> components) {

    public PathExpr {
        if (components.isEmpty()) {
            throw new IllegalArgumentException("Path must have at least one component");
        }
        components = List.copyOf(components);
    }

    public static PathExpr of(String... components) {
        return new PathExpr(Arrays.asList(components));
    }

    public static PathExpr parse(String dotted) {
        return new PathExpr(Arrays.asList(dotted.split("\\.", -1)));
    }

    @Override
    public String toString() {
        return String.join(".", components);
    }
}
