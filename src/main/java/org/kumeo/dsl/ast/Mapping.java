package org.kumeo.dsl.ast;

import java.util.Map;

/**
 * Field bindings of an integration: local field name to path expression, per direction.
 */
public record Mapping(Map<String, PathExpr> input, Map<String, PathExpr> output) {

    public static final Mapping EMPTY = new Mapping(Map.of(), Map.of());

    public Mapping {
        input = AstMaps.orderedCopy(input);
        output = AstMaps.orderedCopy(output);
    }

    public boolean isEmpty() {
        return input.isEmpty() && output.isEmpty();
    }
}
