package org.kumeo.dsl.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

final class AstMaps {
    private AstMaps() {}

    /**
     * Unmodifiable copy that keeps insertion order.
     */
    static <V> Map<String, V> orderedCopy(Map<String, ? extends V> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
