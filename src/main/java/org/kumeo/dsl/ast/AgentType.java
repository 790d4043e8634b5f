package org.kumeo.dsl.ast;

/**
 * Agent type as written in source: a built-in kind or a custom tag.
 *
 * @param kind built-in kind, or {@link AgentKind#CUSTOM}
 * @param name tag text as it appears in source
 */
public record AgentType(AgentKind kind, String name) {

    public static AgentType of(AgentKind kind) {
        var tag = kind.tag()
                      .orElseThrow(() -> new IllegalArgumentException("Custom agent type requires a name"));
        return new AgentType(kind, tag);
    }

    public static AgentType custom(String name) {
        return new AgentType(AgentKind.CUSTOM, name);
    }

    public static AgentType fromTag(String tag) {
        return AgentKind.fromTag(tag)
                        .map(AgentType::of)
                        .orElseGet(() -> custom(tag));
    }

    public boolean isCustom() {
        return kind == AgentKind.CUSTOM;
    }

    @Override
    public String toString() {
        return name;
    }
}
