package org.kumeo.dsl.semantic;

import org.kumeo.dsl.tree.SourceSpan;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Declared workflow and subworkflow names. Both kinds share one namespace.
 *
 * <p>A name declared twice keeps its first declaration for {@link #lookup(String)}, but every
 * kind it was declared with still counts for {@link #isDeclared(String, Kind)}.
 */
public final class SymbolTable {

    public enum Kind {
        WORKFLOW("workflow"),
        SUBWORKFLOW("subworkflow");

        private final String display;

        Kind(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A declaration: the name, what it declares and where.
     */
    public record Symbol(String name, Kind kind, SourceSpan span) {}

    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final Map<Kind, Set<String>> namesByKind = new EnumMap<>(Kind.class);

    SymbolTable() {
        for (var kind : Kind.values()) {
            namesByKind.put(kind, new HashSet<>());
        }
    }

    /**
     * Record a declaration. A taken name is still recorded under the new kind.
     *
     * @return the earlier declaration when the name was already declared
     */
    Optional<Symbol> declare(String name, Kind kind, SourceSpan span) {
        namesByKind.get(kind).add(name);
        var existing = symbols.putIfAbsent(name, new Symbol(name, kind, span));
        return Optional.ofNullable(existing);
    }

    public Optional<Symbol> lookup(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * True when the name was declared with the given kind, even as a duplicate.
     */
    public boolean isDeclared(String name, Kind kind) {
        return namesByKind.get(kind).contains(name);
    }

    public Collection<Symbol> symbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    public int size() {
        return symbols.size();
    }

    SymbolTable copy() {
        var copy = new SymbolTable();
        copy.symbols.putAll(symbols);
        namesByKind.forEach((kind, names) -> copy.namesByKind.get(kind).addAll(names));
        return copy;
    }

    void clear() {
        symbols.clear();
        namesByKind.values().forEach(Set::clear);
    }
}
