package com.github.droe.typer;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Variables of one scope. Lookups fall back to the enclosing scope.
 */
public class SymbolTable {
    private final Optional<SymbolTable> parent;
    private final Map<String, Variable> variables = new LinkedHashMap<>();
    private int nextIndex;

    public SymbolTable() {
        this.parent = Optional.empty();
    }

    private SymbolTable(SymbolTable parent) {
        this.parent = Optional.of(parent);
        this.nextIndex = parent.nextIndex;
    }

    public SymbolTable child() {
        return new SymbolTable(this);
    }

    /**
     * Declares {@code name} in this scope. A name already declared in this scope keeps its
     * slot and only has its type replaced.
     */
    public Variable declare(String name, TypeInfo type) {
        var existing = variables.get(name);
        if (existing != null) {
            existing.type(type);
            return existing;
        }
        var variable = new Variable(name, type, nextIndex++);
        variables.put(name, variable);
        return variable;
    }

    public Optional<Variable> lookup(String name) {
        var variable = variables.get(name);
        if (variable != null) {
            return Optional.of(variable);
        }
        return parent.flatMap(p -> p.lookup(name));
    }

    public boolean isDeclaredLocally(String name) {
        return variables.containsKey(name);
    }

    public Collection<Variable> variables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public int size() {
        return nextIndex;
    }
}
