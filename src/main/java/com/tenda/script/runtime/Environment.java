package com.tenda.script.runtime;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One lexical scope: name to {@link ValueCell}. Lookups here never look past this
 * scope; walking the scope chain is {@link Stack}'s job.
 */
public class Environment implements Iterable<Map.Entry<String, ValueCell>> {

    private final Map<String, ValueCell> vars = new LinkedHashMap<>();

    public Environment() {}

    /** Copies the bindings (the cells themselves, not their values) of another environment. */
    public Environment(Environment other) {
        if (other != null) vars.putAll(other.vars);
    }

    /** @throws RuntimeError ALREADY_DECLARED when the name is bound in this scope already */
    public void declare(String name, ValueCell cell) {
        if (vars.containsKey(name)) {
            throw new RuntimeError(Diagnostic.alreadyDeclared(name));
        }
        upsert(name, cell);
    }

    /** Binds unconditionally, replacing any previous cell for the name. */
    public void upsert(String name, ValueCell cell) {
        if (name == null || cell == null) throw new IllegalArgumentException("name and cell are required");
        vars.put(name, cell);
    }

    /** @return the cell, or null when the name is not bound here */
    public ValueCell lookup(String name) {
        return vars.get(name);
    }

    public boolean has(String name) {
        return vars.containsKey(name);
    }

    /**
     * Writes through a shared cell; replaces an owned one with a fresh owned cell.
     *
     * @throws RuntimeError UNDEFINED_VARIABLE when the name is not bound here
     */
    public void assign(String name, Value value) {
        ValueCell cell = vars.get(name);
        if (cell == null) throw new RuntimeError(Diagnostic.undefinedVariable(name));
        if (cell.isShared()) {
            cell.set(value);
        } else {
            vars.put(name, ValueCell.owned(value));
        }
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(vars.keySet());
    }

    public int size() {
        return vars.size();
    }

    @Override
    public Iterator<Map.Entry<String, ValueCell>> iterator() {
        return Collections.unmodifiableMap(vars).entrySet().iterator();
    }

    /** Current values by name, in declaration order. */
    public Map<String, Value> snapshotValues() {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, ValueCell> e : vars.entrySet()) {
            out.put(e.getKey(), e.getValue().read());
        }
        return out;
    }

    @Override
    public String toString() {
        return vars.toString();
    }
}
