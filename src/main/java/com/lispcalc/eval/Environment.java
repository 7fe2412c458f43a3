package com.lispcalc.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.lispcalc.error.UnboundVariableException;

/**
 * Variable bindings for one top-level evaluation.
 *
 * There is a single flat map and nothing is ever removed from it: a binding made by a
 * {@code let} stays visible after that {@code let} returns, for the rest of the evaluation
 * (dynamic extent, not lexical scope). Rebinding a name overwrites it.
 */
public class Environment {

    private final Map<String, Integer> values = new LinkedHashMap<>();

    public void define(String name, int value) {
        values.put(name, value);
    }

    public int get(String name) {
        Integer v = values.get(name);
        if (v == null) throw new UnboundVariableException(name);
        return v;
    }

    public int size() {
        return values.size();
    }

    /** Read-only view in binding order. */
    public Map<String, Integer> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
