package dumb.deduce.prop;

import dumb.deduce.Names;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Immutable assignment of truth values to propositional variables. Keys keep
 * their insertion order; equality ignores it.
 */
public final class Model {
    public static final Model EMPTY = new Model(Map.of());

    private final Map<String, Boolean> values;

    private Model(Map<String, Boolean> values) {
        this.values = values;
    }

    public static Model of(Map<String, Boolean> values) {
        var copy = new LinkedHashMap<String, Boolean>(values.size() * 2);
        values.forEach((k, v) -> {
            if (!Names.isPropVariable(requireNonNull(k)))
                throw new IllegalArgumentException("Not a propositional variable: " + k);
            copy.put(k, requireNonNull(v));
        });
        return new Model(Collections.unmodifiableMap(copy));
    }

    /** Pairs of name and value, e.g. {@code of("p", true, "q", false)}. */
    public static Model of(Object... nameValuePairs) {
        if (nameValuePairs.length % 2 != 0)
            throw new IllegalArgumentException("Expected name/value pairs");
        var m = new LinkedHashMap<String, Boolean>();
        for (var i = 0; i < nameValuePairs.length; i += 2)
            m.put((String) nameValuePairs[i], (Boolean) nameValuePairs[i + 1]);
        return of(m);
    }

    public boolean get(String variable) {
        var v = values.get(variable);
        if (v == null) throw new IllegalArgumentException("Model has no value for " + variable);
        return v;
    }

    public boolean contains(String variable) {
        return values.containsKey(variable);
    }

    public List<String> variables() {
        return List.copyOf(values.keySet());
    }

    public int size() {
        return values.size();
    }

    public Model with(String variable, boolean value) {
        var m = new LinkedHashMap<>(values);
        m.put(variable, value);
        return of(m);
    }

    public Map<String, Boolean> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Model m && values.equals(m.values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
