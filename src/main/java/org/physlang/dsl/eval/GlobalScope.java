package org.physlang.dsl.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Values of the top-level let bindings, in declaration order.
 */
public final class GlobalScope implements EvaluationScope {

    private final Map<String, Double> values = new LinkedHashMap<>();

    public void define(String name, double value) {
        values.put(name, value);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    @Override
    public OptionalDouble lookup(String name) {
        Double value = values.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public Map<String, Double> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "GlobalScope" + values;
    }
}
