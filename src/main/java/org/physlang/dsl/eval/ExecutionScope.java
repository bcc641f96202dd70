package org.physlang.dsl.eval;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Bindings visible while elaborating one block.
 *
 * Lookup order is local lets, then parameters, then globals. Nested blocks
 * work on a {@link #derive() derived} copy so their locals do not leak out.
 */
public final class ExecutionScope implements EvaluationScope {

    private final GlobalScope globals;
    private final Map<String, Double> parameters;
    private final Map<String, String> stringParameters;
    private final Map<String, Double> locals;

    private ExecutionScope(GlobalScope globals, Map<String, Double> parameters,
                           Map<String, String> stringParameters, Map<String, Double> locals) {
        this.globals = Objects.requireNonNull(globals, "Globals cannot be null");
        this.parameters = parameters;
        this.stringParameters = stringParameters;
        this.locals = locals;
    }

    public static ExecutionScope topLevel(GlobalScope globals) {
        return new ExecutionScope(globals, Map.of(), Map.of(), new HashMap<>());
    }

    /**
     * Fresh frame for a function body: globals plus the call's arguments.
     */
    public static ExecutionScope forCall(GlobalScope globals, Map<String, Double> parameters,
                                         Map<String, String> stringParameters) {
        return new ExecutionScope(globals, Map.copyOf(parameters), Map.copyOf(stringParameters), new HashMap<>());
    }

    /**
     * Copy for a nested block. Locals bound in the copy are invisible here.
     */
    public ExecutionScope derive() {
        return new ExecutionScope(globals, parameters, stringParameters, new HashMap<>(locals));
    }

    public void bindLocal(String name, double value) {
        locals.put(name, value);
    }

    public GlobalScope globals() {
        return globals;
    }

    @Override
    public OptionalDouble lookup(String name) {
        Double value = locals.get(name);
        if (value == null) {
            value = parameters.get(name);
        }
        if (value != null) {
            return OptionalDouble.of(value);
        }
        return globals.lookup(name);
    }

    @Override
    public Optional<String> stringParameter(String name) {
        if (locals.containsKey(name)) {
            return Optional.empty();
        }
        return Optional.ofNullable(stringParameters.get(name));
    }
}
