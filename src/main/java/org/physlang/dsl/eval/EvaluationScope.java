package org.physlang.dsl.eval;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Name lookup used by the expression evaluator.
 */
public interface EvaluationScope {

    /**
     * Resolves a numeric binding, or empty when the name is unbound.
     */
    OptionalDouble lookup(String name);

    /**
     * Resolves a name bound to a particle name by a string argument.
     */
    default Optional<String> stringParameter(String name) {
        return Optional.empty();
    }
}
