package org.physlang.dsl.eval;

import java.util.List;

/**
 * Executes a user-defined function whose value is needed inside an expression.
 */
@FunctionalInterface
public interface UserCallHandler {

    /**
     * @param functionName The function to run
     * @param arguments    Argument values, already evaluated in the caller's scope
     * @return The value of the function's {@code return}
     */
    double invoke(String functionName, List<Double> arguments);
}
