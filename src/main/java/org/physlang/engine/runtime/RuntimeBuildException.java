package org.physlang.engine.runtime;

import org.physlang.dsl.PhysLangException;
import org.physlang.dsl.Span;

/**
 * The elaborated program cannot be turned into a runnable simulation.
 */
public class RuntimeBuildException extends PhysLangException {

    private final Span span;

    public RuntimeBuildException(String message, Span span) {
        super(message);
        this.span = span;
    }

    public RuntimeBuildException(String message, Span span, Throwable cause) {
        super(message, cause);
        this.span = span;
    }

    public Span getSpan() {
        return span;
    }
}
