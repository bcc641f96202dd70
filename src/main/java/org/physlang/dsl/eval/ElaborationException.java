package org.physlang.dsl.eval;

import org.physlang.dsl.PhysLangException;
import org.physlang.dsl.Span;

/**
 * Failure while expanding functions and control flow into scene entities.
 */
public class ElaborationException extends PhysLangException {

    private final Span span;

    public ElaborationException(String message, Span span) {
        super(message);
        this.span = span;
    }

    public ElaborationException(String message, Span span, Throwable cause) {
        super(message, cause);
        this.span = span;
    }

    public Span getSpan() {
        return span;
    }
}
