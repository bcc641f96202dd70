package org.physlang.dsl.eval;

import org.physlang.dsl.PhysLangException;

/**
 * Failure while evaluating an expression to a number.
 */
public class EvaluationException extends PhysLangException {

    public enum Kind {
        UNKNOWN_VARIABLE,
        DIVISION_BY_ZERO,
        ARGUMENT_COUNT,
        INVALID_DOMAIN,
        NOT_NUMERIC,
        UNRESOLVED_CALL
    }

    private final Kind kind;

    public EvaluationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
