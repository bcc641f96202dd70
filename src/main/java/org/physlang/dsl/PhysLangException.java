package org.physlang.dsl;

/**
 * Base class of every failure raised by the PhysLang pipeline.
 * Stage-specific subclasses carry their own location or diagnostic detail.
 */
public class PhysLangException extends RuntimeException {

    public PhysLangException(String message) {
        super(message);
    }

    public PhysLangException(String message, Throwable cause) {
        super(message, cause);
    }
}
