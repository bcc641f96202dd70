package org.physlang.dsl.analysis;

import org.physlang.dsl.Span;

import java.util.Objects;
import java.util.Optional;

/**
 * A single analysis finding.
 *
 * @param severity Error findings abort the pipeline, warnings do not
 * @param message  Human readable description
 * @param span     Source location, may be null
 */
public record Diagnostic(Severity severity, String message, Span span) {

    public enum Severity {
        ERROR,
        WARNING
    }

    public Diagnostic {
        Objects.requireNonNull(severity, "Severity cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
    }

    public static Diagnostic error(String message, Span span) {
        return new Diagnostic(Severity.ERROR, message, span);
    }

    public static Diagnostic warning(String message, Span span) {
        return new Diagnostic(Severity.WARNING, message, span);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public Optional<Span> spanOptional() {
        return Optional.ofNullable(span);
    }

    @Override
    public String toString() {
        String prefix = severity == Severity.ERROR ? "error" : "warning";
        return span == null ? prefix + ": " + message : prefix + " at " + span + ": " + message;
    }
}
