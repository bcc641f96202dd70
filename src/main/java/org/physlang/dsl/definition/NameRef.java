package org.physlang.dsl.definition;

import java.util.Objects;

/**
 * A particle name as written in source.
 *
 * A quoted name ({@code "A"}) is always literal. A bare identifier used inside
 * a function body may name a string parameter, in which case the caller's
 * argument replaces it during elaboration.
 *
 * @param name   The name without quotes
 * @param quoted Whether the name was written as a string literal
 */
public record NameRef(String name, boolean quoted) {

    public NameRef {
        Objects.requireNonNull(name, "Name cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Particle name cannot be empty");
        }
    }

    public static NameRef literal(String name) {
        return new NameRef(name, true);
    }

    public static NameRef bare(String name) {
        return new NameRef(name, false);
    }

    @Override
    public String toString() {
        return quoted ? "\"" + name + "\"" : name;
    }
}
