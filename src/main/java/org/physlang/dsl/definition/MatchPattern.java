package org.physlang.dsl.definition;

/**
 * Pattern of a match arm.
 */
public sealed interface MatchPattern permits MatchPattern.Literal, MatchPattern.Wildcard {

    boolean matches(long value);

    /** An integer literal arm: 2 => { ... } */
    record Literal(long value) implements MatchPattern {
        @Override
        public boolean matches(long candidate) {
            return value == candidate;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /** The catch-all arm: _ => { ... } */
    record Wildcard() implements MatchPattern {
        @Override
        public boolean matches(long candidate) {
            return true;
        }

        @Override
        public String toString() {
            return "_";
        }
    }
}
