package org.physlang.dsl.definition;

import org.physlang.dsl.Expr;

import java.util.Objects;

/**
 * How long a scripted loop keeps firing.
 */
public sealed interface LoopKind permits LoopKind.ForCycles, LoopKind.WhileCondition {

    /**
     * Fires a fixed number of times.
     */
    record ForCycles(Expr cycles) implements LoopKind {
        public ForCycles {
            Objects.requireNonNull(cycles, "Cycles cannot be null");
        }
    }

    /**
     * Fires on every phase wrap while the condition holds.
     */
    record WhileCondition(ConditionExpr condition) implements LoopKind {
        public WhileCondition {
            Objects.requireNonNull(condition, "Condition cannot be null");
        }
    }
}
