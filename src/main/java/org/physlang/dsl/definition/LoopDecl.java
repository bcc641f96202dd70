package org.physlang.dsl.definition;

import org.physlang.dsl.Expr;
import org.physlang.dsl.Span;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Scripted oscillator that periodically applies impulses.
 *
 * <pre>
 * loop kick for 3 cycles with frequency 2.0 damping 0.0 on A {
 *     force push(A) magnitude 1.0 direction (1.0, 0.0)
 * }
 * </pre>
 *
 * @param label     Optional label, may be null
 * @param kind      Cycle count or while condition
 * @param frequency Phase frequency in cycles per unit time
 * @param damping   Phase damping coefficient
 * @param target    Particle the loop is attached to
 * @param body      Push actions fired on each phase wrap
 * @param span      Source location of the loop header
 */
public record LoopDecl(
        String label,
        LoopKind kind,
        Expr frequency,
        Expr damping,
        NameRef target,
        List<PushAction> body,
        Span span) implements Stmt {

    public LoopDecl {
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(frequency, "Frequency cannot be null");
        Objects.requireNonNull(damping, "Damping cannot be null");
        Objects.requireNonNull(target, "Target cannot be null");
        body = List.copyOf(Objects.requireNonNull(body, "Body cannot be null"));
        Objects.requireNonNull(span, "Span cannot be null");
    }

    public Optional<String> labelOptional() {
        return Optional.ofNullable(label);
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visitLoop(this);
    }
}
