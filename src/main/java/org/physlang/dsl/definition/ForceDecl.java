package org.physlang.dsl.definition;

import org.physlang.dsl.Span;

import java.util.Objects;

/**
 * Force declaration between two particles.
 *
 * <pre>
 * force gravity(A, B) G = 1.0
 * force spring(A, B) k = 4.0 rest = 1.0
 * </pre>
 */
public record ForceDecl(NameRef first, NameRef second, ForceKind kind, Span span) implements Stmt {

    public ForceDecl {
        Objects.requireNonNull(first, "First particle cannot be null");
        Objects.requireNonNull(second, "Second particle cannot be null");
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(span, "Span cannot be null");
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visitForce(this);
    }
}
