package org.physlang.dsl.definition;

import org.physlang.dsl.Span;

import java.util.Objects;

/**
 * detect gap = distance(A, B)
 */
public record DetectorDecl(String name, DetectorKind kind, Span span) implements Stmt {

    public DetectorDecl {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(span, "Span cannot be null");
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visitDetector(this);
    }
}
