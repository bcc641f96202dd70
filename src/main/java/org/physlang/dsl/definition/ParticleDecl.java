package org.physlang.dsl.definition;

import org.physlang.dsl.Expr;
import org.physlang.dsl.Span;

import java.util.Objects;

/**
 * Particle declaration: particle A at (0.0, 1.5) mass 2.0
 *
 * @param name The particle name
 * @param x    Initial x coordinate
 * @param y    Initial y coordinate
 * @param mass Mass, expected to be positive
 * @param span Source location
 */
public record ParticleDecl(NameRef name, Expr x, Expr y, Expr mass, Span span) implements Stmt {

    public ParticleDecl {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(x, "X cannot be null");
        Objects.requireNonNull(y, "Y cannot be null");
        Objects.requireNonNull(mass, "Mass cannot be null");
        Objects.requireNonNull(span, "Span cannot be null");
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visitParticle(this);
    }
}
