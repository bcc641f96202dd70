package org.physlang.dsl.definition;

import org.physlang.dsl.Span;

/**
 * Base interface for PhysLang statements.
 *
 * Declarations are statements too: inside function bodies and control-flow
 * blocks they produce scene entities when the block is elaborated.
 */
public sealed interface Stmt
        permits LetStmt, CallStmt, ReturnStmt, ParticleDecl, ForceDecl, LoopDecl, WellDecl, DetectorDecl,
        IfStmt, ForStmt, MatchStmt {

    /**
     * Location of the line the statement was parsed from.
     */
    Span span();

    <T> T accept(StmtVisitor<T> visitor);
}
