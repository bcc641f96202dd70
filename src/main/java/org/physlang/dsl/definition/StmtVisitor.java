package org.physlang.dsl.definition;

/**
 * Visitor for {@link Stmt} nodes.
 *
 * @param <T> The result type
 */
public interface StmtVisitor<T> {

    T visitLet(LetStmt let);

    T visitCall(CallStmt call);

    T visitReturn(ReturnStmt ret);

    T visitParticle(ParticleDecl particle);

    T visitForce(ForceDecl force);

    T visitLoop(LoopDecl loop);

    T visitWell(WellDecl well);

    T visitDetector(DetectorDecl detector);

    T visitIf(IfStmt ifStmt);

    T visitFor(ForStmt forStmt);

    T visitMatch(MatchStmt match);
}
