package org.physlang.dsl.definition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of a parsed PhysLang program.
 *
 * The parser fills the declaration lists with top-level declarations. During
 * elaboration the generated entities are appended to the same lists; nothing
 * is ever removed. After elaboration the runtime builder only reads it.
 */
public final class Program {

    private final List<LetStmt> lets = new ArrayList<>();
    private final List<FunctionDecl> functions = new ArrayList<>();
    private final List<Stmt> statements = new ArrayList<>();
    private final List<ParticleDecl> particles = new ArrayList<>();
    private final List<ForceDecl> forces = new ArrayList<>();
    private final List<DetectorDecl> detectors = new ArrayList<>();
    private final List<LoopDecl> loops = new ArrayList<>();
    private final List<WellDecl> wells = new ArrayList<>();
    private SimulateDecl simulate;
    private boolean elaborated;

    public List<LetStmt> lets() {
        return Collections.unmodifiableList(lets);
    }

    public List<FunctionDecl> functions() {
        return Collections.unmodifiableList(functions);
    }

    /**
     * Top-level statements executed by the elaborator, in source order.
     */
    public List<Stmt> statements() {
        return Collections.unmodifiableList(statements);
    }

    public List<ParticleDecl> particles() {
        return Collections.unmodifiableList(particles);
    }

    public List<ForceDecl> forces() {
        return Collections.unmodifiableList(forces);
    }

    public List<DetectorDecl> detectors() {
        return Collections.unmodifiableList(detectors);
    }

    public List<LoopDecl> loops() {
        return Collections.unmodifiableList(loops);
    }

    public List<WellDecl> wells() {
        return Collections.unmodifiableList(wells);
    }

    public SimulateDecl simulate() {
        if (simulate == null) {
            throw new IllegalStateException("Program has no simulate declaration");
        }
        return simulate;
    }

    public Optional<SimulateDecl> simulateOptional() {
        return Optional.ofNullable(simulate);
    }

    public boolean isElaborated() {
        return elaborated;
    }

    // ==================== Mutation ====================

    public void addLet(LetStmt let) {
        lets.add(Objects.requireNonNull(let));
    }

    public void addFunction(FunctionDecl function) {
        functions.add(Objects.requireNonNull(function));
    }

    public void addStatement(Stmt statement) {
        statements.add(Objects.requireNonNull(statement));
    }

    public void addParticle(ParticleDecl particle) {
        particles.add(Objects.requireNonNull(particle));
    }

    public void addForce(ForceDecl force) {
        forces.add(Objects.requireNonNull(force));
    }

    public void addDetector(DetectorDecl detector) {
        detectors.add(Objects.requireNonNull(detector));
    }

    public void addLoop(LoopDecl loop) {
        loops.add(Objects.requireNonNull(loop));
    }

    public void addWell(WellDecl well) {
        wells.add(Objects.requireNonNull(well));
    }

    public void setSimulate(SimulateDecl simulate) {
        if (this.simulate != null) {
            throw new IllegalStateException("Program already has a simulate declaration");
        }
        this.simulate = Objects.requireNonNull(simulate);
    }

    /**
     * Records that elaboration has started. A program is elaborated at most once.
     */
    public void markElaborated() {
        if (elaborated) {
            throw new IllegalStateException("Program has already been elaborated");
        }
        elaborated = true;
    }

    @Override
    public String toString() {
        return "Program[lets=" + lets.size()
                + ", functions=" + functions.size()
                + ", statements=" + statements.size()
                + ", particles=" + particles.size()
                + ", forces=" + forces.size()
                + ", detectors=" + detectors.size()
                + ", loops=" + loops.size()
                + ", wells=" + wells.size() + "]";
    }
}
