package org.physlang.engine.execution;

import org.physlang.dsl.PhysParser;
import org.physlang.dsl.analysis.Diagnostic;
import org.physlang.dsl.analysis.Diagnostics;
import org.physlang.dsl.analysis.StaticAnalyzer;
import org.physlang.dsl.definition.Program;
import org.physlang.dsl.eval.Elaborator;
import org.physlang.dsl.eval.LetBindings;
import org.physlang.dsl.eval.LetEvaluator;
import org.physlang.engine.physics.Particle;
import org.physlang.engine.runtime.DetectorEvaluator;
import org.physlang.engine.runtime.DetectorResult;
import org.physlang.engine.runtime.ParticleState;
import org.physlang.engine.runtime.RuntimeBuilder;
import org.physlang.engine.runtime.SimulationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for running PhysLang programs.
 *
 * The pipeline is: parse, analyze, evaluate global lets, elaborate, analyze
 * again, build the runtime, step, read detectors. Every stage failure is a
 * {@link org.physlang.dsl.PhysLangException}.
 *
 * Example:
 * <pre>
 * SimulationResult result = new PhysEngine().run(source);
 * double gap = result.detector("gap").orElseThrow();
 * </pre>
 *
 * Front ends that animate the scene use {@link #buildContext(String)} and then
 * call {@link #advanceOneStep(SimulationContext)} and
 * {@link #snapshotParticles(SimulationContext)} per frame.
 */
public final class PhysEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PhysEngine.class);

    private final EngineOptions options;
    private final PhysParser parser;

    public PhysEngine() {
        this(EngineOptions.defaults());
    }

    public PhysEngine(EngineOptions options) {
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.parser = new PhysParser(options.traceParsing());
    }

    public EngineOptions options() {
        return options;
    }

    /**
     * @throws org.physlang.dsl.PhysParseException on a syntax error
     */
    public Program parse(String source) {
        return parser.parseProgram(source);
    }

    /**
     * Runs the checks that match the program's state: before elaboration,
     * particles declared in any block count as known; after it, only
     * generated ones do.
     */
    public Diagnostics analyze(Program program) {
        return StaticAnalyzer.analyze(program);
    }

    /**
     * Runs the program to completion and evaluates its detectors.
     */
    public SimulationResult run(String source) {
        ContextBuild build = buildContext(source);
        SimulationContext context = build.context();
        long start = System.nanoTime();
        context.runToCompletion();
        LOG.debug("Ran {} step(s) in {} ms", context.currentStep(), (System.nanoTime() - start) / 1_000_000);
        List<DetectorResult> detectors = DetectorEvaluator.evaluate(build.program(), context.world());
        return new SimulationResult(detectors, context.currentStep(), build.diagnostics());
    }

    /**
     * Runs every stage up to the runtime build and returns the context at step zero.
     */
    public ContextBuild buildContext(String source) {
        Program program = parse(source);
        Diagnostics collected = new Diagnostics();

        Diagnostics pre = StaticAnalyzer.analyze(program, StaticAnalyzer.Phase.PRE_ELABORATION);
        logWarnings(pre);
        if (pre.hasErrors()) {
            throw new DiagnosticsException(DiagnosticsException.Stage.ANALYSIS, pre);
        }
        collected.merge(pre);

        LetBindings lets = LetEvaluator.evaluate(program.lets());
        if (lets.hasErrors()) {
            throw new DiagnosticsException(DiagnosticsException.Stage.LET_EVALUATION, lets.diagnostics());
        }

        Elaborator.elaborate(program, lets.scope(), options.maxCallDepth());

        Diagnostics post = StaticAnalyzer.analyze(program, StaticAnalyzer.Phase.POST_ELABORATION);
        if (post.hasErrors()) {
            throw new DiagnosticsException(DiagnosticsException.Stage.POST_ELABORATION_ANALYSIS, post);
        }
        collected.merge(post);

        SimulationContext context = RuntimeBuilder.build(program, lets.scope());
        return new ContextBuild(program, context, collected);
    }

    /**
     * Advances the simulation by one step.
     *
     * @return true once the configured number of steps has been run
     */
    public boolean advanceOneStep(SimulationContext context) {
        context.step();
        return context.isFinished();
    }

    public List<ParticleState> snapshotParticles(SimulationContext context) {
        List<ParticleState> states = new ArrayList<>();
        for (Particle particle : context.world().particles()) {
            states.add(new ParticleState(particle.name(), particle.position(), particle.mass()));
        }
        return states;
    }

    private static void logWarnings(Diagnostics diagnostics) {
        for (Diagnostic warning : diagnostics.warnings()) {
            LOG.warn("{}", warning);
        }
    }
}
