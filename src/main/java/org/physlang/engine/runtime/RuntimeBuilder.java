package org.physlang.engine.runtime;

import org.physlang.dsl.Expr;
import org.physlang.dsl.Span;
import org.physlang.dsl.definition.ConditionExpr;
import org.physlang.dsl.definition.ForceDecl;
import org.physlang.dsl.definition.ForceKind;
import org.physlang.dsl.definition.LoopDecl;
import org.physlang.dsl.definition.LoopKind;
import org.physlang.dsl.definition.NameRef;
import org.physlang.dsl.definition.Observable;
import org.physlang.dsl.definition.ParticleDecl;
import org.physlang.dsl.definition.Program;
import org.physlang.dsl.definition.PushAction;
import org.physlang.dsl.definition.SimulateDecl;
import org.physlang.dsl.definition.WellDecl;
import org.physlang.dsl.eval.EvaluationException;
import org.physlang.dsl.eval.ExprEvaluator;
import org.physlang.dsl.eval.GlobalScope;
import org.physlang.engine.physics.Force;
import org.physlang.engine.physics.Particle;
import org.physlang.engine.physics.Vec2;
import org.physlang.engine.physics.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an elaborated program into a runnable {@link SimulationContext}.
 *
 * Particle names are replaced by dense indices in declaration order and
 * every remaining expression is evaluated against the global scope.
 */
public final class RuntimeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(RuntimeBuilder.class);

    private final GlobalScope globals;
    private final Map<String, Integer> indices = new HashMap<>();

    private RuntimeBuilder(GlobalScope globals) {
        this.globals = globals;
    }

    /**
     * @throws RuntimeBuildException if a value is out of range or a name does not resolve
     */
    public static SimulationContext build(Program program, GlobalScope globals) {
        return new RuntimeBuilder(globals).buildContext(program);
    }

    private SimulationContext buildContext(Program program) {
        List<Particle> particles = new ArrayList<>();
        for (ParticleDecl decl : program.particles()) {
            String name = decl.name().name();
            if (indices.putIfAbsent(name, particles.size()) != null) {
                throw new RuntimeBuildException("Duplicate particle '" + name + "'", decl.span());
            }
            double mass = evaluate(decl.mass(), decl.span());
            Vec2 position = new Vec2(evaluate(decl.x(), decl.span()), evaluate(decl.y(), decl.span()));
            particles.add(Particle.atRest(name, position, mass));
        }

        List<Force> forces = new ArrayList<>();
        for (ForceDecl decl : program.forces()) {
            forces.add(buildForce(decl));
        }
        World world = new World(particles, forces);

        List<LoopInstance> loops = new ArrayList<>();
        for (LoopDecl decl : program.loops()) {
            loops.add(buildLoop(decl));
        }
        List<WellInstance> wells = new ArrayList<>();
        for (WellDecl decl : program.wells()) {
            wells.add(new WellInstance(decl.name(), index(decl.target(), decl.span()),
                    observation(decl.observable(), decl.span()),
                    evaluate(decl.threshold(), decl.span()), evaluate(decl.depth(), decl.span())));
        }

        SimulateDecl simulate = program.simulate();
        double dt = evaluate(simulate.dt(), simulate.span());
        if (!Double.isFinite(dt)) {
            throw new RuntimeBuildException("dt must be finite, got " + dt, simulate.span());
        }
        long steps = integer(evaluate(simulate.steps(), simulate.span()), 1, "steps", simulate.span());

        LOG.debug("Built world with {} particle(s), {} force(s), {} loop(s), {} well(s); dt={} steps={}",
                particles.size(), forces.size(), loops.size(), wells.size(), dt, steps);
        return new SimulationContext(world, loops, wells, dt, steps);
    }

    private Force buildForce(ForceDecl decl) {
        int first = index(decl.first(), decl.span());
        int second = index(decl.second(), decl.span());
        if (decl.kind() instanceof ForceKind.Gravity gravity) {
            return new Force.Gravity(first, second, evaluate(gravity.g(), decl.span()));
        }
        ForceKind.Spring spring = (ForceKind.Spring) decl.kind();
        return new Force.Spring(first, second, evaluate(spring.k(), decl.span()),
                evaluate(spring.rest(), decl.span()));
    }

    private LoopInstance buildLoop(LoopDecl decl) {
        int target = index(decl.target(), decl.span());
        double frequency = evaluate(decl.frequency(), decl.span());
        double damping = evaluate(decl.damping(), decl.span());
        List<Impulse> body = new ArrayList<>();
        for (PushAction push : decl.body()) {
            body.add(new Impulse(index(push.target(), push.span()), evaluate(push.magnitude(), push.span()),
                    new Vec2(evaluate(push.directionX(), push.span()), evaluate(push.directionY(), push.span()))));
        }
        if (decl.kind() instanceof LoopKind.ForCycles cycles) {
            long count = integer(evaluate(cycles.cycles(), decl.span()), 0, "cycles", decl.span());
            return new CycleLoop(decl.label(), target, count, frequency, damping, body);
        }
        ConditionExpr condition = ((LoopKind.WhileCondition) decl.kind()).condition();
        LoopCondition loopCondition = new LoopCondition(observation(condition.observable(), decl.span()),
                condition.comparison(), evaluate(condition.threshold(), decl.span()));
        return new ConditionLoop(decl.label(), target, loopCondition, frequency, damping, body);
    }

    private Observation observation(Observable observable, Span span) {
        if (observable instanceof Observable.PositionX x) {
            return new Observation.PositionX(index(x.particle(), span));
        }
        if (observable instanceof Observable.PositionY y) {
            return new Observation.PositionY(index(y.particle(), span));
        }
        Observable.Distance distance = (Observable.Distance) observable;
        return new Observation.Distance(index(distance.first(), span), index(distance.second(), span));
    }

    private int index(NameRef ref, Span span) {
        Integer index = indices.get(ref.name());
        if (index == null) {
            throw new RuntimeBuildException("Unknown particle '" + ref.name() + "'", span);
        }
        return index;
    }

    private double evaluate(Expr expr, Span span) {
        try {
            return ExprEvaluator.evaluate(expr, globals);
        } catch (EvaluationException e) {
            throw new RuntimeBuildException(e.getMessage(), span, e);
        }
    }

    private static long integer(double value, long minimum, String what, Span span) {
        if (!Double.isFinite(value) || value != Math.rint(value) || value < minimum) {
            throw new RuntimeBuildException(what + " must be an integer >= " + minimum + ", got " + value, span);
        }
        return (long) value;
    }
}
