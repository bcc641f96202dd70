package org.physlang.dsl.eval;

import org.physlang.dsl.Expr;
import org.physlang.dsl.NumberLiteral;
import org.physlang.dsl.Span;
import org.physlang.dsl.StringLiteral;
import org.physlang.dsl.VariableRef;
import org.physlang.dsl.definition.CallStmt;
import org.physlang.dsl.definition.ConditionExpr;
import org.physlang.dsl.definition.DetectorDecl;
import org.physlang.dsl.definition.DetectorKind;
import org.physlang.dsl.definition.ForStmt;
import org.physlang.dsl.definition.ForceDecl;
import org.physlang.dsl.definition.ForceKind;
import org.physlang.dsl.definition.FunctionDecl;
import org.physlang.dsl.definition.IfStmt;
import org.physlang.dsl.definition.LetStmt;
import org.physlang.dsl.definition.LoopDecl;
import org.physlang.dsl.definition.LoopKind;
import org.physlang.dsl.definition.MatchArm;
import org.physlang.dsl.definition.MatchStmt;
import org.physlang.dsl.definition.NameRef;
import org.physlang.dsl.definition.Observable;
import org.physlang.dsl.definition.ParticleDecl;
import org.physlang.dsl.definition.Program;
import org.physlang.dsl.definition.PushAction;
import org.physlang.dsl.definition.ReturnStmt;
import org.physlang.dsl.definition.Stmt;
import org.physlang.dsl.definition.StmtVisitor;
import org.physlang.dsl.definition.WellDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Expands user functions and control flow into concrete scene entities.
 *
 * Top-level statements run in source order against an explicit
 * {@link ExecutionScope}. Declarations reached during execution have their
 * expressions evaluated to literals and their particle names resolved, then
 * are appended to the program. Nested blocks get a derived copy of the
 * bindings; the program itself is shared.
 *
 * A function called as a statement may take string arguments, which name
 * particles inside its body. A function called inside an expression takes
 * numbers only and must execute a {@code return}.
 */
public final class Elaborator implements UserCallHandler {

    private static final Logger LOG = LoggerFactory.getLogger(Elaborator.class);

    public static final int DEFAULT_MAX_CALL_DEPTH = 256;

    private final Program program;
    private final GlobalScope globals;
    private final int maxCallDepth;
    private final Map<String, FunctionDecl> functions = new LinkedHashMap<>();
    private final Set<String> particleNames = new HashSet<>();
    private int callDepth;

    private Elaborator(Program program, GlobalScope globals, int maxCallDepth) {
        this.program = program;
        this.globals = globals;
        this.maxCallDepth = maxCallDepth;
        for (FunctionDecl function : program.functions()) {
            functions.putIfAbsent(function.name(), function);
        }
        for (ParticleDecl particle : program.particles()) {
            particleNames.add(particle.name().name());
        }
    }

    public static void elaborate(Program program, GlobalScope globals) {
        elaborate(program, globals, DEFAULT_MAX_CALL_DEPTH);
    }

    /**
     * Executes the program's top-level statements, appending every generated
     * entity to {@code program}.
     *
     * @throws ElaborationException on the first failure; later statements are not run
     * @throws IllegalStateException if the program was already elaborated
     */
    public static void elaborate(Program program, GlobalScope globals, int maxCallDepth) {
        program.markElaborated();
        Elaborator elaborator = new Elaborator(program, globals, maxCallDepth);
        int particlesBefore = program.particles().size();
        int forcesBefore = program.forces().size();
        elaborator.executeBlock(program.statements(), ExecutionScope.topLevel(globals));
        LOG.debug("Elaboration generated {} particle(s) and {} force(s)",
                program.particles().size() - particlesBefore, program.forces().size() - forcesBefore);
    }

    /**
     * Runs statements until one returns. Empty means the block completed normally.
     */
    private OptionalDouble executeBlock(List<Stmt> statements, ExecutionScope scope) {
        StatementExecutor executor = new StatementExecutor(scope);
        for (Stmt stmt : statements) {
            OptionalDouble result;
            try {
                result = stmt.accept(executor);
            } catch (EvaluationException e) {
                throw new ElaborationException(e.getMessage(), stmt.span(), e);
            }
            if (result.isPresent()) {
                return result;
            }
        }
        return OptionalDouble.empty();
    }

    // ==================== Calls ====================

    @Override
    public double invoke(String functionName, List<Double> arguments) {
        FunctionDecl function = resolveFunction(functionName, arguments.size(), null);
        Map<String, Double> params = new HashMap<>();
        for (int i = 0; i < arguments.size(); i++) {
            params.put(function.parameters().get(i), arguments.get(i));
        }
        OptionalDouble result = runBody(function, ExecutionScope.forCall(globals, params, Map.of()));
        if (result.isEmpty()) {
            throw new ElaborationException("Function '" + functionName + "' did not return a value", function.span());
        }
        return result.getAsDouble();
    }

    private void callStatement(CallStmt call, ExecutionScope caller) {
        FunctionDecl function = resolveFunction(call.functionName(), call.arguments().size(), call.span());
        Map<String, Double> params = new HashMap<>();
        Map<String, String> stringParams = new HashMap<>();
        for (int i = 0; i < call.arguments().size(); i++) {
            String param = function.parameters().get(i);
            Expr arg = call.arguments().get(i);
            if (arg instanceof StringLiteral string) {
                stringParams.put(param, string.value());
            } else if (arg instanceof VariableRef ref && caller.stringParameter(ref.name()).isPresent()) {
                stringParams.put(param, caller.stringParameter(ref.name()).get());
            } else {
                params.put(param, evaluate(arg, caller));
            }
        }
        runBody(function, ExecutionScope.forCall(globals, params, stringParams));
    }

    private FunctionDecl resolveFunction(String name, int argumentCount, Span span) {
        FunctionDecl function = functions.get(name);
        if (function == null) {
            throw new ElaborationException("Unknown function '" + name + "'", span);
        }
        if (function.arity() != argumentCount) {
            throw new ElaborationException("Function '" + name + "' expects " + function.arity()
                    + " argument(s), got " + argumentCount, span);
        }
        return function;
    }

    private OptionalDouble runBody(FunctionDecl function, ExecutionScope frame) {
        if (callDepth >= maxCallDepth) {
            throw new ElaborationException("Maximum call depth " + maxCallDepth + " exceeded in '"
                    + function.name() + "'", function.span());
        }
        callDepth++;
        try {
            return executeBlock(function.body(), frame);
        } finally {
            callDepth--;
        }
    }

    // ==================== Evaluation helpers ====================

    private double evaluate(Expr expr, ExecutionScope scope) {
        return new ExprEvaluator(scope, this).evaluate(expr);
    }

    private NumberLiteral literal(Expr expr, ExecutionScope scope) {
        return NumberLiteral.of(evaluate(expr, scope));
    }

    private String resolveName(NameRef ref, ExecutionScope scope) {
        if (ref.quoted()) {
            return ref.name();
        }
        return scope.stringParameter(ref.name()).orElse(ref.name());
    }

    private NameRef requireParticle(NameRef ref, ExecutionScope scope, Span span) {
        String name = resolveName(ref, scope);
        if (!particleNames.contains(name)) {
            throw new ElaborationException("Unknown particle '" + name + "'", span);
        }
        return NameRef.literal(name);
    }

    private Observable resolveObservable(Observable observable, ExecutionScope scope, Span span) {
        if (observable instanceof Observable.PositionX x) {
            return new Observable.PositionX(requireParticle(x.particle(), scope, span));
        }
        if (observable instanceof Observable.PositionY y) {
            return new Observable.PositionY(requireParticle(y.particle(), scope, span));
        }
        Observable.Distance distance = (Observable.Distance) observable;
        return new Observable.Distance(requireParticle(distance.first(), scope, span),
                requireParticle(distance.second(), scope, span));
    }

    /**
     * Executes statements of one block. Returns the value of a {@code return}
     * when one is reached.
     */
    private final class StatementExecutor implements StmtVisitor<OptionalDouble> {

        private final ExecutionScope scope;

        StatementExecutor(ExecutionScope scope) {
            this.scope = scope;
        }

        @Override
        public OptionalDouble visitLet(LetStmt let) {
            scope.bindLocal(let.name(), evaluate(let.value(), scope));
            return OptionalDouble.empty();
        }

        @Override
        public OptionalDouble visitCall(CallStmt call) {
            callStatement(call, scope);
            return OptionalDouble.empty();
        }

        @Override
        public OptionalDouble visitReturn(ReturnStmt ret) {
            return OptionalDouble.of(evaluate(ret.value(), scope));
        }

        @Override
        public OptionalDouble visitParticle(ParticleDecl particle) {
            String name = resolveName(particle.name(), scope);
            program.addParticle(new ParticleDecl(NameRef.literal(name), literal(particle.x(), scope),
                    literal(particle.y(), scope), literal(particle.mass(), scope), particle.span()));
            particleNames.add(name);
            return OptionalDouble.empty();
        }

        @Override
        public OptionalDouble visitForce(ForceDecl force) {
            NameRef first = requireParticle(force.first(), scope, force.span());
            NameRef second = requireParticle(force.second(), scope, force.span());
            ForceKind kind;
            if (force.kind() instanceof ForceKind.Gravity gravity) {
                kind = new ForceKind.Gravity(literal(gravity.g(), scope));
            } else {
                ForceKind.Spring spring = (ForceKind.Spring) force.kind();
                kind = new ForceKind.Spring(literal(spring.k(), scope), literal(spring.rest(), scope));
            }
            program.addForce(new ForceDecl(first, second, kind, force.span()));
            return OptionalDouble.empty();
        }

        @Override
        public OptionalDouble visitLoop(LoopDecl loop) {
            NameRef target = requireParticle(loop.target(), scope, loop.span());
            LoopKind kind;
            if (loop.kind() instanceof LoopKind.ForCycles cycles) {
                kind = new LoopKind.ForCycles(literal(cycles.cycles(), scope));
            } else {
                ConditionExpr condition = ((LoopKind.WhileCondition) loop.kind()).condition();
                kind = new LoopKind.WhileCondition(new ConditionExpr(
                        resolveObservable(condition.observable(), scope, loop.span()),
                        condition.comparison(), literal(condition.threshold(), scope)));
            }
            List<PushAction> body = new ArrayList<>();
            for (PushAction push : loop.body()) {
                body.add(new PushAction(requireParticle(push.target(), scope, push.span()),
                        literal(push.magnitude(), scope), literal(push.directionX(), scope),
                        literal(push.directionY(), scope), push.span()));
            }
            program.addLoop(new LoopDecl(loop.label(), kind, literal(loop.frequency(), scope),
                    literal(loop.damping(), scope), target, body, loop.span()));
            return OptionalDouble.empty();
        }

        @Override
        public OptionalDouble visitWell(WellDecl well) {
            program.addWell(new WellDecl(well.name(), requireParticle(well.target(), scope, well.span()),
                    resolveObservable(well.observable(), scope, well.span()),
                    literal(well.threshold(), scope), literal(well.depth(), scope), well.span()));
            return OptionalDouble.empty();
        }

        @Override
        public OptionalDouble visitDetector(DetectorDecl detector) {
            DetectorKind kind;
            if (detector.kind() instanceof DetectorKind.Position position) {
                kind = new DetectorKind.Position(requireParticle(position.particle(), scope, detector.span()));
            } else {
                DetectorKind.Distance distance = (DetectorKind.Distance) detector.kind();
                kind = new DetectorKind.Distance(requireParticle(distance.first(), scope, detector.span()),
                        requireParticle(distance.second(), scope, detector.span()));
            }
            program.addDetector(new DetectorDecl(detector.name(), kind, detector.span()));
            return OptionalDouble.empty();
        }

        @Override
        public OptionalDouble visitIf(IfStmt ifStmt) {
            boolean taken = evaluate(ifStmt.condition(), scope) != 0.0;
            return executeBlock(taken ? ifStmt.thenBody() : ifStmt.elseBody(), scope.derive());
        }

        @Override
        public OptionalDouble visitFor(ForStmt forStmt) {
            long start = (long) Math.floor(evaluate(forStmt.start(), scope));
            long end = (long) Math.floor(evaluate(forStmt.end(), scope));
            for (long i = start; i < end; i++) {
                ExecutionScope iteration = scope.derive();
                iteration.bindLocal(forStmt.variable(), i);
                OptionalDouble result = executeBlock(forStmt.body(), iteration);
                if (result.isPresent()) {
                    return result;
                }
            }
            return OptionalDouble.empty();
        }

        @Override
        public OptionalDouble visitMatch(MatchStmt match) {
            long value = Math.round(evaluate(match.scrutinee(), scope));
            for (MatchArm arm : match.arms()) {
                if (arm.pattern().matches(value)) {
                    return executeBlock(arm.body(), scope.derive());
                }
            }
            return OptionalDouble.empty();
        }
    }
}
