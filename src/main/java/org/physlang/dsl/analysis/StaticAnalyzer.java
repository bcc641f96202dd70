package org.physlang.dsl.analysis;

import org.physlang.dsl.BinaryExpr;
import org.physlang.dsl.BuiltinCall;
import org.physlang.dsl.Expr;
import org.physlang.dsl.ExprVisitor;
import org.physlang.dsl.NumberLiteral;
import org.physlang.dsl.Span;
import org.physlang.dsl.StringLiteral;
import org.physlang.dsl.UnaryMinus;
import org.physlang.dsl.UserCall;
import org.physlang.dsl.VariableRef;
import org.physlang.dsl.definition.CallStmt;
import org.physlang.dsl.definition.DetectorDecl;
import org.physlang.dsl.definition.ForStmt;
import org.physlang.dsl.definition.ForceDecl;
import org.physlang.dsl.definition.ForceKind;
import org.physlang.dsl.definition.FunctionDecl;
import org.physlang.dsl.definition.IfStmt;
import org.physlang.dsl.definition.LetStmt;
import org.physlang.dsl.definition.LoopDecl;
import org.physlang.dsl.definition.LoopKind;
import org.physlang.dsl.definition.MatchArm;
import org.physlang.dsl.definition.MatchPattern;
import org.physlang.dsl.definition.MatchStmt;
import org.physlang.dsl.definition.NameRef;
import org.physlang.dsl.definition.ParticleDecl;
import org.physlang.dsl.definition.Program;
import org.physlang.dsl.definition.PushAction;
import org.physlang.dsl.definition.ReturnStmt;
import org.physlang.dsl.definition.Stmt;
import org.physlang.dsl.definition.StmtVisitor;
import org.physlang.dsl.definition.WellDecl;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Semantic checks over a parsed program.
 *
 * The analyzer never mutates the program and reports every problem it finds
 * instead of stopping at the first one. It runs twice in the pipeline: on
 * the parsed program, and again after elaboration has appended the
 * generated entities.
 *
 * Checks performed:
 * <ul>
 *   <li>duplicate let, function and particle names</li>
 *   <li>duplicate or colliding function parameters</li>
 *   <li>unknown variables, with nested lexical scopes and shadowing warnings</li>
 *   <li>unknown particles in forces, loops, pushes, wells, conditions and detectors</li>
 *   <li>unknown functions and argument count mismatches</li>
 *   <li>builtin arity</li>
 *   <li>at most one wildcard arm per match</li>
 *   <li>duplicate detector names (warning)</li>
 * </ul>
 *
 * Before elaboration a particle counts as known if any block declares it
 * under a literal name, since the block may run. After elaboration only the
 * particles actually generated are known, and particle references are
 * checked on the flat declaration lists alone.
 */
public final class StaticAnalyzer {

    public enum Phase {
        PRE_ELABORATION,
        POST_ELABORATION
    }

    private final Program program;
    private final Phase phase;
    private final Diagnostics diagnostics = new Diagnostics();
    private final Scope globals = new Scope(null, false);
    private final Map<String, FunctionDecl> functions = new LinkedHashMap<>();
    private final Set<String> knownParticles = new HashSet<>();

    private StaticAnalyzer(Program program, Phase phase) {
        this.program = program;
        this.phase = phase;
    }

    /**
     * Analyzes the program in the phase matching its elaboration state.
     */
    public static Diagnostics analyze(Program program) {
        return analyze(program, program.isElaborated() ? Phase.POST_ELABORATION : Phase.PRE_ELABORATION);
    }

    /**
     * Analyzes the program and returns all findings in discovery order.
     */
    public static Diagnostics analyze(Program program, Phase phase) {
        StaticAnalyzer analyzer = new StaticAnalyzer(program, Objects.requireNonNull(phase, "Phase cannot be null"));
        analyzer.run();
        return analyzer.diagnostics;
    }

    private void run() {
        collectGlobals();
        collectFunctions();
        collectParticles();

        // Global lets see every other global; forward references fail at evaluation time.
        for (LetStmt let : program.lets()) {
            checkExpression(let.value(), globals, let.span(), false);
        }
        program.simulateOptional().ifPresent(simulate -> {
            checkExpression(simulate.dt(), globals, simulate.span(), false);
            checkExpression(simulate.steps(), globals, simulate.span(), false);
        });

        for (FunctionDecl function : functions.values()) {
            checkFunction(function);
        }

        // Top-level declarations are evaluated by the runtime builder, which cannot run functions.
        StatementChecker topLevel = new StatementChecker(new Scope(globals, false), false, true);
        for (ParticleDecl particle : program.particles()) {
            particle.accept(topLevel);
        }
        for (ForceDecl force : program.forces()) {
            force.accept(topLevel);
        }
        for (LoopDecl loop : program.loops()) {
            loop.accept(topLevel);
        }
        for (WellDecl well : program.wells()) {
            well.accept(topLevel);
        }
        for (DetectorDecl detector : program.detectors()) {
            detector.accept(topLevel);
        }
        checkBlock(program.statements(), new Scope(globals, false));
        checkDetectorNames();
    }

    // ==================== Declarations ====================

    private void collectGlobals() {
        for (LetStmt let : program.lets()) {
            if (!globals.names.add(let.name())) {
                diagnostics.error("Duplicate let binding '" + let.name() + "'", let.span());
            }
        }
    }

    private void collectFunctions() {
        for (FunctionDecl function : program.functions()) {
            if (functions.containsKey(function.name())) {
                diagnostics.error("Duplicate function '" + function.name() + "'", function.span());
                continue;
            }
            if (globals.names.contains(function.name())) {
                diagnostics.error("Function '" + function.name() + "' collides with a let binding", function.span());
            }
            if (BuiltinCall.Builtin.fromName(function.name()).isPresent()) {
                diagnostics.error("Function '" + function.name() + "' collides with a builtin", function.span());
            }
            functions.put(function.name(), function);
        }
    }

    private void collectParticles() {
        Set<String> seen = new HashSet<>();
        for (ParticleDecl particle : program.particles()) {
            String name = particle.name().name();
            if (!seen.add(name)) {
                diagnostics.error("Duplicate particle '" + name + "'", particle.span());
            }
        }
        knownParticles.addAll(seen);
        if (phase == Phase.POST_ELABORATION) {
            return;
        }
        for (FunctionDecl function : program.functions()) {
            collectBlockParticles(function.body(), Set.copyOf(function.parameters()));
        }
        collectBlockParticles(program.statements(), Set.of());
    }

    private void collectBlockParticles(List<Stmt> statements, Set<String> parameters) {
        for (Stmt stmt : statements) {
            if (stmt instanceof ParticleDecl particle) {
                NameRef name = particle.name();
                if (name.quoted() || !parameters.contains(name.name())) {
                    knownParticles.add(name.name());
                }
            } else if (stmt instanceof IfStmt ifStmt) {
                collectBlockParticles(ifStmt.thenBody(), parameters);
                collectBlockParticles(ifStmt.elseBody(), parameters);
            } else if (stmt instanceof ForStmt forStmt) {
                collectBlockParticles(forStmt.body(), parameters);
            } else if (stmt instanceof MatchStmt match) {
                for (MatchArm arm : match.arms()) {
                    collectBlockParticles(arm.body(), parameters);
                }
            }
        }
    }

    private void checkFunction(FunctionDecl function) {
        Scope scope = new Scope(globals, true);
        for (String param : function.parameters()) {
            if (!scope.names.add(param)) {
                diagnostics.error("Duplicate parameter '" + param + "' in function '" + function.name() + "'",
                        function.span());
            } else if (globals.names.contains(param)) {
                diagnostics.error("Parameter '" + param + "' of function '" + function.name()
                        + "' collides with a let binding", function.span());
            }
        }
        checkBlock(function.body(), new Scope(scope, false));
    }

    private void checkDetectorNames() {
        Set<String> seen = new HashSet<>();
        for (DetectorDecl detector : program.detectors()) {
            if (!seen.add(detector.name())) {
                diagnostics.warning("Duplicate detector name '" + detector.name() + "'", detector.span());
            }
        }
    }

    // ==================== Statements ====================

    private void checkBlock(List<Stmt> statements, Scope scope) {
        // After elaboration the particles a body generated are checked on the declaration lists instead.
        StatementChecker checker = new StatementChecker(scope, true, phase == Phase.PRE_ELABORATION);
        for (Stmt stmt : statements) {
            stmt.accept(checker);
        }
    }

    private final class StatementChecker implements StmtVisitor<Void> {

        private final Scope scope;
        private final boolean callsAllowed;
        private final boolean particlesChecked;

        StatementChecker(Scope scope, boolean callsAllowed, boolean particlesChecked) {
            this.scope = scope;
            this.callsAllowed = callsAllowed;
            this.particlesChecked = particlesChecked;
        }

        private void checkParticle(NameRef ref, Scope in, String context, Span span) {
            if (particlesChecked) {
                StaticAnalyzer.this.checkParticle(ref, in, context, span);
            }
        }

        private void checkExpression(Expr expr, Scope in, Span span) {
            StaticAnalyzer.this.checkExpression(expr, in, span, callsAllowed);
        }

        @Override
        public Void visitLet(LetStmt let) {
            checkExpression(let.value(), scope, let.span());
            declare(scope, let.name(), let.span());
            return null;
        }

        @Override
        public Void visitCall(CallStmt call) {
            checkCall(call.functionName(), call.arguments().size(), call.span());
            for (Expr arg : call.arguments()) {
                if (!(arg instanceof StringLiteral)) {
                    checkExpression(arg, scope, call.span());
                }
            }
            return null;
        }

        @Override
        public Void visitReturn(ReturnStmt ret) {
            checkExpression(ret.value(), scope, ret.span());
            return null;
        }

        @Override
        public Void visitParticle(ParticleDecl particle) {
            checkExpression(particle.x(), scope, particle.span());
            checkExpression(particle.y(), scope, particle.span());
            checkExpression(particle.mass(), scope, particle.span());
            return null;
        }

        @Override
        public Void visitForce(ForceDecl force) {
            checkParticle(force.first(), scope, "force", force.span());
            checkParticle(force.second(), scope, "force", force.span());
            if (force.kind() instanceof ForceKind.Gravity gravity) {
                checkExpression(gravity.g(), scope, force.span());
            } else if (force.kind() instanceof ForceKind.Spring spring) {
                checkExpression(spring.k(), scope, force.span());
                checkExpression(spring.rest(), scope, force.span());
            }
            return null;
        }

        @Override
        public Void visitLoop(LoopDecl loop) {
            checkParticle(loop.target(), scope, "loop", loop.span());
            checkExpression(loop.frequency(), scope, loop.span());
            checkExpression(loop.damping(), scope, loop.span());
            if (loop.kind() instanceof LoopKind.ForCycles cycles) {
                checkExpression(cycles.cycles(), scope, loop.span());
            } else if (loop.kind() instanceof LoopKind.WhileCondition whileCondition) {
                for (NameRef ref : whileCondition.condition().observable().particles()) {
                    checkParticle(ref, scope, "loop condition", loop.span());
                }
                checkExpression(whileCondition.condition().threshold(), scope, loop.span());
            }
            for (PushAction push : loop.body()) {
                checkParticle(push.target(), scope, "push", push.span());
                checkExpression(push.magnitude(), scope, push.span());
                checkExpression(push.directionX(), scope, push.span());
                checkExpression(push.directionY(), scope, push.span());
            }
            return null;
        }

        @Override
        public Void visitWell(WellDecl well) {
            checkParticle(well.target(), scope, "well", well.span());
            for (NameRef ref : well.observable().particles()) {
                checkParticle(ref, scope, "well", well.span());
            }
            checkExpression(well.threshold(), scope, well.span());
            checkExpression(well.depth(), scope, well.span());
            return null;
        }

        @Override
        public Void visitDetector(DetectorDecl detector) {
            for (NameRef ref : detector.kind().particles()) {
                checkParticle(ref, scope, "detector", detector.span());
            }
            return null;
        }

        @Override
        public Void visitIf(IfStmt ifStmt) {
            checkExpression(ifStmt.condition(), scope, ifStmt.span());
            checkBlock(ifStmt.thenBody(), new Scope(scope, false));
            checkBlock(ifStmt.elseBody(), new Scope(scope, false));
            return null;
        }

        @Override
        public Void visitFor(ForStmt forStmt) {
            checkExpression(forStmt.start(), scope, forStmt.span());
            checkExpression(forStmt.end(), scope, forStmt.span());
            Scope body = new Scope(scope, false);
            declare(body, forStmt.variable(), forStmt.span());
            checkBlock(forStmt.body(), body);
            return null;
        }

        @Override
        public Void visitMatch(MatchStmt match) {
            checkExpression(match.scrutinee(), scope, match.span());
            int wildcards = 0;
            Set<Long> literals = new HashSet<>();
            for (MatchArm arm : match.arms()) {
                if (arm.pattern() instanceof MatchPattern.Literal literal && !literals.add(literal.value())) {
                    diagnostics.warning("Unreachable match arm " + literal.value(), arm.span());
                }
                if (arm.isWildcard()) {
                    wildcards++;
                }
                checkBlock(arm.body(), new Scope(scope, false));
            }
            if (wildcards > 1) {
                diagnostics.error("Match has more than one wildcard arm", match.span());
            }
            return null;
        }
    }

    private void declare(Scope scope, String name, Span span) {
        if (scope.resolves(name)) {
            diagnostics.warning("'" + name + "' shadows an outer binding", span);
        }
        scope.names.add(name);
    }

    private void checkParticle(NameRef ref, Scope scope, String context, Span span) {
        if (!ref.quoted() && scope.isParameter(ref.name())) {
            return;
        }
        if (!knownParticles.contains(ref.name())) {
            diagnostics.error("Unknown particle '" + ref.name() + "' referenced by " + context, span);
        }
    }

    private void checkCall(String name, int argumentCount, Span span) {
        FunctionDecl function = functions.get(name);
        if (function == null) {
            diagnostics.error("Unknown function '" + name + "'", span);
        } else if (function.arity() != argumentCount) {
            diagnostics.error("Function '" + name + "' expects " + function.arity()
                    + " argument(s), got " + argumentCount, span);
        }
    }

    // ==================== Expressions ====================

    private void checkExpression(Expr expr, Scope scope, Span span, boolean callsAllowed) {
        expr.accept(new ExpressionChecker(scope, span, callsAllowed));
    }

    private final class ExpressionChecker implements ExprVisitor<Void> {

        private final Scope scope;
        private final Span span;
        private final boolean callsAllowed;

        ExpressionChecker(Scope scope, Span span, boolean callsAllowed) {
            this.scope = scope;
            this.span = span;
            this.callsAllowed = callsAllowed;
        }

        @Override
        public Void visitNumber(NumberLiteral number) {
            return null;
        }

        @Override
        public Void visitString(StringLiteral string) {
            diagnostics.error("String " + string + " cannot be used as a number", span);
            return null;
        }

        @Override
        public Void visitVariable(VariableRef variable) {
            if (!scope.resolves(variable.name())) {
                diagnostics.error("Unknown variable '" + variable.name() + "'", span);
            }
            return null;
        }

        @Override
        public Void visitUnaryMinus(UnaryMinus unary) {
            return unary.operand().accept(this);
        }

        @Override
        public Void visitBinary(BinaryExpr binary) {
            binary.left().accept(this);
            return binary.right().accept(this);
        }

        @Override
        public Void visitBuiltinCall(BuiltinCall call) {
            if (call.arguments().size() != call.function().arity()) {
                diagnostics.error("Builtin '" + call.function().functionName() + "' expects "
                        + call.function().arity() + " argument(s), got " + call.arguments().size(), span);
            }
            call.arguments().forEach(arg -> arg.accept(this));
            return null;
        }

        @Override
        public Void visitUserCall(UserCall call) {
            if (!callsAllowed) {
                diagnostics.error("Function '" + call.functionName()
                        + "' cannot be called in a top-level let, declaration or simulate block", span);
            }
            checkCall(call.functionName(), call.arguments().size(), span);
            call.arguments().forEach(arg -> arg.accept(this));
            return null;
        }
    }

    /**
     * Lexical scope of variable names. A function scope holds its parameters.
     */
    private static final class Scope {
        private final Scope parent;
        private final boolean functionScope;
        private final Set<String> names = new HashSet<>();

        Scope(Scope parent, boolean functionScope) {
            this.parent = parent;
            this.functionScope = functionScope;
        }

        boolean resolves(String name) {
            for (Scope s = this; s != null; s = s.parent) {
                if (s.names.contains(name)) {
                    return true;
                }
            }
            return false;
        }

        boolean isParameter(String name) {
            for (Scope s = this; s != null; s = s.parent) {
                if (s.functionScope) {
                    return s.names.contains(name);
                }
            }
            return false;
        }
    }
}
