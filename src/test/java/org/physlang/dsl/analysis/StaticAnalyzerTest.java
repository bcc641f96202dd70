package org.physlang.dsl.analysis;

import org.physlang.dsl.PhysParser;
import org.physlang.dsl.definition.Program;
import org.physlang.dsl.eval.Elaborator;
import org.physlang.dsl.eval.GlobalScope;
import org.physlang.dsl.eval.LetBindings;
import org.physlang.dsl.eval.LetEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StaticAnalyzer")
class StaticAnalyzerTest {

    private static final String SIMULATE = "\nsimulate dt = 0.01 steps = 10\n";

    private static Diagnostics analyze(String source) {
        Program program = PhysParser.parse(source + SIMULATE);
        return StaticAnalyzer.analyze(program);
    }

    private static void assertSingleError(Diagnostics diagnostics, String fragment) {
        assertEquals(1, diagnostics.errors().size(), () -> "Expected one error but got:\n" + diagnostics);
        assertTrue(diagnostics.errors().get(0).message().contains(fragment),
                () -> "Unexpected message: " + diagnostics.errors().get(0).message());
    }

    @Test
    @DisplayName("A well-formed program has no findings")
    void testCleanProgram() {
        Diagnostics diagnostics = analyze("""
                let g = 1.0
                particle A at (0, 0) mass 1
                particle B at (5, 0) mass 1
                force gravity(A, B) G = g
                detect gap = distance(A, B)
                """);
        assertTrue(diagnostics.isEmpty(), diagnostics::toString);
    }

    @Nested
    @DisplayName("Particles")
    class Particles {

        @Test
        @DisplayName("Force naming an undeclared particle reports its name")
        void testUnknownParticleInForce() {
            Diagnostics diagnostics = analyze("""
                    particle a at (0, 0) mass 1
                    force gravity(a, b) G = 1
                    """);
            assertSingleError(diagnostics, "'b'");
            assertNotNull(diagnostics.errors().get(0).span());
        }

        @Test
        void testDuplicateParticle() {
            assertSingleError(analyze("""
                    particle a at (0, 0) mass 1
                    particle a at (1, 0) mass 1
                    """), "Duplicate particle 'a'");
        }

        @Test
        @DisplayName("Unknown particles in loops, pushes, wells and detectors")
        void testUnknownParticlesEverywhere() {
            Diagnostics diagnostics = analyze("""
                    particle a at (0, 0) mass 1
                    loop for 1 cycles with frequency 1 damping 0 on x1 {
                        force push(x2) magnitude 1 direction (1, 0)
                    }
                    loop while position(x3).x < 1 with frequency 1 damping 0 on a {
                    }
                    well w on x4 if distance(a, x5) >= 1 depth 1
                    detect d = position(x6)
                    """);
            assertEquals(6, diagnostics.errors().size(), diagnostics::toString);
            for (int i = 1; i <= 6; i++) {
                String name = "'x" + i + "'";
                assertTrue(diagnostics.errors().stream().anyMatch(d -> d.message().contains(name)), name);
            }
        }

        @Test
        @DisplayName("Particles declared inside blocks are known to top-level forces")
        void testBlockDeclaredParticleIsKnown() {
            Diagnostics diagnostics = analyze("""
                    particle A at (0, 0) mass 1
                    if 1 {
                        particle B at (1, 0) mass 1
                    }
                    force spring(A, B) k = 1 rest = 1
                    """);
            assertFalse(diagnostics.hasErrors(), diagnostics::toString);
        }

        @Test
        @DisplayName("A bare name that is a function parameter is checked after elaboration")
        void testParameterParticleDeferred() {
            Diagnostics diagnostics = analyze("""
                    particle A at (0, 0) mass 1
                    fn tether(p, k) {
                        force spring(p, A) k = k rest = 1
                    }
                    """);
            assertFalse(diagnostics.hasErrors(), diagnostics::toString);
        }

        @Test
        @DisplayName("A quoted name is never a parameter")
        void testQuotedNameNotDeferred() {
            assertSingleError(analyze("""
                    particle A at (0, 0) mass 1
                    fn tether(p) {
                        force spring("p", A) k = 1 rest = 1
                    }
                    """), "'p'");
        }
    }

    @Nested
    @DisplayName("Names and scopes")
    class Scopes {

        @Test
        void testUnknownVariable() {
            assertSingleError(analyze("particle a at (spacing, 0) mass 1"), "Unknown variable 'spacing'");
        }

        @Test
        void testDuplicateLet() {
            assertSingleError(analyze("let a = 1\nlet a = 2"), "Duplicate let binding 'a'");
        }

        @Test
        void testDuplicateFunction() {
            assertSingleError(analyze("fn f() { }\nfn f() { }"), "Duplicate function 'f'");
        }

        @Test
        void testFunctionCollidesWithLet() {
            assertSingleError(analyze("let f = 1\nfn f() { }"), "collides with a let");
        }

        @Test
        void testDuplicateParameter() {
            assertSingleError(analyze("fn f(a, a) { }"), "Duplicate parameter 'a'");
        }

        @Test
        void testParameterCollidesWithLet() {
            assertSingleError(analyze("let a = 1\nfn f(a) { }"), "Parameter 'a'");
        }

        @Test
        @DisplayName("Loop variable is only visible inside the loop body")
        void testForVariableScope() {
            assertSingleError(analyze("""
                    fn f() {
                        for i in 0..3 {
                            let twice = i * 2
                        }
                        return i
                    }
                    """), "Unknown variable 'i'");
        }

        @Test
        @DisplayName("Locals in one if branch are not visible in the other")
        void testBranchLocalsIndependent() {
            assertSingleError(analyze("""
                    fn f(x) {
                        if x {
                            let y = 1
                        } else {
                            return y
                        }
                        return 0
                    }
                    """), "Unknown variable 'y'");
        }

        @Test
        @DisplayName("A local let is visible to later statements and nested blocks")
        void testLocalVisibleLater() {
            Diagnostics diagnostics = analyze("""
                    fn f(x) {
                        let y = x + 1
                        if y > 2 {
                            return y
                        }
                        return y * 2
                    }
                    """);
            assertFalse(diagnostics.hasErrors(), diagnostics::toString);
        }

        @Test
        @DisplayName("Shadowing a parameter is a warning")
        void testShadowingWarning() {
            Diagnostics diagnostics = analyze("""
                    fn f(x) {
                        let x = 2
                        return x
                    }
                    """);
            assertFalse(diagnostics.hasErrors());
            assertEquals(1, diagnostics.warnings().size());
            assertTrue(diagnostics.warnings().get(0).message().contains("'x' shadows"));
        }
    }

    @Nested
    @DisplayName("Calls")
    class Calls {

        @Test
        void testUnknownFunction() {
            assertSingleError(analyze("spawn(1)"), "Unknown function 'spawn'");
        }

        @Test
        void testStatementArgumentCount() {
            assertSingleError(analyze("fn f(a, b) { }\nf(1)"), "expects 2 argument(s), got 1");
        }

        @Test
        void testExpressionArgumentCount() {
            assertSingleError(analyze("""
                    fn twice(v) { return v * 2 }
                    fn g() { return twice(1, 2) }
                    """), "expects 1 argument(s), got 2");
        }

        @Test
        void testBuiltinArity() {
            assertSingleError(analyze("let a = clamp(1, 2)"), "Builtin 'clamp' expects 3");
        }

        @Test
        @DisplayName("Functions cannot be called where only globals are available")
        void testCallInTopLevelLet() {
            assertSingleError(analyze("""
                    fn twice(v) { return v * 2 }
                    let a = twice(2)
                    """), "cannot be called in a top-level");
        }

        @Test
        @DisplayName("String arguments are allowed in call statements only")
        void testStringArguments() {
            Diagnostics ok = analyze("fn make(n) { particle n at (0, 0) mass 1 }\nmake(\"A\")");
            assertFalse(ok.hasErrors(), ok::toString);

            Diagnostics bad = analyze("""
                    fn make(n) { return 1 }
                    fn g() { return make("A") }
                    """);
            assertSingleError(bad, "cannot be used as a number");
        }
    }

    @Nested
    @DisplayName("Match and detectors")
    class MatchAndDetectors {

        @Test
        @DisplayName("Two wildcard arms are rejected")
        void testTwoWildcards() {
            assertSingleError(analyze("""
                    fn f(x) {
                        match x {
                            _ => { }
                            _ => { }
                        }
                    }
                    """), "more than one wildcard");
        }

        @Test
        @DisplayName("Repeated literal arm is unreachable")
        void testUnreachableArm() {
            Diagnostics diagnostics = analyze("""
                    match 1 {
                        1 => { }
                        1 => { }
                    }
                    """);
            assertFalse(diagnostics.hasErrors());
            assertEquals(1, diagnostics.warnings().size());
        }

        @Test
        void testDuplicateDetectorWarning() {
            Diagnostics diagnostics = analyze("""
                    particle A at (0, 0) mass 1
                    detect d = position(A)
                    detect d = position(A)
                    """);
            assertFalse(diagnostics.hasErrors());
            assertEquals(Diagnostic.Severity.WARNING, diagnostics.all().get(0).severity());
        }
    }

    @Nested
    @DisplayName("After elaboration")
    class AfterElaboration {

        private Diagnostics elaborateAndAnalyze(String source) {
            Program program = PhysParser.parse(source + SIMULATE);
            LetBindings lets = LetEvaluator.evaluate(program.lets());
            Elaborator.elaborate(program, lets.scope());
            return StaticAnalyzer.analyze(program, StaticAnalyzer.Phase.POST_ELABORATION);
        }

        @Test
        @DisplayName("A particle declared only in a function that is never called is unknown")
        void testUncalledFunctionParticle() {
            String source = """
                    fn unused() {
                        particle "ghost" at (0, 0) mass 1
                    }
                    detect d = position(ghost)
                    """;
            assertFalse(analyze(source).hasErrors());
            assertSingleError(elaborateAndAnalyze(source), "Unknown particle 'ghost'");
        }

        @Test
        @DisplayName("A particle declared only in an untaken branch is unknown")
        void testUntakenBranchParticle() {
            String source = """
                    let flag = 0
                    particle a at (0, 0) mass 1
                    if flag > 0 {
                        particle b at (1, 0) mass 1
                    }
                    force gravity(a, b) G = 1
                    """;
            assertFalse(analyze(source).hasErrors());
            assertSingleError(elaborateAndAnalyze(source), "Unknown particle 'b' referenced by force");
        }

        @Test
        @DisplayName("Particles generated through string arguments are known")
        void testGeneratedParticlesKnown() {
            Diagnostics diagnostics = elaborateAndAnalyze("""
                    particle a at (0, 0) mass 1
                    fn make(name) {
                        particle name at (1, 0) mass 1
                        force spring(a, name) k = 1 rest = 1
                    }
                    fn never(p) {
                        force gravity(p, nowhere) G = 1
                    }
                    make("P")
                    """);
            assertTrue(diagnostics.isEmpty(), diagnostics::toString);
        }

        @Test
        @DisplayName("The single-argument entry point follows the program's state")
        void testPhaseFromProgramState() {
            Program program = PhysParser.parse("""
                    if 0 {
                        particle b at (1, 0) mass 1
                    }
                    detect d = position(b)
                    """ + SIMULATE);
            assertFalse(StaticAnalyzer.analyze(program).hasErrors());
            Elaborator.elaborate(program, new GlobalScope());
            assertSingleError(StaticAnalyzer.analyze(program), "'b'");
        }
    }

    @Test
    @DisplayName("Analysis does not change the program")
    void testDoesNotMutate() {
        Program program = PhysParser.parse("particle a at (0, 0) mass 1\nforce gravity(a, b) G = 1" + SIMULATE);
        String before = program.toString();
        StaticAnalyzer.analyze(program);
        StaticAnalyzer.analyze(program);
        assertEquals(before, program.toString());
        assertFalse(program.isElaborated());
    }
}
