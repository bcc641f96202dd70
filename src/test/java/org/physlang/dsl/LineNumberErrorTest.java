package org.physlang.dsl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for accurate line number and column reporting in parse errors.
 * Front ends rely on these locations to highlight the offending line.
 */
public class LineNumberErrorTest {

    @Test
    @DisplayName("Malformed particle reports its line and column")
    void testParticleErrorLineNumber() {
        String source = """
                particle A at (0, 0) mass 1
                particle B at (1, 0) mass 1
                  particle C at (2, 0)
                simulate dt = 0.01 steps = 10
                """; // Missing mass on line 3

        PhysParseException e = assertThrows(PhysParseException.class, () -> PhysParser.parse(source));

        assertTrue(e.hasLocation(), "Error should have location info");
        assertEquals(3, e.getLine(), "Error should be on line 3 (missing mass)");
        assertEquals(3, e.getColumn(), "Column should point at the first non-blank character");
        assertTrue(e.getMessage().startsWith("line 3:3"), "Message should carry the location prefix");
        assertEquals("  particle C at (2, 0)", e.getLineText());
    }

    @Test
    @DisplayName("Error inside a function body reports the body line")
    void testErrorInsideFunctionBody() {
        String source = """
                fn make(n) {
                    particle n at (0, 0) mass 1

                    force gravity(n) G = 1
                }
                simulate dt = 0.01 steps = 10
                """;

        PhysParseException e = assertThrows(PhysParseException.class, () -> PhysParser.parse(source));

        assertEquals(4, e.getLine());
        assertTrue(e.getDetail().startsWith("Invalid force syntax"));
    }

    @Test
    @DisplayName("Error in an expression keeps the statement location")
    void testExpressionErrorLocation() {
        String source = """
                let a = 1
                let b = a +
                simulate dt = 0.01 steps = 10
                """;

        PhysParseException e = assertThrows(PhysParseException.class, () -> PhysParser.parse(source));

        assertEquals(2, e.getLine());
        assertTrue(e.getDetail().contains("Missing operand"));
    }

    @Test
    @DisplayName("Span offsets map back to the reported line")
    void testSpanMapsToLine() {
        String source = "let a = 1\n\nbogus statement here\nsimulate dt = 0.01 steps = 10\n";

        PhysParseException e = assertThrows(PhysParseException.class, () -> PhysParser.parse(source));

        SourcePosition position = e.getSpan().toPosition(source);
        assertEquals(3, position.line());
        assertEquals(1, position.column());
    }

    @Test
    @DisplayName("Unclosed block reports the opening line")
    void testUnclosedBlock() {
        String source = """
                simulate dt = 0.01 steps = 10
                for i in 0..3 {
                    spawn(i)
                """;

        PhysParseException e = assertThrows(PhysParseException.class, () -> PhysParser.parse(source));

        assertEquals(2, e.getLine());
        assertTrue(e.getDetail().contains("Unclosed"));
    }

    @Test
    @DisplayName("Missing simulate declaration has no location")
    void testMissingSimulate() {
        PhysParseException e = assertThrows(PhysParseException.class,
                () -> PhysParser.parse("particle A at (0, 0) mass 1\n"));

        assertFalse(e.hasLocation());
        assertEquals("Missing 'simulate' declaration", e.getMessage());
    }

    @Test
    @DisplayName("Detailed format shows the offending line with a caret")
    void testFormatDetailed() {
        String source = "simulate dt = 0.01 steps = 10\nloop forever on A {\n}\n";

        PhysParseException e = assertThrows(PhysParseException.class, () -> PhysParser.parse(source));

        String detailed = e.formatDetailed();
        assertTrue(detailed.contains("line 2"));
        assertTrue(detailed.contains("2 | loop forever on A {"));
        assertTrue(detailed.endsWith("^"));
    }

    @Test
    @DisplayName("Second simulate block is rejected at its line")
    void testDuplicateSimulate() {
        PhysParseException e = assertThrows(PhysParseException.class,
                () -> PhysParser.parse("simulate dt = 0.1 steps = 1\nsimulate dt = 0.1 steps = 2\n"));
        assertEquals(2, e.getLine());
    }

    @Test
    @DisplayName("return outside a function is rejected")
    void testTopLevelReturn() {
        PhysParseException e = assertThrows(PhysParseException.class,
                () -> PhysParser.parse("simulate dt = 0.1 steps = 1\nif 1 {\n  return 2\n}\n"));
        assertEquals(3, e.getLine());
    }
}
