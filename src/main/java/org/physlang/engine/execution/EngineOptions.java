package org.physlang.engine.execution;

import org.physlang.dsl.eval.Elaborator;

/**
 * Engine configuration.
 *
 * @param traceParsing Log each parsed line at DEBUG level
 * @param maxCallDepth Nesting limit for user function calls during elaboration
 */
public record EngineOptions(boolean traceParsing, int maxCallDepth) {

    public static final String TRACE_PROPERTY = "physlang.parse.trace";
    public static final String TRACE_ENV = "PHYSLANG_PARSE_TRACE";
    public static final String CALL_DEPTH_PROPERTY = "physlang.maxCallDepth";

    public EngineOptions {
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException("maxCallDepth must be at least 1, got " + maxCallDepth);
        }
    }

    public static EngineOptions defaults() {
        return new EngineOptions(false, Elaborator.DEFAULT_MAX_CALL_DEPTH);
    }

    /**
     * Reads options from system properties, falling back to environment
     * variables and then to the defaults.
     */
    public static EngineOptions fromEnvironment() {
        String trace = System.getProperty(TRACE_PROPERTY);
        if (trace == null) {
            trace = System.getenv(TRACE_ENV);
        }
        int depth = Integer.getInteger(CALL_DEPTH_PROPERTY, Elaborator.DEFAULT_MAX_CALL_DEPTH);
        return new EngineOptions(isTruthy(trace), depth);
    }

    public EngineOptions withTraceParsing(boolean enabled) {
        return new EngineOptions(enabled, maxCallDepth);
    }

    private static boolean isTruthy(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        return v.equals("1") || v.equalsIgnoreCase("true") || v.equalsIgnoreCase("yes");
    }
}
