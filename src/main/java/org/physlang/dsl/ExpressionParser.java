package org.physlang.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Precedence-climbing parser for PhysLang expressions.
 *
 * Works on raw text. Each precedence level scans from the right for its
 * operators at parenthesis depth zero, outside string literals, and recurses
 * on the left substring, which yields left-associative trees:
 * <pre>
 * comparison  : additive (('&lt;' | '&gt;' | '&lt;=' | '&gt;=' | '==' | '!=') additive)*
 * additive    : multiplicative (('+' | '-') multiplicative)*
 * multiplicative : unary (('*' | '/') unary)*
 * unary       : '-' unary | primary
 * primary     : NUMBER | STRING | IDENT | IDENT '(' args ')' | '(' comparison ')'
 * </pre>
 *
 * Errors are reported as {@link PhysParseException} without location; the
 * statement parser attaches the location of the line being parsed.
 */
public final class ExpressionParser {

    private static final Pattern NUMBER = Pattern.compile(
            "(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");
    private static final Pattern STRING = Pattern.compile("\"([^\"]*)\"");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern CALL = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");

    /** Characters after which '+' or '-' is a sign rather than a binary operator. */
    private static final String OPERATOR_CONTEXT = "(,+-*/=<>!";

    private ExpressionParser() {
    }

    /**
     * Parses a complete expression.
     *
     * @throws PhysParseException if the text is not a valid expression
     */
    public static Expr parse(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new PhysParseException("Expected an expression");
        }
        return parseComparison(trimmed);
    }

    /**
     * Splits an argument list on commas at parenthesis depth zero.
     * An empty or blank list yields no arguments.
     */
    public static List<String> splitArguments(String text) {
        List<String> parts = new ArrayList<>();
        if (text.isBlank()) {
            return parts;
        }
        int depth = 0;
        boolean inString = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                inString = !inString;
            } else if (!inString) {
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                } else if (c == ',' && depth == 0) {
                    parts.add(text.substring(start, i).trim());
                    start = i + 1;
                }
            }
        }
        parts.add(text.substring(start).trim());
        return parts;
    }

    // ==================== Precedence levels ====================

    private static Expr parseComparison(String text) {
        int depth = 0;
        boolean inString = false;
        for (int i = text.length() - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (inString) {
                continue;
            }
            if (c == ')') {
                depth++;
            } else if (c == '(') {
                depth--;
            } else if (depth == 0) {
                String symbol = null;
                int opStart = i;
                if (c == '=' && i > 0 && "<>=!".indexOf(text.charAt(i - 1)) >= 0) {
                    symbol = text.substring(i - 1, i + 1);
                    opStart = i - 1;
                } else if (c == '=') {
                    throw new PhysParseException("Unexpected '=' in expression '" + text + "'");
                } else if (c == '<' || c == '>') {
                    symbol = String.valueOf(c);
                }
                if (symbol != null) {
                    BinaryExpr.Operator op = BinaryExpr.Operator.fromSymbol(symbol)
                            .orElseThrow(() -> new PhysParseException("Unknown operator in '" + text + "'"));
                    String left = text.substring(0, opStart);
                    String right = text.substring(i + 1);
                    return new BinaryExpr(parseComparison(operand(left, symbol)), op,
                            parseAdditive(operand(right, symbol)));
                }
            }
        }
        return parseAdditive(text);
    }

    private static Expr parseAdditive(String text) {
        int depth = 0;
        boolean inString = false;
        for (int i = text.length() - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (inString) {
                continue;
            }
            if (c == ')') {
                depth++;
            } else if (c == '(') {
                depth--;
            } else if (depth == 0 && (c == '+' || c == '-') && isBinaryPosition(text, i)) {
                String left = text.substring(0, i);
                String right = text.substring(i + 1);
                Expr lhs = parseAdditive(operand(left, String.valueOf(c)));
                Expr rhs = parseMultiplicative(operand(right, String.valueOf(c)));
                return c == '+' ? BinaryExpr.add(lhs, rhs) : BinaryExpr.subtract(lhs, rhs);
            }
        }
        return parseMultiplicative(text);
    }

    private static Expr parseMultiplicative(String text) {
        int depth = 0;
        boolean inString = false;
        for (int i = text.length() - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (inString) {
                continue;
            }
            if (c == ')') {
                depth++;
            } else if (c == '(') {
                depth--;
            } else if (depth == 0 && (c == '*' || c == '/')) {
                String left = text.substring(0, i);
                String right = text.substring(i + 1);
                Expr lhs = parseMultiplicative(operand(left, String.valueOf(c)));
                Expr rhs = parseUnary(operand(right, String.valueOf(c)));
                return c == '*' ? BinaryExpr.multiply(lhs, rhs) : BinaryExpr.divide(lhs, rhs);
            }
        }
        return parseUnary(text);
    }

    private static Expr parseUnary(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("-")) {
            return new UnaryMinus(parseUnary(operand(trimmed.substring(1), "-")));
        }
        if (trimmed.startsWith("+")) {
            return parseUnary(operand(trimmed.substring(1), "+"));
        }
        return parsePrimary(trimmed);
    }

    private static Expr parsePrimary(String text) {
        if (NUMBER.matcher(text).matches()) {
            return NumberLiteral.of(Double.parseDouble(text));
        }
        Matcher string = STRING.matcher(text);
        if (string.matches()) {
            return new StringLiteral(string.group(1));
        }
        if (IDENTIFIER.matcher(text).matches()) {
            return new VariableRef(text);
        }
        Matcher call = CALL.matcher(text);
        if (call.lookingAt() && text.endsWith(")") && closingParen(text, call.end() - 1) == text.length() - 1) {
            String name = call.group(1);
            String inner = text.substring(call.end(), text.length() - 1);
            List<Expr> args = new ArrayList<>();
            for (String arg : splitArguments(inner)) {
                if (arg.isEmpty()) {
                    throw new PhysParseException("Empty argument in call to '" + name + "'");
                }
                args.add(parse(arg));
            }
            Optional<BuiltinCall.Builtin> builtin = BuiltinCall.Builtin.fromName(name);
            if (builtin.isPresent()) {
                return new BuiltinCall(builtin.get(), args);
            }
            return new UserCall(name, args);
        }
        if (text.startsWith("(") && closingParen(text, 0) == text.length() - 1) {
            return parse(text.substring(1, text.length() - 1));
        }
        throw new PhysParseException("Invalid expression '" + text + "'");
    }

    // ==================== Helpers ====================

    private static String operand(String text, String operator) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new PhysParseException("Missing operand for '" + operator + "'");
        }
        return trimmed;
    }

    /**
     * A '+' or '-' is binary when something other than an operator precedes it
     * and it is not the sign of an exponent such as {@code 1e-3}.
     */
    private static boolean isBinaryPosition(String text, int index) {
        int prev = index - 1;
        while (prev >= 0 && Character.isWhitespace(text.charAt(prev))) {
            prev--;
        }
        if (prev < 0) {
            return false;
        }
        char p = text.charAt(prev);
        if (OPERATOR_CONTEXT.indexOf(p) >= 0) {
            return false;
        }
        return !isExponentMarker(text, prev, index);
    }

    private static boolean isExponentMarker(String text, int markerIndex, int signIndex) {
        char marker = text.charAt(markerIndex);
        if ((marker != 'e' && marker != 'E') || markerIndex != signIndex - 1 || markerIndex == 0) {
            return false;
        }
        int i = markerIndex - 1;
        boolean sawDigit = false;
        while (i >= 0 && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
            sawDigit |= Character.isDigit(text.charAt(i));
            i--;
        }
        if (!sawDigit) {
            return false;
        }
        return i < 0 || !(Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_');
    }

    private static int closingParen(String text, int openIndex) {
        int depth = 0;
        boolean inString = false;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                inString = !inString;
            } else if (!inString) {
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
            }
        }
        return -1;
    }
}
