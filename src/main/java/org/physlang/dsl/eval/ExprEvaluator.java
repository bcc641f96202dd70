package org.physlang.dsl.eval;

import org.physlang.dsl.BinaryExpr;
import org.physlang.dsl.BuiltinCall;
import org.physlang.dsl.Expr;
import org.physlang.dsl.ExprVisitor;
import org.physlang.dsl.NumberLiteral;
import org.physlang.dsl.StringLiteral;
import org.physlang.dsl.UnaryMinus;
import org.physlang.dsl.UserCall;
import org.physlang.dsl.VariableRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates expressions to doubles against a scope.
 *
 * User function calls are delegated to a {@link UserCallHandler}; without a
 * handler they fail with {@link EvaluationException.Kind#UNRESOLVED_CALL}.
 */
public final class ExprEvaluator implements ExprVisitor<Double> {

    private final EvaluationScope scope;
    private final UserCallHandler callHandler;

    public ExprEvaluator(EvaluationScope scope) {
        this(scope, null);
    }

    public ExprEvaluator(EvaluationScope scope, UserCallHandler callHandler) {
        this.scope = Objects.requireNonNull(scope, "Scope cannot be null");
        this.callHandler = callHandler;
    }

    public static double evaluate(Expr expr, EvaluationScope scope) {
        return new ExprEvaluator(scope).evaluate(expr);
    }

    public double evaluate(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public Double visitNumber(NumberLiteral number) {
        return number.value();
    }

    @Override
    public Double visitString(StringLiteral string) {
        throw new EvaluationException(EvaluationException.Kind.NOT_NUMERIC,
                "String " + string + " cannot be used as a number");
    }

    @Override
    public Double visitVariable(VariableRef variable) {
        var value = scope.lookup(variable.name());
        if (value.isPresent()) {
            return value.getAsDouble();
        }
        if (scope.stringParameter(variable.name()).isPresent()) {
            throw new EvaluationException(EvaluationException.Kind.NOT_NUMERIC,
                    "'" + variable.name() + "' names a particle and cannot be used as a number");
        }
        throw new EvaluationException(EvaluationException.Kind.UNKNOWN_VARIABLE,
                "Unknown variable '" + variable.name() + "'");
    }

    @Override
    public Double visitUnaryMinus(UnaryMinus unary) {
        return -evaluate(unary.operand());
    }

    @Override
    public Double visitBinary(BinaryExpr binary) {
        double left = evaluate(binary.left());
        double right = evaluate(binary.right());
        return switch (binary.operator()) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> {
                if (right == 0.0) {
                    throw new EvaluationException(EvaluationException.Kind.DIVISION_BY_ZERO,
                            "Division by zero in " + binary);
                }
                yield left / right;
            }
            case LESS -> truth(left < right);
            case GREATER -> truth(left > right);
            case LESS_EQUAL -> truth(left <= right);
            case GREATER_EQUAL -> truth(left >= right);
            case EQUAL -> truth(left == right);
            case NOT_EQUAL -> truth(left != right);
        };
    }

    @Override
    public Double visitBuiltinCall(BuiltinCall call) {
        BuiltinCall.Builtin function = call.function();
        if (call.arguments().size() != function.arity()) {
            throw new EvaluationException(EvaluationException.Kind.ARGUMENT_COUNT,
                    "Builtin '" + function.functionName() + "' expects " + function.arity()
                            + " argument(s), got " + call.arguments().size());
        }
        List<Double> args = evaluateAll(call.arguments());
        return switch (function) {
            case SIN -> Math.sin(args.get(0));
            case COS -> Math.cos(args.get(0));
            case SQRT -> {
                double x = args.get(0);
                if (x < 0) {
                    throw new EvaluationException(EvaluationException.Kind.INVALID_DOMAIN,
                            "sqrt of negative value " + x);
                }
                yield Math.sqrt(x);
            }
            case CLAMP -> Math.min(Math.max(args.get(0), args.get(1)), args.get(2));
        };
    }

    @Override
    public Double visitUserCall(UserCall call) {
        if (callHandler == null) {
            throw new EvaluationException(EvaluationException.Kind.UNRESOLVED_CALL,
                    "Function '" + call.functionName() + "' cannot be called here");
        }
        return callHandler.invoke(call.functionName(), evaluateAll(call.arguments()));
    }

    private List<Double> evaluateAll(List<Expr> exprs) {
        List<Double> values = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) {
            values.add(evaluate(expr));
        }
        return values;
    }

    private static double truth(boolean value) {
        return value ? 1.0 : 0.0;
    }
}
