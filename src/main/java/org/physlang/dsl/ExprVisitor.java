package org.physlang.dsl;

/**
 * Visitor for {@link Expr} nodes.
 *
 * @param <T> The result type
 */
public interface ExprVisitor<T> {

    T visitNumber(NumberLiteral number);

    T visitString(StringLiteral string);

    T visitVariable(VariableRef variable);

    T visitUnaryMinus(UnaryMinus unary);

    T visitBinary(BinaryExpr binary);

    T visitBuiltinCall(BuiltinCall call);

    T visitUserCall(UserCall call);
}
