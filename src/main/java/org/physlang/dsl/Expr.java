package org.physlang.dsl;

/**
 * Base interface for all PhysLang expressions.
 *
 * Expressions are pure numeric computations. String literals only appear
 * as arguments of function-call statements, where they name particles.
 */
public sealed interface Expr
        permits NumberLiteral, StringLiteral, VariableRef, UnaryMinus, BinaryExpr, BuiltinCall, UserCall {

    <T> T accept(ExprVisitor<T> visitor);
}
