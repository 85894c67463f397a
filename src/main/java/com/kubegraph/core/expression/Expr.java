package com.kubegraph.core.expression;

import com.kubegraph.core.reference.Reference;

import java.util.List;

/**
 * Tagged expression tree. References enter the tree only as explicit {@link FieldRef} nodes,
 * built either by {@link Expressions} or by {@link ExpressionParser}.
 */
public sealed interface Expr permits Expr.Literal, Expr.FieldRef, Expr.Identifier, Expr.Member,
        Expr.Index, Expr.Call, Expr.Unary, Expr.Binary, Expr.Conditional, Expr.Template,
        Expr.ArrayLiteral, Expr.Lambda {

    Span span();

    /** String, number, boolean or null constant. */
    record Literal(Object value, Span span) implements Expr {}

    /** Leaf standing in for a field of another resource or of the input spec. */
    record FieldRef(Reference reference, Span span) implements Expr {}

    /** Bare name: a lambda parameter or a global such as {@code Math}. */
    record Identifier(String name, Span span) implements Expr {}

    record Member(Expr object, String property, boolean optional, Span span) implements Expr {}

    record Index(Expr object, Expr index, boolean optional, Span span) implements Expr {}

    /**
     * Function or method call. Methods have a {@link Member} callee whose object is the receiver.
     */
    record Call(Expr callee, List<Expr> arguments, boolean optional, Span span) implements Expr {
        public Call {
            arguments = List.copyOf(arguments);
        }
    }

    record Unary(String operator, Expr operand, Span span) implements Expr {}

    /** Arithmetic, comparison and logical ({@code &&}, {@code ||}, {@code ??}) operators. */
    record Binary(String operator, Expr left, Expr right, Span span) implements Expr {}

    record Conditional(Expr test, Expr consequent, Expr alternate, Span span) implements Expr {}

    /**
     * String template. {@code quasis} always holds one more entry than {@code expressions}.
     */
    record Template(List<String> quasis, List<Expr> expressions, Span span) implements Expr {
        public Template {
            quasis = List.copyOf(quasis);
            expressions = List.copyOf(expressions);
            if (quasis.size() != expressions.size() + 1) {
                throw new IllegalArgumentException("template needs " + (expressions.size() + 1)
                        + " literal parts, got " + quasis.size());
            }
        }
    }

    record ArrayLiteral(List<Expr> elements, Span span) implements Expr {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }
    }

    /** Single-parameter arrow function, only valid as an argument of a collection method. */
    record Lambda(String parameter, Expr body, Span span) implements Expr {}
}
