package com.kubegraph.core.expression;

import java.util.Set;

/**
 * Static shape checks over expression trees shared by the emitter, the validator and the compiler.
 */
final class ExpressionTypes {

    static final Set<String> COMPARISON_OPERATORS = Set.of("==", "!=", "===", "!==", "<", "<=", ">", ">=");
    static final Set<String> ARITHMETIC_OPERATORS = Set.of("+", "-", "*", "/", "%");
    private static final Set<String> BOOLEAN_METHODS = Set.of("includes", "startsWith", "endsWith", "some", "every");
    private static final Set<String> STRING_METHODS = Set.of(
            "toLowerCase", "toUpperCase", "trim", "substring", "slice", "join", "replace");

    private ExpressionTypes() {}

    /** True when the expression evaluates to a boolean in both source and target semantics. */
    static boolean isBoolean(Expr expr) {
        if (expr instanceof Expr.Literal literal) {
            return literal.value() instanceof Boolean;
        }
        if (expr instanceof Expr.FieldRef ref) {
            return ref.reference().valueType() == Boolean.class;
        }
        if (expr instanceof Expr.Unary unary) {
            return unary.operator().equals("!");
        }
        if (expr instanceof Expr.Binary binary) {
            String op = binary.operator();
            if (COMPARISON_OPERATORS.contains(op)) {
                return true;
            }
            if (op.equals("&&") || op.equals("||")) {
                return isBoolean(binary.left()) && isBoolean(binary.right());
            }
            return false;
        }
        if (expr instanceof Expr.Conditional conditional) {
            return isBoolean(conditional.consequent()) && isBoolean(conditional.alternate());
        }
        if (expr instanceof Expr.Call call) {
            if (call.callee() instanceof Expr.Member member) {
                return BOOLEAN_METHODS.contains(member.property());
            }
            return call.callee() instanceof Expr.Identifier id && id.name().equals("Boolean");
        }
        return false;
    }

    static boolean isString(Expr expr) {
        if (expr instanceof Expr.Literal literal) {
            return literal.value() instanceof String;
        }
        if (expr instanceof Expr.Template) {
            return true;
        }
        if (expr instanceof Expr.FieldRef ref) {
            return ref.reference().valueType() == String.class;
        }
        if (expr instanceof Expr.Call call) {
            if (call.callee() instanceof Expr.Member member) {
                return STRING_METHODS.contains(member.property());
            }
            return call.callee() instanceof Expr.Identifier id && id.name().equals("String");
        }
        if (expr instanceof Expr.Binary binary && binary.operator().equals("+")) {
            return isString(binary.left()) || isString(binary.right());
        }
        return false;
    }

    /** A reference, or plain member/index access rooted at one. */
    static boolean isReferenceAccess(Expr expr) {
        if (expr instanceof Expr.FieldRef) {
            return true;
        }
        if (expr instanceof Expr.Member member) {
            return !member.property().equals("length") && isReferenceAccess(member.object());
        }
        if (expr instanceof Expr.Index index) {
            return isReferenceAccess(index.object());
        }
        return false;
    }

    static Class<?> resultType(Expr expr) {
        if (isBoolean(expr)) {
            return Boolean.class;
        }
        if (isString(expr)) {
            return String.class;
        }
        if (expr instanceof Expr.FieldRef ref) {
            return ref.reference().valueType();
        }
        if (expr instanceof Expr.Binary binary && ARITHMETIC_OPERATORS.contains(binary.operator())) {
            return Number.class;
        }
        if (expr instanceof Expr.Unary unary && !unary.operator().equals("!")) {
            return Number.class;
        }
        if (expr instanceof Expr.Member member && member.property().equals("length")) {
            return Long.class;
        }
        if (expr instanceof Expr.Literal literal && literal.value() != null) {
            return literal.value().getClass();
        }
        return Object.class;
    }
}
