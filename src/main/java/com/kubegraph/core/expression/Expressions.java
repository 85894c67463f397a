package com.kubegraph.core.expression;

import com.kubegraph.core.reference.Reference;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for composing expression trees in code instead of parsing text.
 *
 * <pre>{@code
 * Expr ready = Expressions.gt(ResourceRef.of("web").status().field("readyReplicas"), 0);
 * }</pre>
 */
public final class Expressions {

    private Expressions() {}

    /** Lifts a reference, an existing node or a constant into the tree. */
    public static Expr of(Object value) {
        if (value instanceof Expr expr) {
            return expr;
        }
        if (value instanceof Reference ref) {
            return new Expr.FieldRef(ref, Span.NONE);
        }
        return new Expr.Literal(value, Span.NONE);
    }

    public static Expr ref(Reference reference) {
        return new Expr.FieldRef(reference, Span.NONE);
    }

    public static Expr literal(Object value) {
        return new Expr.Literal(value, Span.NONE);
    }

    public static Expr binary(String operator, Object left, Object right) {
        return new Expr.Binary(operator, of(left), of(right), Span.NONE);
    }

    public static Expr eq(Object left, Object right) {
        return binary("==", left, right);
    }

    public static Expr ne(Object left, Object right) {
        return binary("!=", left, right);
    }

    public static Expr gt(Object left, Object right) {
        return binary(">", left, right);
    }

    public static Expr ge(Object left, Object right) {
        return binary(">=", left, right);
    }

    public static Expr lt(Object left, Object right) {
        return binary("<", left, right);
    }

    public static Expr and(Object left, Object right) {
        return binary("&&", left, right);
    }

    public static Expr or(Object left, Object right) {
        return binary("||", left, right);
    }

    public static Expr coalesce(Object left, Object right) {
        return binary("??", left, right);
    }

    public static Expr not(Object operand) {
        return new Expr.Unary("!", of(operand), Span.NONE);
    }

    public static Expr cond(Object test, Object consequent, Object alternate) {
        return new Expr.Conditional(of(test), of(consequent), of(alternate), Span.NONE);
    }

    public static Expr member(Object object, String property) {
        return new Expr.Member(of(object), property, false, Span.NONE);
    }

    public static Expr optionalMember(Object object, String property) {
        return new Expr.Member(of(object), property, true, Span.NONE);
    }

    /** Method call on a receiver, e.g. {@code call(name, "toLowerCase")}. */
    public static Expr call(Object receiver, String method, Object... arguments) {
        var args = new ArrayList<Expr>();
        for (Object argument : arguments) {
            args.add(of(argument));
        }
        return new Expr.Call(new Expr.Member(of(receiver), method, false, Span.NONE), args, false, Span.NONE);
    }

    /**
     * Interleaves literal text and values: {@code template("http://", host, ":80")}.
     * Adjacent values get an empty literal between them.
     */
    public static Expr template(Object... parts) {
        var quasis = new ArrayList<String>();
        var expressions = new ArrayList<Expr>();
        var pending = new StringBuilder();
        for (Object part : Arrays.asList(parts)) {
            if (part instanceof String text) {
                pending.append(text);
            } else {
                quasis.add(pending.toString());
                pending.setLength(0);
                expressions.add(of(part));
            }
        }
        quasis.add(pending.toString());
        return new Expr.Template(quasis, expressions, Span.NONE);
    }

    public static Expr lambda(String parameter, Expr body) {
        return new Expr.Lambda(parameter, body, Span.NONE);
    }

    public static Expr identifier(String name) {
        return new Expr.Identifier(name, Span.NONE);
    }

    public static Expr array(Object... elements) {
        List<Expr> list = new ArrayList<>();
        for (Object element : elements) {
            list.add(of(element));
        }
        return new Expr.ArrayLiteral(list, Span.NONE);
    }

    /** Parses the textual form, e.g. {@code resources.web.status.readyReplicas > 0}. */
    public static Expr parse(String text) {
        return new ExpressionParser(text).parse();
    }
}
