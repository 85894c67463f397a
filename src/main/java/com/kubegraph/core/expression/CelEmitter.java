package com.kubegraph.core.expression;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Bottom-up translation of an expression tree into CEL text, the syntax evaluated by the
 * control-loop delegate. Every node contributes a {@link SourceMapping}.
 *
 * <p>Parenthesisation follows the operator table: a child binding looser than its parent is
 * wrapped, and so is a right operand of equal precedence.
 */
public final class CelEmitter {

    static final int TERNARY = 0;
    static final int OR = 1;
    static final int AND = 2;
    static final int EQUALITY = 3;
    static final int RELATIONAL = 4;
    static final int ADDITIVE = 5;
    static final int MULTIPLICATIVE = 6;
    static final int UNARY = 7;
    static final int ATOM = 8;

    private static final Map<String, String> OPERATORS = Map.ofEntries(
            Map.entry("===", "=="), Map.entry("!==", "!="),
            Map.entry("==", "=="), Map.entry("!=", "!="),
            Map.entry("<", "<"), Map.entry("<=", "<="), Map.entry(">", ">"), Map.entry(">=", ">="),
            Map.entry("+", "+"), Map.entry("-", "-"),
            Map.entry("*", "*"), Map.entry("/", "/"), Map.entry("%", "%"));

    private static final Map<String, String> SIMPLE_METHODS = Map.of(
            "includes", "contains",
            "startsWith", "startsWith",
            "endsWith", "endsWith",
            "toLowerCase", "lowerAscii",
            "toUpperCase", "upperAscii",
            "trim", "trim",
            "substring", "substring",
            "slice", "substring",
            "split", "split",
            "join", "join");

    private static final Map<String, String> COLLECTION_MACROS = Map.of(
            "map", "map",
            "filter", "filter",
            "some", "exists",
            "every", "all",
            "find", "filter");

    private static final Map<String, String> MATH_FUNCTIONS = Map.of(
            "min", "math.least",
            "max", "math.greatest",
            "abs", "math.abs",
            "floor", "math.floor",
            "ceil", "math.ceil",
            "round", "math.round");

    private static final Map<String, String> CONVERSIONS = Map.of(
            "Number", "double",
            "String", "string",
            "Boolean", "bool",
            "parseInt", "int",
            "parseFloat", "double");

    /**
     * Emitted text plus the mappings for every node.
     */
    public record Emission(String text, List<SourceMapping> mappings) {}

    private final String source;
    private final Deque<String> scope = new ArrayDeque<>();

    public CelEmitter(String source) {
        this.source = source;
    }

    public CelEmitter() {
        this(null);
    }

    public Emission emit(Expr expr) {
        Fragment fragment = node(expr);
        return new Emission(fragment.text(), fragment.mappings());
    }

    /**
     * Form embedded in manifests: {@code ${cel}} for a single expression; for a template, the
     * literal text kept verbatim with each hole compiled on its own.
     */
    public String emitInterpolation(Expr expr) {
        if (expr instanceof Expr.Template template) {
            var sb = new StringBuilder();
            for (int i = 0; i < template.expressions().size(); i++) {
                sb.append(template.quasis().get(i));
                sb.append("${").append(node(template.expressions().get(i)).text()).append('}');
            }
            sb.append(template.quasis().get(template.quasis().size() - 1));
            return sb.toString();
        }
        return "${" + node(expr).text() + "}";
    }

    private record Fragment(String text, int precedence, List<SourceMapping> mappings) {}

    private final class Builder {
        private final StringBuilder text = new StringBuilder();
        private final List<SourceMapping> mappings = new ArrayList<>();

        Builder append(String s) {
            text.append(s);
            return this;
        }

        Builder child(Fragment fragment, int minPrecedence) {
            boolean wrap = fragment.precedence() < minPrecedence;
            if (wrap) {
                text.append('(');
            }
            int offset = text.length();
            for (SourceMapping mapping : fragment.mappings()) {
                mappings.add(mapping.shift(offset));
            }
            text.append(fragment.text());
            if (wrap) {
                text.append(')');
            }
            return this;
        }

        Fragment build(Expr node, int precedence) {
            String out = text.toString();
            var all = new ArrayList<SourceMapping>(mappings.size() + 1);
            all.add(new SourceMapping(node.span(), node.span().slice(source), 0, out.length(), out));
            all.addAll(mappings);
            return new Fragment(out, precedence, all);
        }
    }

    private Fragment node(Expr expr) {
        if (expr instanceof Expr.Literal literal) {
            return new Builder().append(literal(literal.value())).build(expr, ATOM);
        }
        if (expr instanceof Expr.FieldRef ref) {
            return new Builder().append(ref.reference().toCelPath()).build(expr, ATOM);
        }
        if (expr instanceof Expr.Identifier id) {
            if (!scope.contains(id.name())) {
                throw new CompileError("UNKNOWN_IDENTIFIER", "Unknown identifier: " + id.name(), id.span());
            }
            return new Builder().append(id.name()).build(expr, ATOM);
        }
        if (expr instanceof Expr.Member member) {
            return member(member);
        }
        if (expr instanceof Expr.Index index) {
            return new Builder().child(node(index.object()), ATOM)
                    .append(index.optional() ? "[?" : "[")
                    .child(node(index.index()), TERNARY)
                    .append("]")
                    .build(expr, ATOM);
        }
        if (expr instanceof Expr.Call call) {
            return call(call);
        }
        if (expr instanceof Expr.Unary unary) {
            return unary(unary);
        }
        if (expr instanceof Expr.Binary binary) {
            return binary(binary);
        }
        if (expr instanceof Expr.Conditional conditional) {
            Builder b = new Builder();
            testPosition(b, conditional.test());
            return b.append(" ? ")
                    .child(node(conditional.consequent()), OR)
                    .append(" : ")
                    .child(node(conditional.alternate()), TERNARY)
                    .build(expr, TERNARY);
        }
        if (expr instanceof Expr.Template template) {
            return template(template);
        }
        if (expr instanceof Expr.ArrayLiteral array) {
            Builder b = new Builder().append("[");
            for (int i = 0; i < array.elements().size(); i++) {
                if (i > 0) {
                    b.append(", ");
                }
                b.child(node(array.elements().get(i)), TERNARY);
            }
            return b.append("]").build(expr, ATOM);
        }
        if (expr instanceof Expr.Lambda lambda) {
            throw new CompileError("UNSUPPORTED_SYNTAX",
                    "Arrow function is only supported as the argument of a collection method", lambda.span());
        }
        throw new CompileError("UNSUPPORTED_SYNTAX", "Unsupported expression: " + expr, expr.span());
    }

    private Fragment member(Expr.Member member) {
        if (member.property().equals("length")) {
            return new Builder().append("size(").child(node(member.object()), TERNARY).append(")")
                    .build(member, ATOM);
        }
        return new Builder().child(node(member.object()), ATOM)
                .append(member.optional() ? ".?" : ".")
                .append(member.property())
                .build(member, ATOM);
    }

    private Fragment unary(Expr.Unary unary) {
        switch (unary.operator()) {
            case "!":
                if (ExpressionTypes.isBoolean(unary.operand())) {
                    return new Builder().append("!").child(node(unary.operand()), UNARY).build(unary, UNARY);
                }
                return new Builder().append("!(").child(truthy(unary.operand()), TERNARY).append(")")
                        .build(unary, UNARY);
            case "-":
                return new Builder().append("-").child(node(unary.operand()), UNARY).build(unary, UNARY);
            case "+":
                return new Builder().append("double(").child(node(unary.operand()), TERNARY).append(")")
                        .build(unary, ATOM);
            default:
                throw new CompileError("UNSUPPORTED_OPERATOR",
                        "Unsupported unary operator: " + unary.operator(), unary.span());
        }
    }

    private Fragment binary(Expr.Binary binary) {
        String op = binary.operator();
        switch (op) {
            case "??":
                return fallback(binary);
            case "||":
                if (ExpressionTypes.isBoolean(binary.left()) && ExpressionTypes.isBoolean(binary.right())) {
                    return new Builder().child(node(binary.left()), OR).append(" || ")
                            .child(node(binary.right()), OR + 1).build(binary, OR);
                }
                if (ExpressionTypes.isBoolean(binary.left())) {
                    throw new CompileError("UNSUPPORTED_FALLBACK",
                            "Fallback '||' with a boolean left operand and a non-boolean right operand "
                                    + "cannot be represented; use a conditional instead", binary.span());
                }
                if (ExpressionTypes.isReferenceAccess(binary.left())) {
                    return fallback(binary);
                }
                Fragment orLeft = node(binary.left());
                return new Builder().child(truthy(binary.left()), OR).append(" ? ")
                        .child(orLeft, OR).append(" : ")
                        .child(node(binary.right()), TERNARY).build(binary, TERNARY);
            case "&&":
                if (ExpressionTypes.isBoolean(binary.left()) && ExpressionTypes.isBoolean(binary.right())) {
                    return new Builder().child(node(binary.left()), AND).append(" && ")
                            .child(node(binary.right()), AND + 1).build(binary, AND);
                }
                Builder b = new Builder();
                testPosition(b, binary.left());
                return b.append(" ? ").child(node(binary.right()), OR).append(" : ")
                        .child(node(binary.left()), TERNARY).build(binary, TERNARY);
            default:
                String mapped = OPERATORS.get(op);
                if (mapped == null) {
                    throw new CompileError("UNSUPPORTED_OPERATOR", "Unsupported operator: " + op, binary.span());
                }
                int precedence = precedence(op);
                return new Builder().child(node(binary.left()), precedence)
                        .append(" " + mapped + " ")
                        .child(node(binary.right()), precedence + 1)
                        .build(binary, precedence);
        }
    }

    /**
     * {@code left != null ? left : right}, or {@code left.orValue(right)} when the left side is an
     * optional-field chain.
     */
    private Fragment fallback(Expr.Binary binary) {
        Fragment left = node(binary.left());
        if (isOptionalChain(binary.left())) {
            return new Builder().child(left, ATOM).append(".orValue(")
                    .child(node(binary.right()), TERNARY).append(")")
                    .build(binary, ATOM);
        }
        return new Builder().child(left, RELATIONAL).append(" != null ? ")
                .child(left, OR).append(" : ")
                .child(node(binary.right()), TERNARY)
                .build(binary, TERNARY);
    }

    private static boolean isOptionalChain(Expr expr) {
        if (expr instanceof Expr.Member member) {
            return member.optional() || isOptionalChain(member.object());
        }
        if (expr instanceof Expr.Index index) {
            return index.optional() || isOptionalChain(index.object());
        }
        return false;
    }

    /** Emits a value in condition position, spelling out truthiness when it is not boolean. */
    private void testPosition(Builder b, Expr test) {
        if (ExpressionTypes.isBoolean(test)) {
            b.child(node(test), OR);
        } else {
            b.child(truthy(test), OR);
        }
    }

    private Fragment truthy(Expr value) {
        Fragment v = node(value);
        return new Builder()
                .child(v, RELATIONAL).append(" != null && ")
                .child(v, RELATIONAL).append(" != \"\" && ")
                .child(v, RELATIONAL).append(" != false && ")
                .child(v, RELATIONAL).append(" != 0")
                .build(value, AND);
    }

    private Fragment template(Expr.Template template) {
        var parts = new ArrayList<Fragment>();
        for (int i = 0; i < template.expressions().size(); i++) {
            addLiteralPart(parts, template.quasis().get(i));
            Expr hole = template.expressions().get(i);
            if (ExpressionTypes.isString(hole)) {
                parts.add(node(hole));
            } else {
                parts.add(new Builder().append("string(").child(node(hole), TERNARY).append(")")
                        .build(hole, ATOM));
            }
        }
        addLiteralPart(parts, template.quasis().get(template.quasis().size() - 1));
        if (parts.isEmpty()) {
            return new Builder().append("\"\"").build(template, ATOM);
        }
        if (parts.size() == 1) {
            return new Builder().child(parts.get(0), TERNARY).build(template, parts.get(0).precedence());
        }
        Builder b = new Builder();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                b.append(" + ");
            }
            b.child(parts.get(i), i == 0 ? ADDITIVE : ADDITIVE + 1);
        }
        return b.build(template, ADDITIVE);
    }

    private void addLiteralPart(List<Fragment> parts, String text) {
        if (!text.isEmpty()) {
            Expr literal = new Expr.Literal(text, Span.NONE);
            parts.add(new Builder().append(literal(text)).build(literal, ATOM));
        }
    }

    private Fragment call(Expr.Call call) {
        if (call.optional() || call.callee() instanceof Expr.Member m && m.optional()) {
            throw new CompileError("UNSUPPORTED_OPTIONAL_CALL",
                    "Optional call cannot be represented; only fields and indexes may be optional", call.span());
        }
        if (call.callee() instanceof Expr.Member member) {
            if (member.object() instanceof Expr.Identifier id && id.name().equals("Math")
                    && !scope.contains("Math")) {
                return mathCall(call, member.property());
            }
            return methodCall(call, member);
        }
        if (call.callee() instanceof Expr.Identifier id && CONVERSIONS.containsKey(id.name())) {
            requireArity(call, id.name(), 1, 1);
            return new Builder().append(CONVERSIONS.get(id.name()) + "(")
                    .child(node(call.arguments().get(0)), TERNARY).append(")").build(call, ATOM);
        }
        String name = call.callee() instanceof Expr.Identifier id ? id.name() : "<expression>";
        throw new CompileError("UNSUPPORTED_METHOD", "Unsupported method call: " + name, call.span());
    }

    private Fragment mathCall(Expr.Call call, String function) {
        String target = MATH_FUNCTIONS.get(function);
        if (target == null) {
            throw new CompileError("UNSUPPORTED_METHOD", "Unsupported method call: Math." + function, call.span());
        }
        Builder b = new Builder().append(target + "(");
        appendArguments(b, call.arguments());
        return b.append(")").build(call, ATOM);
    }

    private Fragment methodCall(Expr.Call call, Expr.Member member) {
        String method = member.property();
        Fragment receiver = node(member.object());

        if (COLLECTION_MACROS.containsKey(method)) {
            return collectionMacro(call, receiver, method);
        }
        if (method.equals("indexOf")) {
            requireArity(call, method, 1, 1);
            return new Builder().child(receiver, ATOM).append(".contains(")
                    .child(node(call.arguments().get(0)), TERNARY)
                    .append(") ? 0 : -1")
                    .build(call, TERNARY);
        }
        if (method.equals("replace")) {
            requireArity(call, method, 2, 2);
        }
        String target = method.equals("replace") ? "replace" : SIMPLE_METHODS.get(method);
        if (target == null) {
            throw new CompileError("UNSUPPORTED_METHOD", "Unsupported method call: " + method, call.span());
        }
        Builder b = new Builder().child(receiver, ATOM).append("." + target + "(");
        appendArguments(b, call.arguments());
        return b.append(")").build(call, ATOM);
    }

    private Fragment collectionMacro(Expr.Call call, Fragment receiver, String method) {
        requireArity(call, method, 1, 1);
        Expr argument = call.arguments().get(0);
        String parameter;
        Expr body;
        if (argument instanceof Expr.Lambda lambda) {
            parameter = lambda.parameter();
            body = lambda.body();
        } else if (method.equals("map") && argument instanceof Expr.Literal literal
                && literal.value() instanceof String property) {
            parameter = "item";
            body = new Expr.Member(new Expr.Identifier(parameter, Span.NONE), property, false, Span.NONE);
        } else {
            throw new CompileError("UNSUPPORTED_SYNTAX",
                    "'" + method + "' requires an arrow function argument", argument.span());
        }
        scope.push(parameter);
        Fragment emittedBody;
        try {
            emittedBody = node(body);
        } finally {
            scope.pop();
        }
        Builder b = new Builder().child(receiver, ATOM)
                .append("." + COLLECTION_MACROS.get(method) + "(" + parameter + ", ")
                .child(emittedBody, TERNARY)
                .append(")");
        if (method.equals("find")) {
            b.append("[0]");
        }
        return b.build(call, ATOM);
    }

    private void appendArguments(Builder b, List<Expr> arguments) {
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                b.append(", ");
            }
            b.child(node(arguments.get(i)), TERNARY);
        }
    }

    private static void requireArity(Expr.Call call, String name, int min, int max) {
        int n = call.arguments().size();
        if (n < min || n > max) {
            throw new CompileError("INVALID_ARGUMENTS",
                    "'" + name + "' expects " + (min == max ? String.valueOf(min) : min + " to " + max)
                            + " argument(s), got " + n, call.span());
        }
    }

    static int precedence(String op) {
        switch (op) {
            case "||":
            case "??":
                return OR;
            case "&&":
                return AND;
            case "==":
            case "!=":
            case "===":
            case "!==":
                return EQUALITY;
            case "<":
            case "<=":
            case ">":
            case ">=":
                return RELATIONAL;
            case "+":
            case "-":
                return ADDITIVE;
            case "*":
            case "/":
            case "%":
                return MULTIPLICATIVE;
            default:
                return TERNARY;
        }
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof Double d && d == Math.rint(d) && !d.isInfinite() && Math.abs(d) < 1e15) {
            return String.valueOf(d.longValue());
        }
        if (value instanceof Float f && f == Math.rint(f) && !f.isInfinite()) {
            return String.valueOf(f.longValue());
        }
        return String.valueOf(value);
    }

    static String quote(String s) {
        var sb = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
