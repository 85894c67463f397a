package com.kubegraph.core.expression;

import com.kubegraph.core.reference.Reference;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Evaluates expression trees in process for the direct deployment strategy, with JavaScript-like
 * semantics for exactly the constructs {@link CelEmitter} accepts. References are read through
 * the supplied resolver.
 */
public class ExpressionEvaluator {

    /**
     * Replaces every reference and expression embedded in {@code value} by its evaluated result.
     * Maps and lists are copied; other values are returned as is.
     */
    public Object substitute(Object value, Function<Reference, Object> resolver) {
        if (value instanceof Reference ref) {
            return resolver.apply(ref);
        }
        if (value instanceof Expr expr) {
            return evaluate(expr, resolver);
        }
        if (value instanceof String text) {
            if (!ExpressionParser.containsInterpolation(text)) {
                return text;
            }
            Expr parsed;
            try {
                parsed = ExpressionParser.parseInterpolated(text);
            } catch (CompileError e) {
                // not an expression, e.g. a shell-style ${VAR:-default}
                return text;
            }
            if (parsed instanceof Expr.Literal) {
                return text;
            }
            return new ReferenceDetector().hasReferences(parsed) ? evaluate(parsed, resolver) : text;
        }
        if (value instanceof Map<?, ?> map) {
            Reference marker = ReferenceDetector.markerReference(map);
            if (marker != null) {
                return resolver.apply(marker);
            }
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), substitute(v, resolver)));
            return copy;
        }
        if (value instanceof Iterable<?> iterable) {
            var copy = new ArrayList<Object>();
            iterable.forEach(item -> copy.add(substitute(item, resolver)));
            return copy;
        }
        return value;
    }

    public Object evaluate(Expr expr, Function<Reference, Object> resolver) {
        return new Scope(resolver, Map.of()).eval(expr);
    }

    private static final class Scope {
        private final Function<Reference, Object> resolver;
        private final Map<String, Object> variables;

        Scope(Function<Reference, Object> resolver, Map<String, Object> variables) {
            this.resolver = resolver;
            this.variables = variables;
        }

        Scope with(String name, Object value) {
            var vars = new HashMap<>(variables);
            vars.put(name, value);
            return new Scope(resolver, vars);
        }

        Object eval(Expr expr) {
            if (expr instanceof Expr.Literal literal) {
                return literal.value();
            }
            if (expr instanceof Expr.FieldRef ref) {
                return resolver.apply(ref.reference());
            }
            if (expr instanceof Expr.Identifier id) {
                if (!variables.containsKey(id.name())) {
                    throw new EvaluationError("Unknown identifier: " + id.name());
                }
                return variables.get(id.name());
            }
            if (expr instanceof Expr.Member member) {
                Object object = eval(member.object());
                if (object == null) {
                    if (member.optional()) {
                        return null;
                    }
                    throw new EvaluationError("Cannot read property '" + member.property() + "' of null");
                }
                return property(object, member.property());
            }
            if (expr instanceof Expr.Index index) {
                Object object = eval(index.object());
                if (object == null) {
                    if (index.optional()) {
                        return null;
                    }
                    throw new EvaluationError("Cannot index null");
                }
                return element(object, eval(index.index()));
            }
            if (expr instanceof Expr.Call call) {
                return call(call);
            }
            if (expr instanceof Expr.Unary unary) {
                Object operand = eval(unary.operand());
                return switch (unary.operator()) {
                    case "!" -> !truthy(operand);
                    case "-" -> number(-toDouble(operand));
                    default -> number(toDouble(operand));
                };
            }
            if (expr instanceof Expr.Binary binary) {
                return binary(binary);
            }
            if (expr instanceof Expr.Conditional conditional) {
                return truthy(eval(conditional.test()))
                        ? eval(conditional.consequent())
                        : eval(conditional.alternate());
            }
            if (expr instanceof Expr.Template template) {
                var sb = new StringBuilder();
                for (int i = 0; i < template.expressions().size(); i++) {
                    sb.append(template.quasis().get(i)).append(text(eval(template.expressions().get(i))));
                }
                return sb.append(template.quasis().get(template.quasis().size() - 1)).toString();
            }
            if (expr instanceof Expr.ArrayLiteral array) {
                var list = new ArrayList<Object>();
                array.elements().forEach(e -> list.add(eval(e)));
                return list;
            }
            throw new EvaluationError("Cannot evaluate " + expr.getClass().getSimpleName() + " here");
        }

        private Object binary(Expr.Binary binary) {
            String op = binary.operator();
            switch (op) {
                case "&&": {
                    Object left = eval(binary.left());
                    return truthy(left) ? eval(binary.right()) : left;
                }
                case "||": {
                    Object left = eval(binary.left());
                    return truthy(left) ? left : eval(binary.right());
                }
                case "??": {
                    Object left = eval(binary.left());
                    return left != null ? left : eval(binary.right());
                }
                default:
                    break;
            }
            Object left = eval(binary.left());
            Object right = eval(binary.right());
            switch (op) {
                case "+":
                    if (left instanceof String || right instanceof String) {
                        return text(left) + text(right);
                    }
                    return number(toDouble(left) + toDouble(right));
                case "-":
                    return number(toDouble(left) - toDouble(right));
                case "*":
                    return number(toDouble(left) * toDouble(right));
                case "/":
                    return number(toDouble(left) / toDouble(right));
                case "%":
                    return number(toDouble(left) % toDouble(right));
                case "==":
                case "===":
                    return looseEquals(left, right);
                case "!=":
                case "!==":
                    return !looseEquals(left, right);
                case "<":
                case "<=":
                case ">":
                case ">=":
                    return compare(op, left, right);
                default:
                    throw new EvaluationError("Unsupported operator: " + op);
            }
        }

        private Object call(Expr.Call call) {
            if (call.callee() instanceof Expr.Identifier id && !variables.containsKey(id.name())) {
                Object arg = call.arguments().isEmpty() ? null : eval(call.arguments().get(0));
                return switch (id.name()) {
                    case "Number", "parseFloat" -> number(toDouble(arg));
                    case "parseInt" -> number(Math.floor(toDouble(arg)));
                    case "String" -> text(arg);
                    case "Boolean" -> truthy(arg);
                    default -> throw new EvaluationError("Unsupported method call: " + id.name());
                };
            }
            if (!(call.callee() instanceof Expr.Member member)) {
                throw new EvaluationError("Unsupported call expression");
            }
            if (member.object() instanceof Expr.Identifier id && id.name().equals("Math")
                    && !variables.containsKey("Math")) {
                return math(member.property(), call.arguments());
            }
            Object receiver = eval(member.object());
            if (receiver == null) {
                if (member.optional() || call.optional()) {
                    return null;
                }
                throw new EvaluationError("Cannot call '" + member.property() + "' on null");
            }
            String method = member.property();
            if (receiver instanceof List<?> list) {
                return listMethod(list, method, call.arguments());
            }
            if (receiver instanceof String s) {
                return stringMethod(s, method, args(call.arguments()));
            }
            throw new EvaluationError("Unsupported method call: " + method);
        }

        private Object stringMethod(String s, String method, List<Object> args) {
            switch (method) {
                case "includes":
                    return s.contains(text(arg(args, 0)));
                case "startsWith":
                    return s.startsWith(text(arg(args, 0)));
                case "endsWith":
                    return s.endsWith(text(arg(args, 0)));
                case "toLowerCase":
                    return s.toLowerCase();
                case "toUpperCase":
                    return s.toUpperCase();
                case "trim":
                    return s.trim();
                case "substring":
                case "slice": {
                    int start = clamp((int) toDouble(arg(args, 0)), s.length());
                    int end = args.size() > 1 ? clamp((int) toDouble(args.get(1)), s.length()) : s.length();
                    return start <= end ? s.substring(start, end) : "";
                }
                case "split":
                    return new ArrayList<Object>(List.of(s.split(java.util.regex.Pattern.quote(text(arg(args, 0))), -1)));
                case "replace":
                    return s.replaceFirst(java.util.regex.Pattern.quote(text(arg(args, 0))),
                            java.util.regex.Matcher.quoteReplacement(text(arg(args, 1))));
                case "indexOf":
                    return (long) s.indexOf(text(arg(args, 0)));
                default:
                    throw new EvaluationError("Unsupported method call: " + method);
            }
        }

        private Object listMethod(List<?> list, String method, List<Expr> arguments) {
            switch (method) {
                case "includes": {
                    Object needle = eval(arguments.get(0));
                    return list.stream().anyMatch(item -> looseEquals(item, needle));
                }
                case "indexOf": {
                    Object needle = eval(arguments.get(0));
                    for (int i = 0; i < list.size(); i++) {
                        if (looseEquals(list.get(i), needle)) {
                            return (long) i;
                        }
                    }
                    return -1L;
                }
                case "join": {
                    String separator = arguments.isEmpty() ? "," : text(eval(arguments.get(0)));
                    var parts = new ArrayList<String>();
                    list.forEach(item -> parts.add(text(item)));
                    return String.join(separator, parts);
                }
                case "slice": {
                    List<Object> args = args(arguments);
                    int start = clamp((int) toDouble(arg(args, 0)), list.size());
                    int end = args.size() > 1 ? clamp((int) toDouble(args.get(1)), list.size()) : list.size();
                    return start <= end ? new ArrayList<Object>(list.subList(start, end)) : new ArrayList<>();
                }
                case "map":
                case "filter":
                case "some":
                case "every":
                case "find":
                    return macro(list, method, arguments.get(0));
                default:
                    throw new EvaluationError("Unsupported method call: " + method);
            }
        }

        private Object macro(List<?> list, String method, Expr argument) {
            String parameter;
            Expr body;
            if (argument instanceof Expr.Lambda lambda) {
                parameter = lambda.parameter();
                body = lambda.body();
            } else if (argument instanceof Expr.Literal literal && literal.value() instanceof String property) {
                parameter = "item";
                body = new Expr.Member(new Expr.Identifier(parameter, Span.NONE), property, false, Span.NONE);
            } else {
                throw new EvaluationError("'" + method + "' requires an arrow function argument");
            }
            var mapped = new ArrayList<Object>();
            for (Object item : list) {
                Object result = with(parameter, item).eval(body);
                switch (method) {
                    case "map" -> mapped.add(result);
                    case "filter" -> {
                        if (truthy(result)) {
                            mapped.add(item);
                        }
                    }
                    case "some" -> {
                        if (truthy(result)) {
                            return true;
                        }
                    }
                    case "every" -> {
                        if (!truthy(result)) {
                            return false;
                        }
                    }
                    default -> {
                        if (truthy(result)) {
                            return item;
                        }
                    }
                }
            }
            return switch (method) {
                case "some" -> false;
                case "every" -> true;
                case "find" -> null;
                default -> mapped;
            };
        }

        private Object math(String function, List<Expr> arguments) {
            List<Object> args = args(arguments);
            switch (function) {
                case "min":
                    return number(args.stream().mapToDouble(ExpressionEvaluator::toDouble).min().orElse(Double.POSITIVE_INFINITY));
                case "max":
                    return number(args.stream().mapToDouble(ExpressionEvaluator::toDouble).max().orElse(Double.NEGATIVE_INFINITY));
                case "abs":
                    return number(Math.abs(toDouble(arg(args, 0))));
                case "floor":
                    return number(Math.floor(toDouble(arg(args, 0))));
                case "ceil":
                    return number(Math.ceil(toDouble(arg(args, 0))));
                case "round":
                    return number(Math.round(toDouble(arg(args, 0))));
                default:
                    throw new EvaluationError("Unsupported method call: Math." + function);
            }
        }

        private List<Object> args(List<Expr> arguments) {
            var values = new ArrayList<Object>();
            arguments.forEach(a -> values.add(eval(a)));
            return values;
        }
    }

    static Object property(Object object, String property) {
        if (property.equals("length")) {
            if (object instanceof String s) {
                return (long) s.length();
            }
            if (object instanceof List<?> list) {
                return (long) list.size();
            }
        }
        if (object instanceof Map<?, ?> map) {
            return map.get(property);
        }
        return null;
    }

    static Object element(Object object, Object key) {
        if (object instanceof List<?> list && key instanceof Number n) {
            int i = n.intValue();
            return i >= 0 && i < list.size() ? list.get(i) : null;
        }
        if (object instanceof Map<?, ?> map) {
            return map.get(text(key));
        }
        return null;
    }

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }

    static boolean looseEquals(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return a.doubleValue() == b.doubleValue();
        }
        return Objects.equals(left, right);
    }

    static boolean compare(String op, Object left, Object right) {
        int cmp;
        if (left instanceof String a && right instanceof String b) {
            cmp = a.compareTo(b);
        } else if (left == null || right == null) {
            return false;
        } else {
            double a = toDouble(left);
            double b = toDouble(right);
            if (Double.isNaN(a) || Double.isNaN(b)) {
                return false;
            }
            cmp = Double.compare(a, b);
        }
        return switch (op) {
            case "<" -> cmp < 0;
            case "<=" -> cmp <= 0;
            case ">" -> cmp > 0;
            default -> cmp >= 0;
        };
    }

    static double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value == null) {
            return 0;
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    /** Integral results come back as {@code Long}, everything else as {@code Double}. */
    static Object number(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return (long) d;
        }
        return d;
    }

    static String text(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double || value instanceof Float) {
            Object n = number(((Number) value).doubleValue());
            return n.toString();
        }
        if (value instanceof List<?> list) {
            var parts = new ArrayList<String>();
            list.forEach(item -> parts.add(item == null ? "" : text(item)));
            return String.join(",", parts);
        }
        return value.toString();
    }

    private static Object arg(List<Object> args, int index) {
        return index < args.size() ? args.get(index) : null;
    }

    private static int clamp(int index, int length) {
        if (index < 0) {
            index = Math.max(0, length + index);
        }
        return Math.min(index, length);
    }
}
