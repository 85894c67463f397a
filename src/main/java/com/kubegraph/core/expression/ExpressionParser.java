package com.kubegraph.core.expression;

import com.kubegraph.core.expression.ExpressionLexer.Kind;
import com.kubegraph.core.expression.ExpressionLexer.Token;
import com.kubegraph.core.reference.Reference;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the textual expression form.
 *
 * <p>Member chains rooted at {@code resources.<id>} or {@code schema} are folded into a single
 * {@link Expr.FieldRef}, so {@code resources.web.status.readyReplicas > 0} parses to a comparison
 * between a reference and a literal. The chain stops at a method call, an optional access or a
 * trailing {@code .length}.
 */
public class ExpressionParser {

    private final String source;
    private final List<Token> tokens;
    private int current;

    public ExpressionParser(String source) {
        this(source, 0, source.length());
    }

    ExpressionParser(String source, int start, int end) {
        this.source = source;
        this.tokens = new ExpressionLexer(source, start, end).tokenize();
    }

    public Expr parse() {
        try {
            Expr expr = conditional();
            Token next = peek();
            if (next.kind() != Kind.EOF) {
                throw unexpected(next);
            }
            return expr;
        } catch (CompileError e) {
            throw e.withExpression(source);
        }
    }

    /**
     * Parses text that may embed {@code ${...}} holes, as found in manifest strings.
     * Text without holes is a string literal; text that is exactly one hole is that expression;
     * anything else is a {@link Expr.Template}.
     */
    public static Expr parseInterpolated(String text) {
        var quasis = new ArrayList<String>();
        var expressions = new ArrayList<Expr>();
        var literal = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            if (text.startsWith("${", i)) {
                int end = ExpressionLexer.skipHole(text, i + 2, text.length());
                quasis.add(literal.toString());
                literal.setLength(0);
                expressions.add(new ExpressionParser(text, i + 2, end - 1).parse());
                i = end;
            } else {
                literal.append(text.charAt(i++));
            }
        }
        quasis.add(literal.toString());
        if (expressions.isEmpty()) {
            return new Expr.Literal(text, new Span(0, text.length()));
        }
        if (expressions.size() == 1 && quasis.get(0).isEmpty() && quasis.get(1).isEmpty()) {
            return expressions.get(0);
        }
        return new Expr.Template(quasis, expressions, new Span(0, text.length()));
    }

    public static boolean containsInterpolation(String text) {
        return text != null && text.contains("${");
    }

    private Expr conditional() {
        Expr test = logicalOr();
        if (match("?")) {
            Expr consequent = conditional();
            expect(":");
            Expr alternate = conditional();
            return new Expr.Conditional(test, consequent, alternate, test.span().to(alternate.span()));
        }
        return test;
    }

    private Expr logicalOr() {
        Expr left = logicalAnd();
        while (peek().is("||") || peek().is("??")) {
            String op = advance().text();
            Expr right = logicalAnd();
            left = new Expr.Binary(op, left, right, left.span().to(right.span()));
        }
        return left;
    }

    private Expr logicalAnd() {
        Expr left = equality();
        while (match("&&")) {
            Expr right = equality();
            left = new Expr.Binary("&&", left, right, left.span().to(right.span()));
        }
        return left;
    }

    private Expr equality() {
        Expr left = relational();
        while (peek().is("==") || peek().is("!=") || peek().is("===") || peek().is("!==")) {
            String op = advance().text();
            Expr right = relational();
            left = new Expr.Binary(op, left, right, left.span().to(right.span()));
        }
        return left;
    }

    private Expr relational() {
        Expr left = additive();
        while (peek().is("<") || peek().is("<=") || peek().is(">") || peek().is(">=")) {
            String op = advance().text();
            Expr right = additive();
            left = new Expr.Binary(op, left, right, left.span().to(right.span()));
        }
        return left;
    }

    private Expr additive() {
        Expr left = multiplicative();
        while (peek().is("+") || peek().is("-")) {
            String op = advance().text();
            Expr right = multiplicative();
            left = new Expr.Binary(op, left, right, left.span().to(right.span()));
        }
        return left;
    }

    private Expr multiplicative() {
        Expr left = unary();
        while (peek().is("*") || peek().is("/") || peek().is("%")) {
            String op = advance().text();
            Expr right = unary();
            left = new Expr.Binary(op, left, right, left.span().to(right.span()));
        }
        return left;
    }

    private Expr unary() {
        if (peek().is("!") || peek().is("-") || peek().is("+")) {
            Token op = advance();
            Expr operand = unary();
            return new Expr.Unary(op.text(), operand, op.span().to(operand.span()));
        }
        return postfix();
    }

    private Expr postfix() {
        Expr expr = primary();
        while (true) {
            if (match(".")) {
                Token name = expectIdentifier();
                expr = new Expr.Member(expr, name.text(), false, expr.span().to(name.span()));
            } else if (match("?.")) {
                if (match("[")) {
                    Expr index = conditional();
                    Token close = expect("]");
                    expr = new Expr.Index(expr, index, true, expr.span().to(close.span()));
                } else if (match("(")) {
                    List<Expr> args = arguments();
                    Token close = previous();
                    expr = new Expr.Call(expr, args, true, expr.span().to(close.span()));
                } else {
                    Token name = expectIdentifier();
                    expr = new Expr.Member(expr, name.text(), true, expr.span().to(name.span()));
                }
            } else if (match("[")) {
                Expr index = conditional();
                Token close = expect("]");
                expr = new Expr.Index(expr, index, false, expr.span().to(close.span()));
            } else if (match("(")) {
                List<Expr> args = arguments();
                Token close = previous();
                expr = new Expr.Call(expr, args, false, expr.span().to(close.span()));
            } else {
                return expr;
            }
        }
    }

    /** Parses call arguments after the opening parenthesis, consuming the closing one. */
    private List<Expr> arguments() {
        var args = new ArrayList<Expr>();
        if (match(")")) {
            return args;
        }
        do {
            args.add(conditional());
        } while (match(","));
        expect(")");
        return args;
    }

    private Expr primary() {
        Token token = advance();
        switch (token.kind()) {
            case NUMBER, STRING:
                return new Expr.Literal(token.value(), token.span());
            case TEMPLATE:
                return template(token);
            case IDENT:
                return identifierExpression(token);
            case PUNCT:
                if (token.is("(")) {
                    if (peek().kind() == Kind.IDENT && peekAt(1).is(")") && peekAt(2).is("=>")) {
                        Token param = advance();
                        advance();
                        advance();
                        Expr body = conditional();
                        return new Expr.Lambda(param.text(), body, token.span().to(body.span()));
                    }
                    Expr inner = conditional();
                    expect(")");
                    return inner;
                }
                if (token.is("[")) {
                    var elements = new ArrayList<Expr>();
                    if (!peek().is("]")) {
                        do {
                            elements.add(conditional());
                        } while (match(","));
                    }
                    Token close = expect("]");
                    return new Expr.ArrayLiteral(elements, token.span().to(close.span()));
                }
                throw unexpected(token);
            default:
                throw unexpected(token);
        }
    }

    private Expr identifierExpression(Token token) {
        switch (token.text()) {
            case "true":
                return new Expr.Literal(Boolean.TRUE, token.span());
            case "false":
                return new Expr.Literal(Boolean.FALSE, token.span());
            case "null":
            case "undefined":
                return new Expr.Literal(null, token.span());
            default:
                break;
        }
        if (peek().is("=>")) {
            advance();
            Expr body = conditional();
            return new Expr.Lambda(token.text(), body, token.span().to(body.span()));
        }
        if (token.text().equals("resources") && peek().is(".")) {
            advance();
            Token id = expectIdentifier();
            return referenceChain(new Reference(id.text(), ""), token.span().to(id.span()));
        }
        if (token.text().equals("resources") && peek().is("[") && peekAt(1).kind() == Kind.STRING) {
            advance();
            Token id = advance();
            Token close = expect("]");
            return referenceChain(new Reference((String) id.value(), ""), token.span().to(close.span()));
        }
        if (token.text().equals("schema")) {
            return referenceChain(new Reference(Reference.SCHEMA_ID, ""), token.span());
        }
        return new Expr.Identifier(token.text(), token.span());
    }

    private Expr referenceChain(Reference reference, Span span) {
        while (true) {
            if (peek().is(".") && peekAt(1).kind() == Kind.IDENT && !peekAt(2).is("(")
                    && !isTrailingLength(peekAt(1), peekAt(2))) {
                advance();
                Token name = advance();
                reference = reference.field(name.text());
                span = span.to(name.span());
            } else if (peek().is("[") && peekAt(2).is("]")
                    && (peekAt(1).kind() == Kind.NUMBER || peekAt(1).kind() == Kind.STRING)) {
                advance();
                Token key = advance();
                Token close = advance();
                reference = key.kind() == Kind.NUMBER
                        ? reference.index(((Number) key.value()).intValue())
                        : reference.field((String) key.value());
                span = span.to(close.span());
            } else {
                return new Expr.FieldRef(reference, span);
            }
        }
    }

    private static boolean isTrailingLength(Token name, Token after) {
        return name.text().equals("length") && !after.is(".") && !after.is("[");
    }

    private Expr template(Token token) {
        int[] body = (int[]) token.value();
        var quasis = new ArrayList<String>();
        var expressions = new ArrayList<Expr>();
        var literal = new StringBuilder();
        int i = body[0];
        while (i < body[1]) {
            char c = source.charAt(i);
            if (c == '\\' && i + 1 < body[1]) {
                literal.append(ExpressionLexer.unescape(source.charAt(i + 1)));
                i += 2;
            } else if (c == '$' && i + 1 < body[1] && source.charAt(i + 1) == '{') {
                int end = ExpressionLexer.skipHole(source, i + 2, body[1]);
                quasis.add(literal.toString());
                literal.setLength(0);
                expressions.add(new ExpressionParser(source, i + 2, end - 1).parse());
                i = end;
            } else {
                literal.append(c);
                i++;
            }
        }
        quasis.add(literal.toString());
        return new Expr.Template(quasis, expressions, token.span());
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAt(int offset) {
        int index = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (token.kind() != Kind.EOF) {
            current++;
        }
        return token;
    }

    private boolean match(String punct) {
        if (peek().is(punct)) {
            current++;
            return true;
        }
        return false;
    }

    private Token expect(String punct) {
        Token token = peek();
        if (!token.is(punct)) {
            throw new CompileError("PARSE_ERROR",
                    "Expected '" + punct + "' but found " + describe(token) + " at position " + token.start(),
                    token.span());
        }
        return advance();
    }

    private Token expectIdentifier() {
        Token token = peek();
        if (token.kind() != Kind.IDENT) {
            throw new CompileError("PARSE_ERROR",
                    "Expected identifier but found " + describe(token) + " at position " + token.start(),
                    token.span());
        }
        return advance();
    }

    private CompileError unexpected(Token token) {
        return new CompileError("PARSE_ERROR",
                "Unexpected " + describe(token) + " at position " + token.start(), token.span());
    }

    private static String describe(Token token) {
        return token.kind() == Kind.EOF ? "end of expression" : "'" + token.text() + "'";
    }
}
