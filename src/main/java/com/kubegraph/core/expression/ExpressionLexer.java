package com.kubegraph.core.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for the JavaScript-like expression text accepted by {@link ExpressionParser}.
 * Positions are absolute offsets into the full source, so sub-ranges (template holes)
 * can be lexed without re-basing spans.
 */
final class ExpressionLexer {

    enum Kind { NUMBER, STRING, TEMPLATE, IDENT, PUNCT, EOF }

    record Token(Kind kind, String text, Object value, int start, int end) {
        boolean is(String punct) {
            return kind == Kind.PUNCT && text.equals(punct);
        }

        boolean isIdent(String name) {
            return kind == Kind.IDENT && text.equals(name);
        }

        Span span() {
            return new Span(start, end);
        }
    }

    private static final String[] PUNCTUATORS = {
            "===", "!==", "?.", "??", "==", "!=", "<=", ">=", "&&", "||", "=>",
            "+", "-", "*", "/", "%", "<", ">", "!", "?", ":", ".", ",", "(", ")", "[", "]"
    };

    private final String source;
    private final int limit;
    private int pos;

    ExpressionLexer(String source, int start, int end) {
        this.source = source;
        this.pos = start;
        this.limit = end;
    }

    List<Token> tokenize() {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipWhitespace();
            if (pos >= limit) {
                tokens.add(new Token(Kind.EOF, "", null, limit, limit));
                return tokens;
            }
            char c = source.charAt(pos);
            if (Character.isDigit(c) || (c == '.' && pos + 1 < limit && Character.isDigit(source.charAt(pos + 1)))) {
                tokens.add(number());
            } else if (c == '"' || c == '\'') {
                tokens.add(string(c));
            } else if (c == '`') {
                tokens.add(template());
            } else if (Character.isJavaIdentifierStart(c)) {
                tokens.add(identifier());
            } else {
                tokens.add(punctuator());
            }
        }
    }

    private void skipWhitespace() {
        while (pos < limit && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private Token number() {
        int start = pos;
        while (pos < limit && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
            pos++;
        }
        String text = source.substring(start, pos);
        Object value;
        try {
            value = text.contains(".") ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new CompileError("PARSE_ERROR", "Invalid number literal '" + text + "'", new Span(start, pos));
        }
        return new Token(Kind.NUMBER, text, value, start, pos);
    }

    private Token string(char quote) {
        int start = pos++;
        var value = new StringBuilder();
        while (pos < limit) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new Token(Kind.STRING, source.substring(start, pos), value.toString(), start, pos);
            }
            if (c == '\\' && pos < limit) {
                value.append(unescape(source.charAt(pos++)));
            } else {
                value.append(c);
            }
        }
        throw new CompileError("PARSE_ERROR", "Unterminated string literal", new Span(start, pos));
    }

    /** Template token value is the raw text between the backticks; holes are parsed later. */
    private Token template() {
        int start = pos++;
        int bodyStart = pos;
        while (pos < limit) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
            } else if (c == '`') {
                pos++;
                return new Token(Kind.TEMPLATE, source.substring(start, pos),
                        new int[]{bodyStart, pos - 1}, start, pos);
            } else if (c == '$' && pos + 1 < limit && source.charAt(pos + 1) == '{') {
                pos = skipHole(source, pos + 2, limit);
            } else {
                pos++;
            }
        }
        throw new CompileError("PARSE_ERROR", "Unterminated template literal", new Span(start, pos));
    }

    private Token identifier() {
        int start = pos;
        while (pos < limit && Character.isJavaIdentifierPart(source.charAt(pos))) {
            pos++;
        }
        String text = source.substring(start, pos);
        return new Token(Kind.IDENT, text, text, start, pos);
    }

    private Token punctuator() {
        for (String p : PUNCTUATORS) {
            if (source.startsWith(p, pos) && pos + p.length() <= limit) {
                // "a ?.5 : 1" is a conditional, not optional chaining
                if (p.equals("?.") && pos + 2 < limit && Character.isDigit(source.charAt(pos + 2))) {
                    continue;
                }
                int start = pos;
                pos += p.length();
                return new Token(Kind.PUNCT, p, p, start, pos);
            }
        }
        throw new CompileError("PARSE_ERROR",
                "Unexpected character '" + source.charAt(pos) + "' at position " + pos, new Span(pos, pos + 1));
    }

    /**
     * Returns the index just past the closing brace of a {@code ${...}} hole whose body starts
     * at {@code from}, honouring nested braces and quoted strings.
     */
    static int skipHole(String text, int from, int limit) {
        int depth = 1;
        int i = from;
        while (i < limit) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'' || c == '`') {
                i = skipQuoted(text, i, limit);
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
            i++;
        }
        throw new CompileError("PARSE_ERROR", "Unterminated ${ } interpolation", new Span(from - 2, limit));
    }

    private static int skipQuoted(String text, int start, int limit) {
        char quote = text.charAt(start);
        int i = start + 1;
        while (i < limit) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        return limit;
    }

    static char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            default -> c;
        };
    }
}
