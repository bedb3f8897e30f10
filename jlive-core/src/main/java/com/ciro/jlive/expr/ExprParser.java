package com.ciro.jlive.expr;

import com.ciro.jlive.ast.ErrorKind;
import com.ciro.jlive.ast.Span;
import com.ciro.jlive.ast.TemplateCompileException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parser descendente recursivo del lenguaje de expresiones.
 * <pre>
 * or      := and (("||" | "or") and)*
 * and     := eq (("&&" | "and") eq)*
 * eq      := cmp (("==" | "!=") cmp)*
 * cmp     := add (("<" | ">" | "<=" | ">=") add)*
 * add     := mul (("+" | "-" | "&lt;&gt;") mul)*
 * mul     := unary (("*" | "/") unary)*
 * unary   := ("!" | "not" | "-") unary | postfix
 * postfix := primary ("." ident | "[" or "]")*
 * </pre>
 */
public final class ExprParser {

    public static final Set<String> BUILTINS = Set.of("render_slot", "length", "raw");

    private enum Kind { IDENT, ASSIGN, NUMBER, STRING, ATOM, OP, EOF }

    private record Tok(Kind kind, String text) {}

    private final String code;
    private final String file;
    private final Span span;
    private final List<Tok> toks;
    private int p;

    private ExprParser(String code, String file, Span span) {
        this.code = code;
        this.file = file;
        this.span = span;
        this.toks = lex();
    }

    public static Expr parse(String code, String file, Span span) {
        ExprParser parser = new ExprParser(code, file, span);
        Expr e = parser.or();
        parser.expect(Kind.EOF, null);
        return e;
    }

    /** {@code x <- @items} o {@code x <- @items, x.visible} */
    public static Generator parseGenerator(String code, String file, Span span) {
        int arrow = code.indexOf("<-");
        if (arrow < 0) {
            throw new TemplateCompileException(ErrorKind.INVALID_LOOP,
                    "expected a generator expression such as {item <- @items}, got: " + code, file, span);
        }
        String pattern = code.substring(0, arrow).trim();
        if (!isIdentifier(pattern)) {
            throw new TemplateCompileException(ErrorKind.INVALID_LOOP,
                    "generator pattern must be a variable name, got: " + pattern, file, span);
        }
        ExprParser parser = new ExprParser(code.substring(arrow + 2), file, span);
        Expr source = parser.or();
        Expr filter = null;
        if (parser.accept(",")) {
            filter = parser.or();
        }
        parser.expect(Kind.EOF, null);
        return new Generator(pattern, source, filter);
    }

    public static boolean isIdentifier(String s) {
        if (s == null || s.isEmpty()) return false;
        if (!Character.isLetter(s.charAt(0)) && s.charAt(0) != '_') return false;
        for (int i = 1; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') return false;
        }
        return !isKeyword(s);
    }

    private static boolean isKeyword(String s) {
        return switch (s) {
            case "true", "false", "nil", "and", "or", "not", "do", "end", "else" -> true;
            default -> false;
        };
    }

    // ------------------------------------------------------------------
    // Gramática
    // ------------------------------------------------------------------

    private Expr or() {
        Expr left = and();
        while (true) {
            if (accept("||") || accept("or")) left = new Expr.Binary("||", left, and());
            else return left;
        }
    }

    private Expr and() {
        Expr left = equality();
        while (true) {
            if (accept("&&") || accept("and")) left = new Expr.Binary("&&", left, equality());
            else return left;
        }
    }

    private Expr equality() {
        Expr left = comparison();
        while (true) {
            String op = acceptAny("==", "!=");
            if (op == null) return left;
            left = new Expr.Binary(op, left, comparison());
        }
    }

    private Expr comparison() {
        Expr left = additive();
        while (true) {
            String op = acceptAny("<=", ">=", "<", ">");
            if (op == null) return left;
            left = new Expr.Binary(op, left, additive());
        }
    }

    private Expr additive() {
        Expr left = multiplicative();
        while (true) {
            String op = acceptAny("+", "-", "<>");
            if (op == null) return left;
            left = new Expr.Binary(op, left, multiplicative());
        }
    }

    private Expr multiplicative() {
        Expr left = unary();
        while (true) {
            String op = acceptAny("*", "/");
            if (op == null) return left;
            left = new Expr.Binary(op, left, unary());
        }
    }

    private Expr unary() {
        if (accept("!") || accept("not")) return new Expr.Unary("!", unary());
        if (accept("-")) return new Expr.Unary("-", unary());
        return postfix(primary());
    }

    private Expr postfix(Expr e) {
        while (true) {
            if (accept(".")) {
                Tok name = expect(Kind.IDENT, "field name");
                e = new Expr.Field(e, name.text());
            } else if (accept("[")) {
                Expr idx = or();
                expect(Kind.OP, "]");
                e = new Expr.Index(e, idx);
            } else {
                return e;
            }
        }
    }

    private Expr primary() {
        Tok t = toks.get(p);
        switch (t.kind()) {
            case NUMBER -> {
                p++;
                return new Expr.Literal(t.text().contains(".")
                        ? (Object) Double.valueOf(t.text())
                        : (Object) Long.valueOf(t.text()));
            }
            case STRING -> {
                p++;
                return new Expr.Literal(t.text());
            }
            case ATOM -> {
                p++;
                return new Expr.Literal(new Atom(t.text()));
            }
            case ASSIGN -> {
                p++;
                return new Expr.AssignRef(t.text());
            }
            case IDENT -> {
                p++;
                if (t.text().equals("true")) return new Expr.Literal(Boolean.TRUE);
                if (t.text().equals("false")) return new Expr.Literal(Boolean.FALSE);
                if (t.text().equals("nil")) return new Expr.Literal(null);
                if (accept("(")) return call(t.text());
                if (isKeyword(t.text())) throw error("unexpected keyword " + t.text());
                return new Expr.LocalRef(t.text());
            }
            case OP -> {
                if (accept("(")) {
                    Expr inner = or();
                    expect(Kind.OP, ")");
                    return inner;
                }
                if (accept("[")) {
                    List<Expr> items = new ArrayList<>();
                    if (!accept("]")) {
                        do {
                            items.add(or());
                        } while (accept(","));
                        expect(Kind.OP, "]");
                    }
                    return new Expr.ListExpr(items);
                }
                throw error("unexpected token " + t.text());
            }
            default -> throw error("unexpected end of expression");
        }
    }

    private Expr call(String name) {
        if (!BUILTINS.contains(name)) {
            throw error("undefined function " + name);
        }
        List<Expr> args = new ArrayList<>();
        if (!accept(")")) {
            do {
                args.add(or());
            } while (accept(","));
            expect(Kind.OP, ")");
        }
        int max = name.equals("render_slot") ? 2 : 1;
        if (args.isEmpty() || args.size() > max) {
            throw error("undefined function " + name + "/" + args.size());
        }
        return new Expr.Call(name, args);
    }

    // ------------------------------------------------------------------
    // Cursor
    // ------------------------------------------------------------------

    private boolean accept(String text) {
        Tok t = toks.get(p);
        if ((t.kind() == Kind.OP || t.kind() == Kind.IDENT) && t.text().equals(text)) {
            p++;
            return true;
        }
        return false;
    }

    private String acceptAny(String... ops) {
        for (String op : ops) {
            if (accept(op)) return op;
        }
        return null;
    }

    private Tok expect(Kind kind, String text) {
        Tok t = toks.get(p);
        if (t.kind() != kind || (text != null && kind == Kind.OP && !t.text().equals(text))) {
            String wanted = text != null ? text : kind.name().toLowerCase(Locale.ROOT);
            throw error("expected " + wanted + " but found " + (t.kind() == Kind.EOF ? "end of expression" : t.text()));
        }
        p++;
        return t;
    }

    private TemplateCompileException error(String message) {
        return new TemplateCompileException(ErrorKind.INVALID_EXPRESSION,
                message + " in expression: " + code.trim(), file, span);
    }

    // ------------------------------------------------------------------
    // Lexer
    // ------------------------------------------------------------------

    private List<Tok> lex() {
        List<Tok> out = new ArrayList<>();
        int i = 0;
        int n = code.length();
        while (i < n) {
            char c = code.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '@') {
                int start = ++i;
                while (i < n && isIdentChar(code.charAt(i))) i++;
                if (i == start) throw error("expected assign name after @");
                out.add(new Tok(Kind.ASSIGN, code.substring(start, i)));
                continue;
            }
            if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && isIdentChar(code.charAt(i))) i++;
                out.add(new Tok(Kind.IDENT, code.substring(start, i)));
                continue;
            }
            if (Character.isDigit(c)) {
                int start = i;
                while (i < n && Character.isDigit(code.charAt(i))) i++;
                if (i + 1 < n && code.charAt(i) == '.' && Character.isDigit(code.charAt(i + 1))) {
                    i++;
                    while (i < n && Character.isDigit(code.charAt(i))) i++;
                }
                out.add(new Tok(Kind.NUMBER, code.substring(start, i)));
                continue;
            }
            if (c == '"' || c == '\'') {
                StringBuilder sb = new StringBuilder();
                i++;
                while (i < n && code.charAt(i) != c) {
                    char s = code.charAt(i++);
                    if (s == '\\' && i < n) {
                        char esc = code.charAt(i++);
                        sb.append(switch (esc) {
                            case 'n' -> '\n';
                            case 't' -> '\t';
                            default -> esc;
                        });
                    } else {
                        sb.append(s);
                    }
                }
                if (i >= n) throw error("unterminated string");
                i++;
                out.add(new Tok(Kind.STRING, sb.toString()));
                continue;
            }
            if (c == ':' && i + 1 < n && (Character.isLetter(code.charAt(i + 1)) || code.charAt(i + 1) == '_')) {
                int start = ++i;
                while (i < n && isIdentChar(code.charAt(i))) i++;
                if (i < n && (code.charAt(i) == '?' || code.charAt(i) == '!')) i++;
                out.add(new Tok(Kind.ATOM, code.substring(start, i)));
                continue;
            }
            String two = i + 1 < n ? code.substring(i, i + 2) : "";
            if (two.equals("==") || two.equals("!=") || two.equals("<=") || two.equals(">=")
                    || two.equals("&&") || two.equals("||") || two.equals("<>")) {
                out.add(new Tok(Kind.OP, two));
                i += 2;
                continue;
            }
            if ("+-*/<>!()[].,".indexOf(c) >= 0) {
                out.add(new Tok(Kind.OP, String.valueOf(c)));
                i++;
                continue;
            }
            throw error("unexpected character '" + c + "'");
        }
        out.add(new Tok(Kind.EOF, ""));
        return out;
    }

    private static boolean isIdentChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
