package com.ciro.jlive.ast;

/**
 * Atributo tal cual se escribió en el tag. Un spread ({@code {code}} sin nombre)
 * tiene {@code name == null} y siempre un valor {@link AttrValue.Expression}.
 */
public record Attr(String name, AttrValue value, Span span) {

    public static Attr spread(String code, Span span) {
        return new Attr(null, new AttrValue.Expression(code, span), span);
    }

    public boolean isSpread() {
        return name == null;
    }

    public boolean isSpecial() {
        return name != null && name.startsWith(":");
    }

    public boolean isExpression() {
        return value instanceof AttrValue.Expression;
    }

    public String code() {
        return value instanceof AttrValue.Expression e ? e.code() : null;
    }
}
