package com.ciro.jlive.ast;

import java.util.regex.Pattern;

/**
 * Forma literal de un valor de atributo, registrada al parsear para que el
 * validador compare tipos declarados sin volver a analizar el código.
 */
public enum LiteralShape {
    STRING, BOOLEAN, ATOM, INTEGER, FLOAT, NIL, EXPRESSION;

    private static final Pattern INTEGER_RX = Pattern.compile("-?\\d+");
    private static final Pattern FLOAT_RX = Pattern.compile("-?\\d+\\.\\d+");
    private static final Pattern ATOM_RX = Pattern.compile(":[A-Za-z_][A-Za-z0-9_]*[?!]?");
    private static final Pattern STRING_RX = Pattern.compile("\"(?:[^\"\\\\]|\\\\.)*\"|'(?:[^'\\\\]|\\\\.)*'");

    public static LiteralShape of(AttrValue value) {
        if (value == null) return NIL;
        if (value instanceof AttrValue.Literal) return STRING;
        if (value instanceof AttrValue.Presence) return BOOLEAN;
        return ofCode(((AttrValue.Expression) value).code());
    }

    public static LiteralShape ofCode(String code) {
        String c = code.trim();
        if (c.equals("true") || c.equals("false")) return BOOLEAN;
        if (c.equals("nil")) return NIL;
        if (INTEGER_RX.matcher(c).matches()) return INTEGER;
        if (FLOAT_RX.matcher(c).matches()) return FLOAT;
        if (ATOM_RX.matcher(c).matches()) return ATOM;
        if (STRING_RX.matcher(c).matches()) return STRING;
        return EXPRESSION;
    }
}
