package com.ciro.jlive.component;

import com.ciro.jlive.ast.LiteralShape;
import com.ciro.jlive.expr.Atom;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Conjunto cerrado de tipos declarables para atributos. Se compara estructuralmente.
 */
public final class AttrType {

    public enum Kind { ANY, STRING, ATOM, BOOLEAN, INTEGER, FLOAT, LIST, MAP, GLOBAL, STRUCT }

    public static final AttrType ANY = new AttrType(Kind.ANY, null);
    public static final AttrType STRING = new AttrType(Kind.STRING, null);
    public static final AttrType ATOM = new AttrType(Kind.ATOM, null);
    public static final AttrType BOOLEAN = new AttrType(Kind.BOOLEAN, null);
    public static final AttrType INTEGER = new AttrType(Kind.INTEGER, null);
    public static final AttrType FLOAT = new AttrType(Kind.FLOAT, null);
    public static final AttrType LIST = new AttrType(Kind.LIST, null);
    public static final AttrType MAP = new AttrType(Kind.MAP, null);
    public static final AttrType GLOBAL = new AttrType(Kind.GLOBAL, null);

    private final Kind kind;
    private final String tag;

    private AttrType(Kind kind, String tag) {
        this.kind = kind;
        this.tag = tag;
    }

    /** Struct identificado por el nombre simple (o completo) de su clase. */
    public static AttrType struct(String tag) {
        return new AttrType(Kind.STRUCT, Objects.requireNonNull(tag, "tag"));
    }

    public Kind kind() {
        return kind;
    }

    public String tag() {
        return tag;
    }

    /** ¿Un literal de esta forma puede tener este tipo? Las expresiones no se comprueban. */
    public boolean acceptsLiteral(LiteralShape shape) {
        if (shape == LiteralShape.EXPRESSION || shape == LiteralShape.NIL || kind == Kind.ANY) return true;
        return switch (kind) {
            case STRING -> shape == LiteralShape.STRING;
            case ATOM -> shape == LiteralShape.ATOM;
            case BOOLEAN -> shape == LiteralShape.BOOLEAN;
            case INTEGER -> shape == LiteralShape.INTEGER;
            case FLOAT -> shape == LiteralShape.FLOAT;
            default -> false;
        };
    }

    /** Comprueba un valor por defecto declarado. */
    public boolean acceptsValue(Object value) {
        if (value == null) return true;
        return switch (kind) {
            case ANY -> true;
            case STRING -> value instanceof String;
            case ATOM -> value instanceof Atom;
            case BOOLEAN -> value instanceof Boolean;
            case INTEGER -> value instanceof Long || value instanceof Integer;
            case FLOAT -> value instanceof Double || value instanceof Float;
            case LIST -> value instanceof List<?>;
            case MAP, GLOBAL -> value instanceof Map<?, ?>;
            case STRUCT -> value.getClass().getSimpleName().equals(tag) || value.getClass().getName().equals(tag);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttrType other)) return false;
        return kind == other.kind && Objects.equals(tag, other.tag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, tag);
    }

    @Override
    public String toString() {
        return kind == Kind.STRUCT ? ":struct " + tag : ":" + kind.name().toLowerCase(Locale.ROOT);
    }
}
