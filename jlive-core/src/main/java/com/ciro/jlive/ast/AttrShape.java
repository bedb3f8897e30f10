package com.ciro.jlive.ast;

/** Atributo de una llamada a componente tal como lo ve el validador. */
public record AttrShape(String name, LiteralShape shape, Span span) {

    public static AttrShape of(Attr attr) {
        return new AttrShape(attr.name(), LiteralShape.of(attr.value()), attr.span());
    }
}
