package com.ciro.jlive.ast;

import java.util.List;

public sealed interface Token {

    Span span();

    record Text(String content, Span span) implements Token {}

    record TagOpen(String name, TagKind kind, List<Attr> attrs, Span span, boolean selfClose) implements Token {
        public TagOpen {
            attrs = List.copyOf(attrs);
        }
    }

    record TagClose(String name, Span span) implements Token {}

    /** marker: "=" (salida), "" (sentencia) */
    record Expression(String marker, String code, Span span) implements Token {}
}
