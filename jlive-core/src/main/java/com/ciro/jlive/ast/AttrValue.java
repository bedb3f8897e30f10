package com.ciro.jlive.ast;

public sealed interface AttrValue {

    /** name="value" o name='value' */
    record Literal(String value, char delimiter) implements AttrValue {}

    /** name={code} */
    record Expression(String code, Span span) implements AttrValue {}

    /** Atributo booleano: solo presencia (ej: disabled) */
    record Presence() implements AttrValue {}

    Presence PRESENCE = new Presence();
}
