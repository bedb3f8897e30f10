package com.ciro.jlive.component;

/**
 * Atributo declarado. {@code defaultValue} solo aplica si {@code hasDefault}.
 */
public record AttrSpec(String name, AttrType type, boolean required, boolean hasDefault, Object defaultValue) {

    public static AttrSpec optional(String name, AttrType type) {
        return new AttrSpec(name, type, false, false, null);
    }

    public static AttrSpec required(String name, AttrType type) {
        return new AttrSpec(name, type, true, false, null);
    }

    public static AttrSpec withDefault(String name, AttrType type, Object defaultValue) {
        return new AttrSpec(name, type, false, true, defaultValue);
    }

    public boolean isGlobal() {
        return type.kind() == AttrType.Kind.GLOBAL;
    }
}
