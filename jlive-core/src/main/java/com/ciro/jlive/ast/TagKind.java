package com.ciro.jlive.ast;

/**
 * Clasificación del nombre de tag. Se decide una sola vez al tokenizar.
 */
public enum TagKind {
    ELEMENT,
    REMOTE_COMPONENT,   // <Mod.fun>
    LOCAL_COMPONENT,    // <.fun>
    SLOT;               // <:name>

    public static TagKind classify(String name) {
        if (name.isEmpty()) return ELEMENT;
        char first = name.charAt(0);
        if (first == ':') return SLOT;
        if (first == '.') return LOCAL_COMPONENT;
        if (Character.isUpperCase(first) || name.indexOf('.') > 0) return REMOTE_COMPONENT;
        return ELEMENT;
    }

    public boolean isComponent() {
        return this == REMOTE_COMPONENT || this == LOCAL_COMPONENT;
    }
}
