package com.ciro.jlive.template;

import com.ciro.jlive.ast.ComponentTarget;

/**
 * De qué se deriva el id de un componente: destino + atributo {@code id}
 * explícito, o destino + ruta de montaje.
 */
public record MountKey(String target, String id, String path) {

    public static MountKey ofId(ComponentTarget target, Object id) {
        return new MountKey(target.toString(), String.valueOf(id), null);
    }

    public static MountKey ofPath(ComponentTarget target, String path) {
        return new MountKey(target.toString(), null, path);
    }

    @Override
    public String toString() {
        return id != null ? target + "#" + id : target + "@" + path;
    }
}
