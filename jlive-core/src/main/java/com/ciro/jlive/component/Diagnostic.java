package com.ciro.jlive.component;

import com.ciro.jlive.ast.Span;

/** Advertencia de compilación. No aborta salvo que la configuración lo pida. */
public record Diagnostic(String message, String file, Span span) {

    @Override
    public String toString() {
        return (file == null ? "nofile" : file) + ":" + span + ": warning: " + message;
    }
}
