package com.ciro.jlive.template;

/** Marcado que no se escapa al imprimir: resultado de {@code raw(x)}. */
public record SafeHtml(String html) {

    @Override
    public String toString() {
        return html;
    }
}
