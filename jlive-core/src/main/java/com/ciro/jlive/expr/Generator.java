package com.ciro.jlive.expr;

/** {@code pattern <- source[, filter]}; el patrón es un identificador. */
public record Generator(String pattern, Expr source, Expr filter) {

    public Deps deps() {
        Deps d = Deps.of(source);
        if (filter != null) {
            d = d.union(Deps.of(filter).bind(pattern));
        }
        return d;
    }
}
