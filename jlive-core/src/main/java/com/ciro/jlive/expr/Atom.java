package com.ciro.jlive.expr;

/** Literal {@code :name}. Se imprime sin los dos puntos. */
public record Atom(String name) {

    @Override
    public String toString() {
        return name;
    }
}
