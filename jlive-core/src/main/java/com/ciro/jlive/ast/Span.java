package com.ciro.jlive.ast;

/**
 * Rango línea/columna (1-based) dentro del template. Solo sirve para diagnósticos.
 */
public record Span(int line, int column, int endLine, int endColumn) {

    public static final Span UNKNOWN = new Span(0, 0, 0, 0);

    public static Span at(int line, int column) {
        return new Span(line, column, line, column);
    }

    public Span to(int endLine, int endColumn) {
        return new Span(line, column, endLine, endColumn);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
