package com.ciro.jlive.template;

import com.ciro.jlive.ast.Span;
import com.ciro.jlive.expr.Deps;
import com.ciro.jlive.expr.Expr;

/** Expresión ya parseada junto a su código fuente (para errores) y sus dependencias. */
public record CompiledExpr(String source, Expr expr, Deps deps, String file, Span span) {

    public static CompiledExpr constant(Object value) {
        return new CompiledExpr(String.valueOf(value), new Expr.Literal(value), Deps.EMPTY, null, Span.UNKNOWN);
    }
}
