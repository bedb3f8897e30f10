package com.ciro.jlive.expr;

import java.util.List;

/**
 * AST de expresiones del host ({@code <%= ... %>}, atributos {...}, generadores).
 */
public sealed interface Expr {

    /** String, Long, Double, Boolean, {@link Atom} o null (nil) */
    record Literal(Object value) implements Expr {}

    /** {@code @name} */
    record AssignRef(String name) implements Expr {}

    /** Variable local: de un :for, :let o bloque for */
    record LocalRef(String name) implements Expr {}

    /** {@code target.name} */
    record Field(Expr target, String name) implements Expr {}

    /** {@code target[index]} */
    record Index(Expr target, Expr index) implements Expr {}

    record Unary(String op, Expr operand) implements Expr {}

    record Binary(String op, Expr left, Expr right) implements Expr {}

    record ListExpr(List<Expr> items) implements Expr {
        public ListExpr {
            items = List.copyOf(items);
        }
    }

    /** Built-ins: render_slot, length, raw */
    record Call(String function, List<Expr> args) implements Expr {
        public Call {
            args = List.copyOf(args);
        }
    }
}
