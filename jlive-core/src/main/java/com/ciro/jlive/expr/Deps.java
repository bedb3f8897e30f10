package com.ciro.jlive.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Dependencias de una expresión calculadas al compilar: rutas de assigns leídas
 * ({@code @user.name} → [user, name]) y variables locales libres.
 */
public record Deps(Set<List<String>> assignPaths, Set<String> freeLocals) {

    public static final Deps EMPTY = new Deps(Set.of(), Set.of());

    public Deps {
        assignPaths = Set.copyOf(assignPaths);
        freeLocals = Set.copyOf(freeLocals);
    }

    public static Deps of(Expr expr) {
        Set<List<String>> paths = new HashSet<>();
        Set<String> locals = new HashSet<>();
        collect(expr, paths, locals);
        return new Deps(paths, locals);
    }

    public boolean isEmpty() {
        return assignPaths.isEmpty() && freeLocals.isEmpty();
    }

    public Deps union(Deps other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        Set<List<String>> paths = new HashSet<>(assignPaths);
        paths.addAll(other.assignPaths);
        Set<String> locals = new HashSet<>(freeLocals);
        locals.addAll(other.freeLocals);
        return new Deps(paths, locals);
    }

    /** Quita las variables que el constructor (for, :let) liga. */
    public Deps bind(String... names) {
        if (freeLocals.isEmpty()) return this;
        Set<String> locals = new HashSet<>(freeLocals);
        for (String n : names) locals.remove(n);
        return new Deps(assignPaths, locals);
    }

    private static void collect(Expr e, Set<List<String>> paths, Set<String> locals) {
        if (e == null) return;
        List<String> path = assignPath(e);
        if (path != null) {
            paths.add(Collections.unmodifiableList(path));
            return;
        }
        if (e instanceof Expr.LocalRef l) {
            locals.add(l.name());
        } else if (e instanceof Expr.Field f) {
            collect(f.target(), paths, locals);
        } else if (e instanceof Expr.Index i) {
            collect(i.target(), paths, locals);
            collect(i.index(), paths, locals);
        } else if (e instanceof Expr.Unary u) {
            collect(u.operand(), paths, locals);
        } else if (e instanceof Expr.Binary b) {
            collect(b.left(), paths, locals);
            collect(b.right(), paths, locals);
        } else if (e instanceof Expr.ListExpr l) {
            l.items().forEach(it -> collect(it, paths, locals));
        } else if (e instanceof Expr.Call c) {
            c.args().forEach(it -> collect(it, paths, locals));
        }
    }

    /** @user.address.street → [user, address, street]; null si no es una ruta pura. */
    private static List<String> assignPath(Expr e) {
        if (e instanceof Expr.AssignRef a) {
            List<String> p = new ArrayList<>();
            p.add(a.name());
            return p;
        }
        if (e instanceof Expr.Field f) {
            List<String> p = assignPath(f.target());
            if (p != null) p.add(f.name());
            return p;
        }
        return null;
    }
}
