package com.ciro.jlive.template;

import com.ciro.jlive.binding.ChangedSet;
import com.ciro.jlive.expr.Atom;
import com.ciro.jlive.expr.Deps;
import com.ciro.jlive.expr.Expr;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Contexto de evaluación: assigns del componente (o vista), variables locales
 * encadenadas, el ChangedSet del ciclo y la pasada de render en curso.
 */
public final class EvalContext {

    private final Map<String, ?> assigns;
    private final Map<String, Object> locals;
    private final EvalContext parent;
    private final ChangedSet changed;
    private final RenderPass pass;
    private final String path;

    private EvalContext(Map<String, ?> assigns, Map<String, Object> locals, EvalContext parent,
                        ChangedSet changed, RenderPass pass, String path) {
        this.assigns = assigns;
        this.locals = locals;
        this.parent = parent;
        this.changed = changed;
        this.pass = pass;
        this.path = path;
    }

    public static EvalContext root(Map<String, ?> assigns, ChangedSet changed, RenderPass pass) {
        return new EvalContext(assigns, Map.of(), null, changed, pass, "");
    }

    /** Contexto propio de un componente montado: sus assigns, su ChangedSet derivado. */
    public EvalContext forComponent(Map<String, ?> componentAssigns, ChangedSet componentChanged, String mountPath) {
        return new EvalContext(componentAssigns, Map.of(), null, componentChanged, pass, mountPath);
    }

    public EvalContext child(String name, Object value) {
        Map<String, Object> m = new HashMap<>();
        m.put(name, value);
        return new EvalContext(assigns, m, this, changed, pass, path);
    }

    public EvalContext withPath(String newPath) {
        return new EvalContext(assigns, locals, parent, changed, pass, newPath);
    }

    public Map<String, ?> assigns() { return assigns; }
    public ChangedSet changed() { return changed; }
    public RenderPass pass() { return pass; }
    public String path() { return path; }

    /** Las variables locales siempre cuentan como cambiadas. */
    public boolean isChanged(Deps deps) {
        if (changed.isAll() || !deps.freeLocals().isEmpty()) return true;
        for (List<String> p : deps.assignPaths()) {
            if (changed.isChanged(p)) return true;
        }
        return false;
    }

    // ========================================================================
    // Evaluación
    // ========================================================================

    public Object eval(CompiledExpr ce) {
        try {
            return value(ce.expr());
        } catch (TemplateEvaluationException e) {
            if (e.expression() != null) throw e;
            throw new TemplateEvaluationException(e.getMessage(), ce.source(), ce.file(), ce.span(), e);
        }
    }

    public boolean test(CompiledExpr ce) {
        return isTruthy(eval(ce));
    }

    Object value(Expr e) {
        if (e instanceof Expr.Literal l) return l.value();
        if (e instanceof Expr.AssignRef a) return assign(a.name());
        if (e instanceof Expr.LocalRef l) return local(l.name());
        if (e instanceof Expr.Field f) return getProperty(value(f.target()), f.name());
        if (e instanceof Expr.Index i) return index(value(i.target()), value(i.index()));
        if (e instanceof Expr.Unary u) {
            Object v = value(u.operand());
            if (u.op().equals("!")) return !isTruthy(v);
            return negate(v);
        }
        if (e instanceof Expr.Binary b) return binary(b);
        if (e instanceof Expr.ListExpr l) {
            List<Object> out = new ArrayList<>(l.items().size());
            for (Expr it : l.items()) out.add(value(it));
            return out;
        }
        Expr.Call c = (Expr.Call) e;
        return switch (c.function()) {
            case "length" -> (long) size(value(c.args().get(0)));
            case "raw" -> {
                Object v = value(c.args().get(0));
                yield v instanceof SafeHtml ? v : new SafeHtml(v == null ? "" : String.valueOf(v));
            }
            default -> throw new TemplateEvaluationException(
                    "render_slot can only be used as the whole content of <%= %>");
        };
    }

    private Object assign(String name) {
        if (!assigns.containsKey(name)) {
            throw new TemplateEvaluationException("assign @" + name + " not available in template. Available assigns: "
                    + assigns.keySet());
        }
        return assigns.get(name);
    }

    public Object local(String name) {
        for (EvalContext c = this; c != null; c = c.parent) {
            if (c.locals.containsKey(name)) return c.locals.get(name);
        }
        throw new TemplateEvaluationException("undefined variable " + name);
    }

    private Object binary(Expr.Binary b) {
        String op = b.op();
        Object left = value(b.left());
        // cortocircuito: devuelven el operando, no un booleano
        if (op.equals("&&")) return isTruthy(left) ? value(b.right()) : left;
        if (op.equals("||")) return isTruthy(left) ? left : value(b.right());

        Object right = value(b.right());
        return switch (op) {
            case "==" -> valueEquals(left, right);
            case "!=" -> !valueEquals(left, right);
            case "<" -> compare(op, left, right) < 0;
            case ">" -> compare(op, left, right) > 0;
            case "<=" -> compare(op, left, right) <= 0;
            case ">=" -> compare(op, left, right) >= 0;
            case "<>" -> stringOf(left) + stringOf(right);
            default -> arithmetic(op, left, right);
        };
    }

    private static Object arithmetic(String op, Object l, Object r) {
        if (!(l instanceof Number a) || !(r instanceof Number b)) {
            throw new TemplateEvaluationException("bad argument in arithmetic expression: "
                    + describe(l) + " " + op + " " + describe(r));
        }
        if (op.equals("/")) {
            if (b.doubleValue() == 0) throw new TemplateEvaluationException("bad argument in arithmetic expression: division by zero");
            return a.doubleValue() / b.doubleValue();
        }
        if (isIntegral(a) && isIntegral(b)) {
            long x = a.longValue(), y = b.longValue();
            return switch (op) {
                case "+" -> x + y;
                case "-" -> x - y;
                default -> x * y;
            };
        }
        double x = a.doubleValue(), y = b.doubleValue();
        return switch (op) {
            case "+" -> x + y;
            case "-" -> x - y;
            default -> x * y;
        };
    }

    private static Object negate(Object v) {
        if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return -((Number) v).longValue();
        }
        if (v instanceof Number n) return -n.doubleValue();
        throw new TemplateEvaluationException("bad argument in arithmetic expression: -" + describe(v));
    }

    private static boolean valueEquals(Object l, Object r) {
        if (l instanceof Number a && r instanceof Number b) {
            if (isIntegral(a) && isIntegral(b)) return a.longValue() == b.longValue();
            return a.doubleValue() == b.doubleValue();
        }
        return Objects.equals(l, r);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compare(String op, Object l, Object r) {
        if (l instanceof Number a && r instanceof Number b) return Double.compare(a.doubleValue(), b.doubleValue());
        if (l instanceof Comparable c && r != null && l.getClass() == r.getClass()) return c.compareTo(r);
        throw new TemplateEvaluationException("cannot compare " + describe(l) + " " + op + " " + describe(r));
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    private static String stringOf(Object o) {
        return o == null ? "" : String.valueOf(o);
    }

    private static String describe(Object o) {
        return o == null ? "nil" : o instanceof String s ? "\"" + s + "\"" : String.valueOf(o);
    }

    public static boolean isTruthy(Object o) {
        if (o == null) return false;
        if (o instanceof Boolean b) return b;
        if (o instanceof Collection<?> c) return !c.isEmpty();
        if (o instanceof Map<?, ?> m) return !m.isEmpty();
        if (o instanceof String s) return !s.isEmpty();
        if (o instanceof Number n) return n.doubleValue() != 0;
        return true;
    }

    static int size(Object o) {
        if (o instanceof Collection<?> c) return c.size();
        if (o instanceof Map<?, ?> m) return m.size();
        if (o instanceof String s) return s.length();
        if (o != null && o.getClass().isArray()) return Array.getLength(o);
        throw new TemplateEvaluationException("length/1 expects a list, map or string, got: " + describe(o));
    }

    private static Object index(Object target, Object key) {
        if (target == null) return null;
        if (target instanceof List<?> list) {
            if (!(key instanceof Number n)) throw new TemplateEvaluationException("list index must be an integer, got: " + describe(key));
            int i = n.intValue();
            return i >= 0 && i < list.size() ? list.get(i) : null;
        }
        if (target instanceof Map<?, ?> m) {
            if (m.containsKey(key)) return m.get(key);
            return key instanceof Atom a ? m.get(a.name()) : null;
        }
        throw new TemplateEvaluationException("cannot access " + describe(key) + " on " + describe(target));
    }

    // ========================================================================
    // 🔥 EL MOTOR DE REFLEXIÓN (Soporta Maps, Records, Getters y Fields)
    // ========================================================================
    static Object getProperty(Object obj, String fieldName) {
        if (obj == null) return null;
        if (obj instanceof SlotValue slot) return slot.attrs().get(fieldName);
        if (obj instanceof Map<?, ?> m) {
            if (m.containsKey(fieldName)) return m.get(fieldName);
            throw new TemplateEvaluationException("key :" + fieldName + " not found in: " + m.keySet());
        }
        if (obj instanceof Map.Entry<?, ?> e) {
            if (fieldName.equals("key")) return e.getKey();
            if (fieldName.equals("value")) return e.getValue();
        }

        Class<?> c = obj.getClass();
        try {
            // A. Como MÉTODO (Records: street(), Beans: getStreet(), isUrgent())
            Method m = findMethod(c, fieldName);
            if (m != null) {
                m.setAccessible(true);
                return m.invoke(obj);
            }
            // B. Como CAMPO
            Field f = findField(c, fieldName);
            if (f != null) {
                f.setAccessible(true);
                return f.get(obj);
            }
        } catch (IllegalAccessException | InvocationTargetException | RuntimeException e) {
            throw new TemplateEvaluationException("cannot read field " + fieldName + " of " + c.getSimpleName(), e);
        }
        throw new TemplateEvaluationException("unknown field " + fieldName + " on " + c.getSimpleName());
    }

    private static Field findField(Class<?> c, String name) {
        while (c != null && c != Object.class) {
            for (Field f : c.getDeclaredFields()) {
                if (f.getName().equals(name)) return f;
            }
            c = c.getSuperclass();
        }
        return null;
    }

    private static Method findMethod(Class<?> c, String name) {
        String cap = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        for (String candidate : new String[]{name, "get" + cap, "is" + cap}) {
            for (Method m : c.getMethods()) {
                if (m.getName().equals(candidate) && m.getParameterCount() == 0 && m.getDeclaringClass() != Object.class) {
                    return m;
                }
            }
        }
        return null;
    }
}
