package com.ciro.jlive.template;

import com.ciro.jlive.ast.Attr;
import com.ciro.jlive.ast.AttrValue;
import com.ciro.jlive.ast.ComponentTarget;
import com.ciro.jlive.ast.Document;
import com.ciro.jlive.ast.ErrorKind;
import com.ciro.jlive.ast.LvNode;
import com.ciro.jlive.ast.Span;
import com.ciro.jlive.ast.TemplateCompileException;
import com.ciro.jlive.expr.Deps;
import com.ciro.jlive.expr.Expr;
import com.ciro.jlive.expr.ExprParser;
import com.ciro.jlive.expr.Generator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Convierte los nodos del parser en un {@link CompiledTemplate}: el marcado
 * literal se acumula en statics y cada parte dinámica abre un hueco.
 */
public final class TemplateBuilder {

    private final String name;
    private final String file;
    private final String module;
    private final Set<String> localComponents;
    private final Set<String> scope;

    private final List<String> statics = new ArrayList<>();
    private final List<Part> parts = new ArrayList<>();
    private final StringBuilder current = new StringBuilder();

    private TemplateBuilder(String name, String file, String module, Set<String> localComponents, Set<String> scope) {
        this.name = name;
        this.file = file;
        this.module = module;
        this.localComponents = localComponents;
        this.scope = scope;
    }

    /**
     * @param module          módulo que compila; destino de los componentes locales
     * @param localComponents componentes que existen en ese módulo
     */
    public static CompiledTemplate build(Document doc, String name, String module, Set<String> localComponents) {
        TemplateBuilder b = new TemplateBuilder(name, doc.file(), module, localComponents, Set.of());
        return b.build(doc.nodes(), doc.root());
    }

    private CompiledTemplate build(List<LvNode> nodes, boolean root) {
        for (LvNode n : nodes) emit(n);
        statics.add(current.toString());
        return new CompiledTemplate(name, file, statics, parts, root);
    }

    private CompiledTemplate sub(String suffix, List<LvNode> nodes, String bound) {
        Set<String> inner = scope;
        if (bound != null) {
            inner = new HashSet<>(scope);
            inner.add(bound);
        }
        return new TemplateBuilder(name + suffix, file, module, localComponents, inner).build(nodes, false);
    }

    private void hole(Part part) {
        statics.add(current.toString());
        current.setLength(0);
        parts.add(part);
    }

    // ------------------------------------------------------------------
    // Nodos
    // ------------------------------------------------------------------

    private void emit(LvNode node) {
        if (node instanceof LvNode.TextFragment t) {
            current.append(t.content());
        } else if (node instanceof LvNode.ExpressionHole h) {
            expression(h);
        } else if (node instanceof LvNode.Element el) {
            element(el);
        } else if (node instanceof LvNode.Loop loop) {
            Generator gen = ExprParser.parseGenerator(loop.generator().code(), file, loop.generator().span());
            hole(comprehension(loop.generator().code(), gen, List.of(loop.element()), loop.generator().span()));
        } else if (node instanceof LvNode.ForBlock block) {
            Generator gen = ExprParser.parseGenerator(block.generator(), file, block.span());
            hole(comprehension(block.generator(), gen, block.body(), block.span()));
        } else if (node instanceof LvNode.Conditional c) {
            CompiledExpr cond = compile(c.condition(), c.span());
            hole(ConditionalPart.of(cond, sub("#then", c.then(), null), sub("#else", c.otherwise(), null)));
        } else if (node instanceof LvNode.Component c) {
            hole(component(c));
        } else if (node instanceof LvNode.SlotEntry s) {
            throw new TemplateCompileException(ErrorKind.SLOT_OUTSIDE_COMPONENT,
                    "invalid slot entry <:" + s.name() + ">. A slot entry must be a direct child of a component",
                    file, s.span());
        }
    }

    private void expression(LvNode.ExpressionHole h) {
        Expr e = ExprParser.parse(h.code(), file, h.span());
        if (e instanceof Expr.Call call && call.function().equals("render_slot")) {
            CompiledExpr slot = checked(h.code(), call.args().get(0), h.span());
            CompiledExpr arg = call.args().size() > 1 ? checked(h.code(), call.args().get(1), h.span()) : null;
            hole(SlotRenderPart.of(slot, arg));
            return;
        }
        hole(new ExprPart(checked(h.code(), e, h.span())));
    }

    private void element(LvNode.Element el) {
        current.append('<').append(el.name());
        for (Attr a : el.attrs()) {
            if (a.isSpread()) {
                hole(new SpreadPart(compile(a.code(), a.span())));
                continue;
            }
            AttrValue v = a.value();
            if (v instanceof AttrValue.Literal lit) {
                current.append(' ').append(a.name()).append('=')
                        .append(lit.delimiter()).append(lit.value()).append(lit.delimiter());
            } else if (v instanceof AttrValue.Presence) {
                current.append(' ').append(a.name());
            } else {
                CompiledExpr expr = compile(a.code(), ((AttrValue.Expression) v).span());
                hole(a.name().equals("class") ? new ClassAttrPart(expr) : new AttrPart(a.name(), expr));
            }
        }
        current.append('>');
        if (el.isVoid()) return;
        for (LvNode child : el.children()) emit(child);
        current.append("</").append(el.name()).append('>');
    }

    private ComprehensionPart comprehension(String code, Generator gen, List<LvNode> body, Span span) {
        CompiledExpr source = checked(code, gen.source(), span);
        CompiledExpr filter = null;
        if (gen.filter() != null) {
            filter = withScope(gen.pattern()).checked(code, gen.filter(), span);
        }
        CompiledTemplate tpl = sub("#for", body, gen.pattern());
        return ComprehensionPart.of(gen.pattern(), source, filter, tpl);
    }

    private ComponentPart component(LvNode.Component c) {
        ComponentTarget target = c.target();
        if (target.isLocal()) {
            if (!localComponents.contains(target.function())) {
                throw new TemplateCompileException(ErrorKind.UNDEFINED_COMPONENT,
                        "undefined function component ." + target.function() + " in module " + module,
                        file, c.span());
            }
            target = target.resolve(module);
        }

        Map<String, CompiledExpr> attrs = new LinkedHashMap<>();
        List<CompiledExpr> spreads = new ArrayList<>();
        for (Attr a : c.attrs()) {
            if (a.isSpread()) {
                spreads.add(compile(a.code(), a.span()));
            } else {
                attrs.put(a.name(), attrValue(a));
            }
        }

        List<SlotTemplate> slots = new ArrayList<>();
        for (LvNode.SlotEntry entry : c.slots()) {
            String let = null;
            if (entry.let() != null) {
                let = entry.let().code().trim();
                if (!ExprParser.isIdentifier(let)) {
                    throw new TemplateCompileException(ErrorKind.INVALID_LET,
                            ":let must be a variable name, got: " + let, file, entry.let().span());
                }
            }
            Map<String, CompiledExpr> slotAttrs = new LinkedHashMap<>();
            for (Attr a : entry.attrs()) {
                if (a.isSpread()) {
                    throw new TemplateCompileException(ErrorKind.UNSUPPORTED_ATTRIBUTE,
                            "slot entries do not support dynamic attributes {...}", file, a.span());
                }
                slotAttrs.put(a.name(), attrValue(a));
            }
            CompiledTemplate body = sub(":" + entry.name(), entry.children(), let);
            slots.add(SlotTemplate.of(entry.name(), slotAttrs, let, body, entry.span()));
        }
        return ComponentPart.of(target, attrs, spreads, slots, file, c.span());
    }

    private CompiledExpr attrValue(Attr a) {
        AttrValue v = a.value();
        if (v instanceof AttrValue.Literal lit) return CompiledExpr.constant(lit.value());
        if (v instanceof AttrValue.Presence) return CompiledExpr.constant(Boolean.TRUE);
        return compile(a.code(), ((AttrValue.Expression) v).span());
    }

    // ------------------------------------------------------------------
    // Expresiones
    // ------------------------------------------------------------------

    private CompiledExpr compile(String code, Span span) {
        return checked(code, ExprParser.parse(code, file, span), span);
    }

    /** Rechaza render_slot anidado y variables no ligadas en este alcance. */
    private CompiledExpr checked(String code, Expr e, Span span) {
        if (containsRenderSlot(e)) {
            throw new TemplateCompileException(ErrorKind.INVALID_EXPRESSION,
                    "render_slot can only be used as the whole content of <%= %>, got: " + code, file, span);
        }
        Deps deps = Deps.of(e);
        for (String local : deps.freeLocals()) {
            if (!scope.contains(local)) {
                throw new TemplateCompileException(ErrorKind.UNDEFINED_VARIABLE,
                        "undefined variable \"" + local + "\"", file, span);
            }
        }
        return new CompiledExpr(code, e, deps, file, span);
    }

    private TemplateBuilder withScope(String bound) {
        Set<String> inner = new HashSet<>(scope);
        inner.add(bound);
        return new TemplateBuilder(name, file, module, localComponents, inner);
    }

    private static boolean containsRenderSlot(Expr e) {
        if (e instanceof Expr.Call c) {
            if (c.function().equals("render_slot")) return true;
            return c.args().stream().anyMatch(TemplateBuilder::containsRenderSlot);
        }
        if (e instanceof Expr.Field f) return containsRenderSlot(f.target());
        if (e instanceof Expr.Index i) return containsRenderSlot(i.target()) || containsRenderSlot(i.index());
        if (e instanceof Expr.Unary u) return containsRenderSlot(u.operand());
        if (e instanceof Expr.Binary b) return containsRenderSlot(b.left()) || containsRenderSlot(b.right());
        if (e instanceof Expr.ListExpr l) return l.items().stream().anyMatch(TemplateBuilder::containsRenderSlot);
        return false;
    }
}
