package com.ciro.jlive.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ensamblador O(N). Convierte los tokens del lexer en un {@link Document}.
 * <p>
 * Es estricto: cualquier error estructural aborta la compilación con
 * {@link TemplateCompileException}. No hay tolerancia a HTML mal formado.
 */
public final class LvParser {

    private static final Pattern IF_BLOCK = Pattern.compile("^if\\s+(.+?)\\s+do$", Pattern.DOTALL);
    private static final Pattern FOR_BLOCK = Pattern.compile("^for\\s+(.+?)\\s+do$", Pattern.DOTALL);

    private final String file;
    private final Deque<Frame> stack = new ArrayDeque<>();
    private final List<LvNode> roots = new ArrayList<>();
    private final List<ComponentCall> calls = new ArrayList<>();

    private LvParser(String file) {
        this.file = file;
    }

    public static Document parse(String source, String file) {
        return parse(LvLexer.lex(source, file), file);
    }

    public static Document parse(List<Token> tokens, String file) {
        LvParser p = new LvParser(file);
        for (Token t : tokens) {
            if (t instanceof Token.Text text) {
                p.add(new LvNode.TextFragment(text.content()));
            } else if (t instanceof Token.TagOpen open) {
                p.open(open);
            } else if (t instanceof Token.TagClose close) {
                p.close(close);
            } else if (t instanceof Token.Expression expr) {
                p.expression(expr);
            }
        }
        p.end();
        return new Document(file, p.roots, p.calls, isRoot(p.roots));
    }

    // ------------------------------------------------------------------
    // Apertura de tags
    // ------------------------------------------------------------------

    private void open(Token.TagOpen t) {
        switch (t.kind()) {
            case ELEMENT -> openElement(t);
            case REMOTE_COMPONENT, LOCAL_COMPONENT -> openComponent(t);
            case SLOT -> openSlot(t);
        }
    }

    private void openElement(Token.TagOpen t) {
        List<Attr> attrs = new ArrayList<>();
        Attr forAttr = null;
        for (Attr a : t.attrs()) {
            if (!a.isSpecial()) {
                attrs.add(a);
                continue;
            }
            if (!a.name().equals(":for")) {
                throw error(ErrorKind.UNSUPPORTED_ATTRIBUTE,
                        "unsupported attribute \"" + a.name() + "\" in tags", a.span());
            }
            if (forAttr != null) {
                throw error(ErrorKind.DUPLICATE_ATTRIBUTE,
                        "cannot define multiple \":for\" attributes. Another \":for\" has already been defined at line "
                                + forAttr.span().line(), a.span());
            }
            if (!a.isExpression()) {
                throw error(ErrorKind.INVALID_LOOP, ":for must be a generator expression between {...}", a.span());
            }
            forAttr = a;
        }

        if (t.selfClose() || HtmlTokenizer.isVoid(t.name())) {
            add(element(t, attrs, List.of(), forAttr));
        } else {
            stack.push(new ElementFrame(t, attrs, forAttr));
        }
    }

    private void openComponent(Token.TagOpen t) {
        ComponentTarget target = target(t);
        List<Attr> attrs = new ArrayList<>();
        Attr let = null;
        for (Attr a : t.attrs()) {
            if (!a.isSpecial()) {
                attrs.add(a);
            } else if (a.name().equals(":let")) {
                let = checkLet(let, a);
            } else {
                throw error(ErrorKind.UNSUPPORTED_ATTRIBUTE,
                        "unsupported attribute \"" + a.name() + "\" in component", a.span());
            }
        }

        if (t.selfClose()) {
            if (let != null) {
                throw error(ErrorKind.LET_WITHOUT_CONTENT,
                        "cannot use :let on a component without inner content", let.span());
            }
            add(component(target, attrs, List.of(), t.span()));
        } else {
            stack.push(new ComponentFrame(t, target, attrs, let));
        }
    }

    private void openSlot(Token.TagOpen t) {
        String name = t.name().substring(1);
        if (!(stack.peek() instanceof ComponentFrame)) {
            throw error(ErrorKind.SLOT_OUTSIDE_COMPONENT,
                    "invalid slot entry <:" + name + ">. A slot entry must be a direct child of a component",
                    t.span());
        }
        if (name.equals(LvNode.SlotEntry.INNER_BLOCK)) {
            throw error(ErrorKind.RESERVED_SLOT_NAME, "the slot name :inner_block is reserved", t.span());
        }
        if (name.isEmpty()) {
            throw error(ErrorKind.INVALID_TAG, "invalid tag <:>", t.span());
        }

        List<Attr> attrs = new ArrayList<>();
        Attr let = null;
        for (Attr a : t.attrs()) {
            if (!a.isSpecial()) {
                attrs.add(a);
            } else if (a.name().equals(":let")) {
                let = checkLet(let, a);
            } else {
                throw error(ErrorKind.UNSUPPORTED_ATTRIBUTE,
                        "unsupported attribute \"" + a.name() + "\" in slot", a.span());
            }
        }

        if (t.selfClose()) {
            if (let != null) {
                throw error(ErrorKind.LET_WITHOUT_CONTENT,
                        "cannot use :let on a slot without inner content", let.span());
            }
            add(new LvNode.SlotEntry(name, attrs, null, List.of(), t.span()));
        } else {
            stack.push(new SlotFrame(t, name, attrs, let));
        }
    }

    private Attr checkLet(Attr previous, Attr let) {
        if (previous != null) {
            throw error(ErrorKind.DUPLICATE_LET,
                    "cannot define multiple :let attributes. Another :let has already been defined at line "
                            + previous.span().line(), let.span());
        }
        if (!let.isExpression()) {
            throw error(ErrorKind.INVALID_LET, ":let must be a pattern between {...}", let.span());
        }
        return let;
    }

    private ComponentTarget target(Token.TagOpen t) {
        String name = t.name();
        if (t.kind() == TagKind.LOCAL_COMPONENT) {
            String fun = name.substring(1);
            if (fun.isEmpty() || !Character.isLowerCase(fun.charAt(0)) || fun.indexOf('.') >= 0) {
                throw error(ErrorKind.INVALID_TAG, "invalid tag <" + name + ">", t.span());
            }
            return new ComponentTarget(null, fun);
        }
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1 || !Character.isLowerCase(name.charAt(dot + 1))) {
            throw error(ErrorKind.INVALID_TAG, "invalid tag <" + name + ">", t.span());
        }
        return new ComponentTarget(name.substring(0, dot), name.substring(dot + 1));
    }

    // ------------------------------------------------------------------
    // Cierre de tags
    // ------------------------------------------------------------------

    private void close(Token.TagClose t) {
        String name = t.name();
        Frame top = stack.peek();
        if (!(top instanceof TagFrame tag)
                || (TagKind.classify(name) == TagKind.ELEMENT && HtmlTokenizer.isVoid(name))) {
            throw error(ErrorKind.UNEXPECTED_CLOSING_TAG, "missing opening tag for </" + name + ">", t.span());
        }
        if (!tag.open.name().equals(name)) {
            throw new MismatchedClosingTagException(tag.open.name(), name, file, tag.open.span(), t.span());
        }
        stack.pop();
        add(tag.build(this));
    }

    // ------------------------------------------------------------------
    // Marcadores <% %>
    // ------------------------------------------------------------------

    private void expression(Token.Expression t) {
        String code = t.code();
        if (t.marker().equals("=")) {
            Matcher m = IF_BLOCK.matcher(code);
            if (m.matches()) {
                stack.push(new BlockFrame(false, m.group(1).trim(), t.span()));
                return;
            }
            m = FOR_BLOCK.matcher(code);
            if (m.matches()) {
                stack.push(new BlockFrame(true, m.group(1).trim(), t.span()));
                return;
            }
            if (code.endsWith(" do") || code.equals("do")) {
                throw error(ErrorKind.INVALID_EXPRESSION,
                        "unsupported block <%= " + code + " %>. Only if and for blocks are allowed", t.span());
            }
            add(new LvNode.ExpressionHole(code, t.span()));
            return;
        }

        switch (code) {
            case "else" -> {
                if (!(stack.peek() instanceof BlockFrame block) || block.loop || block.inElse) {
                    throw error(ErrorKind.MISPLACED_BLOCK, "unexpected <% else %>", t.span());
                }
                block.inElse = true;
            }
            case "end" -> {
                if (!(stack.peek() instanceof BlockFrame block)) {
                    throw error(ErrorKind.MISPLACED_BLOCK, "unexpected <% end %>", t.span());
                }
                stack.pop();
                add(block.loop
                        ? new LvNode.ForBlock(block.code, block.span, block.then)
                        : new LvNode.Conditional(block.code, block.span, block.then, block.otherwise));
            }
            default -> throw error(ErrorKind.INVALID_EXPRESSION,
                    "unsupported statement <% " + code + " %>. Only else and end are allowed", t.span());
        }
    }

    private void end() {
        Frame top = stack.peek();
        if (top instanceof BlockFrame block) {
            throw error(ErrorKind.UNCLOSED_BLOCK,
                    "end of template reached without <% end %> for block <%= " + (block.loop ? "for " : "if ")
                            + block.code + " do %>", block.span);
        }
        if (top instanceof TagFrame tag) {
            throw error(ErrorKind.UNCLOSED_TAG,
                    "end of template reached without closing tag for <" + tag.open.name() + ">", tag.open.span());
        }
    }

    // ------------------------------------------------------------------
    // Construcción de nodos
    // ------------------------------------------------------------------

    private void add(LvNode node) {
        Frame top = stack.peek();
        if (top == null) {
            roots.add(node);
        } else {
            top.add(node);
        }
    }

    private static LvNode element(Token.TagOpen t, List<Attr> attrs, List<LvNode> children, Attr forAttr) {
        LvNode.Element el = new LvNode.Element(t.name(), attrs, children, t.selfClose(), t.span());
        return forAttr == null ? el : new LvNode.Loop(forAttr, el);
    }

    private LvNode.Component component(ComponentTarget target, List<Attr> attrs,
                                       List<LvNode.SlotEntry> slots, Span span) {
        List<AttrShape> shapes = new ArrayList<>();
        boolean spread = false;
        for (Attr a : attrs) {
            if (a.isSpread()) spread = true;
            else shapes.add(AttrShape.of(a));
        }
        List<SlotCall> slotCalls = new ArrayList<>();
        for (LvNode.SlotEntry s : slots) {
            slotCalls.add(new SlotCall(s.name(),
                    s.attrs().stream().filter(a -> !a.isSpread()).map(AttrShape::of).toList(), s.span()));
        }
        calls.add(new ComponentCall(target, shapes, spread, slotCalls, span));
        return new LvNode.Component(target, attrs, slots, span);
    }

    private static boolean isRoot(List<LvNode> nodes) {
        int tags = 0;
        for (LvNode n : nodes) {
            if (n instanceof LvNode.Element) {
                tags++;
            } else if (!(n instanceof LvNode.TextFragment text) || !text.content().isBlank()) {
                return false;
            }
        }
        return tags == 1;
    }

    private static boolean isBlank(List<LvNode> nodes) {
        for (LvNode n : nodes) {
            if (!(n instanceof LvNode.TextFragment text) || !text.content().isBlank()) return false;
        }
        return true;
    }

    private TemplateCompileException error(ErrorKind kind, String message, Span span) {
        return new TemplateCompileException(kind, message, file, span);
    }

    // ------------------------------------------------------------------
    // Frames de la pila
    // ------------------------------------------------------------------

    private abstract static class Frame {
        abstract void add(LvNode node);
    }

    private abstract static class TagFrame extends Frame {
        final Token.TagOpen open;

        TagFrame(Token.TagOpen open) {
            this.open = open;
        }

        abstract LvNode build(LvParser parser);
    }

    private static final class ElementFrame extends TagFrame {
        final List<Attr> attrs;
        final Attr forAttr;
        final List<LvNode> children = new ArrayList<>();

        ElementFrame(Token.TagOpen open, List<Attr> attrs, Attr forAttr) {
            super(open);
            this.attrs = attrs;
            this.forAttr = forAttr;
        }

        @Override
        void add(LvNode node) {
            children.add(node);
        }

        @Override
        LvNode build(LvParser parser) {
            return element(open, attrs, children, forAttr);
        }
    }

    private static final class ComponentFrame extends TagFrame {
        final ComponentTarget target;
        final List<Attr> attrs;
        final Attr let;
        final List<LvNode.SlotEntry> slots = new ArrayList<>();
        final List<LvNode> inner = new ArrayList<>();

        ComponentFrame(Token.TagOpen open, ComponentTarget target, List<Attr> attrs, Attr let) {
            super(open);
            this.target = target;
            this.attrs = attrs;
            this.let = let;
        }

        @Override
        void add(LvNode node) {
            if (node instanceof LvNode.SlotEntry slot) {
                slots.add(slot);
            } else {
                inner.add(node);
            }
        }

        @Override
        LvNode build(LvParser parser) {
            List<LvNode.SlotEntry> all = new ArrayList<>();
            if (let != null || !isBlank(inner)) {
                all.add(new LvNode.SlotEntry(LvNode.SlotEntry.INNER_BLOCK, List.of(), let, inner, open.span()));
            }
            all.addAll(slots);
            return parser.component(target, attrs, all, open.span());
        }
    }

    private static final class SlotFrame extends TagFrame {
        final String name;
        final List<Attr> attrs;
        final Attr let;
        final List<LvNode> children = new ArrayList<>();

        SlotFrame(Token.TagOpen open, String name, List<Attr> attrs, Attr let) {
            super(open);
            this.name = name;
            this.attrs = attrs;
            this.let = let;
        }

        @Override
        void add(LvNode node) {
            children.add(node);
        }

        @Override
        LvNode build(LvParser parser) {
            return new LvNode.SlotEntry(name, attrs, let, children, open.span());
        }
    }

    private static final class BlockFrame extends Frame {
        final boolean loop;
        final String code;
        final Span span;
        final List<LvNode> then = new ArrayList<>();
        final List<LvNode> otherwise = new ArrayList<>();
        boolean inElse;

        BlockFrame(boolean loop, String code, Span span) {
            this.loop = loop;
            this.code = code;
            this.span = span;
        }

        @Override
        void add(LvNode node) {
            if (inElse) otherwise.add(node);
            else then.add(node);
        }
    }
}
