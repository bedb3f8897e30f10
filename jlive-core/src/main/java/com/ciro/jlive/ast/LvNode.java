package com.ciro.jlive.ast;

import java.util.List;

/**
 * Nodos del árbol de plantilla. Solo existen en tiempo de compilación;
 * {@code TemplateBuilder} los convierte en un {@code CompiledTemplate}.
 */
public sealed interface LvNode {

    record TextFragment(String content) implements LvNode {}

    /** {@code <%= code %>} */
    record ExpressionHole(String code, Span span) implements LvNode {}

    record Element(String name, List<Attr> attrs, List<LvNode> children, boolean selfClose, Span span)
            implements LvNode {
        public Element {
            attrs = List.copyOf(attrs);
            children = List.copyOf(children);
        }

        public boolean isVoid() {
            return HtmlTokenizer.isVoid(name);
        }
    }

    /** Elemento con {@code :for={x <- xs}} */
    record Loop(Attr generator, Element element) implements LvNode {}

    /** Invocación; el contenido que no es slot viaja en el slot implícito inner_block. */
    record Component(ComponentTarget target, List<Attr> attrs, List<SlotEntry> slots, Span span)
            implements LvNode {
        public Component {
            attrs = List.copyOf(attrs);
            slots = List.copyOf(slots);
        }
    }

    record SlotEntry(String name, List<Attr> attrs, Attr let, List<LvNode> children, Span span)
            implements LvNode {
        public static final String INNER_BLOCK = "inner_block";

        public SlotEntry {
            attrs = List.copyOf(attrs);
            children = List.copyOf(children);
        }
    }

    /** {@code <%= if cond do %> ... <% else %> ... <% end %>} */
    record Conditional(String condition, Span span, List<LvNode> then, List<LvNode> otherwise)
            implements LvNode {
        public Conditional {
            then = List.copyOf(then);
            otherwise = List.copyOf(otherwise);
        }
    }

    /** {@code <%= for x <- xs do %> ... <% end %>} */
    record ForBlock(String generator, Span span, List<LvNode> body) implements LvNode {
        public ForBlock {
            body = List.copyOf(body);
        }
    }
}
