package com.ciro.jlive.ast;

import java.util.List;

/**
 * Resultado del parser: nodos de primer nivel, llamadas a componentes y si la
 * plantilla tiene un único tag raíz.
 */
public record Document(String file, List<LvNode> nodes, List<ComponentCall> calls, boolean root) {
    public Document {
        nodes = List.copyOf(nodes);
        calls = List.copyOf(calls);
    }
}
