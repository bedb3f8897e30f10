package com.ciro.jlive.rendered;

import java.util.List;
import java.util.Map;

/**
 * Vista de un componente montado. {@code children} agrupa los componentes hijos
 * por el slot a través del cual llegaron ("" = plantilla propia).
 */
public record ComponentNode(long fingerprint, int componentId, Rendered rendered,
                            Map<String, List<ComponentNode>> children) {
}
