package com.ciro.jlive.component;

import java.util.List;
import java.util.Optional;

/**
 * Declaración inmutable de un componente: atributos y slots aceptados.
 * Un componente sin atributos ni slots declarados no se valida.
 */
public record ComponentSpec(String module, String name, List<AttrSpec> attrs, List<SlotSpec> slots) {

    public ComponentSpec {
        attrs = List.copyOf(attrs);
        slots = List.copyOf(slots);
    }

    public boolean declared() {
        return !attrs.isEmpty() || !slots.isEmpty();
    }

    public Optional<AttrSpec> attr(String attrName) {
        return attrs.stream().filter(a -> a.name().equals(attrName)).findFirst();
    }

    public Optional<SlotSpec> slot(String slotName) {
        return slots.stream().filter(s -> s.name().equals(slotName)).findFirst();
    }

    public Optional<AttrSpec> globalAttr() {
        return attrs.stream().filter(AttrSpec::isGlobal).findFirst();
    }

    public String qualifiedName() {
        return module + "." + name;
    }
}
