package com.ciro.jlive.component;

import java.util.List;
import java.util.Optional;

public record SlotSpec(String name, boolean required, List<AttrSpec> attrs) {

    public SlotSpec {
        attrs = List.copyOf(attrs);
    }

    public Optional<AttrSpec> attr(String attrName) {
        return attrs.stream().filter(a -> a.name().equals(attrName)).findFirst();
    }
}
