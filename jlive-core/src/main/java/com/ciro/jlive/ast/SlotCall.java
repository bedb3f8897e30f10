package com.ciro.jlive.ast;

import java.util.List;

public record SlotCall(String name, List<AttrShape> attrs, Span span) {
    public SlotCall {
        attrs = List.copyOf(attrs);
    }
}
