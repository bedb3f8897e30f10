package com.ciro.jlive.component;

import com.ciro.jlive.ast.AttrShape;
import com.ciro.jlive.ast.ComponentCall;
import com.ciro.jlive.ast.LvNode;
import com.ciro.jlive.ast.SlotCall;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Valida una invocación contra la declaración del componente.
 * Solo produce advertencias; nunca aborta.
 */
public final class CallValidator {

    private CallValidator() {}

    public static List<Diagnostic> validate(ComponentCall call, ComponentSpec spec, String file) {
        List<Diagnostic> out = new ArrayList<>();
        if (spec == null || !spec.declared()) return out;
        String component = spec.qualifiedName();

        Optional<AttrSpec> global = spec.globalAttr();
        Set<String> given = new HashSet<>();
        for (AttrShape attr : call.attrs()) {
            given.add(attr.name());
            Optional<AttrSpec> declared = spec.attr(attr.name());
            if (declared.isEmpty()) {
                if (global.isEmpty() || !Globals.isGlobal(attr.name())) {
                    out.add(new Diagnostic("undefined attribute \"" + attr.name() + "\" for component "
                            + component, file, attr.span()));
                }
                continue;
            }
            AttrSpec a = declared.get();
            if (a.isGlobal()) {
                out.add(new Diagnostic("global attribute \"" + attr.name() + "\" in component " + component
                        + " may not be provided directly", file, attr.span()));
            } else if (!a.type().acceptsLiteral(attr.shape())) {
                out.add(new Diagnostic("attribute \"" + attr.name() + "\" in component " + component
                        + " must be " + article(a.type()) + ", got: " + attr.shape().name().toLowerCase(Locale.ROOT),
                        file, attr.span()));
            }
        }

        // con spread no sabemos qué atributos llegan
        if (!call.hasSpread()) {
            for (AttrSpec a : spec.attrs()) {
                if (a.required() && !given.contains(a.name())) {
                    out.add(new Diagnostic("missing required attribute \"" + a.name() + "\" for component "
                            + component, file, call.span()));
                }
            }
        }

        Set<String> slotsGiven = new HashSet<>();
        for (SlotCall slot : call.slots()) {
            slotsGiven.add(slot.name());
            Optional<SlotSpec> declared = spec.slot(slot.name());
            if (declared.isEmpty()) {
                if (!slot.name().equals(LvNode.SlotEntry.INNER_BLOCK)) {
                    out.add(new Diagnostic("undefined slot \"" + slot.name() + "\" for component "
                            + component, file, slot.span()));
                }
                continue;
            }
            validateSlotAttrs(slot, declared.get(), component, file, out);
        }
        for (SlotSpec s : spec.slots()) {
            if (s.required() && !slotsGiven.contains(s.name())) {
                out.add(new Diagnostic("missing required slot \"" + s.name() + "\" for component "
                        + component, file, call.span()));
            }
        }
        return out;
    }

    private static void validateSlotAttrs(SlotCall slot, SlotSpec spec, String component, String file,
                                          List<Diagnostic> out) {
        if (spec.attrs().isEmpty()) return;
        Set<String> given = new HashSet<>();
        for (AttrShape attr : slot.attrs()) {
            given.add(attr.name());
            Optional<AttrSpec> declared = spec.attr(attr.name());
            if (declared.isEmpty()) {
                out.add(new Diagnostic("undefined attribute \"" + attr.name() + "\" in slot \"" + slot.name()
                        + "\" for component " + component, file, attr.span()));
            } else if (!declared.get().type().acceptsLiteral(attr.shape())) {
                out.add(new Diagnostic("attribute \"" + attr.name() + "\" in slot \"" + slot.name()
                        + "\" for component " + component + " must be " + article(declared.get().type())
                        + ", got: " + attr.shape().name().toLowerCase(Locale.ROOT), file, attr.span()));
            }
        }
        for (AttrSpec a : spec.attrs()) {
            if (a.required() && !given.contains(a.name())) {
                out.add(new Diagnostic("missing required attribute \"" + a.name() + "\" in slot \"" + slot.name()
                        + "\" for component " + component, file, slot.span()));
            }
        }
    }

    private static String article(AttrType type) {
        String name = type.toString();
        return (type.kind() == AttrType.Kind.ATOM || type.kind() == AttrType.Kind.INTEGER ? "an " : "a ") + name;
    }
}
