package com.ciro.jlive.template;

import com.ciro.jlive.ast.ComponentCall;
import com.ciro.jlive.ast.ComponentTarget;
import com.ciro.jlive.ast.Document;
import com.ciro.jlive.ast.ErrorKind;
import com.ciro.jlive.ast.LvNode;
import com.ciro.jlive.ast.LvParser;
import com.ciro.jlive.ast.Span;
import com.ciro.jlive.ast.TemplateCompileException;
import com.ciro.jlive.component.AttrSpec;
import com.ciro.jlive.component.AttrType;
import com.ciro.jlive.component.CallValidator;
import com.ciro.jlive.component.ComponentSpec;
import com.ciro.jlive.component.Diagnostic;
import com.ciro.jlive.component.SlotSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Compila un módulo: declaraciones de componentes, sus plantillas y las
 * plantillas sueltas. {@link #compile()} registra la unidad en el registry.
 * <pre>
 * new TemplateCompiler("Ui", registry)
 *     .component("card").requiredAttr("title", AttrType.STRING).slot("footer")
 *         .template("&lt;div&gt;...&lt;/div&gt;")
 *     .template("page", "&lt;main&gt;&lt;.card title=\"x\"/&gt;&lt;/main&gt;")
 *     .compile();
 * </pre>
 */
public final class TemplateCompiler {

    private static final Logger log = LoggerFactory.getLogger(TemplateCompiler.class);

    private final String module;
    private final ComponentRegistry registry;
    private final Map<String, ComponentBuilder> components = new LinkedHashMap<>();
    private final Map<String, String> templates = new LinkedHashMap<>();
    private boolean failOnWarnings;

    public TemplateCompiler(String module, ComponentRegistry registry) {
        if (module == null || module.isBlank()) {
            throw new IllegalArgumentException("module name is required");
        }
        this.module = module;
        this.registry = registry;
    }

    public ComponentBuilder component(String name) {
        if (components.containsKey(name) || templates.containsKey(name)) {
            throw new IllegalArgumentException(name + " is already defined in module " + module);
        }
        ComponentBuilder b = new ComponentBuilder(name);
        components.put(name, b);
        return b;
    }

    public TemplateCompiler template(String name, String source) {
        if (components.containsKey(name) || templates.containsKey(name)) {
            throw new IllegalArgumentException(name + " is already defined in module " + module);
        }
        templates.put(name, source);
        return this;
    }

    /** Las advertencias abortan la compilación con {@link ErrorKind#DECLARATION}. */
    public TemplateCompiler failOnWarnings(boolean fail) {
        this.failOnWarnings = fail;
        return this;
    }

    public String module() {
        return module;
    }

    /** SHA-256 de declaraciones y fuentes; identifica la unidad en cachés. */
    public String digest() {
        StringBuilder sb = new StringBuilder(module).append('\n').append(failOnWarnings).append('\n');
        components.values().forEach(b -> sb.append("component ").append(b.name).append(b.attrs)
                .append(b.slots).append('\n').append(b.source).append('\n'));
        templates.forEach((name, src) -> sb.append("template ").append(name).append('\n').append(src).append('\n'));
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(sb.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public CompilationUnit compile() {
        List<Diagnostic> warnings = new ArrayList<>();

        // 1. declaraciones
        Map<String, ComponentSpec> specs = new LinkedHashMap<>();
        for (ComponentBuilder b : components.values()) {
            if (b.source == null) {
                throw new IllegalStateException("component " + module + "." + b.name + " has no template");
            }
            specs.put(b.name, b.finish(warnings));
        }

        // 2. parseo: todo o nada
        Map<String, Document> docs = new LinkedHashMap<>();
        components.values().forEach(b -> docs.put(b.name, LvParser.parse(b.source, fileOf(b.name))));
        templates.forEach((name, src) -> docs.put(name, LvParser.parse(src, fileOf(name))));

        // 3. construcción y validación de llamadas
        Set<String> local = specs.keySet();
        Map<String, ComponentDefinition> defs = new LinkedHashMap<>();
        Map<String, CompiledTemplate> compiled = new LinkedHashMap<>();
        docs.forEach((name, doc) -> {
            CompiledTemplate tpl = TemplateBuilder.build(doc, name, module, local);
            if (specs.containsKey(name)) {
                defs.put(name, new ComponentDefinition(specs.get(name), tpl));
            } else {
                compiled.put(name, tpl);
            }
            for (ComponentCall call : doc.calls()) {
                validateCall(call, specs, doc.file(), warnings);
            }
        });

        warnings.forEach(w -> log.warn("{}", w));
        if (failOnWarnings && !warnings.isEmpty()) {
            Diagnostic first = warnings.get(0);
            throw new TemplateCompileException(ErrorKind.DECLARATION,
                    first.message() + (warnings.size() > 1 ? " (and " + (warnings.size() - 1) + " more warnings)" : ""),
                    first.file(), first.span());
        }

        CompilationUnit unit = new CompilationUnit(module, defs, compiled, warnings);
        registry.register(unit);
        log.debug("compiled module {}: {} components, {} templates, {} warnings",
                module, defs.size(), compiled.size(), warnings.size());
        return unit;
    }

    private void validateCall(ComponentCall call, Map<String, ComponentSpec> specs, String file,
                              List<Diagnostic> warnings) {
        ComponentTarget target = call.target().resolve(module);
        ComponentSpec spec;
        if (target.module().equals(module)) {
            spec = specs.get(target.function());
            if (spec == null) {
                warnings.add(new Diagnostic("undefined function component " + target.function()
                        + " in module " + module, file, call.span()));
                return;
            }
        } else {
            CompilationUnit unit = registry.unit(target.module()).orElse(null);
            if (unit == null) {
                warnings.add(new Diagnostic("undefined component " + target + ": module " + target.module()
                        + " is not compiled", file, call.span()));
                return;
            }
            ComponentDefinition def = unit.component(target.function());
            if (def == null) {
                warnings.add(new Diagnostic("undefined function component " + target.function()
                        + " in module " + target.module(), file, call.span()));
                return;
            }
            spec = def.spec();
        }
        warnings.addAll(CallValidator.validate(call, spec, file));
    }

    private String fileOf(String name) {
        return module + "." + name;
    }

    // ========================================================================
    // Builders de declaración
    // ========================================================================

    public final class ComponentBuilder {

        private final String name;
        private final List<AttrSpec> attrs = new ArrayList<>();
        private final List<SlotDecl> slots = new ArrayList<>();
        private String source;

        private ComponentBuilder(String name) {
            this.name = name;
        }

        public ComponentBuilder attr(String attrName, AttrType type) {
            return attr(AttrSpec.optional(attrName, type));
        }

        public ComponentBuilder attr(String attrName, AttrType type, Object defaultValue) {
            return attr(AttrSpec.withDefault(attrName, type, defaultValue));
        }

        public ComponentBuilder requiredAttr(String attrName, AttrType type) {
            return attr(AttrSpec.required(attrName, type));
        }

        /** Recoge los atributos HTML globales no declarados en un único mapa. */
        public ComponentBuilder globalAttr(String attrName) {
            return attr(AttrSpec.optional(attrName, AttrType.GLOBAL));
        }

        public ComponentBuilder attr(AttrSpec spec) {
            attrs.add(spec);
            return this;
        }

        public ComponentBuilder slot(String slotName) {
            return slot(slotName, s -> {});
        }

        public ComponentBuilder slot(String slotName, Consumer<SlotBuilder> body) {
            SlotBuilder sb = new SlotBuilder();
            body.accept(sb);
            slots.add(new SlotDecl(slotName, false, sb.attrs));
            return this;
        }

        public ComponentBuilder requiredSlot(String slotName) {
            return requiredSlot(slotName, s -> {});
        }

        public ComponentBuilder requiredSlot(String slotName, Consumer<SlotBuilder> body) {
            SlotBuilder sb = new SlotBuilder();
            body.accept(sb);
            slots.add(new SlotDecl(slotName, true, sb.attrs));
            return this;
        }

        /** Fija la plantilla del componente y vuelve al compilador. */
        public TemplateCompiler template(String templateSource) {
            this.source = templateSource;
            return TemplateCompiler.this;
        }

        private ComponentSpec finish(List<Diagnostic> warnings) {
            String file = fileOf(name);
            List<AttrSpec> okAttrs = new ArrayList<>();
            Set<String> attrNames = new HashSet<>();
            boolean hasGlobal = false;
            for (AttrSpec a : attrs) {
                String problem = null;
                if (!attrNames.add(a.name())) {
                    problem = "a duplicate attribute with name \"" + a.name() + "\" already exists";
                } else if (a.name().equals(LvNode.SlotEntry.INNER_BLOCK)) {
                    problem = "cannot define attribute called \"inner_block\". Maybe you wanted to use `slot` instead?";
                } else if (a.required() && a.hasDefault()) {
                    problem = "only one of :required or :default must be given for attribute \"" + a.name() + "\"";
                } else if (a.hasDefault() && !a.type().acceptsValue(a.defaultValue())) {
                    problem = "expected the default value for attribute \"" + a.name() + "\" to be "
                            + a.type() + ", got: " + a.defaultValue();
                } else if (a.isGlobal() && hasGlobal) {
                    problem = "cannot define global attribute \"" + a.name()
                            + "\" because one is already defined";
                }
                if (problem != null) {
                    warnings.add(new Diagnostic(problem, file, Span.UNKNOWN));
                    continue;
                }
                hasGlobal |= a.isGlobal();
                okAttrs.add(a);
            }
            Set<String> accepted = new HashSet<>();
            okAttrs.forEach(a -> accepted.add(a.name()));

            List<SlotSpec> okSlots = new ArrayList<>();
            Set<String> slotNames = new HashSet<>();
            for (SlotDecl s : slots) {
                if (!slotNames.add(s.name())) {
                    warnings.add(new Diagnostic("a duplicate slot with name \"" + s.name() + "\" already exists",
                            file, Span.UNKNOWN));
                    continue;
                }
                if (accepted.contains(s.name())) {
                    warnings.add(new Diagnostic("cannot define a slot with name \"" + s.name()
                            + "\", as an attribute with that name already exists", file, Span.UNKNOWN));
                    continue;
                }
                List<AttrSpec> slotAttrs = new ArrayList<>();
                if (s.name().equals(LvNode.SlotEntry.INNER_BLOCK) && !s.attrs().isEmpty()) {
                    warnings.add(new Diagnostic("cannot define attributes in a slot with name \"inner_block\"",
                            file, Span.UNKNOWN));
                } else {
                    Set<String> seen = new HashSet<>();
                    for (AttrSpec a : s.attrs()) {
                        if (!seen.add(a.name())) {
                            warnings.add(new Diagnostic("a duplicate attribute with name \"" + a.name()
                                    + "\" in slot \"" + s.name() + "\" already exists", file, Span.UNKNOWN));
                        } else {
                            slotAttrs.add(a);
                        }
                    }
                }
                okSlots.add(new SlotSpec(s.name(), s.required(), slotAttrs));
            }
            return new ComponentSpec(module, name, okAttrs, okSlots);
        }
    }

    public static final class SlotBuilder {

        private final List<AttrSpec> attrs = new ArrayList<>();

        private SlotBuilder() {}

        public SlotBuilder attr(String name, AttrType type) {
            attrs.add(AttrSpec.optional(name, type));
            return this;
        }

        public SlotBuilder requiredAttr(String name, AttrType type) {
            attrs.add(AttrSpec.required(name, type));
            return this;
        }
    }

    private record SlotDecl(String name, boolean required, List<AttrSpec> attrs) {}
}
