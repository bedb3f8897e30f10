package com.ciro.jlive.component;

import java.util.Set;

/** Atributos HTML globales que un atributo {@code :global} acepta sin declararlos. */
public final class Globals {

    private static final Set<String> NAMES = Set.of(
            "accesskey", "autocapitalize", "autofocus", "class", "contenteditable", "contextmenu",
            "dir", "draggable", "enterkeyhint", "exportparts", "hidden", "id", "inert", "inputmode",
            "is", "itemid", "itemprop", "itemref", "itemscope", "itemtype", "lang", "nonce", "part",
            "role", "slot", "spellcheck", "style", "tabindex", "title", "translate");

    private Globals() {}

    public static boolean isGlobal(String name) {
        return NAMES.contains(name)
                || name.startsWith("aria-")
                || name.startsWith("data-")
                || name.startsWith("phx-")
                || (name.startsWith("on") && name.length() > 2);
    }
}
