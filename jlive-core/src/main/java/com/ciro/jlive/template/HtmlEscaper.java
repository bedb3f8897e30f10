package com.ciro.jlive.template;

import java.util.Collection;

public final class HtmlEscaper {

    private HtmlEscaper() {}

    public static String escape(String s) {
        if (s == null || s.isEmpty()) return "";
        StringBuilder sb = null;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            String rep = switch (c) {
                case '&' -> "&amp;";
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '"' -> "&quot;";
                case '\'' -> "&#39;";
                default -> null;
            };
            if (rep == null) {
                if (sb != null) sb.append(c);
                continue;
            }
            if (sb == null) {
                sb = new StringBuilder(s.length() + 16);
                sb.append(s, 0, i);
            }
            sb.append(rep);
        }
        return sb == null ? s : sb.toString();
    }

    /** Salida de {@code <%= %>}: null → vacío, SafeHtml tal cual, el resto escapado. */
    public static String toOutput(Object value) {
        if (value == null) return "";
        if (value instanceof SafeHtml safe) return safe.html();
        if (value instanceof Collection<?> items) {
            StringBuilder sb = new StringBuilder();
            for (Object it : items) sb.append(toOutput(it));
            return sb.toString();
        }
        return escape(String.valueOf(value));
    }
}
