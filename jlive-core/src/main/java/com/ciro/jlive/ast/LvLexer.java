package com.ciro.jlive.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Separa los marcadores {@code <% %>} del marcado y alimenta el texto intermedio
 * al {@link HtmlTokenizer} trozo a trozo.
 * <ul>
 *   <li>{@code <%= code %>} salida</li>
 *   <li>{@code <% code %>} sentencia (else, end...)</li>
 *   <li>{@code <%# ... %>} comentario, se descarta</li>
 *   <li>{@code <%%} literal {@code <%}</li>
 * </ul>
 */
public final class LvLexer {

    private LvLexer() {}

    public static List<Token> lex(String source, String file) {
        String src = source == null ? "" : source;
        List<Token> out = new ArrayList<>();
        HtmlTokenizer.State state = HtmlTokenizer.State.initial();

        StringBuilder chunk = new StringBuilder();
        int chunkLine = 1, chunkCol = 1;
        int line = 1, col = 1;
        int i = 0;
        int n = src.length();

        while (i < n) {
            if (src.startsWith("<%%", i)) {
                if (chunk.isEmpty()) { chunkLine = line; chunkCol = col; }
                chunk.append("<%");
                i += 3;
                col += 3;
                continue;
            }
            if (src.startsWith("<%", i)) {
                Span start = Span.at(line, col);
                int close = src.startsWith("<%#", i) ? src.indexOf("%>", i + 3) : findClose(src, i + 2);
                if (close < 0) {
                    throw new TemplateCompileException(ErrorKind.UNTERMINATED_EXPRESSION,
                            "missing token '%>'", file, start);
                }

                // 1. Vaciar el texto acumulado al tokenizer
                state = flush(chunk, state.at(chunkLine, chunkCol), file, out);

                String body = src.substring(i + 2, close);
                String marker = "";
                if (body.startsWith("=") || body.startsWith("#")) {
                    marker = body.substring(0, 1);
                    body = body.substring(1);
                }

                // 2. Avanzar cursor (el código puede tener saltos de línea)
                for (int k = i; k < close + 2; k++) {
                    if (src.charAt(k) == '\n') { line++; col = 1; } else { col++; }
                }
                i = close + 2;

                if (!marker.equals("#")) {
                    out.add(new Token.Expression(marker, body.trim(), start.to(line, col)));
                }
                continue;
            }

            char c = src.charAt(i++);
            if (chunk.isEmpty()) { chunkLine = line; chunkCol = col; }
            chunk.append(c);
            if (c == '\n') { line++; col = 1; } else { col++; }
        }

        state = flush(chunk, state.at(chunkLine, chunkCol), file, out);
        HtmlTokenizer.finish(state, file);
        return out;
    }

    /** Primer {@code %>} fuera de strings del código. -1 si no hay. */
    private static int findClose(String src, int from) {
        int n = src.length();
        int k = from;
        while (k < n) {
            char c = src.charAt(k);
            if (c == '"' || c == '\'') {
                k++;
                while (k < n && src.charAt(k) != c) {
                    if (src.charAt(k) == '\\') k++;
                    k++;
                }
                k++;
                continue;
            }
            if (c == '%' && k + 1 < n && src.charAt(k + 1) == '>') return k;
            k++;
        }
        return -1;
    }

    private static HtmlTokenizer.State flush(StringBuilder chunk, HtmlTokenizer.State state,
                                             String file, List<Token> out) {
        if (chunk.isEmpty()) return state;
        HtmlTokenizer.Result r = HtmlTokenizer.tokenize(chunk.toString(), state, file);
        out.addAll(r.tokens());
        chunk.setLength(0);
        return r.end();
    }
}
