package com.ciro.jlive.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tokenizer O(N) del marcado. Lee HTML + componentes + slots en una sola pasada.
 * <p>
 * Es reanudable: el estado final de un fragmento es el estado inicial del siguiente,
 * así {@link LvLexer} puede cortar los marcadores {@code <% %>} por fuera y alimentar
 * el texto de a trozos. Un fragmento solo puede terminar en TEXT, COMMENT o RAW_TEXT;
 * cortar dentro de un tag es un error.
 */
public final class HtmlTokenizer {

    public enum Mode { TEXT, TAG_OPEN, TAG_NAME, ATTR_NAME, ATTR_VALUE, COMMENT, RAW_TEXT }

    public record State(Mode mode, String rawTag, Span openedAt, int line, int column) {

        public static State initial() {
            return new State(Mode.TEXT, null, null, 1, 1);
        }

        public State at(int line, int column) {
            return new State(mode, rawTag, openedAt, line, column);
        }
    }

    public record Result(List<Token> tokens, State end) {}

    private static final Set<String> VOID_TAGS = Set.of(
            "area", "base", "br", "col", "command", "embed", "hr", "img", "input",
            "keygen", "link", "meta", "param", "source", "track", "wbr");

    // Su contenido no se tokeniza como marcado
    private static final Set<String> RAW_TAGS = Set.of("script", "style");

    private final String src;
    private final String file;
    private final int len;
    private int pos;
    private int line;
    private int col;

    private final List<Token> tokens = new ArrayList<>();
    private final StringBuilder text = new StringBuilder();
    private int textLine;
    private int textCol;

    private HtmlTokenizer(String src, String file, int line, int col) {
        this.src = src == null ? "" : src;
        this.file = file;
        this.len = this.src.length();
        this.line = line;
        this.col = col;
    }

    public static Result tokenize(String source, State start, String file) {
        HtmlTokenizer t = new HtmlTokenizer(source, file, start.line(), start.column());
        State end = t.run(start);
        return new Result(List.copyOf(t.tokens), end);
    }

    /** Valida el estado tras el último fragmento. */
    public static void finish(State state, String file) {
        if (state.mode() == Mode.COMMENT) {
            throw new TemplateCompileException(ErrorKind.UNTERMINATED_COMMENT,
                    "unexpected end of template inside <!-- comment, expected -->", file, state.openedAt());
        }
    }

    public static boolean isVoid(String tagName) {
        return VOID_TAGS.contains(tagName.toLowerCase(Locale.ROOT));
    }

    private State run(State start) {
        if (start.mode() == Mode.COMMENT) {
            if (!consumeComment()) return suspend(Mode.COMMENT, null, start.openedAt());
        } else if (start.mode() == Mode.RAW_TEXT) {
            if (!consumeRawText(start.rawTag())) return suspend(Mode.RAW_TEXT, start.rawTag(), start.openedAt());
        }

        while (pos < len) {
            char c = src.charAt(pos);
            if (c == '<') {
                if (src.startsWith("<!--", pos)) {
                    Span opened = here();
                    appendText("<!--");
                    if (!consumeComment()) return suspend(Mode.COMMENT, null, opened);
                    continue;
                }
                if (src.startsWith("<!", pos)) {
                    // doctype y similares: texto literal hasta '>'
                    int end = src.indexOf('>', pos);
                    if (end < 0) {
                        throw new TemplateCompileException(ErrorKind.UNTERMINATED_TAG,
                                "expected closing `>` for <!", file, here());
                    }
                    appendText(src.substring(pos, end + 1));
                    continue;
                }
                if (src.startsWith("</", pos)) {
                    flushText();
                    readCloseTag();
                    continue;
                }
                if (pos + 1 < len && isTagStart(src.charAt(pos + 1))) {
                    flushText();
                    Token.TagOpen open = readOpenTag();
                    tokens.add(open);
                    String lower = open.name().toLowerCase(Locale.ROOT);
                    if (open.kind() == TagKind.ELEMENT && !open.selfClose() && RAW_TAGS.contains(lower)) {
                        if (!consumeRawText(lower)) return suspend(Mode.RAW_TEXT, lower, open.span());
                    }
                    continue;
                }
            }
            markText();
            text.append(next());
        }

        flushText();
        return new State(Mode.TEXT, null, null, line, col);
    }

    private State suspend(Mode mode, String rawTag, Span opened) {
        flushText();
        return new State(mode, rawTag, opened, line, col);
    }

    // ------------------------------------------------------------------
    // Comentarios y texto crudo
    // ------------------------------------------------------------------

    private boolean consumeComment() {
        int end = src.indexOf("-->", pos);
        if (end < 0) {
            appendText(src.substring(pos));
            return false;
        }
        appendText(src.substring(pos, end + 3));
        return true;
    }

    /** Consume hasta {@code </tag} (sin incluirlo). false si el fragmento se acabó antes. */
    private boolean consumeRawText(String tag) {
        String close = "</" + tag;
        int end = -1;
        for (int i = pos; i + close.length() <= len; i++) {
            if (src.regionMatches(true, i, close, 0, close.length())) {
                end = i;
                break;
            }
        }
        if (end < 0) {
            appendText(src.substring(pos));
            return false;
        }
        appendText(src.substring(pos, end));
        flushText();
        return true;
    }

    // ------------------------------------------------------------------
    // Tags
    // ------------------------------------------------------------------

    private void readCloseTag() {
        Span start = here();
        next();
        next();
        String name = readTagName(start, "");
        skipWhitespace();
        if (pos >= len) throw unterminated(start, "/" + name);
        if (src.charAt(pos) != '>') throw invalidChar(src.charAt(pos));
        next();
        tokens.add(new Token.TagClose(name, start.to(line, col)));
    }

    private Token.TagOpen readOpenTag() {
        Span start = here();
        next(); // '<'
        String name = readTagName(start, "");
        List<Attr> attrs = new ArrayList<>();
        boolean selfClose = false;

        // Mode.TAG_OPEN: entre atributos
        while (true) {
            skipWhitespace();
            if (pos >= len) throw unterminated(start, name);
            char c = src.charAt(pos);
            if (c == '>') {
                next();
                break;
            }
            if (c == '/') {
                next();
                if (pos >= len) throw unterminated(start, name);
                if (src.charAt(pos) == '>') {
                    next();
                    selfClose = true;
                    break;
                }
                throw invalidChar('/');
            }
            if (c == '{') {
                Span attrSpan = here();
                String code = readBraced(start, name);
                attrs.add(Attr.spread(code, attrSpan.to(line, col)));
                continue;
            }
            attrs.add(readAttr(start, name));
        }

        return new Token.TagOpen(name, TagKind.classify(name), attrs, start.to(line, col), selfClose);
    }

    // Mode.TAG_NAME
    private String readTagName(Span start, String prefix) {
        StringBuilder sb = new StringBuilder(prefix);
        while (true) {
            if (pos >= len) throw unterminated(start, sb.toString());
            char c = src.charAt(pos);
            if (Character.isWhitespace(c) || c == '/' || c == '>') break;
            if (!isNameChar(c)) throw invalidChar(c);
            sb.append(next());
        }
        if (sb.isEmpty()) {
            throw new TemplateCompileException(ErrorKind.INVALID_CHARACTER_IN_NAME,
                    "expected tag name", file, here());
        }
        return sb.toString();
    }

    // Mode.ATTR_NAME -> Mode.ATTR_VALUE
    private Attr readAttr(Span tagStart, String tagName) {
        Span attrStart = here();
        StringBuilder name = new StringBuilder();
        while (true) {
            if (pos >= len) throw unterminated(tagStart, tagName);
            char c = src.charAt(pos);
            if (Character.isWhitespace(c) || c == '=' || c == '>' || c == '/') break;
            if ("\"'<{}`".indexOf(c) >= 0) throw invalidChar(c);
            name.append(next());
        }
        if (name.isEmpty()) throw invalidChar(src.charAt(pos));

        skipWhitespace();
        if (pos >= len || src.charAt(pos) != '=') {
            return new Attr(name.toString(), AttrValue.PRESENCE, attrStart.to(line, col));
        }
        next(); // '='
        skipWhitespace();
        if (pos >= len) throw unterminated(tagStart, tagName);

        char q = src.charAt(pos);
        AttrValue value;
        if (q == '"' || q == '\'') {
            next();
            int end = src.indexOf(q, pos);
            if (end < 0) throw unterminated(tagStart, tagName);
            String literal = src.substring(pos, end);
            while (pos <= end) next();
            value = new AttrValue.Literal(literal, q);
        } else if (q == '{') {
            Span valueSpan = here();
            String code = readBraced(tagStart, tagName);
            value = new AttrValue.Expression(code, valueSpan);
        } else {
            throw new TemplateCompileException(ErrorKind.INVALID_ATTRIBUTE_VALUE,
                    "invalid attribute value after `=`. Expected either a value between quotes "
                            + "(such as \"value\" or 'value') or an expression between curly braces (such as {value})",
                    file, here());
        }
        return new Attr(name.toString(), value, attrStart.to(line, col));
    }

    /** Lee {@code {...}} respetando llaves anidadas y strings. Devuelve el código sin llaves. */
    private String readBraced(Span tagStart, String tagName) {
        next(); // '{'
        StringBuilder sb = new StringBuilder();
        int depth = 1;
        while (true) {
            if (pos >= len) {
                throw new TemplateCompileException(ErrorKind.UNTERMINATED_TAG,
                        "expected closing `}` for expression in <" + tagName + ">", file, tagStart);
            }
            char c = next();
            if (c == '"' || c == '\'') {
                sb.append(c);
                while (pos < len && src.charAt(pos) != c) {
                    char s = next();
                    sb.append(s);
                    if (s == '\\' && pos < len) sb.append(next());
                }
                if (pos < len) sb.append(next());
                continue;
            }
            if (c == '{') depth++;
            if (c == '}' && --depth == 0) break;
            sb.append(c);
        }
        return sb.toString().trim();
    }

    // ------------------------------------------------------------------
    // Cursor
    // ------------------------------------------------------------------

    private char next() {
        char c = src.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private void skipWhitespace() {
        while (pos < len && Character.isWhitespace(src.charAt(pos))) next();
    }

    private Span here() {
        return Span.at(line, col);
    }

    private void markText() {
        if (text.isEmpty()) {
            textLine = line;
            textCol = col;
        }
    }

    private void appendText(String s) {
        markText();
        for (int i = 0; i < s.length(); i++) text.append(next());
    }

    private void flushText() {
        if (!text.isEmpty()) {
            tokens.add(new Token.Text(text.toString(), new Span(textLine, textCol, line, col)));
            text.setLength(0);
        }
    }

    private static boolean isTagStart(char c) {
        return Character.isLetter(c) || c == '.' || c == ':';
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.' || c == ':';
    }

    private TemplateCompileException unterminated(Span start, String name) {
        return new TemplateCompileException(ErrorKind.UNTERMINATED_TAG,
                "expected closing `>` for tag <" + name + ">", file, start);
    }

    private TemplateCompileException invalidChar(char c) {
        return new TemplateCompileException(ErrorKind.INVALID_CHARACTER_IN_NAME,
                "invalid character '" + c + "' in tag or attribute name", file, here());
    }
}
