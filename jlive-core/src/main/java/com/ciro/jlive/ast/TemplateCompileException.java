package com.ciro.jlive.ast;

/**
 * Error fatal de compilación: el template no compila y no hay salida parcial.
 */
public class TemplateCompileException extends RuntimeException {

    private final ErrorKind kind;
    private final String file;
    private final Span span;
    private final String description;

    public TemplateCompileException(ErrorKind kind, String description, String file, Span span) {
        super(format(description, file, span));
        this.description = description;
        this.kind = kind;
        this.file = file;
        this.span = span;
    }

    public ErrorKind kind() { return kind; }
    public String file() { return file; }
    public Span span() { return span; }

    /** Mensaje sin el prefijo archivo:línea. */
    public String description() { return description; }

    private static String format(String description, String file, Span span) {
        return (file == null ? "nofile" : file) + ":" + span + ": " + description;
    }
}
