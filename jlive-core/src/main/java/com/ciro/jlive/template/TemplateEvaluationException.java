package com.ciro.jlive.template;

import com.ciro.jlive.ast.Span;

/**
 * Error al evaluar una expresión contra los assigns (assign inexistente, campo
 * desconocido, operandos inválidos, componente remoto no registrado...).
 */
public class TemplateEvaluationException extends RuntimeException {

    private final String expression;
    private final String file;
    private final Span span;

    public TemplateEvaluationException(String message) {
        this(message, null, null, null, null);
    }

    public TemplateEvaluationException(String message, Throwable cause) {
        this(message, null, null, null, cause);
    }

    public TemplateEvaluationException(String message, String expression, String file, Span span, Throwable cause) {
        super(expression == null ? message
                : (file == null ? "nofile" : file) + ":" + span + ": " + message + " in <%= " + expression + " %>",
                cause);
        this.expression = expression;
        this.file = file;
        this.span = span;
    }

    public String expression() { return expression; }
    public String file() { return file; }
    public Span span() { return span; }
}
