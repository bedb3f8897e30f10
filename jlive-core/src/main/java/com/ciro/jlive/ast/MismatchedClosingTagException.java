package com.ciro.jlive.ast;

public class MismatchedClosingTagException extends TemplateCompileException {

    private final String expected;
    private final String found;
    private final Span openSpan;
    private final Span closeSpan;

    public MismatchedClosingTagException(String expected, String found, String file, Span openSpan, Span closeSpan) {
        super(ErrorKind.MISMATCHED_CLOSING_TAG,
              "unmatched closing tag. Expected </" + expected + "> for <" + expected
                      + "> at line " + openSpan.line() + ", got: </" + found + ">",
              file, closeSpan);
        this.expected = expected;
        this.found = found;
        this.openSpan = openSpan;
        this.closeSpan = closeSpan;
    }

    public String expected() { return expected; }
    public String found() { return found; }
    public Span openSpan() { return openSpan; }
    public Span closeSpan() { return closeSpan; }
}
