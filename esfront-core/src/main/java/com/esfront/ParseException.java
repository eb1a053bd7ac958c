package com.esfront;

/**
 * Syntax error raised by the parser. Carries the error kind, the offending
 * span and, when known, the line/column where it starts.
 */
public class ParseException extends RuntimeException {
    private final SyntaxError kind;
    private final Span span;
    private final String context;
    private final SourceLocation.Position position;

    public ParseException(SyntaxError kind, Span span, SourceLocation.Position position, String context, String message) {
        super(formatMessage(kind, position, context, message));
        this.kind = kind;
        this.span = span;
        this.context = context;
        this.position = position;
    }

    public ParseException(SyntaxError kind, Span span) {
        this(kind, span, null, null, null);
    }

    private static String formatMessage(SyntaxError kind, SourceLocation.Position position, String context, String message) {
        StringBuilder sb = new StringBuilder("SyntaxError: ");
        sb.append(message != null ? message : kind.message());
        if (context != null) {
            sb.append(" in ").append(context);
        }
        if (position != null) {
            sb.append(" (").append(position).append(')');
        }
        return sb.toString();
    }

    public SyntaxError kind() {
        return kind;
    }

    public Span span() {
        return span;
    }

    /** The construct being parsed when the error occurred, or null. */
    public String context() {
        return context;
    }

    /** Line/column of the span start, or null when the source was not indexed. */
    public SourceLocation.Position position() {
        return position;
    }
}
