package org.l5xst;

/**
 * One recoverable problem found while converting, attached to the output as a comment.
 */
public record Diagnostic(ErrorKind kind, String location, String message) {
    public static Diagnostic of(ErrorKind kind, String location, String message) {
        return new Diagnostic(kind, location, message);
    }

    /** Single-line form used in comment blocks and CLI summaries. */
    public String summary() {
        return kind.code() + " " + location + ": " + message;
    }
}
