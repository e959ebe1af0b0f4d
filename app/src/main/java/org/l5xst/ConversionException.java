package org.l5xst;

import java.text.MessageFormat;

public class ConversionException extends RuntimeException {
    private final ErrorKind kind;
    private final String location;
    private final String reason;

    public ConversionException(ErrorKind kind, String location, String err, String hint) {
        super(format(kind, location, err, hint));
        this.kind = kind;
        this.location = location;
        this.reason = err;
    }

    public ConversionException(ErrorKind kind, String location, String err, String hint, Throwable cause) {
        super(format(kind, location, err, hint), cause);
        this.kind = kind;
        this.location = location;
        this.reason = err;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String location() {
        return location;
    }

    /** The failure text without code, location or hint. */
    public String reason() {
        return reason;
    }

    public Diagnostic toDiagnostic() {
        return new Diagnostic(kind, location, reason);
    }

    private static String format(ErrorKind kind, String location, String err, String hint) {
        return MessageFormat.format("""
[{0}] {1}
> At {2} failure: {3}.
> Hint: {4}""",
            kind.code(), kind, location, err, hint
        );
    }
}
