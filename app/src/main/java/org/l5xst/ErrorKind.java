package org.l5xst;

/**
 * Failure classes a conversion can run into.
 * Recoverable kinds are collected as {@link Diagnostic}s, fatal ones abort the conversion.
 */
public enum ErrorKind {
    UNSUPPORTED_INSTRUCTION("E101", true),
    STRUCTURAL_CYCLE("E102", true),
    TYPE_MISMATCH("E103", true),
    UNDECLARED_REFERENCE("E104", true),
    NAME_COLLISION_UNRESOLVABLE("E201", false),
    MALFORMED_SOURCE_TREE("E301", false),
    MALFORMED_ST_SYNTAX("E302", false);

    private final String code;
    private final boolean recoverable;

    ErrorKind(String code, boolean recoverable) {
        this.code = code;
        this.recoverable = recoverable;
    }

    public String code() {
        return code;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
