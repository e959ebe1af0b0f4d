package org.l5xst.tables;

import java.util.*;

/**
 * Identifiers a source tag may not keep in ST, and what they become instead.
 */
public final class ReservedWords {
    static final Set<String> KEYWORDS = Set.of(
        "TYPE", "END_TYPE", "STRUCT", "END_STRUCT", "FUNCTION", "END_FUNCTION",
        "FUNCTION_BLOCK", "END_FUNCTION_BLOCK", "PROGRAM", "END_PROGRAM",
        "CONFIGURATION", "END_CONFIGURATION", "RESOURCE", "END_RESOURCE", "TASK", "ON", "WITH",
        "VAR", "VAR_INPUT", "VAR_OUTPUT", "VAR_IN_OUT", "VAR_GLOBAL", "VAR_EXTERNAL", "VAR_TEMP", "END_VAR",
        "ARRAY", "OF", "IF", "THEN", "ELSIF", "ELSE", "END_IF", "CASE", "END_CASE",
        "FOR", "TO", "BY", "DO", "END_FOR", "WHILE", "END_WHILE", "REPEAT", "UNTIL", "END_REPEAT",
        "EXIT", "RETURN", "AND", "OR", "XOR", "NOT", "MOD", "TRUE", "FALSE",
        "BOOL", "SINT", "INT", "DINT", "LINT", "USINT", "UINT", "UDINT", "ULINT",
        "REAL", "LREAL", "BYTE", "WORD", "DWORD", "LWORD", "TIME", "STRING",
        "TON", "TOF", "TP", "CTU", "CTD", "CTUD", "R_TRIG", "F_TRIG", "SR", "RS", "SEL", "SQRT", "ABS",
        "EN", "ENO"
    );

    private final Map<String, String> explicit;

    public ReservedWords(Map<String, String> explicit) {
        this.explicit = new LinkedHashMap<>(explicit);
    }

    /** Upper-case language keywords and standard function and block names. */
    public static Set<String> keywords() {
        return KEYWORDS;
    }

    public boolean isReserved(String name) {
        var upper = name.toUpperCase(Locale.ROOT);
        return KEYWORDS.contains(upper)
            || AuxTemplate.declaredNames().contains(upper)
            || explicitFor(name).isPresent();
    }

    /**
     * Replacement for {@code name}: the configured one if any, otherwise {@code name + "1"}
     * for a reserved word, otherwise {@code name} itself.
     */
    public String rename(String name) {
        var configured = explicitFor(name);
        if (configured.isPresent()) {
            return configured.get();
        }
        return isReserved(name) ? name + "1" : name;
    }

    private Optional<String> explicitFor(String name) {
        var exact = explicit.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (var entry : explicit.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }
}
