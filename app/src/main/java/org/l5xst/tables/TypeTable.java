package org.l5xst.tables;

import java.util.*;

/**
 * Data type names of the vendor format and their ST counterparts.
 */
public final class TypeTable {
    private TypeTable() {}

    /** Vendor types without an ST type of the same name. */
    public enum VendorType {
        BIT("BOOL"),
        TIMER("TON"),
        COUNTER("CTU"),
        FBD_TIMER("TON"),
        FBD_COUNTER("CTUD");

        private final String stType;

        VendorType(String stType) {
            this.stType = stType;
        }

        public String stType() {
            return stType;
        }
    }

    private static final Set<String> INTEGERS = Set.of("SINT", "INT", "DINT", "LINT", "USINT", "UINT", "UDINT", "ULINT");
    private static final Set<String> REALS = Set.of("REAL", "LREAL");
    private static final Set<String> ELEMENTARY = Set.of(
        "BOOL", "SINT", "INT", "DINT", "LINT", "USINT", "UINT", "UDINT", "ULINT",
        "REAL", "LREAL", "BYTE", "WORD", "DWORD", "LWORD", "TIME", "STRING"
    );

    public static String toSt(String vendorType) {
        for (var t : VendorType.values()) {
            if (t.name().equalsIgnoreCase(vendorType)) {
                return t.stType();
            }
        }
        return vendorType;
    }

    public static String toSource(String stType) {
        switch (stType.toUpperCase(Locale.ROOT)) {
            case "TON", "TOF", "TONR":
                return VendorType.TIMER.name();
            case "CTU", "CTD":
                return VendorType.COUNTER.name();
            case "CTUD":
                return VendorType.FBD_COUNTER.name();
            default:
                return stType;
        }
    }

    /** Whether a tag of this vendor type may be retyped to whichever timer or counter block drives it. */
    public static boolean isGenericFunctionBlock(String stType) {
        return switch (stType.toUpperCase(Locale.ROOT)) {
            case "TON", "TOF", "TONR", "CTU", "CTD", "CTUD" -> true;
            default -> false;
        };
    }

    /**
     * Backing-tag types of diagram operator blocks ({@code FBD_MATH}, {@code SELECT}, ...). Their
     * results live in plain variables in ST, so an unused tag of such a type can go.
     */
    public static boolean isBlockStorage(String stType) {
        var upper = stType.toUpperCase(Locale.ROOT);
        return (upper.startsWith("FBD_") || upper.equals("SELECT")) && AuxTemplate.forStruct(stType).isEmpty();
    }

    public static boolean isInteger(String type) {
        return INTEGERS.contains(type.toUpperCase(Locale.ROOT));
    }

    public static boolean isReal(String type) {
        return REALS.contains(type.toUpperCase(Locale.ROOT));
    }

    public static boolean isElementary(String type) {
        return ELEMENTARY.contains(type.toUpperCase(Locale.ROOT));
    }

    /** Default value text for a fresh variable of {@code type}. */
    public static String defaultValue(String type) {
        if (type.equalsIgnoreCase("BOOL")) return "FALSE";
        if (isReal(type)) return "0.0";
        return "0";
    }
}
