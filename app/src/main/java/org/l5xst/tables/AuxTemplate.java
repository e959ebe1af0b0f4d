package org.l5xst.tables;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed ST function templates used where the target has no direct construct.
 * Each template is a function over its own struct type; both are text assets under {@code /templates}.
 */
public enum AuxTemplate {
    SCL("SCALE"),
    ALM("ALARM"),
    SETD("DOMINANT_SET"),
    OSRI("FBD_ONESHOT"),
    MSG("MESSAGE");

    private static final Map<String, String> texts = new ConcurrentHashMap<>();

    private final String structType;

    AuxTemplate(String structType) {
        this.structType = structType;
    }

    public String functionName() {
        return name();
    }

    public String structType() {
        return structType;
    }

    public String functionText() {
        return text(name());
    }

    public String structText() {
        return text(structType);
    }

    public static Optional<AuxTemplate> forFunction(String name) {
        for (var t : values()) {
            if (t.name().equalsIgnoreCase(name)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    public static Optional<AuxTemplate> forStruct(String type) {
        for (var t : values()) {
            if (t.structType.equalsIgnoreCase(type)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    /** Every function and struct name the templates declare. */
    public static Set<String> declaredNames() {
        var names = new LinkedHashSet<String>();
        for (var t : values()) {
            names.add(t.name());
            names.add(t.structType);
        }
        return names;
    }

    private static String text(String asset) {
        return texts.computeIfAbsent(asset, AuxTemplate::load);
    }

    private static String load(String asset) {
        var path = "/templates/" + asset + ".st";
        try (InputStream in = AuxTemplate.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("missing template resource " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new IllegalStateException("cannot read template " + path, e);
        }
    }
}
