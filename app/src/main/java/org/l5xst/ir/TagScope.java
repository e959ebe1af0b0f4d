package org.l5xst.ir;

import java.util.*;

/**
 * Declared tags and add-on instructions visible to a translator, looked up case-insensitively.
 */
public final class TagScope {
    private final Map<String, String> types = new HashMap<>();
    private final Map<String, IR.Function> addOns = new HashMap<>();

    public TagScope(List<IR.Var> vars, List<IR.Function> functions) {
        for (var v : vars) {
            types.putIfAbsent(key(v.name()), v.type());
        }
        for (var f : functions) {
            addOns.putIfAbsent(key(f.name()), f);
        }
    }

    /** Type of the tag a path starts with. */
    public Optional<String> typeOf(String path) {
        return Optional.ofNullable(types.get(key(IR.Ref.parse(path).root())));
    }

    public boolean isDeclared(String name) {
        return types.containsKey(key(name)) || addOns.containsKey(key(name));
    }

    public Optional<IR.Function> addOn(String name) {
        return Optional.ofNullable(addOns.get(key(name)));
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
