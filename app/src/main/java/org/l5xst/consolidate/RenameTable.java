package org.l5xst.consolidate;

import java.util.*;

import org.l5xst.ConversionException;
import org.l5xst.ErrorKind;
import org.l5xst.tables.ReservedWords;

/**
 * Global identifier assignment for a consolidation run.
 *
 * <p>Filled by one {@link Builder} in a fixed order, read-only afterwards. Lookups ignore case,
 * since ST identifiers do.
 */
public final class RenameTable {
    public enum KIND { TYPE, FUNCTION, VAR }

    /** An identifier as declared in one program unit. Units count from 1. */
    public record Key(int unit, KIND kind, String name) {
        public Key {
            name = name.toLowerCase(Locale.ROOT);
        }
    }

    private final Map<Key, String> names;

    private RenameTable(Map<Key, String> names) {
        this.names = Collections.unmodifiableMap(new LinkedHashMap<>(names));
    }

    public Optional<String> lookup(int unit, KIND kind, String name) {
        return Optional.ofNullable(names.get(new Key(unit, kind, name)));
    }

    /** Every assignment, in claim order. */
    public Map<Key, String> entries() {
        return names;
    }

    public static final class Builder {
        private final ReservedWords reserved;
        private final int maxAttempts;
        private final Map<Key, String> names = new LinkedHashMap<>();
        private final Set<String> taken = new HashSet<>();

        public Builder(ReservedWords reserved, int maxAttempts) {
            this.reserved = reserved;
            this.maxAttempts = maxAttempts;
            ReservedWords.keywords().forEach(this::reserve);
        }

        /** Makes {@code name} unavailable without assigning it to anything. */
        public Builder reserve(String name) {
            taken.add(name.toLowerCase(Locale.ROOT));
            return this;
        }

        public boolean isTaken(String name) {
            return taken.contains(name.toLowerCase(Locale.ROOT));
        }

        /**
         * Assigns {@code name} of {@code unit} a free identifier: its reserved-word replacement,
         * then {@code <name>_<unit>}, then {@code <name>_<unit>_<n>}.
         */
        public String claim(int unit, KIND kind, String name) {
            var key = new Key(unit, kind, name);
            var existing = names.get(key);
            if (existing != null) {
                return existing;
            }
            var base = reserved.rename(name);
            var candidate = base;
            if (isTaken(candidate)) {
                candidate = base + "_" + unit;
                int attempt = 1;
                while (isTaken(candidate)) {
                    attempt++;
                    if (attempt > maxAttempts) {
                        throw new ConversionException(
                            ErrorKind.NAME_COLLISION_UNRESOLVABLE, "unit " + unit,
                            "no free name for " + kind.name().toLowerCase(Locale.ROOT) + " " + name
                                + " after " + maxAttempts + " attempts",
                            "raise maxRenameAttempts or rename the tag in the source project"
                        );
                    }
                    candidate = base + "_" + unit + "_" + attempt;
                }
            }
            return assign(key, candidate);
        }

        /** Maps {@code name} of {@code unit} onto an identifier another unit already claimed. */
        public String share(int unit, KIND kind, String name, String assigned) {
            return assign(new Key(unit, kind, name), assigned);
        }

        private String assign(Key key, String assigned) {
            names.put(key, assigned);
            reserve(assigned);
            return assigned;
        }

        public RenameTable build() {
            return new RenameTable(names);
        }
    }
}
