package org.tabula.adapters;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of adapter tags understood by {@link AdapterFactory}.
 */
public enum SourceKind {
    REST("rest"),
    FILE("file"),
    DATABASE("database"),
    XLSX("xlsx"),
    MDB("mdb");

    private final String tag;

    SourceKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<SourceKind> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        String wanted = tag.trim().toLowerCase(Locale.ROOT);
        for (SourceKind kind : values()) {
            if (kind.tag.equals(wanted)) return Optional.of(kind);
        }
        return Optional.empty();
    }
}
