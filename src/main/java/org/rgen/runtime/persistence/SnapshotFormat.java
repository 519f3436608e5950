package org.rgen.runtime.persistence;

import java.util.Locale;

/**
 * The two interchangeable snapshot encodings.
 */
public enum SnapshotFormat {
    /** Pretty-printed JSON, human editable. */
    JSON(".json"),
    /** Length-prefixed binary with a magic header. */
    BINARY(".rgw");

    private final String fileExtension;

    SnapshotFormat(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    /**
     * @param name "json" or "binary", case-insensitive.
     */
    public static SnapshotFormat fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown snapshot format '" + name + "'. Supported: json, binary", e);
        }
    }
}
