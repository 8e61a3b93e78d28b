package com.libragraph.atlas.types;

/**
 * Declared encoding of an input file. The label is the display name used in
 * diagnostics.
 */
public enum FormatId {
    UNKNOWN(0, "UNKNOWN"),
    XML(1, "XML"),
    PBF(2, "PBF"),
    OPL(3, "OPL"),
    JSON(4, "JSON"),
    O5M(5, "O5M"),
    DEBUG(6, "DEBUG"),
    BLACKHOLE(7, "BLACKHOLE");

    private final int id;
    private final String label;

    FormatId(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static FormatId fromId(int id) {
        for (FormatId f : values()) {
            if (f.id == id) return f;
        }
        throw new IllegalArgumentException("Unknown FormatId id: " + id);
    }

    /**
     * Looks up a format by its label, ignoring case. Unknown labels map to {@link #UNKNOWN}.
     */
    public static FormatId fromLabel(String label) {
        for (FormatId f : values()) {
            if (f.label.equalsIgnoreCase(label)) return f;
        }
        return UNKNOWN;
    }
}
