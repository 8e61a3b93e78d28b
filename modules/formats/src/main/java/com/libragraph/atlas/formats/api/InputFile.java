package com.libragraph.atlas.formats.api;

import com.libragraph.atlas.types.FormatId;

import java.util.Locale;
import java.util.Objects;

/**
 * Describes a file to be decoded: its name and declared format.
 *
 * @param filename display name used in diagnostics
 * @param format   declared encoding
 * @param history  true for history and change files, whose streams may hold several
 *                 versions of one object
 */
public record InputFile(
        String filename,
        FormatId format,
        boolean history
) {
    public InputFile {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(format, "format");
    }

    public static InputFile of(String filename, FormatId format) {
        return new InputFile(filename, format, false);
    }

    /**
     * Derives the format from the filename suffix. Compression suffixes
     * ({@code .gz}, {@code .bz2}) are skipped. Unknown suffixes give
     * {@link FormatId#UNKNOWN}.
     */
    public static InputFile of(String filename) {
        String name = filename.toLowerCase(Locale.ROOT);
        if (name.endsWith(".gz")) {
            name = name.substring(0, name.length() - 3);
        } else if (name.endsWith(".bz2")) {
            name = name.substring(0, name.length() - 4);
        }

        int dotIndex = name.lastIndexOf('.');
        String ext = dotIndex >= 0 ? name.substring(dotIndex + 1) : "";

        return switch (ext) {
            case "opl" -> new InputFile(filename, FormatId.OPL, false);
            case "osm" -> new InputFile(filename, FormatId.XML, false);
            case "osh", "osc" -> new InputFile(filename, FormatId.XML, true);
            case "pbf" -> new InputFile(filename, FormatId.PBF, name.endsWith(".osh.pbf"));
            case "o5m" -> new InputFile(filename, FormatId.O5M, false);
            case "o5c" -> new InputFile(filename, FormatId.O5M, true);
            case "json", "geojson" -> new InputFile(filename, FormatId.JSON, false);
            case "debug" -> new InputFile(filename, FormatId.DEBUG, false);
            default -> new InputFile(filename, FormatId.UNKNOWN, false);
        };
    }

    public InputFile withHistory(boolean history) {
        return new InputFile(filename, format, history);
    }
}
