package com.libragraph.atlas.formats.opl;

import com.libragraph.atlas.formats.api.Bounds;
import com.libragraph.atlas.formats.api.Changeset;
import com.libragraph.atlas.formats.api.DecodeException;
import com.libragraph.atlas.formats.api.Entity;
import com.libragraph.atlas.formats.api.Metadata;
import com.libragraph.atlas.formats.api.Node;
import com.libragraph.atlas.formats.api.Relation;
import com.libragraph.atlas.formats.api.Way;
import com.libragraph.atlas.types.EntityKind;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses single OPL lines.
 * <p>
 * A line starts with the object type letter immediately followed by the id, then
 * space-separated fields, each introduced by one letter:
 * <pre>
 * n17 v3 dV c42 t2015-01-01T00:00:00Z i7 uanna Tamenity=pub x8.5 y47.3
 * w5 v1 dV c1 t i0 u Thighway=residential Nn1,n2,n3
 * r9 v2 dV c9 t i0 u Ttype=route Mw5@,n17@stop
 * c42 k3 s2015-01-01T00:00:00Z e2015-01-01T01:00:00Z d0 i7 uanna x8.4 y47.2 X8.6 Y47.4 Tcomment=fix
 * </pre>
 * Strings escape space, comma, equals, at sign, percent and non-printable characters
 * as {@code %<hex codepoint>%}.
 */
public class OplParser {

    /**
     * Parses one non-empty, non-comment line.
     *
     * @throws DecodeException if the line is malformed; the message names the line number
     */
    public Entity parse(String line, long lineNumber) {
        try {
            return parseLine(line);
        } catch (DecodeException e) {
            throw new DecodeException("OPL line " + lineNumber + ": " + e.getMessage(), e);
        }
    }

    /**
     * Kind of the object on the given line, from its first character.
     */
    public static EntityKind kindOf(String line) {
        if (line.isEmpty()) {
            throw new DecodeException("Empty line has no object type");
        }
        try {
            return EntityKind.fromCode(line.charAt(0));
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Unknown object type '" + line.charAt(0) + "'");
        }
    }

    private Entity parseLine(String line) {
        String[] fields = line.split(" ");
        EntityKind kind = kindOf(fields[0]);
        long id = parseLong(fields[0].substring(1), "id");

        Fields f = new Fields();
        for (int i = 1; i < fields.length; i++) {
            String field = fields[i];
            if (field.isEmpty()) {
                continue;
            }
            if (kind == EntityKind.CHANGESET) {
                f.readChangesetField(field.charAt(0), field.substring(1));
            } else {
                f.readObjectField(kind, field.charAt(0), field.substring(1));
            }
        }

        return switch (kind) {
            case NODE -> new Node(id, f.metadata(), f.tags, f.lon, f.lat);
            case WAY -> new Way(id, f.metadata(), f.tags, f.nodeRefs);
            case RELATION -> new Relation(id, f.metadata(), f.tags, f.members);
            case CHANGESET -> new Changeset(id, f.createdAt, f.closedAt, f.numChanges, f.numComments,
                    f.uid, f.user, f.bounds(), f.tags);
        };
    }

    private static final class Fields {
        int version;
        boolean visible = true;
        long changeset;
        Instant timestamp;
        long uid;
        String user = "";
        Map<String, String> tags = Collections.emptyMap();
        double lon = Double.NaN;
        double lat = Double.NaN;
        double maxLon = Double.NaN;
        double maxLat = Double.NaN;
        List<Long> nodeRefs = Collections.emptyList();
        List<Relation.Member> members = Collections.emptyList();
        Instant createdAt;
        Instant closedAt;
        int numChanges;
        int numComments;

        void readObjectField(EntityKind kind, char key, String value) {
            switch (key) {
                case 'v' -> version = parseInt(value, "version");
                case 'd' -> visible = parseVisibility(value);
                case 'c' -> changeset = parseLong(value, "changeset");
                case 't' -> timestamp = parseTimestamp(value);
                case 'i' -> uid = parseLong(value, "uid");
                case 'u' -> user = unescape(value);
                case 'T' -> tags = parseTags(value);
                case 'x' -> requireKind(kind, EntityKind.NODE, key, () -> lon = parseCoordinate(value));
                case 'y' -> requireKind(kind, EntityKind.NODE, key, () -> lat = parseCoordinate(value));
                case 'N' -> requireKind(kind, EntityKind.WAY, key, () -> nodeRefs = parseNodeRefs(value));
                case 'M' -> requireKind(kind, EntityKind.RELATION, key, () -> members = parseMembers(value));
                default -> throw new DecodeException("Unknown field '" + key + "' for " + kind.label());
            }
        }

        void readChangesetField(char key, String value) {
            switch (key) {
                case 'k' -> numChanges = parseInt(value, "num_changes");
                case 's' -> createdAt = parseTimestamp(value);
                case 'e' -> closedAt = parseTimestamp(value);
                case 'd' -> numComments = parseInt(value, "comments_count");
                case 'i' -> uid = parseLong(value, "uid");
                case 'u' -> user = unescape(value);
                case 'T' -> tags = parseTags(value);
                case 'x' -> lon = parseCoordinate(value);
                case 'y' -> lat = parseCoordinate(value);
                case 'X' -> maxLon = parseCoordinate(value);
                case 'Y' -> maxLat = parseCoordinate(value);
                default -> throw new DecodeException("Unknown field '" + key + "' for changeset");
            }
        }

        Metadata metadata() {
            return new Metadata(version, visible, changeset, timestamp, uid, user);
        }

        Bounds bounds() {
            Bounds box = new Bounds(lon, lat, maxLon, maxLat);
            return box.isDefined() ? box : Bounds.undefined();
        }

        private static void requireKind(EntityKind kind, EntityKind expected, char key, Runnable read) {
            if (kind != expected) {
                throw new DecodeException("Field '" + key + "' is only valid for " + expected.label());
            }
            read.run();
        }
    }

    // -- value parsers --

    static long parseLong(String value, String what) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new DecodeException("Invalid " + what + " '" + value + "'");
        }
    }

    static int parseInt(String value, String what) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new DecodeException("Invalid " + what + " '" + value + "'");
        }
    }

    static boolean parseVisibility(String value) {
        return switch (value) {
            case "V" -> true;
            case "D" -> false;
            default -> throw new DecodeException("Invalid visibility '" + value + "'");
        };
    }

    static Instant parseTimestamp(String value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new DecodeException("Invalid timestamp '" + value + "'");
        }
    }

    static double parseCoordinate(String value) {
        if (value.isEmpty()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new DecodeException("Invalid coordinate '" + value + "'");
        }
    }

    static Map<String, String> parseTags(String value) {
        if (value.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> tags = new LinkedHashMap<>();
        for (String pair : value.split(",")) {
            int eq = pair.indexOf('=');
            if (eq < 0) {
                throw new DecodeException("Tag without '=': '" + pair + "'");
            }
            tags.put(unescape(pair.substring(0, eq)), unescape(pair.substring(eq + 1)));
        }
        return tags;
    }

    static List<Long> parseNodeRefs(String value) {
        if (value.isEmpty()) {
            return Collections.emptyList();
        }
        List<Long> refs = new ArrayList<>();
        for (String ref : value.split(",")) {
            if (ref.isEmpty() || ref.charAt(0) != 'n') {
                throw new DecodeException("Invalid node reference '" + ref + "'");
            }
            refs.add(parseLong(ref.substring(1), "node reference"));
        }
        return refs;
    }

    static List<Relation.Member> parseMembers(String value) {
        if (value.isEmpty()) {
            return Collections.emptyList();
        }
        List<Relation.Member> members = new ArrayList<>();
        for (String member : value.split(",")) {
            int at = member.indexOf('@');
            if (member.isEmpty() || at < 0) {
                throw new DecodeException("Invalid member '" + member + "'");
            }
            EntityKind type = kindOf(member);
            if (type == EntityKind.CHANGESET) {
                throw new DecodeException("Changeset cannot be a relation member: '" + member + "'");
            }
            long ref = parseLong(member.substring(1, at), "member reference");
            members.add(new Relation.Member(type, ref, unescape(member.substring(at + 1))));
        }
        return members;
    }

    /**
     * Decodes {@code %<hex codepoint>%} escapes.
     */
    static String unescape(String value) {
        if (value.indexOf('%') < 0) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c != '%') {
                sb.append(c);
                i++;
                continue;
            }
            int end = value.indexOf('%', i + 1);
            if (end < 0 || end == i + 1) {
                throw new DecodeException("Invalid escape sequence in '" + value + "'");
            }
            try {
                sb.appendCodePoint(Integer.parseInt(value.substring(i + 1, end), 16));
            } catch (IllegalArgumentException e) {
                // NumberFormatException is an IllegalArgumentException too
                throw new DecodeException("Invalid escape sequence in '" + value + "'");
            }
            i = end + 1;
        }
        return sb.toString();
    }
}
