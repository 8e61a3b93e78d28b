package com.libragraph.atlas.formats.opl;

import com.libragraph.atlas.formats.api.Batch;
import com.libragraph.atlas.formats.api.DecodeException;
import com.libragraph.atlas.formats.api.Decoder;
import com.libragraph.atlas.formats.api.DecoderContext;
import com.libragraph.atlas.formats.api.Entity;
import com.libragraph.atlas.formats.api.Header;
import com.libragraph.atlas.types.EntityKind;
import com.libragraph.atlas.util.channel.Chunk;
import org.jboss.logging.Logger;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decoder for the line-oriented OPL text format.
 * <p>
 * OPL has no header, so the empty header is resolved before any input is read.
 * Lines may be split across chunks; the unfinished tail of a chunk is carried
 * over to the next one. Every chunk that completes at least one line produces one
 * batch, whose byte size covers all input consumed since the previous batch.
 */
public class OplDecoder implements Decoder {

    private static final Logger log = Logger.getLogger(OplDecoder.class);

    private final DecoderContext context;
    private final OplParser parser = new OplParser();
    private final ByteArrayOutputStream partialLine = new ByteArrayOutputStream();
    private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);

    private long lineNumber;
    private long pendingBytes;

    public OplDecoder(DecoderContext context) {
        this.context = context;
    }

    @Override
    public void run() throws InterruptedException {
        context.resolveHeader(Header.empty());

        if (context.readTypes().isEmpty()) {
            log.debug("No entity kinds requested, not reading OPL input");
            return;
        }

        List<Entity> entities = new ArrayList<>();
        for (Chunk chunk = context.nextChunk(); !chunk.isEnd(); chunk = context.nextChunk()) {
            pendingBytes += chunk.size();
            if (consume(chunk.bytes(), entities)) {
                context.send(Batch.of(entities, pendingBytes));
                entities = new ArrayList<>();
                pendingBytes = 0;
            }
        }

        // last line without a trailing newline
        if (partialLine.size() > 0) {
            parseLine(takePartialLine(), entities);
            context.send(Batch.of(entities, pendingBytes));
        }
        log.debugf("Decoded %d OPL line(s)", lineNumber);
    }

    /**
     * Splits the chunk into lines, parsing every completed one.
     *
     * @return true if at least one line was completed
     */
    private boolean consume(byte[] data, List<Entity> out) {
        boolean completed = false;
        int start = 0;
        for (int i = 0; i < data.length; i++) {
            if (data[i] == '\n') {
                partialLine.write(data, start, i - start);
                parseLine(takePartialLine(), out);
                start = i + 1;
                completed = true;
            }
        }
        partialLine.write(data, start, data.length - start);
        return completed;
    }

    private String takePartialLine() {
        ByteBuffer bytes = ByteBuffer.wrap(partialLine.toByteArray());
        partialLine.reset();
        try {
            return utf8.decode(bytes).toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("OPL line " + (lineNumber + 1) + ": invalid UTF-8", e);
        }
    }

    private void parseLine(String line, List<Entity> out) {
        lineNumber++;
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        if (line.isEmpty() || line.charAt(0) == '#') {
            return;
        }
        EntityKind kind;
        try {
            kind = OplParser.kindOf(line);
        } catch (DecodeException e) {
            throw new DecodeException("OPL line " + lineNumber + ": " + e.getMessage(), e);
        }
        if (!context.wants(kind)) {
            return;
        }
        out.add(parser.parse(line, lineNumber));
    }
}
