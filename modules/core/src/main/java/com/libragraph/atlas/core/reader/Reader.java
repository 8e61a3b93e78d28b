package com.libragraph.atlas.core.reader;

import com.libragraph.atlas.formats.api.Batch;
import com.libragraph.atlas.formats.api.DecodeException;
import com.libragraph.atlas.formats.api.DecoderContext;
import com.libragraph.atlas.formats.api.DecoderFactory;
import com.libragraph.atlas.formats.api.DecoderWorker;
import com.libragraph.atlas.formats.api.Header;
import com.libragraph.atlas.formats.api.InputFile;
import com.libragraph.atlas.formats.registry.DecoderRegistry;
import com.libragraph.atlas.types.EntityKind;
import com.libragraph.atlas.util.channel.AsyncResult;
import com.libragraph.atlas.util.channel.BlockingChannel;
import com.libragraph.atlas.util.channel.Chunk;
import com.libragraph.atlas.util.channel.OneShot;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One decoding run over one input file.
 * <p>
 * Construction resolves the decoder for the file's format and starts it on its
 * own thread. Raw chunks go in through {@link #input()}, finished with
 * {@link Chunk#END}; decoded batches come out of {@link #read()} until the end
 * batch. Decoder failures surface as {@link DecodeException} from
 * {@link #header()} and {@link #read()}.
 */
public class Reader implements AutoCloseable {

    private static final Logger log = Logger.getLogger(Reader.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger();

    private final InputFile file;
    private final ReaderConfig config;
    private final String threadName;
    private final BlockingChannel<Chunk> input;
    private final BlockingChannel<AsyncResult<Batch>> output;
    private final OneShot<Header> header = new OneShot<>();
    private final Thread worker;
    // guards feeder and closed; read() holds the reader's own monitor while waiting
    private final Object feederLock = new Object();

    private StreamChunkFeeder feeder;
    private boolean closed;
    private boolean streamEnded;

    public Reader(InputFile file) {
        this(file, EntityKind.all());
    }

    public Reader(InputFile file, Set<EntityKind> readTypes) {
        this(file, readTypes, DecoderRegistry.instance(), ReaderConfig.defaults());
    }

    /**
     * @throws com.libragraph.atlas.formats.registry.UnsupportedFormatException
     *         if no decoder is registered for the file's format; no thread is started
     */
    public Reader(InputFile file, Set<EntityKind> readTypes, DecoderRegistry registry, ReaderConfig config) {
        this.file = file;
        this.config = config;
        DecoderFactory factory = registry.resolve(file);

        this.threadName = config.threadNamePrefix() + "-" + RUN_COUNTER.incrementAndGet();
        this.input = BlockingChannel.bounded(threadName + "-input", config.inputQueueCapacity());
        this.output = BlockingChannel.bounded(threadName + "-output", config.outputQueueCapacity());

        DecoderContext context = new DecoderContext(input, output, header, readTypes);
        DecoderWorker decoderWorker = DecoderWorker.create(threadName, factory, context);

        this.worker = new Thread(decoderWorker, threadName);
        worker.setDaemon(true);
        worker.start();
        log.infof("Reading %s as %s on %s", file.filename(), file.format().label(), threadName);
    }

    /**
     * Opens a file on disk, guessing its format from the name, and feeds its
     * bytes to the decoder on a separate thread.
     */
    public static Reader open(Path path) throws IOException {
        return open(path, EntityKind.all());
    }

    public static Reader open(Path path, Set<EntityKind> readTypes) throws IOException {
        Reader reader = new Reader(InputFile.of(path.getFileName().toString()), readTypes);
        try {
            reader.feedFrom(Files.newInputStream(path));
        } catch (IOException | RuntimeException e) {
            reader.abandon();
            throw e;
        }
        return reader;
    }

    public InputFile file() {
        return file;
    }

    /**
     * Channel the producer puts raw chunks on. The producer must finish with
     * {@link Chunk#END}, otherwise the decoder waits forever.
     */
    public BlockingChannel<Chunk> input() {
        return input;
    }

    /**
     * Starts a feeder thread reading the stream into {@link #input()}. The
     * feeder owns the stream and closes it. {@link #close()} stops it.
     */
    public StreamChunkFeeder feedFrom(InputStream in) {
        synchronized (feederLock) {
            if (closed) {
                throw new IllegalStateException("Reader of " + file.filename() + " is closed");
            }
            if (feeder != null) {
                throw new IllegalStateException("Input of " + file.filename() + " is already being fed");
            }
            feeder = new StreamChunkFeeder(in, input, config.chunkSize());
            Thread thread = new Thread(feeder, threadName + "-feeder");
            thread.setDaemon(true);
            thread.start();
            return feeder;
        }
    }

    /**
     * Blocks until the decoder has seen the header. A file named as a history
     * file always reports multiple object versions.
     *
     * @throws DecodeException if the decoder failed before the header was known
     */
    public Header header() throws InterruptedException {
        Header value;
        try {
            value = header.await();
        } catch (ExecutionException e) {
            throw asDecodeException(e.getCause());
        }
        if (file.history() && !value.multipleObjectVersions()) {
            return value.withMultipleObjectVersions(true);
        }
        return value;
    }

    /**
     * The raw header result as resolved by the decoder, without the history hint.
     */
    public AsyncResult<Header> headerResult() {
        return header;
    }

    /**
     * Next decoded batch. Once the end batch was returned, every further call
     * returns it again without blocking.
     *
     * @throws DecodeException if the decoder failed; the following call returns the end batch
     */
    public synchronized Batch read() throws InterruptedException {
        if (streamEnded) {
            return Batch.end();
        }
        AsyncResult<Batch> result = output.take();
        try {
            Batch batch = result.await();
            if (batch.isEnd()) {
                streamEnded = true;
                log.debugf("Reached end of %s", file.filename());
            }
            return batch;
        } catch (ExecutionException e) {
            throw asDecodeException(e.getCause());
        }
    }

    /**
     * Iterates the remaining batches, excluding the end batch.
     */
    public Iterator<Batch> batches() {
        return new Iterator<>() {
            private Batch next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    try {
                        next = read();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new DecodeException("Interrupted while reading " + file.filename(), e);
                    }
                }
                return !next.isEnd();
            }

            @Override
            public Batch next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Batch batch = next;
                next = null;
                return batch;
            }
        };
    }

    public boolean isDone() {
        return !worker.isAlive();
    }

    /**
     * Stops the feeder if there is one, discards undelivered batches up to the
     * end batch and waits for the decoder thread. A producer feeding
     * {@link #input()} directly must still finish with {@link Chunk#END}.
     * <p>
     * The feeder is stopped even while another thread is blocked in {@link #read()}.
     */
    @Override
    public void close() throws InterruptedException {
        StreamChunkFeeder running;
        synchronized (feederLock) {
            if (closed) {
                return;
            }
            closed = true;
            running = feeder;
        }
        if (running != null) {
            running.stop();
        }
        int discarded = discardUntilEnd();
        worker.join();
        if (discarded > 0) {
            log.debugf("Discarded %d undelivered result(s) of %s", discarded, file.filename());
        }
        log.infof("Closed reader of %s", file.filename());
    }

    private synchronized int discardUntilEnd() throws InterruptedException {
        int discarded = 0;
        while (!streamEnded) {
            if (isEndMarker(output.take())) {
                streamEnded = true;
            } else {
                discarded++;
            }
        }
        return discarded;
    }

    // Lets the decoder finish when opening the input failed after construction.
    private void abandon() {
        try {
            input.put(Chunk.END);
            close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warnf("Interrupted while abandoning reader of %s", file.filename());
        }
    }

    private static boolean isEndMarker(AsyncResult<Batch> result) throws InterruptedException {
        if (result.isFailed()) {
            return false;
        }
        try {
            return result.await().isEnd();
        } catch (ExecutionException e) {
            return false;
        }
    }

    private static DecodeException asDecodeException(Throwable cause) {
        if (cause instanceof DecodeException de) {
            return de;
        }
        return new DecodeException("Decoding failed: " + cause.getMessage(), cause);
    }
}
