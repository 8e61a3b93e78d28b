package com.libragraph.atlas.core.reader;

import com.libragraph.atlas.util.channel.BlockingChannel;
import com.libragraph.atlas.util.channel.Chunk;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;

/**
 * Producer that slices an {@link InputStream} into chunks and puts them on a
 * channel, always finishing with {@link Chunk#END}: at end of stream, after
 * {@link #stop()}, and after a read failure.
 * <p>
 * The feeder owns the stream and closes it when done.
 */
public class StreamChunkFeeder implements Runnable {

    private static final Logger log = Logger.getLogger(StreamChunkFeeder.class);

    private final InputStream in;
    private final BlockingChannel<Chunk> target;
    private final int chunkSize;

    private volatile boolean stopped;
    private volatile boolean done;
    private volatile IOException failure;
    private volatile long bytesRead;

    public StreamChunkFeeder(InputStream in, BlockingChannel<Chunk> target, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        this.in = in;
        this.target = target;
        this.chunkSize = chunkSize;
    }

    @Override
    public void run() {
        try (InputStream stream = in) {
            byte[] buffer = new byte[chunkSize];
            while (!stopped) {
                int n = stream.readNBytes(buffer, 0, chunkSize);
                if (n == 0) {
                    break;
                }
                target.put(Chunk.copyOf(buffer, 0, n));
                bytesRead += n;
                if (n < chunkSize) {
                    break;
                }
            }
            if (stopped) {
                log.debugf("Feeding stopped after %d bytes", bytesRead);
            }
        } catch (IOException e) {
            failure = e;
            log.errorf(e, "Reading input failed after %d bytes", bytesRead);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warnf("Feeding interrupted after %d bytes", bytesRead);
        } finally {
            sendEnd();
            done = true;
        }
    }

    /**
     * Stops feeding at the next chunk boundary. The end marker is still sent.
     */
    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    public boolean isDone() {
        return done;
    }

    public long bytesRead() {
        return bytesRead;
    }

    /**
     * The read failure that ended feeding early, or null.
     */
    public IOException failure() {
        return failure;
    }

    private void sendEnd() {
        boolean interrupted = Thread.interrupted();
        try {
            target.put(Chunk.END);
        } catch (InterruptedException e) {
            interrupted = true;
            log.error("Interrupted before the end of input could be signalled");
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
