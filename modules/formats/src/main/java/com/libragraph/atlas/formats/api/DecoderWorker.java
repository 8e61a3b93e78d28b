package com.libragraph.atlas.formats.api;

import org.jboss.logging.Logger;

import java.util.Objects;

/**
 * Guarded entry point of a decode run, shared by every format. Runs on the
 * dedicated worker thread.
 * <p>
 * Whatever the decoder does, a run ends the same way:
 * <ol>
 *   <li>a failure thrown by the decoder fails the header (if still unresolved) and is
 *       put on the output channel as one failing result</li>
 *   <li>a decoder that returns normally without resolving the header gets
 *       {@link Header#empty()} resolved for it</li>
 *   <li>{@link Batch#end()} is put on the output channel as the last item</li>
 *   <li>if the decoder stopped before the input end marker, the input is drained so a
 *       producer blocked on a full input channel is released</li>
 * </ol>
 * No exception leaves {@link #run()}.
 */
public final class DecoderWorker implements Runnable {

    private static final Logger log = Logger.getLogger(DecoderWorker.class);

    private final String name;
    private final Decoder decoder;
    private final DecoderContext context;

    public DecoderWorker(String name, Decoder decoder, DecoderContext context) {
        this.name = Objects.requireNonNull(name, "name");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.context = Objects.requireNonNull(context, "context");
    }

    public static DecoderWorker create(String name, DecoderFactory factory, DecoderContext context) {
        return new DecoderWorker(name, factory.create(context), context);
    }

    public String name() {
        return name;
    }

    @Override
    public void run() {
        log.debugf("Decoder '%s' started (%s)", name, decoder.getClass().getSimpleName());

        Throwable failure = null;
        try {
            decoder.run();
            if (!context.isHeaderResolved()) {
                context.resolveHeader(Header.empty());
            }
        } catch (Throwable t) {
            failure = t;
            log.errorf(t, "Decoder '%s' failed", name);
        }

        finish(failure);
    }

    private void finish(Throwable failure) {
        // Interrupts are deferred until the end of the stream has been delivered.
        boolean interrupted = Thread.interrupted();
        try {
            if (failure != null) {
                context.failHeader(failure);
                interrupted |= uninterruptibly(() -> context.sendFailure(failure));
            }

            interrupted |= uninterruptibly(context::sendEnd);

            if (!context.isInputDone()) {
                int[] discarded = new int[1];
                interrupted |= uninterruptibly(() -> discarded[0] += context.drainInput());
                log.debugf("Decoder '%s' drained %d unread chunk(s)", name, discarded[0]);
            }
            log.debugf("Decoder '%s' finished (%s)", name, failure == null ? "ok" : "failed");
        } finally {
            if (interrupted) {
                log.debugf("Decoder '%s' was interrupted, restoring the interrupt flag", name);
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Retries a blocking step until it completes.
     *
     * @return true if the step was interrupted at least once
     */
    private static boolean uninterruptibly(BlockingStep step) {
        boolean interrupted = false;
        while (true) {
            try {
                step.run();
                return interrupted;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
    }

    @FunctionalInterface
    private interface BlockingStep {
        void run() throws InterruptedException;
    }
}
