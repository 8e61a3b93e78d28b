package com.libragraph.atlas.util.channel;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-assignment result. The first call to {@link #complete} or {@link #fail}
 * wins; later calls return false and leave the observed outcome unchanged.
 * <p>
 * Readers block in {@link #await()} until the result is resolved. A failure is
 * rethrown as an {@link ExecutionException} carrying the original cause.
 *
 * @param <T> value type
 */
public class OneShot<T> implements AsyncResult<T> {

    private static final Logger log = Logger.getLogger(OneShot.class);

    private final CompletableFuture<T> future = new CompletableFuture<>();

    /**
     * Resolves with a value.
     *
     * @return true if this call resolved the result
     */
    public boolean complete(T value) {
        boolean won = future.complete(value);
        if (!won) {
            log.debugf("Ignoring value for already resolved result: %s", value);
        }
        return won;
    }

    /**
     * Resolves with a failure.
     *
     * @return true if this call resolved the result
     */
    public boolean fail(Throwable cause) {
        if (cause == null) {
            throw new NullPointerException("cause");
        }
        boolean won = future.completeExceptionally(cause);
        if (!won) {
            log.debugf("Ignoring failure for already resolved result: %s", cause.toString());
        }
        return won;
    }

    @Override
    public boolean isDone() {
        return future.isDone();
    }

    @Override
    public boolean isFailed() {
        return future.isCompletedExceptionally();
    }

    @Override
    public T await() throws InterruptedException, ExecutionException {
        return future.get();
    }

    @Override
    public T await(Duration timeout) throws InterruptedException, ExecutionException, TimeoutException {
        return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public String toString() {
        if (!future.isDone()) {
            return "OneShot[pending]";
        }
        return isFailed() ? "OneShot[failed]" : "OneShot[done]";
    }
}
