package com.libragraph.atlas.util.channel;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Read side of a value that is produced on another thread, either successfully or
 * with a failure. Reading blocks until the result is resolved.
 *
 * @param <T> value type
 */
public interface AsyncResult<T> {

    boolean isDone();

    /**
     * True if resolved with a failure. False while unresolved.
     */
    boolean isFailed();

    /**
     * Waits for the result.
     *
     * @throws ExecutionException if resolved with a failure; the cause is the original failure
     */
    T await() throws InterruptedException, ExecutionException;

    T await(Duration timeout) throws InterruptedException, ExecutionException, TimeoutException;

    static <T> AsyncResult<T> completed(T value) {
        OneShot<T> result = new OneShot<>();
        result.complete(value);
        return result;
    }

    static <T> AsyncResult<T> failed(Throwable cause) {
        OneShot<T> result = new OneShot<>();
        result.fail(cause);
        return result;
    }
}
