package com.libragraph.atlas.util.channel;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Thread-safe FIFO connecting one stage of the pipeline to the next.
 * <p>
 * A bounded channel blocks {@link #put} while full, which gives the producing side
 * backpressure. {@link #take} blocks while the channel is empty. Items leave in the
 * order they were put.
 *
 * @param <T> item type
 */
public class BlockingChannel<T> {

    /** Capacity reported by unbounded channels. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final BlockingQueue<T> queue;
    private final int capacity;
    private final String name;

    public BlockingChannel(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Channel capacity must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    public static <T> BlockingChannel<T> bounded(String name, int capacity) {
        return new BlockingChannel<>(name, capacity);
    }

    public static <T> BlockingChannel<T> unbounded(String name) {
        return new BlockingChannel<>(name, UNBOUNDED);
    }

    /**
     * Appends an item, waiting for space if the channel is full.
     */
    public void put(T item) throws InterruptedException {
        if (item == null) {
            throw new NullPointerException("Channel '" + name + "' does not accept null items");
        }
        queue.put(item);
    }

    /**
     * Removes the oldest item, waiting until one is available.
     */
    public T take() throws InterruptedException {
        return queue.take();
    }

    /**
     * Removes the oldest item, waiting at most {@code timeout}.
     *
     * @return the item, or null if none arrived in time
     */
    public T poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isBounded() {
        return capacity != UNBOUNDED;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "BlockingChannel[" + name + ", " + queue.size() + "/"
                + (isBounded() ? capacity : "unbounded") + "]";
    }
}
