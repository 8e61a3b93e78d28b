package com.libragraph.atlas.formats.api;

import com.libragraph.atlas.types.EntityKind;
import com.libragraph.atlas.util.channel.AsyncResult;
import com.libragraph.atlas.util.channel.BlockingChannel;
import com.libragraph.atlas.util.channel.Chunk;
import com.libragraph.atlas.util.channel.OneShot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

class DecoderWorkerTest {

    private BlockingChannel<Chunk> input;
    private BlockingChannel<AsyncResult<Batch>> output;
    private OneShot<Header> header;
    private DecoderContext context;

    @BeforeEach
    void setUp() {
        input = BlockingChannel.unbounded("input");
        output = BlockingChannel.unbounded("output");
        header = new OneShot<>();
        context = new DecoderContext(input, output, header, EntityKind.all());
    }

    @Test
    void shouldEmitBatchesInOrderFollowedByOneEndBatch() throws Exception {
        feed("r1", "r2", "r3", "r4", "");

        run(new RecordDecoder(context));

        List<AsyncResult<Batch>> results = drainOutput();
        assertThat(results).hasSize(5);
        List<String> records = new ArrayList<>();
        for (AsyncResult<Batch> result : results.subList(0, 4)) {
            Batch batch = result.await();
            assertThat(batch.isEnd()).isFalse();
            records.add(RecordDecoder.recordOf(batch));
        }
        assertThat(records).containsExactly("r1", "r2", "r3", "r4");
        assertThat(results.get(4).await().isEnd()).isTrue();
        assertThat(output.isEmpty()).isTrue();
        assertThat(input.isEmpty()).isTrue();
    }

    @Test
    void shouldDecodeRecordsAndResolveHeaderAfterFirstChunk() throws Exception {
        feed("rec1", "rec2", "");

        run(new RecordDecoder(context));

        List<AsyncResult<Batch>> results = drainOutput();
        assertThat(results).hasSize(3);
        assertThat(RecordDecoder.recordOf(results.get(0).await())).isEqualTo("rec1");
        assertThat(RecordDecoder.recordOf(results.get(1).await())).isEqualTo("rec2");
        assertThat(results.get(2).await()).isSameAs(Batch.end());

        assertThat(header.await()).isEqualTo(Header.empty().withGenerator("test"));
    }

    @Test
    void shouldAppendFailureAndEndAfterSuccessfulBatches() throws Exception {
        feed("ok1", "ok2", "broken", "never", "");

        run(new RecordDecoder(context, 3, true));

        List<AsyncResult<Batch>> results = drainOutput();
        assertThat(results).hasSize(4);
        assertThat(RecordDecoder.recordOf(results.get(0).await())).isEqualTo("ok1");
        assertThat(RecordDecoder.recordOf(results.get(1).await())).isEqualTo("ok2");
        assertThat(results.get(2).isFailed()).isTrue();
        assertThatThrownBy(() -> results.get(2).await())
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(DecodeException.class)
                .hasRootCauseMessage("bad record 'broken'");
        assertThat(results.get(3).await().isEnd()).isTrue();
        assertThat(output.isEmpty()).isTrue();
    }

    @Test
    void shouldDrainInputAfterEarlyFailure() throws Exception {
        feed("a", "b", "c", "");

        run(new RecordDecoder(context, 2, false));

        assertThat(input.isEmpty()).isTrue();
        List<AsyncResult<Batch>> results = drainOutput();
        assertThat(results).hasSize(2);
        assertThat(results.get(0).isFailed()).isTrue();
        assertThat(results.get(1).await().isEnd()).isTrue();
    }

    @Test
    void shouldFailHeaderWithSameCauseWhenUnresolved() throws Exception {
        IOException cause = new IOException("truncated");
        feed("x", "");

        run(() -> {
            context.nextChunk();
            throw cause;
        });

        assertThatThrownBy(header::await)
                .isInstanceOf(ExecutionException.class)
                .hasCause(cause);
        List<AsyncResult<Batch>> results = drainOutput();
        assertThatThrownBy(() -> results.get(0).await()).hasCause(cause);
        assertThat(results.get(1).await().isEnd()).isTrue();
    }

    @Test
    void shouldKeepResolvedHeaderWhenFailingLater() throws Exception {
        feed("first", "second", "");

        run(new RecordDecoder(context, 2, true));

        assertThat(header.isFailed()).isFalse();
        assertThat(header.await().generator()).isEqualTo("test");

        List<AsyncResult<Batch>> results = drainOutput();
        assertThat(results).hasSize(3);
        assertThat(results.get(1).isFailed()).isTrue();
    }

    @Test
    void shouldResolveEmptyHeaderWhenDecoderNeverDoes() throws Exception {
        feed("");

        run(() -> {
            while (!context.nextChunk().isEnd()) {
                // discard
            }
        });

        assertThat(header.await()).isEqualTo(Header.empty());
        List<AsyncResult<Batch>> results = drainOutput();
        assertThat(results).hasSize(1);
        assertThat(results.get(0).await().isEnd()).isTrue();
    }

    @Test
    void shouldRejectEndBatchFromDecoder() throws Exception {
        feed("");

        run(() -> context.send(Batch.end()));

        List<AsyncResult<Batch>> results = drainOutput();
        assertThat(results).hasSize(2);
        assertThatThrownBy(() -> results.get(0).await())
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(results.get(1).await().isEnd()).isTrue();
    }

    @Test
    void shouldContainErrorsThrownByDecoder() throws Exception {
        feed("");

        run(() -> {
            throw new StackOverflowError("deep");
        });

        List<AsyncResult<Batch>> results = drainOutput();
        assertThatThrownBy(() -> results.get(0).await()).hasCauseInstanceOf(StackOverflowError.class);
        assertThat(results.get(1).await().isEnd()).isTrue();
        assertThat(header.isFailed()).isTrue();
    }

    @Test
    void shouldReleaseBlockedProducerWhenDecoderStopsEarly() throws Exception {
        BlockingChannel<Chunk> bounded = BlockingChannel.bounded("bounded-input", 1);
        DecoderContext ctx = new DecoderContext(bounded, output, header, EntityKind.all());

        Thread producer = new Thread(() -> {
            try {
                for (int i = 0; i < 10; i++) {
                    bounded.put(Chunk.of("chunk-" + i));
                }
                bounded.put(Chunk.END);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();

        Thread worker = new Thread(new DecoderWorker("early-exit", () -> ctx.nextChunk(), ctx));
        worker.start();

        producer.join(TimeUnit.SECONDS.toMillis(5));
        worker.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(producer.isAlive()).isFalse();
        assertThat(worker.isAlive()).isFalse();
        assertThat(bounded.isEmpty()).isTrue();
        assertThat(ctx.isInputDone()).isTrue();
        assertThat(drainOutput()).hasSize(1);
    }

    @Test
    void shouldDeliverFailureAndEndWhenInterruptedWhileFinishing() throws Exception {
        BlockingChannel<Chunk> boundedInput = BlockingChannel.bounded("bounded-input", 1);
        BlockingChannel<AsyncResult<Batch>> boundedOutput = BlockingChannel.bounded("bounded-output", 1);
        DecoderContext ctx = new DecoderContext(boundedInput, boundedOutput, header, EntityKind.all());

        Thread producer = new Thread(() -> {
            try {
                for (int i = 0; i < 10; i++) {
                    boundedInput.put(Chunk.of("chunk-" + i));
                }
                boundedInput.put(Chunk.END);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();

        AtomicBoolean interruptRestored = new AtomicBoolean();
        DecoderWorker decoderWorker = new DecoderWorker("interrupted", () -> {
            Chunk first = ctx.nextChunk();
            ctx.send(Batch.of(List.of(), first.size()));
            throw new DecodeException("gave up after " + first.asString());
        }, ctx);
        Thread worker = new Thread(() -> {
            decoderWorker.run();
            interruptRestored.set(Thread.currentThread().isInterrupted());
        });
        worker.start();

        // the batch fills the output channel, so the worker blocks sending the failure
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!(boundedOutput.size() == 1 && worker.getState() == Thread.State.WAITING)) {
            assertThat(System.nanoTime()).isLessThan(deadline);
            Thread.sleep(5);
        }
        worker.interrupt();

        AsyncResult<Batch> batch = boundedOutput.poll(Duration.ofSeconds(5));
        AsyncResult<Batch> failure = boundedOutput.poll(Duration.ofSeconds(5));
        AsyncResult<Batch> end = boundedOutput.poll(Duration.ofSeconds(5));

        assertThat(batch.await().isEnd()).isFalse();
        assertThat(failure).isNotNull();
        assertThat(failure.isFailed()).isTrue();
        assertThat(end).isNotNull();
        assertThat(end.await().isEnd()).isTrue();

        producer.join(TimeUnit.SECONDS.toMillis(5));
        worker.join(TimeUnit.SECONDS.toMillis(5));
        assertThat(producer.isAlive()).isFalse();
        assertThat(worker.isAlive()).isFalse();
        assertThat(boundedInput.isEmpty()).isTrue();
        assertThat(interruptRestored).isTrue();
    }

    @Test
    void shouldKeepReturningEndOnceInputIsExhausted() throws Exception {
        feed("only", "");

        assertThat(context.nextChunk().asString()).isEqualTo("only");
        assertThat(context.nextChunk()).isSameAs(Chunk.END);
        assertThat(context.nextChunk()).isSameAs(Chunk.END);
        assertThat(context.isInputDone()).isTrue();
    }

    @Test
    void shouldResolveHeaderOnlyOnce() throws Exception {
        assertThat(context.resolveHeader(Header.empty().withGenerator("one"))).isTrue();
        assertThat(context.resolveHeader(Header.empty().withGenerator("two"))).isFalse();

        assertThat(header.await().generator()).isEqualTo("one");
    }

    @Test
    void shouldBuildWorkerFromFactory() throws Exception {
        feed("via-factory", "");

        DecoderWorker worker = DecoderWorker.create("factory", RecordDecoder::new, context);
        worker.run();

        assertThat(worker.name()).isEqualTo("factory");
        assertThat(RecordDecoder.recordOf(drainOutput().get(0).await())).isEqualTo("via-factory");
    }

    private void feed(String... chunks) throws InterruptedException {
        for (String chunk : chunks) {
            input.put(Chunk.of(chunk));
        }
    }

    private void run(Decoder decoder) {
        new DecoderWorker("test", decoder, context).run();
    }

    /** Collects results up to and including the end batch. */
    private List<AsyncResult<Batch>> drainOutput() throws Exception {
        List<AsyncResult<Batch>> results = new ArrayList<>();
        while (true) {
            AsyncResult<Batch> result = output.take();
            results.add(result);
            if (!result.isFailed() && result.await().isEnd()) {
                return results;
            }
        }
    }
}
