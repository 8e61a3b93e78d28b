package com.libragraph.atlas.formats.registry;

import com.libragraph.atlas.formats.api.Batch;
import com.libragraph.atlas.formats.api.Decoder;
import com.libragraph.atlas.formats.api.DecoderContext;
import com.libragraph.atlas.formats.api.DecoderFactory;
import com.libragraph.atlas.formats.api.Header;
import com.libragraph.atlas.formats.api.InputFile;
import com.libragraph.atlas.formats.opl.OplDecoder;
import com.libragraph.atlas.types.EntityKind;
import com.libragraph.atlas.types.FormatId;
import com.libragraph.atlas.util.channel.AsyncResult;
import com.libragraph.atlas.util.channel.BlockingChannel;
import com.libragraph.atlas.util.channel.Chunk;
import com.libragraph.atlas.util.channel.OneShot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class DecoderRegistryTest {

    private DecoderRegistry registry;
    private DecoderContext context;

    @BeforeEach
    void setUp() {
        registry = new DecoderRegistry();
        BlockingChannel<Chunk> input = BlockingChannel.unbounded("input");
        BlockingChannel<AsyncResult<Batch>> output = BlockingChannel.unbounded("output");
        context = new DecoderContext(input, output, new OneShot<>(), EntityKind.all());
    }

    @Test
    void shouldKeepFirstFactoryOnDuplicateRegistration() {
        Decoder first = () -> context.resolveHeader(Header.empty().withGenerator("first"));
        Decoder second = () -> context.resolveHeader(Header.empty().withGenerator("second"));
        DecoderFactory factory1 = ctx -> first;
        DecoderFactory factory2 = ctx -> second;

        assertThat(registry.register(FormatId.XML, factory1)).isTrue();
        assertThat(registry.register(FormatId.XML, factory2)).isFalse();

        assertThat(registry.resolve(InputFile.of("a.osm"))).isSameAs(factory1);
        assertThat(registry.createDecoder(InputFile.of("a.osm"), context)).isSameAs(first);
    }

    @Test
    void shouldFailWithFilenameAndFormatNameForUnregisteredFormat() {
        InputFile file = InputFile.of("planet-latest.osm.pbf");

        UnsupportedFormatException e = catchThrowableOfType(
                () -> registry.resolve(file), UnsupportedFormatException.class);

        assertThat(e).isNotNull();
        assertThat(e.getMessage()).contains("planet-latest.osm.pbf").contains("PBF");
        assertThat(e.filename()).isEqualTo("planet-latest.osm.pbf");
        assertThat(e.formatName()).isEqualTo("PBF");
    }

    @Test
    void shouldNotResolveUnknownFormat() {
        registry.register(FormatId.OPL, OplDecoder::new);

        assertThatThrownBy(() -> registry.resolve(InputFile.of("notes.txt")))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessage("Can not open file 'notes.txt' with type 'UNKNOWN'. "
                        + "No support for reading this format in this program.");
    }

    @Test
    void shouldListRegisteredFormatsInOrder() {
        assertThat(registry.formats()).isEmpty();

        registry.register(FormatId.O5M, ctx -> () -> {});
        registry.register(FormatId.OPL, ctx -> () -> {});

        assertThat(registry.formats()).containsExactly(FormatId.OPL, FormatId.O5M);
        assertThat(registry.isRegistered(FormatId.OPL)).isTrue();
        assertThat(registry.isRegistered(FormatId.PBF)).isFalse();
    }

    @Test
    void shouldLoadPluginsFromClassPath() {
        int loaded = registry.loadPlugins(getClass().getClassLoader());

        assertThat(loaded).isEqualTo(1);
        assertThat(registry.isRegistered(FormatId.OPL)).isTrue();
        assertThat(registry.loadPlugins(getClass().getClassLoader())).isZero();
    }

    @Test
    void shouldExposeProcessWideInstanceWithPlugins() {
        DecoderRegistry shared = DecoderRegistry.instance();

        assertThat(shared).isSameAs(DecoderRegistry.instance());
        assertThat(shared.isRegistered(FormatId.OPL)).isTrue();
        assertThat(shared.resolve(InputFile.of("x.opl"))).isNotNull();
    }

    @Test
    void shouldAcceptExactlyOneConcurrentRegistration() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return registry.register(FormatId.JSON, ctx -> () -> {});
                }));
            }
            start.countDown();

            int accepted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    accepted++;
                }
            }
            assertThat(accepted).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }
}
