package org.pywalrus.benchmark;

import java.util.concurrent.TimeUnit;

import org.pywalrus.ConversionConfig;
import org.pywalrus.Walrus;
import org.pywalrus.benchmark.domain.SampleSources;
import org.pywalrus.transpiler.UniqueNameGenerator;
import org.openjdk.jmh.annotations.*;

/**
 * Measures end-to-end conversion cost: parse, validate, rewrite and emit.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class ConversionCostBenchmark {

    @State(Scope.Thread)
    public static class ConversionState {

        ConversionConfig config;
        String largeModule;

        @Setup(Level.Trial)
        public void init() {
            config = ConversionConfig.builder()
                    .uniqueNames(UniqueNameGenerator::sequential)
                    .build();
            largeModule = SampleSources.largeModule(20);
        }
    }

    @Benchmark
    public String convertPlainModule(ConversionState state) {
        return Walrus.convert(SampleSources.PLAIN_MODULE, state.config);
    }

    @Benchmark
    public String convertSingleBinding(ConversionState state) {
        return Walrus.convert(SampleSources.SINGLE_BINDING, state.config);
    }

    @Benchmark
    public String convertMixedModule(ConversionState state) {
        return Walrus.convert(SampleSources.MIXED_MODULE, state.config);
    }

    @Benchmark
    public String convertLargeModule(ConversionState state) {
        return Walrus.convert(state.largeModule, state.config);
    }
}
