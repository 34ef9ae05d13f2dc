package org.pywalrus.benchmark;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.pywalrus.ConversionConfig;
import org.pywalrus.Walrus;
import org.pywalrus.benchmark.domain.SampleSources;
import org.openjdk.jmh.annotations.*;

/**
 * Two threads converting different modules with one shared configuration. Conversion
 * runs share no mutable state, so this gives a contention baseline.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentConversionBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        final String[] sources = {
                SampleSources.SINGLE_BINDING,
                SampleSources.MIXED_MODULE
        };

        final ConversionConfig config = ConversionConfig.defaults();
    }

    @State(Scope.Thread)
    public static class ThreadState {

        private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
        int threadIndex;

        @Setup(Level.Trial)
        public void init() {
            threadIndex = THREAD_COUNTER.getAndIncrement() % 2;
        }
    }

    @Benchmark
    public String concurrentConvertDifferentModules(SharedState shared, ThreadState local) {
        return Walrus.convert(shared.sources[local.threadIndex], shared.config);
    }
}
