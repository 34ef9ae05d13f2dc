package org.pywalrus.benchmark;

import java.util.concurrent.TimeUnit;

import org.pywalrus.ConversionConfig;
import org.pywalrus.PythonVersion;
import org.pywalrus.benchmark.domain.SampleSources;
import org.pywalrus.parser.SourceParser;
import org.pywalrus.parser.ast.Node;
import org.pywalrus.transpiler.ConversionContext;
import org.pywalrus.transpiler.UniqueNameGenerator;
import org.openjdk.jmh.annotations.*;

/**
 * Splits conversion cost into parsing and tree rewriting. Run with {@code -prof gc}
 * to compare allocation of the two phases.
 */
@BenchmarkMode({Mode.AverageTime, Mode.Throughput})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 5, time = 2)
public class ParseCostBenchmark {

    @State(Scope.Thread)
    public static class ParsedState {

        ConversionConfig config;
        Node module;

        @Setup(Level.Trial)
        public void parse() {
            config = ConversionConfig.defaults();
            module = SourceParser.parse(SampleSources.MIXED_MODULE, PythonVersion.PY39);
        }
    }

    @Benchmark
    public Node parseMixedModule() {
        return SourceParser.parse(SampleSources.MIXED_MODULE, PythonVersion.PY39);
    }

    @Benchmark
    public String rewriteParsedModule(ParsedState state) {
        return ConversionContext.forModule(state.module, state.config, UniqueNameGenerator.sequential())
                .getOutput();
    }
}
