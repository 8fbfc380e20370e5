package net.pedegie.atomics.jmh;

import net.pedegie.atomics.longs.ConcurrentAtomicLong;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Timeout;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import static net.pedegie.atomics.jmh.BenchmarkUtils.runBenchmarkForCell;

public class AtomicLongVsJdkAtomicLong
{
    @Fork(value = 1)
    @Warmup(iterations = 5)
    @Measurement(iterations = 4)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    @BenchmarkMode({Mode.AverageTime})
    @State(Scope.Benchmark)
    @Timeout(time = 120)
    public static class TestBenchmark
    {
        @Benchmark
        public void ConcurrentAtomicLongIncrement(CellConfiguration configuration)
        {
            configuration.cellIncrement.get();
        }

        @Benchmark
        public void JdkAtomicLongIncrement(CellConfiguration configuration)
        {
            configuration.jdkIncrement.get();
        }

        @Benchmark
        public void ConcurrentAtomicLongUpdate(CellConfiguration configuration)
        {
            configuration.cellUpdate.get();
        }

        @Benchmark
        public void JdkAtomicLongUpdate(CellConfiguration configuration)
        {
            configuration.jdkUpdate.get();
        }

        @Benchmark
        public void ConcurrentAtomicLongSetIfGreater(CellConfiguration configuration)
        {
            configuration.cellSetIfGreater.get();
        }

        @Benchmark
        public void JdkAtomicLongAccumulateMax(CellConfiguration configuration)
        {
            configuration.jdkAccumulateMax.get();
        }

        @State(Scope.Benchmark)
        public static class CellConfiguration
        {
            @Param({"1", "2", "4", "8", "16"})
            public int threads;

            Supplier<Void> cellIncrement;
            Supplier<Void> jdkIncrement;
            Supplier<Void> cellUpdate;
            Supplier<Void> jdkUpdate;
            Supplier<Void> cellSetIfGreater;
            Supplier<Void> jdkAccumulateMax;

            ExecutorService pool;

            @Setup(Level.Trial)
            public void setUp()
            {
                pool = Executors.newFixedThreadPool(threads, new BenchmarkUtils.NamedThreadFactory("cell_pool-%d"));

                var cell = new ConcurrentAtomicLong();
                var jdk = new AtomicLong();

                cellIncrement = runBenchmarkForCell(i -> cell.incrementAndGet(), threads, pool);
                jdkIncrement = runBenchmarkForCell(i -> jdk.incrementAndGet(), threads, pool);
                cellUpdate = runBenchmarkForCell(i -> cell.update(v -> v * 31 + 7), threads, pool);
                jdkUpdate = runBenchmarkForCell(i -> jdk.updateAndGet(v -> v * 31 + 7), threads, pool);
                cellSetIfGreater = runBenchmarkForCell(cell::setIfGreater, threads, pool);
                jdkAccumulateMax = runBenchmarkForCell(i -> jdk.accumulateAndGet(i, Math::max), threads, pool);
            }

            @TearDown(Level.Trial)
            public void teardownTrial()
            {
                BenchmarkUtils.closePool(pool);
            }
        }
    }

    public static void main(String[] args) throws RunnerException
    {
        Options options = new OptionsBuilder()
                .include(AtomicLongVsJdkAtomicLong.class.getSimpleName())
                .build();
        new Runner(options).run();
    }
}
