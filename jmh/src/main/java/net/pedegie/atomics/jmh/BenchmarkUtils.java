package net.pedegie.atomics.jmh;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongConsumer;
import java.util.function.Supplier;
import java.util.stream.IntStream;

public class BenchmarkUtils
{
    static final int OPERATIONS_PER_THREAD = 100_000;

    /**
     * @param operation receives the index of the current iteration of the calling thread
     */
    public static Supplier<Void> runBenchmarkForCell(LongConsumer operation, int threads, ExecutorService pool)
    {
        Runnable worker = () ->
        {
            for (long i = 0; i < OPERATIONS_PER_THREAD; i++)
            {
                operation.accept(i);
            }
        };

        return () ->
        {
            List<CompletableFuture<?>> futures = new ArrayList<>(threads);
            IntStream.range(0, threads).forEach(index -> futures.add(CompletableFuture.runAsync(worker, pool)));

            try
            {
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[]{})).get(60, TimeUnit.SECONDS);
            } catch (Exception e)
            {
                e.printStackTrace();
            }
            return null;
        };
    }

    static void closePool(ExecutorService executorService)
    {
        executorService.shutdown();
        try
        {
            executorService.awaitTermination(60, TimeUnit.SECONDS);
        } catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            e.printStackTrace();
        }
    }

    static class NamedThreadFactory implements ThreadFactory
    {
        private final AtomicInteger threadNumber = new AtomicInteger(0);

        private final String name;

        public NamedThreadFactory(String name)
        {
            this.name = name;
        }

        public Thread newThread(@NotNull Runnable r)
        {
            return new Thread(r, String.format(name, threadNumber.incrementAndGet()));
        }
    }
}
