package net.pedegie.atomics.longs;

import lombok.AccessLevel;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;

/**
 * Backoff between failed compare-and-swap attempts of a single retry loop. Not thread-safe, create one per loop.
 * <p>
 * Spins with {@link Thread#onSpinWait()} for an exponentially growing number of pauses, then yields the processor on
 * every further call. Never gives up.
 */
@Slf4j
@FieldDefaults(makeFinal = true, level = AccessLevel.PRIVATE)
class SpinWait
{
    SpinWaitConfiguration configuration;
    String operation;
    @NonFinal
    int count;
    @NonFinal
    boolean contentionReported;

    SpinWait(SpinWaitConfiguration configuration, String operation)
    {
        this.configuration = configuration;
        this.operation = operation;
    }

    void spinOnce()
    {
        if (count < configuration.getSpinIterationsBeforeYield())
        {
            int spins = count < 31 ? Math.min(1 << count, configuration.getMaxSpinsPerIteration()) : configuration.getMaxSpinsPerIteration();
            for (int i = 0; i < spins; i++)
            {
                Thread.onSpinWait();
            }
        } else
        {
            Thread.yield();
        }

        if (count < Integer.MAX_VALUE)
            count++;

        if (!contentionReported && count >= configuration.getContentionLogThreshold())
        {
            contentionReported = true;
            log.debug("CAS loop of {} contended, {} failed attempts on {}", operation, count, Thread.currentThread().getName());
        }
    }

    int count()
    {
        return count;
    }

    boolean nextSpinYields()
    {
        return count >= configuration.getSpinIterationsBeforeYield();
    }
}
