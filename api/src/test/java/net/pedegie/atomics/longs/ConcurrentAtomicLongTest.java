package net.pedegie.atomics.longs;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConcurrentAtomicLongTest
{
    @Test
    void shouldStartFromZeroByDefault()
    {
        assertEquals(0, new ConcurrentAtomicLong().get());
        assertEquals(0, AtomicLong.create().read());
        assertEquals(-4, AtomicLong.create(-4).get());
    }

    @Test
    void shouldReplaySequenceOfOperations()
    {
        AtomicLong cell = AtomicLong.create();

        cell.write(5);
        assertEquals(6, cell.increment());
        assertEquals(6, cell.read());
        assertEquals(5, cell.decrement());
        assertEquals(15, cell.add(10));
        cell.set(-1);
        assertEquals(-1, cell.get());
    }

    @Test
    void getAndFamilyShouldReturnValueBeforeMutation()
    {
        AtomicLong cell = AtomicLong.create(10);

        assertEquals(10, cell.getAndIncrement());
        assertEquals(11, cell.getAndDecrement());
        assertEquals(10, cell.getAndAdd(5));
        assertEquals(15, cell.get());
    }

    @Test
    void andGetFamilyShouldReturnValueAfterMutation()
    {
        AtomicLong cell = AtomicLong.create(10);

        assertEquals(11, cell.incrementAndGet());
        assertEquals(10, cell.decrementAndGet());
        assertEquals(3, cell.addAndGet(-7));
        assertEquals(3, cell.get());
    }

    @Test
    void getAndAddShouldReturnPreviousValue()
    {
        AtomicLong cell = AtomicLong.create(0);

        assertEquals(0, cell.getAndAdd(7));
        assertEquals(7, cell.read());
    }

    @Test
    void shouldWrapOnOverflow()
    {
        AtomicLong max = AtomicLong.create(Long.MAX_VALUE);
        AtomicLong min = AtomicLong.create(Long.MIN_VALUE);

        assertEquals(Long.MIN_VALUE, max.increment());
        assertEquals(Long.MAX_VALUE, min.decrement());
        assertEquals(Long.MIN_VALUE + 1, AtomicLong.create(Long.MAX_VALUE).add(2));
        assertEquals(Long.MAX_VALUE, AtomicLong.create(Long.MAX_VALUE).getAndIncrement());
    }

    @Test
    void exchangeShouldReturnPreviousValue()
    {
        AtomicLong cell = AtomicLong.create(3);

        assertEquals(3, cell.exchange(8));
        assertEquals(8, cell.read());
    }

    @Test
    void compareExchangeShouldReplaceOnlyMatchingValue()
    {
        AtomicLong cell = AtomicLong.create(3);

        assertEquals(3, cell.compareExchange(4, 2));
        assertEquals(3, cell.get());

        assertEquals(3, cell.compareExchange(4, 3));
        assertEquals(4, cell.get());
    }

    @Test
    void tryCompareExchangeShouldReportSuccess()
    {
        AtomicLong cell = AtomicLong.create(3);

        assertFalse(cell.tryCompareExchange(9, 4));
        assertEquals(3, cell.get());
        assertTrue(cell.tryCompareExchange(9, 3));
        assertEquals(9, cell.get());
    }

    @Test
    void trySetIfGreaterShouldOnlyRaise()
    {
        AtomicLong cell = AtomicLong.create(10);

        assertFalse(cell.trySetIfGreater(5));
        assertEquals(10, cell.get());
        assertFalse(cell.trySetIfGreater(10));
        assertEquals(10, cell.get());
        assertTrue(cell.trySetIfGreater(15));
        assertEquals(15, cell.get());
    }

    @Test
    void trySetIfLessShouldOnlyLower()
    {
        AtomicLong cell = AtomicLong.create(10);

        assertFalse(cell.trySetIfLess(15));
        assertFalse(cell.trySetIfLess(10));
        assertEquals(10, cell.get());
        assertTrue(cell.trySetIfLess(-2));
        assertEquals(-2, cell.get());
    }

    @Test
    void setIfGreaterShouldReturnValueInEffect()
    {
        AtomicLong cell = AtomicLong.create(10);

        assertEquals(10, cell.setIfGreater(3));
        assertEquals(10, cell.setIfGreater(10));
        assertEquals(20, cell.setIfGreater(20));
        assertEquals(20, cell.get());
    }

    @Test
    void setIfLessShouldReturnValueInEffect()
    {
        AtomicLong cell = AtomicLong.create(10);

        assertEquals(10, cell.setIfLess(30));
        assertEquals(10, cell.setIfLess(10));
        assertEquals(Long.MIN_VALUE, cell.setIfLess(Long.MIN_VALUE));
        assertEquals(Long.MIN_VALUE, cell.get());
    }

    @Test
    void identityUpdateShouldKeepValue()
    {
        AtomicLong cell = AtomicLong.create(42);

        assertEquals(42, cell.update(v -> v));
        assertEquals(42, cell.get());
    }

    @Test
    void updateShouldInstallTransformedValue()
    {
        AtomicLong cell = AtomicLong.create(5);

        assertEquals(11, cell.update(v -> v * 2 + 1));
        assertEquals(11, cell.get());
    }

    @Test
    void updateShouldRetryWhenValueChangesUnderneath()
    {
        AtomicLong cell = AtomicLong.create(1);
        AtomicInteger invocations = new AtomicInteger();

        long result = cell.update(v ->
        {
            if (invocations.getAndIncrement() == 0)
            {
                cell.set(100);
            }
            return v + 1;
        });

        assertEquals(101, result);
        assertEquals(101, cell.get());
        assertEquals(2, invocations.get());
    }

    @Test
    void tryUpdateShouldReportSnapshotAndComputedValue()
    {
        AtomicLong cell = AtomicLong.create(4);

        UpdateResult result = cell.tryUpdate(v -> v * 3);

        assertTrue(result.isSuccess());
        assertEquals(4, result.getOriginal());
        assertEquals(12, result.getUpdated());
        assertEquals(12, cell.get());
    }

    @Test
    void tryUpdateShouldNotRetryWhenValueChangesUnderneath()
    {
        AtomicLong cell = AtomicLong.create(4);

        UpdateResult result = cell.tryUpdate(v ->
        {
            cell.set(50);
            return v + 1;
        });

        assertFalse(result.isSuccess());
        assertEquals(4, result.getOriginal());
        assertEquals(5, result.getUpdated());
        assertEquals(50, cell.get());
    }

    @Test
    void accumulateWithSumShouldMatchAddAndGet()
    {
        AtomicLong accumulated = AtomicLong.create(17);
        AtomicLong added = AtomicLong.create(17);

        assertEquals(added.addAndGet(25), accumulated.accumulate(25, Long::sum));
        assertEquals(added.get(), accumulated.get());
    }

    @Test
    void accumulateShouldPassCurrentValueFirst()
    {
        AtomicLong cell = AtomicLong.create(10);

        assertEquals(7, cell.accumulate(3, (current, x) -> current - x));
    }

    @Test
    void shouldRejectMissingCallbacks()
    {
        AtomicLong cell = AtomicLong.create(1);

        assertThrows(NullPointerException.class, () -> cell.update(null));
        assertThrows(NullPointerException.class, () -> cell.tryUpdate(null));
        assertThrows(NullPointerException.class, () -> cell.accumulate(1, null));
        assertEquals(1, cell.get());
    }

    @Test
    void transformExceptionShouldPropagateAndLeaveValue()
    {
        AtomicLong cell = AtomicLong.create(1);

        IllegalStateException exception = assertThrows(IllegalStateException.class, () -> cell.update(v ->
        {
            throw new IllegalStateException("boom");
        }));

        assertEquals("boom", exception.getMessage());
        assertEquals(1, cell.get());
    }

    @Test
    void shouldRenderDecimalValue()
    {
        assertEquals("-123", AtomicLong.create(-123).toString());
        assertEquals("9223372036854775807", AtomicLong.create(Long.MAX_VALUE).toString());
    }

    @Test
    void shouldExposeNumberViews()
    {
        ConcurrentAtomicLong cell = new ConcurrentAtomicLong((1L << 32) + 3);

        assertEquals((1L << 32) + 3, cell.longValue());
        assertEquals(3, cell.intValue());
        assertEquals((double) ((1L << 32) + 3), cell.doubleValue());
    }

    @Test
    void cellsWithSameValueShouldStayDistinct()
    {
        ConcurrentAtomicLong first = new ConcurrentAtomicLong(1);
        ConcurrentAtomicLong copy = new ConcurrentAtomicLong(first.get());

        copy.increment();

        assertNotEquals(first, copy);
        assertEquals(1, first.get());
        assertSame(first, first);
    }

    @Test
    void shouldRejectInvalidSpinWaitConfiguration()
    {
        SpinWaitConfiguration configuration = SpinWaitConfiguration.builder().maxSpinsPerIteration(0).build();

        assertThrows(IllegalArgumentException.class, () -> new ConcurrentAtomicLong(0, configuration));
        assertThrows(NullPointerException.class, () -> new ConcurrentAtomicLong(0, null));
    }
}
