package net.pedegie.atomics.longs;

import lombok.AccessLevel;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Objects;
import java.util.function.LongBinaryOperator;
import java.util.function.LongPredicate;
import java.util.function.LongUnaryOperator;

/**
 * {@link AtomicLong} over a single {@code volatile long} accessed through a {@link VarHandle}.
 * <p>
 * Equality is identity: two cells holding the same number are still different slots.
 */
@FieldDefaults(makeFinal = true, level = AccessLevel.PRIVATE)
public final class ConcurrentAtomicLong extends Number implements AtomicLong
{
    private static final long serialVersionUID = -3871625402761893541L;
    private static final LongPredicate NEVER = current -> false;
    private static final VarHandle VALUE;

    static
    {
        try
        {
            VALUE = MethodHandles.lookup().findVarHandle(ConcurrentAtomicLong.class, "value", long.class);
        } catch (ReflectiveOperationException e)
        {
            throw new ExceptionInInitializerError(e);
        }
    }

    transient SpinWaitConfiguration spinWaitConfiguration;
    @NonFinal
    volatile long value;

    public ConcurrentAtomicLong()
    {
        this(0L);
    }

    public ConcurrentAtomicLong(long initialValue)
    {
        this(initialValue, SpinWaitConfiguration.defaultConfiguration());
    }

    public ConcurrentAtomicLong(long initialValue, SpinWaitConfiguration spinWaitConfiguration)
    {
        SpinWaitConfigurationValidator.validate(spinWaitConfiguration);
        this.spinWaitConfiguration = spinWaitConfiguration;
        this.value = initialValue;
    }

    @Override
    public long get()
    {
        return value;
    }

    @Override
    public void set(long value)
    {
        this.value = value;
    }

    @Override
    public long read()
    {
        return value;
    }

    @Override
    public void write(long value)
    {
        this.value = value;
    }

    @Override
    public long exchange(long value)
    {
        return (long) VALUE.getAndSet(this, value);
    }

    @Override
    public long compareExchange(long value, long comparand)
    {
        return (long) VALUE.compareAndExchange(this, comparand, value);
    }

    @Override
    public boolean tryCompareExchange(long value, long comparand)
    {
        return VALUE.compareAndSet(this, comparand, value);
    }

    @Override
    public long increment()
    {
        return (long) VALUE.getAndAdd(this, 1L) + 1L;
    }

    @Override
    public long decrement()
    {
        return (long) VALUE.getAndAdd(this, -1L) - 1L;
    }

    @Override
    public long add(long delta)
    {
        return (long) VALUE.getAndAdd(this, delta) + delta;
    }

    @Override
    public long getAndIncrement()
    {
        return (long) VALUE.getAndAdd(this, 1L);
    }

    @Override
    public long getAndDecrement()
    {
        return (long) VALUE.getAndAdd(this, -1L);
    }

    @Override
    public long getAndAdd(long delta)
    {
        return (long) VALUE.getAndAdd(this, delta);
    }

    @Override
    public long incrementAndGet()
    {
        return increment();
    }

    @Override
    public long decrementAndGet()
    {
        return decrement();
    }

    @Override
    public long addAndGet(long delta)
    {
        return add(delta);
    }

    @Override
    public boolean trySetIfGreater(long value)
    {
        long current = this.value;
        if (value <= current)
        {
            return false;
        }
        return VALUE.compareAndSet(this, current, value);
    }

    @Override
    public boolean trySetIfLess(long value)
    {
        long current = this.value;
        if (value >= current)
        {
            return false;
        }
        return VALUE.compareAndSet(this, current, value);
    }

    @Override
    public long setIfGreater(long value)
    {
        return retryUntilInstalled(current -> value, current -> value <= current, "setIfGreater");
    }

    @Override
    public long setIfLess(long value)
    {
        return retryUntilInstalled(current -> value, current -> value >= current, "setIfLess");
    }

    @Override
    public long update(LongUnaryOperator transform)
    {
        Objects.requireNonNull(transform, "transform");
        return retryUntilInstalled(transform, NEVER, "update");
    }

    @Override
    public UpdateResult tryUpdate(LongUnaryOperator transform)
    {
        Objects.requireNonNull(transform, "transform");

        long original = value;
        long updated = transform.applyAsLong(original);
        boolean success = VALUE.compareAndSet(this, original, updated);
        return new UpdateResult(original, updated, success);
    }

    @Override
    public long accumulate(long x, LongBinaryOperator combiner)
    {
        Objects.requireNonNull(combiner, "combiner");
        return retryUntilInstalled(current -> combiner.applyAsLong(current, x), NEVER, "accumulate");
    }

    /**
     * Read, compute, compare-and-swap, back off, repeat. Returns the current value without writing once
     * {@code satisfied} holds for a snapshot, otherwise the value installed by the winning attempt.
     */
    private long retryUntilInstalled(LongUnaryOperator next, LongPredicate satisfied, String operation)
    {
        SpinWait spinWait = null;
        while (true)
        {
            long current = value;
            if (satisfied.test(current))
            {
                return current;
            }

            long computed = next.applyAsLong(current);
            if (VALUE.compareAndSet(this, current, computed))
            {
                return computed;
            }

            if (spinWait == null)
            {
                spinWait = new SpinWait(spinWaitConfiguration(), operation);
            }
            spinWait.spinOnce();
        }
    }

    private SpinWaitConfiguration spinWaitConfiguration()
    {
        // null after deserialization
        return spinWaitConfiguration == null ? SpinWaitConfiguration.defaultConfiguration() : spinWaitConfiguration;
    }

    @Override
    public int intValue()
    {
        return (int) get();
    }

    @Override
    public long longValue()
    {
        return get();
    }

    @Override
    public float floatValue()
    {
        return (float) get();
    }

    @Override
    public double doubleValue()
    {
        return (double) get();
    }

    @Override
    public String toString()
    {
        return Long.toString(get());
    }
}
