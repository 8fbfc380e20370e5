package net.pedegie.atomics.longs;

import java.util.function.LongBinaryOperator;
import java.util.function.LongUnaryOperator;

/**
 * Thread-safe 64-bit signed integer updated with lock-free atomic operations.
 * <p>
 * All operations are linearizable with respect to each other on the same instance. Arithmetic wraps on overflow.
 * The retrying operations ({@link #setIfGreater}, {@link #setIfLess}, {@link #update}, {@link #accumulate}) are
 * lock-free, not wait-free: some contending thread always makes progress, but a single caller can in theory retry
 * indefinitely under contention.
 * <p>
 * Share the instance, never its value. Holding it in a {@code final} field and passing the reference around keeps all
 * holders on the same slot; re-creating a cell from {@link #get()} gives an independent slot that no longer observes
 * the other holders' updates.
 */
public interface AtomicLong
{
    static AtomicLong create()
    {
        return new ConcurrentAtomicLong();
    }

    static AtomicLong create(long initialValue)
    {
        return new ConcurrentAtomicLong(initialValue);
    }

    /**
     * @return current value, with volatile read semantics
     */
    long get();

    /**
     * Stores {@code value} with volatile write semantics.
     */
    void set(long value);

    /**
     * Same as {@link #get()}.
     */
    long read();

    /**
     * Same as {@link #set(long)}.
     */
    void write(long value);

    /**
     * @return value before the exchange
     */
    long exchange(long value);

    /**
     * Sets {@code value} if the current value equals {@code comparand}.
     *
     * @return value observed by the attempt, whether it matched or not
     */
    long compareExchange(long value, long comparand);

    /**
     * @return true if the current value equalled {@code comparand} and was replaced by {@code value}
     */
    boolean tryCompareExchange(long value, long comparand);

    /**
     * @return value after the increment
     */
    long increment();

    /**
     * @return value after the decrement
     */
    long decrement();

    /**
     * @return value after the addition
     */
    long add(long delta);

    long getAndIncrement();

    long getAndDecrement();

    long getAndAdd(long delta);

    long incrementAndGet();

    long decrementAndGet();

    long addAndGet(long delta);

    /**
     * Single attempt to replace the current value with {@code value} if {@code value} is strictly greater. Fails
     * without retrying when another writer gets in between the read and the compare-and-swap.
     *
     * @return true if {@code value} was stored
     */
    boolean trySetIfGreater(long value);

    /**
     * Mirror of {@link #trySetIfGreater(long)} for strictly less values.
     */
    boolean trySetIfLess(long value);

    /**
     * Raises the value to {@code value}, retrying until stored or until the current value is already greater or
     * equal.
     *
     * @return value in effect when the call returns, either {@code value} or the greater one that was already stored
     */
    long setIfGreater(long value);

    /**
     * Mirror of {@link #setIfGreater(long)}.
     *
     * @return value in effect when the call returns, either {@code value} or the smaller one that was already stored
     */
    long setIfLess(long value);

    /**
     * Replaces the value with {@code transform(current)} in a compare-and-swap loop. {@code transform} may run several
     * times against different snapshots, so it has to be free of side effects.
     *
     * @return the value installed by the successful attempt
     * @throws NullPointerException if {@code transform} is null
     */
    long update(LongUnaryOperator transform);

    /**
     * Single compare-and-swap attempt of {@link #update(LongUnaryOperator)}. The returned result carries the snapshot
     * and the computed value even on failure, so the caller can decide whether to retry.
     *
     * @throws NullPointerException if {@code transform} is null
     */
    UpdateResult tryUpdate(LongUnaryOperator transform);

    /**
     * Replaces the value with {@code combiner(current, x)} in a compare-and-swap loop.
     *
     * @return the value installed by the successful attempt
     * @throws NullPointerException if {@code combiner} is null
     */
    long accumulate(long x, LongBinaryOperator combiner);
}
