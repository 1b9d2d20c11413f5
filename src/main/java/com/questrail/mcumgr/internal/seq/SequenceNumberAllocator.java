package com.questrail.mcumgr.internal.seq;

import java.util.concurrent.ThreadLocalRandom;

/**
 * SequenceNumberAllocator
 * =============================================================================
 * Issues 8-bit SMP sequence numbers.
 *
 * <p>{@link #next()} returns the current value and then advances it, wrapping
 * from 255 back to 0. Any 256 consecutive calls therefore return every value
 * in {@code 0..255} exactly once.</p>
 *
 * <h2>Starting value</h2>
 * <p>Production managers start at a random value ({@link #random()}) so that a
 * restarted client does not collide with sequence numbers a device still
 * remembers from the previous session. Tests start at a fixed value.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. The owning manager calls it only while holding its lock,
 * paired with the reorder-buffer enqueue.</p>
 */
public final class SequenceNumberAllocator
{
    public static final int MIN_VALUE = 0;
    public static final int MAX_VALUE = 0xFF;

    private int next;

    private SequenceNumberAllocator(int start)
    {
        if (start < MIN_VALUE || start > MAX_VALUE) {
            throw new IllegalArgumentException(
                    "Sequence number must be in range " + MIN_VALUE + ".." + MAX_VALUE
                            + " (was " + start + ")");
        }
        this.next = start;
    }

    public static SequenceNumberAllocator random()
    {
        return new SequenceNumberAllocator(ThreadLocalRandom.current().nextInt(MAX_VALUE + 1));
    }

    public static SequenceNumberAllocator startingAt(int start)
    {
        return new SequenceNumberAllocator(start);
    }

    /**
     * Returns the current sequence number and advances the counter.
     */
    public int next()
    {
        int current = next;
        next = (next + 1) & MAX_VALUE;
        return current;
    }

    /**
     * The value the next call to {@link #next()} will return.
     */
    public int peek()
    {
        return next;
    }
}
