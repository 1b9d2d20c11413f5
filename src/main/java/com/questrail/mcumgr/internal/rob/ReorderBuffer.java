package com.questrail.mcumgr.internal.rob;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * ReorderBuffer
 * =============================================================================
 * Releases asynchronously completed outcomes strictly in the order their
 * expectations were registered.
 *
 * <h2>Problem</h2>
 * <p>A transport may complete outstanding requests in any order. Handing each
 * completion straight to its caller would let a later request overtake an
 * earlier one that is still in flight. This buffer holds early outcomes back
 * until everything registered before them has completed.</p>
 *
 * <h2>Model</h2>
 * <pre>
 *   pending (issue order):   [ 7 ][ 8 ][ 9 ]
 *   slots:                     -   ok   err
 *
 *   received(x, 7)  → true     (7 is now the filled head)
 *   deliver(cb)     → cb(7,x), cb(8,ok), cb(9,err)
 * </pre>
 *
 * <ul>
 *   <li>Keys are ordered only by queue position, never by value, so sequence
 *       number wraparound has no effect on ordering.</li>
 *   <li>A failure outcome is an outcome: it fills its slot and unblocks the
 *       queue like a success does.</li>
 *   <li>Every registered key is handed to a {@code deliver} callback exactly
 *       once, after which it is forgotten and may be registered again.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. Callers serialise {@code enqueueExpectation} and each
 * {@code received} + {@code deliver} pair under one lock.</p>
 *
 * @param <K> correlation key (sequence number)
 * @param <V> outcome type
 */
public final class ReorderBuffer<K, V>
{
    private final Deque<K> pending = new ArrayDeque<>();
    private final Map<K, Slot<V>> slots = new HashMap<>();

    /**
     * Appends {@code key} to the tail of the pending queue with an empty slot.
     *
     * @throws ReorderBufferException with {@link ReorderBufferException.Reason#DUPLICATE_EXPECTATION}
     *                                if {@code key} has not been delivered yet
     */
    public void enqueueExpectation(K key) throws ReorderBufferException
    {
        Objects.requireNonNull(key, "key");
        if (slots.containsKey(key)) {
            throw new ReorderBufferException(ReorderBufferException.Reason.DUPLICATE_EXPECTATION, key,
                    "Expectation for " + key + " is still pending");
        }
        slots.put(key, new Slot<>());
        pending.addLast(key);
    }

    /**
     * Stores the outcome for {@code key}. Nothing is delivered here.
     *
     * @return {@code true} if the head of the queue is now complete, i.e. a
     *         call to {@link #deliver} will hand out at least one outcome
     * @throws ReorderBufferException if {@code key} is unknown or already has an outcome
     */
    public boolean received(V outcome, K key) throws ReorderBufferException
    {
        Objects.requireNonNull(key, "key");
        Slot<V> slot = slots.get(key);
        if (slot == null) {
            throw new ReorderBufferException(ReorderBufferException.Reason.UNEXPECTED_RESPONSE, key,
                    "No pending expectation for " + key);
        }
        if (slot.filled) {
            throw new ReorderBufferException(ReorderBufferException.Reason.DUPLICATE_RESPONSE, key,
                    "Outcome for " + key + " was already received");
        }
        slot.fill(outcome);
        return isHeadComplete();
    }

    /**
     * Hands every completed outcome at the head of the queue to
     * {@code callback}, oldest first, stopping at the first entry that is still
     * waiting. Each entry is removed before its callback runs, so a callback
     * that re-enters this buffer sees a consistent queue.
     *
     * @return the number of outcomes delivered
     */
    public int deliver(BiConsumer<? super K, ? super V> callback)
    {
        Objects.requireNonNull(callback, "callback");
        int delivered = 0;
        while (isHeadComplete()) {
            K key = pending.pollFirst();
            Slot<V> slot = slots.remove(key);
            delivered++;
            callback.accept(key, slot.outcome);
        }
        return delivered;
    }

    /**
     * Whether {@code key} is registered and not yet delivered.
     */
    public boolean isPending(K key)
    {
        return slots.containsKey(key);
    }

    /**
     * Number of registered, undelivered keys (buffered or still waiting).
     */
    public int pendingCount()
    {
        return pending.size();
    }

    public boolean isEmpty()
    {
        return pending.isEmpty();
    }

    private boolean isHeadComplete()
    {
        K head = pending.peekFirst();
        return head != null && slots.get(head).filled;
    }

    private static final class Slot<V>
    {
        private boolean filled;
        private V outcome;

        private void fill(V outcome)
        {
            this.outcome = outcome;
            this.filled = true;
        }
    }
}
