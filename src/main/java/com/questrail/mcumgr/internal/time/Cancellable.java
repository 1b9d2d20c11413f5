package com.questrail.mcumgr.internal.time;

/**
 * Cancellation handle for a scheduled task, typically a request timeout that
 * becomes moot once the response arrives.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
