package com.questrail.mcumgr.api;

/**
 * Completion callback for an SMP request.
 *
 * <p>Invoked exactly once per request, on whichever thread completed the
 * request. Callbacks issued by one manager run one at a time and in the order
 * the requests were sent; they must return promptly and must not block.</p>
 */
@FunctionalInterface
public interface McuMgrCallback<T>
{
    void onComplete(McuMgrResult<T> result);
}
