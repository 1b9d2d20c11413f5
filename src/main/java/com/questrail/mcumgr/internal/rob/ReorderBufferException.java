package com.questrail.mcumgr.internal.rob;

import com.questrail.mcumgr.error.McuMgrException;

/**
 * Correlation failure inside a {@link ReorderBuffer}. Signals a protocol or
 * implementation fault; the buffer's state is left untouched.
 */
public final class ReorderBufferException extends McuMgrException
{
    public enum Reason
    {
        /** An expectation was registered for a key that is still pending. */
        DUPLICATE_EXPECTATION,
        /** An outcome arrived for a key that was never registered (or already delivered). */
        UNEXPECTED_RESPONSE,
        /** A second outcome arrived for a key whose outcome is already buffered. */
        DUPLICATE_RESPONSE
    }

    private final Reason reason;
    private final Object key;

    ReorderBufferException(Reason reason, Object key, String message)
    {
        super(message);
        this.reason = reason;
        this.key = key;
    }

    public Reason reason()
    {
        return reason;
    }

    /**
     * The offending key (a sequence number, for managers).
     */
    public Object key()
    {
        return key;
    }
}
