package com.questrail.mcumgr.error;

/**
 * Failure reported by a transport. Passed through to the caller's callback
 * unchanged; nothing in the library retries on it.
 */
public final class McuMgrTransportException extends McuMgrException
{
    public enum Reason
    {
        TIMEOUT,
        DISCONNECTED,
        NOT_CONNECTED,
        SEND_FAILED,
        MALFORMED_RESPONSE
    }

    private final Reason reason;

    public McuMgrTransportException(Reason reason, String message)
    {
        super(message);
        this.reason = reason;
    }

    public McuMgrTransportException(Reason reason, String message, Throwable cause)
    {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason()
    {
        return reason;
    }

    public boolean isTimeout()
    {
        return reason == Reason.TIMEOUT;
    }
}
