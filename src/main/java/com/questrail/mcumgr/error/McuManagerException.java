package com.questrail.mcumgr.error;

import com.questrail.mcumgr.model.McuMgrConstants;

/**
 * Configuration error raised synchronously by a manager. These never reach
 * the transport.
 */
public final class McuManagerException extends McuMgrException
{
    public enum Reason
    {
        MTU_OUT_OF_RANGE,
        MTU_UNCHANGED
    }

    private final Reason reason;
    private final int value;

    private McuManagerException(Reason reason, int value, String message)
    {
        super(message);
        this.reason = reason;
        this.value = value;
    }

    public static McuManagerException mtuOutOfRange(int mtu)
    {
        return new McuManagerException(Reason.MTU_OUT_OF_RANGE, mtu,
                "New MTU value " + mtu + " is outside valid range of "
                        + McuMgrConstants.MIN_MTU + ".." + McuMgrConstants.MAX_MTU);
    }

    public static McuManagerException mtuUnchanged(int mtu)
    {
        return new McuManagerException(Reason.MTU_UNCHANGED, mtu,
                "MTU value already set to " + mtu);
    }

    public Reason reason()
    {
        return reason;
    }

    /**
     * The rejected value.
     */
    public int value()
    {
        return value;
    }
}
