package com.questrail.mcumgr.error;

import java.util.OptionalLong;

/**
 * Root of every failure this library reports.
 *
 * <p>{@link #getMessage()} is the human-readable description. Where the
 * failure has a numeric protocol code, {@link #code()} exposes it for
 * programmatic matching.</p>
 */
public class McuMgrException extends Exception
{
    public McuMgrException(String message)
    {
        super(message);
    }

    public McuMgrException(String message, Throwable cause)
    {
        super(message, cause);
    }

    /**
     * Numeric code associated with this failure, if any.
     */
    public OptionalLong code()
    {
        return OptionalLong.empty();
    }
}
