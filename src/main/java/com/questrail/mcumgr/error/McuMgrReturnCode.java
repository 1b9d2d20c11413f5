package com.questrail.mcumgr.error;

import java.util.Optional;

/**
 * McuMgrReturnCode
 * -----------------------------------------------------------------------------
 * Generic SMP return codes ({@code "rc"}). Every response carries one; a
 * response without it is treated as {@link #OK}.
 *
 * <p>Codes at or above {@link #USER_DEFINED_ERROR} are application-defined and
 * have no constant of their own; {@link #describe(long)} covers them.</p>
 */
public enum McuMgrReturnCode
{
    OK(0, "OK"),
    UNKNOWN(1, "Unknown error"),
    NO_MEMORY(2, "No memory"),
    IN_VALUE(3, "Invalid value"),
    TIMEOUT(4, "Timeout"),
    // For filesystem operations this usually means the mount point does not match the target.
    NO_ENTRY(5, "No entry"),
    BAD_STATE(6, "Bad state"),
    RESPONSE_TOO_LONG(7, "Response is too long"),
    UNSUPPORTED(8, "Not supported"),
    CORRUPT_PAYLOAD(9, "Corrupt payload"),
    BUSY(10, "Busy, try again later"),
    ACCESS_DENIED(11, "Access denied"),
    UNSUPPORTED_TOO_OLD(12, "Requested SMP protocol version is too old"),
    UNSUPPORTED_TOO_NEW(13, "Requested SMP protocol version is too new"),
    USER_DEFINED_ERROR(256, "User-defined error");

    private final long value;
    private final String description;

    McuMgrReturnCode(long value, String description)
    {
        this.value = value;
        this.description = description;
    }

    public long value()
    {
        return value;
    }

    public String description()
    {
        return description;
    }

    public boolean isSuccess()
    {
        return this == OK;
    }

    public boolean isError()
    {
        return this != OK;
    }

    /**
     * {@code false} for the three "not supported" flavours.
     */
    public boolean isSupported()
    {
        return this != UNSUPPORTED && this != UNSUPPORTED_TOO_OLD && this != UNSUPPORTED_TOO_NEW;
    }

    public static Optional<McuMgrReturnCode> valueOf(long value)
    {
        for (McuMgrReturnCode rc : values()) {
            if (rc.value == value) {
                return Optional.of(rc);
            }
        }
        return Optional.empty();
    }

    /**
     * Human-readable text for any raw return code.
     */
    public static String describe(long value)
    {
        Optional<McuMgrReturnCode> known = valueOf(value);
        if (known.isPresent()) {
            return known.get().description;
        }
        if (value >= USER_DEFINED_ERROR.value) {
            return "User-defined error (code " + value + ")";
        }
        return "Unrecognized (code " + value + ")";
    }
}
