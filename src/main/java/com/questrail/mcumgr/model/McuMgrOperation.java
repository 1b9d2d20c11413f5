package com.questrail.mcumgr.model;

import java.util.Optional;

/**
 * Operation code (header byte 1): read/write, request/response.
 */
public enum McuMgrOperation
{
    READ(0),
    READ_RESPONSE(1),
    WRITE(2),
    WRITE_RESPONSE(3);

    private final int code;

    McuMgrOperation(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }

    /**
     * Returns {@code true} for the two response operations.
     */
    public boolean isResponse()
    {
        return this == READ_RESPONSE || this == WRITE_RESPONSE;
    }

    public static Optional<McuMgrOperation> fromCode(int code)
    {
        for (McuMgrOperation op : values()) {
            if (op.code == code) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
