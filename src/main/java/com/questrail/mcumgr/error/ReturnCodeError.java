package com.questrail.mcumgr.error;

import java.util.Optional;

/**
 * Generic numeric-code error. Also the fallback for group errors whose group
 * or code has no table entry.
 */
public record ReturnCodeError(long code) implements McuMgrError
{
    public ReturnCodeError
    {
        if (code == 0) {
            throw new IllegalArgumentException("0 is the success code, not an error");
        }
    }

    /**
     * The matching constant, or empty for user-defined and unrecognized codes.
     */
    public Optional<McuMgrReturnCode> returnCode()
    {
        return McuMgrReturnCode.valueOf(code);
    }

    @Override
    public String description()
    {
        return McuMgrReturnCode.describe(code);
    }

    @Override
    public String toString()
    {
        return description() + " (rc: " + code + ")";
    }
}
