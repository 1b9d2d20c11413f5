package com.questrail.mcumgr.group.os;

import com.questrail.mcumgr.error.McuMgrGroupError;
import com.questrail.mcumgr.model.McuMgrGroup;

/**
 * Default (OS) management group errors.
 */
public enum OsManagerError implements McuMgrGroupError
{
    UNKNOWN(1, "Unknown error"),
    INVALID_FORMAT(2, "Provided format value is not valid"),
    QUERY_YIELDS_NO_ANSWER(3, "Query was not recognized"),
    RTC_NOT_SET(4, "RTC is not set"),
    RTC_COMMAND_FAILED(5, "RTC command failed"),
    QUERY_RESPONSE_VALUE_NOT_VALID(6, "Query was recognized but there is no valid value for the response");

    private final long code;
    private final String description;

    OsManagerError(long code, String description)
    {
        this.code = code;
        this.description = description;
    }

    @Override
    public long code()
    {
        return code;
    }

    @Override
    public String description()
    {
        return description;
    }

    @Override
    public McuMgrGroup commandGroup()
    {
        return McuMgrGroup.Known.OS;
    }

    @Override
    public String toString()
    {
        return name() + " (" + description + ")";
    }
}
