package com.questrail.mcumgr.group.stats;

import com.questrail.mcumgr.error.McuMgrGroupError;
import com.questrail.mcumgr.model.McuMgrGroup;

/**
 * Statistics group errors.
 */
public enum StatsManagerError implements McuMgrGroupError
{
    UNKNOWN(1, "Unknown error"),
    INVALID_GROUP(2, "The provided statistic group name was not found"),
    INVALID_STAT_NAME(3, "The provided statistic name was not found"),
    INVALID_STAT_SIZE(4, "The size of the statistic cannot be handled"),
    WALK_ABORTED(5, "Walk through of statistics was aborted");

    private final long code;
    private final String description;

    StatsManagerError(long code, String description)
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
        return McuMgrGroup.Known.STATISTICS;
    }

    @Override
    public String toString()
    {
        return name() + " (" + description + ")";
    }
}
