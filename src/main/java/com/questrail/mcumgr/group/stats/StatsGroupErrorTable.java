package com.questrail.mcumgr.group.stats;

import com.questrail.mcumgr.error.EnumGroupErrorTable;
import com.questrail.mcumgr.model.McuMgrGroup;

public final class StatsGroupErrorTable extends EnumGroupErrorTable<StatsManagerError>
{
    public StatsGroupErrorTable()
    {
        super(McuMgrGroup.Known.STATISTICS, StatsManagerError.class);
    }
}
