package com.questrail.mcumgr.group.basic;

import com.questrail.mcumgr.error.EnumGroupErrorTable;
import com.questrail.mcumgr.model.McuMgrGroup;

public final class BasicGroupErrorTable extends EnumGroupErrorTable<BasicManagerError>
{
    public BasicGroupErrorTable()
    {
        super(McuMgrGroup.Known.BASIC, BasicManagerError.class);
    }
}
