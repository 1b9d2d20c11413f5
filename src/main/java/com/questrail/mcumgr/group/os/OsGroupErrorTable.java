package com.questrail.mcumgr.group.os;

import com.questrail.mcumgr.error.EnumGroupErrorTable;
import com.questrail.mcumgr.model.McuMgrGroup;

public final class OsGroupErrorTable extends EnumGroupErrorTable<OsManagerError>
{
    public OsGroupErrorTable()
    {
        super(McuMgrGroup.Known.OS, OsManagerError.class);
    }
}
