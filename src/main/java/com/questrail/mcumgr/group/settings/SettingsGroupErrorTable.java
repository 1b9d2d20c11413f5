package com.questrail.mcumgr.group.settings;

import com.questrail.mcumgr.error.EnumGroupErrorTable;
import com.questrail.mcumgr.model.McuMgrGroup;

public final class SettingsGroupErrorTable extends EnumGroupErrorTable<SettingsManagerError>
{
    public SettingsGroupErrorTable()
    {
        super(McuMgrGroup.Known.SETTINGS, SettingsManagerError.class);
    }
}
