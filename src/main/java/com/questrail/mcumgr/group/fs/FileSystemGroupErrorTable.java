package com.questrail.mcumgr.group.fs;

import com.questrail.mcumgr.error.EnumGroupErrorTable;
import com.questrail.mcumgr.model.McuMgrGroup;

public final class FileSystemGroupErrorTable extends EnumGroupErrorTable<FileSystemManagerError>
{
    public FileSystemGroupErrorTable()
    {
        super(McuMgrGroup.Known.FILESYSTEM, FileSystemManagerError.class);
    }
}
