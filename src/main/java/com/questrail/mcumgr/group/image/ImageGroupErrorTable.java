package com.questrail.mcumgr.group.image;

import com.questrail.mcumgr.error.EnumGroupErrorTable;
import com.questrail.mcumgr.model.McuMgrGroup;

public final class ImageGroupErrorTable extends EnumGroupErrorTable<ImageManagerError>
{
    public ImageGroupErrorTable()
    {
        super(McuMgrGroup.Known.IMAGE, ImageManagerError.class);
    }
}
