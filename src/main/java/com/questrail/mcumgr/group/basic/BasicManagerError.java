package com.questrail.mcumgr.group.basic;

import com.questrail.mcumgr.error.McuMgrGroupError;
import com.questrail.mcumgr.model.McuMgrGroup;

/**
 * Zephyr basic management group errors.
 */
public enum BasicManagerError implements McuMgrGroupError
{
    UNKNOWN(1, "Unknown error"),
    FLASH_OPEN_FAILED(2, "Opening of the flash area has failed"),
    FLASH_CONFIG_QUERY_FAIL(3, "Querying the flash area parameters has failed"),
    FLASH_ERASE_FAILED(4, "Erasing the flash area has failed");

    private final long code;
    private final String description;

    BasicManagerError(long code, String description)
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
        return McuMgrGroup.Known.BASIC;
    }

    @Override
    public String toString()
    {
        return name() + " (" + description + ")";
    }
}
