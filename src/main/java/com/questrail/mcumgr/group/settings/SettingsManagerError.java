package com.questrail.mcumgr.group.settings;

import com.questrail.mcumgr.error.McuMgrGroupError;
import com.questrail.mcumgr.model.McuMgrGroup;

/**
 * Settings (system configuration) group errors.
 */
public enum SettingsManagerError implements McuMgrGroupError
{
    UNKNOWN(1, "Unknown error"),
    KEY_TOO_LONG(2, "The provided key name is too long to be used"),
    KEY_NOT_FOUND(3, "The provided key name does not exist"),
    READ_NOT_SUPPORTED(4, "The provided key name does not support being read"),
    ROOT_KEY_NOT_FOUND(5, "The provided root key name does not exist"),
    WRITE_NOT_SUPPORTED(6, "The provided key name does not support being written"),
    DELETE_NOT_SUPPORTED(7, "The provided key name does not support being deleted");

    private final long code;
    private final String description;

    SettingsManagerError(long code, String description)
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
        return McuMgrGroup.Known.SETTINGS;
    }

    @Override
    public String toString()
    {
        return name() + " (" + description + ")";
    }
}
