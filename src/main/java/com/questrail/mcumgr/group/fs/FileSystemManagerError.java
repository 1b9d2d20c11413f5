package com.questrail.mcumgr.group.fs;

import com.questrail.mcumgr.error.McuMgrGroupError;
import com.questrail.mcumgr.model.McuMgrGroup;

/**
 * File system group errors.
 */
public enum FileSystemManagerError implements McuMgrGroupError
{
    UNKNOWN(1, "Unknown error"),
    FILE_INVALID_NAME(2, "The specified file name is not valid"),
    FILE_NOT_FOUND(3, "The specified file does not exist"),
    FILE_IS_DIRECTORY(4, "The specified file is a directory, not a file"),
    FILE_OPEN_FAILED(5, "Error occurred whilst attempting to open a file"),
    FILE_SEEK_FAILED(6, "Error occurred whilst attempting to seek to an offset in a file"),
    FILE_READ_FAILED(7, "Error occurred whilst attempting to read data from a file"),
    FILE_TRUNCATE_FAILED(8, "Error occurred whilst trying to truncate file"),
    FILE_DELETE_FAILED(9, "Error occurred whilst trying to delete file"),
    FILE_WRITE_FAILED(10, "Error occurred whilst attempting to write data to a file"),
    FILE_OFFSET_NOT_VALID(11, "The specified data offset is not valid"),
    FILE_OFFSET_LARGER_THAN_FILE(12, "The requested offset is larger than the size of the file on the device"),
    CHECKSUM_HASH_NOT_FOUND(13, "The requested checksum or hash type was not found or is not supported"),
    MOUNT_POINT_NOT_FOUND(14, "The specified mount point was not found or is not mounted"),
    READ_ONLY_FILESYSTEM(15, "The specified mount point is a read-only filesystem"),
    FILE_EMPTY(16, "The operation cannot be performed because the file is empty with no contents");

    private final long code;
    private final String description;

    FileSystemManagerError(long code, String description)
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
        return McuMgrGroup.Known.FILESYSTEM;
    }

    @Override
    public String toString()
    {
        return name() + " (" + description + ")";
    }
}
