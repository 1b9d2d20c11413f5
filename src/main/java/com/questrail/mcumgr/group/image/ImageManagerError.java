package com.questrail.mcumgr.group.image;

import com.questrail.mcumgr.error.McuMgrGroupError;
import com.questrail.mcumgr.model.McuMgrGroup;

/**
 * Image management group errors.
 */
public enum ImageManagerError implements McuMgrGroupError
{
    UNKNOWN(1, "Unknown error"),
    FLASH_CONFIG_QUERY_FAIL(2, "Failed to query flash area configuration"),
    NO_IMAGE(3, "There is no image in the slot"),
    NO_TLVS(4, "The image in the slot has no TLVs (tag, length, value)"),
    INVALID_TLV(5, "The image in the slot has an invalid TLV type and/or length"),
    TLV_MULTIPLE_HASHES_FOUND(6, "The image in the slot has multiple hash TLVs, which is invalid"),
    TLV_INVALID_SIZE(7, "The image in the slot has an invalid TLV size"),
    HASH_NOT_FOUND(8, "The image in the slot does not have a hash TLV, which is required"),
    NO_FREE_SLOT(9, "There is no free slot to place the image"),
    FLASH_OPEN_FAILED(10, "Flash area opening failed"),
    FLASH_READ_FAILED(11, "Flash area reading failed"),
    FLASH_WRITE_FAILED(12, "Flash area writing failed"),
    FLASH_ERASE_FAILED(13, "Flash area erase failed"),
    INVALID_SLOT(14, "The provided slot is not valid"),
    NO_FREE_MEMORY(15, "Insufficient heap memory (malloc failed)"),
    FLASH_CONTEXT_ALREADY_SET(16, "The flash context is already set"),
    FLASH_CONTEXT_NOT_SET(17, "The flash context is not set"),
    FLASH_AREA_DEVICE_NULL(18, "The device for the flash area is NULL"),
    INVALID_PAGE_OFFSET(19, "The offset for a page number is invalid"),
    INVALID_OFFSET(20, "The offset parameter was not provided and is required"),
    INVALID_LENGTH(21, "The length parameter was not provided and is required"),
    INVALID_IMAGE_HEADER(22, "The image length is smaller than the size of an image header"),
    INVALID_IMAGE_HEADER_MAGIC(23, "The image header magic value does not match the expected value"),
    INVALID_HASH(24, "The hash parameter provided is not valid"),
    INVALID_FLASH_ADDRESS(25, "The image load address does not match the address of the flash area"),
    VERSION_GET_FAILED(26, "Failed to get version of currently running application"),
    CURRENT_VERSION_IS_NEWER(27, "The currently running application is newer than the uploaded version"),
    IMAGE_ALREADY_PENDING(28, "There is already an image operating pending"),
    INVALID_IMAGE_VECTOR_TABLE(29, "The image vector table is invalid"),
    INVALID_IMAGE_TOO_LARGE(30, "The image is too large to fit"),
    INVALID_IMAGE_DATA_OVERRUN(31, "The amount of data sent is larger than the provided image size"),
    IMAGE_CONFIRMATION_DENIED(32, "Confirmation of image has been denied"),
    IMAGE_SETTING_TEST_TO_ACTIVE_DENIED(33, "Setting test to active slot is not allowed"),
    ACTIVE_SLOT_NOT_KNOWN(34, "Current active slot for image cannot be determined");

    private final long code;
    private final String description;

    ImageManagerError(long code, String description)
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
        return McuMgrGroup.Known.IMAGE;
    }

    @Override
    public String toString()
    {
        return name() + " (" + description + ")";
    }
}
