package com.questrail.mcumgr.error;

import com.questrail.mcumgr.model.McuMgrGroup;

import java.util.Optional;

/**
 * A structured, non-success outcome reported by the device.
 *
 * <p>Implemented by {@link ReturnCodeError} for the generic code space and by
 * each command group's own error enumeration.</p>
 */
public interface McuMgrError
{
    /**
     * Raw numeric return code as carried on the wire.
     */
    long code();

    /**
     * Human-readable description.
     */
    String description();

    /**
     * Command group whose error table produced this error. Empty for generic codes.
     */
    default Optional<McuMgrGroup> group()
    {
        return Optional.empty();
    }
}
