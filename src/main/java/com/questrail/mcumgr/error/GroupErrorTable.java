package com.questrail.mcumgr.error;

import com.questrail.mcumgr.model.McuMgrGroup;

import java.util.Optional;

/**
 * GroupErrorTable
 * -----------------------------------------------------------------------------
 * Service-provider interface: one implementation per command group that
 * defines its own error codes.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader}
 * from {@code META-INF/services/com.questrail.mcumgr.error.GroupErrorTable},
 * or registered programmatically with {@link GroupErrorRegistry#register}.
 * They must have a public no-argument constructor to be discoverable.</p>
 */
public interface GroupErrorTable
{
    /**
     * The group this table resolves codes for.
     */
    McuMgrGroup group();

    /**
     * Resolves a non-zero group return code.
     *
     * @return the group-specific error, or empty if this table has no entry
     */
    Optional<McuMgrError> resolve(long rc);
}
