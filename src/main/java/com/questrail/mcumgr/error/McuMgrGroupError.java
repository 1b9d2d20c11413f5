package com.questrail.mcumgr.error;

import com.questrail.mcumgr.model.McuMgrGroup;

import java.util.Optional;

/**
 * Error meaning defined by one command group's own table. The same numeric
 * code means different things in different groups.
 */
public interface McuMgrGroupError extends McuMgrError
{
    McuMgrGroup commandGroup();

    @Override
    default Optional<McuMgrGroup> group()
    {
        return Optional.of(commandGroup());
    }
}
