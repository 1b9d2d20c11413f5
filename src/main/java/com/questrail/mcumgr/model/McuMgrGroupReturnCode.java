package com.questrail.mcumgr.model;

/**
 * Group-scoped return code, as carried by SMPv2 responses in the
 * {@code "err": {"group": g, "rc": r}} map.
 *
 * @param group raw command group the error originated from
 * @param rc    group-specific return code
 */
public record McuMgrGroupReturnCode(int group, long rc)
{
    public McuMgrGroupReturnCode
    {
        if (group < McuMgrGroup.MIN_VALUE || group > McuMgrGroup.MAX_VALUE) {
            throw new IllegalArgumentException("group out of range: " + group);
        }
    }

    public McuMgrGroup commandGroup()
    {
        return McuMgrGroup.of(group);
    }
}
