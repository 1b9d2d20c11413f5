package com.questrail.mcumgr.model;

import java.util.Optional;

/**
 * SMP protocol revision carried in byte 0 of every header.
 *
 * <p>A manager that has not yet observed a response assumes {@link #SMP_V2}.</p>
 */
public enum McuMgrVersion
{
    SMP_V1(0, "SMPv1"),
    SMP_V2(1, "SMPv2");

    private final int code;
    private final String label;

    McuMgrVersion(int code, String label)
    {
        this.code = code;
        this.label = label;
    }

    /**
     * Wire value (unsigned byte).
     */
    public int code()
    {
        return code;
    }

    public static Optional<McuMgrVersion> fromCode(int code)
    {
        for (McuMgrVersion v : values()) {
            if (v.code == code) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString()
    {
        return label;
    }
}
