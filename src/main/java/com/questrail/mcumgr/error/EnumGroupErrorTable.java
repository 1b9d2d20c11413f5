package com.questrail.mcumgr.error;

import com.questrail.mcumgr.model.McuMgrGroup;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link GroupErrorTable} backed by an enum whose constants are the group's
 * errors.
 */
public abstract class EnumGroupErrorTable<E extends Enum<E> & McuMgrGroupError> implements GroupErrorTable
{
    private final McuMgrGroup group;
    private final Class<E> type;

    protected EnumGroupErrorTable(McuMgrGroup group, Class<E> type)
    {
        this.group = Objects.requireNonNull(group, "group");
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public final McuMgrGroup group()
    {
        return group;
    }

    @Override
    public final Optional<McuMgrError> resolve(long rc)
    {
        for (E e : type.getEnumConstants()) {
            if (e.code() == rc) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }
}
