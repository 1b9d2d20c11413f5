package com.questrail.mcumgr.error;

import com.questrail.mcumgr.model.McuMgrGroup;
import com.questrail.mcumgr.model.McuMgrGroupReturnCode;
import com.questrail.mcumgr.model.McuMgrResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * GroupErrorRegistry
 * =============================================================================
 * Resolves raw return codes into structured {@link McuMgrError}s.
 *
 * <h2>Resolution rules</h2>
 * <ul>
 *   <li>Code {@code 0} is success for every group: resolution yields empty.</li>
 *   <li>A group with a registered {@link GroupErrorTable} and a code that table
 *       knows yields the group's own error.</li>
 *   <li>Anything else falls back to {@link ReturnCodeError}.</li>
 * </ul>
 *
 * <p>The core has no compile-time knowledge of any group's error set. Tables
 * are contributed independently, either through {@link ServiceLoader} (see
 * {@link #loadDefault()}) or through {@link #register(GroupErrorTable)}.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * GroupErrorRegistry registry = GroupErrorRegistry.loadDefault();
 * Optional<McuMgrError> err = registry.resolve(response);
 * }</pre>
 *
 * <p>Thread-safe.</p>
 */
public final class GroupErrorRegistry
{
    private static final Logger log = LoggerFactory.getLogger(GroupErrorRegistry.class);

    private final Map<Integer, GroupErrorTable> tables = new ConcurrentHashMap<>();

    /**
     * Creates a registry with no group tables; every error resolves generically.
     */
    public GroupErrorRegistry()
    {
    }

    /**
     * Creates a registry populated with every {@link GroupErrorTable} visible
     * to this class's class loader.
     */
    public static GroupErrorRegistry loadDefault()
    {
        GroupErrorRegistry registry = new GroupErrorRegistry();
        ServiceLoader.load(GroupErrorTable.class, GroupErrorRegistry.class.getClassLoader())
                .stream()
                .map(ServiceLoader.Provider::get)
                .forEach(registry::register);
        return registry;
    }

    /**
     * Adds or replaces the table for {@code table.group()}.
     */
    public GroupErrorRegistry register(GroupErrorTable table)
    {
        Objects.requireNonNull(table, "table");
        GroupErrorTable previous = tables.put(table.group().value(), table);
        if (previous != null && previous != table) {
            log.debug("Replaced error table for group {}: {} -> {}",
                    table.group(), previous.getClass().getName(), table.getClass().getName());
        }
        return this;
    }

    public boolean hasTable(McuMgrGroup group)
    {
        return tables.containsKey(Objects.requireNonNull(group, "group").value());
    }

    /**
     * Resolves a generic (group-less) return code.
     */
    public Optional<McuMgrError> resolve(long rc)
    {
        if (rc == 0) {
            return Optional.empty();
        }
        return Optional.of(new ReturnCodeError(rc));
    }

    /**
     * Resolves a group-scoped return code.
     */
    public Optional<McuMgrError> resolve(McuMgrGroup group, long rc)
    {
        Objects.requireNonNull(group, "group");
        if (rc == 0) {
            return Optional.empty();
        }
        GroupErrorTable table = tables.get(group.value());
        if (table != null) {
            Optional<McuMgrError> groupError = table.resolve(rc);
            if (groupError.isPresent()) {
                return groupError;
            }
        }
        return Optional.of(new ReturnCodeError(rc));
    }

    public Optional<McuMgrError> resolve(McuMgrGroupReturnCode code)
    {
        Objects.requireNonNull(code, "code");
        return resolve(code.commandGroup(), code.rc());
    }

    /**
     * Resolves whichever error a response carries. An SMPv2 {@code "err"} map
     * takes precedence over an SMPv1 {@code "rc"} entry.
     */
    public Optional<McuMgrError> resolve(McuMgrResponse response)
    {
        Objects.requireNonNull(response, "response");
        Optional<McuMgrGroupReturnCode> groupCode = response.groupReturnCode();
        if (groupCode.isPresent() && groupCode.get().rc() != 0) {
            return resolve(groupCode.get());
        }
        long errCode = response.errReturnCode();
        if (errCode != 0) {
            // group outside 16 bits: no table can claim it
            return resolve(errCode);
        }
        return resolve(response.returnCode());
    }
}
