package com.questrail.mcumgr.codec;

import com.questrail.mcumgr.model.McuMgrGroup;
import com.questrail.mcumgr.model.McuMgrOperation;
import com.questrail.mcumgr.model.McuMgrScheme;
import com.questrail.mcumgr.model.McuMgrVersion;

import java.util.Map;

/**
 * McuMgrPacketBuilder
 * -----------------------------------------------------------------------------
 * Outbound wire boundary: header fields plus a payload map in, transport-ready
 * bytes out.
 *
 * <p>Implementations are bound to one {@link McuMgrScheme} and must be pure:
 * identical arguments always yield byte-identical output. Resending a request
 * with the same sequence number therefore reproduces the original packet.</p>
 */
public interface McuMgrPacketBuilder
{
    /**
     * The scheme (framing mode) this builder produces packets for.
     */
    McuMgrScheme scheme();

    /**
     * Builds one request packet.
     *
     * @param payload string-keyed payload; {@code null} is treated as an empty
     *                map. The reserved header key is never counted in the
     *                header's length field.
     * @throws IllegalArgumentException if a field is out of range or the
     *                                  encoded payload exceeds 65535 bytes
     */
    byte[] build(McuMgrVersion version,
                 McuMgrOperation operation,
                 int flags,
                 McuMgrGroup group,
                 int sequenceNumber,
                 int commandId,
                 Map<String, ?> payload);
}
