package com.questrail.mcumgr.codec.impl;

import com.questrail.mcumgr.codec.CborCodec;
import com.questrail.mcumgr.codec.McuMgrPacketBuilder;
import com.questrail.mcumgr.model.McuMgrConstants;
import com.questrail.mcumgr.model.McuMgrGroup;
import com.questrail.mcumgr.model.McuMgrHeader;
import com.questrail.mcumgr.model.McuMgrOperation;
import com.questrail.mcumgr.model.McuMgrScheme;
import com.questrail.mcumgr.model.McuMgrVersion;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultMcuMgrPacketBuilder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link McuMgrPacketBuilder}.
 *
 * <p>Stateless apart from its immutable scheme and codec; safe to share
 * between managers and threads.</p>
 */
public final class DefaultMcuMgrPacketBuilder implements McuMgrPacketBuilder
{
    private static final int MAX_PAYLOAD_LENGTH = 0xFFFF;

    private final McuMgrScheme scheme;
    private final CborCodec codec;

    public DefaultMcuMgrPacketBuilder(McuMgrScheme scheme, CborCodec codec)
    {
        this.scheme = Objects.requireNonNull(scheme, "scheme");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public McuMgrScheme scheme()
    {
        return scheme;
    }

    @Override
    public byte[] build(McuMgrVersion version,
                        McuMgrOperation operation,
                        int flags,
                        McuMgrGroup group,
                        int sequenceNumber,
                        int commandId,
                        Map<String, ?> payload)
    {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(group, "group");

        // ---------------------------------------------------------------------
        // 1) Payload without the reserved header key; its encoded size is the
        //    header's length field.
        // ---------------------------------------------------------------------

        final Map<String, Object> stripped = copyOf(payload);
        stripped.remove(McuMgrConstants.HEADER_KEY);

        final byte[] encodedPayload = codec.encode(stripped);
        if (encodedPayload.length > MAX_PAYLOAD_LENGTH) {
            throw new IllegalArgumentException(
                    "Encoded payload of " + encodedPayload.length + " bytes exceeds " + MAX_PAYLOAD_LENGTH);
        }

        final byte[] header = McuMgrHeader.of(version, operation, flags, encodedPayload.length,
                group, sequenceNumber, commandId).toBytes();

        // ---------------------------------------------------------------------
        // 2) Frame according to the scheme.
        // ---------------------------------------------------------------------

        if (scheme.isCoap()) {
            // Header rides inside the map. A header already supplied by the
            // caller is kept as-is.
            final Map<String, Object> coap = copyOf(payload);
            coap.putIfAbsent(McuMgrConstants.HEADER_KEY, header);
            return codec.encode(coap);
        }

        final byte[] packet = new byte[header.length + encodedPayload.length];
        System.arraycopy(header, 0, packet, 0, header.length);
        System.arraycopy(encodedPayload, 0, packet, header.length, encodedPayload.length);
        return packet;
    }

    private static Map<String, Object> copyOf(Map<String, ?> payload)
    {
        return (payload == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
    }
}
