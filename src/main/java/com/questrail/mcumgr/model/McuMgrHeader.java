package com.questrail.mcumgr.model;

import java.util.Objects;
import java.util.Optional;

/**
 * McuMgrHeader
 * -----------------------------------------------------------------------------
 * The fixed 9-byte SMP header. Layout is identical for every framing mode:
 *
 * <pre>
 *   byte 0     version
 *   byte 1     operation
 *   byte 2     flags
 *   bytes 3-4  payload length (big-endian)
 *   bytes 5-6  command group (big-endian)
 *   byte 7     sequence number
 *   byte 8     command id
 * </pre>
 *
 * <p>Numeric fields are held as unsigned {@code int}s so that a header decoded
 * from an unknown peer round-trips even when its version or operation byte has
 * no enum constant. Typed views are available through {@link #knownVersion()}
 * and {@link #knownOperation()}.</p>
 */
public record McuMgrHeader(
        int version,
        int operation,
        int flags,
        int length,
        int group,
        int sequenceNumber,
        int commandId
)
{
    /** Encoded size of a header. */
    public static final int SIZE = 9;

    public McuMgrHeader
    {
        requireUnsigned("version", version, 0xFF);
        requireUnsigned("operation", operation, 0xFF);
        requireUnsigned("flags", flags, 0xFF);
        requireUnsigned("length", length, 0xFFFF);
        requireUnsigned("group", group, 0xFFFF);
        requireUnsigned("sequenceNumber", sequenceNumber, 0xFF);
        requireUnsigned("commandId", commandId, 0xFF);
    }

    /**
     * Typed factory used when building requests.
     */
    public static McuMgrHeader of(McuMgrVersion version,
                                  McuMgrOperation operation,
                                  int flags,
                                  int length,
                                  McuMgrGroup group,
                                  int sequenceNumber,
                                  int commandId)
    {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(group, "group");
        return new McuMgrHeader(version.code(), operation.code(), flags, length,
                group.value(), sequenceNumber, commandId);
    }

    /**
     * Encodes this header into its 9-byte wire form.
     */
    public byte[] toBytes()
    {
        byte[] out = new byte[SIZE];
        out[0] = (byte) version;
        out[1] = (byte) operation;
        out[2] = (byte) flags;
        out[3] = (byte) ((length >>> 8) & 0xFF);
        out[4] = (byte) (length & 0xFF);
        out[5] = (byte) ((group >>> 8) & 0xFF);
        out[6] = (byte) (group & 0xFF);
        out[7] = (byte) sequenceNumber;
        out[8] = (byte) commandId;
        return out;
    }

    /**
     * Decodes the first {@link #SIZE} bytes of {@code data}.
     *
     * @throws IllegalArgumentException if fewer than 9 bytes are available
     */
    public static McuMgrHeader fromBytes(byte[] data)
    {
        Objects.requireNonNull(data, "data");
        if (data.length < SIZE) {
            throw new IllegalArgumentException(
                    "SMP header requires " + SIZE + " bytes (was " + data.length + ")");
        }
        return new McuMgrHeader(
                data[0] & 0xFF,
                data[1] & 0xFF,
                data[2] & 0xFF,
                ((data[3] & 0xFF) << 8) | (data[4] & 0xFF),
                ((data[5] & 0xFF) << 8) | (data[6] & 0xFF),
                data[7] & 0xFF,
                data[8] & 0xFF
        );
    }

    /**
     * Version enum for this header; unknown version bytes map to {@link McuMgrVersion#SMP_V1}.
     */
    public McuMgrVersion knownVersion()
    {
        return McuMgrVersion.fromCode(version).orElse(McuMgrVersion.SMP_V1);
    }

    public Optional<McuMgrOperation> knownOperation()
    {
        return McuMgrOperation.fromCode(operation);
    }

    public McuMgrGroup commandGroup()
    {
        return McuMgrGroup.of(group);
    }

    private static void requireUnsigned(String field, int value, int max)
    {
        if (value < 0 || value > max) {
            throw new IllegalArgumentException(
                    field + " must be in range 0.." + max + " (was " + value + ")");
        }
    }
}
