package com.questrail.mcumgr.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/**
 * McuMgrResponse
 * -----------------------------------------------------------------------------
 * A decoded SMP response: the wire header plus the CBOR payload map.
 *
 * <p>The payload is exposed as a Jackson tree. The reserved
 * {@link McuMgrConstants#HEADER_KEY} entry of CoAP-framed responses has already
 * been removed by the decoder.</p>
 *
 * <p>Responses are treated as immutable once decoded; callers must not mutate
 * {@link #payload()}.</p>
 */
public record McuMgrResponse(McuMgrHeader header, ObjectNode payload)
{
    private static final String RC_KEY = "rc";
    private static final String ERR_KEY = "err";
    private static final String GROUP_KEY = "group";

    public McuMgrResponse
    {
        Objects.requireNonNull(header, "header");
        payload = (payload == null) ? JsonNodeFactory.instance.objectNode() : payload;
    }

    /**
     * SMPv1 return code. Responses without an {@code "rc"} entry are successful,
     * so the absent case reads as {@code 0}.
     */
    public long returnCode()
    {
        return readCode(payload.get(RC_KEY));
    }

    /**
     * SMPv2 group-scoped error, if the response carries an {@code "err"} map
     * whose group fits in 16 bits.
     *
     * @see #errReturnCode()
     */
    public Optional<McuMgrGroupReturnCode> groupReturnCode()
    {
        JsonNode err = payload.get(ERR_KEY);
        if (err == null || !err.isObject()) {
            return Optional.empty();
        }
        JsonNode group = err.get(GROUP_KEY);
        int groupValue = (group != null && group.canConvertToInt()) ? group.asInt() : 0;
        if (groupValue < McuMgrGroup.MIN_VALUE || groupValue > McuMgrGroup.MAX_VALUE) {
            return Optional.empty();
        }
        return Optional.of(new McuMgrGroupReturnCode(groupValue, readCode(err.get(RC_KEY))));
    }

    /**
     * The {@code "rc"} of the {@code "err"} map regardless of its group, or
     * {@code 0} without one. Non-zero here is an error even when the group
     * cannot be named.
     */
    public long errReturnCode()
    {
        JsonNode err = payload.get(ERR_KEY);
        return (err != null && err.isObject()) ? readCode(err.get(RC_KEY)) : 0L;
    }

    /**
     * Reads a CBOR return code. Integers outside the signed 64-bit range
     * saturate, so a non-zero code never reads as {@code 0}.
     */
    static long readCode(JsonNode rc)
    {
        if (rc == null || !rc.isNumber()) {
            return 0L;
        }
        if (rc.isIntegralNumber()) {
            if (rc.canConvertToLong()) {
                return rc.longValue();
            }
            return (rc.bigIntegerValue().signum() < 0) ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        double d = rc.doubleValue();
        if (d == 0.0) {
            return 0L;
        }
        if (Double.isNaN(d) || d >= Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        if (d <= Long.MIN_VALUE) {
            return Long.MIN_VALUE;
        }
        long truncated = (long) d;
        return (truncated != 0) ? truncated : ((d > 0) ? 1L : -1L);
    }

    public McuMgrVersion version()
    {
        return header.knownVersion();
    }

    public int sequenceNumber()
    {
        return header.sequenceNumber();
    }
}
