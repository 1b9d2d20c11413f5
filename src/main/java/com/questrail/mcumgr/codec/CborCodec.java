package com.questrail.mcumgr.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.questrail.mcumgr.error.McuMgrDecodeException;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * CborCodec
 * -----------------------------------------------------------------------------
 * Thin wrapper around a Jackson {@link CBORMapper}: string-keyed maps in,
 * CBOR bytes out, and CBOR bytes back into a Jackson tree.
 *
 * <p>Map entries are written sorted by key so that identical maps always
 * produce identical bytes, whatever {@code Map} implementation the caller
 * used. {@code byte[]} values are written as CBOR byte strings.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class CborCodec
{
    private final ObjectMapper mapper;

    public CborCodec()
    {
        this.mapper = CBORMapper.builder()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .build();
    }

    /**
     * Encodes a payload map.
     *
     * @throws IllegalArgumentException if a value has no CBOR representation
     */
    public byte[] encode(Map<String, ?> map)
    {
        Objects.requireNonNull(map, "map");
        try {
            return mapper.writeValueAsBytes(map);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload cannot be encoded as CBOR: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decodes {@code len} bytes starting at {@code off} as a CBOR map. Zero
     * bytes decode to an empty map.
     */
    public ObjectNode decodeMap(byte[] data, int off, int len) throws McuMgrDecodeException
    {
        Objects.requireNonNull(data, "data");
        if (len == 0) {
            return mapper.createObjectNode();
        }
        final JsonNode node;
        try {
            node = mapper.readTree(data, off, len);
        } catch (IOException e) {
            throw new McuMgrDecodeException("Malformed CBOR payload: " + e.getMessage(), e);
        }
        if (node == null || node.isMissingNode()) {
            return mapper.createObjectNode();
        }
        if (!node.isObject()) {
            throw new McuMgrDecodeException("CBOR payload is not a map (was " + node.getNodeType() + ")");
        }
        return (ObjectNode) node;
    }

    public ObjectNode decodeMap(byte[] data) throws McuMgrDecodeException
    {
        return decodeMap(data, 0, Objects.requireNonNull(data, "data").length);
    }

    /**
     * Binds a decoded payload onto a caller-defined response type.
     */
    public <T> T convert(JsonNode payload, Class<T> type) throws McuMgrDecodeException
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(type, "type");
        try {
            return mapper.treeToValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new McuMgrDecodeException("Cannot bind payload to " + type.getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }
}
