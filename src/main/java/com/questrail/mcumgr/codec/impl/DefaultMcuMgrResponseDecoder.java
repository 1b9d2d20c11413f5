package com.questrail.mcumgr.codec.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.mcumgr.codec.CborCodec;
import com.questrail.mcumgr.codec.McuMgrResponseDecoder;
import com.questrail.mcumgr.error.McuMgrDecodeException;
import com.questrail.mcumgr.model.McuMgrConstants;
import com.questrail.mcumgr.model.McuMgrHeader;
import com.questrail.mcumgr.model.McuMgrResponse;
import com.questrail.mcumgr.model.McuMgrScheme;

import java.io.IOException;
import java.util.Objects;

/**
 * DefaultMcuMgrResponseDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link McuMgrResponseDecoder}; the mechanical
 * inverse of {@link DefaultMcuMgrPacketBuilder}.
 *
 * <p>Datagram framing: the header's length field bounds the CBOR payload.
 * Trailing bytes beyond it are ignored. A payload shorter than advertised is
 * rejected.</p>
 */
public final class DefaultMcuMgrResponseDecoder implements McuMgrResponseDecoder
{
    private final McuMgrScheme scheme;
    private final CborCodec codec;

    public DefaultMcuMgrResponseDecoder(McuMgrScheme scheme, CborCodec codec)
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
    public McuMgrResponse decode(byte[] data) throws McuMgrDecodeException
    {
        Objects.requireNonNull(data, "data");
        return scheme.isCoap() ? decodeCoap(data) : decodeDatagram(data);
    }

    private McuMgrResponse decodeDatagram(byte[] data) throws McuMgrDecodeException
    {
        if (data.length < McuMgrHeader.SIZE) {
            throw new McuMgrDecodeException(
                    "Packet too short for SMP header (" + data.length + " bytes)");
        }

        McuMgrHeader header = McuMgrHeader.fromBytes(data);
        int available = data.length - McuMgrHeader.SIZE;
        if (available < header.length()) {
            throw new McuMgrDecodeException(
                    "Truncated payload: header declares " + header.length()
                            + " bytes but only " + available + " received");
        }

        ObjectNode payload = codec.decodeMap(data, McuMgrHeader.SIZE, header.length());
        return new McuMgrResponse(header, payload);
    }

    private McuMgrResponse decodeCoap(byte[] data) throws McuMgrDecodeException
    {
        ObjectNode payload = codec.decodeMap(data);

        JsonNode headerNode = payload.remove(McuMgrConstants.HEADER_KEY);
        if (headerNode == null || !headerNode.isBinary()) {
            throw new McuMgrDecodeException(
                    "CoAP payload has no '" + McuMgrConstants.HEADER_KEY + "' byte string");
        }

        final byte[] headerBytes;
        try {
            headerBytes = headerNode.binaryValue();
        } catch (IOException e) {
            throw new McuMgrDecodeException("Unreadable CoAP header entry", e);
        }
        if (headerBytes.length < McuMgrHeader.SIZE) {
            throw new McuMgrDecodeException(
                    "CoAP header entry too short (" + headerBytes.length + " bytes)");
        }

        return new McuMgrResponse(McuMgrHeader.fromBytes(headerBytes), payload);
    }
}
