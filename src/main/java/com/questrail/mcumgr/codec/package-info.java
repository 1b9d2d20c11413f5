/**
 * SMP Codec: Wire-Level Implementation
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong>: the only place
 * where SMP header bytes and CBOR payload bytes are produced or consumed.</p>
 *
 * <h2>Framing modes</h2>
 * <pre>
 *   datagram   [ 9-byte header ][ CBOR map (reserved key stripped) ]
 *
 *   CoAP       CBOR map { "_h": h'9-byte header', ...payload }
 * </pre>
 *
 * <p>In both modes the header's length field is the encoded length of the
 * payload map <em>without</em> the reserved {@code "_h"} entry.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   McuManager.send(...)
 *        → McuMgrPacketBuilder        (header + CBOR → bytes)
 *            → McuMgrTransport.send
 *
 *   transport bytes
 *        → McuMgrResponseDecoder      (bytes → header + CBOR tree)
 *            → McuMgrResponse
 * </pre>
 *
 * <p>The CBOR encoder itself is Jackson's CBOR data format, wrapped by
 * {@link com.questrail.mcumgr.codec.CborCodec}; length-prefixing and map
 * ordering are its responsibility.</p>
 */
package com.questrail.mcumgr.codec;
