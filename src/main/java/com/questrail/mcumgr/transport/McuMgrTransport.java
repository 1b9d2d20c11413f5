package com.questrail.mcumgr.transport;

import com.questrail.mcumgr.api.McuMgrCallback;
import com.questrail.mcumgr.model.McuMgrResponse;
import com.questrail.mcumgr.model.McuMgrScheme;

import java.time.Duration;

/**
 * McuMgrTransport
 * -----------------------------------------------------------------------------
 * Port between a manager and whatever carries SMP packets to the device.
 *
 * <p>Implementations own link establishment, chunking, link-level
 * retransmission and response decoding. They do not own ordering: completions
 * may be reported in any order and on any thread.</p>
 */
public interface McuMgrTransport
{
    /**
     * Framing mode and default MTU of this transport.
     */
    McuMgrScheme scheme();

    /**
     * Sends one request packet.
     *
     * <p>{@code callback} MUST be invoked exactly once: with the decoded
     * response, or with a {@link com.questrail.mcumgr.error.McuMgrTransportException}
     * on timeout, disconnect, send failure or undecodable response. When
     * {@code timeout} elapses without a response the transport reports
     * {@link com.questrail.mcumgr.error.McuMgrTransportException.Reason#TIMEOUT}.</p>
     *
     * @param packet  fully framed request, as produced by the packet builder
     * @param timeout how long to wait for the response
     */
    void send(byte[] packet, Duration timeout, McuMgrCallback<McuMgrResponse> callback);
}
