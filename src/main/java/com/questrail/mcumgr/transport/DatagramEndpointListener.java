package com.questrail.mcumgr.transport;

import java.net.SocketAddress;

/**
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Netty endpoints deliver these callbacks serially on the channel's event
 * loop. Listeners must still tolerate being called concurrently with their own
 * outbound {@code send} calls from other threads.</p>
 */
public interface DatagramEndpointListener
{
    /**
     * Called when the socket becomes usable.
     */
    void onTransportUp();

    /**
     * Called when the socket becomes unusable.
     *
     * @param cause an exception or diagnostic cause; may be {@code null} for
     *              orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called when a datagram is received. The payload is a private copy and
     * a complete datagram; no streaming assumptions apply.
     *
     * @param remote  remote sender endpoint
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
