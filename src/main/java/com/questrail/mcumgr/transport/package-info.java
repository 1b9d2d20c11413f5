/**
 * SMP Transport Ports
 * =============================================================================
 *
 * <p>{@link com.questrail.mcumgr.transport.McuMgrTransport} is the boundary a
 * manager talks to: packet bytes and a timeout in, exactly one completion out.
 * {@link com.questrail.mcumgr.transport.DatagramEndpoint} is the lower,
 * framework-agnostic socket boundary that datagram transports are built on.</p>
 *
 * <h2>Why two ports</h2>
 * Netty is used for real sockets <strong>without</strong> letting Netty types
 * leak into the protocol core. Everything above the endpoint sees only:
 * <ul>
 *   <li>raw datagram payloads as {@code byte[]}</li>
 *   <li>remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>socket lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Transports MUST:
 * <ul>
 *   <li>complete every request exactly once (response, timeout or failure)</li>
 *   <li>not retry on their own</li>
 *   <li>not reorder on behalf of the manager; ordering is the manager's job</li>
 * </ul>
 */
package com.questrail.mcumgr.transport;
