package com.questrail.mcumgr.transport.udp;

import com.questrail.mcumgr.api.McuMgrCallback;
import com.questrail.mcumgr.api.McuMgrResult;
import com.questrail.mcumgr.codec.McuMgrResponseDecoder;
import com.questrail.mcumgr.error.McuMgrDecodeException;
import com.questrail.mcumgr.error.McuMgrTransportException;
import com.questrail.mcumgr.error.McuMgrTransportException.Reason;
import com.questrail.mcumgr.internal.time.Cancellable;
import com.questrail.mcumgr.internal.time.MonotonicClock;
import com.questrail.mcumgr.internal.time.MonotonicScheduler;
import com.questrail.mcumgr.model.McuMgrHeader;
import com.questrail.mcumgr.model.McuMgrResponse;
import com.questrail.mcumgr.model.McuMgrScheme;
import com.questrail.mcumgr.observability.McuMgrErrorEvent;
import com.questrail.mcumgr.observability.McuMgrObservabilitySink;
import com.questrail.mcumgr.observability.McuMgrTransportEvent;
import com.questrail.mcumgr.transport.DatagramEndpoint;
import com.questrail.mcumgr.transport.DatagramEndpointListener;
import com.questrail.mcumgr.transport.McuMgrTransport;

import java.net.SocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * UdpMcuMgrTransport
 * =============================================================================
 * {@link McuMgrTransport} for SMP over plain UDP (datagram framing), built on
 * the {@link DatagramEndpoint} port.
 *
 * <h2>Correlation</h2>
 * Each outstanding request is keyed by the sequence number in its header. An
 * inbound datagram is decoded and matched by the sequence number of the
 * response header. A datagram that matches nothing is reported to the
 * observability sink and dropped:
 * <ul>
 *   <li>{@code LATE_RESPONSE} when its request already timed out</li>
 *   <li>{@code UNSOLICITED_RESPONSE} otherwise, or when it comes from a
 *       sender other than the configured device</li>
 *   <li>{@code MALFORMED_DATAGRAM} when it does not decode, or is not a
 *       response</li>
 * </ul>
 *
 * <h2>Completion</h2>
 * Every request completes exactly once: with the response, with
 * {@link Reason#TIMEOUT} when its timer fires first, with
 * {@link Reason#DISCONNECTED} when the socket goes down while it is
 * outstanding, or immediately with {@link Reason#NOT_CONNECTED} /
 * {@link Reason#SEND_FAILED}. Callbacks are invoked on the thread that
 * caused the completion (endpoint, scheduler or caller) and never while this
 * class holds a lock.
 *
 * <p>Nothing is retransmitted.</p>
 */
public final class UdpMcuMgrTransport implements McuMgrTransport, DatagramEndpointListener
{
    /** Port the mcumgr UDP transport listens on by default. */
    public static final int DEFAULT_PORT = 1337;

    private final DatagramEndpoint endpoint;
    private final SocketAddress remote;
    private final McuMgrResponseDecoder decoder;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final McuMgrObservabilitySink sink;

    private final Map<Integer, Outstanding> outstanding = new ConcurrentHashMap<>();
    private final Set<Integer> timedOut = ConcurrentHashMap.newKeySet();

    private volatile boolean up;

    public UdpMcuMgrTransport(DatagramEndpoint endpoint,
                              SocketAddress remote,
                              McuMgrResponseDecoder decoder,
                              MonotonicScheduler scheduler,
                              MonotonicClock clock,
                              McuMgrObservabilitySink sink)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNull(sink, "sink");

        if (decoder.scheme() != McuMgrScheme.UDP) {
            throw new IllegalArgumentException("UDP transport requires a UDP decoder (was " + decoder.scheme() + ")");
        }

        this.endpoint.setListener(this);
    }

    public void start()
    {
        endpoint.start();
    }

    public void stop()
    {
        endpoint.stop();
    }

    public boolean isUp()
    {
        return up;
    }

    public SocketAddress remote()
    {
        return remote;
    }

    /**
     * Requests sent and not yet completed.
     */
    public int outstandingCount()
    {
        return outstanding.size();
    }

    @Override
    public McuMgrScheme scheme()
    {
        return McuMgrScheme.UDP;
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    @Override
    public void send(byte[] packet, Duration timeout, McuMgrCallback<McuMgrResponse> callback)
    {
        Objects.requireNonNull(packet, "packet");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(callback, "callback");

        final int sequenceNumber = McuMgrHeader.fromBytes(packet).sequenceNumber();

        if (!up) {
            callback.onComplete(McuMgrResult.failure(new McuMgrTransportException(
                    Reason.NOT_CONNECTED, "UDP transport to " + remote + " is not connected")));
            return;
        }

        Outstanding request = new Outstanding(sequenceNumber, callback);
        if (outstanding.putIfAbsent(sequenceNumber, request) != null) {
            callback.onComplete(McuMgrResult.failure(new McuMgrTransportException(
                    Reason.SEND_FAILED, "Sequence number " + sequenceNumber + " is already outstanding")));
            return;
        }
        timedOut.remove(sequenceNumber);

        request.timeout = scheduler.scheduleAfter(timeout, clock, () -> onTimeout(request, timeout));

        try {
            endpoint.send(remote, packet);
        } catch (RuntimeException e) {
            if (outstanding.remove(sequenceNumber, request)) {
                request.complete(McuMgrResult.failure(new McuMgrTransportException(
                        Reason.SEND_FAILED, "Failed to send seq " + sequenceNumber + ": " + e.getMessage(), e)));
            }
        }
    }

    private void onTimeout(Outstanding request, Duration timeout)
    {
        if (!outstanding.remove(request.sequenceNumber, request)) {
            return;
        }
        timedOut.add(request.sequenceNumber);
        request.complete(McuMgrResult.failure(new McuMgrTransportException(
                Reason.TIMEOUT, "No response for seq " + request.sequenceNumber + " within " + timeout.toMillis() + " ms")));
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp()
    {
        up = true;
        sink.onTransportEvent(new McuMgrTransportEvent(Instant.now(),
                McuMgrTransportEvent.Kind.TRANSPORT_UP, "remote " + remote));
    }

    @Override
    public void onTransportDown(Throwable cause)
    {
        up = false;
        sink.onTransportEvent(new McuMgrTransportEvent(Instant.now(),
                McuMgrTransportEvent.Kind.TRANSPORT_DOWN,
                (cause != null) ? String.valueOf(cause.getMessage()) : "closed"));

        List<Outstanding> failed = new ArrayList<>();
        for (Outstanding request : outstanding.values()) {
            if (outstanding.remove(request.sequenceNumber, request)) {
                failed.add(request);
            }
        }
        timedOut.clear();

        for (Outstanding request : failed) {
            request.complete(McuMgrResult.failure(new McuMgrTransportException(
                    Reason.DISCONNECTED, "Transport went down with seq " + request.sequenceNumber + " outstanding", cause)));
        }
    }

    @Override
    public void onDatagram(SocketAddress sender, byte[] payload)
    {
        if (!remote.equals(sender)) {
            transportEvent(McuMgrTransportEvent.Kind.UNSOLICITED_RESPONSE,
                    payload.length + " bytes from unexpected sender " + sender);
            return;
        }

        final McuMgrResponse response;
        try {
            response = decoder.decode(payload);
        } catch (McuMgrDecodeException e) {
            transportEvent(McuMgrTransportEvent.Kind.MALFORMED_DATAGRAM, e.getMessage());
            return;
        }

        boolean isResponse = response.header().knownOperation().map(op -> op.isResponse()).orElse(false);
        if (!isResponse) {
            transportEvent(McuMgrTransportEvent.Kind.MALFORMED_DATAGRAM,
                    "Not a response (op " + response.header().operation() + ", seq " + response.sequenceNumber() + ")");
            return;
        }

        int sequenceNumber = response.sequenceNumber();
        Outstanding request = outstanding.remove(sequenceNumber);
        if (request == null) {
            if (timedOut.remove(sequenceNumber)) {
                transportEvent(McuMgrTransportEvent.Kind.LATE_RESPONSE, "seq " + sequenceNumber);
            } else {
                transportEvent(McuMgrTransportEvent.Kind.UNSOLICITED_RESPONSE, "seq " + sequenceNumber);
            }
            return;
        }

        request.complete(McuMgrResult.success(response));
    }

    private void transportEvent(McuMgrTransportEvent.Kind kind, String detail)
    {
        sink.onTransportEvent(new McuMgrTransportEvent(Instant.now(), kind, detail));
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private final class Outstanding
    {
        private final int sequenceNumber;
        private final McuMgrCallback<McuMgrResponse> callback;
        private final AtomicBoolean completed = new AtomicBoolean();

        private volatile Cancellable timeout;

        private Outstanding(int sequenceNumber, McuMgrCallback<McuMgrResponse> callback)
        {
            this.sequenceNumber = sequenceNumber;
            this.callback = callback;
        }

        /**
         * Callers must have removed this request from {@link #outstanding} first.
         */
        private void complete(McuMgrResult<McuMgrResponse> result)
        {
            if (!completed.compareAndSet(false, true)) {
                return;
            }
            Cancellable t = timeout;
            if (t != null) {
                t.cancel();
            }
            try {
                callback.onComplete(result);
            } catch (RuntimeException e) {
                sink.onError(new McuMgrErrorEvent(Instant.now(),
                        "Completion callback for seq " + sequenceNumber + " threw", e));
            }
        }
    }
}
