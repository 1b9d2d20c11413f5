package com.questrail.mcumgr;

import com.questrail.mcumgr.api.McuMgrCallback;
import com.questrail.mcumgr.api.McuMgrResult;
import com.questrail.mcumgr.codec.CborCodec;
import com.questrail.mcumgr.codec.McuMgrPacketBuilder;
import com.questrail.mcumgr.codec.impl.DefaultMcuMgrPacketBuilder;
import com.questrail.mcumgr.error.GroupErrorRegistry;
import com.questrail.mcumgr.error.McuManagerException;
import com.questrail.mcumgr.error.McuMgrError;
import com.questrail.mcumgr.error.McuMgrErrorException;
import com.questrail.mcumgr.error.McuMgrTransportException;
import com.questrail.mcumgr.internal.rob.ReorderBuffer;
import com.questrail.mcumgr.internal.rob.ReorderBufferException;
import com.questrail.mcumgr.internal.seq.SequenceNumberAllocator;
import com.questrail.mcumgr.model.McuMgrConstants;
import com.questrail.mcumgr.model.McuMgrGroup;
import com.questrail.mcumgr.model.McuMgrOperation;
import com.questrail.mcumgr.model.McuMgrResponse;
import com.questrail.mcumgr.model.McuMgrScheme;
import com.questrail.mcumgr.model.McuMgrVersion;
import com.questrail.mcumgr.observability.McuMgrCompletionEvent;
import com.questrail.mcumgr.observability.McuMgrErrorEvent;
import com.questrail.mcumgr.observability.McuMgrObservabilitySink;
import com.questrail.mcumgr.observability.McuMgrRequestEvent;
import com.questrail.mcumgr.observability.Slf4jMcuMgrObservabilitySink;
import com.questrail.mcumgr.transport.McuMgrTransport;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * McuManager
 * =============================================================================
 * Transaction manager for one device connection.
 *
 * <p>Every request follows the same path:</p>
 * <pre>
 *   allocate sequence number
 *        → build packet (current protocol version, transport framing)
 *            → register expectation in the reorder buffer
 *                → McuMgrTransport.send(...)
 *
 *   transport completion (any thread, any order)
 *        → reorder buffer: received(...)
 *            → deliver every completed head, oldest first
 *                → update protocol version, resolve return code
 *                    → caller's callback
 * </pre>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>Each callback is invoked exactly once.</li>
 *   <li>Callbacks run in the order their requests were sent, whatever order
 *       the transport completes them in. A timed-out or failed request holds
 *       its place like any other.</li>
 *   <li>The protocol version is only ever updated from delivered responses,
 *       so it, too, evolves in request order.</li>
 * </ul>
 *
 * <h2>Correlation failures</h2>
 * <p>If the reorder buffer rejects a request's outcome (a sequence number it
 * does not know), the original caller is completed immediately with the
 * {@link ReorderBufferException}, outside of normal ordering. This is a last
 * resort for an internal fault; the request is never silently dropped.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>The sequence counter, reorder buffer and version state form one critical
 * section guarded by a {@link ReentrantLock}. Callbacks are invoked while that
 * lock is held, which is what keeps deliveries from different completion
 * threads in order; a callback may send further requests from the same thread.
 * Managers share no state with each other.</p>
 *
 * <h2>Lifetime</h2>
 * <p>Each in-flight transport completion holds a reference to its manager, so
 * a manager stays reachable until every request it issued has completed.</p>
 */
public class McuManager
{
    /**
     * Time allowed for a response when the caller does not specify one.
     */
    public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(40);

    /**
     * Typical time for a short command to be sent, executed and answered.
     */
    public static final Duration FAST_TIMEOUT = Duration.ofSeconds(5);

    private final McuMgrTransport transport;
    private final McuMgrPacketBuilder packetBuilder;
    private final GroupErrorRegistry errorRegistry;
    private final McuMgrObservabilitySink sink;
    private final Duration defaultTimeout;

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock.
    private final SequenceNumberAllocator sequenceNumbers;
    private final ReorderBuffer<Integer, Completion> reorderBuffer = new ReorderBuffer<>();
    private McuMgrVersion smpVersion = McuMgrVersion.SMP_V2;
    private int mtu;

    public McuManager(McuMgrTransport transport)
    {
        this(builder(transport));
    }

    private McuManager(Builder builder)
    {
        this.transport = builder.transport;
        this.packetBuilder = (builder.packetBuilder != null)
                ? builder.packetBuilder
                : new DefaultMcuMgrPacketBuilder(transport.scheme(), new CborCodec());
        this.errorRegistry = (builder.errorRegistry != null)
                ? builder.errorRegistry
                : GroupErrorRegistry.loadDefault();
        this.sink = builder.sink;
        this.defaultTimeout = builder.defaultTimeout;
        this.sequenceNumbers = (builder.sequenceNumbers != null)
                ? builder.sequenceNumbers
                : SequenceNumberAllocator.random();
        this.mtu = transport.scheme().defaultMtu();

        if (packetBuilder.scheme() != transport.scheme()) {
            throw new IllegalArgumentException("Packet builder scheme " + packetBuilder.scheme()
                    + " does not match transport scheme " + transport.scheme());
        }
    }

    public static Builder builder(McuMgrTransport transport)
    {
        return new Builder(transport);
    }

    // -------------------------------------------------------------------------
    // Send
    // -------------------------------------------------------------------------

    /**
     * Sends a request with no flags and the manager's default timeout
     * ({@link #DEFAULT_SEND_TIMEOUT} unless configured otherwise).
     */
    public void send(McuMgrGroup group,
                     McuMgrOperation operation,
                     int commandId,
                     Map<String, ?> payload,
                     McuMgrCallback<McuMgrResponse> callback)
    {
        send(group, operation, 0, commandId, payload, defaultTimeout, callback);
    }

    /**
     * Sends a request with no flags.
     */
    public void send(McuMgrGroup group,
                     McuMgrOperation operation,
                     int commandId,
                     Map<String, ?> payload,
                     Duration timeout,
                     McuMgrCallback<McuMgrResponse> callback)
    {
        send(group, operation, 0, commandId, payload, timeout, callback);
    }

    /**
     * Sends a request.
     *
     * <p>The callback receives the response when the device answered with
     * return code 0, an {@link McuMgrErrorException} when it answered with any
     * other code, or the transport's {@link McuMgrTransportException}.</p>
     *
     * @param payload string-keyed CBOR payload; may be {@code null}. Must not
     *                contain {@link McuMgrConstants#HEADER_KEY}.
     * @throws IllegalArgumentException if a header field is out of range or the
     *                                  payload cannot be encoded; nothing is sent
     *                                  and the callback is not invoked
     */
    public void send(McuMgrGroup group,
                     McuMgrOperation operation,
                     int flags,
                     int commandId,
                     Map<String, ?> payload,
                     Duration timeout,
                     McuMgrCallback<McuMgrResponse> callback)
    {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(callback, "callback");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }

        final Request request;
        final byte[] packet;

        lock.lock();
        try {
            int sequenceNumber = sequenceNumbers.next();
            McuMgrVersion version = smpVersion;
            packet = packetBuilder.build(version, operation, flags, group, sequenceNumber, commandId, payload);
            request = new Request(sequenceNumber, version, group, operation, commandId, callback);

            try {
                reorderBuffer.enqueueExpectation(sequenceNumber);
            } catch (ReorderBufferException e) {
                // The number is still outstanding: more than 256 requests in flight.
                reportError("Sequence number " + sequenceNumber + " reused while in flight", e);
                request.invoke(McuMgrResult.failure(e), sink);
                return;
            }
        } finally {
            lock.unlock();
        }

        sink.onRequestSent(new McuMgrRequestEvent(Instant.now(), request.version, group, operation,
                request.sequenceNumber, commandId, packet.length));

        try {
            transport.send(packet, timeout, result -> complete(request, result));
        } catch (RuntimeException e) {
            complete(request, McuMgrResult.failure(new McuMgrTransportException(
                    McuMgrTransportException.Reason.SEND_FAILED,
                    "Transport rejected request seq " + request.sequenceNumber + ": " + e.getMessage(), e)));
        }
    }

    /**
     * Internal completion handler; one invocation per transport completion.
     */
    private void complete(Request request, McuMgrResult<McuMgrResponse> result)
    {
        if (!request.transportCompleted.compareAndSet(false, true)) {
            reportError("Transport completed seq " + request.sequenceNumber + " more than once; ignoring", null);
            return;
        }

        lock.lock();
        try {
            final boolean deliverable;
            try {
                deliverable = reorderBuffer.received(new Completion(request, result), request.sequenceNumber);
            } catch (ReorderBufferException e) {
                // Out-of-order fallback: the caller still hears about its request.
                reportError("Cannot correlate response for seq " + request.sequenceNumber, e);
                request.invoke(McuMgrResult.failure(e), sink);
                return;
            }

            if (deliverable) {
                reorderBuffer.deliver((sequenceNumber, completion) -> deliver(completion));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs under {@link #lock}, in issue order.
     */
    private void deliver(Completion completion)
    {
        Request request = completion.request;
        McuMgrResult<McuMgrResponse> outcome = completion.result;

        if (outcome instanceof McuMgrResult.Success<McuMgrResponse> success) {
            McuMgrResponse response = success.result();
            smpVersion = response.version();

            McuMgrError error = errorRegistry.resolve(response).orElse(null);
            if (error != null) {
                outcome = McuMgrResult.failure(new McuMgrErrorException(error, response));
            }
        }

        sink.onRequestCompleted(new McuMgrCompletionEvent(Instant.now(), smpVersion, request.group,
                request.sequenceNumber, request.commandId, outcome));
        request.invoke(outcome, sink);
    }

    // -------------------------------------------------------------------------
    // Configuration
    // -------------------------------------------------------------------------

    /**
     * Sets the MTU used when sizing requests (uploads in particular).
     *
     * @throws McuManagerException {@code MTU_OUT_OF_RANGE} outside
     *                             {@value McuMgrConstants#MIN_MTU}..{@value McuMgrConstants#MAX_MTU};
     *                             {@code MTU_UNCHANGED} if {@code mtu} is already current
     */
    public void setMtu(int mtu) throws McuManagerException
    {
        if (mtu < McuMgrConstants.MIN_MTU || mtu > McuMgrConstants.MAX_MTU) {
            throw McuManagerException.mtuOutOfRange(mtu);
        }

        final int previous;
        lock.lock();
        try {
            if (this.mtu == mtu) {
                throw McuManagerException.mtuUnchanged(mtu);
            }
            previous = this.mtu;
            this.mtu = mtu;
        } finally {
            lock.unlock();
        }
        sink.onMtuChanged(previous, mtu);
    }

    public int mtu()
    {
        lock.lock();
        try {
            return mtu;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Protocol version the next request will be built with: the version of the
     * most recently delivered response, or {@link McuMgrVersion#SMP_V2} before any.
     */
    public McuMgrVersion smpVersion()
    {
        lock.lock();
        try {
            return smpVersion;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Requests sent but not yet delivered to their callbacks.
     */
    public int pendingCount()
    {
        lock.lock();
        try {
            return reorderBuffer.pendingCount();
        } finally {
            lock.unlock();
        }
    }

    public Duration defaultTimeout()
    {
        return defaultTimeout;
    }

    public McuMgrScheme scheme()
    {
        return transport.scheme();
    }

    public McuMgrTransport transport()
    {
        return transport;
    }

    private void reportError(String message, Throwable cause)
    {
        sink.onError(new McuMgrErrorEvent(Instant.now(), message, cause));
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private static final class Request
    {
        private final int sequenceNumber;
        private final McuMgrVersion version;
        private final McuMgrGroup group;
        private final McuMgrOperation operation;
        private final int commandId;
        private final McuMgrCallback<McuMgrResponse> callback;

        private final AtomicBoolean transportCompleted = new AtomicBoolean();
        private final AtomicBoolean callbackInvoked = new AtomicBoolean();

        private Request(int sequenceNumber,
                        McuMgrVersion version,
                        McuMgrGroup group,
                        McuMgrOperation operation,
                        int commandId,
                        McuMgrCallback<McuMgrResponse> callback)
        {
            this.sequenceNumber = sequenceNumber;
            this.version = version;
            this.group = group;
            this.operation = operation;
            this.commandId = commandId;
            this.callback = callback;
        }

        private void invoke(McuMgrResult<McuMgrResponse> result, McuMgrObservabilitySink sink)
        {
            if (!callbackInvoked.compareAndSet(false, true)) {
                return;
            }
            try {
                callback.onComplete(result);
            } catch (RuntimeException e) {
                // A throwing callback must not stall delivery of the requests queued behind it.
                sink.onError(new McuMgrErrorEvent(Instant.now(),
                        "Callback for " + operation + " seq " + sequenceNumber + " threw", e));
            }
        }
    }

    private record Completion(Request request, McuMgrResult<McuMgrResponse> result) {}

    public static final class Builder
    {
        private final McuMgrTransport transport;
        private McuMgrPacketBuilder packetBuilder;
        private GroupErrorRegistry errorRegistry;
        private McuMgrObservabilitySink sink = new Slf4jMcuMgrObservabilitySink();
        private SequenceNumberAllocator sequenceNumbers;
        private Duration defaultTimeout = DEFAULT_SEND_TIMEOUT;

        private Builder(McuMgrTransport transport)
        {
            this.transport = Objects.requireNonNull(transport, "transport");
        }

        public Builder withPacketBuilder(McuMgrPacketBuilder packetBuilder)
        {
            this.packetBuilder = Objects.requireNonNull(packetBuilder, "packetBuilder");
            return this;
        }

        public Builder withErrorRegistry(GroupErrorRegistry errorRegistry)
        {
            this.errorRegistry = Objects.requireNonNull(errorRegistry, "errorRegistry");
            return this;
        }

        public Builder withObservabilitySink(McuMgrObservabilitySink sink)
        {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /**
         * Overrides the random starting sequence number; intended for tests.
         */
        public Builder withSequenceNumbers(SequenceNumberAllocator sequenceNumbers)
        {
            this.sequenceNumbers = Objects.requireNonNull(sequenceNumbers, "sequenceNumbers");
            return this;
        }

        public Builder withDefaultTimeout(Duration defaultTimeout)
        {
            Objects.requireNonNull(defaultTimeout, "defaultTimeout");
            if (defaultTimeout.isNegative()) {
                throw new IllegalArgumentException("defaultTimeout must be non-negative");
            }
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public McuManager build()
        {
            return new McuManager(this);
        }
    }
}
