package com.questrail.mcumgr.runtime;

import com.questrail.mcumgr.McuManager;
import com.questrail.mcumgr.codec.CborCodec;
import com.questrail.mcumgr.codec.impl.DefaultMcuMgrPacketBuilder;
import com.questrail.mcumgr.codec.impl.DefaultMcuMgrResponseDecoder;
import com.questrail.mcumgr.config.McuMgrClientConfig;
import com.questrail.mcumgr.error.GroupErrorRegistry;
import com.questrail.mcumgr.error.McuManagerException;
import com.questrail.mcumgr.internal.time.MonotonicClock;
import com.questrail.mcumgr.internal.time.MonotonicScheduler;
import com.questrail.mcumgr.internal.time.ScheduledExecutorScheduler;
import com.questrail.mcumgr.internal.time.SystemMonotonicClock;
import com.questrail.mcumgr.model.McuMgrScheme;
import com.questrail.mcumgr.observability.McuMgrObservabilitySink;
import com.questrail.mcumgr.observability.Slf4jMcuMgrObservabilitySink;
import com.questrail.mcumgr.transport.DatagramEndpoint;
import com.questrail.mcumgr.transport.udp.UdpMcuMgrTransport;
import com.questrail.mcumgr.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * McuMgrUdpRuntime
 * =============================================================================
 * Composition root and lifecycle owner for talking SMP to one device over UDP.
 *
 * <pre>
 *   McuManager
 *        → DefaultMcuMgrPacketBuilder (UDP framing)
 *            → UdpMcuMgrTransport (correlation + timeouts)
 *                → DatagramEndpoint (Netty by default)
 * </pre>
 *
 * <p><strong>No protocol semantics live here.</strong> This class only wires
 * already-tested parts together and owns the resources they need: the
 * endpoint's socket and, unless one was injected, the single-threaded executor
 * that fires request timeouts.</p>
 */
public final class McuMgrUdpRuntime
{
    private final McuMgrClientConfig config;
    private final UdpMcuMgrTransport transport;
    private final McuManager manager;
    private final ScheduledExecutorService schedulerExecutor;

    private McuMgrUdpRuntime(McuMgrClientConfig config,
                             UdpMcuMgrTransport transport,
                             McuManager manager,
                             ScheduledExecutorService schedulerExecutor)
    {
        this.config = config;
        this.transport = transport;
        this.manager = manager;
        this.schedulerExecutor = schedulerExecutor;
    }

    /**
     * Bind the socket. Requests sent before the transport reports up fail with
     * {@code NOT_CONNECTED}.
     */
    public void start()
    {
        transport.start();
    }

    /**
     * Close the socket, failing outstanding requests with {@code DISCONNECTED},
     * then shut down the owned timeout executor.
     */
    public void stop()
    {
        transport.stop();

        if (schedulerExecutor == null) {
            return;
        }
        schedulerExecutor.shutdown();
        try {
            long graceMillis = config.timingPolicy().shutdownGrace().toMillis();
            if (!schedulerExecutor.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public McuManager manager()
    {
        return manager;
    }

    public UdpMcuMgrTransport transport()
    {
        return transport;
    }

    public McuMgrClientConfig config()
    {
        return config;
    }

    public static Builder builder(McuMgrClientConfig config)
    {
        return new Builder(config);
    }

    public static final class Builder
    {
        private final McuMgrClientConfig config;
        private McuMgrObservabilitySink observabilitySink = new Slf4jMcuMgrObservabilitySink();
        private GroupErrorRegistry errorRegistry;
        private DatagramEndpoint endpoint;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        private Builder(McuMgrClientConfig config)
        {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder withObservabilitySink(McuMgrObservabilitySink sink)
        {
            this.observabilitySink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder withErrorRegistry(GroupErrorRegistry errorRegistry)
        {
            this.errorRegistry = Objects.requireNonNull(errorRegistry, "errorRegistry");
            return this;
        }

        /**
         * Replaces the Netty endpoint, e.g. with an in-memory fake.
         */
        public Builder withEndpoint(DatagramEndpoint endpoint)
        {
            this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
            return this;
        }

        /**
         * Replaces the executor-backed timeout scheduler. The runtime does not
         * own an injected scheduler.
         */
        public Builder withScheduler(MonotonicScheduler scheduler, MonotonicClock clock)
        {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public McuMgrUdpRuntime build()
        {
            CborCodec codec = new CborCodec();

            ScheduledExecutorService executor = null;
            MonotonicScheduler timeouts = scheduler;
            if (timeouts == null) {
                executor = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "mcumgr-timeouts");
                    t.setDaemon(true);
                    return t;
                });
                timeouts = new ScheduledExecutorScheduler(executor, clock);
            }

            DatagramEndpoint ep = (endpoint != null)
                    ? endpoint
                    : new NettyUdpDatagramEndpoint(config.bindAddress());

            UdpMcuMgrTransport transport = new UdpMcuMgrTransport(
                    ep,
                    config.remoteAddress(),
                    new DefaultMcuMgrResponseDecoder(McuMgrScheme.UDP, codec),
                    timeouts,
                    clock,
                    observabilitySink);

            McuManager.Builder managerBuilder = McuManager.builder(transport)
                    .withPacketBuilder(new DefaultMcuMgrPacketBuilder(McuMgrScheme.UDP, codec))
                    .withObservabilitySink(observabilitySink)
                    .withDefaultTimeout(config.timingPolicy().defaultTimeout());
            if (errorRegistry != null) {
                managerBuilder.withErrorRegistry(errorRegistry);
            }
            McuManager manager = managerBuilder.build();

            if (config.mtu() != manager.mtu()) {
                try {
                    manager.setMtu(config.mtu());
                } catch (McuManagerException e) {
                    throw new IllegalStateException("Configured MTU rejected: " + e.getMessage(), e);
                }
            }

            return new McuMgrUdpRuntime(config, transport, manager, executor);
        }
    }
}
