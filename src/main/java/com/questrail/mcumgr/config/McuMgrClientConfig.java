package com.questrail.mcumgr.config;

import com.questrail.mcumgr.model.McuMgrConstants;
import com.questrail.mcumgr.model.McuMgrScheme;
import com.questrail.mcumgr.transport.udp.UdpMcuMgrTransport;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Aggregated configuration for a UDP client runtime.
 *
 * <p>{@code mtu} must lie within
 * {@value McuMgrConstants#MIN_MTU}..{@value McuMgrConstants#MAX_MTU}.</p>
 */
public record McuMgrClientConfig(
    InetSocketAddress remoteAddress,
    InetSocketAddress bindAddress,
    int mtu,
    McuMgrTimingPolicy timingPolicy
) {
    public McuMgrClientConfig {
        Objects.requireNonNull(remoteAddress, "remoteAddress");
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(timingPolicy, "timingPolicy");

        if (mtu < McuMgrConstants.MIN_MTU || mtu > McuMgrConstants.MAX_MTU) {
            throw new IllegalArgumentException("mtu must be within " + McuMgrConstants.MIN_MTU
                    + ".." + McuMgrConstants.MAX_MTU + " (was " + mtu + ")");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress remoteAddress;
        private InetSocketAddress bindAddress = new InetSocketAddress(0);
        private int mtu = McuMgrScheme.UDP.defaultMtu();
        private McuMgrTimingPolicy timingPolicy = McuMgrTimingPolicy.defaults();

        public Builder withRemoteAddress(InetSocketAddress remoteAddress) {
            this.remoteAddress = remoteAddress;
            return this;
        }

        /**
         * Device host on the default mcumgr UDP port ({@value UdpMcuMgrTransport#DEFAULT_PORT}).
         */
        public Builder withRemoteHost(String host) {
            this.remoteAddress = new InetSocketAddress(host, UdpMcuMgrTransport.DEFAULT_PORT);
            return this;
        }

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withMtu(int mtu) {
            this.mtu = mtu;
            return this;
        }

        public Builder withTimingPolicy(McuMgrTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public McuMgrClientConfig build() {
            return new McuMgrClientConfig(remoteAddress, bindAddress, mtu, timingPolicy);
        }
    }
}
