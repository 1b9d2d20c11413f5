package com.questrail.mcumgr.transport.udp.netty;

import com.questrail.mcumgr.model.McuMgrConstants;
import com.questrail.mcumgr.model.McuMgrHeader;
import com.questrail.mcumgr.transport.DatagramEndpoint;
import com.questrail.mcumgr.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port for SMP
 * over UDP.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound payloads are copied into
 * {@code byte[]} before they reach the listener.
 *
 * <h2>Receive sizing</h2>
 * Each receive buffer holds one whole SMP datagram: the SMP header plus a
 * payload of up to the largest MTU a manager accepts. A datagram larger than
 * that is truncated by the socket and will fail to decode upstream.
 *
 * <h2>Lifecycle</h2>
 * The endpoint is single-use. {@link #start()} binds once; {@link #stop()}
 * closes the channel and releases the event loop, after which the endpoint
 * cannot be started again.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    /** Header plus the largest SMP payload. */
    public static final int DEFAULT_RECEIVE_SIZE = McuMgrHeader.SIZE + McuMgrConstants.MAX_MTU;

    private final InetSocketAddress bindAddress;
    private final int receiveSize;

    private final EventLoopGroup group;
    private final AtomicBoolean started = new AtomicBoolean();

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this(bindAddress, DEFAULT_RECEIVE_SIZE);
    }

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress, int receiveSize)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (receiveSize < McuMgrHeader.SIZE) {
            throw new IllegalArgumentException("receiveSize must hold at least an SMP header (was " + receiveSize + ")");
        }
        this.receiveSize = receiveSize;
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("UDP endpoint already started");
        }

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(receiveSize))
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new SmpDatagramHandler());
                    }
                });

        bootstrap.bind(bindAddress).addListener((ChannelFutureListener) bound -> {
            if (bound.isSuccess()) {
                channel = bound.channel();
                l.onTransportUp();
            }
            else {
                l.onTransportDown(bound.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            // channelInactive reports the transition.
            ch.close().syncUninterruptibly();
        }
        group.shutdownGracefully();
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        if (!(remote instanceof InetSocketAddress)) {
            throw new IllegalArgumentException("UDP remote must be an InetSocketAddress: " + remote);
        }

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new IllegalStateException("UDP endpoint is not bound");
        }

        ch.writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(payload), (InetSocketAddress) remote));
    }

    /**
     * Local address the socket is bound to, or {@code null} before the bind
     * completes and after stop.
     */
    public SocketAddress localAddress()
    {
        Channel ch = channel;
        return (ch != null) ? ch.localAddress() : null;
    }

    public int receiveSize()
    {
        return receiveSize;
    }

    private final class SmpDatagramHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }

            ByteBuf content = packet.content();
            byte[] datagram = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), datagram);

            l.onDatagram(packet.sender(), datagram);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(cause);
            }
            ctx.close();
        }
    }
}
