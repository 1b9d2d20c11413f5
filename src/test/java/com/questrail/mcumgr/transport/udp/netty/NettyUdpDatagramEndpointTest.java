package com.questrail.mcumgr.transport.udp.netty;

import com.questrail.mcumgr.model.McuMgrHeader;
import com.questrail.mcumgr.transport.DatagramEndpointListener;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;

import static org.junit.jupiter.api.Assertions.*;

class NettyUdpDatagramEndpointTest
{
    private static final InetSocketAddress LOOPBACK = new InetSocketAddress(InetAddress.getLoopbackAddress(), 0);

    @Test
    void defaultReceiveSizeHoldsHeaderAndLargestMtu()
    {
        NettyUdpDatagramEndpoint ep = new NettyUdpDatagramEndpoint(LOOPBACK);
        try {
            assertEquals(McuMgrHeader.SIZE + 1024, ep.receiveSize());
        }
        finally {
            ep.stop();
        }
    }

    @Test
    void rejectsReceiveSizeSmallerThanHeader()
    {
        assertThrows(IllegalArgumentException.class, () -> new NettyUdpDatagramEndpoint(LOOPBACK, McuMgrHeader.SIZE - 1));
    }

    @Test
    void startRequiresListener()
    {
        NettyUdpDatagramEndpoint ep = new NettyUdpDatagramEndpoint(LOOPBACK);
        try {
            assertThrows(IllegalStateException.class, ep::start);
        }
        finally {
            ep.stop();
        }
    }

    @Test
    void sendBeforeBindFails()
    {
        NettyUdpDatagramEndpoint ep = new NettyUdpDatagramEndpoint(LOOPBACK);
        try {
            assertNull(ep.localAddress());
            assertThrows(IllegalStateException.class,
                    () -> ep.send(new InetSocketAddress(InetAddress.getLoopbackAddress(), 1337), new byte[McuMgrHeader.SIZE]));
        }
        finally {
            ep.stop();
        }
    }

    @Test
    void secondStartIsRejected()
    {
        NettyUdpDatagramEndpoint ep = new NettyUdpDatagramEndpoint(LOOPBACK);
        ep.setListener(new DatagramEndpointListener() {
            @Override public void onTransportUp() { }
            @Override public void onTransportDown(Throwable cause) { }
            @Override public void onDatagram(SocketAddress remote, byte[] payload) { }
        });
        try {
            ep.start();
            assertThrows(IllegalStateException.class, ep::start);
        }
        finally {
            ep.stop();
        }
    }
}
