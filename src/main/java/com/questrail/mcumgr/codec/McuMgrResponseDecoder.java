package com.questrail.mcumgr.codec;

import com.questrail.mcumgr.error.McuMgrDecodeException;
import com.questrail.mcumgr.model.McuMgrResponse;
import com.questrail.mcumgr.model.McuMgrScheme;

/**
 * Inbound wire boundary: received bytes into an {@link McuMgrResponse}.
 *
 * <p>This is the mechanical inverse of {@link McuMgrPacketBuilder} for the same
 * scheme. It does not interpret return codes.</p>
 */
public interface McuMgrResponseDecoder
{
    McuMgrScheme scheme();

    /**
     * @throws McuMgrDecodeException if the bytes are not a well-formed SMP packet
     */
    McuMgrResponse decode(byte[] data) throws McuMgrDecodeException;
}
