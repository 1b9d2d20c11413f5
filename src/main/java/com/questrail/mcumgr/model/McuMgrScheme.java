package com.questrail.mcumgr.model;

/**
 * McuMgrScheme
 * -----------------------------------------------------------------------------
 * Identifies a transport family. The scheme selects two things:
 * <ul>
 *   <li>the framing mode used by the packet builder and response decoder</li>
 *   <li>the default MTU a new manager starts with</li>
 * </ul>
 *
 * <p>Datagram framing puts the 9-byte header in front of the CBOR payload.
 * CoAP framing carries the header inside the CBOR map under
 * {@link McuMgrConstants#HEADER_KEY}.</p>
 */
public enum McuMgrScheme
{
    /** SMP over a BLE GATT characteristic. ATT MTU 527 minus 3 bytes of ATT overhead. */
    BLE(false, 524),

    /** SMP over plain UDP datagrams. */
    UDP(false, 1024),

    /** SMP over CoAP carried on BLE. */
    COAP_BLE(true, 1024),

    /** SMP over CoAP carried on UDP. */
    COAP_UDP(true, 1024);

    private final boolean coap;
    private final int defaultMtu;

    McuMgrScheme(boolean coap, int defaultMtu)
    {
        this.coap = coap;
        this.defaultMtu = defaultMtu;
    }

    public boolean isCoap()
    {
        return coap;
    }

    public int defaultMtu()
    {
        return defaultMtu;
    }
}
