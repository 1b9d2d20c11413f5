package com.questrail.mcumgr.model;

/**
 * Protocol-level constants shared by the codec and the transaction manager.
 */
public final class McuMgrConstants
{
    /** CoAP resource path that SMP requests are posted to. */
    public static final String COAP_PATH = "/omgr";

    /**
     * Reserved payload key under which CoAP framing embeds the header.
     * Callers must never supply it.
     */
    public static final String HEADER_KEY = "_h";

    /** Smallest MTU a manager accepts. */
    public static final int MIN_MTU = 73;

    /** Largest MTU a manager accepts. */
    public static final int MAX_MTU = 1024;

    private McuMgrConstants() {}
}
