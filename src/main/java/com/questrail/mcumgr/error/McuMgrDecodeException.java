package com.questrail.mcumgr.error;

/**
 * Indicates that received bytes could not be turned into an
 * {@link com.questrail.mcumgr.model.McuMgrResponse}.
 *
 * <p>Typically a truncated header, a missing or malformed CoAP header entry,
 * or a payload that is not a CBOR map.</p>
 */
public final class McuMgrDecodeException extends McuMgrException
{
    public McuMgrDecodeException(String message)
    {
        super(message);
    }

    public McuMgrDecodeException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
