package com.questrail.mcumgr.error;

import com.questrail.mcumgr.model.McuMgrResponse;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Delivered to a caller when the exchange itself succeeded but the device
 * answered with a non-zero return code.
 */
public final class McuMgrErrorException extends McuMgrException
{
    private final McuMgrError error;
    private final McuMgrResponse response;

    public McuMgrErrorException(McuMgrError error, McuMgrResponse response)
    {
        super("Remote error: " + Objects.requireNonNull(error, "error").description());
        this.error = error;
        this.response = response;
    }

    public McuMgrError error()
    {
        return error;
    }

    /**
     * The response that carried the error, when one was decoded.
     */
    public Optional<McuMgrResponse> response()
    {
        return Optional.ofNullable(response);
    }

    @Override
    public OptionalLong code()
    {
        return OptionalLong.of(error.code());
    }
}
