package com.questrail.mcumgr.observability;

import com.questrail.mcumgr.api.McuMgrResult;
import com.questrail.mcumgr.model.McuMgrGroup;
import com.questrail.mcumgr.model.McuMgrResponse;
import com.questrail.mcumgr.model.McuMgrVersion;

import java.time.Instant;

/**
 * A request's outcome being handed to its caller, in issue order.
 *
 * @param version protocol version in effect after this delivery
 */
public record McuMgrCompletionEvent(
        Instant timestamp,
        McuMgrVersion version,
        McuMgrGroup group,
        int sequenceNumber,
        int commandId,
        McuMgrResult<McuMgrResponse> result
) {
    public boolean isSuccess() {
        return result.isSuccess();
    }
}
