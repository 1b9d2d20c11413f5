package com.questrail.mcumgr.api;

import com.questrail.mcumgr.error.McuMgrException;
import com.questrail.mcumgr.error.McuMgrTransportException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class McuMgrResultTest {

    @Test
    void successCarriesItsResult() throws McuMgrException {
        McuMgrResult<String> result = McuMgrResult.success("ok");

        assertTrue(result.isSuccess());
        assertEquals("ok", result.value().orElseThrow());
        assertTrue(result.error().isEmpty());
        assertEquals("ok", result.getOrThrow());
        assertEquals("ok", ((McuMgrResult.Success<String>) result).result());
    }

    @Test
    void failureCarriesItsCause() {
        McuMgrTransportException cause =
                new McuMgrTransportException(McuMgrTransportException.Reason.TIMEOUT, "no response");
        McuMgrResult<String> result = McuMgrResult.failure(cause);

        assertFalse(result.isSuccess());
        assertTrue(result.value().isEmpty());
        assertSame(cause, result.error().orElseThrow());
        assertSame(cause, ((McuMgrResult.Failure<String>) result).cause());
        assertSame(cause, assertThrows(McuMgrTransportException.class, result::getOrThrow));
    }

    @Test
    void neitherSideAcceptsNull() {
        assertThrows(NullPointerException.class, () -> McuMgrResult.success(null));
        assertThrows(NullPointerException.class, () -> McuMgrResult.failure(null));
    }
}
