package com.questrail.mcumgr.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class McuMgrResponseTest {

    private static final McuMgrHeader HEADER = new McuMgrHeader(1, 1, 0, 0, 0, 4, 0);

    @Test
    void missingReturnCodeReadsAsZero() {
        McuMgrResponse response = new McuMgrResponse(HEADER, null);

        assertEquals(0, response.returnCode());
        assertTrue(response.groupReturnCode().isEmpty());
        assertEquals(0, response.payload().size());
    }

    @Test
    void readsPlainReturnCode() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("rc", 8);

        assertEquals(8, new McuMgrResponse(HEADER, payload).returnCode());
    }

    @Test
    void readsGroupReturnCode() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.putObject("err").put("group", 8).put("rc", 2);

        McuMgrGroupReturnCode code = new McuMgrResponse(HEADER, payload).groupReturnCode().orElseThrow();
        assertEquals(McuMgrGroup.Known.FILESYSTEM, code.commandGroup());
        assertEquals(2, code.rc());
    }

    @Test
    void groupOutsideSixteenBitsKeepsItsReturnCode() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.putObject("err").put("group", 70000).put("rc", 2);
        McuMgrResponse response = new McuMgrResponse(HEADER, payload);

        assertTrue(response.groupReturnCode().isEmpty());
        assertEquals(2, response.errReturnCode());
    }

    @Test
    void returnCodeAboveSignedRangeSaturates() {
        BigInteger uint64Max = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("rc", uint64Max);
        payload.putObject("err").put("group", 1).put("rc", uint64Max);
        McuMgrResponse response = new McuMgrResponse(HEADER, payload);

        assertEquals(Long.MAX_VALUE, response.returnCode());
        assertEquals(Long.MAX_VALUE, response.groupReturnCode().orElseThrow().rc());
        assertEquals(Long.MAX_VALUE, response.errReturnCode());
    }

    @Test
    void returnCodeBelowSignedRangeSaturates() {
        BigInteger tooNegative = BigInteger.valueOf(Long.MIN_VALUE).subtract(BigInteger.ONE);
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("rc", tooNegative);

        assertEquals(Long.MIN_VALUE, new McuMgrResponse(HEADER, payload).returnCode());
    }

    @Test
    void fractionalReturnCodeNeverReadsAsZero() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("rc", 0.5);

        assertEquals(1, new McuMgrResponse(HEADER, payload).returnCode());
    }

    @Test
    void exposesHeaderSequenceAndVersion() {
        McuMgrResponse response = new McuMgrResponse(HEADER, null);

        assertEquals(4, response.sequenceNumber());
        assertEquals(McuMgrVersion.SMP_V2, response.version());
    }
}
