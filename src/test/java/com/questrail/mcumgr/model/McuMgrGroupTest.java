package com.questrail.mcumgr.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class McuMgrGroupTest {

    @Test
    void conversionIsLosslessForEvery16BitValue() {
        for (int v = 0; v <= 0xFFFF; v++) {
            assertEquals(v, McuMgrGroup.of(v).value());
        }
    }

    @Test
    void knownValuesResolveToTheirConstant() {
        assertSame(McuMgrGroup.Known.OS, McuMgrGroup.of(0));
        assertSame(McuMgrGroup.Known.IMAGE, McuMgrGroup.of(1));
        assertSame(McuMgrGroup.Known.FILESYSTEM, McuMgrGroup.of(8));
        assertSame(McuMgrGroup.Known.BASIC, McuMgrGroup.of(63));
        assertSame(McuMgrGroup.Known.PER_USER, McuMgrGroup.of(64));
    }

    @Test
    void otherValuesAreCustom() {
        McuMgrGroup group = McuMgrGroup.of(65);

        assertTrue(group instanceof McuMgrGroup.Custom);
        assertEquals(new McuMgrGroup.Custom(65), group);
        assertEquals("CUSTOM(65)", group.toString());
    }

    @Test
    void customCannotShadowAKnownGroup() {
        assertThrows(IllegalArgumentException.class, () -> new McuMgrGroup.Custom(1));
    }

    @Test
    void outOfRangeValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> McuMgrGroup.of(-1));
        assertThrows(IllegalArgumentException.class, () -> McuMgrGroup.of(0x10000));
    }
}
