package com.questrail.mcumgr.error;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.mcumgr.group.basic.BasicManagerError;
import com.questrail.mcumgr.group.fs.FileSystemManagerError;
import com.questrail.mcumgr.group.image.ImageManagerError;
import com.questrail.mcumgr.group.os.OsGroupErrorTable;
import com.questrail.mcumgr.group.os.OsManagerError;
import com.questrail.mcumgr.model.McuMgrGroup;
import com.questrail.mcumgr.model.McuMgrGroupReturnCode;
import com.questrail.mcumgr.model.McuMgrHeader;
import com.questrail.mcumgr.model.McuMgrResponse;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GroupErrorRegistryTest
 * -----------------------------------------------------------------------------
 * Resolution of raw codes through the tables contributed via ServiceLoader.
 */
class GroupErrorRegistryTest {

    private final GroupErrorRegistry registry = GroupErrorRegistry.loadDefault();

    @Test
    void serviceLoaderContributesEveryBundledTable() {
        for (McuMgrGroup.Known group : new McuMgrGroup.Known[] {
                McuMgrGroup.Known.OS,
                McuMgrGroup.Known.IMAGE,
                McuMgrGroup.Known.STATISTICS,
                McuMgrGroup.Known.SETTINGS,
                McuMgrGroup.Known.FILESYSTEM,
                McuMgrGroup.Known.BASIC}) {
            assertTrue(registry.hasTable(group), "no table for " + group);
        }
        assertFalse(registry.hasTable(McuMgrGroup.Known.SHELL));
    }

    @Test
    void zeroIsSuccessForEveryGroup() {
        assertTrue(registry.resolve(0).isEmpty());
        assertTrue(registry.resolve(McuMgrGroup.Known.IMAGE, 0).isEmpty());
        assertTrue(registry.resolve(McuMgrGroup.of(1000), 0).isEmpty());
    }

    @Test
    void genericCodeResolvesToReturnCodeError() {
        McuMgrError error = registry.resolve(2).orElseThrow();

        assertEquals(new ReturnCodeError(2), error);
        assertEquals("No memory", error.description());
    }

    @Test
    void groupCodeResolvesToTheGroupsError() {
        McuMgrError error = registry.resolve(McuMgrGroup.Known.OS, 4).orElseThrow();

        assertEquals(OsManagerError.RTC_NOT_SET, error);
        assertEquals(Optional.of(McuMgrGroup.Known.OS), error.group());
        assertEquals(4, error.code());
    }

    @Test
    void eachGroupHasItsOwnMeaningForTheSameCode() {
        assertEquals(ImageManagerError.NO_IMAGE, registry.resolve(McuMgrGroup.Known.IMAGE, 3).orElseThrow());
        assertEquals(OsManagerError.QUERY_YIELDS_NO_ANSWER, registry.resolve(McuMgrGroup.Known.OS, 3).orElseThrow());
    }

    @Test
    void unlistedGroupFallsBackToGenericError() {
        McuMgrError error = registry.resolve(new McuMgrGroupReturnCode(4000, 5)).orElseThrow();

        assertEquals(new ReturnCodeError(5), error);
        assertEquals("No entry", error.description());
    }

    @Test
    void unlistedCodeInListedGroupFallsBackToGenericError() {
        McuMgrError error = registry.resolve(McuMgrGroup.Known.BASIC, 300).orElseThrow();

        assertEquals(new ReturnCodeError(300), error);
        assertTrue(error.description().contains("300"));
    }

    @Test
    void groupErrorInResponseTakesPrecedenceOverPlainCode() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("rc", 1);
        payload.putObject("err").put("group", 8).put("rc", 2);
        McuMgrResponse response = new McuMgrResponse(new McuMgrHeader(1, 1, 0, 0, 8, 0, 0), payload);

        assertEquals(FileSystemManagerError.FILE_INVALID_NAME, registry.resolve(response).orElseThrow());
    }

    @Test
    void plainCodeIsUsedWhenGroupErrorIsZero() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("rc", 6);
        payload.putObject("err").put("group", 0).put("rc", 0);
        McuMgrResponse response = new McuMgrResponse(new McuMgrHeader(1, 1, 0, 0, 0, 0, 0), payload);

        assertEquals(new ReturnCodeError(6), registry.resolve(response).orElseThrow());
    }

    @Test
    void groupErrorOutsideSixteenBitsStillResolvesGenerically() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.putObject("err").put("group", 70000).put("rc", 2);
        McuMgrResponse response = new McuMgrResponse(new McuMgrHeader(1, 1, 0, 0, 0, 0, 0), payload);

        assertEquals(new ReturnCodeError(2), registry.resolve(response).orElseThrow());
    }

    @Test
    void oversizedReturnCodeIsAnError() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode()
                .put("rc", BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE));
        McuMgrResponse response = new McuMgrResponse(new McuMgrHeader(1, 1, 0, 0, 0, 0, 0), payload);

        McuMgrError error = registry.resolve(response).orElseThrow();
        assertEquals(new ReturnCodeError(Long.MAX_VALUE), error);
        assertTrue(error.description().startsWith("User-defined error"));
    }

    @Test
    void emptyRegistryResolvesEverythingGenerically() {
        GroupErrorRegistry empty = new GroupErrorRegistry();

        assertEquals(new ReturnCodeError(4), empty.resolve(McuMgrGroup.Known.OS, 4).orElseThrow());

        empty.register(new OsGroupErrorTable());
        assertEquals(OsManagerError.RTC_NOT_SET, empty.resolve(McuMgrGroup.Known.OS, 4).orElseThrow());
    }

    @Test
    void basicGroupTableIsRegistered() {
        McuMgrError error = registry.resolve(McuMgrGroup.Known.BASIC, BasicManagerError.values()[0].code()).orElseThrow();
        assertSame(BasicManagerError.values()[0], error);
    }
}
