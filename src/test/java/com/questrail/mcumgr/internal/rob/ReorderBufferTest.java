package com.questrail.mcumgr.internal.rob;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReorderBufferTest
 * -----------------------------------------------------------------------------
 * Exercises delivery order, duplicate handling and key reuse.
 */
class ReorderBufferTest {

    private ReorderBuffer<Integer, String> rob;
    private List<String> out;

    @BeforeEach
    void setUp() {
        rob = new ReorderBuffer<>();
        out = new ArrayList<>();
    }

    private int deliver() {
        return rob.deliver((key, value) -> out.add(key + "=" + value));
    }

    @Test
    void headArrivingFirstIsDeliverableImmediately() throws ReorderBufferException {
        rob.enqueueExpectation(1);
        rob.enqueueExpectation(2);

        assertTrue(rob.received("a", 1));
        assertEquals(1, deliver());
        assertEquals(List.of("1=a"), out);
        assertTrue(rob.isPending(2));
        assertFalse(rob.isPending(1));
    }

    @Test
    void laterOutcomesWaitForTheHead() throws ReorderBufferException {
        rob.enqueueExpectation(1);
        rob.enqueueExpectation(2);
        rob.enqueueExpectation(3);

        assertFalse(rob.received("c", 3));
        assertFalse(rob.received("b", 2));
        assertEquals(0, deliver());
        assertTrue(out.isEmpty());

        assertTrue(rob.received("a", 1));
        assertEquals(3, deliver());
        assertEquals(List.of("1=a", "2=b", "3=c"), out);
        assertTrue(rob.isEmpty());
    }

    @Test
    void deliveryStopsAtTheFirstGap() throws ReorderBufferException {
        rob.enqueueExpectation(1);
        rob.enqueueExpectation(2);
        rob.enqueueExpectation(3);

        rob.received("c", 3);
        rob.received("a", 1);
        assertEquals(1, deliver());
        assertEquals(List.of("1=a"), out);
        assertEquals(2, rob.pendingCount());
    }

    @Test
    void orderIsByRegistrationNotByKeyValue() throws ReorderBufferException {
        rob.enqueueExpectation(255);
        rob.enqueueExpectation(0);

        rob.received("second", 0);
        assertEquals(0, deliver());
        rob.received("first", 255);
        deliver();

        assertEquals(List.of("255=first", "0=second"), out);
    }

    @Test
    void duplicateExpectationIsRejectedWhilePending() throws ReorderBufferException {
        rob.enqueueExpectation(7);

        ReorderBufferException e = assertThrows(ReorderBufferException.class, () -> rob.enqueueExpectation(7));
        assertEquals(ReorderBufferException.Reason.DUPLICATE_EXPECTATION, e.reason());
        assertEquals(7, e.key());

        // Still rejected once the outcome is buffered but not yet delivered.
        rob.received("x", 7);
        assertThrows(ReorderBufferException.class, () -> rob.enqueueExpectation(7));
        assertEquals(1, rob.pendingCount());
    }

    @Test
    void keyMayBeRegisteredAgainAfterDelivery() throws ReorderBufferException {
        rob.enqueueExpectation(7);
        rob.received("x", 7);
        deliver();

        rob.enqueueExpectation(7);
        rob.received("y", 7);
        deliver();

        assertEquals(List.of("7=x", "7=y"), out);
    }

    @Test
    void outcomeForUnknownKeyIsRejected() {
        ReorderBufferException e = assertThrows(ReorderBufferException.class, () -> rob.received("x", 9));
        assertEquals(ReorderBufferException.Reason.UNEXPECTED_RESPONSE, e.reason());
    }

    @Test
    void secondOutcomeForSameKeyIsRejectedAndFirstIsKept() throws ReorderBufferException {
        rob.enqueueExpectation(1);
        rob.enqueueExpectation(2);
        rob.received("first", 2);

        ReorderBufferException e = assertThrows(ReorderBufferException.class, () -> rob.received("second", 2));
        assertEquals(ReorderBufferException.Reason.DUPLICATE_RESPONSE, e.reason());

        rob.received("head", 1);
        deliver();
        assertEquals(List.of("1=head", "2=first"), out);
    }

    @Test
    void callbackMayRegisterNewExpectations() throws ReorderBufferException {
        rob.enqueueExpectation(1);
        rob.received("a", 1);

        rob.deliver((key, value) -> {
            out.add(key + "=" + value);
            try {
                rob.enqueueExpectation(2);
            } catch (ReorderBufferException e) {
                fail(e);
            }
        });

        assertEquals(List.of("1=a"), out);
        assertTrue(rob.isPending(2));
    }
}
