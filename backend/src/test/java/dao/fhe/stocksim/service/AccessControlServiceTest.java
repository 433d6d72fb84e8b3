package dao.fhe.stocksim.service;

import dao.fhe.stocksim.SimulationFixture;
import dao.fhe.stocksim.event.SimulationEvent;
import dao.fhe.stocksim.exception.ErrorKind;
import dao.fhe.stocksim.exception.SimulationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static dao.fhe.stocksim.SimulationFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class AccessControlServiceTest {

    private SimulationFixture fx;

    @BeforeEach
    void setUp() {
        fx = new SimulationFixture();
    }

    @Test
    @DisplayName("owner and providers come from configuration")
    void initialRoles() {
        assertEquals(OWNER, fx.accessControl.owner());
        assertTrue(fx.accessControl.isProvider(PROVIDER));
        assertFalse(fx.accessControl.isProvider(OWNER));
    }

    @Test
    @DisplayName("transferOwnership hands every owner-only operation to the new owner")
    void transferOwnership() {
        fx.accessControl.transferOwnership(OWNER, ALICE);

        assertEquals(ALICE, fx.accessControl.owner());
        SimulationException e = assertThrows(SimulationException.class, () -> fx.batchLifecycle.openBatch(OWNER));
        assertEquals(ErrorKind.PERMISSION_DENIED, e.getKind());
        assertEquals(1L, fx.batchLifecycle.openBatch(ALICE));
        assertEquals(new SimulationEvent.OwnershipTransferred(OWNER, ALICE),
                fx.events.ofType(SimulationEvent.OwnershipTransferred.class).get(0));
    }

    @Test
    @DisplayName("non-owner cannot transfer ownership or manage providers")
    void nonOwnerDenied() {
        assertEquals(ErrorKind.PERMISSION_DENIED, assertThrows(SimulationException.class,
                () -> fx.accessControl.transferOwnership(ALICE, ALICE)).getKind());
        assertEquals(ErrorKind.PERMISSION_DENIED, assertThrows(SimulationException.class,
                () -> fx.accessControl.addProvider(PROVIDER, ALICE)).getKind());
        assertEquals(ErrorKind.PERMISSION_DENIED, assertThrows(SimulationException.class,
                () -> fx.accessControl.removeProvider(PROVIDER, PROVIDER)).getKind());
        assertEquals(0, fx.events.size());
    }

    @Test
    @DisplayName("addProvider/removeProvider are idempotent and only emit on change")
    void idempotentProviderChanges() {
        fx.accessControl.addProvider(OWNER, ALICE);
        fx.accessControl.addProvider(OWNER, ALICE);
        assertTrue(fx.accessControl.isProvider(ALICE));
        assertEquals(1, fx.events.ofType(SimulationEvent.ProviderAdded.class).size());

        fx.accessControl.removeProvider(OWNER, ALICE);
        fx.accessControl.removeProvider(OWNER, ALICE);
        assertFalse(fx.accessControl.isProvider(ALICE));
        assertEquals(1, fx.events.ofType(SimulationEvent.ProviderRemoved.class).size());
    }

    @Test
    @DisplayName("accounts compare case-insensitively")
    void normalization() {
        String mixed = "0x00000000000000000000000000000000000000A1";
        assertTrue(fx.accessControl.isOwner(mixed));
        assertEquals(OWNER, AccessControlService.normalizeAccount("  " + mixed + " "));
    }

    @Test
    @DisplayName("malformed account is INVALID_ARGUMENT")
    void malformedAccount() {
        SimulationException e = assertThrows(SimulationException.class,
                () -> fx.accessControl.addProvider(OWNER, "0x1234"));
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
    }
}
