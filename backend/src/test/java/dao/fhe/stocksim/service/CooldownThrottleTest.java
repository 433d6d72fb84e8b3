package dao.fhe.stocksim.service;

import dao.fhe.stocksim.SimulationFixture;
import dao.fhe.stocksim.event.SimulationEvent;
import dao.fhe.stocksim.exception.ErrorKind;
import dao.fhe.stocksim.exception.SimulationException;
import dao.fhe.stocksim.model.ActionCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static dao.fhe.stocksim.SimulationFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class CooldownThrottleTest {

    private SimulationFixture fx;

    @BeforeEach
    void setUp() {
        fx = new SimulationFixture();
        fx.batchLifecycle.openBatch(OWNER);
    }

    @Test
    @DisplayName("cooldown=30: t=0 ok, t=10 COOLDOWN_ACTIVE, t=31 ok")
    void timeline() {
        fx.stateStore.submitTrade(ALICE, handle(1), handle(2));

        fx.clock.setEpochSecond(10);
        SimulationException e = assertThrows(SimulationException.class,
                () -> fx.stateStore.submitTrade(ALICE, handle(3), handle(4)));
        assertEquals(ErrorKind.COOLDOWN_ACTIVE, e.getKind());

        fx.clock.setEpochSecond(31);
        assertDoesNotThrow(() -> fx.stateStore.submitTrade(ALICE, handle(3), handle(4)));
    }

    @Test
    @DisplayName("exactly cooldownSeconds later is accepted")
    void boundaryIsInclusive() {
        fx.stateStore.submitTrade(ALICE, handle(1), handle(2));
        fx.clock.setEpochSecond(30);
        assertDoesNotThrow(() -> fx.stateStore.submitTrade(ALICE, handle(3), handle(4)));
    }

    @Test
    @DisplayName("rejected action does not move the last-action time")
    void rejectionDoesNotRecord() {
        fx.stateStore.submitTrade(ALICE, handle(1), handle(2));
        fx.clock.setEpochSecond(20);
        assertThrows(SimulationException.class, () -> fx.stateStore.submitTrade(ALICE, handle(3), handle(4)));

        assertEquals(0L, fx.cooldown.lastAction(ALICE, ActionCategory.SUBMISSION).orElseThrow());
        fx.clock.setEpochSecond(30);
        assertDoesNotThrow(() -> fx.stateStore.submitTrade(ALICE, handle(3), handle(4)));
    }

    @Test
    @DisplayName("categories and accounts are throttled independently")
    void independentKeys() {
        fx.stateStore.submitTrade(ALICE, handle(1), handle(2));

        assertDoesNotThrow(() -> fx.decryptionManager.requestBatchDecryption(ALICE));
        assertDoesNotThrow(() -> fx.stateStore.submitTrade(BOB, handle(3), handle(4)));
    }

    @Test
    @DisplayName("a failed guard after the cooldown check leaves no timestamp behind")
    void batchNotOpenDoesNotRecord() {
        fx.batchLifecycle.closeBatch(OWNER);
        assertThrows(SimulationException.class, () -> fx.stateStore.submitTrade(ALICE, handle(1), handle(2)));
        assertTrue(fx.cooldown.lastAction(ALICE, ActionCategory.SUBMISSION).isEmpty());
    }

    @Test
    @DisplayName("changing cooldownSeconds applies to the next check")
    void changeTakesEffectImmediately() {
        fx.stateStore.submitTrade(ALICE, handle(1), handle(2));
        fx.clock.setEpochSecond(5);
        assertThrows(SimulationException.class, () -> fx.stateStore.submitTrade(ALICE, handle(3), handle(4)));

        fx.cooldown.setCooldownSeconds(OWNER, 5);
        assertDoesNotThrow(() -> fx.stateStore.submitTrade(ALICE, handle(3), handle(4)));

        fx.cooldown.setCooldownSeconds(OWNER, 100);
        fx.clock.setEpochSecond(50);
        assertThrows(SimulationException.class, () -> fx.stateStore.submitTrade(ALICE, handle(5), handle(6)));
    }

    @Test
    @DisplayName("setCooldownSeconds is owner only and emits CooldownChanged")
    void setCooldownGuards() {
        SimulationException e = assertThrows(SimulationException.class,
                () -> fx.cooldown.setCooldownSeconds(ALICE, 1));
        assertEquals(ErrorKind.PERMISSION_DENIED, e.getKind());
        assertEquals(30, fx.cooldown.getCooldownSeconds());

        SimulationException negative = assertThrows(SimulationException.class,
                () -> fx.cooldown.setCooldownSeconds(OWNER, -1));
        assertEquals(ErrorKind.INVALID_ARGUMENT, negative.getKind());

        fx.cooldown.setCooldownSeconds(OWNER, 0);
        assertEquals(0, fx.cooldown.getCooldownSeconds());
        assertEquals(new SimulationEvent.CooldownChanged(30, 0),
                fx.events.ofType(SimulationEvent.CooldownChanged.class).get(0));
    }
}
