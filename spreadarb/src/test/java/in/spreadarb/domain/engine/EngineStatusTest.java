package in.spreadarb.domain.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EngineStatusTest {

    @Test
    @DisplayName("Normal lifecycle path is allowed")
    void lifecyclePath() {
        assertTrue(EngineStatus.IDLE.canTransitionTo(EngineStatus.STARTING));
        assertTrue(EngineStatus.STARTING.canTransitionTo(EngineStatus.RUNNING));
        assertTrue(EngineStatus.RUNNING.canTransitionTo(EngineStatus.PAUSED));
        assertTrue(EngineStatus.PAUSED.canTransitionTo(EngineStatus.RUNNING));
        assertTrue(EngineStatus.PAUSED.canTransitionTo(EngineStatus.STOPPING));
        assertTrue(EngineStatus.STOPPING.canTransitionTo(EngineStatus.STOPPED));
        assertTrue(EngineStatus.STOPPED.canTransitionTo(EngineStatus.STARTING));
    }

    @Test
    @DisplayName("ERROR is left only through a start")
    void errorOnlyLeftByStart() {
        for (EngineStatus next : EngineStatus.values()) {
            assertEquals(next == EngineStatus.STARTING, EngineStatus.ERROR.canTransitionTo(next), next.name());
        }
    }

    @Test
    @DisplayName("Shortcuts are refused")
    void shortcutsRefused() {
        assertFalse(EngineStatus.IDLE.canTransitionTo(EngineStatus.RUNNING));
        assertFalse(EngineStatus.RUNNING.canTransitionTo(EngineStatus.STOPPED));
        assertFalse(EngineStatus.STOPPED.canTransitionTo(EngineStatus.RUNNING));
        assertFalse(EngineStatus.IDLE.canTransitionTo(EngineStatus.ERROR));
    }

    @Test
    void activeStates() {
        assertTrue(EngineStatus.RUNNING.isActive());
        assertTrue(EngineStatus.PAUSED.isActive());
        assertFalse(EngineStatus.IDLE.isActive());
        assertFalse(EngineStatus.STOPPED.isActive());
        assertFalse(EngineStatus.ERROR.isActive());
    }
}
