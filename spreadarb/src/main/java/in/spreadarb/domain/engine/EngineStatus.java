package in.spreadarb.domain.engine;

import java.util.EnumSet;
import java.util.Set;

/**
 * Engine lifecycle states.
 *
 * IDLE -> STARTING -> RUNNING <-> PAUSED -> STOPPING -> STOPPED.
 * ERROR is reachable from every active state and is left only through an explicit start.
 */
public enum EngineStatus {
    IDLE,
    STARTING,
    RUNNING,
    PAUSED,
    STOPPING,
    STOPPED,
    ERROR;

    public Set<EngineStatus> allowedNext() {
        return switch (this) {
            case IDLE -> EnumSet.of(STARTING);
            case STARTING -> EnumSet.of(RUNNING, ERROR);
            case RUNNING -> EnumSet.of(PAUSED, STOPPING, ERROR);
            case PAUSED -> EnumSet.of(RUNNING, STOPPING, ERROR);
            case STOPPING -> EnumSet.of(STOPPED, ERROR);
            case STOPPED -> EnumSet.of(STARTING);
            case ERROR -> EnumSet.of(STARTING);
        };
    }

    public boolean canTransitionTo(EngineStatus next) {
        return allowedNext().contains(next);
    }

    /**
     * States in which pollers and scheduled tasks are alive.
     */
    public boolean isActive() {
        return this == STARTING || this == RUNNING || this == PAUSED || this == STOPPING;
    }
}
