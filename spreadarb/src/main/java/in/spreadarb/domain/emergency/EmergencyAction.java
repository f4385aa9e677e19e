package in.spreadarb.domain.emergency;

/**
 * Action recommended to the engine controller.
 */
public enum EmergencyAction {
    NONE,
    PAUSE_TRADING,
    STOP_TRADING
}
