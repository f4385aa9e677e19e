package in.spreadarb.domain.common;

/**
 * Severity of an engine error event.
 */
public enum ErrorSeverity {
    CRITICAL,   // Needs a human now (stranded inventory, abandoned execution)
    HIGH,       // Engine state changed because of it
    MEDIUM,     // A single attempt failed
    LOW,        // Degraded but self-healing
    INFO
}
