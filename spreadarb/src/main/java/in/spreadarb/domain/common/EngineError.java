package in.spreadarb.domain.common;

import in.spreadarb.domain.trade.HeldInventory;

import java.time.Instant;

/**
 * Structured error event. Every failure path in the engine ends in one of these
 * rather than an exception crossing the engine boundary.
 */
public record EngineError(
    String source,
    String message,
    ErrorSeverity severity,
    String symbol,
    String tradeId,
    String recommendedAction,
    HeldInventory heldInventory,
    Throwable cause,
    Instant timestamp
) {
    public EngineError {
        if (source == null || message == null || severity == null) {
            throw new IllegalArgumentException("source, message and severity are required");
        }
        if (timestamp == null) timestamp = Instant.now();
    }

    public static EngineError of(String source, ErrorSeverity severity, String symbol, String message) {
        return new EngineError(source, message, severity, symbol, null, null, null, null, Instant.now());
    }

    public static EngineError of(String source, ErrorSeverity severity, String symbol, String message, Throwable cause) {
        return new EngineError(source, message, severity, symbol, null, null, null, cause, Instant.now());
    }
}
