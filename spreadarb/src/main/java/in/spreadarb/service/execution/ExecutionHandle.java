package in.spreadarb.service.execution;

import in.spreadarb.domain.trade.ExecutionState;
import in.spreadarb.domain.trade.TradeResult;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live view of one in-flight execution.
 */
public final class ExecutionHandle {
    private final String tradeId;
    private final String symbol;
    private final Instant startedAt;
    private final AtomicReference<ExecutionState> state = new AtomicReference<>(ExecutionState.PENDING);
    private final CompletableFuture<TradeResult> result = new CompletableFuture<>();

    ExecutionHandle(String tradeId, String symbol, Instant startedAt) {
        this.tradeId = tradeId;
        this.symbol = symbol;
        this.startedAt = startedAt;
    }

    public String tradeId() {
        return tradeId;
    }

    public String symbol() {
        return symbol;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public ExecutionState state() {
        return state.get();
    }

    void advance(ExecutionState next) {
        state.set(next);
    }

    public CompletableFuture<TradeResult> result() {
        return result;
    }

    @Override
    public String toString() {
        return tradeId + "[" + symbol + " " + state.get() + "]";
    }
}
