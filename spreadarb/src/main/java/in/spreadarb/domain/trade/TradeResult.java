package in.spreadarb.domain.trade;

import in.spreadarb.domain.order.Order;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Final record of one two-leg arbitrage attempt.
 * Built once by the execution coordinator, then only read.
 */
public record TradeResult(
    String tradeId,
    String symbol,
    ArbitrageDirection direction,
    TradeResultStatus status,
    ExecutionState executionState,
    Order buyOrder,
    Order sellOrder,
    SpreadOpportunity opportunity,
    BigDecimal actualBuyValue,
    BigDecimal actualSellValue,
    BigDecimal totalFees,
    BigDecimal netPnl,
    BigDecimal pnlPercent,
    Instant startedAt,
    Instant endedAt,
    Duration duration,
    HeldInventory heldInventory,
    String errorMessage,
    Map<String, Object> metadata
) {
    public TradeResult {
        if (tradeId == null || symbol == null || status == null || executionState == null) {
            throw new IllegalArgumentException("tradeId, symbol, status and executionState are required");
        }
        if (buyOrder != null && sellOrder != null
            && sellOrder.quantity().compareTo(buyOrder.filledQuantity()) > 0) {
            throw new IllegalArgumentException("Sell quantity " + sellOrder.quantity()
                + " exceeds buy filled quantity " + buyOrder.filledQuantity());
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isWin() {
        return netPnl.signum() > 0;
    }

    public boolean isLoss() {
        return netPnl.signum() < 0;
    }

    /**
     * Only attempts that moved money count towards stats and loss streaks.
     */
    public boolean isExecuted() {
        return status != TradeResultStatus.CANCELLED
            && (buyOrder != null && buyOrder.hasFill());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String tradeId = UUID.randomUUID().toString();
        private String symbol;
        private ArbitrageDirection direction = ArbitrageDirection.NONE;
        private TradeResultStatus status;
        private ExecutionState executionState = ExecutionState.PENDING;
        private Order buyOrder;
        private Order sellOrder;
        private SpreadOpportunity opportunity;
        private BigDecimal actualBuyValue = BigDecimal.ZERO;
        private BigDecimal actualSellValue = BigDecimal.ZERO;
        private BigDecimal totalFees = BigDecimal.ZERO;
        private BigDecimal netPnl = BigDecimal.ZERO;
        private BigDecimal pnlPercent = BigDecimal.ZERO;
        private Instant startedAt = Instant.now();
        private Instant endedAt;
        private HeldInventory heldInventory;
        private String errorMessage;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {}

        public Builder tradeId(String tradeId) { this.tradeId = tradeId; return this; }
        public Builder symbol(String symbol) { this.symbol = symbol; return this; }
        public Builder direction(ArbitrageDirection direction) { this.direction = direction; return this; }
        public Builder status(TradeResultStatus status) { this.status = status; return this; }
        public Builder executionState(ExecutionState state) { this.executionState = state; return this; }
        public Builder buyOrder(Order order) { this.buyOrder = order; return this; }
        public Builder sellOrder(Order order) { this.sellOrder = order; return this; }
        public Builder actualBuyValue(BigDecimal value) { this.actualBuyValue = value; return this; }
        public Builder actualSellValue(BigDecimal value) { this.actualSellValue = value; return this; }
        public Builder totalFees(BigDecimal fees) { this.totalFees = fees; return this; }
        public Builder netPnl(BigDecimal pnl) { this.netPnl = pnl; return this; }
        public Builder pnlPercent(BigDecimal pct) { this.pnlPercent = pct; return this; }
        public Builder startedAt(Instant startedAt) { this.startedAt = startedAt; return this; }
        public Builder endedAt(Instant endedAt) { this.endedAt = endedAt; return this; }
        public Builder heldInventory(HeldInventory inventory) { this.heldInventory = inventory; return this; }
        public Builder errorMessage(String message) { this.errorMessage = message; return this; }
        public Builder metadata(String key, Object value) { this.metadata.put(key, value); return this; }

        public Builder opportunity(SpreadOpportunity opportunity) {
            this.opportunity = opportunity;
            if (opportunity != null) {
                if (symbol == null) symbol = opportunity.symbol();
                direction = opportunity.direction();
            }
            return this;
        }

        public TradeResult build() {
            Instant end = endedAt != null ? endedAt : Instant.now();
            return new TradeResult(tradeId, symbol, direction, status, executionState, buyOrder, sellOrder,
                opportunity, actualBuyValue, actualSellValue, totalFees, netPnl, pnlPercent,
                startedAt, end, Duration.between(startedAt, end), heldInventory, errorMessage, metadata);
        }
    }
}
