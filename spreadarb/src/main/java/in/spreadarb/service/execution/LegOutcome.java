package in.spreadarb.service.execution;

import in.spreadarb.domain.order.Order;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Result of one leg. {@code order} aggregates all child orders and is null when the
 * exchange never accepted any of them. {@code unsettledOrderIds} lists child orders whose
 * final state could not be confirmed; they may still be working on the exchange.
 */
public record LegOutcome(Order order, int childOrders, int retries, String error, Duration elapsed,
                         List<String> unsettledOrderIds) {

    public LegOutcome {
        unsettledOrderIds = unsettledOrderIds == null ? List.of() : List.copyOf(unsettledOrderIds);
    }

    public boolean hasUnsettledOrders() {
        return !unsettledOrderIds.isEmpty();
    }

    public BigDecimal filledQuantity() {
        return order == null ? BigDecimal.ZERO : order.filledQuantity();
    }

    public boolean hasFill() {
        return order != null && order.hasFill();
    }

    public boolean isComplete(BigDecimal requested) {
        return order != null && order.filledQuantity().compareTo(requested) >= 0;
    }
}
