package in.spreadarb.service.execution;

import in.spreadarb.application.port.output.ExchangeClient;
import in.spreadarb.domain.order.Order;
import in.spreadarb.domain.order.OrderRequest;
import in.spreadarb.domain.order.OrderSide;
import in.spreadarb.domain.order.OrderStatus;
import in.spreadarb.domain.order.OrderType;
import in.spreadarb.domain.strategy.AdvancedRules;
import in.spreadarb.infrastructure.exchange.BackoffPolicy;
import in.spreadarb.infrastructure.exchange.ExchangeErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one side of an arbitrage on one exchange and blocks until it settles.
 *
 * Features:
 * - MARKET orders, or LIMIT orders offset from the expected price
 * - Large legs split into child orders of at most maxSingleOrderSize quote
 * - Transient submission failures retried with backoff, reusing the client order id
 * - Status polled until terminal; the working remainder is cancelled at the timeout
 * - An order whose cancel and follow-up status check both fail is reported as unsettled
 *
 * Runs on an execution pool thread. Does not observe engine cancellation: once a leg
 * is submitted it is driven to a final state.
 */
public final class LegExecutor {
    private static final Logger log = LoggerFactory.getLogger(LegExecutor.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public record LegRequest(String tradeId, String exchangeSymbol, OrderSide side,
                             BigDecimal quantity, BigDecimal expectedPrice) {}

    public LegOutcome execute(ExchangeClient client, LegRequest leg, AdvancedRules rules) {
        Instant started = Instant.now();
        List<BigDecimal> slices = slice(leg.quantity(), leg.expectedPrice(), rules);
        List<Order> children = new ArrayList<>();
        int retries = 0;
        String error = null;

        for (BigDecimal slice : slices) {
            OrderRequest request = request(client.name(), leg, slice, rules);
            Submission submission = submit(client, request, rules);
            retries += submission.retries();
            if (submission.order() == null) {
                error = submission.error();
                break;
            }
            Order settled = awaitFinal(client, submission.order(), rules);
            children.add(settled);
            if (settled.filledQuantity().compareTo(slice) < 0) {
                if (!settled.isTerminal()) {
                    error = leg.side() + " order " + settled.orderId() + " on " + client.name() + " may still be live"
                        + (settled.message() != null ? " (" + settled.message() + ")" : "");
                } else if (settled.status() == OrderStatus.REJECTED || !settled.hasFill()) {
                    error = settled.message() != null ? settled.message()
                        : leg.side() + " order " + settled.orderId() + " not filled before timeout";
                } else {
                    error = leg.side() + " order " + settled.orderId() + " partially filled "
                        + settled.filledQuantity() + "/" + slice;
                }
                break;
            }
        }

        Order aggregate = aggregate(leg, children);
        Duration elapsed = Duration.between(started, Instant.now());
        log.info("[LEG] {} {} {} on {}: filled {}/{} in {} child order(s), {}ms{}",
            leg.tradeId(), leg.side(), leg.exchangeSymbol(), client.name(),
            aggregate == null ? BigDecimal.ZERO : aggregate.filledQuantity(), leg.quantity(),
            children.size(), elapsed.toMillis(), error == null ? "" : " (" + error + ")");
        List<String> unsettled = new ArrayList<>();
        for (Order child : children) {
            if (!child.isTerminal()) {
                unsettled.add(child.orderId());
            }
        }
        if (!unsettled.isEmpty()) {
            log.error("[LEG] 🚨 {} {} order(s) {} on {} not confirmed final; they may still fill",
                leg.tradeId(), leg.side(), unsettled, client.name());
        }
        return new LegOutcome(aggregate, children.size(), retries, error, elapsed, unsettled);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SLICING
    // ═══════════════════════════════════════════════════════════════════════

    static List<BigDecimal> slice(BigDecimal quantity, BigDecimal price, AdvancedRules rules) {
        BigDecimal maxChild = BigDecimal.valueOf(rules.maxSingleOrderSize());
        BigDecimal notional = quantity.multiply(price);
        if (!rules.splitLargeOrders() || maxChild.signum() <= 0 || notional.compareTo(maxChild) <= 0) {
            return List.of(quantity);
        }
        int count = notional.divide(maxChild, 0, RoundingMode.CEILING).intValueExact();
        int scale = Math.max(quantity.scale(), 8);
        BigDecimal each = quantity.divide(BigDecimal.valueOf(count), scale, RoundingMode.DOWN);
        List<BigDecimal> slices = new ArrayList<>(count);
        BigDecimal assigned = BigDecimal.ZERO;
        for (int i = 0; i < count - 1; i++) {
            slices.add(each);
            assigned = assigned.add(each);
        }
        slices.add(quantity.subtract(assigned));
        return slices;
    }

    private static OrderRequest request(String exchange, LegRequest leg, BigDecimal quantity, AdvancedRules rules) {
        if (!rules.useLimitOrders()) {
            return OrderRequest.market(exchange, leg.exchangeSymbol(), leg.side(), quantity);
        }
        BigDecimal offset = BigDecimal.valueOf(rules.limitOrderOffsetPercent()).divide(HUNDRED, 10, RoundingMode.HALF_UP);
        BigDecimal factor = leg.side() == OrderSide.BUY ? BigDecimal.ONE.add(offset) : BigDecimal.ONE.subtract(offset);
        BigDecimal price = leg.expectedPrice().multiply(factor).setScale(8, RoundingMode.HALF_UP);
        return OrderRequest.limit(exchange, leg.exchangeSymbol(), leg.side(), quantity, price);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SUBMISSION
    // ═══════════════════════════════════════════════════════════════════════

    private record Submission(Order order, int retries, String error) {}

    private Submission submit(ExchangeClient client, OrderRequest request, AdvancedRules rules) {
        BackoffPolicy backoff = BackoffPolicy.forOrderSubmission(rules.retryFailedOrders() ? rules.maxOrderRetries() : 0);
        long callTimeoutMs = Math.max(1000L, rules.orderTimeoutSeconds() * 1000L);
        int retries = 0;
        while (true) {
            try {
                return new Submission(await(client.placeOrder(request), callTimeoutMs), retries, null);
            } catch (LegCallException e) {
                backoff.recordFailure();
                if (!e.isTransient() || backoff.isExhausted()) {
                    log.warn("[LEG] {} {} on {} failed after {} attempt(s): {}", request.side(), request.symbol(),
                        client.name(), backoff.consecutiveFailures(), e.getMessage());
                    return new Submission(null, retries, e.getMessage());
                }
                Duration delay = backoff.nextDelay();
                log.info("[LEG] {} {} on {} failed ({}), retrying in {}ms", request.side(), request.symbol(),
                    client.name(), e.getMessage(), delay.toMillis());
                retries++;
                if (!sleep(delay.toMillis())) {
                    return new Submission(null, retries, "interrupted while retrying");
                }
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // FILL TRACKING
    // ═══════════════════════════════════════════════════════════════════════

    private Order awaitFinal(ExchangeClient client, Order order, AdvancedRules rules) {
        Order current = order;
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(rules.orderTimeoutSeconds());
        long pollMs = Math.max(10, rules.orderStatusPollMillis());

        while (!current.isTerminal()) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return cancelRemainder(client, current, pollMs);
            }
            if (!sleep(Math.min(pollMs, remainingMs))) {
                log.warn("[LEG] Interrupted while waiting on {} order {}", client.name(), current.orderId());
                return current;
            }
            try {
                current = await(client.getOrderStatus(current.symbol(), current.orderId()), pollMs * 4);
            } catch (LegCallException e) {
                log.debug("[LEG] Status check for {} on {} failed: {}", current.orderId(), client.name(), e.getMessage());
            }
        }
        return current;
    }

    private Order cancelRemainder(ExchangeClient client, Order current, long pollMs) {
        log.info("[LEG] Order {} on {} timed out with {}/{} filled, cancelling",
            current.orderId(), client.name(), current.filledQuantity(), current.quantity());
        try {
            return await(client.cancelOrder(current.symbol(), current.orderId()), Math.max(1000L, pollMs * 4));
        } catch (LegCallException e) {
            log.warn("[LEG] ⚠️ Cancel of {} on {} failed: {}", current.orderId(), client.name(), e.getMessage());
            try {
                return await(client.getOrderStatus(current.symbol(), current.orderId()), Math.max(1000L, pollMs * 4));
            } catch (LegCallException again) {
                log.warn("[LEG] ⚠️ Status of {} on {} unknown after failed cancel: {}",
                    current.orderId(), client.name(), again.getMessage());
                return current.withStatus(current.status(), "cancel and status check failed: " + e.getMessage());
            }
        }
    }

    private static Order aggregate(LegRequest leg, List<Order> children) {
        if (children.isEmpty()) {
            return null;
        }
        if (children.size() == 1 && children.get(0).quantity().compareTo(leg.quantity()) == 0) {
            return children.get(0);
        }
        BigDecimal filled = BigDecimal.ZERO;
        BigDecimal value = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        List<String> ids = new ArrayList<>();
        for (Order child : children) {
            filled = filled.add(child.filledQuantity());
            value = value.add(child.filledValue());
            fees = fees.add(child.fee());
            ids.add(child.orderId());
        }
        BigDecimal average = filled.signum() > 0 ? value.divide(filled, 8, RoundingMode.HALF_UP) : BigDecimal.ZERO;
        OrderStatus status;
        if (filled.compareTo(leg.quantity()) >= 0) {
            status = OrderStatus.FILLED;
        } else if (filled.signum() > 0) {
            status = OrderStatus.PARTIALLY_FILLED;
        } else {
            status = children.get(children.size() - 1).status();
        }
        Order first = children.get(0);
        return new Order(String.join(",", ids), first.clientOrderId(), first.exchange(), first.symbol(),
            first.side(), first.type(), leg.quantity(), first.price(), status, filled.min(leg.quantity()),
            average, fees, Instant.now(), children.size() + " child orders");
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════════════

    private static <T> T await(CompletableFuture<T> future, long timeoutMs) throws LegCallException {
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new LegCallException("timed out", true, e);
        } catch (ExecutionException e) {
            Throwable cause = ExchangeErrors.unwrap(e);
            throw new LegCallException(ExchangeErrors.describe(cause), ExchangeErrors.isTransient(cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LegCallException("interrupted", false, e);
        }
    }

    private static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class LegCallException extends Exception {
        private final boolean transientFailure;

        LegCallException(String message, boolean transientFailure, Throwable cause) {
            super(message, cause);
            this.transientFailure = transientFailure;
        }

        boolean isTransient() {
            return transientFailure;
        }
    }
}
