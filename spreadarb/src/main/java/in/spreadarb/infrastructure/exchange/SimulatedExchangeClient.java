package in.spreadarb.infrastructure.exchange;

import in.spreadarb.application.port.output.ExchangeClient;
import in.spreadarb.domain.balance.AccountBalance;
import in.spreadarb.domain.balance.AssetBalance;
import in.spreadarb.domain.market.OrderBook;
import in.spreadarb.domain.market.OrderBookLevel;
import in.spreadarb.domain.market.Ticker;
import in.spreadarb.domain.order.Order;
import in.spreadarb.domain.order.OrderRequest;
import in.spreadarb.domain.order.OrderSide;
import in.spreadarb.domain.order.OrderStatus;
import in.spreadarb.domain.order.OrderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Paper-trading exchange.
 *
 * Features:
 * - Markets seeded with a mid price and bid/ask spread, optional random walk per ticker request
 * - Balance-checked order fills with taker fee charged in the quote currency
 * - Configurable fill ratio (partial fills) and resting mode (orders stay NEW until filled by hand)
 * - Fault injection: disconnect, reject next orders, fail next ticker requests, response latency
 *
 * Used by the bootstrap for dry runs and by tests as a deterministic exchange.
 */
public final class SimulatedExchangeClient implements ExchangeClient {
    private static final Logger log = LoggerFactory.getLogger(SimulatedExchangeClient.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int PRICE_SCALE = 8;

    private final String name;
    private final Map<String, Market> markets = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> balances = new HashMap<>();
    private final Map<String, Order> orders = new ConcurrentHashMap<>();
    private final AtomicLong orderSequence = new AtomicLong();
    private final Random random;

    private volatile BigDecimal takerFeePercent;
    private volatile BigDecimal fillRatio = BigDecimal.ONE;
    private volatile boolean restingOrders = false;
    private volatile boolean connected = true;
    private volatile double volatilityPercent = 0.0;
    private volatile Duration latency = Duration.ZERO;
    private int rejectNextOrders = 0;
    private int failNextTickers = 0;

    public SimulatedExchangeClient(String name, BigDecimal takerFeePercent) {
        this(name, takerFeePercent, new Random());
    }

    public SimulatedExchangeClient(String name, BigDecimal takerFeePercent, Random random) {
        this.name = name;
        this.takerFeePercent = takerFeePercent;
        this.random = random;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SETUP
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Quote a market around {@code mid} with a symmetric spread.
     * The market is listed under BASE+QUOTE, e.g. BTCUSDT.
     */
    public SimulatedExchangeClient withMarket(String base, String quote, BigDecimal mid,
                                              double spreadPercent, BigDecimal volume24h) {
        BigDecimal half = mid.multiply(BigDecimal.valueOf(spreadPercent / 200.0));
        return withQuote(base, quote, mid.subtract(half), mid.add(half), new BigDecimal("10"), volume24h);
    }

    /**
     * Quote a market with explicit bid/ask and top-of-book quantity.
     */
    public SimulatedExchangeClient withQuote(String base, String quote, BigDecimal bid, BigDecimal ask,
                                             BigDecimal topQuantity, BigDecimal volume24h) {
        String symbol = base + quote;
        markets.put(symbol, new Market(base, quote, bid, ask, topQuantity, volume24h));
        return this;
    }

    public SimulatedExchangeClient withBalance(String asset, BigDecimal amount) {
        synchronized (balances) {
            balances.put(asset, amount);
        }
        return this;
    }

    public void setQuote(String exchangeSymbol, BigDecimal bid, BigDecimal ask) {
        Market market = requireMarket(exchangeSymbol);
        market.bid = bid;
        market.ask = ask;
    }

    public void setFeePercent(BigDecimal feePercent) {
        this.takerFeePercent = feePercent;
    }

    /**
     * Fraction (0..1] of each marketable order that fills immediately.
     */
    public void setFillRatio(BigDecimal ratio) {
        if (ratio.signum() < 0 || ratio.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("fill ratio must be within [0, 1]");
        }
        this.fillRatio = ratio;
    }

    /**
     * When set, new orders are accepted but not filled until {@link #fillOrder(String)}.
     */
    public void setRestingOrders(boolean resting) {
        this.restingOrders = resting;
    }

    public void setConnected(boolean connected) {
        this.connected = connected;
    }

    public void setVolatilityPercent(double volatilityPercent) {
        this.volatilityPercent = volatilityPercent;
    }

    public void setLatency(Duration latency) {
        this.latency = latency;
    }

    public synchronized void rejectNextOrders(int count) {
        this.rejectNextOrders = count;
    }

    public synchronized void failNextTickers(int count) {
        this.failNextTickers = count;
    }

    /**
     * Fill a resting order completely at the current touch price.
     */
    public Order fillOrder(String orderId) {
        synchronized (this) {
            Order order = orders.get(orderId);
            if (order == null || order.isTerminal()) {
                throw new IllegalStateException("No working order " + orderId);
            }
            Market market = requireMarket(order.symbol());
            BigDecimal price = order.side() == OrderSide.BUY ? market.ask : market.bid;
            Order filled = applyFill(order, order.remainingQuantity(), price, market);
            orders.put(orderId, filled);
            return filled;
        }
    }

    public BigDecimal balanceOf(String asset) {
        synchronized (balances) {
            return balances.getOrDefault(asset, BigDecimal.ZERO);
        }
    }

    public List<Order> orders() {
        return new ArrayList<>(orders.values());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ExchangeClient
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public String name() {
        return name;
    }

    @Override
    public BigDecimal takerFeePercent() {
        return takerFeePercent;
    }

    @Override
    public CompletableFuture<Boolean> testConnection() {
        return respond(() -> connected);
    }

    @Override
    public CompletableFuture<Ticker> getTicker(String symbol) {
        return respond(() -> {
            ensureConnected();
            synchronized (this) {
                if (failNextTickers > 0) {
                    failNextTickers--;
                    throw new ExchangeUnavailableException(name, "Ticker request timed out for " + symbol);
                }
            }
            Market market = requireMarket(symbol);
            if (volatilityPercent > 0) {
                market.walk(random, volatilityPercent);
            }
            return new Ticker(name, symbol, market.bid, market.topQuantity, market.ask, market.topQuantity,
                market.bid.add(market.ask).divide(BigDecimal.valueOf(2), PRICE_SCALE, RoundingMode.HALF_UP),
                market.volume24h, Instant.now());
        });
    }

    @Override
    public CompletableFuture<OrderBook> getOrderBook(String symbol, int depth) {
        return respond(() -> {
            ensureConnected();
            Market market = requireMarket(symbol);
            BigDecimal step = market.ask.multiply(new BigDecimal("0.0001"));
            List<OrderBookLevel> bids = new ArrayList<>();
            List<OrderBookLevel> asks = new ArrayList<>();
            for (int i = 0; i < depth; i++) {
                BigDecimal offset = step.multiply(BigDecimal.valueOf(i));
                bids.add(new OrderBookLevel(market.bid.subtract(offset), market.topQuantity));
                asks.add(new OrderBookLevel(market.ask.add(offset), market.topQuantity));
            }
            return new OrderBook(name, symbol, bids, asks, Instant.now());
        });
    }

    @Override
    public CompletableFuture<AccountBalance> getBalance() {
        return respond(() -> {
            ensureConnected();
            Map<String, AssetBalance> assets = new HashMap<>();
            synchronized (balances) {
                balances.forEach((asset, amount) -> assets.put(asset, new AssetBalance(asset, amount, amount)));
            }
            return new AccountBalance(name, assets, Instant.now());
        });
    }

    @Override
    public CompletableFuture<Order> placeOrder(OrderRequest request) {
        return respond(() -> {
            ensureConnected();
            synchronized (this) {
                if (rejectNextOrders > 0) {
                    rejectNextOrders--;
                    throw new OrderRejectedException(name, request, "rejected by simulation");
                }
                Market market = markets.get(request.symbol());
                if (market == null) {
                    throw new OrderRejectedException(name, request, "unknown symbol");
                }
                BigDecimal touch = request.side() == OrderSide.BUY ? market.ask : market.bid;
                checkBalance(request, market, request.type() == OrderType.LIMIT ? request.price() : touch);

                String orderId = name + "-" + orderSequence.incrementAndGet();
                Order order = Order.accepted(orderId, request);
                if (!restingOrders && isMarketable(request, market)) {
                    BigDecimal fillQty = request.quantity().multiply(fillRatio)
                        .setScale(Math.max(request.quantity().scale(), PRICE_SCALE), RoundingMode.DOWN);
                    order = applyFill(order, fillQty, touch, market);
                }
                orders.put(orderId, order);
                log.debug("[SIM:{}] {} {} {} -> {} filled {}", name, request.side(), request.quantity(),
                    request.symbol(), order.status(), order.filledQuantity());
                return order;
            }
        });
    }

    @Override
    public CompletableFuture<Order> getOrderStatus(String symbol, String orderId) {
        return respond(() -> {
            ensureConnected();
            Order order = orders.get(orderId);
            if (order == null) {
                throw new ExchangeException(name, "Unknown order " + orderId);
            }
            return order;
        });
    }

    @Override
    public CompletableFuture<Order> cancelOrder(String symbol, String orderId) {
        return respond(() -> {
            ensureConnected();
            synchronized (this) {
                Order order = orders.get(orderId);
                if (order == null) {
                    throw new ExchangeException(name, "Unknown order " + orderId);
                }
                if (!order.isTerminal()) {
                    order = order.withStatus(OrderStatus.CANCELLED, "cancelled");
                    orders.put(orderId, order);
                }
                return order;
            }
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INTERNALS
    // ═══════════════════════════════════════════════════════════════════════

    private <T> CompletableFuture<T> respond(Supplier<T> action) {
        Duration delay = latency;
        if (delay.isZero()) {
            try {
                return CompletableFuture.completedFuture(action.get());
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        return CompletableFuture.supplyAsync(action,
            CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
    }

    private void ensureConnected() {
        if (!connected) {
            throw new ExchangeUnavailableException(name, "Not connected");
        }
    }

    private Market requireMarket(String symbol) {
        Market market = markets.get(symbol);
        if (market == null) {
            throw new ExchangeException(name, "Unknown symbol " + symbol);
        }
        return market;
    }

    private static boolean isMarketable(OrderRequest request, Market market) {
        if (request.type() == OrderType.MARKET) return true;
        return request.side() == OrderSide.BUY
            ? request.price().compareTo(market.ask) >= 0
            : request.price().compareTo(market.bid) <= 0;
    }

    private void checkBalance(OrderRequest request, Market market, BigDecimal price) {
        synchronized (balances) {
            if (request.side() == OrderSide.BUY) {
                BigDecimal cost = request.quantity().multiply(price);
                BigDecimal needed = cost.add(fee(cost));
                if (balances.getOrDefault(market.quote, BigDecimal.ZERO).compareTo(needed) < 0) {
                    throw new OrderRejectedException(name, request, "Insufficient " + market.quote + " balance");
                }
            } else if (balances.getOrDefault(market.base, BigDecimal.ZERO).compareTo(request.quantity()) < 0) {
                throw new OrderRejectedException(name, request, "Insufficient " + market.base + " balance");
            }
        }
    }

    private Order applyFill(Order order, BigDecimal quantity, BigDecimal price, Market market) {
        if (quantity.signum() <= 0) {
            return order;
        }
        BigDecimal notional = quantity.multiply(price);
        BigDecimal fee = fee(notional);
        synchronized (balances) {
            if (order.side() == OrderSide.BUY) {
                balances.merge(market.quote, notional.add(fee).negate(), BigDecimal::add);
                balances.merge(market.base, quantity, BigDecimal::add);
            } else {
                balances.merge(market.base, quantity.negate(), BigDecimal::add);
                balances.merge(market.quote, notional.subtract(fee), BigDecimal::add);
            }
        }
        BigDecimal filled = order.filledQuantity().add(quantity);
        BigDecimal avg = order.filledValue().add(notional).divide(filled, PRICE_SCALE, RoundingMode.HALF_UP);
        OrderStatus status = filled.compareTo(order.quantity()) >= 0 ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED;
        return order.withFill(status, filled, avg, order.fee().add(fee));
    }

    private BigDecimal fee(BigDecimal notional) {
        return notional.multiply(takerFeePercent).divide(HUNDRED, PRICE_SCALE, RoundingMode.HALF_UP);
    }

    private static final class Market {
        final String base;
        final String quote;
        final BigDecimal topQuantity;
        final BigDecimal volume24h;
        volatile BigDecimal bid;
        volatile BigDecimal ask;

        Market(String base, String quote, BigDecimal bid, BigDecimal ask,
               BigDecimal topQuantity, BigDecimal volume24h) {
            this.base = base;
            this.quote = quote;
            this.bid = bid;
            this.ask = ask;
            this.topQuantity = topQuantity;
            this.volume24h = volume24h;
        }

        synchronized void walk(Random random, double volatilityPercent) {
            double change = (random.nextDouble() * 2 - 1) * volatilityPercent / 100.0;
            BigDecimal factor = BigDecimal.ONE.add(BigDecimal.valueOf(change));
            bid = bid.multiply(factor).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
            ask = ask.multiply(factor).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
        }
    }
}
