package in.spreadarb.service.market;

import in.spreadarb.application.port.output.ExchangeClient;
import in.spreadarb.application.port.output.ExchangeClientFactory;
import in.spreadarb.config.PollingSettings;
import in.spreadarb.domain.common.EventType;
import in.spreadarb.domain.market.OrderBook;
import in.spreadarb.domain.market.Ticker;
import in.spreadarb.domain.pair.PairLeg;
import in.spreadarb.domain.pair.TradingPair;
import in.spreadarb.infrastructure.exchange.BackoffPolicy;
import in.spreadarb.infrastructure.exchange.ExchangeErrors;
import in.spreadarb.infrastructure.metrics.ArbitrageMetrics;
import in.spreadarb.service.core.EngineEventBus;
import in.spreadarb.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Per-pair market data loop.
 *
 * Features:
 * - One loop per enabled pair on a shared scheduler
 * - Both legs fetched concurrently, each bounded by the ticker timeout
 * - A failed leg skips the cycle; consecutive failures back off the loop
 * - Cycles whose legs are further apart than the detection window are skipped
 * - The next cycle is scheduled only after the handler returns, so detection for a
 *   pair never overlaps its own next fetch
 *
 * Usage:
 * <pre>
 * MarketDataPoller poller = new MarketDataPoller(factory, table, bus, metrics, scheduler, () -> polling);
 * poller.start(pair, runToken, handler);
 * ...
 * poller.stopAll();
 * </pre>
 */
public final class MarketDataPoller {
    private static final Logger log = LoggerFactory.getLogger(MarketDataPoller.class);

    /**
     * Receives each complete cycle for a pair.
     */
    public interface PairCycleHandler {

        void onTickers(TradingPair pair, TickerPair tickers);

        /**
         * The handler itself threw. The loop for this pair stops.
         */
        void onLoopFault(TradingPair pair, Throwable error);
    }

    private final ExchangeClientFactory clients;
    private final LatestTickerTable table;
    private final EngineEventBus events;
    private final ArbitrageMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final Supplier<PollingSettings> settings;
    private final ConcurrentHashMap<String, PairLoop> loops = new ConcurrentHashMap<>();

    public MarketDataPoller(ExchangeClientFactory clients,
                            LatestTickerTable table,
                            EngineEventBus events,
                            ArbitrageMetrics metrics,
                            ScheduledExecutorService scheduler,
                            Supplier<PollingSettings> settings) {
        this.clients = clients;
        this.table = table;
        this.events = events;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.settings = settings;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SINGLE FETCH
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Fetch both legs once. Each successful leg updates the ticker table and publishes a
     * price update even if the other leg fails. Order books are fetched best-effort when
     * {@code withOrderBooks} is set.
     */
    public CompletableFuture<TickerPair> poll(TradingPair pair, boolean withOrderBooks) {
        PollingSettings polling = settings.get();
        CompletableFuture<Ticker> a = fetchTicker(pair, pair.legA(), polling);
        CompletableFuture<Ticker> b = fetchTicker(pair, pair.legB(), polling);
        CompletableFuture<OrderBook> bookA = withOrderBooks ? fetchBook(pair, pair.legA(), polling) : done(null);
        CompletableFuture<OrderBook> bookB = withOrderBooks ? fetchBook(pair, pair.legB(), polling) : done(null);

        return CompletableFuture.allOf(a, b, bookA, bookB)
            .handle((ignored, error) -> {
                if (a.isCompletedExceptionally() || b.isCompletedExceptionally()) {
                    Throwable cause = a.isCompletedExceptionally() ? failure(a) : failure(b);
                    throw new MarketDataException(pair.symbol(), ExchangeErrors.describe(cause), cause);
                }
                return new TickerPair(a.join(), b.join(), bookA.getNow(null), bookB.getNow(null));
            });
    }

    private CompletableFuture<Ticker> fetchTicker(TradingPair pair, PairLeg leg, PollingSettings polling) {
        CompletableFuture<Ticker> future;
        try {
            ExchangeClient client = clients.createClient(leg.exchange());
            future = client.getTicker(leg.exchangeSymbol())
                .orTimeout(polling.tickerTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((ticker, error) -> {
            if (error != null) {
                metrics.recordMarketDataError(leg.exchange());
                log.warn("[POLLER] {} ticker from {} failed: {}", pair.symbol(), leg.exchange(),
                    ExchangeErrors.describe(error));
                return;
            }
            table.update(pair.symbol(), ticker);
            events.publish(EventType.PRICE_UPDATED, l -> l.onPriceUpdated(pair.symbol(), ticker));
        });
    }

    private CompletableFuture<OrderBook> fetchBook(TradingPair pair, PairLeg leg, PollingSettings polling) {
        CompletableFuture<OrderBook> future;
        try {
            future = clients.createClient(leg.exchange())
                .getOrderBook(leg.exchangeSymbol(), polling.orderBookDepth())
                .orTimeout(polling.tickerTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.handle((book, error) -> {
            if (error != null) {
                log.debug("[POLLER] {} order book from {} unavailable: {}", pair.symbol(), leg.exchange(),
                    ExchangeErrors.describe(error));
                return null;
            }
            table.updateOrderBook(pair.symbol(), book);
            return book;
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LOOPS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Start the loop for {@code pair}. Returns false if one is already running for its symbol.
     *
     * @param withOrderBooks evaluated every cycle, so a strategy reload can toggle depth checks
     */
    public boolean start(TradingPair pair, CancellationToken runToken, BooleanSupplier withOrderBooks,
                         PairCycleHandler handler) {
        PollingSettings polling = settings.get();
        PairLoop loop = new PairLoop(pair, CancellationToken.linkedTo(runToken), withOrderBooks, handler,
            BackoffPolicy.forMarketData(polling.failuresBeforeBackoff(),
                Duration.ofMillis(polling.intervalMs()), Duration.ofMillis(polling.maxBackoffMs())));
        if (loops.putIfAbsent(pair.symbol(), loop) != null) {
            log.debug("[POLLER] Loop for {} already running", pair.symbol());
            return false;
        }
        loop.token.onCancel(() -> {
            loops.remove(pair.symbol(), loop);
            loop.cancelScheduled();
        });
        log.info("[POLLER] Started {} ({} / {}) every {}ms", pair.symbol(), pair.legA().exchange(),
            pair.legB().exchange(), polling.intervalMs());
        loop.schedule(0);
        return true;
    }

    public void stop(String pairSymbol) {
        PairLoop loop = loops.get(pairSymbol);
        if (loop != null) {
            loop.token.cancel();
            log.info("[POLLER] Stopped {}", pairSymbol);
        }
    }

    public void stopAll() {
        for (PairLoop loop : loops.values()) {
            loop.token.cancel();
        }
        loops.clear();
    }

    public boolean isPolling(String pairSymbol) {
        return loops.containsKey(pairSymbol);
    }

    public Set<String> activeSymbols() {
        return Set.copyOf(loops.keySet());
    }

    private final class PairLoop {
        private final TradingPair pair;
        private final CancellationToken token;
        private final BooleanSupplier withOrderBooks;
        private final PairCycleHandler handler;
        private final BackoffPolicy backoff;
        private volatile ScheduledFuture<?> next;

        PairLoop(TradingPair pair, CancellationToken token, BooleanSupplier withOrderBooks,
                 PairCycleHandler handler, BackoffPolicy backoff) {
            this.pair = pair;
            this.token = token;
            this.withOrderBooks = withOrderBooks;
            this.handler = handler;
            this.backoff = backoff;
        }

        void schedule(long delayMs) {
            if (token.isCancelled()) {
                return;
            }
            try {
                next = scheduler.schedule(this::runCycle, delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("[POLLER] Scheduler shut down, {} loop ends", pair.symbol());
                token.cancel();
            }
        }

        void cancelScheduled() {
            ScheduledFuture<?> pending = next;
            if (pending != null) {
                pending.cancel(false);
            }
        }

        private void runCycle() {
            if (token.isCancelled()) {
                return;
            }
            poll(pair, withOrderBooks.getAsBoolean()).whenComplete((tickers, error) -> {
                if (token.isCancelled()) {
                    return;
                }
                if (error != null) {
                    backoff.recordFailure();
                    if (backoff.isBackingOff()) {
                        log.warn("[POLLER] {} backing off {}ms after {} consecutive failures", pair.symbol(),
                            backoff.nextDelay().toMillis(), backoff.consecutiveFailures());
                    }
                } else {
                    backoff.recordSuccess();
                    if (!dispatch(tickers)) {
                        return;
                    }
                }
                schedule(settings.get().intervalMs() + backoff.nextDelay().toMillis());
            });
        }

        private boolean dispatch(TickerPair tickers) {
            long skewMs = Math.abs(Duration.between(tickers.tickerA().timestamp(),
                tickers.tickerB().timestamp()).toMillis());
            if (skewMs > settings.get().detectionWindowMs()) {
                log.debug("[POLLER] {} legs {}ms apart, skipping detection", pair.symbol(), skewMs);
                return true;
            }
            try {
                handler.onTickers(pair, tickers);
                return true;
            } catch (RuntimeException e) {
                log.error("[POLLER] {} cycle handler failed, stopping loop", pair.symbol(), e);
                token.cancel();
                handler.onLoopFault(pair, e);
                return false;
            }
        }
    }

    private static <T> CompletableFuture<T> done(T value) {
        return CompletableFuture.completedFuture(value);
    }

    private static Throwable failure(CompletableFuture<?> future) {
        try {
            future.join();
            return null;
        } catch (RuntimeException e) {
            return ExchangeErrors.unwrap(e);
        }
    }
}
