package in.spreadarb.service.opportunity;

import in.spreadarb.application.port.output.ExchangeClientFactory;
import in.spreadarb.config.PollingSettings;
import in.spreadarb.domain.balance.CombinedBalanceSnapshot;
import in.spreadarb.domain.market.OrderBook;
import in.spreadarb.domain.market.Ticker;
import in.spreadarb.domain.pair.TradingPair;
import in.spreadarb.domain.strategy.EntryRules;
import in.spreadarb.domain.strategy.TradingStrategy;
import in.spreadarb.domain.trade.ArbitrageDirection;
import in.spreadarb.domain.trade.SpreadOpportunity;
import in.spreadarb.service.market.LatestTickerTable;
import in.spreadarb.service.market.PriceHistory;
import in.spreadarb.service.market.TickerPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Turns a pair of tickers into a {@link SpreadOpportunity}.
 *
 * Both directions are priced and the better one is kept. Net spread is the gross spread
 * minus the taker fee of both exchanges and the strategy's slippage estimate.
 * The opportunity is tradeable only when every entry rule passes and the sized quantity
 * is positive. Stateless apart from the confirmation streak per pair.
 */
public final class OpportunityDetector {
    private static final Logger log = LoggerFactory.getLogger(OpportunityDetector.class);

    private final ExchangeClientFactory clients;
    private final LatestTickerTable table;
    private final Supplier<CombinedBalanceSnapshot> balances;
    private final Supplier<PollingSettings> polling;
    private final StrategyEvaluator strategies;
    private final Clock clock;
    private final SpreadConfirmationTracker confirmations = new SpreadConfirmationTracker();

    public OpportunityDetector(ExchangeClientFactory clients,
                               LatestTickerTable table,
                               Supplier<CombinedBalanceSnapshot> balances,
                               Supplier<PollingSettings> polling,
                               StrategyEvaluator strategies,
                               Clock clock) {
        this.clients = clients;
        this.table = table;
        this.balances = balances;
        this.polling = polling;
        this.strategies = strategies;
        this.clock = clock;
    }

    /**
     * Evaluate against the evaluator's active strategy.
     */
    public SpreadOpportunity evaluate(TradingPair pair, TickerPair tickers) {
        return evaluate(pair, tickers, strategies.current());
    }

    public SpreadOpportunity evaluate(TradingPair pair, Ticker tickerA, Ticker tickerB, TradingStrategy strategy) {
        return evaluate(pair, new TickerPair(tickerA, tickerB, null, null), strategy);
    }

    public SpreadOpportunity evaluate(TradingPair pair, TickerPair tickers, TradingStrategy strategy) {
        Instant now = clock.instant();
        Ticker a = tickers.tickerA();
        Ticker b = tickers.tickerB();

        // ═══════════════════════════════════════════════════════════════════════
        // INPUT CHECKS
        // ═══════════════════════════════════════════════════════════════════════
        for (Ticker ticker : new Ticker[] {a, b}) {
            if (!ticker.hasPositivePrices()) {
                confirmations.reset(pair.symbol());
                return SpreadOpportunity.none(pair.symbol(), "Non-positive price on " + ticker.exchange());
            }
            Duration maxAge = Duration.ofMillis(polling.get().maxTickerAgeMs());
            if (ticker.isOlderThan(maxAge, now)) {
                confirmations.reset(pair.symbol());
                return SpreadOpportunity.none(pair.symbol(), String.format("Stale ticker from %s (%dms old)",
                    ticker.exchange(), Duration.between(ticker.timestamp(), now).toMillis()));
            }
        }

        // ═══════════════════════════════════════════════════════════════════════
        // PRICING
        // ═══════════════════════════════════════════════════════════════════════
        BigDecimal feeA = clients.createClient(a.exchange()).takerFeePercent();
        BigDecimal feeB = clients.createClient(b.exchange()).takerFeePercent();
        BigDecimal totalFee = feeA.add(feeB);
        BigDecimal slippage = BigDecimal.valueOf(strategy.advanced().estimatedSlippagePercent());

        BigDecimal grossAB = SpreadCalculator.grossSpreadPercent(a.ask(), b.bid());
        BigDecimal netAB = SpreadCalculator.netSpreadPercent(grossAB, totalFee, slippage);
        BigDecimal grossBA = SpreadCalculator.grossSpreadPercent(b.ask(), a.bid());
        BigDecimal netBA = SpreadCalculator.netSpreadPercent(grossBA, totalFee, slippage);

        // Fee-aware selection ranks directions by net spread, otherwise by gross.
        boolean feeAware = strategy.advanced().preferLowerFeeExchanges();
        int cmp = feeAware ? netAB.compareTo(netBA) : grossAB.compareTo(grossBA);
        boolean buyOnA = cmp > 0 || (cmp == 0 && !(feeAware && feeB.compareTo(feeA) < 0));

        ArbitrageDirection direction = buyOnA ? ArbitrageDirection.BUY_A_SELL_B : ArbitrageDirection.BUY_B_SELL_A;
        Ticker buy = buyOnA ? a : b;
        Ticker sell = buyOnA ? b : a;
        BigDecimal gross = buyOnA ? grossAB : grossBA;
        BigDecimal net = buyOnA ? netAB : netBA;
        OrderBook buyBook = bookFor(pair, buy, buyOnA ? tickers.bookA() : tickers.bookB());
        OrderBook sellBook = bookFor(pair, sell, buyOnA ? tickers.bookB() : tickers.bookA());

        // ═══════════════════════════════════════════════════════════════════════
        // SIZING AND RULES
        // ═══════════════════════════════════════════════════════════════════════
        PositionSizer.Sizing sizing = PositionSizer.size(pair, buy, sell, strategy.risk(), balances.get());

        EntryRules entry = strategy.entry();
        boolean meetsMinimum = strategies.meetsMinimumSpread(entry, net);
        SpreadConfirmationTracker.Confirmation confirmation =
            confirmations.observe(pair.symbol(), direction, meetsMinimum, now);

        BigDecimal expectedProfit = SpreadCalculator.expectedProfit(sizing.quantity(), buy.ask(), net);
        EntryContext context = new EntryContext(pair.symbol(), direction, buy, sell, net, expectedProfit,
            buyBook, sellBook, history(buy, pair), history(sell, pair), confirmation.count(), confirmation.heldFor(), now);
        List<String> reasons = new ArrayList<>(strategies.entryRules(entry).rejections(context));
        if (sizing.isZero()) {
            reasons.add("Suggested quantity is zero (limited by " + sizing.limitedBy() + ")");
        }
        boolean shouldTrade = reasons.isEmpty();

        SpreadOpportunity opportunity = new SpreadOpportunity(
            pair.symbol(), direction, buy.exchange(), sell.exchange(), buy.ask(), sell.bid(),
            gross, totalFee, slippage, net, expectedProfit, sizing.quantity(), shouldTrade, reasons, now);

        if (shouldTrade) {
            log.info("[OPPORTUNITY] {} buy {}@{} sell {}@{} net={}% qty={} expected={}",
                pair.symbol(), buy.exchange(), buy.ask(), sell.exchange(), sell.bid(),
                net.setScale(4, RoundingMode.HALF_UP), sizing.quantity(),
                opportunity.expectedNetProfit());
        } else {
            log.debug("[OPPORTUNITY] {} rejected: {}", pair.symbol(), reasons);
        }
        return opportunity;
    }

    private OrderBook bookFor(TradingPair pair, Ticker ticker, OrderBook fetched) {
        return fetched != null ? fetched : table.orderBook(ticker.exchange(), pair.symbol()).orElse(null);
    }

    private PriceHistory history(Ticker ticker, TradingPair pair) {
        return table.history(ticker.exchange(), pair.symbol()).orElse(null);
    }

    public void resetConfirmations() {
        confirmations.clear();
    }
}
