package in.spreadarb.service.market;

import in.spreadarb.application.port.output.PriceOracle;
import in.spreadarb.domain.market.OrderBook;
import in.spreadarb.domain.market.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Latest ticker and order book per (exchange, pair), plus mid-price history.
 *
 * Written by the market data pollers, read by opportunity detection, the exit monitor
 * and balance valuation. Entries are immutable and replaced on every update.
 */
public final class LatestTickerTable implements PriceOracle {
    private static final Logger log = LoggerFactory.getLogger(LatestTickerTable.class);

    static final Set<String> STABLECOINS = Set.of("USDT", "USDC", "BUSD", "FDUSD", "DAI", "USD");

    private final ConcurrentHashMap<String, Entry> tickers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, OrderBook> books = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, PriceHistory> histories = new ConcurrentHashMap<>();
    private final Duration historyRetention;

    public LatestTickerTable() {
        this(Duration.ofMinutes(60));
    }

    public LatestTickerTable(Duration historyRetention) {
        this.historyRetention = historyRetention;
    }

    public void update(String pairSymbol, Ticker ticker) {
        String key = key(ticker.exchange(), pairSymbol);
        tickers.put(key, new Entry(pairSymbol, ticker));
        if (ticker.hasPositivePrices()) {
            histories.computeIfAbsent(key, k -> new PriceHistory(historyRetention, 10_000))
                .add(ticker.timestamp(), ticker.mid());
        }
        log.trace("Updated ticker: {} = {}/{} @ {}", key, ticker.bid(), ticker.ask(), ticker.timestamp());
    }

    public void updateOrderBook(String pairSymbol, OrderBook book) {
        books.put(key(book.exchange(), pairSymbol), book);
    }

    public Optional<Ticker> latest(String exchange, String pairSymbol) {
        Entry entry = tickers.get(key(exchange, pairSymbol));
        return entry == null ? Optional.empty() : Optional.of(entry.ticker());
    }

    public Optional<OrderBook> orderBook(String exchange, String pairSymbol) {
        return Optional.ofNullable(books.get(key(exchange, pairSymbol)));
    }

    public Optional<PriceHistory> history(String exchange, String pairSymbol) {
        return Optional.ofNullable(histories.get(key(exchange, pairSymbol)));
    }

    /**
     * Drop everything known about a pair.
     */
    public void remove(String pairSymbol) {
        String suffix = "|" + pairSymbol;
        tickers.keySet().removeIf(k -> k.endsWith(suffix));
        books.keySet().removeIf(k -> k.endsWith(suffix));
        histories.keySet().removeIf(k -> k.endsWith(suffix));
    }

    public Map<String, Ticker> snapshot() {
        return tickers.entrySet().stream()
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> e.getValue().ticker()));
    }

    public void clear() {
        tickers.clear();
        books.clear();
        histories.clear();
        log.info("Ticker table cleared");
    }

    /**
     * Stablecoins are valued at 1 against each other. Other assets use the average mid of
     * every exchange quoting ASSET/QUOTE, or the inverse of QUOTE/ASSET.
     */
    @Override
    public Optional<BigDecimal> priceIn(String asset, String quoteCurrency) {
        if (asset.equals(quoteCurrency)) {
            return Optional.of(BigDecimal.ONE);
        }
        if (STABLECOINS.contains(asset) && STABLECOINS.contains(quoteCurrency)) {
            return Optional.of(BigDecimal.ONE);
        }
        Optional<BigDecimal> direct = averageMid(asset + "/" + quoteCurrency);
        if (direct.isPresent()) {
            return direct;
        }
        Optional<BigDecimal> inverse = averageMid(quoteCurrency + "/" + asset);
        if (inverse.isPresent() && inverse.get().signum() > 0) {
            return Optional.of(BigDecimal.ONE.divide(inverse.get(), 12, RoundingMode.HALF_UP));
        }
        if (STABLECOINS.contains(quoteCurrency)) {
            for (String stable : STABLECOINS) {
                Optional<BigDecimal> viaStable = averageMid(asset + "/" + stable);
                if (viaStable.isPresent()) {
                    return viaStable;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<BigDecimal> averageMid(String pairSymbol) {
        List<BigDecimal> mids = tickers.values().stream()
            .filter(e -> e.pairSymbol().equals(pairSymbol) && e.ticker().hasPositivePrices())
            .map(e -> e.ticker().mid())
            .collect(Collectors.toList());
        if (mids.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal sum = mids.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return Optional.of(sum.divide(BigDecimal.valueOf(mids.size()), 12, RoundingMode.HALF_UP));
    }

    private static String key(String exchange, String pairSymbol) {
        return exchange + "|" + pairSymbol;
    }

    private record Entry(String pairSymbol, Ticker ticker) {}
}
