package in.spreadarb.service.market;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;

/**
 * Bounded mid-price history for one exchange and pair.
 * Points older than the retention window are evicted on insert.
 */
public final class PriceHistory {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Duration retention;
    private final int maxPoints;
    private final Deque<PricePoint> points = new ArrayDeque<>();

    public PriceHistory(Duration retention, int maxPoints) {
        this.retention = retention;
        this.maxPoints = maxPoints;
    }

    public synchronized void add(Instant at, BigDecimal price) {
        points.addLast(new PricePoint(at, price));
        Instant cutoff = at.minus(retention);
        while (!points.isEmpty() && (points.peekFirst().at().isBefore(cutoff) || points.size() > maxPoints)) {
            points.removeFirst();
        }
    }

    public synchronized int size() {
        return points.size();
    }

    /**
     * Percent change from the oldest point inside {@code window} to the latest point.
     * Empty with fewer than two points in the window.
     */
    public synchronized Optional<BigDecimal> changePercent(Duration window, Instant now) {
        Instant from = now.minus(window);
        PricePoint first = null;
        for (PricePoint point : points) {
            if (!point.at().isBefore(from)) {
                first = point;
                break;
            }
        }
        PricePoint last = points.peekLast();
        if (first == null || last == null || first == last || first.price().signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(last.price().subtract(first.price())
            .multiply(HUNDRED)
            .divide(first.price(), 10, RoundingMode.HALF_UP));
    }

    /**
     * (max - min) / min over {@code window}, in percent.
     */
    public synchronized Optional<BigDecimal> rangePercent(Duration window, Instant now) {
        Instant from = now.minus(window);
        BigDecimal min = null;
        BigDecimal max = null;
        int count = 0;
        Iterator<PricePoint> it = points.descendingIterator();
        while (it.hasNext()) {
            PricePoint point = it.next();
            if (point.at().isBefore(from)) break;
            min = min == null ? point.price() : min.min(point.price());
            max = max == null ? point.price() : max.max(point.price());
            count++;
        }
        if (count < 2 || min.signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(max.subtract(min).multiply(HUNDRED).divide(min, 10, RoundingMode.HALF_UP));
    }

    public record PricePoint(Instant at, BigDecimal price) {}
}
