package in.spreadarb.service.balance;

import in.spreadarb.application.port.input.EngineEventListener;
import in.spreadarb.config.BalanceSettings;
import in.spreadarb.config.EmergencySettings;
import in.spreadarb.domain.balance.CombinedBalanceSnapshot;
import in.spreadarb.domain.emergency.EmergencyAction;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.emergency.EmergencyTriggerReason;
import in.spreadarb.domain.strategy.RiskRules;
import in.spreadarb.infrastructure.exchange.ExchangeClientRegistry;
import in.spreadarb.infrastructure.exchange.SimulatedExchangeClient;
import in.spreadarb.service.core.EngineEventBus;
import in.spreadarb.service.emergency.EmergencyGuard;
import in.spreadarb.support.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class BalancePoolTest {

    // 2 x (100000 USDT + 100 BTC at 100)
    private static final BigDecimal STARTING_EQUITY = new BigDecimal("220000");

    private SimulatedExchangeClient exchangeA;
    private BalancePool pool;
    private final List<EmergencyCheck> emergencies = new CopyOnWriteArrayList<>();
    private final List<CombinedBalanceSnapshot> published = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        exchangeA = Fixtures.exchange(Fixtures.EXCHANGE_A, "99.95", "100.05");
        SimulatedExchangeClient exchangeB = Fixtures.exchange(Fixtures.EXCHANGE_B, "99.95", "100.05");
        ExchangeClientRegistry clients = new ExchangeClientRegistry().register(exchangeA).register(exchangeB);

        EngineEventBus events = EngineEventBus.direct();
        events.addListener(new EngineEventListener() {
            @Override
            public void onBalanceUpdated(CombinedBalanceSnapshot snapshot) {
                published.add(snapshot);
            }
        });

        pool = new BalancePool(clients,
            (asset, quote) -> Optional.of("BTC".equals(asset) ? new BigDecimal("100") : BigDecimal.ONE),
            events,
            new EmergencyGuard(EmergencySettings::defaults),
            () -> Set.of(Fixtures.EXCHANGE_A, Fixtures.EXCHANGE_B),
            () -> Set.of("BTC", "USDT"),
            RiskRules::defaults,
            BalanceSettings::defaults,
            Clock.systemUTC());
        pool.onEmergency(emergencies::add);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    @DisplayName("Initialization values every account and sets the starting equity")
    void initialize() {
        CombinedBalanceSnapshot snapshot = pool.initialize().join();

        assertEquals(0, snapshot.totalEquity().compareTo(STARTING_EQUITY));
        assertEquals(0, snapshot.peakEquity().compareTo(STARTING_EQUITY));
        assertEquals(0, snapshot.drawdownPercent().signum());
        assertEquals(2, snapshot.accounts().size());
        assertEquals(0, snapshot.assets().get("BTC").total().compareTo(new BigDecimal("200")));
        assertSame(snapshot, pool.currentSnapshot());
        assertFalse(published.isEmpty());
        assertFalse(pool.calculateRebalance().needsRebalance());
    }

    @Test
    @DisplayName("An unreachable exchange fails initialization")
    void initializeNeedsEveryExchange() {
        exchangeA.setConnected(false);

        assertThrows(CompletionException.class, () -> pool.initialize().join());
    }

    @Test
    @DisplayName("Recorded P&L moves equity before the next fetch")
    void realizedPnlApplied() {
        pool.initialize().join();

        CombinedBalanceSnapshot snapshot = pool.recordTrade(Fixtures.trade("50", Instant.now())).join();

        assertEquals(0, snapshot.totalEquity().compareTo(new BigDecimal("220050")));
        assertEquals(0, pool.realizedPnl().compareTo(new BigDecimal("50")));
        assertEquals(0, pool.pnl().peakEquity().compareTo(new BigDecimal("220050")));
    }

    @Test
    @DisplayName("Losses open a drawdown and track the maximum")
    void drawdown() {
        pool.initialize().join();

        pool.recordTrade(Fixtures.trade("-2200", Instant.now())).join();

        assertEquals(0, pool.currentDrawdown().compareTo(BigDecimal.ONE), "2200 of 220000 is 1%");
        assertEquals(0, pool.maxDrawdown().compareTo(BigDecimal.ONE));
    }

    @Test
    @DisplayName("Drawdown at the limit fires STOP_TRADING")
    void drawdownStops() {
        pool.initialize().join();

        pool.recordTrade(Fixtures.trade("-11000", Instant.now())).join();

        assertEquals(1, emergencies.size());
        assertEquals(EmergencyTriggerReason.MAX_DRAWDOWN_EXCEEDED, emergencies.get(0).reason());
        assertEquals(EmergencyAction.STOP_TRADING, emergencies.get(0).action());
    }

    @Test
    @DisplayName("A loss streak fires once until acknowledged")
    void lossStreakFiresOnce() {
        pool.initialize().join();

        for (int i = 0; i < 4; i++) {
            pool.recordTrade(Fixtures.trade("-1", Instant.now())).join();
        }

        assertEquals(1, emergencies.size(), "Fourth loss must not re-fire the same rule");
        assertEquals(EmergencyTriggerReason.CONSECUTIVE_LOSSES, emergencies.get(0).reason());
        assertTrue(pool.checkEmergency().isPresent());

        pool.acknowledgeLossStreak();
        pool.recordTrade(Fixtures.trade("-1", Instant.now().plusSeconds(1))).join();

        assertEquals(1, emergencies.size());
        assertTrue(pool.checkEmergency().isEmpty(), "Losses before the acknowledgement no longer count");
    }

    @Test
    @DisplayName("A check the handler could not act on is offered again")
    void declinedCheckOfferedAgain() {
        AtomicBoolean accept = new AtomicBoolean(false);
        List<EmergencyCheck> offered = new CopyOnWriteArrayList<>();
        pool.onEmergency(check -> {
            offered.add(check);
            return accept.get();
        });
        pool.initialize().join();
        for (int i = 0; i < 3; i++) {
            pool.recordTrade(Fixtures.trade("-1", Instant.now())).join();
        }
        assertEquals(1, offered.size());

        accept.set(true);
        Optional<EmergencyCheck> again = pool.reevaluateEmergency().join();

        assertTrue(again.isPresent());
        assertEquals(2, offered.size(), "Declined reason is raised again");
        assertEquals(EmergencyTriggerReason.CONSECUTIVE_LOSSES, offered.get(1).reason());

        pool.reevaluateEmergency().join();
        assertEquals(2, offered.size(), "Handled reason is not raised twice");
    }

    @Test
    @DisplayName("Snapshot history is newest first")
    void history() {
        pool.initialize().join();
        pool.recordTrade(Fixtures.trade("1", Instant.now())).join();

        List<CombinedBalanceSnapshot> history = pool.history(10);

        assertEquals(2, history.size());
        assertEquals(0, history.get(0).realizedPnl().compareTo(BigDecimal.ONE));
    }
}
