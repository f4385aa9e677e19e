package in.spreadarb.application.port.output;

import in.spreadarb.domain.strategy.TradingStrategy;

import java.util.List;
import java.util.Optional;

/**
 * Read access to saved strategies.
 */
public interface StrategyStore {

    Optional<TradingStrategy> find(String strategyId);

    List<TradingStrategy> findAll();
}
