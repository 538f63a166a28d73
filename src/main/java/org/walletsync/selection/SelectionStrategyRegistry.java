package org.walletsync.selection;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.selection.strategies.EfficiencyStrategy;
import org.walletsync.selection.strategies.LargestFirstStrategy;
import org.walletsync.selection.strategies.OldestFirstStrategy;
import org.walletsync.selection.strategies.PrivacyStrategy;
import org.walletsync.selection.strategies.SmallestFirstStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Selection strategies by id.
 * <p>
 * Selecting with an unknown strategy id falls back to {@link EfficiencyStrategy}.
 */
public class SelectionStrategyRegistry {

    private static final Logger LOGGER = LogManager.getLogger(SelectionStrategyRegistry.class);

    public static final String FALLBACK_STRATEGY_ID = EfficiencyStrategy.ID;

    // Registration order is kept for listing
    private final Map<String, SelectionStrategy> strategies = new ConcurrentHashMap<>();
    private final List<String> registrationOrder = new ArrayList<>();

    /** Returns registry holding the built-in strategies. */
    public static SelectionStrategyRegistry createDefault() {
        SelectionStrategyRegistry registry = new SelectionStrategyRegistry();

        registry.register(new PrivacyStrategy());
        registry.register(new EfficiencyStrategy());
        registry.register(new OldestFirstStrategy());
        registry.register(new LargestFirstStrategy());
        registry.register(new SmallestFirstStrategy());

        return registry;
    }

    /**
     * Registers strategy.
     *
     * @throws IllegalArgumentException if a strategy with the same id is already registered
     */
    public synchronized void register(SelectionStrategy strategy) {
        if (this.strategies.putIfAbsent(strategy.getId(), strategy) != null)
            throw new IllegalArgumentException(String.format("Selection strategy \"%s\" already registered", strategy.getId()));

        this.registrationOrder.add(strategy.getId());
    }

    public Optional<SelectionStrategy> get(String strategyId) {
        if (strategyId == null)
            return Optional.empty();

        return Optional.ofNullable(this.strategies.get(strategyId));
    }

    public boolean has(String strategyId) {
        return get(strategyId).isPresent();
    }

    public synchronized List<SelectionStrategy> getAll() {
        return this.registrationOrder.stream().map(this.strategies::get).collect(Collectors.toList());
    }

    public List<SelectionStrategy> getByTag(String tag) {
        return getAll().stream().filter(strategy -> strategy.getTags().contains(tag)).collect(Collectors.toList());
    }

    /**
     * Runs strategy with given id, or the fallback strategy if there's no such strategy.
     *
     * @throws StrategyNotFoundException if neither strategy is registered
     */
    public SelectionResult select(String strategyId, SelectionContext context) {
        SelectionStrategy strategy = get(strategyId).orElse(null);

        if (strategy == null) {
            LOGGER.warn("Unknown selection strategy \"{}\", falling back to \"{}\"", strategyId, FALLBACK_STRATEGY_ID);

            strategy = get(FALLBACK_STRATEGY_ID).orElseThrow(() -> new StrategyNotFoundException(strategyId));
        }

        return strategy.select(context);
    }

}
