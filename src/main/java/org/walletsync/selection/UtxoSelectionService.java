package org.walletsync.selection;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.data.wallet.UtxoData;
import org.walletsync.repository.DataException;
import org.walletsync.repository.Repository;
import org.walletsync.selection.strategies.EfficiencyStrategy;
import org.walletsync.selection.strategies.PrivacyStrategy;
import org.walletsync.selection.strategies.SmallestFirstStrategy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Coin selection over a wallet's stored UTXOs.
 */
public class UtxoSelectionService {

    private static final Logger LOGGER = LogManager.getLogger(UtxoSelectionService.class);

    private static final double HIGH_FEE_RATE = 50.0;
    private static final double LOW_FEE_RATE = 5.0;
    private static final int CONSOLIDATION_UTXO_COUNT = 20;

    public static class Recommendation {
        private final String strategyId;
        private final String reason;

        public Recommendation(String strategyId, String reason) {
            this.strategyId = strategyId;
            this.reason = reason;
        }

        public String getStrategyId() {
            return this.strategyId;
        }

        public String getReason() {
            return this.reason;
        }
    }

    private final SelectionStrategyRegistry registry;

    public UtxoSelectionService(SelectionStrategyRegistry registry) {
        this.registry = registry;
    }

    public UtxoSelectionService() {
        this(SelectionStrategyRegistry.createDefault());
    }

    public SelectionStrategyRegistry getRegistry() {
        return this.registry;
    }

    /**
     * Returns wallet's spendable UTXOs, largest first.
     * <p>
     * Spent UTXOs and those locked by a draft transaction are never returned.
     */
    public List<UtxoData> getAvailableUtxos(Repository repository, String walletId, SelectionOptions options) throws DataException {
        Set<String> lockedKeys = repository.getDraftRepository().getLockedUtxoKeys(walletId);

        List<UtxoData> available = new ArrayList<>();
        for (UtxoData utxo : repository.getUtxoRepository().getUnspentUtxos(walletId)) {
            if (utxo.isFrozen() && !options.isIncludeFrozen())
                continue;

            if (options.isExcludeUnconfirmed() && utxo.getConfirmations() <= 0)
                continue;

            if (lockedKeys.contains(utxo.getKey()) || options.getExcludedUtxoKeys().contains(utxo.getKey()))
                continue;

            available.add(utxo);
        }

        available.sort((a, b) -> Long.compare(b.getAmount(), a.getAmount()));

        return available;
    }

    public SelectionResult selectUtxos(Repository repository, String walletId, String strategyId, long targetAmount,
            double feeRate, ScriptType scriptType, SelectionOptions options) throws DataException {
        LOGGER.debug("Selecting UTXOs for wallet {}: target {}, fee rate {}, strategy {}", walletId, targetAmount, feeRate, strategyId);

        List<UtxoData> available = getAvailableUtxos(repository, walletId, options);

        return this.registry.select(strategyId, new SelectionContext(available, targetAmount, feeRate, scriptType));
    }

    /** Returns result of every registered strategy over the same candidates, keyed by strategy id. */
    public Map<String, SelectionResult> compareStrategies(Repository repository, String walletId, long targetAmount,
            double feeRate, ScriptType scriptType) throws DataException {
        List<UtxoData> available = getAvailableUtxos(repository, walletId, SelectionOptions.defaults());
        SelectionContext context = new SelectionContext(available, targetAmount, feeRate, scriptType);

        Map<String, SelectionResult> results = new LinkedHashMap<>();
        for (SelectionStrategy strategy : this.registry.getAll())
            results.put(strategy.getId(), strategy.select(context));

        return results;
    }

    public static Recommendation getRecommendedStrategy(int utxoCount, double feeRate, boolean prioritizePrivacy) {
        if (prioritizePrivacy)
            return new Recommendation(PrivacyStrategy.ID, "Minimizes address linkage for better privacy");

        if (feeRate > HIGH_FEE_RATE)
            return new Recommendation(EfficiencyStrategy.ID, "High fee environment, minimizing input count saves fees");

        if (feeRate < LOW_FEE_RATE && utxoCount > CONSOLIDATION_UTXO_COUNT)
            return new Recommendation(SmallestFirstStrategy.ID, "Low fee environment, good time to consolidate small UTXOs");

        return new Recommendation(EfficiencyStrategy.ID, "Minimizes transaction fees");
    }

}
