package org.walletsync.sync.phases;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.event.WalletLog;
import org.walletsync.event.WalletLogEvent.Category;
import org.walletsync.node.NodeClient;
import org.walletsync.node.NodeClientException;
import org.walletsync.node.UnspentOutput;
import org.walletsync.settings.Settings;
import org.walletsync.sync.BatchFetcher;
import org.walletsync.sync.SyncContext;
import org.walletsync.sync.SyncPhase;

import java.util.List;
import java.util.Map;

/**
 * Fetches the chain's current unspent outputs for every wallet address.
 * <p>
 * Only addresses whose query succeeded end up in {@link SyncContext#getSuccessfullyFetchedAddresses()},
 * whether or not they have any UTXOs. Reconciliation relies on that distinction.
 */
public class FetchUtxosPhase implements SyncPhase {

    private static final Logger LOGGER = LogManager.getLogger(FetchUtxosPhase.class);

    public static final String NAME = "fetchUtxos";

    private final int batchSize;

    public FetchUtxosPhase() {
        this(Settings.getInstance().getSyncBatchSize());
    }

    public FetchUtxosPhase(int batchSize) {
        this.batchSize = batchSize;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SyncContext execute(SyncContext context) throws NodeClientException {
        NodeClient nodeClient = context.getNodeClient();
        List<String> addresses = context.getAddressStrings();

        LOGGER.debug("Fetching UTXOs for {} addresses", addresses.size());

        BatchFetcher fetcher = new BatchFetcher("UTXOs", this.batchSize, context.getFetchExecutor());
        BatchFetcher.Outcome<List<UnspentOutput>> outcome = fetcher.fetch(addresses,
                nodeClient::getAddressUtxosBatch, nodeClient::getAddressUtxos);

        int utxosFetched = 0;

        for (Map.Entry<String, List<UnspentOutput>> entry : outcome.getResults().entrySet()) {
            String address = entry.getKey();
            List<UnspentOutput> utxos = entry.getValue();

            context.getUtxoMap().put(address, utxos);

            for (UnspentOutput utxo : utxos) {
                String key = utxo.getKey();
                context.getUtxoDataMap().put(key, new SyncContext.ObservedUtxo(address, utxo));
                context.getAllUtxoKeys().add(key);
                ++utxosFetched;
            }
        }

        context.getSuccessfullyFetchedAddresses().addAll(outcome.getSucceeded());

        if (!outcome.getFailed().isEmpty())
            WalletLog.warn(context.getWalletId(), Category.UTXO,
                    String.format("Unable to fetch UTXOs for %d address(es), leaving their UTXOs untouched", outcome.getFailed().size()));

        context.getStats().setUtxosFetched(utxosFetched);

        return context;
    }
}
