package org.walletsync.sync.phases;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.event.WalletLog;
import org.walletsync.event.WalletLogEvent.Category;
import org.walletsync.node.HistoryEntry;
import org.walletsync.node.NodeClient;
import org.walletsync.node.NodeClientException;
import org.walletsync.settings.Settings;
import org.walletsync.sync.BatchFetcher;
import org.walletsync.sync.SyncContext;
import org.walletsync.sync.SyncPhase;

import java.util.Collections;
import java.util.List;

/**
 * Fetches transaction history of every wallet address.
 * <p>
 * An address whose history can't be fetched is recorded with an empty history,
 * so later phases see it as known but inactive.
 */
public class FetchHistoriesPhase implements SyncPhase {

    private static final Logger LOGGER = LogManager.getLogger(FetchHistoriesPhase.class);

    public static final String NAME = "fetchHistories";

    private final int batchSize;

    public FetchHistoriesPhase() {
        this(Settings.getInstance().getSyncBatchSize());
    }

    public FetchHistoriesPhase(int batchSize) {
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

        LOGGER.debug("Fetching history for {} addresses", addresses.size());

        BatchFetcher fetcher = new BatchFetcher("history", this.batchSize, context.getFetchExecutor());
        BatchFetcher.Outcome<List<HistoryEntry>> outcome = fetcher.fetch(addresses,
                nodeClient::getAddressHistoryBatch, nodeClient::getAddressHistory);

        int addressesWithActivity = 0;

        for (String address : addresses) {
            List<HistoryEntry> history = outcome.getResults().getOrDefault(address, Collections.emptyList());
            context.getHistoryMap().put(address, history);

            if (history.isEmpty())
                continue;

            ++addressesWithActivity;

            for (HistoryEntry entry : history) {
                context.getAllTxids().add(entry.getTxHash());
                context.getTxHeightMap().put(entry.getTxHash(), entry.getHeight());
            }
        }

        if (!outcome.getFailed().isEmpty())
            WalletLog.warn(context.getWalletId(), Category.BLOCKCHAIN,
                    String.format("Unable to fetch history for %d address(es), treating them as inactive", outcome.getFailed().size()));

        context.getStats().setHistoriesFetched(context.getHistoryMap().size());
        context.getStats().setAddressesWithActivity(addressesWithActivity);

        LOGGER.debug("Found {} transactions across {} active addresses", context.getAllTxids().size(), addressesWithActivity);

        return context;
    }
}
