package org.walletsync.sync.phases;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.address.AddressDeriverFactory;
import org.walletsync.address.AddressDiscovery;
import org.walletsync.address.DescriptorAddressDeriver;
import org.walletsync.data.wallet.AddressData;
import org.walletsync.event.WalletLog;
import org.walletsync.event.WalletLogEvent.Category;
import org.walletsync.node.HistoryEntry;
import org.walletsync.node.NodeClient;
import org.walletsync.node.NodeClientException;
import org.walletsync.repository.DataException;
import org.walletsync.repository.Repository;
import org.walletsync.settings.Settings;
import org.walletsync.sync.BatchFetcher;
import org.walletsync.sync.SyncContext;
import org.walletsync.sync.SyncPhase;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Extends the wallet's addresses up to the gap limit, then probes the new ones for activity.
 * <p>
 * Activity on a new address means the wallet was used beyond what this run scanned,
 * so the run is flagged for a follow-up sync. A failed probe is only logged:
 * the addresses stay stored and get scanned next time.
 */
public class GapLimitPhase implements SyncPhase {

    private static final Logger LOGGER = LogManager.getLogger(GapLimitPhase.class);

    public static final String NAME = "gapLimit";

    private final AddressDiscovery addressDiscovery;
    private final int batchSize;

    public GapLimitPhase() {
        this(Settings.getInstance().getGapLimit(), DescriptorAddressDeriver::forWallet);
    }

    public GapLimitPhase(int gapLimit, AddressDeriverFactory deriverFactory) {
        this.addressDiscovery = new AddressDiscovery(gapLimit, deriverFactory);
        this.batchSize = Settings.getInstance().getSyncBatchSize();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SyncContext execute(SyncContext context) throws DataException {
        Repository repository = context.getRepository();
        String walletId = context.getWalletId();

        List<AddressData> generated = this.addressDiscovery.ensureGapLimit(repository, context.getWallet());
        repository.saveChanges();

        context.setNewAddresses(generated);
        context.getStats().setNewAddressesGenerated(generated.size());

        if (generated.isEmpty())
            return context;

        List<String> newAddresses = generated.stream().map(AddressData::getAddress).collect(Collectors.toList());
        NodeClient nodeClient = context.getNodeClient();

        try {
            BatchFetcher fetcher = new BatchFetcher("history", this.batchSize, context.getFetchExecutor());
            BatchFetcher.Outcome<List<HistoryEntry>> outcome = fetcher.fetch(newAddresses,
                    nodeClient::getAddressHistoryBatch, nodeClient::getAddressHistory);

            if (!outcome.getFailed().isEmpty())
                WalletLog.warn(walletId, Category.BLOCKCHAIN, String.format("Unable to scan %d new addresses, will retry next sync", outcome.getFailed().size()));

            boolean hasActivity = outcome.getResults().values().stream().anyMatch(history -> !history.isEmpty());

            if (hasActivity) {
                context.setResyncRequired(true);
                WalletLog.info(walletId, Category.BLOCKCHAIN, "Found transactions on new addresses, re-syncing...");
            } else {
                WalletLog.info(walletId, Category.BLOCKCHAIN, String.format("Scanning %d newly generated addresses", newAddresses.size()));
            }
        } catch (NodeClientException | RuntimeException e) {
            // Addresses are already stored, so they'll be scanned next time
            LOGGER.warn(String.format("Wallet %s: unable to scan new addresses: %s", walletId, e.getMessage()), e);
            WalletLog.warn(walletId, Category.BLOCKCHAIN, String.format("Unable to scan %d new addresses, will retry next sync", newAddresses.size()));
        }

        return context;
    }
}
