package org.walletsync.sync;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.data.wallet.AddressData;
import org.walletsync.data.wallet.WalletData;
import org.walletsync.event.WalletLog;
import org.walletsync.event.WalletLogEvent.Category;
import org.walletsync.node.NodeClient;
import org.walletsync.node.NodeClientException;
import org.walletsync.repository.DataException;
import org.walletsync.repository.Repository;
import org.walletsync.repository.RepositoryManager;
import org.walletsync.settings.Settings;
import org.walletsync.sync.phases.CheckExistingPhase;
import org.walletsync.sync.phases.FetchHistoriesPhase;
import org.walletsync.sync.phases.FetchUtxosPhase;
import org.walletsync.sync.phases.GapLimitPhase;
import org.walletsync.sync.phases.InsertUtxosPhase;
import org.walletsync.sync.phases.ProcessTransactionsPhase;
import org.walletsync.sync.phases.ReconcileUtxosPhase;
import org.walletsync.sync.phases.UpdateAddressesPhase;
import org.walletsync.sync.phases.UpdateConfirmationsPhase;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;

/**
 * Runs an ordered list of {@link SyncPhase}s against one wallet.
 * <p>
 * Phases run strictly in the given order, one at a time. A failing phase aborts the run
 * with a {@link SyncPipelineException}; there is no retry here. Writes of completed phases
 * stand, and the next run reconciles from there.
 */
public class SyncPipeline {

    private static final Logger LOGGER = LogManager.getLogger(SyncPipeline.class);

    private final NodeClient nodeClient;
    private final ExecutorService fetchExecutor;

    public SyncPipeline(NodeClient nodeClient) {
        this(nodeClient, null);
    }

    /**
     * @param fetchExecutor runs batched node queries within a phase concurrently, or null for sequential
     */
    public SyncPipeline(NodeClient nodeClient, ExecutorService fetchExecutor) {
        this.nodeClient = nodeClient;
        this.fetchExecutor = fetchExecutor;
    }

    /** Returns the standard phase sequence of a full wallet sync. */
    public static List<SyncPhase> defaultPhases() {
        return Arrays.asList(
                new FetchHistoriesPhase(),
                new CheckExistingPhase(),
                new ProcessTransactionsPhase(),
                new FetchUtxosPhase(),
                new ReconcileUtxosPhase(),
                new InsertUtxosPhase(),
                new UpdateAddressesPhase(),
                new UpdateConfirmationsPhase(),
                new GapLimitPhase());
    }

    public SyncResult run(String walletId, List<SyncPhase> phases) throws SyncException {
        return this.run(walletId, phases, SyncOptions.defaults());
    }

    public SyncResult run(String walletId, List<SyncPhase> phases, SyncOptions options) throws SyncException {
        final long startTime = System.currentTimeMillis();

        try (final Repository repository = RepositoryManager.getRepository()) {
            WalletData wallet = repository.getWalletRepository().fromWalletId(walletId);
            if (wallet == null)
                throw new WalletNotFoundException(walletId);

            if (!this.nodeClient.getNetId().equals(wallet.getNetwork()))
                LOGGER.warn("Syncing {} wallet {} using {} node", wallet.getNetwork(), walletId, this.nodeClient.getNetId());

            int currentHeight = this.nodeClient.getCurrentHeight();

            List<AddressData> addresses = repository.getAddressRepository().getAddressesByWallet(walletId);
            if (addresses.isEmpty()) {
                LOGGER.debug("Wallet {} has no addresses, nothing to sync", walletId);
                return SyncResult.empty(walletId, System.currentTimeMillis() - startTime);
            }

            // Nothing read so far needs to stay locked
            repository.discardChanges();

            SyncContext context = new SyncContext(wallet, this.nodeClient, repository, addresses, currentHeight,
                    this.fetchExecutor, Settings.getInstance().getTransactionCacheLimit());

            WalletLog.info(walletId, Category.SYNC, String.format("Syncing %d addresses at height %d", addresses.size(), currentHeight));

            for (SyncPhase phase : phases) {
                if (!options.isSelected(phase.getName()))
                    continue;

                context = this.runPhase(phase, context);

                context.addCompletedPhase(phase.getName());

                SyncOptions.PhaseCompletionListener listener = options.getPhaseCompletionListener();
                if (listener != null) {
                    try {
                        listener.onPhaseComplete(phase.getName(), context);
                    } catch (RuntimeException e) {
                        WalletLog.error(walletId, Category.SYNC, String.format("Sync failed after %s: %s", phase.getName(), e.getMessage()));
                        throw new SyncPipelineException(phase.getName(), context.getCompletedPhases(), e);
                    }
                }
            }

            long elapsed = System.currentTimeMillis() - startTime;
            WalletLog.info(walletId, Category.SYNC, String.format(Locale.ROOT, "Sync completed in %.2fs", elapsed / 1000.0));
            LOGGER.debug("Wallet {} sync stats: {}", walletId, context.getStats());

            return SyncResult.fromContext(context, elapsed);
        } catch (DataException e) {
            throw new SyncException(String.format("Repository issue while syncing wallet %s", walletId), e);
        } catch (NodeClientException e) {
            throw new SyncException(String.format("Unable to fetch blockchain height while syncing wallet %s", walletId), e);
        }
    }

    private SyncContext runPhase(SyncPhase phase, SyncContext context) throws SyncPipelineException {
        LOGGER.trace("Wallet {}: running sync phase {}", context.getWalletId(), phase.getName());

        try {
            SyncContext nextContext = phase.execute(context);
            if (nextContext == null)
                throw new IllegalStateException(String.format("Sync phase %s returned no context", phase.getName()));

            return nextContext;
        } catch (DataException | NodeClientException | RuntimeException e) {
            try {
                context.getRepository().discardChanges();
            } catch (DataException de) {
                e.addSuppressed(de);
            }

            WalletLog.error(context.getWalletId(), Category.SYNC, String.format("Sync failed during %s: %s", phase.getName(), e.getMessage()));
            throw new SyncPipelineException(phase.getName(), context.getCompletedPhases(), e);
        }
    }
}
