package org.walletsync.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.node.NodeClient;
import org.walletsync.node.NodeClientException;
import org.walletsync.settings.Settings;
import org.walletsync.sync.SyncException;
import org.walletsync.sync.SyncPhase;
import org.walletsync.sync.SyncPipeline;
import org.walletsync.sync.SyncResult;
import org.walletsync.utils.NamedThreadFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs wallet syncs in the background.
 * <p>
 * Different wallets sync concurrently, up to <tt>syncThreadCount</tt> at a time.
 * Requests for a wallet that is already syncing share the running sync.
 */
public class WalletSyncManager {

    private static final Logger LOGGER = LogManager.getLogger(WalletSyncManager.class);

    private final NodeClient nodeClient;
    private final SyncPipeline syncPipeline;
    private final Supplier<List<SyncPhase>> phasesSupplier;

    private final ExecutorService syncExecutor;
    private final ExecutorService fetchExecutor;

    /** Syncs in progress, by wallet ID */
    private final Map<String, CompletableFuture<SyncResult>> inFlight = new ConcurrentHashMap<>();

    private volatile boolean isStopping = false;

    public WalletSyncManager(NodeClient nodeClient) {
        this(nodeClient, SyncPipeline::defaultPhases);
    }

    /**
     * @param phasesSupplier builds phases for each run, as phases may hold per-run settings
     */
    public WalletSyncManager(NodeClient nodeClient, Supplier<List<SyncPhase>> phasesSupplier) {
        Settings settings = Settings.getInstance();

        this.nodeClient = nodeClient;
        this.phasesSupplier = phasesSupplier;

        this.syncExecutor = Executors.newFixedThreadPool(settings.getSyncThreadCount(),
                new NamedThreadFactory("WalletSync", Thread.NORM_PRIORITY));
        this.fetchExecutor = Executors.newFixedThreadPool(settings.getFetchThreadCount(),
                new NamedThreadFactory("WalletSync-fetch", Thread.NORM_PRIORITY, true));

        this.syncPipeline = new SyncPipeline(nodeClient, this.fetchExecutor);
    }

    /**
     * Requests background sync of wallet.
     * <p>
     * If wallet is already syncing, returns the future of that sync.
     * The returned future fails with {@link SyncException} if the sync fails.
     *
     * @throws NodeClientException.NetworkException if node isn't available
     */
    public CompletableFuture<SyncResult> requestSync(String walletId) throws NodeClientException {
        if (this.isStopping)
            throw new IllegalStateException("Wallet sync manager is shutting down");

        CompletableFuture<SyncResult> existing = this.inFlight.get(walletId);
        if (existing != null) {
            LOGGER.debug("Wallet {} is already syncing", walletId);
            return existing;
        }

        if (!this.nodeClient.isAvailable())
            throw new NodeClientException.NetworkException(String.format("%s node unavailable, can't sync wallet %s",
                    this.nodeClient.getNetId(), walletId));

        CompletableFuture<SyncResult> future = new CompletableFuture<>();

        existing = this.inFlight.putIfAbsent(walletId, future);
        if (existing != null)
            return existing;

        try {
            this.syncExecutor.execute(() -> this.runSync(walletId, future));
        } catch (RejectedExecutionException e) {
            this.inFlight.remove(walletId, future);
            future.completeExceptionally(e);
        }

        return future;
    }

    public boolean isSyncing(String walletId) {
        return this.inFlight.containsKey(walletId);
    }

    private void runSync(String walletId, CompletableFuture<SyncResult> future) {
        try {
            SyncResult result = this.syncWallet(walletId);
            this.inFlight.remove(walletId, future);
            future.complete(result);
        } catch (SyncException | RuntimeException e) {
            LOGGER.warn(String.format("Wallet %s sync failed: %s", walletId, e.getMessage()));
            this.inFlight.remove(walletId, future);
            future.completeExceptionally(e);
        }
    }

    /**
     * Syncs wallet on the calling thread.
     * <p>
     * If the sync found activity on newly generated addresses, one more sync is run
     * and its result returned.
     */
    public SyncResult syncWallet(String walletId) throws SyncException {
        SyncResult result = this.syncPipeline.run(walletId, this.phasesSupplier.get());

        if (result.isResyncRequired() && !this.isStopping) {
            LOGGER.debug("Wallet {} needs another sync after address discovery", walletId);
            result = this.syncPipeline.run(walletId, this.phasesSupplier.get());
        }

        return result;
    }

    public void shutdown() {
        this.isStopping = true;

        LOGGER.info("Shutting down wallet sync executors");
        this.syncExecutor.shutdownNow();
        this.fetchExecutor.shutdownNow();

        try {
            if (!this.syncExecutor.awaitTermination(5, TimeUnit.SECONDS))
                LOGGER.warn("Wallet sync executor did not terminate in time");

            if (!this.fetchExecutor.awaitTermination(5, TimeUnit.SECONDS))
                LOGGER.warn("Wallet sync fetch executor did not terminate in time");
        } catch (InterruptedException e) {
            LOGGER.warn("Interrupted while waiting for wallet sync executors to terminate", e);
            Thread.currentThread().interrupt();
        }

        for (CompletableFuture<SyncResult> future : this.inFlight.values())
            future.cancel(true);
        this.inFlight.clear();
    }

}
