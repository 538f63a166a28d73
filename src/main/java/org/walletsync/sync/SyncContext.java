package org.walletsync.sync;

import org.walletsync.data.wallet.AddressData;
import org.walletsync.data.wallet.WalletData;
import org.walletsync.node.HistoryEntry;
import org.walletsync.node.NodeClient;
import org.walletsync.node.UnspentOutput;
import org.walletsync.repository.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Accumulated state of one wallet sync run, threaded through every {@link SyncPhase}.
 * <p>
 * Created at run start and discarded at run end. Never persisted, never shared between wallets.
 */
public class SyncContext {

    /** A UTXO seen on chain during this run, with the wallet address it pays. */
    public static class ObservedUtxo {
        private final String address;
        private final UnspentOutput output;

        public ObservedUtxo(String address, UnspentOutput output) {
            this.address = address;
            this.output = output;
        }

        public String getAddress() {
            return this.address;
        }

        public UnspentOutput getOutput() {
            return this.output;
        }
    }

    private final WalletData wallet;
    private final NodeClient nodeClient;
    private final Repository repository;
    private final List<AddressData> addresses;
    private final int currentHeight;
    /** Runs batched node queries concurrently, or null for sequential */
    private final ExecutorService fetchExecutor;

    private final Map<String, List<HistoryEntry>> historyMap = new LinkedHashMap<>();
    private final Set<String> allTxids = new LinkedHashSet<>();
    private final Map<String, Integer> txHeightMap = new HashMap<>();
    private Set<String> newTxids = new LinkedHashSet<>();

    private final Map<String, List<UnspentOutput>> utxoMap = new LinkedHashMap<>();
    private final Map<String, ObservedUtxo> utxoDataMap = new LinkedHashMap<>();
    private final Set<String> allUtxoKeys = new LinkedHashSet<>();
    private final Set<String> successfullyFetchedAddresses = new HashSet<>();

    private List<AddressData> newAddresses = new ArrayList<>();
    private boolean resyncRequired;

    private final TransactionCache transactionCache;
    private final SyncStats stats = new SyncStats();
    private final List<String> completedPhases = new ArrayList<>();

    public SyncContext(WalletData wallet, NodeClient nodeClient, Repository repository, List<AddressData> addresses,
            int currentHeight, ExecutorService fetchExecutor, int transactionCacheLimit) {
        this.wallet = wallet;
        this.nodeClient = nodeClient;
        this.repository = repository;
        this.addresses = addresses;
        this.currentHeight = currentHeight;
        this.fetchExecutor = fetchExecutor;
        this.transactionCache = new TransactionCache(transactionCacheLimit);
    }

    public String getWalletId() {
        return this.wallet.getWalletId();
    }

    public WalletData getWallet() {
        return this.wallet;
    }

    public String getNetwork() {
        return this.wallet.getNetwork();
    }

    public NodeClient getNodeClient() {
        return this.nodeClient;
    }

    public Repository getRepository() {
        return this.repository;
    }

    public List<AddressData> getAddresses() {
        return this.addresses;
    }

    /** Returns wallet's address strings, in derivation order. */
    public List<String> getAddressStrings() {
        return this.addresses.stream().map(AddressData::getAddress).collect(Collectors.toList());
    }

    /** Returns all wallet addresses known to this run, including ones generated during it. */
    public Set<String> getWalletAddressSet() {
        Set<String> walletAddresses = new HashSet<>(this.getAddressStrings());
        for (AddressData newAddress : this.newAddresses)
            walletAddresses.add(newAddress.getAddress());

        return walletAddresses;
    }

    public int getCurrentHeight() {
        return this.currentHeight;
    }

    public ExecutorService getFetchExecutor() {
        return this.fetchExecutor;
    }

    public Map<String, List<HistoryEntry>> getHistoryMap() {
        return this.historyMap;
    }

    public Set<String> getAllTxids() {
        return this.allTxids;
    }

    public Map<String, Integer> getTxHeightMap() {
        return this.txHeightMap;
    }

    public Set<String> getNewTxids() {
        return this.newTxids;
    }

    public void setNewTxids(Set<String> newTxids) {
        this.newTxids = newTxids;
    }

    public Map<String, List<UnspentOutput>> getUtxoMap() {
        return this.utxoMap;
    }

    public Map<String, ObservedUtxo> getUtxoDataMap() {
        return this.utxoDataMap;
    }

    public Set<String> getAllUtxoKeys() {
        return this.allUtxoKeys;
    }

    public Set<String> getSuccessfullyFetchedAddresses() {
        return this.successfullyFetchedAddresses;
    }

    public List<AddressData> getNewAddresses() {
        return this.newAddresses;
    }

    public void setNewAddresses(List<AddressData> newAddresses) {
        this.newAddresses = newAddresses;
    }

    public boolean isResyncRequired() {
        return this.resyncRequired;
    }

    public void setResyncRequired(boolean resyncRequired) {
        this.resyncRequired = resyncRequired;
    }

    public TransactionCache getTransactionCache() {
        return this.transactionCache;
    }

    public SyncStats getStats() {
        return this.stats;
    }

    public List<String> getCompletedPhases() {
        return Collections.unmodifiableList(this.completedPhases);
    }

    /* package */ void addCompletedPhase(String phaseName) {
        this.completedPhases.add(phaseName);
    }
}
