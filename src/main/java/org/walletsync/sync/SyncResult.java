package org.walletsync.sync;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@XmlAccessorType(XmlAccessType.FIELD)
public class SyncResult {

    private String walletId;
    private int addressCount;
    private int transactionsCreated;
    private int utxosCreated;
    private SyncStats stats;
    private long elapsedMillis;
    private List<String> completedPhases;
    /** Set when newly generated addresses already had activity, so another run should follow. */
    private boolean resyncRequired;

    protected SyncResult() {
    }

    public SyncResult(String walletId, int addressCount, int transactionsCreated, int utxosCreated, SyncStats stats,
            long elapsedMillis, List<String> completedPhases, boolean resyncRequired) {
        this.walletId = walletId;
        this.addressCount = addressCount;
        this.transactionsCreated = transactionsCreated;
        this.utxosCreated = utxosCreated;
        this.stats = stats;
        this.elapsedMillis = elapsedMillis;
        this.completedPhases = completedPhases;
        this.resyncRequired = resyncRequired;
    }

    /** Result of a run that had nothing to do. */
    public static SyncResult empty(String walletId, long elapsedMillis) {
        return new SyncResult(walletId, 0, 0, 0, new SyncStats(), elapsedMillis, Collections.emptyList(), false);
    }

    public static SyncResult fromContext(SyncContext context, long elapsedMillis) {
        SyncStats stats = context.getStats();

        return new SyncResult(context.getWalletId(), context.getAddresses().size(), stats.getNewTransactionsCreated(),
                stats.getUtxosCreated(), stats, elapsedMillis, new ArrayList<>(context.getCompletedPhases()), context.isResyncRequired());
    }

    public String getWalletId() {
        return this.walletId;
    }

    public int getAddressCount() {
        return this.addressCount;
    }

    public int getTransactionsCreated() {
        return this.transactionsCreated;
    }

    public int getUtxosCreated() {
        return this.utxosCreated;
    }

    public SyncStats getStats() {
        return this.stats;
    }

    public long getElapsedMillis() {
        return this.elapsedMillis;
    }

    public List<String> getCompletedPhases() {
        return this.completedPhases;
    }

    public boolean isResyncRequired() {
        return this.resyncRequired;
    }
}
