package org.walletsync.sync;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

/**
 * Running counters of one sync run.
 */
@XmlAccessorType(XmlAccessType.FIELD)
public class SyncStats {

    private int historiesFetched;
    private int addressesWithActivity;
    private int transactionsProcessed;
    private int newTransactionsCreated;
    private int rbfReplacements;
    private int utxosFetched;
    private int utxosCreated;
    private int utxosMarkedSpent;
    private int utxosUpdated;
    private int draftsInvalidated;
    private int addressesUpdated;
    private int transactionConfirmationsUpdated;
    private int newAddressesGenerated;

    public int getHistoriesFetched() {
        return historiesFetched;
    }

    public void setHistoriesFetched(int historiesFetched) {
        this.historiesFetched = historiesFetched;
    }

    public int getAddressesWithActivity() {
        return addressesWithActivity;
    }

    public void setAddressesWithActivity(int addressesWithActivity) {
        this.addressesWithActivity = addressesWithActivity;
    }

    public int getTransactionsProcessed() {
        return transactionsProcessed;
    }

    public void setTransactionsProcessed(int transactionsProcessed) {
        this.transactionsProcessed = transactionsProcessed;
    }

    public int getNewTransactionsCreated() {
        return newTransactionsCreated;
    }

    public void setNewTransactionsCreated(int newTransactionsCreated) {
        this.newTransactionsCreated = newTransactionsCreated;
    }

    public int getRbfReplacements() {
        return rbfReplacements;
    }

    public void setRbfReplacements(int rbfReplacements) {
        this.rbfReplacements = rbfReplacements;
    }

    public int getUtxosFetched() {
        return utxosFetched;
    }

    public void setUtxosFetched(int utxosFetched) {
        this.utxosFetched = utxosFetched;
    }

    public int getUtxosCreated() {
        return utxosCreated;
    }

    public void setUtxosCreated(int utxosCreated) {
        this.utxosCreated = utxosCreated;
    }

    public int getUtxosMarkedSpent() {
        return utxosMarkedSpent;
    }

    public void setUtxosMarkedSpent(int utxosMarkedSpent) {
        this.utxosMarkedSpent = utxosMarkedSpent;
    }

    public int getUtxosUpdated() {
        return utxosUpdated;
    }

    public void setUtxosUpdated(int utxosUpdated) {
        this.utxosUpdated = utxosUpdated;
    }

    public int getDraftsInvalidated() {
        return draftsInvalidated;
    }

    public void setDraftsInvalidated(int draftsInvalidated) {
        this.draftsInvalidated = draftsInvalidated;
    }

    public int getAddressesUpdated() {
        return addressesUpdated;
    }

    public void setAddressesUpdated(int addressesUpdated) {
        this.addressesUpdated = addressesUpdated;
    }

    public int getTransactionConfirmationsUpdated() {
        return transactionConfirmationsUpdated;
    }

    public void setTransactionConfirmationsUpdated(int transactionConfirmationsUpdated) {
        this.transactionConfirmationsUpdated = transactionConfirmationsUpdated;
    }

    public int getNewAddressesGenerated() {
        return newAddressesGenerated;
    }

    public void setNewAddressesGenerated(int newAddressesGenerated) {
        this.newAddressesGenerated = newAddressesGenerated;
    }

    /** Returns number of repository rows this run inserted or changed. */
    public int getTotalWrites() {
        return newTransactionsCreated + rbfReplacements + utxosCreated + utxosMarkedSpent + utxosUpdated
                + draftsInvalidated + addressesUpdated + transactionConfirmationsUpdated + newAddressesGenerated;
    }

    @Override
    public String toString() {
        return String.format("histories %d (%d active), txs %d new of %d, utxos %d fetched / %d created / %d spent / %d updated, "
                + "drafts %d invalidated, addresses %d marked used / %d generated",
                historiesFetched, addressesWithActivity, newTransactionsCreated, transactionsProcessed,
                utxosFetched, utxosCreated, utxosMarkedSpent, utxosUpdated,
                draftsInvalidated, addressesUpdated, newAddressesGenerated);
    }
}
