package org.walletsync.sync.phases;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.data.wallet.DraftTransactionData;
import org.walletsync.data.wallet.UtxoData;
import org.walletsync.event.WalletLog;
import org.walletsync.event.WalletLogEvent.Category;
import org.walletsync.repository.DataException;
import org.walletsync.repository.Repository;
import org.walletsync.sync.Confirmations;
import org.walletsync.sync.SyncContext;
import org.walletsync.sync.SyncPhase;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reconciles stored UTXOs against this run's view of the chain.
 * <p>
 * A stored UTXO is marked spent only when it is missing from the chain's UTXO set
 * <b>and</b> its address was successfully queried in this run. A failed query
 * means "unknown", never "spent".
 * <p>
 * Drafts locking a newly spent UTXO are deleted in the same transaction as the spent marking.
 * Confirmation updates follow as a second transaction.
 */
public class ReconcileUtxosPhase implements SyncPhase {

    private static final Logger LOGGER = LogManager.getLogger(ReconcileUtxosPhase.class);

    public static final String NAME = "reconcileUtxos";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SyncContext execute(SyncContext context) throws DataException {
        Repository repository = context.getRepository();
        String walletId = context.getWalletId();
        int currentHeight = context.getCurrentHeight();

        List<UtxoData> storedUtxos = repository.getUtxoRepository().getUtxosByWallet(walletId);

        List<String> toMarkSpent = new ArrayList<>();
        List<UtxoData> toUpdate = new ArrayList<>();
        int unknownCount = 0;

        for (UtxoData utxo : storedUtxos) {
            String key = utxo.getKey();
            SyncContext.ObservedUtxo observed = context.getUtxoDataMap().get(key);

            if (observed == null) {
                if (utxo.isSpent())
                    continue;

                if (!context.getSuccessfullyFetchedAddresses().contains(utxo.getAddress())) {
                    // Address query failed, so we don't know whether this is still unspent
                    ++unknownCount;
                    continue;
                }

                toMarkSpent.add(key);
                continue;
            }

            int height = observed.getOutput().getHeight();
            int confirmations = Confirmations.fromHeight(currentHeight, height);
            Integer blockHeight = Confirmations.toBlockHeight(height);

            if (confirmations == utxo.getConfirmations() && Objects.equals(blockHeight, utxo.getBlockHeight()))
                continue;

            utxo.setConfirmations(confirmations);
            utxo.setBlockHeight(blockHeight);
            toUpdate.add(utxo);
        }

        if (unknownCount > 0)
            LOGGER.debug("Wallet {}: left {} UTXO(s) untouched as their address couldn't be queried", walletId, unknownCount);

        if (!toMarkSpent.isEmpty())
            this.markSpent(context, toMarkSpent);

        if (!toUpdate.isEmpty()) {
            repository.getUtxoRepository().updateConfirmations(toUpdate);
            repository.saveChanges();

            context.getStats().setUtxosUpdated(toUpdate.size());
            LOGGER.debug("Wallet {}: updated confirmations of {} UTXO(s)", walletId, toUpdate.size());
        }

        return context;
    }

    private void markSpent(SyncContext context, List<String> utxoKeys) throws DataException {
        Repository repository = context.getRepository();
        String walletId = context.getWalletId();

        // Find affected drafts before their locks disappear
        List<DraftTransactionData> invalidDrafts = repository.getDraftRepository().getDraftsLockingUtxos(walletId, utxoKeys);

        repository.getUtxoRepository().markSpent(walletId, utxoKeys);

        if (!invalidDrafts.isEmpty())
            repository.getDraftRepository().delete(invalidDrafts.stream()
                    .map(DraftTransactionData::getDraftId)
                    .collect(Collectors.toList()));

        // Spent marking and draft deletion commit together
        repository.saveChanges();

        context.getStats().setUtxosMarkedSpent(utxoKeys.size());
        WalletLog.info(walletId, Category.UTXO, String.format("Marked %d UTXO(s) as spent", utxoKeys.size()));

        if (invalidDrafts.isEmpty())
            return;

        context.getStats().setDraftsInvalidated(invalidDrafts.size());

        List<String> labels = invalidDrafts.stream()
                .map(DraftTransactionData::getLabel)
                .filter(label -> label != null && !label.isEmpty())
                .collect(Collectors.toList());

        String message = String.format("Invalidated %d draft(s) due to spent UTXOs", invalidDrafts.size());
        if (!labels.isEmpty())
            message += ": " + String.join(", ", labels);

        WalletLog.info(walletId, Category.DRAFT, message);
    }
}
