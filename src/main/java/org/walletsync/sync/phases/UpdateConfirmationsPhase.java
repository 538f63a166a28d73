package org.walletsync.sync.phases;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.data.wallet.TransactionData;
import org.walletsync.data.wallet.TransactionData.RbfStatus;
import org.walletsync.repository.DataException;
import org.walletsync.repository.Repository;
import org.walletsync.settings.Settings;
import org.walletsync.sync.Confirmations;
import org.walletsync.sync.SyncContext;
import org.walletsync.sync.SyncPhase;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Refreshes confirmations of stored transactions that aren't buried deep enough yet.
 * <p>
 * Pending transactions pick up their block height from this run's history.
 */
public class UpdateConfirmationsPhase implements SyncPhase {

    private static final Logger LOGGER = LogManager.getLogger(UpdateConfirmationsPhase.class);

    public static final String NAME = "updateConfirmations";

    private final int deepConfirmationThreshold;

    public UpdateConfirmationsPhase() {
        this(Settings.getInstance().getDeepConfirmationThreshold());
    }

    public UpdateConfirmationsPhase(int deepConfirmationThreshold) {
        this.deepConfirmationThreshold = deepConfirmationThreshold;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SyncContext execute(SyncContext context) throws DataException {
        Repository repository = context.getRepository();
        String walletId = context.getWalletId();

        List<TransactionData> shallowTransactions = repository.getTransactionRepository()
                .getShallowTransactions(walletId, this.deepConfirmationThreshold);

        List<TransactionData> toUpdate = new ArrayList<>();

        for (TransactionData transaction : shallowTransactions) {
            Integer blockHeight = transaction.getBlockHeight();

            Integer observedHeight = context.getTxHeightMap().get(transaction.getTxid());
            if (observedHeight != null && observedHeight > 0)
                blockHeight = observedHeight;

            int confirmations = Confirmations.fromHeight(context.getCurrentHeight(), blockHeight);

            RbfStatus rbfStatus = transaction.getRbfStatus();
            if (confirmations > 0 && rbfStatus == RbfStatus.ACTIVE)
                rbfStatus = RbfStatus.CONFIRMED;

            if (confirmations == transaction.getConfirmations() && Objects.equals(blockHeight, transaction.getBlockHeight())
                    && rbfStatus == transaction.getRbfStatus())
                continue;

            transaction.setConfirmations(confirmations);
            transaction.setBlockHeight(blockHeight);
            transaction.setRbfStatus(rbfStatus);
            toUpdate.add(transaction);
        }

        if (toUpdate.isEmpty())
            return context;

        repository.getTransactionRepository().updateConfirmations(toUpdate);
        repository.saveChanges();

        context.getStats().setTransactionConfirmationsUpdated(toUpdate.size());
        LOGGER.debug("Wallet {}: updated confirmations of {} transaction(s)", walletId, toUpdate.size());

        return context;
    }
}
