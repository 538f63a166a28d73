package org.walletsync.sync.phases;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.repository.DataException;
import org.walletsync.sync.SyncContext;
import org.walletsync.sync.SyncPhase;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Works out which observed transactions have no stored record yet.
 */
public class CheckExistingPhase implements SyncPhase {

    private static final Logger LOGGER = LogManager.getLogger(CheckExistingPhase.class);

    public static final String NAME = "checkExisting";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SyncContext execute(SyncContext context) throws DataException {
        Set<String> allTxids = context.getAllTxids();

        Set<String> existingTxids = context.getRepository().getTransactionRepository()
                .getExistingTxids(context.getWalletId(), allTxids);

        Set<String> newTxids = new LinkedHashSet<>(allTxids);
        newTxids.removeAll(existingTxids);
        context.setNewTxids(newTxids);

        LOGGER.debug("Wallet {}: {} of {} transactions are new", context.getWalletId(), newTxids.size(), allTxids.size());

        return context;
    }
}
