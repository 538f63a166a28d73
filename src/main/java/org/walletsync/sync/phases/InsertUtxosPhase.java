package org.walletsync.sync.phases;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.data.wallet.UtxoData;
import org.walletsync.event.WalletLog;
import org.walletsync.event.WalletLogEvent.Category;
import org.walletsync.node.NodeClientException;
import org.walletsync.node.NodeTransaction;
import org.walletsync.node.UnspentOutput;
import org.walletsync.repository.DataException;
import org.walletsync.repository.Repository;
import org.walletsync.sync.Confirmations;
import org.walletsync.sync.SyncContext;
import org.walletsync.sync.SyncPhase;
import org.walletsync.utils.Amounts;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Stores UTXOs observed on chain that aren't in the repository yet.
 */
public class InsertUtxosPhase implements SyncPhase {

    private static final Logger LOGGER = LogManager.getLogger(InsertUtxosPhase.class);

    public static final String NAME = "insertUtxos";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SyncContext execute(SyncContext context) throws DataException {
        Repository repository = context.getRepository();
        String walletId = context.getWalletId();

        Set<String> storedKeys = repository.getUtxoRepository().getUtxoKeys(walletId);

        List<UtxoData> newUtxos = new ArrayList<>();
        long totalSats = 0;

        for (String key : context.getAllUtxoKeys()) {
            if (storedKeys.contains(key))
                continue;

            SyncContext.ObservedUtxo observed = context.getUtxoDataMap().get(key);
            UnspentOutput output = observed.getOutput();

            Optional<NodeTransaction> transaction = this.fetchTransaction(context, output.getTxid());
            if (!transaction.isPresent())
                continue;

            NodeTransaction.Output txOutput = transaction.get().getOutput(output.getVout());
            if (txOutput == null) {
                LOGGER.warn("Wallet {}: skipping UTXO {} as its transaction has no such output", walletId, key);
                continue;
            }

            String scriptPubKey = txOutput.getScriptPubKey();

            int confirmations = Confirmations.fromHeight(context.getCurrentHeight(), output.getHeight());
            Integer blockHeight = Confirmations.toBlockHeight(output.getHeight());

            newUtxos.add(new UtxoData(walletId, output.getTxid(), output.getVout(), observed.getAddress(), output.getValue(),
                    scriptPubKey, confirmations, blockHeight, false, false));
            totalSats += output.getValue();
        }

        if (newUtxos.isEmpty())
            return context;

        repository.getUtxoRepository().saveAll(newUtxos);
        repository.saveChanges();

        context.getStats().setUtxosCreated(newUtxos.size());
        WalletLog.info(walletId, Category.UTXO, String.format("Found %d new UTXOs (%s)", newUtxos.size(), Amounts.prettyAmountWithCode(totalSats)));

        return context;
    }

    private Optional<NodeTransaction> fetchTransaction(SyncContext context, String txid) {
        Optional<NodeTransaction> cached = context.getTransactionCache().getTransactionByHash(txid);
        if (cached.isPresent())
            return cached;

        try {
            NodeTransaction transaction = context.getNodeClient().getTransaction(txid);
            context.getTransactionCache().addTransaction(transaction);
            return Optional.of(transaction);
        } catch (NodeClientException e) {
            LOGGER.warn("Wallet {}: skipping UTXO of transaction {} as it couldn't be fetched: {}", context.getWalletId(), txid, e.getMessage());
            return Optional.empty();
        }
    }
}
