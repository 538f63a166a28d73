package org.walletsync.sync.phases;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.data.wallet.TransactionData;
import org.walletsync.data.wallet.TransactionData.RbfStatus;
import org.walletsync.data.wallet.TransactionData.Type;
import org.walletsync.data.wallet.TransactionInputData;
import org.walletsync.data.wallet.TransactionOutputData;
import org.walletsync.data.wallet.TransactionOutputData.OutputType;
import org.walletsync.event.WalletLog;
import org.walletsync.event.WalletLogEvent.Category;
import org.walletsync.node.HistoryEntry;
import org.walletsync.node.NodeClient;
import org.walletsync.node.NodeClientException;
import org.walletsync.node.NodeTransaction;
import org.walletsync.repository.DataException;
import org.walletsync.repository.Repository;
import org.walletsync.repository.TransactionRepository;
import org.walletsync.settings.Settings;
import org.walletsync.sync.BatchFetcher;
import org.walletsync.sync.Confirmations;
import org.walletsync.sync.SyncContext;
import org.walletsync.sync.SyncPhase;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies and stores transactions seen for the first time.
 * <p>
 * Each transaction is recorded as received, sent or consolidation, from the wallet's point of view.
 * A newly confirmed transaction that spends an input of a stored, still pending transaction
 * marks that pending one as replaced.
 */
public class ProcessTransactionsPhase implements SyncPhase {

    private static final Logger LOGGER = LogManager.getLogger(ProcessTransactionsPhase.class);

    public static final String NAME = "processTransactions";

    /** Transaction with its inputs resolved to addresses and values, where possible. */
    private static class ResolvedTransaction {
        final NodeTransaction transaction;
        final List<TransactionInputData> inputs;

        ResolvedTransaction(NodeTransaction transaction, List<TransactionInputData> inputs) {
            this.transaction = transaction;
            this.inputs = inputs;
        }
    }

    private final int batchSize;

    public ProcessTransactionsPhase() {
        this(Settings.getInstance().getTransactionBatchSize());
    }

    public ProcessTransactionsPhase(int batchSize) {
        this.batchSize = batchSize;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SyncContext execute(SyncContext context) throws DataException, NodeClientException {
        if (context.getNewTxids().isEmpty())
            return context;

        String walletId = context.getWalletId();
        NodeClient nodeClient = context.getNodeClient();

        BatchFetcher fetcher = new BatchFetcher("transactions", this.batchSize, context.getFetchExecutor());
        BatchFetcher.Outcome<NodeTransaction> outcome = fetcher.fetch(new ArrayList<>(context.getNewTxids()),
                nodeClient::getTransactionsBatch, nodeClient::getTransaction);

        for (NodeTransaction transaction : outcome.getResults().values())
            context.getTransactionCache().addTransaction(transaction);

        if (!outcome.getFailed().isEmpty())
            WalletLog.warn(walletId, Category.TX, String.format("Unable to fetch %d transaction(s), will retry next sync", outcome.getFailed().size()));

        Set<String> walletAddresses = context.getWalletAddressSet();

        Map<String, ResolvedTransaction> resolved = new LinkedHashMap<>();
        for (NodeTransaction transaction : outcome.getResults().values())
            resolved.put(transaction.getTxid(), new ResolvedTransaction(transaction, this.resolveInputs(context, transaction)));

        // Keyed by "txid:type" so a transaction touching several wallet addresses is only recorded once per type
        Map<String, TransactionData> records = new LinkedHashMap<>();
        List<TransactionInputData> inputRows = new ArrayList<>();
        List<TransactionOutputData> outputRows = new ArrayList<>();
        Set<String> storedIo = new HashSet<>();

        for (Map.Entry<String, List<HistoryEntry>> historyEntry : context.getHistoryMap().entrySet()) {
            String address = historyEntry.getKey();

            for (HistoryEntry entry : historyEntry.getValue()) {
                ResolvedTransaction resolvedTransaction = resolved.get(entry.getTxHash());
                if (resolvedTransaction == null)
                    continue;

                Optional<TransactionData> record = this.classify(context, address, entry, resolvedTransaction, walletAddresses);
                if (!record.isPresent())
                    continue;

                TransactionData transactionData = record.get();
                String recordKey = transactionData.getTxid() + ":" + transactionData.getType().value;
                if (records.containsKey(recordKey))
                    continue;

                records.put(recordKey, transactionData);

                if (storedIo.add(transactionData.getTxid())) {
                    inputRows.addAll(resolvedTransaction.inputs);
                    outputRows.addAll(this.buildOutputs(walletId, resolvedTransaction.transaction, transactionData.getType(), walletAddresses));
                }
            }
        }

        Repository repository = context.getRepository();
        TransactionRepository transactionRepository = repository.getTransactionRepository();

        List<TransactionData> newTransactions = new ArrayList<>(records.values());
        if (!newTransactions.isEmpty()) {
            transactionRepository.saveAll(newTransactions);
            transactionRepository.saveInputs(inputRows);
            transactionRepository.saveOutputs(outputRows);
        }

        int replacedCount = this.detectReplacements(context, newTransactions, resolved);

        repository.saveChanges();

        context.getStats().setTransactionsProcessed(outcome.getResults().size());
        context.getStats().setNewTransactionsCreated(newTransactions.size());
        context.getStats().setRbfReplacements(replacedCount);

        if (!newTransactions.isEmpty())
            WalletLog.info(walletId, Category.TX, String.format("Processed %d new transaction(s)", newTransactions.size()));

        return context;
    }

    /**
     * Resolves each input's spent address and value, from the node's prevout details
     * or, failing that, from the previous transaction itself.
     */
    private List<TransactionInputData> resolveInputs(SyncContext context, NodeTransaction transaction) {
        List<TransactionInputData> inputs = new ArrayList<>();

        List<NodeTransaction.Input> txInputs = transaction.getInputs();
        for (int inputIndex = 0; inputIndex < txInputs.size(); ++inputIndex) {
            NodeTransaction.Input input = txInputs.get(inputIndex);

            // Coinbase inputs spend nothing
            if (input.isCoinbase())
                continue;

            String address = input.getAddress();
            Long value = input.getValue();

            if (address == null || value == null) {
                Optional<NodeTransaction> previous = this.fetchPrevious(context, input.getPrevTxid());
                NodeTransaction.Output prevOutput = previous.map(tx -> tx.getOutput(input.getPrevVout())).orElse(null);

                if (prevOutput != null) {
                    if (address == null)
                        address = prevOutput.getAddress();

                    if (value == null)
                        value = prevOutput.getValue();
                }
            }

            inputs.add(new TransactionInputData(context.getWalletId(), transaction.getTxid(), inputIndex,
                    input.getPrevTxid(), input.getPrevVout(), address, value));
        }

        return inputs;
    }

    private Optional<NodeTransaction> fetchPrevious(SyncContext context, String txid) {
        Optional<NodeTransaction> cached = context.getTransactionCache().getTransactionByHash(txid);
        if (cached.isPresent())
            return cached;

        try {
            NodeTransaction previous = context.getNodeClient().getTransaction(txid);
            context.getTransactionCache().addTransaction(previous);
            return Optional.of(previous);
        } catch (NodeClientException e) {
            LOGGER.debug("Unable to fetch previous transaction {}: {}", txid, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<TransactionData> classify(SyncContext context, String address, HistoryEntry entry,
            ResolvedTransaction resolved, Set<String> walletAddresses) {
        NodeTransaction transaction = resolved.transaction;

        boolean hasWalletInputs = false;
        boolean allInputValuesKnown = true;
        long totalIn = 0;

        for (TransactionInputData input : resolved.inputs) {
            if (input.getAddress() != null && walletAddresses.contains(input.getAddress()))
                hasWalletInputs = true;

            if (input.getAmount() == null)
                allInputValuesKnown = false;
            else
                totalIn += input.getAmount();
        }

        long totalOut = 0;
        long toWallet = 0;
        long toExternal = 0;
        long toThisAddress = 0;

        for (NodeTransaction.Output output : transaction.getOutputs()) {
            totalOut += output.getValue();

            if (output.getAddress() == null)
                continue;

            if (walletAddresses.contains(output.getAddress())) {
                toWallet += output.getValue();

                if (output.getAddress().equals(address))
                    toThisAddress += output.getValue();
            } else {
                toExternal += output.getValue();
            }
        }

        Long fee = null;
        if (allInputValuesKnown && !resolved.inputs.isEmpty() && totalIn - totalOut >= 0)
            fee = totalIn - totalOut;

        Type type;
        long amount;

        if (!hasWalletInputs) {
            // Nothing received by this address means the history entry belongs to another of our addresses
            if (toThisAddress <= 0)
                return Optional.empty();

            type = Type.RECEIVED;
            amount = toWallet;
        } else if (toExternal > 0) {
            type = Type.SENT;
            amount = -(toExternal + (fee != null ? fee : 0L));
        } else {
            type = Type.CONSOLIDATION;
            amount = -(fee != null ? fee : 0L);
        }

        int height = entry.getHeight();
        if (height <= 0 && transaction.getBlockHeight() != null)
            height = transaction.getBlockHeight();

        int confirmations = Confirmations.fromHeight(context.getCurrentHeight(), height);
        RbfStatus rbfStatus = confirmations > 0 ? RbfStatus.CONFIRMED : RbfStatus.ACTIVE;

        return Optional.of(new TransactionData(context.getWalletId(), transaction.getTxid(), type, amount, fee, confirmations,
                Confirmations.toBlockHeight(height), transaction.getBlockTime(), address, rbfStatus, null));
    }

    private List<TransactionOutputData> buildOutputs(String walletId, NodeTransaction transaction, Type type, Set<String> walletAddresses) {
        List<TransactionOutputData> outputs = new ArrayList<>();

        for (NodeTransaction.Output output : transaction.getOutputs()) {
            boolean mine = output.getAddress() != null && walletAddresses.contains(output.getAddress());

            OutputType outputType;
            switch (type) {
                case SENT:
                    outputType = mine ? OutputType.CHANGE : OutputType.RECIPIENT;
                    break;

                case CONSOLIDATION:
                    outputType = OutputType.CONSOLIDATION;
                    break;

                default:
                    outputType = mine ? OutputType.RECIPIENT : OutputType.UNKNOWN;
                    break;
            }

            outputs.add(new TransactionOutputData(walletId, transaction.getTxid(), output.getIndex(), output.getAddress(),
                    output.getValue(), output.getScriptPubKey(), mine, outputType));
        }

        return outputs;
    }

    /**
     * Marks stored pending transactions as replaced when a newly confirmed transaction spends one of their inputs.
     *
     * @return number of transactions marked as replaced
     */
    private int detectReplacements(SyncContext context, List<TransactionData> newTransactions,
            Map<String, ResolvedTransaction> resolved) throws DataException {
        String walletId = context.getWalletId();
        TransactionRepository transactionRepository = context.getRepository().getTransactionRepository();

        // Outpoint -> confirmed txid spending it
        Map<String, String> confirmedSpends = new LinkedHashMap<>();
        for (TransactionData transaction : newTransactions) {
            if (transaction.getConfirmations() <= 0)
                continue;

            for (TransactionInputData input : resolved.get(transaction.getTxid()).inputs)
                confirmedSpends.put(input.getOutpoint(), transaction.getTxid());
        }

        if (confirmedSpends.isEmpty())
            return 0;

        Set<String> replacedTxids = new HashSet<>();

        for (TransactionData pending : transactionRepository.getPendingTransactions(walletId)) {
            if (replacedTxids.contains(pending.getTxid()) || confirmedSpends.containsValue(pending.getTxid()))
                continue;

            for (TransactionInputData input : transactionRepository.getInputs(walletId, pending.getTxid())) {
                String replacement = confirmedSpends.get(input.getOutpoint());
                if (replacement == null || replacement.equals(pending.getTxid()))
                    continue;

                transactionRepository.markReplaced(walletId, pending.getTxid(), replacement);
                replacedTxids.add(pending.getTxid());

                WalletLog.warn(walletId, Category.RBF, String.format("Transaction %s was replaced by %s", pending.getTxid(), replacement));
                break;
            }
        }

        return replacedTxids.size();
    }
}
