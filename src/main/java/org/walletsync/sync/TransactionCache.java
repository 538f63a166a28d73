package org.walletsync.sync;

import org.walletsync.node.NodeTransaction;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Class TransactionCache
 *
 * Cache transaction details within one sync run to avoid fetching the same transaction twice.
 */
public class TransactionCache {

    /**
     * Transactions By Hash
     *
     * Transaction Hash -> Transaction
     */
    private final ConcurrentHashMap<String, NodeTransaction> transactionByHash = new ConcurrentHashMap<>();

    /**
     * Cache Limit
     *
     * If this limit is reached, the cache will be cleared.
     */
    private final int cacheLimit;

    public TransactionCache(int cacheLimit) {
        this.cacheLimit = cacheLimit;
    }

    /**
     * Add Transaction
     *
     * @param transaction the transaction
     */
    public void addTransaction(NodeTransaction transaction) {

        if( this.transactionByHash.size() >= this.cacheLimit ) {
            this.transactionByHash.clear();
        }

        this.transactionByHash.put(transaction.getTxid(), transaction);
    }

    /**
     * Get Transaction By Hash
     *
     * @param hash the transaction hash
     *
     * @return the transaction, empty if the hash is not in the cache
     */
    public Optional<NodeTransaction> getTransactionByHash(String hash) {
        return Optional.ofNullable(this.transactionByHash.get(hash));
    }

    public int size() {
        return this.transactionByHash.size();
    }
}
