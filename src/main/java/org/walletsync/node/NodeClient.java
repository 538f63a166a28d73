package org.walletsync.node;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Queries against a blockchain node, e.g. a full node's RPC interface or an Electrum server.
 * <p>
 * Singular methods fail per item. Batch methods fail as a unit: either every requested
 * item is answered or a {@link NodeClientException} is thrown, leaving the caller
 * to fall back to singular calls.
 */
public abstract class NodeClient {

	/** Returns the identifier for the network, e.g. "mainnet", "testnet". */
	public abstract String getNetId();

	/**
	 * Returns current blockchain height.
	 * <p>
	 * @throws NodeClientException if error occurs
	 */
	public abstract int getCurrentHeight() throws NodeClientException;

	/**
	 * Returns confirmed and unconfirmed transactions involving address.
	 * <p>
	 * @return list of history entries, or empty list if address has no activity
	 * @throws NodeClientException if there was an error
	 */
	public abstract List<HistoryEntry> getAddressHistory(String address) throws NodeClientException;

	/**
	 * Returns history for each passed address, keyed by address.
	 * <p>
	 * @throws NodeClientException if any part of the batch failed
	 */
	public abstract Map<String, List<HistoryEntry>> getAddressHistoryBatch(List<String> addresses) throws NodeClientException;

	/**
	 * Returns unspent outputs paying address, including unconfirmed ones.
	 * <p>
	 * @return list of unspent outputs, or empty list if address has none
	 * @throws NodeClientException if there was an error
	 */
	public abstract List<UnspentOutput> getAddressUtxos(String address) throws NodeClientException;

	/**
	 * Returns unspent outputs for each passed address, keyed by address.
	 * <p>
	 * @throws NodeClientException if any part of the batch failed
	 */
	public abstract Map<String, List<UnspentOutput>> getAddressUtxosBatch(List<String> addresses) throws NodeClientException;

	/**
	 * Returns transaction details, with prevout address/value where the node supplies them.
	 * <p>
	 * @throws NodeClientException.NotFoundException if transaction unknown
	 * @throws NodeClientException if error occurs
	 */
	public abstract NodeTransaction getTransaction(String txid) throws NodeClientException;

	/**
	 * Returns details of each passed transaction, keyed by txid.
	 * <p>
	 * Default implementation fetches transactions one by one, failing on first error.
	 * <p>
	 * @throws NodeClientException if any part of the batch failed
	 */
	public Map<String, NodeTransaction> getTransactionsBatch(List<String> txids) throws NodeClientException {
		Map<String, NodeTransaction> transactions = new LinkedHashMap<>(txids.size());

		for (String txid : txids)
			transactions.put(txid, this.getTransaction(txid));

		return transactions;
	}

	/**
	 * Health signal from whatever pooling / circuit-breaking wraps this client.
	 * <p>
	 * @return false if queries are currently expected to fail
	 */
	public boolean isAvailable() {
		return true;
	}

}
