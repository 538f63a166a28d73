package org.walletsync.repository;

import org.walletsync.data.wallet.UtxoData;

import java.util.Collection;
import java.util.List;
import java.util.Set;

public interface UtxoRepository {

	/** Returns all of wallet's UTXOs, spent or not. */
	public List<UtxoData> getUtxosByWallet(String walletId) throws DataException;

	public List<UtxoData> getUnspentUtxos(String walletId) throws DataException;

	public UtxoData fromKey(String walletId, String txid, int vout) throws DataException;

	/** Returns "txid:vout" keys of all of wallet's stored UTXOs, spent or not. */
	public Set<String> getUtxoKeys(String walletId) throws DataException;

	/**
	 * Inserts UTXOs, silently skipping any already present.
	 *
	 * @return number of rows actually inserted
	 */
	public int saveAll(List<UtxoData> utxos) throws DataException;

	/**
	 * Marks UTXOs, given as "txid:vout" keys, as spent.
	 *
	 * @return number of rows actually changed
	 */
	public int markSpent(String walletId, Collection<String> utxoKeys) throws DataException;

	/** Writes confirmations and block height of each passed UTXO. */
	public void updateConfirmations(List<UtxoData> utxos) throws DataException;

	public int setFrozen(String walletId, String txid, int vout, boolean frozen) throws DataException;

}
