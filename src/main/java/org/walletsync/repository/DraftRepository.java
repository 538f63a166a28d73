package org.walletsync.repository;

import org.walletsync.data.wallet.DraftTransactionData;

import java.util.Collection;
import java.util.List;
import java.util.Set;

public interface DraftRepository {

	public DraftTransactionData fromDraftId(String draftId) throws DataException;

	public List<DraftTransactionData> getDraftsByWallet(String walletId) throws DataException;

	/** Returns drafts holding a lock on any of passed "txid:vout" keys. */
	public List<DraftTransactionData> getDraftsLockingUtxos(String walletId, Collection<String> utxoKeys) throws DataException;

	/** Returns "txid:vout" keys of all UTXOs locked by any of wallet's drafts. */
	public Set<String> getLockedUtxoKeys(String walletId) throws DataException;

	/** Saves draft along with its UTXO locks. */
	public void save(DraftTransactionData draftData) throws DataException;

	/**
	 * Deletes drafts. Their UTXO locks are removed by cascade.
	 *
	 * @return number of drafts deleted
	 */
	public int delete(Collection<String> draftIds) throws DataException;

}
