package org.walletsync.repository;

import org.walletsync.data.wallet.TransactionData;
import org.walletsync.data.wallet.TransactionInputData;
import org.walletsync.data.wallet.TransactionOutputData;

import java.util.Collection;
import java.util.List;
import java.util.Set;

public interface TransactionRepository {

	/** Returns which of passed txids already have a stored record, of any type. */
	public Set<String> getExistingTxids(String walletId, Collection<String> txids) throws DataException;

	public List<TransactionData> getTransactionsByWallet(String walletId) throws DataException;

	public TransactionData fromTxid(String walletId, String txid, TransactionData.Type type) throws DataException;

	/** Returns unconfirmed transactions that haven't been replaced. */
	public List<TransactionData> getPendingTransactions(String walletId) throws DataException;

	/** Returns non-replaced transactions with fewer than <tt>threshold</tt> confirmations. */
	public List<TransactionData> getShallowTransactions(String walletId, int threshold) throws DataException;

	/**
	 * Inserts transactions, silently skipping any already present.
	 *
	 * @return number of rows actually inserted
	 */
	public int saveAll(List<TransactionData> transactions) throws DataException;

	public void saveInputs(List<TransactionInputData> inputs) throws DataException;

	public void saveOutputs(List<TransactionOutputData> outputs) throws DataException;

	public List<TransactionInputData> getInputs(String walletId, String txid) throws DataException;

	public List<TransactionOutputData> getOutputs(String walletId, String txid) throws DataException;

	/** Marks all records of <tt>txid</tt> as replaced by <tt>replacedByTxid</tt>. */
	public int markReplaced(String walletId, String txid, String replacedByTxid) throws DataException;

	/** Writes confirmations, block height and RBF status of each passed transaction. */
	public void updateConfirmations(List<TransactionData> transactions) throws DataException;

}
