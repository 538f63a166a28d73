package org.walletsync.repository.hsqldb;

import com.google.common.collect.Lists;
import org.walletsync.data.wallet.TransactionData;
import org.walletsync.data.wallet.TransactionData.RbfStatus;
import org.walletsync.data.wallet.TransactionData.Type;
import org.walletsync.data.wallet.TransactionInputData;
import org.walletsync.data.wallet.TransactionOutputData;
import org.walletsync.data.wallet.TransactionOutputData.OutputType;
import org.walletsync.repository.DataException;
import org.walletsync.repository.TransactionRepository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class HSQLDBTransactionRepository implements TransactionRepository {

	private static final int IN_LIST_LIMIT = 1000;

	private static final String TRANSACTION_COLUMNS = "txid, tx_type, amount, fee, confirmations, block_height, block_time, "
			+ "address, rbf_status, replaced_by_txid";

	protected HSQLDBRepository repository;

	public HSQLDBTransactionRepository(HSQLDBRepository repository) {
		this.repository = repository;
	}

	@Override
	public Set<String> getExistingTxids(String walletId, Collection<String> txids) throws DataException {
		Set<String> existingTxids = new HashSet<>();

		try {
			for (List<String> chunk : Lists.partition(new ArrayList<>(txids), IN_LIST_LIMIT)) {
				StringBuilder sql = new StringBuilder(256);
				sql.append("SELECT DISTINCT txid FROM WalletTransactions WHERE wallet_id = ? AND txid IN (");
				HSQLDBRepository.appendPlaceholders(sql, chunk.size());
				sql.append(")");

				try (ResultSet resultSet = this.repository.checkedExecute(sql.toString(), HSQLDBRepository.bindValues(chunk, walletId))) {
					if (resultSet == null)
						continue;

					do {
						existingTxids.add(resultSet.getString(1));
					} while (resultSet.next());
				}
			}
		} catch (SQLException e) {
			throw new DataException("Unable to fetch existing transactions from repository", e);
		}

		return existingTxids;
	}

	private List<TransactionData> getTransactions(String walletId, String extraCriteria, Object... extraObjects) throws DataException {
		String sql = "SELECT " + TRANSACTION_COLUMNS + " FROM WalletTransactions WHERE wallet_id = ?" + extraCriteria
				+ " ORDER BY block_height DESC NULLS FIRST, txid";

		Object[] bindValues = new Object[extraObjects.length + 1];
		bindValues[0] = walletId;
		System.arraycopy(extraObjects, 0, bindValues, 1, extraObjects.length);

		List<TransactionData> transactions = new ArrayList<>();

		try (ResultSet resultSet = this.repository.checkedExecute(sql, bindValues)) {
			if (resultSet == null)
				return transactions;

			do {
				transactions.add(fromResultSet(walletId, resultSet));
			} while (resultSet.next());

			return transactions;
		} catch (SQLException e) {
			throw new DataException("Unable to fetch wallet transactions from repository", e);
		}
	}

	private static TransactionData fromResultSet(String walletId, ResultSet resultSet) throws SQLException {
		String txid = resultSet.getString(1);
		Type type = Type.fromValue(resultSet.getString(2));
		long amount = resultSet.getLong(3);
		Long fee = HSQLDBRepository.getNullableLong(resultSet, 4);
		int confirmations = resultSet.getInt(5);
		Integer blockHeight = HSQLDBRepository.getNullableInteger(resultSet, 6);
		Long blockTime = HSQLDBRepository.getNullableLong(resultSet, 7);
		String address = resultSet.getString(8);
		RbfStatus rbfStatus = RbfStatus.fromValue(resultSet.getString(9));
		String replacedByTxid = resultSet.getString(10);

		return new TransactionData(walletId, txid, type, amount, fee, confirmations, blockHeight, blockTime, address, rbfStatus, replacedByTxid);
	}

	@Override
	public List<TransactionData> getTransactionsByWallet(String walletId) throws DataException {
		return this.getTransactions(walletId, "");
	}

	@Override
	public TransactionData fromTxid(String walletId, String txid, Type type) throws DataException {
		List<TransactionData> transactions = this.getTransactions(walletId, " AND txid = ? AND tx_type = ?", txid, type.value);
		return transactions.isEmpty() ? null : transactions.get(0);
	}

	@Override
	public List<TransactionData> getPendingTransactions(String walletId) throws DataException {
		return this.getTransactions(walletId, " AND confirmations = 0 AND rbf_status = ?", RbfStatus.ACTIVE.value);
	}

	@Override
	public List<TransactionData> getShallowTransactions(String walletId, int threshold) throws DataException {
		return this.getTransactions(walletId, " AND confirmations < ? AND rbf_status <> ?", threshold, RbfStatus.REPLACED.value);
	}

	@Override
	public int saveAll(List<TransactionData> transactions) throws DataException {
		String sql = "INSERT IGNORE INTO WalletTransactions (wallet_id, " + TRANSACTION_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

		List<Object[]> bindParamValues = new ArrayList<>(transactions.size());
		for (TransactionData transaction : transactions)
			bindParamValues.add(new Object[] { transaction.getWalletId(), transaction.getTxid(), transaction.getType().value,
					transaction.getAmount(), transaction.getFee(), transaction.getConfirmations(), transaction.getBlockHeight(),
					transaction.getBlockTime(), transaction.getAddress(), transaction.getRbfStatus().value, transaction.getReplacedByTxid() });

		try {
			return this.repository.executeCheckedBatchUpdate(sql, bindParamValues);
		} catch (SQLException e) {
			throw new DataException("Unable to save wallet transactions into repository", e);
		}
	}

	@Override
	public void saveInputs(List<TransactionInputData> inputs) throws DataException {
		String sql = "INSERT IGNORE INTO TransactionInputs (wallet_id, txid, input_index, prev_txid, prev_vout, address, amount) "
				+ "VALUES (?, ?, ?, ?, ?, ?, ?)";

		List<Object[]> bindParamValues = new ArrayList<>(inputs.size());
		for (TransactionInputData input : inputs)
			bindParamValues.add(new Object[] { input.getWalletId(), input.getTxid(), input.getInputIndex(), input.getPrevTxid(),
					input.getPrevVout(), input.getAddress(), input.getAmount() });

		try {
			this.repository.executeCheckedBatchUpdate(sql, bindParamValues);
		} catch (SQLException e) {
			throw new DataException("Unable to save transaction inputs into repository", e);
		}
	}

	@Override
	public void saveOutputs(List<TransactionOutputData> outputs) throws DataException {
		String sql = "INSERT IGNORE INTO TransactionOutputs (wallet_id, txid, output_index, address, amount, script_pubkey, is_mine, output_type) "
				+ "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

		List<Object[]> bindParamValues = new ArrayList<>(outputs.size());
		for (TransactionOutputData output : outputs)
			bindParamValues.add(new Object[] { output.getWalletId(), output.getTxid(), output.getOutputIndex(), output.getAddress(),
					output.getAmount(), output.getScriptPubKey(), output.isMine(), output.getOutputType().value });

		try {
			this.repository.executeCheckedBatchUpdate(sql, bindParamValues);
		} catch (SQLException e) {
			throw new DataException("Unable to save transaction outputs into repository", e);
		}
	}

	@Override
	public List<TransactionInputData> getInputs(String walletId, String txid) throws DataException {
		String sql = "SELECT input_index, prev_txid, prev_vout, address, amount FROM TransactionInputs "
				+ "WHERE wallet_id = ? AND txid = ? ORDER BY input_index";

		List<TransactionInputData> inputs = new ArrayList<>();

		try (ResultSet resultSet = this.repository.checkedExecute(sql, walletId, txid)) {
			if (resultSet == null)
				return inputs;

			do {
				int inputIndex = resultSet.getInt(1);
				String prevTxid = resultSet.getString(2);
				int prevVout = resultSet.getInt(3);
				String address = resultSet.getString(4);
				Long amount = HSQLDBRepository.getNullableLong(resultSet, 5);

				inputs.add(new TransactionInputData(walletId, txid, inputIndex, prevTxid, prevVout, address, amount));
			} while (resultSet.next());

			return inputs;
		} catch (SQLException e) {
			throw new DataException("Unable to fetch transaction inputs from repository", e);
		}
	}

	@Override
	public List<TransactionOutputData> getOutputs(String walletId, String txid) throws DataException {
		String sql = "SELECT output_index, address, amount, script_pubkey, is_mine, output_type FROM TransactionOutputs "
				+ "WHERE wallet_id = ? AND txid = ? ORDER BY output_index";

		List<TransactionOutputData> outputs = new ArrayList<>();

		try (ResultSet resultSet = this.repository.checkedExecute(sql, walletId, txid)) {
			if (resultSet == null)
				return outputs;

			do {
				int outputIndex = resultSet.getInt(1);
				String address = resultSet.getString(2);
				long amount = resultSet.getLong(3);
				String scriptPubKey = resultSet.getString(4);
				boolean mine = resultSet.getBoolean(5);
				OutputType outputType = OutputType.fromValue(resultSet.getString(6));

				outputs.add(new TransactionOutputData(walletId, txid, outputIndex, address, amount, scriptPubKey, mine, outputType));
			} while (resultSet.next());

			return outputs;
		} catch (SQLException e) {
			throw new DataException("Unable to fetch transaction outputs from repository", e);
		}
	}

	@Override
	public int markReplaced(String walletId, String txid, String replacedByTxid) throws DataException {
		String sql = "UPDATE WalletTransactions SET rbf_status = ?, replaced_by_txid = ? WHERE wallet_id = ? AND txid = ?";

		try {
			return this.repository.executeCheckedUpdate(sql, RbfStatus.REPLACED.value, replacedByTxid, walletId, txid);
		} catch (SQLException e) {
			throw new DataException("Unable to mark transaction as replaced in repository", e);
		}
	}

	@Override
	public void updateConfirmations(List<TransactionData> transactions) throws DataException {
		String sql = "UPDATE WalletTransactions SET confirmations = ?, block_height = ?, rbf_status = ? "
				+ "WHERE wallet_id = ? AND txid = ? AND tx_type = ?";

		List<Object[]> bindParamValues = new ArrayList<>(transactions.size());
		for (TransactionData transaction : transactions)
			bindParamValues.add(new Object[] { transaction.getConfirmations(), transaction.getBlockHeight(), transaction.getRbfStatus().value,
					transaction.getWalletId(), transaction.getTxid(), transaction.getType().value });

		try {
			this.repository.executeCheckedBatchUpdate(sql, bindParamValues);
		} catch (SQLException e) {
			throw new DataException("Unable to update transaction confirmations in repository", e);
		}
	}

}
