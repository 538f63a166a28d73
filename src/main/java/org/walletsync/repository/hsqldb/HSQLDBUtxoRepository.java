package org.walletsync.repository.hsqldb;

import com.google.common.collect.Lists;
import org.walletsync.data.wallet.UtxoData;
import org.walletsync.repository.DataException;
import org.walletsync.repository.UtxoRepository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class HSQLDBUtxoRepository implements UtxoRepository {

	private static final String UTXO_COLUMNS = "txid, vout, address, amount, script_pubkey, confirmations, block_height, spent, frozen";

	protected HSQLDBRepository repository;

	public HSQLDBUtxoRepository(HSQLDBRepository repository) {
		this.repository = repository;
	}

	private List<UtxoData> getUtxos(String walletId, String extraCriteria) throws DataException {
		String sql = "SELECT " + UTXO_COLUMNS + " FROM Utxos WHERE wallet_id = ?" + extraCriteria + " ORDER BY txid, vout";

		List<UtxoData> utxos = new ArrayList<>();

		try (ResultSet resultSet = this.repository.checkedExecute(sql, walletId)) {
			if (resultSet == null)
				return utxos;

			do {
				utxos.add(fromResultSet(walletId, resultSet));
			} while (resultSet.next());

			return utxos;
		} catch (SQLException e) {
			throw new DataException("Unable to fetch UTXOs from repository", e);
		}
	}

	private static UtxoData fromResultSet(String walletId, ResultSet resultSet) throws SQLException {
		String txid = resultSet.getString(1);
		int vout = resultSet.getInt(2);
		String address = resultSet.getString(3);
		long amount = resultSet.getLong(4);
		String scriptPubKey = resultSet.getString(5);
		int confirmations = resultSet.getInt(6);
		Integer blockHeight = HSQLDBRepository.getNullableInteger(resultSet, 7);
		boolean spent = resultSet.getBoolean(8);
		boolean frozen = resultSet.getBoolean(9);

		return new UtxoData(walletId, txid, vout, address, amount, scriptPubKey, confirmations, blockHeight, spent, frozen);
	}

	@Override
	public List<UtxoData> getUtxosByWallet(String walletId) throws DataException {
		return this.getUtxos(walletId, "");
	}

	@Override
	public List<UtxoData> getUnspentUtxos(String walletId) throws DataException {
		return this.getUtxos(walletId, " AND spent = FALSE");
	}

	@Override
	public UtxoData fromKey(String walletId, String txid, int vout) throws DataException {
		String sql = "SELECT " + UTXO_COLUMNS + " FROM Utxos WHERE wallet_id = ? AND txid = ? AND vout = ?";

		try (ResultSet resultSet = this.repository.checkedExecute(sql, walletId, txid, vout)) {
			if (resultSet == null)
				return null;

			return fromResultSet(walletId, resultSet);
		} catch (SQLException e) {
			throw new DataException("Unable to fetch UTXO from repository", e);
		}
	}

	@Override
	public Set<String> getUtxoKeys(String walletId) throws DataException {
		Set<String> keys = new HashSet<>();

		try (ResultSet resultSet = this.repository.checkedExecute("SELECT txid, vout FROM Utxos WHERE wallet_id = ?", walletId)) {
			if (resultSet == null)
				return keys;

			do {
				keys.add(UtxoData.buildKey(resultSet.getString(1), resultSet.getInt(2)));
			} while (resultSet.next());

			return keys;
		} catch (SQLException e) {
			throw new DataException("Unable to fetch UTXO keys from repository", e);
		}
	}

	@Override
	public int saveAll(List<UtxoData> utxos) throws DataException {
		String sql = "INSERT IGNORE INTO Utxos (wallet_id, " + UTXO_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

		List<Object[]> bindParamValues = new ArrayList<>(utxos.size());
		for (UtxoData utxo : utxos)
			bindParamValues.add(new Object[] { utxo.getWalletId(), utxo.getTxid(), utxo.getVout(), utxo.getAddress(), utxo.getAmount(),
					utxo.getScriptPubKey(), utxo.getConfirmations(), utxo.getBlockHeight(), utxo.isSpent(), utxo.isFrozen() });

		try {
			return this.repository.executeCheckedBatchUpdate(sql, bindParamValues);
		} catch (SQLException e) {
			throw new DataException("Unable to save UTXOs into repository", e);
		}
	}

	@Override
	public int markSpent(String walletId, Collection<String> utxoKeys) throws DataException {
		String sql = "UPDATE Utxos SET spent = TRUE WHERE wallet_id = ? AND txid = ? AND vout = ? AND spent = FALSE";

		List<Object[]> bindParamValues = new ArrayList<>(utxoKeys.size());
		for (String utxoKey : utxoKeys) {
			Object[] keyParts = HSQLDBRepository.splitUtxoKey(utxoKey);
			bindParamValues.add(new Object[] { walletId, keyParts[0], keyParts[1] });
		}

		try {
			return this.repository.executeCheckedBatchUpdate(sql, bindParamValues);
		} catch (SQLException e) {
			throw new DataException("Unable to mark UTXOs as spent in repository", e);
		}
	}

	@Override
	public void updateConfirmations(List<UtxoData> utxos) throws DataException {
		String sql = "UPDATE Utxos SET confirmations = ?, block_height = ? WHERE wallet_id = ? AND txid = ? AND vout = ?";

		List<Object[]> bindParamValues = new ArrayList<>(utxos.size());
		for (UtxoData utxo : utxos)
			bindParamValues.add(new Object[] { utxo.getConfirmations(), utxo.getBlockHeight(), utxo.getWalletId(), utxo.getTxid(), utxo.getVout() });

		try {
			for (List<Object[]> chunk : Lists.partition(bindParamValues, 500))
				this.repository.executeCheckedBatchUpdate(sql, chunk);
		} catch (SQLException e) {
			throw new DataException("Unable to update UTXO confirmations in repository", e);
		}
	}

	@Override
	public int setFrozen(String walletId, String txid, int vout, boolean frozen) throws DataException {
		try {
			return this.repository.executeCheckedUpdate("UPDATE Utxos SET frozen = ? WHERE wallet_id = ? AND txid = ? AND vout = ?",
					frozen, walletId, txid, vout);
		} catch (SQLException e) {
			throw new DataException("Unable to update UTXO frozen flag in repository", e);
		}
	}

}
