package org.walletsync.repository.hsqldb;

import org.walletsync.data.wallet.DraftTransactionData;
import org.walletsync.data.wallet.UtxoData;
import org.walletsync.repository.DataException;
import org.walletsync.repository.DraftRepository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class HSQLDBDraftRepository implements DraftRepository {

	private static final String DRAFT_COLUMNS = "draft_id, wallet_id, label, recipient, amount, fee_rate, created_when";

	protected HSQLDBRepository repository;

	public HSQLDBDraftRepository(HSQLDBRepository repository) {
		this.repository = repository;
	}

	private List<DraftTransactionData> getDrafts(String criteria, Object... objects) throws DataException {
		String sql = "SELECT " + DRAFT_COLUMNS + " FROM DraftTransactions WHERE " + criteria + " ORDER BY created_when, draft_id";

		List<DraftTransactionData> drafts = new ArrayList<>();

		try (ResultSet resultSet = this.repository.checkedExecute(sql, objects)) {
			if (resultSet == null)
				return drafts;

			do {
				String draftId = resultSet.getString(1);
				String walletId = resultSet.getString(2);
				String label = resultSet.getString(3);
				String recipient = resultSet.getString(4);
				long amount = resultSet.getLong(5);
				double feeRate = resultSet.getDouble(6);
				long created = resultSet.getLong(7);

				drafts.add(new DraftTransactionData(draftId, walletId, label, recipient, amount, feeRate, created, new ArrayList<>()));
			} while (resultSet.next());
		} catch (SQLException e) {
			throw new DataException("Unable to fetch drafts from repository", e);
		}

		for (DraftTransactionData draft : drafts)
			draft.setLockedUtxoKeys(this.getLockedKeys(draft.getDraftId()));

		return drafts;
	}

	private List<String> getLockedKeys(String draftId) throws DataException {
		List<String> keys = new ArrayList<>();

		try (ResultSet resultSet = this.repository.checkedExecute("SELECT txid, vout FROM DraftUtxoLocks WHERE draft_id = ? ORDER BY txid, vout", draftId)) {
			if (resultSet == null)
				return keys;

			do {
				keys.add(UtxoData.buildKey(resultSet.getString(1), resultSet.getInt(2)));
			} while (resultSet.next());

			return keys;
		} catch (SQLException e) {
			throw new DataException("Unable to fetch draft UTXO locks from repository", e);
		}
	}

	@Override
	public DraftTransactionData fromDraftId(String draftId) throws DataException {
		List<DraftTransactionData> drafts = this.getDrafts("draft_id = ?", draftId);
		return drafts.isEmpty() ? null : drafts.get(0);
	}

	@Override
	public List<DraftTransactionData> getDraftsByWallet(String walletId) throws DataException {
		return this.getDrafts("wallet_id = ?", walletId);
	}

	@Override
	public List<DraftTransactionData> getDraftsLockingUtxos(String walletId, Collection<String> utxoKeys) throws DataException {
		Set<String> draftIds = new LinkedHashSet<>();

		String sql = "SELECT draft_id FROM DraftUtxoLocks WHERE wallet_id = ? AND txid = ? AND vout = ?";

		try {
			for (String utxoKey : utxoKeys) {
				Object[] keyParts = HSQLDBRepository.splitUtxoKey(utxoKey);

				try (ResultSet resultSet = this.repository.checkedExecute(sql, walletId, keyParts[0], keyParts[1])) {
					if (resultSet != null)
						draftIds.add(resultSet.getString(1));
				}
			}
		} catch (SQLException e) {
			throw new DataException("Unable to fetch draft UTXO locks from repository", e);
		}

		List<DraftTransactionData> drafts = new ArrayList<>(draftIds.size());
		for (String draftId : draftIds) {
			DraftTransactionData draft = this.fromDraftId(draftId);
			if (draft != null)
				drafts.add(draft);
		}

		return drafts;
	}

	@Override
	public Set<String> getLockedUtxoKeys(String walletId) throws DataException {
		Set<String> keys = new HashSet<>();

		try (ResultSet resultSet = this.repository.checkedExecute("SELECT txid, vout FROM DraftUtxoLocks WHERE wallet_id = ?", walletId)) {
			if (resultSet == null)
				return keys;

			do {
				keys.add(UtxoData.buildKey(resultSet.getString(1), resultSet.getInt(2)));
			} while (resultSet.next());

			return keys;
		} catch (SQLException e) {
			throw new DataException("Unable to fetch locked UTXOs from repository", e);
		}
	}

	@Override
	public void save(DraftTransactionData draftData) throws DataException {
		HSQLDBSaver saveHelper = new HSQLDBSaver("DraftTransactions");

		saveHelper.bindKey("draft_id", draftData.getDraftId()).bind("wallet_id", draftData.getWalletId())
				.bind("label", draftData.getLabel()).bind("recipient", draftData.getRecipient())
				.bind("amount", draftData.getAmount()).bind("fee_rate", draftData.getFeeRate())
				.bind("created_when", draftData.getCreated());

		List<Object[]> lockValues = new ArrayList<>();
		for (String utxoKey : draftData.getLockedUtxoKeys()) {
			Object[] keyParts = HSQLDBRepository.splitUtxoKey(utxoKey);
			lockValues.add(new Object[] { draftData.getDraftId(), draftData.getWalletId(), keyParts[0], keyParts[1] });
		}

		try {
			saveHelper.execute(this.repository);

			// Replace any previous locks
			this.repository.delete("DraftUtxoLocks", "draft_id = ?", draftData.getDraftId());
			this.repository.executeCheckedBatchUpdate("INSERT INTO DraftUtxoLocks (draft_id, wallet_id, txid, vout) VALUES (?, ?, ?, ?)", lockValues);
		} catch (SQLException e) {
			throw new DataException("Unable to save draft into repository", e);
		}
	}

	@Override
	public int delete(Collection<String> draftIds) throws DataException {
		int deletedCount = 0;

		try {
			for (String draftId : draftIds)
				deletedCount += this.repository.delete("DraftTransactions", "draft_id = ?", draftId);
		} catch (SQLException e) {
			throw new DataException("Unable to delete drafts from repository", e);
		}

		return deletedCount;
	}

}
