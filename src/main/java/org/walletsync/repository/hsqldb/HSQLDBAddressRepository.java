package org.walletsync.repository.hsqldb;

import com.google.common.collect.Lists;
import org.walletsync.data.wallet.AddressData;
import org.walletsync.repository.AddressRepository;
import org.walletsync.repository.DataException;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class HSQLDBAddressRepository implements AddressRepository {

	/** Maximum number of values bound into a single IN (...) list. */
	private static final int IN_LIST_LIMIT = 1000;

	protected HSQLDBRepository repository;

	public HSQLDBAddressRepository(HSQLDBRepository repository) {
		this.repository = repository;
	}

	@Override
	public List<AddressData> getAddressesByWallet(String walletId) throws DataException {
		String sql = "SELECT address, derivation_path, chain, address_index, used FROM WalletAddresses "
				+ "WHERE wallet_id = ? ORDER BY chain, address_index";

		List<AddressData> addresses = new ArrayList<>();

		try (ResultSet resultSet = this.repository.checkedExecute(sql, walletId)) {
			if (resultSet == null)
				return addresses;

			do {
				String address = resultSet.getString(1);
				String derivationPath = resultSet.getString(2);
				int chain = resultSet.getInt(3);
				int index = resultSet.getInt(4);
				boolean used = resultSet.getBoolean(5);

				addresses.add(new AddressData(walletId, address, derivationPath, chain, index, used));
			} while (resultSet.next());

			return addresses;
		} catch (SQLException e) {
			throw new DataException("Unable to fetch wallet addresses from repository", e);
		}
	}

	@Override
	public AddressData fromAddress(String walletId, String address) throws DataException {
		String sql = "SELECT derivation_path, chain, address_index, used FROM WalletAddresses WHERE wallet_id = ? AND address = ?";

		try (ResultSet resultSet = this.repository.checkedExecute(sql, walletId, address)) {
			if (resultSet == null)
				return null;

			return new AddressData(walletId, address, resultSet.getString(1), resultSet.getInt(2), resultSet.getInt(3), resultSet.getBoolean(4));
		} catch (SQLException e) {
			throw new DataException("Unable to fetch wallet address from repository", e);
		}
	}

	@Override
	public int saveAll(List<AddressData> addresses) throws DataException {
		String sql = "INSERT IGNORE INTO WalletAddresses (wallet_id, address, derivation_path, chain, address_index, used) "
				+ "VALUES (?, ?, ?, ?, ?, ?)";

		List<Object[]> bindParamValues = new ArrayList<>(addresses.size());
		for (AddressData addressData : addresses)
			bindParamValues.add(new Object[] { addressData.getWalletId(), addressData.getAddress(), addressData.getDerivationPath(),
					addressData.getChain(), addressData.getIndex(), addressData.isUsed() });

		try {
			return this.repository.executeCheckedBatchUpdate(sql, bindParamValues);
		} catch (SQLException e) {
			throw new DataException("Unable to save wallet addresses into repository", e);
		}
	}

	@Override
	public int markUsed(String walletId, Collection<String> addresses) throws DataException {
		int updatedCount = 0;

		try {
			for (List<String> chunk : Lists.partition(new ArrayList<>(addresses), IN_LIST_LIMIT)) {
				StringBuilder sql = new StringBuilder(256);
				sql.append("UPDATE WalletAddresses SET used = TRUE WHERE wallet_id = ? AND used = FALSE AND address IN (");
				HSQLDBRepository.appendPlaceholders(sql, chunk.size());
				sql.append(")");

				updatedCount += this.repository.executeCheckedUpdate(sql.toString(), HSQLDBRepository.bindValues(chunk, walletId));
			}
		} catch (SQLException e) {
			throw new DataException("Unable to mark wallet addresses as used in repository", e);
		}

		return updatedCount;
	}

}
