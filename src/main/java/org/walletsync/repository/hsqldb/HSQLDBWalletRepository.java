package org.walletsync.repository.hsqldb;

import org.walletsync.data.wallet.WalletData;
import org.walletsync.repository.DataException;
import org.walletsync.repository.WalletRepository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

public class HSQLDBWalletRepository implements WalletRepository {

	protected HSQLDBRepository repository;

	public HSQLDBWalletRepository(HSQLDBRepository repository) {
		this.repository = repository;
	}

	@Override
	public WalletData fromWalletId(String walletId) throws DataException {
		String sql = "SELECT name, network, descriptor, script_type FROM Wallets WHERE wallet_id = ?";

		try (ResultSet resultSet = this.repository.checkedExecute(sql, walletId)) {
			if (resultSet == null)
				return null;

			String name = resultSet.getString(1);
			String network = resultSet.getString(2);
			String descriptor = resultSet.getString(3);
			String scriptType = resultSet.getString(4);

			return new WalletData(walletId, name, network, descriptor, scriptType);
		} catch (SQLException e) {
			throw new DataException("Unable to fetch wallet info from repository", e);
		}
	}

	@Override
	public boolean exists(String walletId) throws DataException {
		try (ResultSet resultSet = this.repository.checkedExecute("SELECT TRUE FROM Wallets WHERE wallet_id = ?", walletId)) {
			return resultSet != null;
		} catch (SQLException e) {
			throw new DataException("Unable to check for wallet in repository", e);
		}
	}

	@Override
	public List<WalletData> getAllWallets() throws DataException {
		String sql = "SELECT wallet_id, name, network, descriptor, script_type FROM Wallets ORDER BY wallet_id";

		List<WalletData> wallets = new ArrayList<>();

		try (ResultSet resultSet = this.repository.checkedExecute(sql)) {
			if (resultSet == null)
				return wallets;

			do {
				String walletId = resultSet.getString(1);
				String name = resultSet.getString(2);
				String network = resultSet.getString(3);
				String descriptor = resultSet.getString(4);
				String scriptType = resultSet.getString(5);

				wallets.add(new WalletData(walletId, name, network, descriptor, scriptType));
			} while (resultSet.next());

			return wallets;
		} catch (SQLException e) {
			throw new DataException("Unable to fetch wallets from repository", e);
		}
	}

	@Override
	public void save(WalletData walletData) throws DataException {
		HSQLDBSaver saveHelper = new HSQLDBSaver("Wallets");

		saveHelper.bindKey("wallet_id", walletData.getWalletId()).bind("name", walletData.getName())
				.bind("network", walletData.getNetwork()).bind("descriptor", walletData.getDescriptor())
				.bind("script_type", walletData.getScriptType());

		try {
			saveHelper.execute(this.repository);
		} catch (SQLException e) {
			throw new DataException("Unable to save wallet info into repository", e);
		}
	}

}
