package org.walletsync.repository.hsqldb;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public class HSQLDBDatabaseUpdates {

	private static final Logger LOGGER = LogManager.getLogger(HSQLDBDatabaseUpdates.class);

	/**
	 * Apply any incremental changes to database schema.
	 *
	 * @return true if database was non-existent/empty, false otherwise
	 * @throws SQLException
	 */
	public static boolean updateDatabase(Connection connection) throws SQLException {
		final boolean wasPristine = fetchDatabaseVersion(connection) == 0;

		while (databaseUpdating(connection))
			incrementDatabaseVersion(connection);

		LOGGER.debug("Starting with schema version: {}", fetchDatabaseVersion(connection));

		return wasPristine;
	}

	/**
	 * Increment database's schema version.
	 *
	 * @throws SQLException
	 */
	private static void incrementDatabaseVersion(Connection connection) throws SQLException {
		try (Statement stmt = connection.createStatement()) {
			stmt.execute("UPDATE DatabaseInfo SET version = version + 1");
		}
	}

	/**
	 * Fetch current version of database schema.
	 *
	 * @return database version, or 0 if there's no schema yet
	 * @throws SQLException
	 */
	private static int fetchDatabaseVersion(Connection connection) throws SQLException {
		try (Statement stmt = connection.createStatement()) {
			if (stmt.execute("SELECT version FROM DatabaseInfo"))
				try (ResultSet resultSet = stmt.getResultSet()) {
					if (resultSet.next())
						return resultSet.getInt(1);
				}
		} catch (SQLException e) {
			LOGGER.trace("No DatabaseInfo table yet: {}", e.getMessage());
		}

		return 0;
	}

	/**
	 * Incrementally update database schema, returning whether an update happened.
	 *
	 * @return true - if a schema update happened, false otherwise
	 * @throws SQLException
	 */
	private static boolean databaseUpdating(Connection connection) throws SQLException {
		int databaseVersion = fetchDatabaseVersion(connection);

		try (Statement stmt = connection.createStatement()) {

			/*
			 * Every call to this method should only apply a single update,
			 * so the schema version increments one step at a time.
			 */

			switch (databaseVersion) {
				case 0:
					// create from new
					stmt.execute("SET DATABASE DEFAULT TABLE TYPE CACHED");
					stmt.execute("CREATE TABLE DatabaseInfo ( version INTEGER NOT NULL )");
					stmt.execute("INSERT INTO DatabaseInfo VALUES ( 0 )");

					stmt.execute("CREATE TABLE Wallets (wallet_id VARCHAR(64) NOT NULL, name VARCHAR(128), network VARCHAR(16) NOT NULL, "
							+ "descriptor VARCHAR(1024), script_type VARCHAR(32) NOT NULL, "
							+ "PRIMARY KEY (wallet_id))");

					stmt.execute("CREATE TABLE WalletAddresses (wallet_id VARCHAR(64) NOT NULL, address VARCHAR(100) NOT NULL, "
							+ "derivation_path VARCHAR(128), chain INTEGER NOT NULL, address_index INTEGER NOT NULL, used BOOLEAN DEFAULT FALSE NOT NULL, "
							+ "PRIMARY KEY (wallet_id, address), FOREIGN KEY (wallet_id) REFERENCES Wallets (wallet_id) ON DELETE CASCADE)");
					stmt.execute("CREATE INDEX WalletAddressChainIndex ON WalletAddresses (wallet_id, chain, address_index)");
					break;

				case 1:
					// Unspent outputs, kept after spending with spent flag set
					stmt.execute("CREATE TABLE Utxos (wallet_id VARCHAR(64) NOT NULL, txid VARCHAR(64) NOT NULL, vout INTEGER NOT NULL, "
							+ "address VARCHAR(100) NOT NULL, amount BIGINT NOT NULL, script_pubkey VARCHAR(20000), "
							+ "confirmations INTEGER DEFAULT 0 NOT NULL, block_height INTEGER, "
							+ "spent BOOLEAN DEFAULT FALSE NOT NULL, frozen BOOLEAN DEFAULT FALSE NOT NULL, "
							+ "PRIMARY KEY (wallet_id, txid, vout), FOREIGN KEY (wallet_id) REFERENCES Wallets (wallet_id) ON DELETE CASCADE)");
					stmt.execute("CREATE INDEX UtxoAddressIndex ON Utxos (wallet_id, address)");
					break;

				case 2:
					// Wallet transactions, with their inputs & outputs for RBF detection
					stmt.execute("CREATE TABLE WalletTransactions (wallet_id VARCHAR(64) NOT NULL, txid VARCHAR(64) NOT NULL, tx_type VARCHAR(16) NOT NULL, "
							+ "amount BIGINT NOT NULL, fee BIGINT, confirmations INTEGER DEFAULT 0 NOT NULL, block_height INTEGER, block_time BIGINT, "
							+ "address VARCHAR(100), rbf_status VARCHAR(16) NOT NULL, replaced_by_txid VARCHAR(64), "
							+ "PRIMARY KEY (wallet_id, txid, tx_type), FOREIGN KEY (wallet_id) REFERENCES Wallets (wallet_id) ON DELETE CASCADE)");
					stmt.execute("CREATE INDEX WalletTransactionStatusIndex ON WalletTransactions (wallet_id, rbf_status, confirmations)");

					stmt.execute("CREATE TABLE TransactionInputs (wallet_id VARCHAR(64) NOT NULL, txid VARCHAR(64) NOT NULL, input_index INTEGER NOT NULL, "
							+ "prev_txid VARCHAR(64) NOT NULL, prev_vout INTEGER NOT NULL, address VARCHAR(100), amount BIGINT, "
							+ "PRIMARY KEY (wallet_id, txid, input_index), FOREIGN KEY (wallet_id) REFERENCES Wallets (wallet_id) ON DELETE CASCADE)");
					stmt.execute("CREATE INDEX TransactionInputOutpointIndex ON TransactionInputs (wallet_id, prev_txid, prev_vout)");

					stmt.execute("CREATE TABLE TransactionOutputs (wallet_id VARCHAR(64) NOT NULL, txid VARCHAR(64) NOT NULL, output_index INTEGER NOT NULL, "
							+ "address VARCHAR(100), amount BIGINT NOT NULL, script_pubkey VARCHAR(20000), is_mine BOOLEAN DEFAULT FALSE NOT NULL, "
							+ "output_type VARCHAR(16) NOT NULL, "
							+ "PRIMARY KEY (wallet_id, txid, output_index), FOREIGN KEY (wallet_id) REFERENCES Wallets (wallet_id) ON DELETE CASCADE)");
					break;

				case 3:
					// Drafts and the UTXOs they reserve. A UTXO can only be reserved by one draft.
					stmt.execute("CREATE TABLE DraftTransactions (draft_id VARCHAR(64) NOT NULL, wallet_id VARCHAR(64) NOT NULL, label VARCHAR(256), "
							+ "recipient VARCHAR(100) NOT NULL, amount BIGINT NOT NULL, fee_rate DOUBLE NOT NULL, created_when BIGINT NOT NULL, "
							+ "PRIMARY KEY (draft_id), FOREIGN KEY (wallet_id) REFERENCES Wallets (wallet_id) ON DELETE CASCADE)");

					stmt.execute("CREATE TABLE DraftUtxoLocks (draft_id VARCHAR(64) NOT NULL, wallet_id VARCHAR(64) NOT NULL, "
							+ "txid VARCHAR(64) NOT NULL, vout INTEGER NOT NULL, "
							+ "PRIMARY KEY (draft_id, txid, vout), UNIQUE (wallet_id, txid, vout), "
							+ "FOREIGN KEY (draft_id) REFERENCES DraftTransactions (draft_id) ON DELETE CASCADE)");
					break;

				default:
					// nothing to do
					return false;
			}
		}

		// database was updated
		LOGGER.info("Database schema updated to version {}", databaseVersion + 1);
		return true;
	}

}
