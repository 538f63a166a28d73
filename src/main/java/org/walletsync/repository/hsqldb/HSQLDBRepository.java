package org.walletsync.repository.hsqldb;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.walletsync.repository.AddressRepository;
import org.walletsync.repository.DataException;
import org.walletsync.repository.DraftRepository;
import org.walletsync.repository.Repository;
import org.walletsync.repository.TransactionRepository;
import org.walletsync.repository.UtxoRepository;
import org.walletsync.repository.WalletRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

public class HSQLDBRepository implements Repository {

	private static final Logger LOGGER = LogManager.getLogger(HSQLDBRepository.class);

	protected Connection connection;

	private final WalletRepository walletRepository = new HSQLDBWalletRepository(this);
	private final AddressRepository addressRepository = new HSQLDBAddressRepository(this);
	private final UtxoRepository utxoRepository = new HSQLDBUtxoRepository(this);
	private final TransactionRepository transactionRepository = new HSQLDBTransactionRepository(this);
	private final DraftRepository draftRepository = new HSQLDBDraftRepository(this);

	// Constructors

	// NB: no visibility modifier so only callable from within same package
	/* package */ HSQLDBRepository(Connection connection) throws DataException {
		this.connection = connection;

		try {
			this.connection.setAutoCommit(false);
		} catch (SQLException e) {
			throw new DataException("Couldn't disable auto-commit on repository connection", e);
		}
	}

	// Getters / setters

	@Override
	public WalletRepository getWalletRepository() {
		return this.walletRepository;
	}

	@Override
	public AddressRepository getAddressRepository() {
		return this.addressRepository;
	}

	@Override
	public UtxoRepository getUtxoRepository() {
		return this.utxoRepository;
	}

	@Override
	public TransactionRepository getTransactionRepository() {
		return this.transactionRepository;
	}

	@Override
	public DraftRepository getDraftRepository() {
		return this.draftRepository;
	}

	// Transaction COMMIT / ROLLBACK / savepoints

	@Override
	public void saveChanges() throws DataException {
		try {
			this.connection.commit();
		} catch (SQLException e) {
			throw new DataException("commit error", e);
		}
	}

	@Override
	public void discardChanges() throws DataException {
		try {
			this.connection.rollback();
		} catch (SQLException e) {
			throw new DataException("rollback error", e);
		}
	}

	// Close / backup / rebuild / restore

	@Override
	public void close() throws DataException {
		if (this.connection == null)
			return;

		try {
			// Anything not explicitly saved is discarded
			this.connection.rollback();

			// Give connection back to the pool
			this.connection.close();
			this.connection = null;
		} catch (SQLException e) {
			throw new DataException("Error while closing repository", e);
		}
	}

	// SQL statements, etc.

	/**
	 * Execute SQL and return ResultSet with but added checking.
	 * <p>
	 * <b>Note: calls ResultSet.next()</b> therefore returned ResultSet is already pointing to first row.
	 *
	 * @param sql
	 * @param objects
	 * @return ResultSet, or null if there are no found rows
	 * @throws SQLException
	 */
	public ResultSet checkedExecute(String sql, Object... objects) throws SQLException {
		PreparedStatement preparedStatement = this.connection.prepareStatement(sql);

		// Close the PreparedStatement when the ResultSet is closed otherwise there's a potential resource leak.
		// We can't use try-with-resources here as closing the PreparedStatement on return would also prematurely close the ResultSet.
		preparedStatement.closeOnCompletion();

		long beforeQuery = System.currentTimeMillis();

		ResultSet resultSet = this.checkedExecuteResultSet(preparedStatement, objects);

		long queryTime = System.currentTimeMillis() - beforeQuery;
		if (LOGGER.isTraceEnabled())
			LOGGER.trace("[{}ms] {}", queryTime, sql);

		return resultSet;
	}

	/**
	 * Bind objects to placeholders in prepared statement.
	 * <p>
	 * Null objects are bound as SQL NULL.
	 */
	private void bindStatementParams(PreparedStatement preparedStatement, Object... objects) throws SQLException {
		for (int i = 0; i < objects.length; ++i) {
			// Special treatment for nulls, as not every JDBC type accepts a plain null
			if (objects[i] == null)
				preparedStatement.setNull(i + 1, Types.NULL);
			else
				preparedStatement.setObject(i + 1, objects[i]);
		}
	}

	/**
	 * Execute PreparedStatement and return ResultSet with but added checking.
	 * <p>
	 * <b>Note: calls ResultSet.next()</b> therefore returned ResultSet is already pointing to first row.
	 *
	 * @return ResultSet, or null if there are no found rows
	 */
	private ResultSet checkedExecuteResultSet(PreparedStatement preparedStatement, Object... objects) throws SQLException {
		bindStatementParams(preparedStatement, objects);

		if (!preparedStatement.execute())
			throw new SQLException("Fetching from database produced no results");

		ResultSet resultSet = preparedStatement.getResultSet();
		if (resultSet == null)
			throw new SQLException("Fetching results from database produced no ResultSet");

		if (!resultSet.next()) {
			resultSet.close();
			return null;
		}

		return resultSet;
	}

	/**
	 * Execute PreparedStatement and return changed row count.
	 *
	 * @param sql
	 * @param objects
	 * @return number of changed rows
	 * @throws SQLException
	 */
	public int executeCheckedUpdate(String sql, Object... objects) throws SQLException {
		try (PreparedStatement preparedStatement = this.connection.prepareStatement(sql)) {
			bindStatementParams(preparedStatement, objects);

			if (preparedStatement.execute())
				throw new SQLException("Database produced results, not row count");

			int rowCount = preparedStatement.getUpdateCount();
			if (rowCount == -1)
				throw new SQLException("Database returned invalid row count");

			return rowCount;
		}
	}

	/**
	 * Execute same SQL once per entry in <tt>batchedObjects</tt>, as one JDBC batch.
	 *
	 * @return total number of changed rows
	 * @throws SQLException
	 */
	public int executeCheckedBatchUpdate(String sql, List<Object[]> batchedObjects) throws SQLException {
		// Nothing to do?
		if (batchedObjects == null || batchedObjects.isEmpty())
			return 0;

		try (PreparedStatement preparedStatement = this.connection.prepareStatement(sql)) {
			for (Object[] objects : batchedObjects) {
				this.bindStatementParams(preparedStatement, objects);
				preparedStatement.addBatch();
			}

			int[] updateCounts = preparedStatement.executeBatch();

			int totalCount = 0;
			for (int updateCount : updateCounts) {
				if (updateCount == PreparedStatement.EXECUTE_FAILED)
					throw new SQLException("Database returned invalid row count");

				// Driver might not know how many rows were affected
				if (updateCount > 0)
					totalCount += updateCount;
			}

			return totalCount;
		}
	}

	/**
	 * Delete rows from database table.
	 *
	 * @param tableName
	 * @param whereClause
	 * @param objects
	 * @return number of deleted rows
	 * @throws SQLException
	 */
	public int delete(String tableName, String whereClause, Object... objects) throws SQLException {
		StringBuilder sql = new StringBuilder(256);
		sql.append("DELETE FROM ");
		sql.append(tableName);
		sql.append(" WHERE ");
		sql.append(whereClause);

		return this.executeCheckedUpdate(sql.toString(), objects);
	}

	/** Appends "?, ?, ..." placeholders, one per value, to <tt>sql</tt>. */
	public static void appendPlaceholders(StringBuilder sql, int count) {
		sql.append(String.join(", ", Collections.nCopies(count, "?")));
	}

	/** Returns prefix objects followed by collection values, for binding to an IN list. */
	public static Object[] bindValues(Collection<?> values, Object... prefix) {
		Object[] objects = new Object[prefix.length + values.size()];
		System.arraycopy(prefix, 0, objects, 0, prefix.length);

		int i = prefix.length;
		for (Object value : values)
			objects[i++] = value;

		return objects;
	}

	/** Converts nullable Integer column, read via ResultSet.getInt, into Integer. */
	public static Integer getNullableInteger(ResultSet resultSet, int columnIndex) throws SQLException {
		int value = resultSet.getInt(columnIndex);
		if (value == 0 && resultSet.wasNull())
			return null;

		return value;
	}

	/** Converts nullable BIGINT column into Long. */
	public static Long getNullableLong(ResultSet resultSet, int columnIndex) throws SQLException {
		long value = resultSet.getLong(columnIndex);
		if (value == 0 && resultSet.wasNull())
			return null;

		return value;
	}

	/** Splits "txid:vout" key into its parts. */
	public static Object[] splitUtxoKey(String utxoKey) throws DataException {
		int separator = utxoKey.lastIndexOf(':');
		if (separator <= 0 || separator == utxoKey.length() - 1)
			throw new DataException(String.format("Malformed UTXO key \"%s\"", utxoKey));

		try {
			return new Object[] { utxoKey.substring(0, separator), Integer.parseInt(utxoKey.substring(separator + 1)) };
		} catch (NumberFormatException e) {
			throw new DataException(String.format("Malformed UTXO key \"%s\"", utxoKey), e);
		}
	}

}
