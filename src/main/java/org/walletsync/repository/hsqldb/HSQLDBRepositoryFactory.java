package org.walletsync.repository.hsqldb;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hsqldb.HsqlException;
import org.hsqldb.error.ErrorCode;
import org.hsqldb.jdbc.JDBCPool;
import org.walletsync.repository.DataException;
import org.walletsync.repository.Repository;
import org.walletsync.repository.RepositoryFactory;
import org.walletsync.settings.Settings;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class HSQLDBRepositoryFactory implements RepositoryFactory {

	private static final Logger LOGGER = LogManager.getLogger(HSQLDBRepositoryFactory.class);

	/** Log getConnection() calls that take longer than this. (ms) */
	private static final long SLOW_CONNECTION_THRESHOLD = 1000L;

	private final String connectionUrl;
	private final JDBCPool connectionPool;

	/**
	 * Constructs new RepositoryFactory using passed <tt>connectionUrl</tt>.
	 * <p>
	 * MySQL syntax and MVCC transaction control are always enabled,
	 * as repositories rely on <tt>INSERT IGNORE</tt> and non-blocking readers.
	 *
	 * @param connectionUrl e.g. <tt>jdbc:hsqldb:file:db/walletsync</tt> or <tt>jdbc:hsqldb:mem:test</tt>
	 * @throws DataException if repository access fails
	 */
	public HSQLDBRepositoryFactory(String connectionUrl) throws DataException {
		this.connectionUrl = connectionUrl + ";sql.syntax_mys=true;hsqldb.tx=mvcc";

		// Check no-one else is accessing database
		try (Connection connection = DriverManager.getConnection(this.connectionUrl, "SA", "")) {
			// We only need to check we can obtain connection. It will be auto-closed.
			HSQLDBDatabaseUpdates.updateDatabase(connection);
		} catch (SQLException e) {
			Throwable cause = e.getCause();
			if (!(cause instanceof HsqlException))
				throw new DataException("Unable to open repository: " + e.getMessage(), e);

			HsqlException he = (HsqlException) cause;
			if (he.getErrorCode() == -ErrorCode.LOCK_FILE_ACQUISITION_FAILURE)
				throw new DataException("Unable to lock repository: " + e.getMessage(), e);

			throw new DataException("Unable to open repository: " + e.getMessage(), e);
		}

		this.connectionPool = new JDBCPool(Settings.getInstance().getRepositoryConnectionPoolSize());
		this.connectionPool.setUrl(this.connectionUrl);
		this.connectionPool.setUser("SA");
		this.connectionPool.setPassword("");
	}

	/** Returns file-based factory using repository path from settings. */
	public static HSQLDBRepositoryFactory fromSettings() throws DataException {
		return new HSQLDBRepositoryFactory("jdbc:hsqldb:file:" + Settings.getInstance().getRepositoryPath() + "/walletsync;create=true");
	}

	@Override
	public Repository getRepository() throws DataException {
		try {
			return new HSQLDBRepository(this.getConnection());
		} catch (SQLException e) {
			throw new DataException("Repository instantiation error", e);
		}
	}

	private Connection getConnection() throws SQLException {
		long before = System.currentTimeMillis();
		Connection connection = this.connectionPool.getConnection();
		long delay = System.currentTimeMillis() - before;

		if (delay > SLOW_CONNECTION_THRESHOLD)
			LOGGER.warn("Fetching repository connection from pool took {}ms", delay);

		return connection;
	}

	@Override
	public void close() throws DataException {
		try {
			// Close all existing connections immediately
			this.connectionPool.close(0);

			// Now that all connections are closed, create a dedicated connection to shut down repository
			try (Connection connection = DriverManager.getConnection(this.connectionUrl, "SA", "");
					Statement statement = connection.createStatement()) {
				statement.execute("SHUTDOWN");
			}
		} catch (SQLException e) {
			throw new DataException("Error during repository shutdown", e);
		}
	}

}
