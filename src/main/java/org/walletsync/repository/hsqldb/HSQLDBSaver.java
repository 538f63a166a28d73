package org.walletsync.repository.hsqldb;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Database helper for building, and executing, INSERT INTO ... ON DUPLICATE KEY UPDATE ... statements.
 * <p>
 * Columns, and corresponding values, are bound via close-coupled pairs in a chain thus:
 * <p>
 * {@code HSQLDBSaver saver = new HSQLDBSaver("TableName").bind("column_name", someColumnValue).bind("column2", columnValue2); }<br>
 * {@code saver.execute(repository);}
 * <p>
 * Key columns are given via {@link #bindKey(String, Object)} and are never updated.
 */
public class HSQLDBSaver {

	private final String table;

	private final List<String> columns = new ArrayList<>();
	private final List<Object> objects = new ArrayList<>();
	private final List<String> keyColumns = new ArrayList<>();

	/**
	 * Construct a SaveHelper, using SQL Statement, for given table.
	 *
	 * @param table
	 */
	public HSQLDBSaver(String table) {
		this.table = table;
	}

	/**
	 * Add a key column, and bound value, to be saved when execute() is called.
	 */
	public HSQLDBSaver bindKey(String column, Object value) {
		this.keyColumns.add(column);
		return this.bind(column, value);
	}

	/**
	 * Add a column, and bound value, to be saved when execute() is called.
	 *
	 * @param column
	 * @param value
	 * @return the same HSQLDBSaver object
	 */
	public HSQLDBSaver bind(String column, Object value) {
		this.columns.add(column);
		this.objects.add(value);
		return this;
	}

	/**
	 * Build PreparedStatement using bound column-value pairs then execute it.
	 *
	 * @param repository
	 * @return number of rows inserted or updated
	 * @throws SQLException
	 */
	public int execute(HSQLDBRepository repository) throws SQLException {
		String sql = this.formatInsertWithPlaceholders();

		return repository.executeCheckedUpdate(sql, this.objects.toArray());
	}

	/**
	 * Format table and column names into an INSERT INTO ... SQL statement.
	 * <p>
	 * Full form is:
	 * <p>
	 * INSERT INTO <I>table</I> (<I>column</I>, ...) VALUES (?, ...) ON DUPLICATE KEY UPDATE <I>column</I>=VALUES(<I>column</I>), ...
	 * <p>
	 * Note that HSQLDB needs to put into mySQL compatibility mode first via "SET DATABASE SQL SYNTAX MYS TRUE" or ";sql.syntax_mys=true" in connection URL.
	 *
	 * @return String
	 */
	private String formatInsertWithPlaceholders() {
		StringBuilder output = new StringBuilder(256);
		output.append("INSERT INTO ");
		output.append(this.table);
		output.append(" (");
		output.append(String.join(", ", this.columns));
		output.append(") VALUES (");
		output.append(String.join(", ", Collections.nCopies(this.columns.size(), "?")));
		output.append(")");

		List<String> updates = new ArrayList<>();
		for (String column : this.columns)
			if (!this.keyColumns.contains(column))
				updates.add(column + "=VALUES(" + column + ")");

		if (!updates.isEmpty()) {
			output.append(" ON DUPLICATE KEY UPDATE ");
			output.append(String.join(", ", updates));
		}

		return output.toString();
	}

}
