package org.javai.text2sql.schema;

/**
 * Describes a foreign key declared on a table.
 *
 * <p>Used by schema linking to pull related tables into the prompt, and by the schema graph to
 * draw column-to-column edges.</p>
 *
 * @param foreignKeyName the constraint name
 * @param columnName the foreign key column on the owning table
 * @param referencedTableName the referenced table
 * @param referencedColumnName the referenced column (typically the primary key)
 * @param relationship human-readable relationship sentence (may be null)
 */
public record ForeignKeyInfo(
		String foreignKeyName,
		String columnName,
		String referencedTableName,
		String referencedColumnName,
		String relationship
) {

	public ForeignKeyInfo {
		if (referencedTableName == null || referencedTableName.isBlank()) {
			throw new IllegalArgumentException("referencedTableName must not be blank");
		}
	}

	public static ForeignKeyInfo of(String columnName, String referencedTableName, String referencedColumnName) {
		return new ForeignKeyInfo(null, columnName, referencedTableName, referencedColumnName, null);
	}

	/**
	 * Returns true if this key points at the given table (case-insensitive).
	 */
	public boolean references(String tableName) {
		return tableName != null && referencedTableName.equalsIgnoreCase(tableName);
	}

	/**
	 * Creates a join clause suggestion for SQL.
	 *
	 * @param owningTable the table that declares this key
	 * @return a string like "JOIN customers ON orders.customer_id = customers.id"
	 */
	public String joinHint(String owningTable) {
		return "JOIN %s ON %s.%s = %s.%s".formatted(
				referencedTableName, owningTable, columnName, referencedTableName, referencedColumnName);
	}
}
