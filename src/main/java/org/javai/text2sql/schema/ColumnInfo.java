package org.javai.text2sql.schema;

/**
 * A column of a trained table.
 *
 * <p>Disabled columns stay in the stored schema but are left out of the text that is embedded
 * for retrieval and of the tables returned by schema linking.</p>
 *
 * @param columnName column name
 * @param dataType declared SQL data type (e.g. "bigint", "varchar")
 * @param nullable whether the column accepts nulls
 * @param primaryKey whether the column is part of the primary key
 * @param description free-text description (may be null)
 * @param enabled whether the column takes part in retrieval; absent values default to {@code true}
 */
public record ColumnInfo(
		String columnName,
		String dataType,
		boolean nullable,
		boolean primaryKey,
		String description,
		Boolean enabled
) {

	public ColumnInfo {
		if (columnName == null || columnName.isBlank()) {
			throw new IllegalArgumentException("columnName must not be blank");
		}
		dataType = dataType != null ? dataType : "";
		enabled = enabled == null || enabled;
	}

	/**
	 * Creates an enabled, nullable, non-key column without a description.
	 */
	public static ColumnInfo of(String columnName, String dataType) {
		return new ColumnInfo(columnName, dataType, true, false, null, true);
	}

	/**
	 * Creates an enabled primary-key column.
	 */
	public static ColumnInfo primaryKeyColumn(String columnName, String dataType) {
		return new ColumnInfo(columnName, dataType, false, true, null, true);
	}

	public boolean hasName(String candidate) {
		return candidate != null && columnName.equalsIgnoreCase(candidate);
	}

	public ColumnInfo withDescription(String newDescription) {
		return new ColumnInfo(columnName, dataType, nullable, primaryKey, newDescription, enabled);
	}

	public ColumnInfo withEnabled(boolean newEnabled) {
		return new ColumnInfo(columnName, dataType, nullable, primaryKey, description, newEnabled);
	}
}
