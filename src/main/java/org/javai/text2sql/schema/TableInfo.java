package org.javai.text2sql.schema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A trained table of a connection's schema.
 *
 * <p>Identity is the table name, compared case-insensitively within a connection. Lists are
 * copied on construction, so instances are immutable; edits produce new instances via the
 * {@code with...} methods.</p>
 *
 * @param tableName table name
 * @param description free-text description (may be null)
 * @param columns ordered columns
 * @param foreignKeys foreign keys declared on this table
 */
public record TableInfo(
		String tableName,
		String description,
		List<ColumnInfo> columns,
		List<ForeignKeyInfo> foreignKeys
) {

	public TableInfo {
		if (tableName == null || tableName.isBlank()) {
			throw new IllegalArgumentException("tableName must not be blank");
		}
		columns = columns != null ? List.copyOf(columns) : List.of();
		foreignKeys = foreignKeys != null ? List.copyOf(foreignKeys) : List.of();
	}

	public static TableInfo of(String tableName, List<ColumnInfo> columns, List<ForeignKeyInfo> foreignKeys) {
		return new TableInfo(tableName, null, columns, foreignKeys);
	}

	/**
	 * Returns true if the given name identifies this table. Comparison is case-insensitive.
	 */
	public boolean hasName(String candidate) {
		return candidate != null && tableName.equalsIgnoreCase(candidate);
	}

	/**
	 * Returns true if any foreign key of this table references the given table.
	 */
	public boolean references(String otherTable) {
		return foreignKeys.stream().anyMatch(fk -> fk.references(otherTable));
	}

	public boolean hasPrimaryKey() {
		return columns.stream().anyMatch(ColumnInfo::primaryKey);
	}

	public List<ColumnInfo> enabledColumns() {
		return columns.stream().filter(ColumnInfo::enabled).toList();
	}

	public Optional<ColumnInfo> findColumn(String columnName) {
		return columns.stream().filter(c -> c.hasName(columnName)).findFirst();
	}

	/**
	 * Returns a copy of this table that only carries enabled columns.
	 */
	public TableInfo withoutDisabledColumns() {
		List<ColumnInfo> enabled = enabledColumns();
		if (enabled.size() == columns.size()) {
			return this;
		}
		return new TableInfo(tableName, description, enabled, foreignKeys);
	}

	public TableInfo withDescription(String newDescription) {
		return new TableInfo(tableName, newDescription, columns, foreignKeys);
	}

	public TableInfo withColumns(List<ColumnInfo> newColumns) {
		return new TableInfo(tableName, description, newColumns, foreignKeys);
	}

	/**
	 * Finds a table by name in the given list (case-insensitive).
	 */
	public static Optional<TableInfo> find(List<TableInfo> tables, String tableName) {
		Objects.requireNonNull(tables, "tables must not be null");
		return tables.stream().filter(t -> t.hasName(tableName)).findFirst();
	}
}
