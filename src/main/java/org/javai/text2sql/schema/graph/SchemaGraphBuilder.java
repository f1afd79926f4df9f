package org.javai.text2sql.schema.graph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.text2sql.schema.ColumnInfo;
import org.javai.text2sql.schema.ForeignKeyInfo;
import org.javai.text2sql.schema.TableInfo;

/**
 * Turns a flat table list into a {@link SchemaGraph} with inferred table types and column
 * semantic tags.
 *
 * <h2>Table type (first rule that applies)</h2>
 * <ol>
 *   <li>name contains "log" or "audit": {@link TableType#LOG_TABLE}</li>
 *   <li>name contains "config" or "setting": {@link TableType#CONFIG_TABLE}</li>
 *   <li>at least 2 foreign keys and at most 5 columns: {@link TableType#JUNCTION_TABLE}</li>
 *   <li>more than 20 columns: {@link TableType#FACT_TABLE}</li>
 *   <li>otherwise {@link TableType#DIMENSION_TABLE}</li>
 * </ol>
 */
public class SchemaGraphBuilder {

	public SchemaGraph build(List<TableInfo> tables) {
		Objects.requireNonNull(tables, "tables must not be null");
		SchemaGraph graph = new SchemaGraph();

		for (TableInfo table : tables) {
			graph.addTableNode(table.tableName(), tableFeatures(table));
			for (ColumnInfo column : table.columns()) {
				graph.addColumnNode(columnId(table.tableName(), column.columnName()),
						columnFeatures(column), table.tableName());
			}
		}

		// Edges point at the referenced column even when that table is not part of the list
		for (TableInfo table : tables) {
			for (ForeignKeyInfo fk : table.foreignKeys()) {
				graph.addForeignKeyEdge(
						columnId(table.tableName(), fk.columnName()),
						columnId(fk.referencedTableName(), fk.referencedColumnName()),
						fk.foreignKeyName());
			}
		}
		return graph;
	}

	public TableType inferTableType(TableInfo table) {
		String name = table.tableName().toLowerCase(Locale.ROOT);
		if (name.contains("log") || name.contains("audit")) {
			return TableType.LOG_TABLE;
		}
		if (name.contains("config") || name.contains("setting")) {
			return TableType.CONFIG_TABLE;
		}
		if (table.foreignKeys().size() >= 2 && table.columns().size() <= 5) {
			return TableType.JUNCTION_TABLE;
		}
		if (table.columns().size() > 20) {
			return TableType.FACT_TABLE;
		}
		return TableType.DIMENSION_TABLE;
	}

	public ColumnSemanticType inferSemanticType(ColumnInfo column) {
		String name = column.columnName().toLowerCase(Locale.ROOT);
		String dataType = column.dataType().toLowerCase(Locale.ROOT);

		if (column.primaryKey()) {
			return ColumnSemanticType.PRIMARY_KEY;
		}
		if (looksLikeIdentifier(column.columnName())) {
			return ColumnSemanticType.FOREIGN_KEY_CANDIDATE;
		}
		if (name.contains("name") || name.contains("title")) {
			return ColumnSemanticType.NAME_FIELD;
		}
		if (name.contains("date") || name.contains("time") || dataType.contains("date") || dataType.contains("time")) {
			return ColumnSemanticType.TEMPORAL_FIELD;
		}
		if (name.contains("amount") || name.contains("price") || name.contains("cost") || dataType.contains("money")) {
			return ColumnSemanticType.MONETARY_FIELD;
		}
		if (name.contains("count") || name.contains("number") || name.contains("qty") || isNumericType(dataType)) {
			return ColumnSemanticType.NUMERIC_FIELD;
		}
		return ColumnSemanticType.GENERAL_FIELD;
	}

	private Map<String, Object> tableFeatures(TableInfo table) {
		Map<String, Object> features = new LinkedHashMap<>();
		features.put("name", table.tableName());
		features.put("description", table.description() != null ? table.description() : "");
		features.put("column_count", table.columns().size());
		features.put("foreign_key_count", table.foreignKeys().size());
		features.put("has_primary_key", table.hasPrimaryKey());
		features.put("table_type", inferTableType(table).tag());
		return features;
	}

	private Map<String, Object> columnFeatures(ColumnInfo column) {
		Map<String, Object> features = new LinkedHashMap<>();
		features.put("name", column.columnName());
		features.put("data_type", column.dataType());
		features.put("is_primary_key", column.primaryKey());
		features.put("is_nullable", column.nullable());
		features.put("description", column.description() != null ? column.description() : "");
		features.put("semantic_type", inferSemanticType(column).tag());
		return features;
	}

	/**
	 * "id", "customer_id" and "customerId" qualify; "paid" and "width" do not.
	 */
	private static boolean looksLikeIdentifier(String columnName) {
		String lower = columnName.toLowerCase(Locale.ROOT);
		return lower.equals("id") || lower.endsWith("_id") || columnName.endsWith("Id") || columnName.endsWith("ID");
	}

	private static boolean isNumericType(String dataType) {
		return dataType.contains("int") || dataType.contains("decimal") || dataType.contains("numeric")
				|| dataType.contains("float") || dataType.contains("double") || dataType.contains("real");
	}

	static String columnId(String tableName, String columnName) {
		return tableName + "." + columnName;
	}
}
