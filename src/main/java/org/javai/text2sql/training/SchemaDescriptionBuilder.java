package org.javai.text2sql.training;

import org.javai.text2sql.schema.ColumnInfo;
import org.javai.text2sql.schema.ForeignKeyInfo;
import org.javai.text2sql.schema.TableInfo;

/**
 * Builds the text that is embedded for a table. Disabled columns are left out.
 *
 * <p>Example:</p>
 * <pre>
 * Table: orders
 * Description: Customer orders
 * Columns:
 *   - id (bigint, primary key: yes, nullable: no): no description
 *   - customer_id (bigint, primary key: no, nullable: no): buyer
 * Relationships:
 *   - orders.customer_id references customers.id
 * </pre>
 */
public class SchemaDescriptionBuilder {

	private static final String NO_DESCRIPTION = "no description";

	public String describe(TableInfo table) {
		StringBuilder sb = new StringBuilder();
		sb.append("Table: ").append(table.tableName()).append('\n');
		sb.append("Description: ").append(orDefault(table.description())).append('\n');
		sb.append("Columns:\n");
		for (ColumnInfo column : table.enabledColumns()) {
			sb.append("  - ").append(column.columnName())
					.append(" (").append(column.dataType())
					.append(", primary key: ").append(yesNo(column.primaryKey()))
					.append(", nullable: ").append(yesNo(column.nullable()))
					.append("): ").append(orDefault(column.description()))
					.append('\n');
		}
		if (!table.foreignKeys().isEmpty()) {
			sb.append("Relationships:\n");
			for (ForeignKeyInfo fk : table.foreignKeys()) {
				sb.append("  - ").append(table.tableName()).append('.').append(fk.columnName())
						.append(" references ").append(fk.referencedTableName()).append('.')
						.append(fk.referencedColumnName());
				if (fk.relationship() != null && !fk.relationship().isBlank()) {
					sb.append(" (").append(fk.relationship()).append(')');
				}
				sb.append('\n');
			}
		}
		return sb.toString();
	}

	private static String orDefault(String description) {
		return description == null || description.isBlank() ? NO_DESCRIPTION : description;
	}

	private static String yesNo(boolean value) {
		return value ? "yes" : "no";
	}
}
