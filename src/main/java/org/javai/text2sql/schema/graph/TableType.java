package org.javai.text2sql.schema.graph;

/**
 * Coarse structural role of a table, inferred from its name and shape.
 */
public enum TableType {
	LOG_TABLE("log_table"),
	CONFIG_TABLE("config_table"),
	JUNCTION_TABLE("junction_table"),
	FACT_TABLE("fact_table"),
	DIMENSION_TABLE("dimension_table");

	private final String tag;

	TableType(String tag) {
		this.tag = tag;
	}

	/**
	 * @return the tag carried in graph node features (e.g. "junction_table")
	 */
	public String tag() {
		return tag;
	}
}
