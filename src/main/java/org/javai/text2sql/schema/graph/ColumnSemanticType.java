package org.javai.text2sql.schema.graph;

/**
 * Semantic role of a column, inferred from its name and declared data type.
 */
public enum ColumnSemanticType {
	PRIMARY_KEY("primary_key"),
	FOREIGN_KEY_CANDIDATE("foreign_key_candidate"),
	NAME_FIELD("name_field"),
	TEMPORAL_FIELD("temporal_field"),
	MONETARY_FIELD("monetary_field"),
	NUMERIC_FIELD("numeric_field"),
	GENERAL_FIELD("general_field");

	private final String tag;

	ColumnSemanticType(String tag) {
		this.tag = tag;
	}

	public String tag() {
		return tag;
	}
}
