package org.javai.text2sql.schema.graph;

public enum EdgeType {
	/** Table to one of its columns. */
	CONTAINS,
	/** Foreign key column to the referenced column. */
	FOREIGN_KEY
}
