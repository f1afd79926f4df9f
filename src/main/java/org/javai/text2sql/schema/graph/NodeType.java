package org.javai.text2sql.schema.graph;

public enum NodeType {
	TABLE,
	COLUMN
}
