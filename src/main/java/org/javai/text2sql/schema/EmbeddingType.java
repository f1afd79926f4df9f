package org.javai.text2sql.schema;

/**
 * Granularity of a retrievable schema unit.
 *
 * <p>Training currently produces {@link #TABLE} embeddings only; schema linking ignores hits of
 * any other type.</p>
 */
public enum EmbeddingType {
	TABLE,
	COLUMN,
	RELATION
}
