package org.javai.text2sql.vector;

/**
 * A single similarity-search hit.
 *
 * @param text the stored item text
 * @param score relevance score, higher is more similar
 */
public record VectorHit(String text, double score) {
}
