package org.javai.text2sql.conversation;

/**
 * How a question relates to the one before it.
 */
public enum FollowupQueryType {
	NEW_QUERY,
	FILTER_REFINEMENT,
	AGGREGATION_CHANGE,
	COLUMN_EXPANSION,
	SORTING_CHANGE,
	PRONOUN_REFERENCE,
	COMPARISON
}
