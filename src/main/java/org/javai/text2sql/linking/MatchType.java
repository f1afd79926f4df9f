package org.javai.text2sql.linking;

/**
 * Why a table ended up in a linking result.
 */
public enum MatchType {
	/** Found by similarity search. */
	SEMANTIC,
	/** Referenced by a foreign key of a matched table. */
	REFERENCED_TABLE,
	/** Declares a foreign key to a matched table. */
	REFERENCING_TABLE,
	/** Bridges two or more tables already in the result. */
	JUNCTION_TABLE
}
