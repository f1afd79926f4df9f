package org.javai.text2sql.linking;

import java.util.List;

/**
 * Explains the inclusion of one table in a {@link SchemaLinkingResult}.
 *
 * @param tableName the included table
 * @param matchType how it was found
 * @param relevanceScore search score for semantic matches, null otherwise
 * @param threshold threshold the semantic match was found at, null otherwise
 * @param relatedTables for expansion matches, the tables that caused the inclusion
 */
public record SchemaMatchDetail(
		String tableName,
		MatchType matchType,
		Double relevanceScore,
		Double threshold,
		List<String> relatedTables
) {

	public SchemaMatchDetail {
		relatedTables = relatedTables != null ? List.copyOf(relatedTables) : List.of();
	}

	public static SchemaMatchDetail semantic(String tableName, double relevanceScore, double threshold) {
		return new SchemaMatchDetail(tableName, MatchType.SEMANTIC, relevanceScore, threshold, List.of());
	}

	public static SchemaMatchDetail related(String tableName, MatchType matchType, List<String> relatedTables) {
		return new SchemaMatchDetail(tableName, matchType, null, null, relatedTables);
	}

	public String reason() {
		return switch (matchType) {
			case SEMANTIC -> "table %s is semantically similar to the question (score %.2f at threshold %.1f)"
					.formatted(tableName, relevanceScore, threshold);
			case REFERENCED_TABLE -> "table %s is referenced by %s".formatted(tableName, String.join(", ", relatedTables));
			case REFERENCING_TABLE -> "table %s references %s".formatted(tableName, String.join(", ", relatedTables));
			case JUNCTION_TABLE -> "table %s links %s".formatted(tableName, String.join(", ", relatedTables));
		};
	}
}
