package org.javai.text2sql.linking;

import java.util.List;
import org.javai.text2sql.schema.TableInfo;

/**
 * Outcome of schema linking.
 *
 * @param tables tables to put in front of SQL generation, never empty unless the schema is
 * @param matchDetails one entry per table explaining its inclusion, empty on fallback
 * @param usedFallback true when nothing matched and the full schema was returned
 * @param schemaJson {@code tables} serialized as JSON, ready for prompting
 * @param thresholdsTried every relevance threshold that was queried, in order
 */
public record SchemaLinkingResult(
		List<TableInfo> tables,
		List<SchemaMatchDetail> matchDetails,
		boolean usedFallback,
		String schemaJson,
		List<Double> thresholdsTried
) {

	public SchemaLinkingResult {
		tables = tables != null ? List.copyOf(tables) : List.of();
		matchDetails = matchDetails != null ? List.copyOf(matchDetails) : List.of();
		thresholdsTried = thresholdsTried != null ? List.copyOf(thresholdsTried) : List.of();
	}

	public List<String> tableNames() {
		return tables.stream().map(TableInfo::tableName).toList();
	}
}
