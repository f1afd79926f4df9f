package org.javai.text2sql.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

/**
 * One retrievable unit of a connection's schema.
 *
 * <p>The record is serialized to JSON and saved as the text of a vector-index item; search hits
 * are parsed back into this record to recover the {@code (connectionId, tableName)} back-reference.</p>
 *
 * @param id vector-index item id ({@code connectionId + "_" + tableName} for tables)
 * @param connectionId owning connection
 * @param tableName table the unit describes
 * @param columnName column the unit describes, null for table units
 * @param description generated description text that is embedded
 * @param embeddingType granularity of the unit
 * @param createdAt when the unit was (re)trained
 */
public record SchemaEmbedding(
		String id,
		String connectionId,
		String tableName,
		String columnName,
		String description,
		EmbeddingType embeddingType,
		Instant createdAt
) {

	public static SchemaEmbedding forTable(String connectionId, String tableName, String description) {
		return new SchemaEmbedding(
				tableItemId(connectionId, tableName),
				connectionId,
				tableName,
				null,
				description,
				EmbeddingType.TABLE,
				Instant.now());
	}

	public static String tableItemId(String connectionId, String tableName) {
		return connectionId + "_" + tableName;
	}

	@JsonIgnore
	public boolean isTable() {
		return embeddingType == EmbeddingType.TABLE;
	}
}
