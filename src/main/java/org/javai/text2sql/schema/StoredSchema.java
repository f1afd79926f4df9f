package org.javai.text2sql.schema;

import java.time.Instant;

/**
 * The serialized table list of a connection as held by a {@link SchemaStore}.
 *
 * @param connectionId owning connection
 * @param schemaContent JSON array of tables
 * @param createdAt first insertion time
 * @param updatedAt last update time (equals {@code createdAt} until the first update)
 */
public record StoredSchema(
		String connectionId,
		String schemaContent,
		Instant createdAt,
		Instant updatedAt
) {

	public StoredSchema {
		if (connectionId == null || connectionId.isBlank()) {
			throw new IllegalArgumentException("connectionId must not be blank");
		}
		if (schemaContent == null) {
			throw new IllegalArgumentException("schemaContent must not be null");
		}
	}

	public static StoredSchema create(String connectionId, String schemaContent) {
		Instant now = Instant.now();
		return new StoredSchema(connectionId, schemaContent, now, now);
	}

	public StoredSchema withContent(String newContent) {
		return new StoredSchema(connectionId, newContent, createdAt, Instant.now());
	}
}
