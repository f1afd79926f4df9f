package org.javai.text2sql.schema;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link SchemaStore} for tests and single-instance deployments.
 */
public class InMemorySchemaStore implements SchemaStore {

	private final ConcurrentHashMap<String, StoredSchema> schemas = new ConcurrentHashMap<>();

	@Override
	public Optional<StoredSchema> findByConnectionId(String connectionId) {
		if (connectionId == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(schemas.get(connectionId));
	}

	@Override
	public void save(StoredSchema schema) {
		Objects.requireNonNull(schema, "schema must not be null");
		schemas.put(schema.connectionId(), schema);
	}

	@Override
	public void delete(String connectionId) {
		if (connectionId != null) {
			schemas.remove(connectionId);
		}
	}
}
