package org.javai.text2sql.schema;

import java.util.Optional;

/**
 * Persistence contract for the serialized schema of a connection, keyed by connection id.
 */
public interface SchemaStore {
	Optional<StoredSchema> findByConnectionId(String connectionId);
	void save(StoredSchema schema);
	void delete(String connectionId);
}
