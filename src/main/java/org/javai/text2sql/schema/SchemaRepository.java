package org.javai.text2sql.schema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed access to the stored schema of each connection.
 *
 * <p>The store holds the table list as JSON. Decoding it on every call is wasteful, so the
 * repository keeps the last decoded list per connection together with the JSON it was decoded
 * from. Each read still consults the store; the cached list is reused only while the stored JSON
 * is unchanged, so writes that bypass this repository are picked up on the next read. Writes
 * through {@link #save} refresh the cache directly.</p>
 */
public class SchemaRepository {

	private static final Logger logger = LoggerFactory.getLogger(SchemaRepository.class);

	private final SchemaStore store;
	private final SchemaCodec codec;
	private final ConcurrentHashMap<String, CachedSchema> cache = new ConcurrentHashMap<>();

	public SchemaRepository(SchemaStore store, SchemaCodec codec) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.codec = Objects.requireNonNull(codec, "codec must not be null");
	}

	/**
	 * Returns the tables of a connection.
	 *
	 * @throws SchemaNotFoundException if the connection has no stored schema
	 */
	public List<TableInfo> tables(String connectionId) {
		return findTables(connectionId).orElseThrow(() -> new SchemaNotFoundException(connectionId));
	}

	public Optional<List<TableInfo>> findTables(String connectionId) {
		Optional<StoredSchema> stored = store.findByConnectionId(connectionId);
		if (stored.isEmpty()) {
			cache.remove(connectionId);
			return Optional.empty();
		}
		String content = stored.get().schemaContent();
		CachedSchema cached = cache.get(connectionId);
		if (cached != null && cached.content().equals(content)) {
			return Optional.of(cached.tables());
		}
		List<TableInfo> tables = codec.readTables(content);
		cache.put(connectionId, new CachedSchema(content, tables));
		logger.debug("Decoded schema for connection {} ({} tables)", connectionId, tables.size());
		return Optional.of(tables);
	}

	/**
	 * Inserts or replaces the table list of a connection.
	 */
	public void save(String connectionId, List<TableInfo> tables) {
		Objects.requireNonNull(tables, "tables must not be null");
		String content = codec.writeTables(tables);
		StoredSchema schema = store.findByConnectionId(connectionId)
				.map(existing -> existing.withContent(content))
				.orElseGet(() -> StoredSchema.create(connectionId, content));
		store.save(schema);
		cache.put(connectionId, new CachedSchema(content, List.copyOf(tables)));
	}

	public void delete(String connectionId) {
		store.delete(connectionId);
		cache.remove(connectionId);
	}

	/**
	 * Serializes tables in the same format the store uses, e.g. for prompting.
	 */
	public String toJson(List<TableInfo> tables) {
		return codec.writeTables(tables);
	}

	private record CachedSchema(String content, List<TableInfo> tables) {
	}
}
