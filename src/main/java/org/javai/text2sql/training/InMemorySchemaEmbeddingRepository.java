package org.javai.text2sql.training;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.text2sql.schema.SchemaEmbedding;

/**
 * In-memory {@link SchemaEmbeddingRepository} keyed by embedding id.
 */
public class InMemorySchemaEmbeddingRepository implements SchemaEmbeddingRepository {

	private final Map<String, SchemaEmbedding> embeddings = new ConcurrentHashMap<>();

	@Override
	public List<SchemaEmbedding> findByConnectionId(String connectionId) {
		return embeddings.values().stream()
				.filter(e -> Objects.equals(e.connectionId(), connectionId))
				.toList();
	}

	@Override
	public List<SchemaEmbedding> findByTable(String connectionId, String tableName) {
		return embeddings.values().stream()
				.filter(e -> Objects.equals(e.connectionId(), connectionId))
				.filter(e -> e.tableName() != null && e.tableName().equalsIgnoreCase(tableName))
				.toList();
	}

	@Override
	public void save(SchemaEmbedding embedding) {
		Objects.requireNonNull(embedding, "embedding must not be null");
		embeddings.put(embedding.id(), embedding);
	}

	@Override
	public void deleteByConnectionId(String connectionId) {
		embeddings.values().removeIf(e -> Objects.equals(e.connectionId(), connectionId));
	}

	@Override
	public void deleteByTable(String connectionId, String tableName) {
		embeddings.values().removeIf(e -> Objects.equals(e.connectionId(), connectionId)
				&& e.tableName() != null && e.tableName().equalsIgnoreCase(tableName));
	}
}
