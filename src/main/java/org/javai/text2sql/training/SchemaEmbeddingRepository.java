package org.javai.text2sql.training;

import java.util.List;
import org.javai.text2sql.schema.SchemaEmbedding;

/**
 * Bookkeeping of the embeddings saved to the vector index, so stale items can be found and
 * removed before a table is retrained.
 */
public interface SchemaEmbeddingRepository {

	List<SchemaEmbedding> findByConnectionId(String connectionId);

	/**
	 * Table name comparison is case-insensitive.
	 */
	List<SchemaEmbedding> findByTable(String connectionId, String tableName);

	void save(SchemaEmbedding embedding);

	void deleteByConnectionId(String connectionId);

	void deleteByTable(String connectionId, String tableName);
}
