package org.javai.text2sql.vector;

import java.util.List;

/**
 * Similarity index holding schema embeddings, partitioned into collections (one per connection).
 */
public interface VectorSearch {

	void save(String collection, String id, String text);

	void remove(String collection, String id);

	/**
	 * Searches a collection.
	 *
	 * @param collection the collection to search
	 * @param query natural-language query
	 * @param limit maximum number of hits
	 * @param minScore minimum relevance score a hit must reach
	 * @return hits ordered by descending score, never null
	 */
	List<VectorHit> search(String collection, String query, int limit, double minScore);
}
