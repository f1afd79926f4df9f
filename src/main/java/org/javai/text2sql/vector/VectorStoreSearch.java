package org.javai.text2sql.vector;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

/**
 * {@link VectorSearch} backed by a Spring AI {@link VectorStore}.
 *
 * <p>A single store serves every collection; the collection is written into each document's
 * metadata under {@value #COLLECTION_KEY} and applied as a filter expression on search.</p>
 */
public class VectorStoreSearch implements VectorSearch {

	private static final Logger logger = LoggerFactory.getLogger(VectorStoreSearch.class);

	static final String COLLECTION_KEY = "collection";

	private final VectorStore vectorStore;

	public VectorStoreSearch(VectorStore vectorStore) {
		this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore must not be null");
	}

	@Override
	public void save(String collection, String id, String text) {
		vectorStore.add(List.of(new Document(id, text, Map.of(COLLECTION_KEY, collection))));
		logger.debug("Saved item {} to collection {}", id, collection);
	}

	@Override
	public void remove(String collection, String id) {
		vectorStore.delete(List.of(id));
		logger.debug("Removed item {} from collection {}", id, collection);
	}

	@Override
	public List<VectorHit> search(String collection, String query, int limit, double minScore) {
		SearchRequest request = SearchRequest.builder()
				.query(query)
				.topK(limit)
				.similarityThreshold(minScore)
				.filterExpression("%s == '%s'".formatted(COLLECTION_KEY, escape(collection)))
				.build();
		List<Document> documents = vectorStore.similaritySearch(request);
		if (documents == null) {
			return List.of();
		}
		return documents.stream()
				.map(doc -> new VectorHit(doc.getText(), doc.getScore() != null ? doc.getScore() : 0.0))
				.sorted((a, b) -> Double.compare(b.score(), a.score()))
				.toList();
	}

	private static String escape(String value) {
		return value.replace("'", "\\'");
	}
}
