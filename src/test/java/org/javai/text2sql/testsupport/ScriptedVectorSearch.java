package org.javai.text2sql.testsupport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToDoubleBiFunction;
import org.javai.text2sql.vector.VectorHit;
import org.javai.text2sql.vector.VectorSearch;

/**
 * In-memory {@link VectorSearch} whose similarity is supplied by the test.
 *
 * <p>Items are kept per collection in insertion order. A search scores every item of the
 * collection with the scorer, drops those under the threshold and returns the best {@code limit}.
 * Each threshold searched is recorded.</p>
 */
public final class ScriptedVectorSearch implements VectorSearch {

	private final Map<String, Map<String, String>> collections = new ConcurrentHashMap<>();
	private final List<Double> searchedThresholds = Collections.synchronizedList(new ArrayList<>());
	private volatile ToDoubleBiFunction<String, String> scorer = (query, text) -> 0.0;

	/**
	 * @param scorer similarity of (query, item text)
	 */
	public ScriptedVectorSearch scoredBy(ToDoubleBiFunction<String, String> scorer) {
		this.scorer = scorer;
		return this;
	}

	@Override
	public void save(String collection, String id, String text) {
		collections.computeIfAbsent(collection, c -> Collections.synchronizedMap(new LinkedHashMap<>())).put(id, text);
	}

	/**
	 * Adds a raw item, bypassing training.
	 */
	public ScriptedVectorSearch put(String collection, String id, String text) {
		save(collection, id, text);
		return this;
	}

	@Override
	public void remove(String collection, String id) {
		Map<String, String> items = collections.get(collection);
		if (items != null) {
			items.remove(id);
		}
	}

	@Override
	public List<VectorHit> search(String collection, String query, int limit, double minScore) {
		searchedThresholds.add(minScore);
		Map<String, String> items = collections.getOrDefault(collection, Map.of());
		List<VectorHit> hits = new ArrayList<>();
		synchronized (items) {
			for (String text : items.values()) {
				double score = scorer.applyAsDouble(query, text);
				if (score >= minScore) {
					hits.add(new VectorHit(text, score));
				}
			}
		}
		hits.sort((a, b) -> Double.compare(b.score(), a.score()));
		return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
	}

	public Map<String, String> items(String collection) {
		return Map.copyOf(collections.getOrDefault(collection, Map.of()));
	}

	public List<Double> searchedThresholds() {
		return List.copyOf(searchedThresholds);
	}
}
