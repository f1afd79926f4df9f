package org.javai.text2sql.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only copy of a connection's conversation state.
 *
 * @param connectionId the connection
 * @param history turns, oldest first
 * @param referencedEntities every entity mentioned so far, in discovery order
 * @param activeFilters named filters, e.g. {@value ConversationContext#LAST_WHERE} and
 *     {@value ConversationContext#TIME_RANGE}
 */
public record ConversationSnapshot(
		String connectionId,
		List<ConversationTurn> history,
		Set<String> referencedEntities,
		Map<String, String> activeFilters
) {

	public ConversationSnapshot {
		history = history != null ? List.copyOf(history) : List.of();
		referencedEntities = referencedEntities != null
				? Collections.unmodifiableSet(new LinkedHashSet<>(referencedEntities))
				: Set.of();
		activeFilters = activeFilters != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(activeFilters))
				: Map.of();
	}

	@JsonIgnore
	public boolean isEmpty() {
		return history.isEmpty();
	}

	public Optional<ConversationTurn> lastTurn() {
		return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
	}

	public Optional<String> activeFilter(String name) {
		return Optional.ofNullable(activeFilters.get(name));
	}
}
