package org.javai.text2sql.conversation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutable conversation state of one connection: bounded turn history, referenced entities and
 * active filters.
 *
 * <p>All access goes through {@link #withLock} and {@link #runLocked}, which hold the context's lock,
 * so concurrent requests for one connection are serialized. A context dropped from its manager is
 * retired under the lock; writers that still hold it must fetch the current one.</p>
 */
public final class ConversationContext {

	public static final String LAST_WHERE = "last_where";
	public static final String TIME_RANGE = "time_range";

	private final String connectionId;
	private final int maxHistorySize;
	private final List<ConversationTurn> history = new ArrayList<>();
	private final Set<String> referencedEntities = new LinkedHashSet<>();
	private final Map<String, String> activeFilters = new LinkedHashMap<>();
	private final ReentrantLock lock = new ReentrantLock();
	private boolean retired;

	ConversationContext(String connectionId, int maxHistorySize) {
		this.connectionId = connectionId;
		this.maxHistorySize = maxHistorySize;
	}

	public String connectionId() {
		return connectionId;
	}

	<T> T withLock(Supplier<T> action) {
		lock.lock();
		try {
			return action.get();
		}
		finally {
			lock.unlock();
		}
	}

	void runLocked(Runnable action) {
		lock.lock();
		try {
			action.run();
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Caller holds the lock.
	 */
	void retire() {
		retired = true;
	}

	boolean isRetired() {
		return retired;
	}

	/**
	 * Appends a turn, evicting the oldest turns beyond the history limit. Caller holds the lock.
	 */
	void append(ConversationTurn turn) {
		history.add(turn);
		referencedEntities.addAll(turn.extractedEntities());
		while (history.size() > maxHistorySize) {
			history.remove(0);
		}
	}

	void putFilter(String name, String value) {
		activeFilters.put(name, value);
	}

	ConversationSnapshot snapshot() {
		return new ConversationSnapshot(connectionId, history, referencedEntities, activeFilters);
	}
}
