package org.javai.text2sql.conversation;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link ChatHistoryStore}.
 */
public class InMemoryChatHistoryStore implements ChatHistoryStore {

	private final ConcurrentHashMap<String, CopyOnWriteArrayList<ChatMessage>> messages = new ConcurrentHashMap<>();

	@Override
	public void append(ChatMessage message) {
		Objects.requireNonNull(message, "message must not be null");
		messages.computeIfAbsent(message.connectionId(), id -> new CopyOnWriteArrayList<>()).add(message);
	}

	@Override
	public List<ChatMessage> recent(String connectionId, int limit) {
		List<ChatMessage> all = messages.get(connectionId);
		if (all == null || limit <= 0) {
			return List.of();
		}
		List<ChatMessage> copy = List.copyOf(all);
		return copy.subList(Math.max(0, copy.size() - limit), copy.size());
	}

	@Override
	public void clear(String connectionId) {
		messages.remove(connectionId);
	}
}
