package org.javai.text2sql.conversation;

import java.util.List;

/**
 * Persistence of chat messages per connection.
 */
public interface ChatHistoryStore {

	void append(ChatMessage message);

	/**
	 * Returns the most recent messages of a connection, oldest first.
	 *
	 * @param limit maximum number of messages
	 */
	List<ChatMessage> recent(String connectionId, int limit);

	void clear(String connectionId);
}
