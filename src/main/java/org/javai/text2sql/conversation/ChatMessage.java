package org.javai.text2sql.conversation;

import java.time.Instant;

/**
 * A persisted chat message.
 *
 * @param connectionId the connection the conversation belongs to
 * @param message message text
 * @param fromUser true for user questions, false for assistant answers
 * @param sqlQuery SQL attached to an assistant answer (may be null)
 * @param executionError execution error attached to an assistant answer (may be null)
 * @param createdAt creation time
 */
public record ChatMessage(
		String connectionId,
		String message,
		boolean fromUser,
		String sqlQuery,
		String executionError,
		Instant createdAt
) {

	public ChatMessage {
		if (connectionId == null || connectionId.isBlank()) {
			throw new IllegalArgumentException("connectionId must not be blank");
		}
		message = message != null ? message : "";
		createdAt = createdAt != null ? createdAt : Instant.now();
	}

	public static ChatMessage user(String connectionId, String message) {
		return new ChatMessage(connectionId, message, true, null, null, Instant.now());
	}

	public static ChatMessage assistant(String connectionId, String message, String sqlQuery, String executionError) {
		return new ChatMessage(connectionId, message, false, sqlQuery, executionError, Instant.now());
	}
}
