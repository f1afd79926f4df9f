package org.javai.text2sql.conversation;

import java.time.Instant;
import java.util.List;

/**
 * One question and answer of a conversation. Immutable once appended.
 *
 * @param userMessage the question as asked
 * @param assistantMessage the answer shown to the user
 * @param generatedSql SQL that answered the question (may be null)
 * @param resultSummary short description of the result, e.g. "12 records, 3 fields"
 * @param extractedEntities entities found in the question, in discovery order
 * @param timestamp when the turn was recorded
 */
public record ConversationTurn(
		String userMessage,
		String assistantMessage,
		String generatedSql,
		String resultSummary,
		List<String> extractedEntities,
		Instant timestamp
) {

	public ConversationTurn {
		userMessage = userMessage != null ? userMessage : "";
		assistantMessage = assistantMessage != null ? assistantMessage : "";
		extractedEntities = extractedEntities != null ? List.copyOf(extractedEntities) : List.of();
	}

	public boolean hasEntities() {
		return !extractedEntities.isEmpty();
	}
}
