package org.javai.text2sql.pipeline;

import java.util.function.BooleanSupplier;

/**
 * A question asked against a connection.
 *
 * @param connectionId the connection whose schema and conversation apply
 * @param question the question as typed by the user
 * @param cancelled polled between optimization passes; never null
 */
public record Text2SqlRequest(String connectionId, String question, BooleanSupplier cancelled) {

	public Text2SqlRequest {
		if (connectionId == null || connectionId.isBlank()) {
			throw new IllegalArgumentException("connectionId must not be blank");
		}
		if (question == null || question.isBlank()) {
			throw new IllegalArgumentException("question must not be blank");
		}
		cancelled = cancelled != null ? cancelled : () -> false;
	}

	public static Text2SqlRequest of(String connectionId, String question) {
		return new Text2SqlRequest(connectionId, question, null);
	}
}
