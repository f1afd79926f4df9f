package org.javai.text2sql.config;

import java.util.Objects;
import org.javai.text2sql.conversation.ConversationConfig;
import org.javai.text2sql.feedback.FeedbackOptimizerConfig;
import org.javai.text2sql.linking.SchemaLinkingConfig;

/**
 * All tunables of the engine.
 *
 * @param linking schema linking configuration
 * @param optimization execute/validate/repair loop configuration
 * @param conversation conversation state configuration
 * @param dialect SQL dialect named in generation prompts
 * @param temperature sampling temperature for completions, null for the model default
 */
public record Text2SqlSettings(
		SchemaLinkingConfig linking,
		FeedbackOptimizerConfig optimization,
		ConversationConfig conversation,
		String dialect,
		Double temperature
) {

	public static final String DEFAULT_DIALECT = "ANSI SQL";
	public static final double DEFAULT_TEMPERATURE = 0.1;

	public Text2SqlSettings {
		Objects.requireNonNull(linking, "linking must not be null");
		Objects.requireNonNull(optimization, "optimization must not be null");
		Objects.requireNonNull(conversation, "conversation must not be null");
		if (dialect == null || dialect.isBlank()) {
			dialect = DEFAULT_DIALECT;
		}
		if (temperature != null && (temperature < 0 || temperature > 2)) {
			throw new IllegalArgumentException("temperature must be within [0, 2]");
		}
	}

	public static Text2SqlSettings defaults() {
		return new Text2SqlSettings(SchemaLinkingConfig.defaults(), FeedbackOptimizerConfig.defaults(),
				ConversationConfig.defaults(), DEFAULT_DIALECT, DEFAULT_TEMPERATURE);
	}
}
