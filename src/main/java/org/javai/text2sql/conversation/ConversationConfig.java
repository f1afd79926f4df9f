package org.javai.text2sql.conversation;

/**
 * Configuration of conversation state.
 *
 * @param maxHistorySize turns kept per connection; older turns are evicted
 * @param entityLookbackTurns most recent turns searched for an entity to replace a pronoun with
 */
public record ConversationConfig(
		int maxHistorySize,
		int entityLookbackTurns
) {

	public static final int DEFAULT_MAX_HISTORY_SIZE = 10;
	public static final int DEFAULT_ENTITY_LOOKBACK_TURNS = 3;

	public ConversationConfig {
		if (maxHistorySize < 1) {
			throw new IllegalArgumentException("maxHistorySize must be at least 1");
		}
		if (entityLookbackTurns < 1) {
			throw new IllegalArgumentException("entityLookbackTurns must be at least 1");
		}
	}

	public static ConversationConfig defaults() {
		return new ConversationConfig(DEFAULT_MAX_HISTORY_SIZE, DEFAULT_ENTITY_LOOKBACK_TURNS);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private int maxHistorySize = DEFAULT_MAX_HISTORY_SIZE;
		private int entityLookbackTurns = DEFAULT_ENTITY_LOOKBACK_TURNS;

		private Builder() {}

		public Builder maxHistorySize(int maxHistorySize) {
			this.maxHistorySize = maxHistorySize;
			return this;
		}

		public Builder entityLookbackTurns(int entityLookbackTurns) {
			this.entityLookbackTurns = entityLookbackTurns;
			return this;
		}

		public ConversationConfig build() {
			return new ConversationConfig(maxHistorySize, entityLookbackTurns);
		}
	}
}
