package org.javai.text2sql.conversation;

import java.util.List;
import java.util.Objects;
import org.javai.text2sql.text.KeywordMatcher;

/**
 * First-match keyword classification in the order filter, aggregation, column expansion, sorting,
 * pronoun, comparison. Without earlier turns every question is a new query.
 */
public class KeywordFollowupClassifier implements FollowupClassifier {

	private static final List<FollowupQueryType> ORDER = List.of(
			FollowupQueryType.FILTER_REFINEMENT,
			FollowupQueryType.AGGREGATION_CHANGE,
			FollowupQueryType.COLUMN_EXPANSION,
			FollowupQueryType.SORTING_CHANGE,
			FollowupQueryType.PRONOUN_REFERENCE,
			FollowupQueryType.COMPARISON);

	private final ConversationKeywords keywords;

	public KeywordFollowupClassifier() {
		this(ConversationKeywords.defaults());
	}

	public KeywordFollowupClassifier(ConversationKeywords keywords) {
		this.keywords = Objects.requireNonNull(keywords, "keywords must not be null");
	}

	@Override
	public FollowupQueryType classify(String message, boolean hasContext) {
		if (!hasContext || message == null) {
			return FollowupQueryType.NEW_QUERY;
		}
		return ORDER.stream()
				.filter(type -> KeywordMatcher.containsAny(message, keywords.cuesFor(type)))
				.findFirst()
				.orElse(FollowupQueryType.NEW_QUERY);
	}
}
