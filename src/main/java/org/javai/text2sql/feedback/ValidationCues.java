package org.javai.text2sql.feedback;

import java.util.List;
import org.javai.text2sql.text.KeywordMatcher;

/**
 * Expectations about a result set read from the wording of the question.
 *
 * @param size expected result size
 * @param order expected row order
 * @param requiresNonNull whether the question asks for non-null values
 */
public record ValidationCues(SizeCue size, OrderCue order, boolean requiresNonNull) {

	private static final List<String> LIMITED = List.of("top", "前", "最多");
	private static final List<String> ALL = List.of("所有", "全部", "all");
	private static final List<String> HIGHEST = List.of("最高", "最大", "highest", "max", "maximum");
	private static final List<String> LOWEST = List.of("最低", "最小", "lowest", "min", "minimum");
	private static final List<String> RECENT = List.of("最近", "recent");
	private static final List<String> NON_NULL = List.of("非空", "not null");

	public enum SizeCue {
		LIMITED, ALL, UNQUALIFIED
	}

	public enum OrderCue {
		DESCENDING, ASCENDING, RECENT_FIRST, NONE
	}

	public static ValidationCues detect(String question) {
		String text = question != null ? question : "";

		SizeCue size = KeywordMatcher.containsAny(text, LIMITED) ? SizeCue.LIMITED
				: KeywordMatcher.containsAny(text, ALL) ? SizeCue.ALL
				: SizeCue.UNQUALIFIED;

		OrderCue order = KeywordMatcher.containsAny(text, HIGHEST) ? OrderCue.DESCENDING
				: KeywordMatcher.containsAny(text, LOWEST) ? OrderCue.ASCENDING
				: KeywordMatcher.containsAny(text, RECENT) ? OrderCue.RECENT_FIRST
				: OrderCue.NONE;

		return new ValidationCues(size, order, KeywordMatcher.containsAny(text, NON_NULL));
	}
}
