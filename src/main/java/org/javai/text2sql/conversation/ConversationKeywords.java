package org.javai.text2sql.conversation;

import java.util.Comparator;
import java.util.List;

/**
 * Keyword tables driving follow-up classification and coreference resolution.
 *
 * <p>Swap in a different instance to localize the conversation heuristics. Latin keywords match
 * whole words; CJK keywords match as substrings.</p>
 *
 * @param filterWords cues for {@link FollowupQueryType#FILTER_REFINEMENT}
 * @param aggregationWords cues for {@link FollowupQueryType#AGGREGATION_CHANGE}
 * @param columnExpansionWords cues for {@link FollowupQueryType#COLUMN_EXPANSION}
 * @param sortingWords cues for {@link FollowupQueryType#SORTING_CHANGE}
 * @param pronouns pronouns that are replaced by a recent entity
 * @param comparisonWords cues for {@link FollowupQueryType#COMPARISON}
 * @param continuationMarkers words marking a question as a continuation of the previous one
 * @param relativeTimeWords relative time phrases replaced by the active time range
 * @param resultReferenceWords words referring to the previous result set
 * @param tableWords words that count as an explicit table reference
 */
public record ConversationKeywords(
		List<String> filterWords,
		List<String> aggregationWords,
		List<String> columnExpansionWords,
		List<String> sortingWords,
		List<String> pronouns,
		List<String> comparisonWords,
		List<String> continuationMarkers,
		List<String> relativeTimeWords,
		List<String> resultReferenceWords,
		List<String> tableWords
) {

	public ConversationKeywords {
		filterWords = List.copyOf(filterWords);
		aggregationWords = List.copyOf(aggregationWords);
		columnExpansionWords = List.copyOf(columnExpansionWords);
		sortingWords = List.copyOf(sortingWords);
		// longest first, so "它们" is replaced before "它"
		pronouns = pronouns.stream()
				.sorted(Comparator.comparingInt(String::length).reversed())
				.toList();
		comparisonWords = List.copyOf(comparisonWords);
		continuationMarkers = List.copyOf(continuationMarkers);
		relativeTimeWords = List.copyOf(relativeTimeWords);
		resultReferenceWords = List.copyOf(resultReferenceWords);
		tableWords = List.copyOf(tableWords);
	}

	public static ConversationKeywords defaults() {
		return new ConversationKeywords(
				List.of("筛选", "过滤", "条件", "只要", "除了", "不包括", "where", "filter", "条件是"),
				List.of("统计", "计算", "求和", "平均", "最大", "最小", "count", "sum", "avg", "max", "min"),
				List.of("加上", "还要", "也显示", "包括", "以及", "and", "include", "show"),
				List.of("排序", "排列", "按", "升序", "降序", "order", "sort", "asc", "desc"),
				List.of("它们", "他们", "这个", "那个", "它", "this", "that", "they", "them", "it"),
				List.of("比较", "对比", "差异", "相同", "不同", "compare", "difference", "versus"),
				List.of("也", "还", "再", "and", "also", "too"),
				List.of("同期", "同比", "环比", "上次", "之前"),
				List.of("其中", "这些", "那些"),
				List.of("表", "table", "用户", "订单", "商品", "客户"));
	}

	/**
	 * Cue words of a follow-up type; empty for {@link FollowupQueryType#NEW_QUERY}.
	 */
	public List<String> cuesFor(FollowupQueryType type) {
		return switch (type) {
			case FILTER_REFINEMENT -> filterWords;
			case AGGREGATION_CHANGE -> aggregationWords;
			case COLUMN_EXPANSION -> columnExpansionWords;
			case SORTING_CHANGE -> sortingWords;
			case PRONOUN_REFERENCE -> pronouns;
			case COMPARISON -> comparisonWords;
			case NEW_QUERY -> List.of();
		};
	}
}
