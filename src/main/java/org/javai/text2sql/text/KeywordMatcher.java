package org.javai.text2sql.text;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds keyword cues in user text.
 *
 * <p>Keywords made only of ASCII characters match whole words, case-insensitively, so "min" does
 * not fire on "admin" and "it" does not fire on "items". A digit may follow directly, so "top5"
 * carries the "top" cue. Any other keyword (e.g. "最近") matches as
 * a plain substring, since CJK text has no word separators.</p>
 */
public final class KeywordMatcher {

	private static final ConcurrentHashMap<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

	private KeywordMatcher() {
	}

	public static boolean contains(String text, String keyword) {
		if (text == null || text.isEmpty() || keyword == null || keyword.isEmpty()) {
			return false;
		}
		if (!isAscii(keyword)) {
			return text.contains(keyword);
		}
		return pattern(keyword).matcher(text).find();
	}

	public static boolean containsAny(String text, Collection<String> keywords) {
		return firstMatch(text, keywords).isPresent();
	}

	/**
	 * Returns the first keyword, in collection order, that occurs in the text.
	 */
	public static Optional<String> firstMatch(String text, Collection<String> keywords) {
		for (String keyword : keywords) {
			if (contains(text, keyword)) {
				return Optional.of(keyword);
			}
		}
		return Optional.empty();
	}

	/**
	 * Replaces every occurrence of the keyword, honouring the same matching rules as
	 * {@link #contains}.
	 */
	public static String replaceAll(String text, String keyword, String replacement) {
		if (!contains(text, keyword)) {
			return text;
		}
		if (!isAscii(keyword)) {
			return text.replace(keyword, replacement);
		}
		return pattern(keyword).matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
	}

	private static Pattern pattern(String keyword) {
		return PATTERNS.computeIfAbsent(keyword,
				k -> Pattern.compile("\\b" + Pattern.quote(k) + "(?:\\b|(?=\\d))", Pattern.CASE_INSENSITIVE));
	}

	private static boolean isAscii(String keyword) {
		return keyword.chars().allMatch(c -> c < 0x80);
	}
}
