package org.javai.text2sql.conversation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex entity extraction. Patterns run in order and their matches are collected without
 * duplicates: standalone numbers, single-quoted text, double-quoted text, capitalized words.
 *
 * <p>{@code Show orders placed by "Acme Corp"} yields {@code [Acme Corp, Show, Acme, Corp]}.</p>
 */
public class PatternEntityExtractor implements EntityExtractor {

	private static final List<Pattern> DEFAULT_PATTERNS = List.of(
			Pattern.compile("\\d+"),
			Pattern.compile("'([^']*)'"),
			Pattern.compile("\"([^\"]*)\""),
			Pattern.compile("\\b[A-Z][a-z]+\\b"));

	private final List<Pattern> patterns;

	public PatternEntityExtractor() {
		this(DEFAULT_PATTERNS);
	}

	/**
	 * @param patterns patterns whose first group, or whole match when they have no group, is an entity
	 */
	public PatternEntityExtractor(List<Pattern> patterns) {
		this.patterns = List.copyOf(patterns);
	}

	@Override
	public List<String> extract(String message) {
		if (message == null || message.isBlank()) {
			return List.of();
		}
		Set<String> entities = new LinkedHashSet<>();
		for (Pattern pattern : patterns) {
			Matcher matcher = pattern.matcher(message);
			while (matcher.find()) {
				String value = matcher.groupCount() > 0 ? matcher.group(1) : matcher.group();
				if (value != null && !value.isBlank()) {
					entities.add(value);
				}
			}
		}
		return List.copyOf(entities);
	}
}
