package org.javai.text2sql.completion;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Strips markdown fences and blank lines from model output that should be a bare SQL statement.
 */
public final class SqlResponseCleaner {

	private SqlResponseCleaner() {
	}

	public static String clean(String response) {
		if (response == null) {
			return "";
		}
		String withoutFences = response
				.replaceAll("(?i)```sql", "")
				.replace("```", "");
		return Arrays.stream(withoutFences.split("\\R"))
				.filter(line -> !line.isBlank())
				.collect(Collectors.joining("\n"))
				.trim();
	}
}
