package org.javai.text2sql.feedback;

import java.util.List;

/**
 * Outcome of validating a result set.
 *
 * @param valid true when no issue was found
 * @param issues human-readable issues, in check order
 */
public record ValidationResult(boolean valid, List<String> issues) {

	public ValidationResult {
		issues = issues != null ? List.copyOf(issues) : List.of();
		if (valid && !issues.isEmpty()) {
			throw new IllegalArgumentException("a valid result cannot carry issues");
		}
	}

	public static ValidationResult ofIssues(List<String> issues) {
		return new ValidationResult(issues == null || issues.isEmpty(), issues);
	}
}
