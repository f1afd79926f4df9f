package org.javai.text2sql.feedback;

import java.util.Locale;

/**
 * Classifies database error messages by substring, case-insensitively. The first rule that applies
 * wins:
 * <ol>
 *   <li>"column" with "not found" or "doesn't exist" / "does not exist"</li>
 *   <li>"table" with the same</li>
 *   <li>"syntax" or "near"</li>
 *   <li>"type" with "mismatch"</li>
 *   <li>"aggregate" or "group by"</li>
 *   <li>"join" or "foreign key"</li>
 * </ol>
 */
public class ErrorClassifier {

	public ErrorKind classify(String errorMessage) {
		if (errorMessage == null || errorMessage.isBlank()) {
			return ErrorKind.UNKNOWN;
		}
		String error = errorMessage.toLowerCase(Locale.ROOT);

		if (error.contains("column") && isMissing(error)) {
			return ErrorKind.COLUMN_NOT_FOUND;
		}
		if (error.contains("table") && isMissing(error)) {
			return ErrorKind.TABLE_NOT_FOUND;
		}
		if (error.contains("syntax") || error.contains("near")) {
			return ErrorKind.SYNTAX_ERROR;
		}
		if (error.contains("type") && error.contains("mismatch")) {
			return ErrorKind.TYPE_MISMATCH;
		}
		if (error.contains("aggregate") || error.contains("group by")) {
			return ErrorKind.AGGREGATION_ERROR;
		}
		if (error.contains("join") || error.contains("foreign key")) {
			return ErrorKind.JOIN_ERROR;
		}
		return ErrorKind.UNKNOWN;
	}

	public ErrorAnalysis analyze(String errorMessage) {
		return ErrorAnalysis.of(classify(errorMessage), errorMessage);
	}

	private static boolean isMissing(String error) {
		return error.contains("not found") || error.contains("doesn't exist") || error.contains("does not exist");
	}
}
