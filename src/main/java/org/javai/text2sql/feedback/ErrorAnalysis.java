package org.javai.text2sql.feedback;

/**
 * A classified execution error.
 *
 * @param kind classified error kind
 * @param message raw error message
 * @param suggestedFix remediation hint for the kind
 */
public record ErrorAnalysis(ErrorKind kind, String message, String suggestedFix) {

	public static ErrorAnalysis of(ErrorKind kind, String message) {
		return new ErrorAnalysis(kind, message, kind.hint());
	}

	/**
	 * Text handed to the repair request, e.g. {@code "syntax error: near FROM\nSuggestion: ..."}.
	 */
	public String describe() {
		return "%s: %s\nSuggestion: %s".formatted(kind.label(), message, suggestedFix);
	}
}
