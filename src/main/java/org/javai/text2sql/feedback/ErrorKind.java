package org.javai.text2sql.feedback;

/**
 * Classification of a failed execution. Every kind carries one fixed remediation hint that is
 * used to prime the repair request.
 */
public enum ErrorKind {
	COLUMN_NOT_FOUND("column not found"),
	TABLE_NOT_FOUND("table not found"),
	SYNTAX_ERROR("syntax error"),
	TYPE_MISMATCH("type mismatch"),
	AGGREGATION_ERROR("aggregation error"),
	JOIN_ERROR("join error"),
	UNKNOWN("unknown error"),
	/** Internal fault of the loop itself, not a database error. */
	SYSTEM_ERROR("system error");

	private final String label;

	ErrorKind(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}

	public String hint() {
		return switch (this) {
			case COLUMN_NOT_FOUND -> "Check the spelling of the column name and that the column exists in the table it is selected from.";
			case TABLE_NOT_FOUND -> "Check the spelling of the table name and that the table exists in the database.";
			case SYNTAX_ERROR -> "Check the SQL syntax, especially keyword usage and punctuation.";
			case TYPE_MISMATCH -> "Check data type conversions and make sure compared values have the same type.";
			case AGGREGATION_ERROR -> "Make sure every non-aggregated column in the select list appears in GROUP BY.";
			case JOIN_ERROR -> "Check the JOIN conditions; the joined columns must exist and have matching types.";
			case UNKNOWN -> "Review the syntax and logic of the SQL statement.";
			case SYSTEM_ERROR -> "Check the system configuration or contact an administrator.";
		};
	}
}
