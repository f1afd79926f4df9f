package org.javai.text2sql.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of running one SQL statement.
 *
 * @param rows returned rows, each keyed by column label in select order; empty on error
 * @param error database error message, null on success
 */
public record ExecutionResult(List<Map<String, Object>> rows, String error) {

	public ExecutionResult {
		if (rows == null) {
			rows = List.of();
		}
		else {
			// cells may be null
			List<Map<String, Object>> copy = new ArrayList<>(rows.size());
			for (Map<String, Object> row : rows) {
				copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
			}
			rows = Collections.unmodifiableList(copy);
		}
	}

	public static ExecutionResult success(List<Map<String, Object>> rows) {
		return new ExecutionResult(rows, null);
	}

	public static ExecutionResult failure(String error) {
		return new ExecutionResult(List.of(), error != null ? error : "unknown error");
	}

	public boolean succeeded() {
		return error == null;
	}

	public int rowCount() {
		return rows.size();
	}

	/**
	 * Number of fields of the first row, 0 when there are no rows.
	 */
	public int fieldCount() {
		return rows.isEmpty() ? 0 : rows.get(0).size();
	}
}
