package org.javai.text2sql.feedback;

import org.javai.text2sql.execution.ExecutionResult;

/**
 * Execution outcome as recorded on an optimization step.
 *
 * @param success whether the statement ran without error
 * @param errorMessage database error, null on success
 * @param rowCount rows returned
 * @param durationMillis time the execution took
 */
public record ExecutionSummary(boolean success, String errorMessage, int rowCount, long durationMillis) {

	public static ExecutionSummary of(ExecutionResult result, long durationMillis) {
		return new ExecutionSummary(result.succeeded(), result.error(), result.rowCount(), durationMillis);
	}
}
