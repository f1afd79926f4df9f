package org.javai.text2sql.feedback;

/**
 * One pass of the execute, validate and repair loop.
 *
 * @param iteration 1-based pass number
 * @param inputSql SQL executed by this pass
 * @param outputSql SQL handed to the next pass (equal to {@code inputSql} for validated and
 *     aborted steps)
 * @param kind what the pass did
 * @param execution execution outcome, null if the pass faulted before execution finished
 * @param validation validation outcome, null unless the execution succeeded
 * @param errorAnalysis classified error for repair and system-error steps, null otherwise
 * @param feedback refinement feedback for result-refinement steps, null otherwise
 */
public record OptimizationStep(
		int iteration,
		String inputSql,
		String outputSql,
		StepKind kind,
		ExecutionSummary execution,
		ValidationResult validation,
		ErrorAnalysis errorAnalysis,
		String feedback
) {

	public OptimizationStep {
		if (iteration < 1) {
			throw new IllegalArgumentException("iteration must be >= 1");
		}
		if (kind == null) {
			throw new IllegalArgumentException("kind must not be null");
		}
	}

	public static OptimizationStep validated(int iteration, String sql, ExecutionSummary execution,
			ValidationResult validation) {
		return new OptimizationStep(iteration, sql, sql, StepKind.VALIDATED, execution, validation, null, null);
	}

	public static OptimizationStep refinement(int iteration, String inputSql, String outputSql,
			ExecutionSummary execution, ValidationResult validation, String feedback) {
		return new OptimizationStep(iteration, inputSql, outputSql, StepKind.RESULT_REFINEMENT, execution,
				validation, null, feedback);
	}

	public static OptimizationStep repair(int iteration, String inputSql, String outputSql,
			ExecutionSummary execution, ErrorAnalysis errorAnalysis) {
		return new OptimizationStep(iteration, inputSql, outputSql, StepKind.ERROR_REPAIR, execution, null,
				errorAnalysis, null);
	}

	public static OptimizationStep systemError(int iteration, String inputSql, String message) {
		return new OptimizationStep(iteration, inputSql, inputSql, StepKind.SYSTEM_ERROR, null, null,
				ErrorAnalysis.of(ErrorKind.SYSTEM_ERROR, message), null);
	}
}
