package org.javai.text2sql.feedback;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one optimization run.
 *
 * <p>An unsuccessful run is a normal result: {@code finalSql} then holds the last SQL produced and
 * callers decide what to show.</p>
 *
 * @param originalSql the draft SQL the run started from
 * @param finalSql the accepted SQL, or the last SQL produced when unsuccessful
 * @param success whether a result passed validation
 * @param cancelled whether the run stopped because cancellation was requested
 * @param steps recorded passes, iterations 1..n
 * @param rows rows of the last successful execution, empty if none succeeded
 */
public record OptimizationResult(
		String originalSql,
		String finalSql,
		boolean success,
		boolean cancelled,
		List<OptimizationStep> steps,
		List<Map<String, Object>> rows
) {

	public OptimizationResult {
		steps = steps != null ? List.copyOf(steps) : List.of();
		rows = rows != null ? Collections.unmodifiableList(rows) : List.of();
	}

	public int iterations() {
		return steps.size();
	}

	/**
	 * The last recorded step, or null if no step ran.
	 */
	public OptimizationStep lastStep() {
		return steps.isEmpty() ? null : steps.get(steps.size() - 1);
	}
}
