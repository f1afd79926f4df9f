package org.javai.text2sql.feedback;

import java.time.Duration;

/**
 * Tuning of the execute, validate and repair loop.
 *
 * @param maxIterations maximum number of loop passes (steps) per run
 * @param iterationTimeout time allowed for one pass, null for no limit
 * @param maxResultRows largest result size accepted for an unqualified question
 * @param maxLimitedResultRows largest result size accepted for a "top"/limited question
 */
public record FeedbackOptimizerConfig(
		int maxIterations,
		Duration iterationTimeout,
		int maxResultRows,
		int maxLimitedResultRows
) {

	public static final int DEFAULT_MAX_ITERATIONS = 3;
	public static final int DEFAULT_MAX_RESULT_ROWS = 10_000;
	public static final int DEFAULT_MAX_LIMITED_RESULT_ROWS = 100;

	public FeedbackOptimizerConfig {
		if (maxIterations < 1) {
			throw new IllegalArgumentException("maxIterations must be at least 1");
		}
		if (iterationTimeout != null && (iterationTimeout.isZero() || iterationTimeout.isNegative())) {
			throw new IllegalArgumentException("iterationTimeout must be positive");
		}
		if (maxResultRows < 1 || maxLimitedResultRows < 1) {
			throw new IllegalArgumentException("result row limits must be positive");
		}
	}

	public static FeedbackOptimizerConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public FeedbackOptimizerConfig withMaxIterations(int newMaxIterations) {
		return new FeedbackOptimizerConfig(newMaxIterations, iterationTimeout, maxResultRows, maxLimitedResultRows);
	}

	public static class Builder {
		private int maxIterations = DEFAULT_MAX_ITERATIONS;
		private Duration iterationTimeout;
		private int maxResultRows = DEFAULT_MAX_RESULT_ROWS;
		private int maxLimitedResultRows = DEFAULT_MAX_LIMITED_RESULT_ROWS;

		private Builder() {}

		public Builder maxIterations(int maxIterations) {
			this.maxIterations = maxIterations;
			return this;
		}

		public Builder iterationTimeout(Duration iterationTimeout) {
			this.iterationTimeout = iterationTimeout;
			return this;
		}

		public Builder maxResultRows(int maxResultRows) {
			this.maxResultRows = maxResultRows;
			return this;
		}

		public Builder maxLimitedResultRows(int maxLimitedResultRows) {
			this.maxLimitedResultRows = maxLimitedResultRows;
			return this;
		}

		public FeedbackOptimizerConfig build() {
			return new FeedbackOptimizerConfig(maxIterations, iterationTimeout, maxResultRows, maxLimitedResultRows);
		}
	}
}
