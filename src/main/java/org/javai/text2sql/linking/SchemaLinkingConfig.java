package org.javai.text2sql.linking;

/**
 * Tuning of schema linking.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SchemaLinkingConfig config = SchemaLinkingConfig.builder()
 *         .relevanceThreshold(0.8)
 *         .maxRelatedTables(5)
 *         .build();
 * }</pre>
 *
 * @param relevanceThreshold similarity score the search starts at
 * @param thresholdStep amount the threshold is lowered by after a search that resolved too few tables
 * @param thresholdFloor lowest threshold that is ever queried
 * @param maxTables maximum number of hits requested per search
 * @param minTablesRequired resolved tables needed to stop lowering the threshold
 * @param maxRelatedTables maximum number of tables relationship expansion may add
 */
public record SchemaLinkingConfig(
		double relevanceThreshold,
		double thresholdStep,
		double thresholdFloor,
		int maxTables,
		int minTablesRequired,
		int maxRelatedTables
) {

	public static final double DEFAULT_RELEVANCE_THRESHOLD = 0.7;
	public static final double DEFAULT_THRESHOLD_STEP = 0.1;
	public static final double DEFAULT_THRESHOLD_FLOOR = 0.4;
	public static final int DEFAULT_MAX_TABLES = 5;
	public static final int DEFAULT_MIN_TABLES_REQUIRED = 1;
	public static final int DEFAULT_MAX_RELATED_TABLES = 10;

	public SchemaLinkingConfig {
		if (thresholdStep <= 0) {
			throw new IllegalArgumentException("thresholdStep must be positive");
		}
		if (thresholdFloor < 0 || thresholdFloor > 1) {
			throw new IllegalArgumentException("thresholdFloor must be within [0, 1]");
		}
		if (maxTables < 1) {
			throw new IllegalArgumentException("maxTables must be at least 1");
		}
		if (minTablesRequired < 1) {
			throw new IllegalArgumentException("minTablesRequired must be at least 1");
		}
		if (maxRelatedTables < 0) {
			throw new IllegalArgumentException("maxRelatedTables must be non-negative");
		}
	}

	public static SchemaLinkingConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private double relevanceThreshold = DEFAULT_RELEVANCE_THRESHOLD;
		private double thresholdStep = DEFAULT_THRESHOLD_STEP;
		private double thresholdFloor = DEFAULT_THRESHOLD_FLOOR;
		private int maxTables = DEFAULT_MAX_TABLES;
		private int minTablesRequired = DEFAULT_MIN_TABLES_REQUIRED;
		private int maxRelatedTables = DEFAULT_MAX_RELATED_TABLES;

		private Builder() {}

		public Builder relevanceThreshold(double relevanceThreshold) {
			this.relevanceThreshold = relevanceThreshold;
			return this;
		}

		public Builder thresholdStep(double thresholdStep) {
			this.thresholdStep = thresholdStep;
			return this;
		}

		public Builder thresholdFloor(double thresholdFloor) {
			this.thresholdFloor = thresholdFloor;
			return this;
		}

		public Builder maxTables(int maxTables) {
			this.maxTables = maxTables;
			return this;
		}

		public Builder minTablesRequired(int minTablesRequired) {
			this.minTablesRequired = minTablesRequired;
			return this;
		}

		public Builder maxRelatedTables(int maxRelatedTables) {
			this.maxRelatedTables = maxRelatedTables;
			return this;
		}

		public SchemaLinkingConfig build() {
			return new SchemaLinkingConfig(relevanceThreshold, thresholdStep, thresholdFloor,
					maxTables, minTablesRequired, maxRelatedTables);
		}
	}
}
