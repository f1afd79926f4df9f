package org.javai.text2sql.feedback;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Sanity checks on a successful result set, driven by cues in the question.
 *
 * <ul>
 *   <li>size: at most {@code maxLimitedResultRows} rows for a "top" question, at least one row for
 *       an "all" question, otherwise within (0, {@code maxResultRows}]</li>
 *   <li>type consistency: a column's values share the class of the first row's value, except that
 *       any two numbers are compatible</li>
 *   <li>order: numeric columns non-increasing for "highest", non-decreasing for "lowest";
 *       date/time columns non-increasing for "recent"</li>
 *   <li>nulls: no null cell when the question asks for non-null values</li>
 * </ul>
 * <p>Numeric and date/time columns are those whose value in the first row is a {@link Number} or a
 * date/time value; null cells are skipped by the order checks.</p>
 */
public class ResultValidator {

	private final int maxResultRows;
	private final int maxLimitedResultRows;

	public ResultValidator() {
		this(FeedbackOptimizerConfig.defaults());
	}

	public ResultValidator(FeedbackOptimizerConfig config) {
		Objects.requireNonNull(config, "config must not be null");
		this.maxResultRows = config.maxResultRows();
		this.maxLimitedResultRows = config.maxLimitedResultRows();
	}

	public ValidationResult validate(List<Map<String, Object>> rows, String question) {
		if (rows == null) {
			return ValidationResult.ofIssues(List.of("the query returned no result set"));
		}
		ValidationCues cues = ValidationCues.detect(question);
		List<String> issues = new ArrayList<>();

		if (!checkResultSize(rows, cues)) {
			issues.add("result size (%d rows) does not match what the question asks for".formatted(rows.size()));
		}
		if (!checkTypeConsistency(rows)) {
			issues.add("values of a column have inconsistent data types");
		}
		if (!checkOrder(rows, cues)) {
			issues.add(switch (cues.order()) {
				case DESCENDING -> "rows are not sorted from highest to lowest";
				case ASCENDING -> "rows are not sorted from lowest to highest";
				case RECENT_FIRST -> "rows are not sorted with the most recent first";
				case NONE -> "rows are not in the expected order";
			});
		}
		if (!checkNullHandling(rows, cues)) {
			issues.add("the result contains null values although non-null values were requested");
		}
		return ValidationResult.ofIssues(issues);
	}

	public boolean checkResultSize(List<Map<String, Object>> rows, ValidationCues cues) {
		int size = rows.size();
		return switch (cues.size()) {
			case LIMITED -> size <= maxLimitedResultRows;
			case ALL -> size >= 1;
			case UNQUALIFIED -> size > 0 && size <= maxResultRows;
		};
	}

	public boolean checkTypeConsistency(List<Map<String, Object>> rows) {
		if (rows.size() <= 1) {
			return true;
		}
		Map<String, Object> first = rows.get(0);
		for (Map<String, Object> row : rows.subList(1, rows.size())) {
			for (Map.Entry<String, Object> cell : first.entrySet()) {
				Object expected = cell.getValue();
				Object actual = row.get(cell.getKey());
				if (expected == null || actual == null || expected.getClass().equals(actual.getClass())) {
					continue;
				}
				if (!(expected instanceof Number && actual instanceof Number)) {
					return false;
				}
			}
		}
		return true;
	}

	public boolean checkOrder(List<Map<String, Object>> rows, ValidationCues cues) {
		return switch (cues.order()) {
			case DESCENDING -> checkDescendingOrder(rows);
			case ASCENDING -> checkAscendingOrder(rows);
			case RECENT_FIRST -> checkRecentTimeOrder(rows);
			case NONE -> true;
		};
	}

	/**
	 * True when every numeric column is non-increasing from row to row.
	 */
	public boolean checkDescendingOrder(List<Map<String, Object>> rows) {
		return columnsInOrder(rows, v -> v instanceof Number, v -> ((Number) v).doubleValue(), false);
	}

	/**
	 * True when every numeric column is non-decreasing from row to row.
	 */
	public boolean checkAscendingOrder(List<Map<String, Object>> rows) {
		return columnsInOrder(rows, v -> v instanceof Number, v -> ((Number) v).doubleValue(), true);
	}

	/**
	 * True when every date/time column lists the most recent value first.
	 */
	public boolean checkRecentTimeOrder(List<Map<String, Object>> rows) {
		return columnsInOrder(rows, ResultValidator::isDateTime, ResultValidator::toInstant, false);
	}

	public boolean checkNullHandling(List<Map<String, Object>> rows, ValidationCues cues) {
		if (!cues.requiresNonNull()) {
			return true;
		}
		return rows.stream().noneMatch(row -> row.values().stream().anyMatch(Objects::isNull));
	}

	private static <T extends Comparable<T>> boolean columnsInOrder(List<Map<String, Object>> rows,
			Predicate<Object> columnFilter, Function<Object, T> key, boolean ascending) {
		if (rows.size() <= 1) {
			return true;
		}
		List<String> columns = rows.get(0).entrySet().stream()
				.filter(e -> e.getValue() != null && columnFilter.test(e.getValue()))
				.map(Map.Entry::getKey)
				.toList();

		for (String column : columns) {
			List<T> values = rows.stream()
					.map(row -> row.get(column))
					.filter(v -> v != null && columnFilter.test(v))
					.map(key)
					.toList();
			for (int i = 0; i < values.size() - 1; i++) {
				int comparison = values.get(i).compareTo(values.get(i + 1));
				if (ascending ? comparison > 0 : comparison < 0) {
					return false;
				}
			}
		}
		return true;
	}

	private static boolean isDateTime(Object value) {
		return value instanceof Date || value instanceof Instant || value instanceof LocalDate
				|| value instanceof LocalDateTime || value instanceof OffsetDateTime
				|| value instanceof ZonedDateTime;
	}

	private static Instant toInstant(Object value) {
		if (value instanceof Date date) {
			return Instant.ofEpochMilli(date.getTime());
		}
		if (value instanceof Instant instant) {
			return instant;
		}
		if (value instanceof LocalDate date) {
			return date.atStartOfDay().toInstant(ZoneOffset.UTC);
		}
		if (value instanceof LocalDateTime dateTime) {
			return dateTime.toInstant(ZoneOffset.UTC);
		}
		if (value instanceof OffsetDateTime dateTime) {
			return dateTime.toInstant();
		}
		if (value instanceof ZonedDateTime dateTime) {
			return dateTime.toInstant();
		}
		throw new IllegalArgumentException("Not a date/time value: " + value.getClass().getName());
	}
}
