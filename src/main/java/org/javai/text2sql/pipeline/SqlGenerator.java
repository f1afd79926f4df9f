package org.javai.text2sql.pipeline;

import java.util.Map;
import java.util.Objects;
import org.javai.text2sql.completion.SqlResponseCleaner;
import org.javai.text2sql.completion.TextCompletion;
import org.javai.text2sql.completion.TextCompletionException;

/**
 * Drafts the first SQL statement for a question from the linked schema.
 */
public class SqlGenerator {

	public static final String GENERATE_TEMPLATE = "generate_sql";

	private final TextCompletion completion;
	private final String dialect;

	/**
	 * @param dialect SQL dialect named in the prompt, e.g. "PostgreSQL"
	 */
	public SqlGenerator(TextCompletion completion, String dialect) {
		this.completion = Objects.requireNonNull(completion, "completion must not be null");
		this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
	}

	/**
	 * @throws TextCompletionException if the completion fails or yields no SQL
	 */
	public String generate(String question, String schemaJson) {
		String response = completion.complete(GENERATE_TEMPLATE, Map.of(
				"dialect", dialect,
				"schemaInfo", schemaJson != null ? schemaJson : "",
				"userMessage", question));
		String sql = SqlResponseCleaner.clean(response);
		if (sql.isEmpty()) {
			throw new TextCompletionException("No SQL was generated for: " + question);
		}
		return sql;
	}
}
