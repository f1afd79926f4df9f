package org.javai.text2sql.completion;

import java.util.Map;

/**
 * Text-generation collaborator: renders a named prompt template with arguments and returns the
 * model's reply.
 */
public interface TextCompletion {

	/**
	 * @param templateName template name, e.g. {@code optimize_sql_query}
	 * @param args template arguments keyed by placeholder name
	 * @return the generated text
	 * @throws TextCompletionException if the template is unknown or generation fails
	 */
	String complete(String templateName, Map<String, String> args);
}
