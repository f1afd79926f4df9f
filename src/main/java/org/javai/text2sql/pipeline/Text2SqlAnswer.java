package org.javai.text2sql.pipeline;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.javai.text2sql.conversation.FollowupQueryType;
import org.javai.text2sql.feedback.OptimizationResult;
import org.javai.text2sql.linking.SchemaLinkingResult;

/**
 * Everything produced while answering one question.
 *
 * @param question the question as asked
 * @param rewrittenQuestion the question after follow-up rewriting
 * @param followupType how the question related to the previous one
 * @param linking the schema linking outcome
 * @param optimization the optimization run, null if no SQL could be drafted
 * @param sql the final SQL, null if none was drafted
 * @param rows rows of the final successful execution
 * @param success whether a validated result was produced
 * @param assistantMessage the reply shown to the user
 */
public record Text2SqlAnswer(
		String question,
		String rewrittenQuestion,
		FollowupQueryType followupType,
		SchemaLinkingResult linking,
		OptimizationResult optimization,
		String sql,
		List<Map<String, Object>> rows,
		boolean success,
		String assistantMessage
) {

	public Text2SqlAnswer {
		rows = rows != null ? Collections.unmodifiableList(rows) : List.of();
	}
}
