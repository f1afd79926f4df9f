package org.javai.text2sql.pipeline;

import java.util.Objects;
import org.javai.text2sql.completion.TextCompletionException;
import org.javai.text2sql.conversation.ChatHistoryStore;
import org.javai.text2sql.conversation.ChatMessage;
import org.javai.text2sql.conversation.ConversationContextManager;
import org.javai.text2sql.conversation.FollowupQueryType;
import org.javai.text2sql.feedback.ErrorAnalysis;
import org.javai.text2sql.feedback.FeedbackOptimizer;
import org.javai.text2sql.feedback.OptimizationResult;
import org.javai.text2sql.feedback.OptimizationStep;
import org.javai.text2sql.linking.SchemaLinker;
import org.javai.text2sql.linking.SchemaLinkingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers a question end to end.
 *
 * <ol>
 *   <li>classify the question against the conversation and rewrite it</li>
 *   <li>link the rewritten question to the relevant tables</li>
 *   <li>draft SQL from the linked schema</li>
 *   <li>execute, validate and repair the draft</li>
 *   <li>compose the reply, record the turn and append both messages to chat history</li>
 * </ol>
 */
public class Text2SqlPipeline {

	private static final Logger logger = LoggerFactory.getLogger(Text2SqlPipeline.class);

	private final ConversationContextManager conversation;
	private final SchemaLinker schemaLinker;
	private final SqlGenerator sqlGenerator;
	private final FeedbackOptimizer optimizer;
	private final ChatHistoryStore historyStore;

	public Text2SqlPipeline(ConversationContextManager conversation, SchemaLinker schemaLinker,
			SqlGenerator sqlGenerator, FeedbackOptimizer optimizer, ChatHistoryStore historyStore) {
		this.conversation = Objects.requireNonNull(conversation, "conversation must not be null");
		this.schemaLinker = Objects.requireNonNull(schemaLinker, "schemaLinker must not be null");
		this.sqlGenerator = Objects.requireNonNull(sqlGenerator, "sqlGenerator must not be null");
		this.optimizer = Objects.requireNonNull(optimizer, "optimizer must not be null");
		this.historyStore = Objects.requireNonNull(historyStore, "historyStore must not be null");
	}

	public Text2SqlAnswer answer(Text2SqlRequest request) {
		String connectionId = request.connectionId();
		String question = request.question();

		FollowupQueryType followupType = conversation.analyzeFollowupQuery(connectionId, question);
		String rewritten = followupType == FollowupQueryType.NEW_QUERY
				? conversation.resolveCoreferences(connectionId, question)
				: conversation.processIncrementalQuery(connectionId, question, followupType);
		logger.info("Answering '{}' on connection {} as {}", rewritten, connectionId, followupType);

		SchemaLinkingResult linking = schemaLinker.getRelevantSchema(connectionId, rewritten);

		Text2SqlAnswer answer;
		try {
			String draft = sqlGenerator.generate(rewritten, linking.schemaJson());
			OptimizationResult optimization = optimizer.optimizeWithFeedback(connectionId, rewritten,
					linking.schemaJson(), draft, defaultIterations(), request.cancelled());
			answer = new Text2SqlAnswer(question, rewritten, followupType, linking, optimization,
					optimization.finalSql(), optimization.rows(), optimization.success(), reply(optimization));
		}
		catch (TextCompletionException e) {
			logger.warn("SQL generation failed for '{}'", rewritten, e);
			answer = new Text2SqlAnswer(question, rewritten, followupType, linking, null, null, null, false,
					"No SQL could be generated for this question: %s\nSuggestion: rephrase the question or name the tables it is about."
							.formatted(e.getMessage()));
		}

		record(connectionId, answer);
		return answer;
	}

	private int defaultIterations() {
		return optimizer.config().maxIterations();
	}

	private void record(String connectionId, Text2SqlAnswer answer) {
		conversation.updateContext(connectionId, answer.question(), answer.assistantMessage(), answer.sql(),
				answer.rows());
		historyStore.append(ChatMessage.user(connectionId, answer.question()));
		historyStore.append(ChatMessage.assistant(connectionId, answer.assistantMessage(), answer.sql(),
				answer.success() ? null : failureDetail(answer.optimization())));
	}

	static String reply(OptimizationResult optimization) {
		if (optimization.success()) {
			return "The query returned %d records.".formatted(optimization.rows().size());
		}
		if (optimization.cancelled()) {
			return "The request was cancelled before a valid result was found.";
		}
		OptimizationStep last = optimization.lastStep();
		if (last != null && last.errorAnalysis() != null) {
			ErrorAnalysis analysis = last.errorAnalysis();
			return "The query could not be completed.\n" + analysis.describe();
		}
		if (last != null && last.validation() != null) {
			return "The query ran, but its result may not match the question: "
					+ String.join("; ", last.validation().issues());
		}
		return "The query could not be completed.";
	}

	private static String failureDetail(OptimizationResult optimization) {
		if (optimization == null || optimization.lastStep() == null || optimization.lastStep().errorAnalysis() == null) {
			return null;
		}
		return optimization.lastStep().errorAnalysis().message();
	}
}
