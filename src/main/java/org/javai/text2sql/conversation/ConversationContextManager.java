package org.javai.text2sql.conversation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.text2sql.text.KeywordMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps per-connection conversation state and uses it to rewrite follow-up questions.
 *
 * <p>Contexts are created lazily, seeded from the {@link ChatHistoryStore}, and live until
 * {@link #clear} is called. Every read-modify-write of a context runs under that context's lock.</p>
 *
 * <h2>Coreference resolution</h2>
 * <ol>
 *   <li>each pronoun is replaced by the first entity of the most recent turn (within the
 *       lookback window) that has entities</li>
 *   <li>a message with a continuation marker ("also", "too", "也", ...) is prefixed with the
 *       previous turn's table, unless it names a table itself, and with the active time range</li>
 *   <li>relative time phrases ("同比", "上次", ...) are replaced by the active time range</li>
 *   <li>a message referring to the previous result ("这些", ...) is prefixed accordingly</li>
 * </ol>
 */
public class ConversationContextManager {

	private static final Logger logger = LoggerFactory.getLogger(ConversationContextManager.class);

	private static final Pattern WHERE_PATTERN = Pattern.compile(
			"\\bWHERE\\s+(.+?)(?:\\s+GROUP\\s+BY|\\s+ORDER\\s+BY|\\s+HAVING|\\s+LIMIT|\\s*;|$)",
			Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

	private static final List<Pattern> TIME_RANGE_PATTERNS = List.of(
			Pattern.compile("(最近|最后|过去|前)\\s*(\\d+)\\s*个?\\s*(天|月|年|小时|分钟)"),
			Pattern.compile("\\b(?:last|past|previous)\\s+\\d+\\s+(?:minutes?|hours?|days?|weeks?|months?|years?)\\b",
					Pattern.CASE_INSENSITIVE));

	static final String PREVIOUS_RESULT_PREFIX = "Based on the previous query's result, ";

	private final ConcurrentHashMap<String, ConversationContext> contexts = new ConcurrentHashMap<>();
	private final ChatHistoryStore historyStore;
	private final ConversationConfig config;
	private final ConversationKeywords keywords;
	private final FollowupClassifier classifier;
	private final EntityExtractor entityExtractor;
	private final TableReferenceDetector tableDetector;
	private final ObjectMapper mapper = new ObjectMapper()
			.registerModule(new JavaTimeModule())
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

	public ConversationContextManager() {
		this(new InMemoryChatHistoryStore(), ConversationConfig.defaults());
	}

	public ConversationContextManager(ChatHistoryStore historyStore, ConversationConfig config) {
		this(historyStore, config, ConversationKeywords.defaults());
	}

	public ConversationContextManager(ChatHistoryStore historyStore, ConversationConfig config,
			ConversationKeywords keywords) {
		this(historyStore, config, keywords, new KeywordFollowupClassifier(keywords), new PatternEntityExtractor());
	}

	public ConversationContextManager(ChatHistoryStore historyStore, ConversationConfig config,
			ConversationKeywords keywords, FollowupClassifier classifier, EntityExtractor entityExtractor) {
		this.historyStore = Objects.requireNonNull(historyStore, "historyStore must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.keywords = Objects.requireNonNull(keywords, "keywords must not be null");
		this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
		this.entityExtractor = Objects.requireNonNull(entityExtractor, "entityExtractor must not be null");
		this.tableDetector = new TableReferenceDetector(keywords);
	}

	/**
	 * Records a finished turn.
	 *
	 * @param result rows returned by the turn's SQL (may be null)
	 */
	public void updateContext(String connectionId, String userMessage, String assistantMessage, String sql,
			List<Map<String, Object>> result) {
		ConversationTurn turn = new ConversationTurn(userMessage, assistantMessage, sql, summarize(result),
				entityExtractor.extract(userMessage), Instant.now());
		int size = -1;
		while (size < 0) {
			ConversationContext context = context(connectionId);
			size = context.withLock(() -> {
				if (context.isRetired()) {
					return -1;
				}
				applyTurn(context, turn);
				return context.snapshot().history().size();
			});
		}
		logger.info("Updated conversation context of connection {} ({} turns)", connectionId, size);
	}

	public String resolveCoreferences(String connectionId, String message) {
		Objects.requireNonNull(message, "message must not be null");
		ConversationSnapshot snapshot = getContext(connectionId);
		if (snapshot.isEmpty()) {
			return message;
		}

		String resolved = resolvePronouns(message, snapshot);
		if (KeywordMatcher.containsAny(resolved, keywords.continuationMarkers())) {
			resolved = addImplicitContext(resolved, snapshot);
		}
		resolved = resolveRelativeTime(resolved, snapshot);
		if (KeywordMatcher.containsAny(resolved, keywords.resultReferenceWords())) {
			resolved = PREVIOUS_RESULT_PREFIX + resolved;
		}

		if (!resolved.equals(message)) {
			logger.info("Resolved '{}' to '{}'", message, resolved);
		}
		return resolved;
	}

	public FollowupQueryType analyzeFollowupQuery(String connectionId, String message) {
		boolean hasContext = !getContext(connectionId).isEmpty();
		FollowupQueryType type = classifier.classify(message, hasContext);
		logger.debug("Classified '{}' as {}", message, type);
		return type;
	}

	/**
	 * Rewrites a follow-up so that it carries the previous question. Pronoun references are
	 * resolved instead; new queries and connections without history are returned unchanged.
	 */
	public String processIncrementalQuery(String connectionId, String message, FollowupQueryType queryType) {
		Objects.requireNonNull(message, "message must not be null");
		Objects.requireNonNull(queryType, "queryType must not be null");
		Optional<ConversationTurn> lastTurn = getContext(connectionId).lastTurn();
		if (lastTurn.isEmpty()) {
			return message;
		}
		String previous = lastTurn.get().userMessage();
		return switch (queryType) {
			case FILTER_REFINEMENT -> "Previous query: %s. Narrow its result: %s".formatted(previous, message);
			case AGGREGATION_CHANGE -> "Previous query: %s. Using the same tables and conditions, %s"
					.formatted(previous, message);
			case COLUMN_EXPANSION -> "Previous query: %s. Keep its result and add: %s".formatted(previous, message);
			case SORTING_CHANGE -> "Previous query: %s. Keep its content and conditions, %s"
					.formatted(previous, message);
			case COMPARISON -> "Previous query: %s. Compare with its result: %s".formatted(previous, message);
			case PRONOUN_REFERENCE -> resolveCoreferences(connectionId, message);
			case NEW_QUERY -> message;
		};
	}

	/**
	 * Returns the conversation state of a connection, loading it from chat history on first access.
	 */
	public ConversationSnapshot getContext(String connectionId) {
		ConversationContext context = context(connectionId);
		return context.withLock(context::snapshot);
	}

	/**
	 * Drops the in-memory context of a connection. The next access rebuilds it from chat history.
	 * An update waiting on the dropped context is applied to the rebuilt one.
	 */
	public void clear(String connectionId) {
		boolean[] cleared = {false};
		contexts.computeIfPresent(connectionId, (id, context) -> {
			context.runLocked(context::retire);
			cleared[0] = true;
			return null;
		});
		if (cleared[0]) {
			logger.info("Cleared conversation context of connection {}", connectionId);
		}
	}

	/**
	 * Drops the in-memory context and the stored chat history of a connection.
	 */
	public void forget(String connectionId) {
		historyStore.clear(connectionId);
		clear(connectionId);
	}

	/**
	 * Pretty-printed JSON of a connection's conversation state, for diagnostics.
	 */
	public String toReadableJson(String connectionId) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(getContext(connectionId));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to write conversation context of " + connectionId, e);
		}
	}

	ConversationContext context(String connectionId) {
		Objects.requireNonNull(connectionId, "connectionId must not be null");
		return contexts.computeIfAbsent(connectionId, this::loadFromHistory);
	}

	private ConversationContext loadFromHistory(String connectionId) {
		ConversationContext context = new ConversationContext(connectionId, config.maxHistorySize());
		List<ChatMessage> messages = historyStore.recent(connectionId, config.maxHistorySize() * 2);
		List<ConversationTurn> turns = new ArrayList<>();
		for (int i = 0; i < messages.size(); i++) {
			ChatMessage message = messages.get(i);
			if (!message.fromUser()) {
				continue;
			}
			ChatMessage answer = i + 1 < messages.size() && !messages.get(i + 1).fromUser() ? messages.get(i + 1) : null;
			turns.add(new ConversationTurn(
					message.message(),
					answer != null ? answer.message() : "",
					answer != null ? answer.sqlQuery() : null,
					"",
					entityExtractor.extract(message.message()),
					message.createdAt()));
		}
		context.runLocked(() -> turns.forEach(turn -> applyTurn(context, turn)));
		if (!turns.isEmpty()) {
			logger.info("Loaded {} turns of connection {} from chat history", turns.size(), connectionId);
		}
		return context;
	}

	/**
	 * Caller holds the context lock.
	 */
	private void applyTurn(ConversationContext context, ConversationTurn turn) {
		context.append(turn);
		extractWhereClause(turn.generatedSql()).ifPresent(where -> context.putFilter(ConversationContext.LAST_WHERE, where));
		extractTimeRange(turn.userMessage()).ifPresent(range -> context.putFilter(ConversationContext.TIME_RANGE, range));
	}

	static Optional<String> extractWhereClause(String sql) {
		if (sql == null) {
			return Optional.empty();
		}
		Matcher matcher = WHERE_PATTERN.matcher(sql);
		if (!matcher.find()) {
			return Optional.empty();
		}
		String where = matcher.group(1).trim();
		return where.isEmpty() ? Optional.empty() : Optional.of(where);
	}

	static Optional<String> extractTimeRange(String message) {
		if (message == null) {
			return Optional.empty();
		}
		for (Pattern pattern : TIME_RANGE_PATTERNS) {
			Matcher matcher = pattern.matcher(message);
			if (matcher.find()) {
				return Optional.of(matcher.group());
			}
		}
		return Optional.empty();
	}

	static String summarize(List<Map<String, Object>> result) {
		if (result == null || result.isEmpty()) {
			return "no results";
		}
		return "%d records, %d fields".formatted(result.size(), result.get(0).size());
	}

	private String resolvePronouns(String message, ConversationSnapshot snapshot) {
		Optional<String> entity = findRecentEntity(snapshot);
		if (entity.isEmpty()) {
			return message;
		}
		String resolved = message;
		for (String pronoun : keywords.pronouns()) {
			resolved = KeywordMatcher.replaceAll(resolved, pronoun, entity.get());
		}
		return resolved;
	}

	private Optional<String> findRecentEntity(ConversationSnapshot snapshot) {
		List<ConversationTurn> history = snapshot.history();
		int oldest = Math.max(0, history.size() - config.entityLookbackTurns());
		for (int i = history.size() - 1; i >= oldest; i--) {
			ConversationTurn turn = history.get(i);
			if (turn.hasEntities()) {
				return Optional.of(turn.extractedEntities().get(0));
			}
		}
		return Optional.empty();
	}

	private String addImplicitContext(String message, ConversationSnapshot snapshot) {
		String enhanced = message;
		Optional<ConversationTurn> lastTurn = snapshot.lastTurn();
		if (lastTurn.isPresent() && !tableDetector.containsTableReference(message)) {
			Optional<String> table = tableDetector.tableContext(lastTurn.get());
			if (table.isPresent()) {
				enhanced = "In table %s, %s".formatted(table.get(), enhanced);
			}
		}
		Optional<String> timeRange = snapshot.activeFilter(ConversationContext.TIME_RANGE);
		if (timeRange.isPresent()) {
			enhanced = timeRange.get() + ", " + enhanced;
		}
		return enhanced;
	}

	private String resolveRelativeTime(String message, ConversationSnapshot snapshot) {
		Optional<String> timeRange = snapshot.activeFilter(ConversationContext.TIME_RANGE);
		if (timeRange.isEmpty()) {
			return message;
		}
		String resolved = message;
		for (String phrase : keywords.relativeTimeWords()) {
			resolved = KeywordMatcher.replaceAll(resolved, phrase, timeRange.get());
		}
		return resolved;
	}
}
