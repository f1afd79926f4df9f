package org.javai.text2sql.conversation;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConversationContextManager")
class ConversationContextManagerTest {

	private static final String CONN = "shop";
	private static final String ACME_QUESTION = "Show orders placed by \"Acme Corp\"";

	private InMemoryChatHistoryStore historyStore;
	private ConversationContextManager manager;

	@BeforeEach
	void setUp() {
		historyStore = new InMemoryChatHistoryStore();
		manager = new ConversationContextManager(historyStore, ConversationConfig.defaults());
	}

	private void turn(String question, String sql) {
		manager.updateContext(CONN, question, "done", sql, List.of(Map.of("id", 1)));
	}

	@Nested
	@DisplayName("Coreference resolution")
	class Coreferences {

		@Test
		@DisplayName("A pronoun is replaced by the most recent entity")
		void pronounReplaced() {
			turn(ACME_QUESTION, "SELECT * FROM orders o JOIN customers c ON o.customer_id = c.id WHERE c.name = 'Acme Corp'");

			assertThat(manager.resolveCoreferences(CONN, "how much did it cost"))
					.isEqualTo("how much did Acme Corp cost");
		}

		@Test
		@DisplayName("Pronouns inside other words are left alone")
		void wholeWordsOnly() {
			turn(ACME_QUESTION, null);

			assertThat(manager.resolveCoreferences(CONN, "list its items")).isEqualTo("list its items");
		}

		@Test
		@DisplayName("Without history the message is unchanged")
		void noHistory() {
			assertThat(manager.resolveCoreferences(CONN, "how much did it cost")).isEqualTo("how much did it cost");
		}

		@Test
		@DisplayName("Entities older than the lookback window are not used")
		void lookbackWindow() {
			turn(ACME_QUESTION, null);
			turn("show everything", null);
			turn("group by region", null);
			turn("only paid ones", null);

			assertThat(manager.resolveCoreferences(CONN, "how much did it cost")).isEqualTo("how much did it cost");
		}

		@Test
		@DisplayName("Continuation markers add the previous table and time range")
		void continuation() {
			turn("最近7天的订单", "SELECT * FROM orders WHERE order_date >= '2024-05-01'");

			assertThat(manager.resolveCoreferences(CONN, "also the cancelled ones"))
					.isEqualTo("最近7天, In table orders, also the cancelled ones");
		}

		@Test
		@DisplayName("A message naming a table keeps its own table")
		void continuationWithExplicitTable() {
			turn("orders of today", "SELECT * FROM orders");

			assertThat(manager.resolveCoreferences(CONN, "also the refunds table"))
					.isEqualTo("also the refunds table");
		}

		@Test
		@DisplayName("Relative time phrases become the active time range")
		void relativeTime() {
			turn("最近7天的订单", "SELECT * FROM orders");

			assertThat(manager.resolveCoreferences(CONN, "和上次相比呢")).isEqualTo("和最近7天相比呢");
		}

		@Test
		@DisplayName("References to the previous result are made explicit")
		void previousResult() {
			turn("orders of today", "SELECT * FROM orders");

			assertThat(manager.resolveCoreferences(CONN, "这些里面金额最高的"))
					.isEqualTo(ConversationContextManager.PREVIOUS_RESULT_PREFIX + "这些里面金额最高的");
		}
	}

	@Nested
	@DisplayName("Follow-up handling")
	class Followups {

		@Test
		@DisplayName("Without history every message is a new query")
		void newConnection() {
			assertThat(manager.analyzeFollowupQuery(CONN, "sort by date")).isEqualTo(FollowupQueryType.NEW_QUERY);
		}

		@Test
		@DisplayName("Follow-ups are classified against existing history")
		void classified() {
			turn(ACME_QUESTION, null);

			assertThat(manager.analyzeFollowupQuery(CONN, "how much did it cost"))
					.isEqualTo(FollowupQueryType.PRONOUN_REFERENCE);
			assertThat(manager.analyzeFollowupQuery(CONN, "sort by date")).isEqualTo(FollowupQueryType.SORTING_CHANGE);
		}

		@Test
		@DisplayName("Incremental queries carry the previous question")
		void incremental() {
			turn(ACME_QUESTION, null);

			assertThat(manager.processIncrementalQuery(CONN, "only above 100", FollowupQueryType.FILTER_REFINEMENT))
					.isEqualTo("Previous query: " + ACME_QUESTION + ". Narrow its result: only above 100");
			assertThat(manager.processIncrementalQuery(CONN, "sort by date", FollowupQueryType.SORTING_CHANGE))
					.isEqualTo("Previous query: " + ACME_QUESTION + ". Keep its content and conditions, sort by date");
			assertThat(manager.processIncrementalQuery(CONN, "count them", FollowupQueryType.AGGREGATION_CHANGE))
					.startsWith("Previous query: " + ACME_QUESTION + ". Using the same tables and conditions, ");
			assertThat(manager.processIncrementalQuery(CONN, "include email", FollowupQueryType.COLUMN_EXPANSION))
					.endsWith("Keep its result and add: include email");
			assertThat(manager.processIncrementalQuery(CONN, "compare with Globex", FollowupQueryType.COMPARISON))
					.endsWith("Compare with its result: compare with Globex");
			assertThat(manager.processIncrementalQuery(CONN, "how much did it cost", FollowupQueryType.PRONOUN_REFERENCE))
					.isEqualTo("how much did Acme Corp cost");
			assertThat(manager.processIncrementalQuery(CONN, "revenue by month", FollowupQueryType.NEW_QUERY))
					.isEqualTo("revenue by month");
		}

		@Test
		@DisplayName("Incremental rewriting needs a previous turn")
		void incrementalWithoutHistory() {
			assertThat(manager.processIncrementalQuery(CONN, "only above 100", FollowupQueryType.FILTER_REFINEMENT))
					.isEqualTo("only above 100");
		}
	}

	@Nested
	@DisplayName("Context state")
	class State {

		@Test
		@DisplayName("Turns record entities, result summary and active filters")
		void recordedTurn() {
			manager.updateContext(CONN, "customers in 'Berlin' over the past 30 days", "2 rows",
					"SELECT name FROM customers WHERE city = 'Berlin' ORDER BY name",
					List.of(Map.of("name", "Acme Corp", "city", "Berlin"), Map.of("name", "Globex", "city", "Berlin")));

			ConversationSnapshot snapshot = manager.getContext(CONN);
			ConversationTurn turn = snapshot.lastTurn().orElseThrow();
			assertThat(turn.resultSummary()).isEqualTo("2 records, 2 fields");
			assertThat(turn.extractedEntities()).containsExactly("30", "Berlin");
			assertThat(snapshot.activeFilter(ConversationContext.LAST_WHERE)).contains("city = 'Berlin'");
			assertThat(snapshot.activeFilter(ConversationContext.TIME_RANGE)).contains("past 30 days");
		}

		@Test
		@DisplayName("History is capped at the configured size")
		void cappedHistory() {
			for (int i = 1; i <= 11; i++) {
				turn("question number " + i, null);
			}

			List<ConversationTurn> history = manager.getContext(CONN).history();
			assertThat(history).hasSize(10);
			assertThat(history.get(0).userMessage()).isEqualTo("question number 2");
		}

		@Test
		@DisplayName("A context is rebuilt from chat history on first access")
		void loadedFromHistory() {
			historyStore.append(ChatMessage.user(CONN, "orders from the past 7 days"));
			historyStore.append(ChatMessage.assistant(CONN, "The query returned 3 records.",
					"SELECT * FROM orders WHERE status = 'open'", null));
			historyStore.append(ChatMessage.user(CONN, "and the refunds?"));

			ConversationSnapshot snapshot = manager.getContext(CONN);

			assertThat(snapshot.history()).extracting(ConversationTurn::userMessage)
					.containsExactly("orders from the past 7 days", "and the refunds?");
			assertThat(snapshot.history().get(0).generatedSql()).isEqualTo("SELECT * FROM orders WHERE status = 'open'");
			assertThat(snapshot.history().get(1).assistantMessage()).isEmpty();
			assertThat(snapshot.activeFilter(ConversationContext.LAST_WHERE)).contains("status = 'open'");
			assertThat(snapshot.activeFilter(ConversationContext.TIME_RANGE)).contains("past 7 days");
		}

		@Test
		@DisplayName("Clear drops memory only, forget also drops chat history")
		void clearAndForget() {
			historyStore.append(ChatMessage.user(CONN, "orders of today"));
			turn("orders of yesterday", null);
			assertThat(manager.getContext(CONN).history()).hasSize(2);

			manager.clear(CONN);
			assertThat(manager.getContext(CONN).history()).hasSize(1);

			manager.forget(CONN);
			assertThat(manager.getContext(CONN).isEmpty()).isTrue();
			assertThat(historyStore.recent(CONN, 10)).isEmpty();
		}

		@Test
		@DisplayName("An update waiting while the context is cleared lands in the rebuilt context")
		void updateDuringClear() throws Exception {
			ConversationContext held = manager.context(CONN);
			Thread writer = new Thread(() -> turn(ACME_QUESTION, null));

			held.runLocked(() -> {
				writer.start();
				try {
					Thread.sleep(50);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				manager.clear(CONN);
			});
			writer.join(2_000);

			assertThat(writer.isAlive()).isFalse();
			assertThat(held.isRetired()).isTrue();
			assertThat(manager.getContext(CONN).history())
					.extracting(ConversationTurn::userMessage)
					.containsExactly(ACME_QUESTION);
		}

		@Test
		@DisplayName("Connections do not share state")
		void isolated() {
			turn(ACME_QUESTION, null);

			assertThat(manager.getContext("other").isEmpty()).isTrue();
			assertThat(manager.resolveCoreferences("other", "how much did it cost")).isEqualTo("how much did it cost");
		}

		@Test
		@DisplayName("Readable JSON shows the conversation state")
		void readableJson() {
			turn(ACME_QUESTION, "SELECT * FROM orders WHERE customer = 'Acme Corp'");

			assertThat(manager.toReadableJson(CONN))
					.contains("\"connectionId\" : \"shop\"")
					.contains("Acme Corp")
					.contains("last_where")
					.doesNotContain("\"empty\"");
		}

		@Test
		@DisplayName("Concurrent updates of one connection are all recorded")
		void concurrentUpdates() throws Exception {
			ConversationContextManager roomy = new ConversationContextManager(historyStore,
					ConversationConfig.builder().maxHistorySize(1000).build());
			ExecutorService pool = Executors.newFixedThreadPool(8);
			try {
				List<Future<?>> futures = new java.util.ArrayList<>();
				for (int t = 0; t < 8; t++) {
					int thread = t;
					futures.add(pool.submit(() -> {
						for (int i = 0; i < 25; i++) {
							roomy.updateContext(CONN, "question " + thread + "-" + i, "ok", null, null);
						}
					}));
				}
				for (Future<?> future : futures) {
					future.get();
				}
			}
			finally {
				pool.shutdown();
			}

			assertThat(roomy.getContext(CONN).history()).hasSize(200);
		}
	}

	@Test
	@DisplayName("WHERE clauses stop at the next clause")
	void whereClause() {
		assertThat(ConversationContextManager.extractWhereClause(
				"SELECT region, sum(amount) FROM orders WHERE amount > 10 AND region <> 'EU' GROUP BY region"))
				.contains("amount > 10 AND region <> 'EU'");
		assertThat(ConversationContextManager.extractWhereClause("select * from t where a = 1 limit 5"))
				.contains("a = 1");
		assertThat(ConversationContextManager.extractWhereClause("SELECT * FROM t WHERE b = 2;")).contains("b = 2");
		assertThat(ConversationContextManager.extractWhereClause("SELECT * FROM t")).isEmpty();
		assertThat(ConversationContextManager.extractWhereClause(null)).isEmpty();
	}

	@Test
	@DisplayName("Time ranges are read in Chinese and English")
	void timeRange() {
		assertThat(ConversationContextManager.extractTimeRange("最近 3 个月的销售额")).contains("最近 3 个月");
		assertThat(ConversationContextManager.extractTimeRange("过去30天")).contains("过去30天");
		assertThat(ConversationContextManager.extractTimeRange("revenue in the last 2 weeks")).contains("last 2 weeks");
		assertThat(ConversationContextManager.extractTimeRange("revenue per week")).isEmpty();
	}

	@Test
	@DisplayName("Result summary counts records and fields")
	void summary() {
		assertThat(ConversationContextManager.summarize(null)).isEqualTo("no results");
		assertThat(ConversationContextManager.summarize(List.of())).isEqualTo("no results");
		assertThat(ConversationContextManager.summarize(List.of(Map.of("a", 1, "b", 2)))).isEqualTo("1 records, 2 fields");
	}
}
