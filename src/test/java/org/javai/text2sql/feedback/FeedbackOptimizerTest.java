package org.javai.text2sql.feedback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.text2sql.completion.TextCompletion;
import org.javai.text2sql.completion.TextCompletionException;
import org.javai.text2sql.execution.ExecutionResult;
import org.javai.text2sql.execution.QueryExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("FeedbackOptimizer")
class FeedbackOptimizerTest {

	private static final String CONN = "shop";
	private static final String SCHEMA = "[{\"tableName\": \"customers\"}]";
	private static final String BROKEN_SQL = "SELECT nme FROM customers";
	private static final String FIXED_SQL = "SELECT name FROM customers";

	private static final List<Map<String, Object>> NAMES = List.of(
			Map.of("name", "Acme Corp"),
			Map.of("name", "Globex"));

	private QueryExecutor executor;
	private TextCompletion completion;
	private FeedbackOptimizer optimizer;

	@BeforeEach
	void setUp() {
		executor = mock(QueryExecutor.class);
		completion = mock(TextCompletion.class);
		optimizer = new FeedbackOptimizer(executor, completion);
	}

	@Nested
	@DisplayName("Successful runs")
	class SuccessfulRuns {

		@Test
		@DisplayName("A valid first result records exactly one step")
		void validFirstResult() {
			when(executor.execute(CONN, FIXED_SQL)).thenReturn(ExecutionResult.success(NAMES));

			OptimizationResult result = optimizer.optimizeWithFeedback(CONN, "customer names", SCHEMA, FIXED_SQL, 3);

			assertThat(result.success()).isTrue();
			assertThat(result.iterations()).isEqualTo(1);
			assertThat(result.lastStep().kind()).isEqualTo(StepKind.VALIDATED);
			assertThat(result.finalSql()).isEqualTo(FIXED_SQL);
			assertThat(result.rows()).isEqualTo(NAMES);
			verifyNoInteractions(completion);
		}

		@Test
		@DisplayName("A failed execution is classified and repaired")
		void repairedAfterError() {
			when(executor.execute(CONN, BROKEN_SQL))
					.thenReturn(ExecutionResult.failure("ERROR: column \"nme\" does not exist"));
			when(executor.execute(CONN, FIXED_SQL)).thenReturn(ExecutionResult.success(NAMES));
			when(completion.complete(eq(FeedbackOptimizer.OPTIMIZE_TEMPLATE), anyMap()))
					.thenReturn("```sql\n" + FIXED_SQL + "\n```");

			OptimizationResult result = optimizer.optimizeWithFeedback(CONN, "customer names", SCHEMA, BROKEN_SQL);

			assertThat(result.success()).isTrue();
			assertThat(result.steps()).extracting(OptimizationStep::kind)
					.containsExactly(StepKind.ERROR_REPAIR, StepKind.VALIDATED);
			OptimizationStep repair = result.steps().get(0);
			assertThat(repair.inputSql()).isEqualTo(BROKEN_SQL);
			assertThat(repair.outputSql()).isEqualTo(FIXED_SQL);
			assertThat(repair.errorAnalysis().kind()).isEqualTo(ErrorKind.COLUMN_NOT_FOUND);
			assertThat(repair.execution().success()).isFalse();
			assertThat(result.originalSql()).isEqualTo(BROKEN_SQL);
			assertThat(result.finalSql()).isEqualTo(FIXED_SQL);
		}

		@Test
		@DisplayName("The repair request carries schema, question, SQL and the classified error")
		@SuppressWarnings("unchecked")
		void repairRequestArguments() {
			when(executor.execute(CONN, BROKEN_SQL))
					.thenReturn(ExecutionResult.failure("ERROR: column \"nme\" does not exist"));
			when(executor.execute(CONN, FIXED_SQL)).thenReturn(ExecutionResult.success(NAMES));
			when(completion.complete(anyString(), anyMap())).thenReturn(FIXED_SQL);

			optimizer.optimizeWithFeedback(CONN, "customer names", SCHEMA, BROKEN_SQL);

			ArgumentCaptor<Map<String, String>> args = ArgumentCaptor.forClass(Map.class);
			verify(completion).complete(eq(FeedbackOptimizer.OPTIMIZE_TEMPLATE), args.capture());
			assertThat(args.getValue())
					.containsEntry("schemaInfo", SCHEMA)
					.containsEntry("userMessage", "customer names")
					.containsEntry("originalSql", BROKEN_SQL);
			assertThat(args.getValue().get("errorMessage"))
					.startsWith("column not found: ERROR: column \"nme\" does not exist")
					.contains("Suggestion: " + ErrorKind.COLUMN_NOT_FOUND.hint());
		}

		@Test
		@DisplayName("A result that fails validation is refined with the listed issues")
		@SuppressWarnings("unchecked")
		void refinedAfterValidation() {
			String unsorted = "SELECT name, amount FROM orders";
			String sorted = "SELECT name, amount FROM orders ORDER BY amount DESC";
			when(executor.execute(CONN, unsorted)).thenReturn(ExecutionResult.success(List.of(
					Map.of("amount", 100), Map.of("amount", 80), Map.of("amount", 90))));
			when(executor.execute(CONN, sorted)).thenReturn(ExecutionResult.success(List.of(
					Map.of("amount", 100), Map.of("amount", 90), Map.of("amount", 80))));
			when(completion.complete(anyString(), anyMap())).thenReturn(sorted);

			OptimizationResult result = optimizer.optimizeWithFeedback(CONN, "orders with the highest amount",
					SCHEMA, unsorted);

			assertThat(result.steps()).extracting(OptimizationStep::kind)
					.containsExactly(StepKind.RESULT_REFINEMENT, StepKind.VALIDATED);
			OptimizationStep refinement = result.steps().get(0);
			assertThat(refinement.validation().issues()).containsExactly("rows are not sorted from highest to lowest");
			assertThat(refinement.feedback())
					.contains("- rows are not sorted from highest to lowest")
					.contains("Original question: orders with the highest amount");

			ArgumentCaptor<Map<String, String>> args = ArgumentCaptor.forClass(Map.class);
			verify(completion).complete(eq(FeedbackOptimizer.OPTIMIZE_TEMPLATE), args.capture());
			assertThat(args.getValue().get("errorMessage")).startsWith("Result validation issues: ");
			assertThat(result.rows()).extracting(row -> row.get("amount")).containsExactly(100, 90, 80);
		}
	}

	@Nested
	@DisplayName("Unsuccessful runs")
	class UnsuccessfulRuns {

		@Test
		@DisplayName("Exhaustion returns the best known SQL with success false")
		void exhaustion() {
			when(executor.execute(eq(CONN), anyString())).thenReturn(ExecutionResult.failure("syntax error at or near \"FORM\""));
			when(completion.complete(anyString(), anyMap())).thenReturn("SELECT 1 FORM a", "SELECT 2 FORM b", "SELECT 3 FORM c");

			OptimizationResult result = optimizer.optimizeWithFeedback(CONN, "q", SCHEMA, "SELECT 0 FORM x", 3);

			assertThat(result.success()).isFalse();
			assertThat(result.iterations()).isEqualTo(3);
			assertThat(result.steps()).allSatisfy(step -> {
				assertThat(step.kind()).isEqualTo(StepKind.ERROR_REPAIR);
				assertThat(step.errorAnalysis().kind()).isEqualTo(ErrorKind.SYNTAX_ERROR);
			});
			assertThat(result.finalSql()).isEqualTo("SELECT 3 FORM c");
			assertThat(result.rows()).isEmpty();
		}

		@Test
		@DisplayName("A failed completion keeps the current SQL for the next pass")
		void completionFailureKeepsSql() {
			when(executor.execute(CONN, BROKEN_SQL)).thenReturn(ExecutionResult.failure("table foo not found"));
			when(completion.complete(anyString(), anyMap())).thenThrow(new TextCompletionException("model unavailable"));

			OptimizationResult result = optimizer.optimizeWithFeedback(CONN, "q", SCHEMA, BROKEN_SQL, 2);

			assertThat(result.steps()).extracting(OptimizationStep::outputSql).containsExactly(BROKEN_SQL, BROKEN_SQL);
			verify(executor, times(2)).execute(CONN, BROKEN_SQL);
		}

		@Test
		@DisplayName("An empty rewrite keeps the current SQL")
		void emptyRewriteKeepsSql() {
			when(executor.execute(CONN, BROKEN_SQL)).thenReturn(ExecutionResult.failure("table foo not found"));
			when(completion.complete(anyString(), anyMap())).thenReturn("```sql\n```");

			OptimizationResult result = optimizer.optimizeWithFeedback(CONN, "q", SCHEMA, BROKEN_SQL, 1);

			assertThat(result.finalSql()).isEqualTo(BROKEN_SQL);
		}

		@Test
		@DisplayName("An internal fault aborts the loop with a system error")
		void internalFault() {
			when(executor.execute(CONN, BROKEN_SQL)).thenThrow(new IllegalStateException("pool exhausted"));

			OptimizationResult result = optimizer.optimizeWithFeedback(CONN, "q", SCHEMA, BROKEN_SQL, 3);

			assertThat(result.iterations()).isEqualTo(1);
			OptimizationStep step = result.lastStep();
			assertThat(step.kind()).isEqualTo(StepKind.SYSTEM_ERROR);
			assertThat(step.outputSql()).isEqualTo(step.inputSql());
			assertThat(step.errorAnalysis().kind()).isEqualTo(ErrorKind.SYSTEM_ERROR);
			assertThat(step.errorAnalysis().message()).isEqualTo("pool exhausted");
			assertThat(result.success()).isFalse();
			verify(completion, never()).complete(anyString(), anyMap());
		}

		@Test
		@DisplayName("A pass exceeding the timeout aborts with a system error and is interrupted")
		void timeout() throws InterruptedException {
			CountDownLatch interrupted = new CountDownLatch(1);
			when(executor.execute(CONN, BROKEN_SQL)).thenAnswer(invocation -> {
				try {
					Thread.sleep(5_000);
				}
				catch (InterruptedException e) {
					interrupted.countDown();
					throw e;
				}
				return ExecutionResult.success(NAMES);
			});

			try (FeedbackOptimizer bounded = new FeedbackOptimizer(executor, completion,
					FeedbackOptimizerConfig.builder().iterationTimeout(Duration.ofMillis(50)).build())) {
				OptimizationResult result = bounded.optimizeWithFeedback(CONN, "q", SCHEMA, BROKEN_SQL);

				assertThat(result.iterations()).isEqualTo(1);
				assertThat(result.lastStep().kind()).isEqualTo(StepKind.SYSTEM_ERROR);
				assertThat(result.lastStep().errorAnalysis().message()).contains("timed out");
				assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
			}
		}

		@Test
		@DisplayName("A timed-out pass makes no collaborator call after the run returns")
		void noCallsAfterTimeout() throws InterruptedException {
			CountDownLatch executionFinished = new CountDownLatch(1);
			when(executor.execute(CONN, BROKEN_SQL)).thenAnswer(invocation -> {
				try {
					Thread.sleep(300);
				}
				catch (InterruptedException e) {
					// keep going like a driver that ignores interrupts
				}
				executionFinished.countDown();
				return ExecutionResult.failure("column \"nme\" does not exist");
			});

			try (FeedbackOptimizer bounded = new FeedbackOptimizer(executor, completion,
					FeedbackOptimizerConfig.builder().iterationTimeout(Duration.ofMillis(50)).build())) {
				OptimizationResult result = bounded.optimizeWithFeedback(CONN, "q", SCHEMA, BROKEN_SQL);

				assertThat(result.lastStep().kind()).isEqualTo(StepKind.SYSTEM_ERROR);
				assertThat(executionFinished.await(2, TimeUnit.SECONDS)).isTrue();
				Thread.sleep(100);
				verify(executor, times(1)).execute(anyString(), anyString());
				verifyNoInteractions(completion);
			}
		}

		@Test
		@DisplayName("Without a timeout close has nothing to stop")
		void closeWithoutTimeout() {
			when(executor.execute(CONN, FIXED_SQL)).thenReturn(ExecutionResult.success(NAMES));

			optimizer.close();

			assertThat(optimizer.optimizeWithFeedback(CONN, "customer names", SCHEMA, FIXED_SQL).success()).isTrue();
		}

		@Test
		@DisplayName("At least one iteration is required")
		void invalidIterations() {
			assertThatThrownBy(() -> optimizer.optimizeWithFeedback(CONN, "q", SCHEMA, FIXED_SQL, 0))
					.isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Nested
	@DisplayName("Cancellation")
	class Cancellation {

		@Test
		@DisplayName("Cancelled before the first pass records no steps")
		void cancelledUpfront() {
			OptimizationResult result = optimizer.optimizeWithFeedback(CONN, "q", SCHEMA, FIXED_SQL, 3, () -> true);

			assertThat(result.cancelled()).isTrue();
			assertThat(result.steps()).isEmpty();
			assertThat(result.finalSql()).isEqualTo(FIXED_SQL);
			verifyNoInteractions(executor);
		}

		@Test
		@DisplayName("Cancellation is observed between passes")
		void cancelledBetweenPasses() {
			AtomicInteger polls = new AtomicInteger();
			when(executor.execute(eq(CONN), anyString())).thenReturn(ExecutionResult.failure("syntax error"));
			when(completion.complete(anyString(), anyMap())).thenReturn("SELECT 2");

			OptimizationResult result = optimizer.optimizeWithFeedback(CONN, "q", SCHEMA, "SELECT 1", 3,
					() -> polls.incrementAndGet() > 1);

			assertThat(result.cancelled()).isTrue();
			assertThat(result.iterations()).isEqualTo(1);
			assertThat(result.finalSql()).isEqualTo("SELECT 2");
		}
	}
}
