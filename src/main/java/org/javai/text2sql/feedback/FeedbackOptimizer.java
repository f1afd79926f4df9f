package org.javai.text2sql.feedback;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.javai.text2sql.completion.SqlResponseCleaner;
import org.javai.text2sql.completion.TextCompletion;
import org.javai.text2sql.completion.TextCompletionException;
import org.javai.text2sql.execution.ExecutionResult;
import org.javai.text2sql.execution.QueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a draft SQL statement into one that runs and returns a plausible result.
 *
 * <p>Each pass executes the current SQL. A failed execution is classified by
 * {@link ErrorClassifier} and a repair is requested; a successful one is checked by
 * {@link ResultValidator} and, if it fails, a refinement is requested listing the issues. Both
 * requests use the {@value #OPTIMIZE_TEMPLATE} template and their output becomes the next pass's
 * input. The run ends on the first result that passes validation or after {@code maxIterations}
 * passes.</p>
 *
 * <p>A failed completion keeps the current SQL for the next pass. Any other fault inside a pass,
 * including a pass timeout, records a {@link StepKind#SYSTEM_ERROR} step and ends the run.
 * Cancellation is checked before every pass.</p>
 *
 * <p>With an {@code iterationTimeout} each pass runs on a worker owned by the optimizer. A pass that
 * times out is interrupted and abandoned: it makes no further collaborator calls. {@link #close()}
 * stops the workers.</p>
 */
public class FeedbackOptimizer implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(FeedbackOptimizer.class);

	public static final String OPTIMIZE_TEMPLATE = "optimize_sql_query";

	private final QueryExecutor executor;
	private final TextCompletion completion;
	private final FeedbackOptimizerConfig config;
	private final ResultValidator validator;
	private final ErrorClassifier classifier;
	private final ExecutorService passRunner;

	public FeedbackOptimizer(QueryExecutor executor, TextCompletion completion) {
		this(executor, completion, FeedbackOptimizerConfig.defaults());
	}

	public FeedbackOptimizer(QueryExecutor executor, TextCompletion completion, FeedbackOptimizerConfig config) {
		this(executor, completion, config, new ResultValidator(config), new ErrorClassifier());
	}

	public FeedbackOptimizer(QueryExecutor executor, TextCompletion completion, FeedbackOptimizerConfig config,
			ResultValidator validator, ErrorClassifier classifier) {
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		this.completion = Objects.requireNonNull(completion, "completion must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.validator = Objects.requireNonNull(validator, "validator must not be null");
		this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
		this.passRunner = config.iterationTimeout() != null ? Executors.newCachedThreadPool(passThreads()) : null;
	}

	public FeedbackOptimizerConfig config() {
		return config;
	}

	public OptimizationResult optimizeWithFeedback(String connectionId, String question, String schemaInfo,
			String initialSql) {
		return optimizeWithFeedback(connectionId, question, schemaInfo, initialSql, config.maxIterations());
	}

	public OptimizationResult optimizeWithFeedback(String connectionId, String question, String schemaInfo,
			String initialSql, int maxIterations) {
		return optimizeWithFeedback(connectionId, question, schemaInfo, initialSql, maxIterations, () -> false);
	}

	/**
	 * Runs the loop.
	 *
	 * @param maxIterations maximum number of passes
	 * @param cancelled polled before each pass; once true the run stops with {@code cancelled = true}
	 */
	public OptimizationResult optimizeWithFeedback(String connectionId, String question, String schemaInfo,
			String initialSql, int maxIterations, BooleanSupplier cancelled) {
		Objects.requireNonNull(initialSql, "initialSql must not be null");
		Objects.requireNonNull(cancelled, "cancelled must not be null");
		if (maxIterations < 1) {
			throw new IllegalArgumentException("maxIterations must be at least 1");
		}
		Request request = new Request(connectionId, question != null ? question : "",
				schemaInfo != null ? schemaInfo : "");

		List<OptimizationStep> steps = new ArrayList<>();
		List<Map<String, Object>> lastRows = List.of();
		String currentSql = initialSql;
		boolean success = false;
		boolean wasCancelled = false;

		for (int iteration = 1; iteration <= maxIterations; iteration++) {
			if (cancelled.getAsBoolean()) {
				logger.info("Optimization cancelled before iteration {}", iteration);
				wasCancelled = true;
				break;
			}
			logger.info("Starting optimization iteration {} of {}", iteration, maxIterations);

			PassOutcome outcome = runPass(request, iteration, currentSql);
			steps.add(outcome.step());
			if (outcome.rows() != null) {
				lastRows = outcome.rows();
			}
			if (outcome.step().kind() == StepKind.VALIDATED) {
				success = true;
				break;
			}
			if (outcome.step().kind() == StepKind.SYSTEM_ERROR) {
				break;
			}
			currentSql = outcome.step().outputSql();
		}

		String finalSql = success || steps.isEmpty() ? currentSql : steps.get(steps.size() - 1).outputSql();
		logger.info("Optimization finished after {} iterations (success: {})", steps.size(), success);
		return new OptimizationResult(initialSql, finalSql, success, wasCancelled, steps, lastRows);
	}

	private PassOutcome runPass(Request request, int iteration, String sql) {
		Duration timeout = config.iterationTimeout();
		if (timeout == null) {
			try {
				return pass(request, iteration, sql, new AtomicBoolean());
			}
			catch (RuntimeException e) {
				return abort(iteration, sql, e);
			}
		}

		AtomicBoolean abandoned = new AtomicBoolean();
		Future<PassOutcome> future = passRunner.submit(() -> pass(request, iteration, sql, abandoned));
		try {
			return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (TimeoutException e) {
			abandoned.set(true);
			future.cancel(true);
			logger.error("Optimization iteration {} timed out after {}", iteration, timeout);
			return new PassOutcome(OptimizationStep.systemError(iteration, sql,
					"iteration timed out after " + timeout.toMillis() + " ms"), null);
		}
		catch (ExecutionException e) {
			return abort(iteration, sql, e.getCause() != null ? e.getCause() : e);
		}
		catch (InterruptedException e) {
			abandoned.set(true);
			future.cancel(true);
			Thread.currentThread().interrupt();
			return abort(iteration, sql, e);
		}
	}

	/**
	 * @param abandoned set once nobody waits for this pass; checked before the completion model is called
	 */
	private PassOutcome pass(Request request, int iteration, String sql, AtomicBoolean abandoned) {
		long start = System.nanoTime();
		ExecutionResult result = executor.execute(request.connectionId(), sql);
		ExecutionSummary execution = ExecutionSummary.of(result,
				TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));

		if (!result.succeeded()) {
			ErrorAnalysis analysis = classifier.analyze(result.error());
			logger.info("Execution failed ({}): {}", analysis.kind().label(), result.error());
			if (abandoned.get()) {
				return abandonedOutcome(iteration, sql);
			}
			String repaired = requestRewrite(request, sql, analysis.describe());
			return new PassOutcome(OptimizationStep.repair(iteration, sql, repaired, execution, analysis), null);
		}

		ValidationResult validation = validator.validate(result.rows(), request.question());
		if (validation.valid()) {
			logger.info("Result of iteration {} passed validation ({} rows)", iteration, result.rowCount());
			return new PassOutcome(OptimizationStep.validated(iteration, sql, execution, validation), result.rows());
		}

		String feedback = feedback(validation, request.question());
		logger.info("Result of iteration {} failed validation: {}", iteration, validation.issues());
		if (abandoned.get()) {
			return abandonedOutcome(iteration, sql);
		}
		String refined = requestRewrite(request, sql, "Result validation issues: " + feedback);
		return new PassOutcome(
				OptimizationStep.refinement(iteration, sql, refined, execution, validation, feedback), result.rows());
	}

	private static PassOutcome abandonedOutcome(int iteration, String sql) {
		logger.info("Iteration {} was abandoned; skipping the rewrite request", iteration);
		return new PassOutcome(OptimizationStep.systemError(iteration, sql, "iteration abandoned"), null);
	}

	private String requestRewrite(Request request, String currentSql, String problem) {
		try {
			String response = completion.complete(OPTIMIZE_TEMPLATE, Map.of(
					"schemaInfo", request.schemaInfo(),
					"userMessage", request.question(),
					"originalSql", currentSql,
					"errorMessage", problem));
			String sql = SqlResponseCleaner.clean(response);
			if (sql.isEmpty()) {
				logger.warn("Rewrite request returned no SQL; keeping the current statement");
				return currentSql;
			}
			return sql;
		}
		catch (TextCompletionException e) {
			logger.warn("Rewrite request failed; keeping the current statement", e);
			return currentSql;
		}
	}

	private static String feedback(ValidationResult validation, String question) {
		StringBuilder sb = new StringBuilder("Validation of the query result found these issues:\n");
		validation.issues().forEach(issue -> sb.append("- ").append(issue).append('\n'));
		sb.append("\nOriginal question: ").append(question).append('\n');
		sb.append("Adjust the SQL so that the result matches what the user asked for.");
		return sb.toString();
	}

	private static PassOutcome abort(int iteration, String sql, Throwable cause) {
		logger.error("Optimization iteration {} failed; aborting", iteration, cause);
		String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
		return new PassOutcome(OptimizationStep.systemError(iteration, sql, message), null);
	}

	/**
	 * Stops the pass workers, interrupting any pass still running. Without an iteration timeout
	 * there are none and this does nothing.
	 */
	@Override
	public void close() {
		if (passRunner != null) {
			passRunner.shutdownNow();
		}
	}

	private static ThreadFactory passThreads() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "feedback-optimizer-pass-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	private record Request(String connectionId, String question, String schemaInfo) {
	}

	/**
	 * @param rows rows of a successful execution, null when the pass did not execute successfully
	 */
	private record PassOutcome(OptimizationStep step, List<Map<String, Object>> rows) {
	}
}
