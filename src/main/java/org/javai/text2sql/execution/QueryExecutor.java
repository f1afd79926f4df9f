package org.javai.text2sql.execution;

/**
 * Runs SQL against a connection's database.
 *
 * <p>Implementations report failures through {@link ExecutionResult#error()} instead of
 * throwing.</p>
 */
@FunctionalInterface
public interface QueryExecutor {

	ExecutionResult execute(String connectionId, String sql);
}
