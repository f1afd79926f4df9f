package org.javai.text2sql.feedback;

/**
 * What an optimization step did with its input SQL.
 */
public enum StepKind {
	/** Executed and passed validation; the run ends here. */
	VALIDATED,
	/** Executed but failed validation; a refinement was requested. */
	RESULT_REFINEMENT,
	/** Execution failed; a repair was requested. */
	ERROR_REPAIR,
	/** The step itself faulted or timed out; the run was aborted. */
	SYSTEM_ERROR
}
