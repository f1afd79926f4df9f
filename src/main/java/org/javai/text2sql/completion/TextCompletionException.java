package org.javai.text2sql.completion;

/**
 * Thrown when a prompt template cannot be loaded or the completion call fails.
 */
public class TextCompletionException extends RuntimeException {

	public TextCompletionException(String message) {
		super(message);
	}

	public TextCompletionException(String message, Throwable cause) {
		super(message, cause);
	}
}
