package org.javai.text2sql.conversation;

/**
 * Decides how a question relates to the conversation so far.
 */
@FunctionalInterface
public interface FollowupClassifier {

	/**
	 * @param message the new question
	 * @param hasContext whether the connection has earlier turns
	 */
	FollowupQueryType classify(String message, boolean hasContext);
}
