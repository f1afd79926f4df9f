package org.javai.text2sql.conversation;

import java.util.List;

/**
 * Pulls entity strings (names, numbers, quoted values) out of a user message.
 */
@FunctionalInterface
public interface EntityExtractor {

	/**
	 * @return distinct entities in discovery order
	 */
	List<String> extract(String message);
}
