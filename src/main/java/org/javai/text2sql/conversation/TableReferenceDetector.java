package org.javai.text2sql.conversation;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.javai.text2sql.text.KeywordMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds what table a turn was about.
 *
 * <p>The turn's SQL is parsed first and the table mentioned earliest in it wins. When there is no
 * SQL, or it does not parse, the user message is split into words and the first word containing a
 * table keyword is used (e.g. "订单表").</p>
 */
public class TableReferenceDetector {

	private static final Logger logger = LoggerFactory.getLogger(TableReferenceDetector.class);

	private final ConversationKeywords keywords;

	public TableReferenceDetector(ConversationKeywords keywords) {
		this.keywords = Objects.requireNonNull(keywords, "keywords must not be null");
	}

	/**
	 * True if the message mentions a table keyword.
	 */
	public boolean containsTableReference(String message) {
		return KeywordMatcher.containsAny(message, keywords.tableWords());
	}

	public Optional<String> tableContext(ConversationTurn turn) {
		return tableFromSql(turn.generatedSql()).or(() -> tableFromMessage(turn.userMessage()));
	}

	Optional<String> tableFromSql(String sql) {
		if (sql == null || sql.isBlank()) {
			return Optional.empty();
		}
		Statement statement;
		try {
			statement = CCJSqlParserUtil.parse(sql);
		}
		catch (JSQLParserException e) {
			logger.debug("Previous SQL does not parse, falling back to keywords: {}", e.getMessage());
			return Optional.empty();
		}
		Set<String> tables = new TablesNamesFinder().getTables(statement);
		String lowerSql = sql.toLowerCase(Locale.ROOT);
		return tables.stream()
				.map(TableReferenceDetector::bareName)
				.min(Comparator.comparingInt(name -> position(lowerSql, name)));
	}

	Optional<String> tableFromMessage(String message) {
		if (message == null || !containsTableReference(message)) {
			return Optional.empty();
		}
		for (String word : message.split("[\\s，。,.]+")) {
			if (!word.isEmpty() && KeywordMatcher.containsAny(word, keywords.tableWords())) {
				return Optional.of(word);
			}
		}
		return Optional.empty();
	}

	private static int position(String lowerSql, String name) {
		int index = lowerSql.indexOf(name.toLowerCase(Locale.ROOT));
		return index < 0 ? Integer.MAX_VALUE : index;
	}

	private static String bareName(String qualified) {
		String name = qualified.contains(".") ? qualified.substring(qualified.lastIndexOf('.') + 1) : qualified;
		return name.replaceAll("[\"`\\[\\]]", "");
	}
}
