package org.javai.text2sql.conversation;

import static org.assertj.core.api.Assertions.assertThat;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class TableReferenceDetectorTest {

	private final TableReferenceDetector detector = new TableReferenceDetector(ConversationKeywords.defaults());

	private static ConversationTurn turn(String message, String sql) {
		return new ConversationTurn(message, "", sql, "", List.of(), Instant.now());
	}

	@Test
	void firstTableOfTheSqlWins() {
		assertThat(detector.tableFromSql(
				"SELECT o.id FROM shop.orders o JOIN customers c ON o.customer_id = c.id"))
				.contains("orders");
	}

	@Test
	void quotesAreStripped() {
		assertThat(detector.tableFromSql("SELECT * FROM \"order_items\"")).contains("order_items");
	}

	@Test
	void unparsableSqlFallsBackToTheMessage() {
		assertThat(detector.tableContext(turn("查询 订单 数据", "SELEKT nonsense"))).contains("订单");
		assertThat(detector.tableContext(turn("how are you", null))).isEmpty();
	}

	@Test
	void detectsTableWords() {
		assertThat(detector.containsTableReference("the refunds table")).isTrue();
		assertThat(detector.containsTableReference("客户的数量")).isTrue();
		assertThat(detector.containsTableReference("the tablet sales")).isFalse();
	}
}
