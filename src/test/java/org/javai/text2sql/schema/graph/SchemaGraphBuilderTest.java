package org.javai.text2sql.schema.graph;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.ArrayList;
import java.util.List;
import org.javai.text2sql.schema.ColumnInfo;
import org.javai.text2sql.schema.TableInfo;
import org.javai.text2sql.testsupport.ShopSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SchemaGraphBuilder")
class SchemaGraphBuilderTest {

	private final SchemaGraphBuilder builder = new SchemaGraphBuilder();

	@Nested
	@DisplayName("Graph structure")
	class Structure {

		@Test
		@DisplayName("Every table and column becomes a node")
		void nodes() {
			SchemaGraph graph = builder.build(ShopSchema.tables());

			assertThat(graph.tableNodes()).extracting(GraphNode::id)
					.containsExactly("customers", "orders", "products", "order_items", "audit_log");
			assertThat(graph.columnsOf("orders")).extracting(GraphNode::id)
					.containsExactly("orders.id", "orders.customer_id", "orders.amount", "orders.order_date");
			assertThat(graph.edgesOfType(EdgeType.CONTAINS)).hasSize(18);
		}

		@Test
		@DisplayName("Foreign keys link column to referenced column")
		void foreignKeyEdges() {
			SchemaGraph graph = builder.build(ShopSchema.tables());

			assertThat(graph.edgesOfType(EdgeType.FOREIGN_KEY))
					.extracting(GraphEdge::source, GraphEdge::target)
					.containsExactly(
							org.assertj.core.groups.Tuple.tuple("orders.customer_id", "customers.id"),
							org.assertj.core.groups.Tuple.tuple("order_items.order_id", "orders.id"),
							org.assertj.core.groups.Tuple.tuple("order_items.product_id", "products.id"));
			assertThat(graph.edgesOfType(EdgeType.FOREIGN_KEY).get(0).properties())
					.containsEntry("constraint_name", "fk_orders_customer");
		}

		@Test
		@DisplayName("Table features describe shape and type")
		void tableFeatures() {
			GraphNode items = builder.build(ShopSchema.tables()).node("order_items").orElseThrow();

			assertThat(items.type()).isEqualTo(NodeType.TABLE);
			assertThat(items.feature("column_count")).isEqualTo(4);
			assertThat(items.feature("foreign_key_count")).isEqualTo(2);
			assertThat(items.feature("has_primary_key")).isEqualTo(true);
			assertThat(items.feature("table_type")).isEqualTo("junction_table");
		}
	}

	@Nested
	@DisplayName("Table types")
	class TableTypes {

		@Test
		@DisplayName("Name rules win over shape rules")
		void nameRulesFirst() {
			assertThat(builder.inferTableType(ShopSchema.AUDIT_LOG)).isEqualTo(TableType.LOG_TABLE);
			assertThat(builder.inferTableType(TableInfo.of("app_settings", List.of(), List.of())))
					.isEqualTo(TableType.CONFIG_TABLE);
			assertThat(builder.inferTableType(ShopSchema.ORDER_ITEMS)).isEqualTo(TableType.JUNCTION_TABLE);
		}

		@Test
		@DisplayName("Wide tables are facts, others dimensions")
		void shapeRules() {
			List<ColumnInfo> columns = new ArrayList<>();
			for (int i = 0; i < 21; i++) {
				columns.add(ColumnInfo.of("c" + i, "int"));
			}
			assertThat(builder.inferTableType(TableInfo.of("sales", columns, List.of()))).isEqualTo(TableType.FACT_TABLE);
			assertThat(builder.inferTableType(ShopSchema.PRODUCTS)).isEqualTo(TableType.DIMENSION_TABLE);
		}
	}

	@Nested
	@DisplayName("Column semantic types")
	class SemanticTypes {

		@Test
		@DisplayName("Columns are tagged by the first matching rule")
		void tags() {
			assertThat(builder.inferSemanticType(ColumnInfo.primaryKeyColumn("id", "bigint")))
					.isEqualTo(ColumnSemanticType.PRIMARY_KEY);
			assertThat(builder.inferSemanticType(ColumnInfo.of("customer_id", "bigint")))
					.isEqualTo(ColumnSemanticType.FOREIGN_KEY_CANDIDATE);
			assertThat(builder.inferSemanticType(ColumnInfo.of("customerId", "bigint")))
					.isEqualTo(ColumnSemanticType.FOREIGN_KEY_CANDIDATE);
			assertThat(builder.inferSemanticType(ColumnInfo.of("title", "varchar")))
					.isEqualTo(ColumnSemanticType.NAME_FIELD);
			assertThat(builder.inferSemanticType(ColumnInfo.of("created", "timestamp")))
					.isEqualTo(ColumnSemanticType.TEMPORAL_FIELD);
			assertThat(builder.inferSemanticType(ColumnInfo.of("price", "decimal")))
					.isEqualTo(ColumnSemanticType.MONETARY_FIELD);
			assertThat(builder.inferSemanticType(ColumnInfo.of("qty", "varchar")))
					.isEqualTo(ColumnSemanticType.NUMERIC_FIELD);
			assertThat(builder.inferSemanticType(ColumnInfo.of("weight", "real")))
					.isEqualTo(ColumnSemanticType.NUMERIC_FIELD);
			assertThat(builder.inferSemanticType(ColumnInfo.of("paid", "boolean")))
					.isEqualTo(ColumnSemanticType.GENERAL_FIELD);
		}
	}
}
