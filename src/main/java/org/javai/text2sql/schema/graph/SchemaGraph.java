package org.javai.text2sql.schema.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed graph of a connection's schema: table and column nodes joined by "contains" and
 * "foreign key" edges.
 *
 * <p>Built by {@link SchemaGraphBuilder}; used for diagnostics and visualization, not by
 * retrieval itself.</p>
 */
public final class SchemaGraph {

	private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
	private final List<GraphEdge> edges = new ArrayList<>();

	void addTableNode(String tableName, Map<String, Object> features) {
		nodes.put(tableName, new GraphNode(tableName, NodeType.TABLE, features));
	}

	void addColumnNode(String columnId, Map<String, Object> features, String parentTable) {
		nodes.put(columnId, new GraphNode(columnId, NodeType.COLUMN, features));
		edges.add(new GraphEdge(parentTable, columnId, EdgeType.CONTAINS, Map.of()));
	}

	void addForeignKeyEdge(String sourceColumn, String targetColumn, String constraintName) {
		edges.add(new GraphEdge(sourceColumn, targetColumn, EdgeType.FOREIGN_KEY,
				Map.of("constraint_name", constraintName != null ? constraintName : "")));
	}

	public List<GraphNode> nodes() {
		return List.copyOf(nodes.values());
	}

	public List<GraphEdge> edges() {
		return Collections.unmodifiableList(edges);
	}

	public Optional<GraphNode> node(String id) {
		return Optional.ofNullable(nodes.get(id));
	}

	public List<GraphNode> tableNodes() {
		return nodes.values().stream().filter(n -> n.type() == NodeType.TABLE).toList();
	}

	public List<GraphEdge> edgesOfType(EdgeType type) {
		return edges.stream().filter(e -> e.type() == type).toList();
	}

	/**
	 * Returns the column nodes contained by the given table, in declaration order.
	 */
	public List<GraphNode> columnsOf(String tableName) {
		return edges.stream()
				.filter(e -> e.type() == EdgeType.CONTAINS && e.source().equals(tableName))
				.map(e -> nodes.get(e.target()))
				.toList();
	}
}
