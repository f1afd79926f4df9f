package org.javai.text2sql.schema.graph;

import java.util.Map;

/**
 * A directed edge of a {@link SchemaGraph}.
 *
 * @param source source node id
 * @param target target node id
 * @param type edge type
 * @param properties extra properties (e.g. {@code constraint_name} on foreign key edges)
 */
public record GraphEdge(String source, String target, EdgeType type, Map<String, Object> properties) {

	public GraphEdge {
		properties = properties != null ? Map.copyOf(properties) : Map.of();
	}
}
