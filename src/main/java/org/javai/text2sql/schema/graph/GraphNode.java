package org.javai.text2sql.schema.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A table or column node of a {@link SchemaGraph}.
 *
 * @param id table name for table nodes, {@code table.column} for column nodes
 * @param type node type
 * @param features derived features keyed by name (insertion ordered)
 */
public record GraphNode(String id, NodeType type, Map<String, Object> features) {

	public GraphNode {
		features = features != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(features))
				: Map.of();
	}

	public Object feature(String name) {
		return features.get(name);
	}
}
