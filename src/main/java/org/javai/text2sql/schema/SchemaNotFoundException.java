package org.javai.text2sql.schema;

/**
 * Thrown when an operation needs the stored schema of a connection that has never been trained.
 */
public class SchemaNotFoundException extends RuntimeException {

	private final String connectionId;

	public SchemaNotFoundException(String connectionId) {
		super("No schema stored for connection: " + connectionId);
		this.connectionId = connectionId;
	}

	public String connectionId() {
		return connectionId;
	}
}
