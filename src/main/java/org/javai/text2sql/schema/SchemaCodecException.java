package org.javai.text2sql.schema;

/**
 * Thrown when a schema blob or an embedding text cannot be read or written as JSON.
 */
public class SchemaCodecException extends RuntimeException {

	public SchemaCodecException(String message, Throwable cause) {
		super(message, cause);
	}
}
