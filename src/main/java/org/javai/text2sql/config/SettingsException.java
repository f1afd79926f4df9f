package org.javai.text2sql.config;

/**
 * Thrown when a settings document cannot be read or holds invalid values.
 */
public class SettingsException extends RuntimeException {

	public SettingsException(String message) {
		super(message);
	}

	public SettingsException(String message, Throwable cause) {
		super(message, cause);
	}
}
