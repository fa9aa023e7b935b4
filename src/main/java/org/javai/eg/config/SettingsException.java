package org.javai.eg.config;

import org.javai.eg.model.EgException;

/**
 * Exception thrown when settings cannot be read or hold invalid values.
 */
public class SettingsException extends EgException {

	public SettingsException(String message) {
		super(message);
	}

	public SettingsException(String message, Throwable cause) {
		super(message, cause);
	}
}
