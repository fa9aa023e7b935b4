package org.javai.eg.clif;

import org.javai.eg.model.EgException;

/**
 * Exception thrown when CLIF text cannot be tokenized or does not follow the supported grammar.
 */
public class ClifParseException extends EgException {

	public ClifParseException(String message) {
		super(message);
	}

	public ClifParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
