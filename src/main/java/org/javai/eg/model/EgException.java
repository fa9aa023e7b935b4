package org.javai.eg.model;

/**
 * Base of the exceptions raised by the existential graph core.
 */
public class EgException extends RuntimeException {

	public EgException(String message) {
		super(message);
	}

	public EgException(String message, Throwable cause) {
		super(message, cause);
	}
}
