package org.javai.eg.model;

/**
 * Thrown when an operation would break the shape of the graph.
 *
 * <p>This exception is thrown when:</p>
 * <ul>
 *   <li>a parent context is missing or is not a context</li>
 *   <li>a hook index lies outside a predicate's arity</li>
 *   <li>an entity is registered twice</li>
 * </ul>
 */
public class StructuralException extends EgException {

	public StructuralException(String message) {
		super(message);
	}

	public StructuralException(String message, Throwable cause) {
		super(message, cause);
	}
}
