package org.javai.eg.model;

import java.util.UUID;

/**
 * Base of every entity held by an {@link EntityRegistry}.
 *
 * <p>The hierarchy is closed so callers can dispatch over entity kinds exhaustively.</p>
 */
public sealed interface GraphObject permits Context, Predicate, LineOfIdentity, Ligature {

	/**
	 * @return the opaque identifier of this entity, unique within its registry
	 */
	String id();

	static String newId() {
		return UUID.randomUUID().toString();
	}
}
