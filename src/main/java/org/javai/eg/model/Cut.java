package org.javai.eg.model;

/**
 * A nested context standing for one level of negation.
 */
public final class Cut extends Context {

	public Cut() {
		super(null);
	}

	public Cut(String id) {
		super(id);
	}
}
