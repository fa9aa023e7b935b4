package org.javai.eg.model;

/**
 * The root context. There is exactly one per registry and it always carries {@link #ID}.
 */
public final class SheetOfAssertion extends Context {

	public static final String ID = "SA";

	SheetOfAssertion() {
		super(ID);
	}
}
