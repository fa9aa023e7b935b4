package org.javai.eg.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An area of the graph that owns child objects by id.
 *
 * <p>Children are kept in insertion order. The set is only changed through
 * {@link EntityRegistry#attach(String, String)} and {@link EntityRegistry#detach(String, String)}
 * so the registry's parent index stays in step.</p>
 */
public abstract sealed class Context implements GraphObject permits SheetOfAssertion, Cut {

	private final String id;
	private final Set<String> children = new LinkedHashSet<>();

	protected Context(String id) {
		this.id = id != null ? id : GraphObject.newId();
	}

	@Override
	public String id() {
		return id;
	}

	public Set<String> children() {
		return Collections.unmodifiableSet(children);
	}

	void addChild(String childId) {
		children.add(childId);
	}

	boolean removeChild(String childId) {
		return children.remove(childId);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[" + id + ", children=" + children.size() + "]";
	}
}
