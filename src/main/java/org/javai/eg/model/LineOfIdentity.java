package org.javai.eg.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One logical individual, realized by the ligatures currently attached to it.
 */
public final class LineOfIdentity implements GraphObject {

	private final String id;
	private final Set<String> ligatures = new LinkedHashSet<>();

	public LineOfIdentity() {
		this(null);
	}

	public LineOfIdentity(String id) {
		this.id = id != null ? id : GraphObject.newId();
	}

	@Override
	public String id() {
		return id;
	}

	public Set<String> ligatures() {
		return Collections.unmodifiableSet(ligatures);
	}

	public void addLigature(String ligatureId) {
		ligatures.add(ligatureId);
	}

	public boolean removeLigature(String ligatureId) {
		return ligatures.remove(ligatureId);
	}

	@Override
	public String toString() {
		return "LineOfIdentity[" + id + ", ligatures=" + ligatures.size() + "]";
	}
}
