package org.javai.eg.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A relation node with numbered hooks, each bound to a line of identity or unbound.
 *
 * <p>A functional predicate designates its highest hook as the output; the remaining
 * hooks are its inputs.</p>
 */
public final class Predicate implements GraphObject {

	private final String id;
	private final String label;
	private final int arity;
	private final PredicateKind kind;
	private final boolean functional;
	private final Map<Integer, String> hooks = new LinkedHashMap<>();

	public Predicate(String label, int arity, PredicateKind kind, boolean functional) {
		this(null, label, arity, kind, functional);
	}

	public Predicate(String id, String label, int arity, PredicateKind kind, boolean functional) {
		Objects.requireNonNull(label, "label must not be null");
		if (arity < 0) {
			throw new IllegalArgumentException("Arity cannot be negative: " + arity);
		}
		if (functional && arity < 1) {
			throw new IllegalArgumentException("A functional predicate needs at least one hook");
		}
		this.id = id != null ? id : GraphObject.newId();
		this.label = label;
		this.arity = arity;
		this.kind = kind != null ? kind : PredicateKind.RELATION;
		this.functional = functional;
		for (int i = 1; i <= arity; i++) {
			hooks.put(i, null);
		}
	}

	@Override
	public String id() {
		return id;
	}

	public String label() {
		return label;
	}

	public int arity() {
		return arity;
	}

	public PredicateKind kind() {
		return kind;
	}

	public boolean isConstant() {
		return kind == PredicateKind.CONSTANT;
	}

	public boolean isFunctional() {
		return functional;
	}

	/**
	 * @return the output hook index of a functional predicate
	 * @throws IllegalStateException if this predicate is not functional
	 */
	public int outputHook() {
		if (!functional) {
			throw new IllegalStateException("Predicate " + label + " is not functional");
		}
		return arity;
	}

	/**
	 * Hook bindings in index order; unbound hooks map to {@code null}.
	 */
	public Map<Integer, String> hooks() {
		return Collections.unmodifiableMap(hooks);
	}

	public Optional<String> lineAt(int hook) {
		checkHook(hook);
		return Optional.ofNullable(hooks.get(hook));
	}

	public boolean hasHook(int hook) {
		return hook >= 1 && hook <= arity;
	}

	public void bind(int hook, String lineId) {
		checkHook(hook);
		hooks.put(hook, lineId);
	}

	/**
	 * Rebinds every hook currently bound to {@code from}.
	 *
	 * @return the number of hooks rewritten
	 */
	public int rebind(String from, String to) {
		int count = 0;
		for (Map.Entry<Integer, String> entry : hooks.entrySet()) {
			if (from.equals(entry.getValue())) {
				entry.setValue(to);
				count++;
			}
		}
		return count;
	}

	public boolean references(String lineId) {
		return hooks.containsValue(lineId);
	}

	private void checkHook(int hook) {
		if (!hasHook(hook)) {
			throw new IllegalArgumentException(
					"Hook " + hook + " is out of range for " + label + " with arity " + arity);
		}
	}

	@Override
	public String toString() {
		return "Predicate[" + label + "/" + arity + (functional ? ", functional" : "") + ", " + id + "]";
	}
}
