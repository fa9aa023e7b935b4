package org.javai.eg.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the nesting of contexts in a registry: parent lookup, depth,
 * polarity and lowest common ancestors.
 */
public class ContextTree {

	private final EntityRegistry registry;

	public ContextTree(EntityRegistry registry) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
	}

	public EntityRegistry registry() {
		return registry;
	}

	public Optional<String> parentOf(String id) {
		return registry.parentOf(id);
	}

	/**
	 * @return the number of parent hops from {@code contextId} to the sheet of assertion
	 */
	public int depth(String contextId) {
		int depth = 0;
		Optional<String> current = parentOf(contextId);
		while (current.isPresent()) {
			depth++;
			current = parentOf(current.get());
		}
		return depth;
	}

	public boolean isPositive(String contextId) {
		return depth(contextId) % 2 == 0;
	}

	public boolean isNegative(String contextId) {
		return !isPositive(contextId);
	}

	/**
	 * @return {@code contextId} followed by each enclosing context up to the sheet
	 */
	public List<String> ancestors(String contextId) {
		List<String> chain = new ArrayList<>();
		String current = contextId;
		while (current != null) {
			chain.add(current);
			current = parentOf(current).orElse(null);
		}
		return chain;
	}

	/**
	 * @return true if {@code ancestorId} is {@code contextId} or encloses it
	 */
	public boolean isWithin(String contextId, String ancestorId) {
		return ancestors(contextId).contains(ancestorId);
	}

	/**
	 * Finds the deepest context enclosing (or equal to) every given context.
	 *
	 * @return the common ancestor, empty when no contexts are given or they share none
	 */
	public Optional<String> lowestCommonAncestor(Collection<String> contextIds) {
		Iterator<String> it = contextIds.iterator();
		if (!it.hasNext()) {
			return Optional.empty();
		}
		Set<String> common = new LinkedHashSet<>(ancestors(it.next()));
		while (it.hasNext()) {
			common.retainAll(new LinkedHashSet<>(ancestors(it.next())));
		}
		return common.stream().findFirst();
	}

	/**
	 * Collects the cuts passed when walking up from {@code contextId} to {@code stopAt},
	 * excluding {@code stopAt} itself.
	 */
	public List<String> cutsBetween(String contextId, String stopAt) {
		List<String> cuts = new ArrayList<>();
		String current = contextId;
		while (current != null && !current.equals(stopAt)) {
			if (registry.get(current).orElse(null) instanceof Cut) {
				cuts.add(current);
			}
			current = parentOf(current).orElse(null);
		}
		return cuts;
	}
}
