package org.javai.eg.logic;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.eg.model.Context;
import org.javai.eg.model.ContextTree;
import org.javai.eg.model.Cut;
import org.javai.eg.model.EntityRegistry;
import org.javai.eg.model.Predicate;

/**
 * Validator reading polarity and shape from a {@link ContextTree}.
 */
public class DefaultValidator implements Validator {

	private final ContextTree tree;

	public DefaultValidator(ContextTree tree) {
		this.tree = Objects.requireNonNull(tree, "tree must not be null");
	}

	public DefaultValidator(EntityRegistry registry) {
		this(new ContextTree(registry));
	}

	public ContextTree tree() {
		return tree;
	}

	@Override
	public boolean canErase(List<String> selection) {
		if (selection == null || selection.isEmpty()) {
			return false;
		}
		return tree.parentOf(selection.get(0))
				.map(tree::isPositive)
				.orElse(false);
	}

	@Override
	public boolean canInsert(String contextId) {
		return isContext(contextId) && tree.isNegative(contextId);
	}

	@Override
	public boolean canIterate(List<String> selection, String targetContextId) {
		if (selection == null || selection.isEmpty() || !isContext(targetContextId)) {
			return false;
		}
		Optional<String> source = tree.parentOf(selection.get(0));
		if (source.isEmpty() || source.get().equals(targetContextId)) {
			return false;
		}
		// a graph cannot be iterated into itself
		for (String selected : selection) {
			if (tree.isWithin(targetContextId, selected)) {
				return false;
			}
		}
		return tree.isWithin(targetContextId, source.get());
	}

	@Override
	public boolean canDeiterate(List<String> selection, List<String> originalSelection) {
		return selection != null && !selection.isEmpty()
				&& originalSelection != null && !originalSelection.isEmpty();
	}

	@Override
	public boolean canRemoveDoubleCut(String cutId) {
		Optional<Cut> outer = tree.registry().get(cutId, Cut.class);
		if (outer.isEmpty() || outer.get().children().size() != 1) {
			return false;
		}
		String innerId = outer.get().children().iterator().next();
		return tree.registry().get(innerId, Cut.class).isPresent();
	}

	@Override
	public boolean canApplyFunctionalPropertyRule(String firstPredicateId, String secondPredicateId) {
		Optional<Predicate> first = tree.registry().get(firstPredicateId, Predicate.class);
		Optional<Predicate> second = tree.registry().get(secondPredicateId, Predicate.class);
		if (first.isEmpty() || second.isEmpty()) {
			return false;
		}
		Predicate p1 = first.get();
		Predicate p2 = second.get();
		if (!p1.isFunctional() || !p2.isFunctional()) {
			return false;
		}
		if (!p1.label().equals(p2.label()) || p1.arity() != p2.arity()) {
			return false;
		}
		int output = p1.outputHook();
		for (int hook = 1; hook < output; hook++) {
			if (!Objects.equals(p1.hooks().get(hook), p2.hooks().get(hook))) {
				return false;
			}
		}
		String out1 = p1.hooks().get(output);
		String out2 = p2.hooks().get(output);
		return out1 == null || !out1.equals(out2);
	}

	private boolean isContext(String id) {
		return tree.registry().get(id, Context.class).isPresent();
	}
}
