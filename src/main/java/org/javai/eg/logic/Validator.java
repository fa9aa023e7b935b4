package org.javai.eg.logic;

import java.util.List;

/**
 * Preconditions of the transformation rules of existential graphs.
 *
 * <p>Implementations are pure: they read the graph and never change it. The editor
 * consults them before applying a rule.</p>
 */
public interface Validator {

	/**
	 * Erasure is allowed in positive contexts only. Only the first selected object's
	 * context is inspected.
	 */
	boolean canErase(List<String> selection);

	/**
	 * Insertion is allowed in negative contexts only.
	 */
	boolean canInsert(String contextId);

	/**
	 * Iteration copies a selection into a context nested (strictly) inside the
	 * selection's own context.
	 */
	boolean canIterate(List<String> selection, String targetContextId);

	/**
	 * Deiteration removes a copy of a graph that also occurs in the same or an
	 * enclosing context.
	 */
	boolean canDeiterate(List<String> selection, List<String> originalSelection);

	/**
	 * A double cut is a cut whose only child is another cut.
	 */
	boolean canRemoveDoubleCut(String cutId);

	/**
	 * Two functional predicates with the same label, arity and inputs must share an output.
	 */
	boolean canApplyFunctionalPropertyRule(String firstPredicateId, String secondPredicateId);
}
