package org.javai.eg.editor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.eg.logic.DefaultValidator;
import org.javai.eg.logic.Validator;
import org.javai.eg.model.Context;
import org.javai.eg.model.ContextTree;
import org.javai.eg.model.Cut;
import org.javai.eg.model.EntityRegistry;
import org.javai.eg.model.GraphObject;
import org.javai.eg.model.HookRef;
import org.javai.eg.model.Ligature;
import org.javai.eg.model.LineOfIdentity;
import org.javai.eg.model.Predicate;
import org.javai.eg.model.PredicateKind;
import org.javai.eg.model.SheetOfAssertion;
import org.javai.eg.model.StructuralException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutation API over an existential graph.
 *
 * <p>Construction calls ({@link #addCut}, {@link #addPredicate}) build the graph, {@link #connect}
 * joins hooks into shared lines of identity, and the rule methods apply the formal
 * transformations of existential graphs after checking their preconditions with the
 * {@link Validator}. A refused rule raises {@link RuleViolationException} without touching
 * the graph; a malformed call raises {@link StructuralException}.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * EgEditor editor = new EgEditor();
 * String p = editor.addPredicate("P", 1);
 * String cut = editor.addCut();
 * String q = editor.addPredicate("Q", 1, cut);
 * editor.connect(HookRef.of(p, 1), HookRef.of(q, 1));
 * </pre>
 *
 * <p>Not thread-safe: one transformation at a time.</p>
 */
public class EgEditor {

	private static final Logger logger = LoggerFactory.getLogger(EgEditor.class);

	private final EntityRegistry registry;
	private final ContextTree tree;
	private final Validator validator;

	public EgEditor() {
		this(new EntityRegistry());
	}

	public EgEditor(EntityRegistry registry) {
		this(registry, new DefaultValidator(registry));
	}

	public EgEditor(EntityRegistry registry, Validator validator) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
		this.validator = Objects.requireNonNull(validator, "validator must not be null");
		this.tree = new ContextTree(registry);
	}

	public EntityRegistry registry() {
		return registry;
	}

	public ContextTree tree() {
		return tree;
	}

	public Validator validator() {
		return validator;
	}

	public Optional<String> parentOf(String id) {
		return registry.parentOf(id);
	}

	// ---------------------------------------------------------------------
	// Construction
	// ---------------------------------------------------------------------

	public String addCut() {
		return addCut(SheetOfAssertion.ID);
	}

	public String addCut(String parentId) {
		requireContext(parentId);
		Cut cut = new Cut();
		registry.add(cut);
		registry.attach(parentId, cut.id());
		return cut.id();
	}

	public String addPredicate(String label, int arity) {
		return addPredicate(label, arity, SheetOfAssertion.ID);
	}

	public String addPredicate(String label, int arity, String parentId) {
		return addPredicate(label, arity, parentId, PredicateKind.RELATION, false);
	}

	public String addPredicate(String label, int arity, String parentId, PredicateKind kind, boolean functional) {
		requireContext(parentId);
		Predicate predicate;
		try {
			predicate = new Predicate(label, arity, kind, functional);
		} catch (IllegalArgumentException e) {
			throw new StructuralException("Cannot create predicate " + label + ": " + e.getMessage(), e);
		}
		registry.add(predicate);
		registry.attach(parentId, predicate.id());
		return predicate.id();
	}

	/**
	 * Creates a line of identity with no ligatures yet.
	 */
	public String addLine() {
		LineOfIdentity line = new LineOfIdentity();
		registry.add(line);
		return line.id();
	}

	/**
	 * Creates a fresh line together with an empty ligature realizing it.
	 *
	 * @return the ligature id; its line is available through {@link Ligature#lineId()}
	 */
	public String addLigature() {
		String lineId = addLine();
		Ligature ligature = new Ligature(lineId, List.of());
		registry.add(ligature);
		line(lineId).addLigature(ligature.id());
		return ligature.id();
	}

	// ---------------------------------------------------------------------
	// Lines of identity
	// ---------------------------------------------------------------------

	public String connect(HookRef... pairs) {
		return connect(Arrays.asList(pairs));
	}

	/**
	 * Joins the given hooks into one line of identity.
	 *
	 * <p>The first hook already bound supplies the line; when none is bound a fresh line is
	 * created. Hooks bound to other lines have those lines merged in. A new ligature records
	 * the pairs in the order given. Pairs naming a missing predicate are skipped.</p>
	 *
	 * @return the id of the new ligature
	 * @throws StructuralException if a hook index is out of range or no pair names a known predicate
	 */
	public String connect(List<HookRef> pairs) {
		List<HookRef> resolved = resolveHooks(pairs);
		String primary = null;
		for (HookRef pair : resolved) {
			String bound = predicate(pair.predicateId()).hooks().get(pair.index());
			if (bound != null) {
				primary = bound;
				break;
			}
		}
		if (primary == null) {
			primary = addLine();
		}
		return join(primary, resolved);
	}

	/**
	 * Binds the given hooks to an existing line, merging any other line they were bound to,
	 * and records the binding as a new ligature.
	 *
	 * @return the id of the new ligature
	 */
	public String attach(String lineId, List<HookRef> pairs) {
		if (registry.get(lineId, LineOfIdentity.class).isEmpty()) {
			throw new StructuralException("Line of identity not found: " + lineId);
		}
		return join(lineId, resolveHooks(pairs));
	}

	/**
	 * Folds {@code otherLineId} into {@code primaryLineId}: its ligatures move over, every hook
	 * bound to it is rebound, and it is deleted.
	 */
	public void mergeLines(String primaryLineId, String otherLineId) {
		if (Objects.equals(primaryLineId, otherLineId)) {
			return;
		}
		Optional<LineOfIdentity> primary = registry.get(primaryLineId, LineOfIdentity.class);
		Optional<LineOfIdentity> other = registry.get(otherLineId, LineOfIdentity.class);
		if (primary.isEmpty() || other.isEmpty()) {
			return;
		}
		for (String ligatureId : other.get().ligatures()) {
			registry.get(ligatureId, Ligature.class).ifPresent(ligature -> {
				ligature.relinkTo(primaryLineId);
				primary.get().addLigature(ligatureId);
			});
		}
		int rebound = 0;
		for (Predicate predicate : registry.objectsOf(Predicate.class)) {
			rebound += predicate.rebind(otherLineId, primaryLineId);
		}
		registry.remove(otherLineId);
		logger.debug("Merged line {} into {} ({} hooks rebound)", otherLineId, primaryLineId, rebound);
	}

	private String join(String primaryLineId, List<HookRef> pairs) {
		for (HookRef pair : pairs) {
			Predicate predicate = predicate(pair.predicateId());
			String existing = predicate.hooks().get(pair.index());
			if (existing != null && !existing.equals(primaryLineId)) {
				mergeLines(primaryLineId, existing);
			}
			predicate.bind(pair.index(), primaryLineId);
		}
		Ligature ligature = new Ligature(primaryLineId, pairs);
		registry.add(ligature);
		line(primaryLineId).addLigature(ligature.id());
		ligature.traversedCuts(traversedCuts(ligature));
		return ligature.id();
	}

	private List<String> traversedCuts(Ligature ligature) {
		List<String> contexts = new ArrayList<>();
		for (HookRef attachment : ligature.attachments()) {
			parentOf(attachment.predicateId()).ifPresent(contexts::add);
		}
		Optional<String> lca = tree.lowestCommonAncestor(contexts);
		if (lca.isEmpty()) {
			return List.of();
		}
		Set<String> cuts = new LinkedHashSet<>();
		for (String context : contexts) {
			cuts.addAll(tree.cutsBetween(context, lca.get()));
		}
		return new ArrayList<>(cuts);
	}

	private void refreshTraversedCuts() {
		for (Ligature ligature : registry.objectsOf(Ligature.class)) {
			ligature.traversedCuts(traversedCuts(ligature));
		}
	}

	// ---------------------------------------------------------------------
	// Transformation rules
	// ---------------------------------------------------------------------

	public DoubleCut insertDoubleCut() {
		return insertDoubleCut(List.of(), SheetOfAssertion.ID);
	}

	public DoubleCut insertDoubleCut(List<String> selection) {
		return insertDoubleCut(selection, SheetOfAssertion.ID);
	}

	/**
	 * Encloses the selection (possibly empty) in two nested cuts. When a selection is given the
	 * cuts are placed in the selection's own context and {@code parentId} is ignored.
	 */
	public DoubleCut insertDoubleCut(List<String> selection, String parentId) {
		List<String> moved = selection != null ? selection : List.of();
		String context = moved.isEmpty() ? parentId : commonParent(moved);
		String outer = addCut(context);
		String inner = addCut(outer);
		for (String id : moved) {
			registry.attach(inner, id);
		}
		if (!moved.isEmpty()) {
			refreshTraversedCuts();
		}
		logger.debug("Inserted double cut {}/{} around {} object(s)", outer, inner, moved.size());
		return new DoubleCut(outer, inner);
	}

	public void removeDoubleCut(String outerCutId) {
		if (!validator.canRemoveDoubleCut(outerCutId)) {
			throw new RuleViolationException("remove double cut", "Not a valid double cut: " + outerCutId);
		}
		Cut outer = registry.get(outerCutId, Cut.class).orElseThrow();
		String innerId = outer.children().iterator().next();
		Cut inner = registry.get(innerId, Cut.class).orElseThrow();
		String parentId = parentOf(outerCutId)
				.orElseThrow(() -> new StructuralException("Cut " + outerCutId + " has no parent context"));
		for (String child : new ArrayList<>(inner.children())) {
			registry.attach(parentId, child);
		}
		registry.remove(innerId);
		registry.remove(outerCutId);
		refreshTraversedCuts();
		logger.debug("Removed double cut {}/{}", outerCutId, innerId);
	}

	/**
	 * Copies the selection, with every nested cut, into a context enclosed by the selection's
	 * context. Copied hooks stay bound to the same lines as the originals.
	 *
	 * @return the ids of the top-level copies, in selection order
	 */
	public List<String> iterate(List<String> selection, String targetContextId) {
		if (!validator.canIterate(selection, targetContextId)) {
			throw new RuleViolationException("iterate", "Iteration not valid into context " + targetContextId);
		}
		for (String id : selection) {
			requireSelectable(id);
		}
		List<String> copies = new ArrayList<>();
		Deque<String[]> pending = new ArrayDeque<>();
		for (String id : selection) {
			String copy = copyShallow(id, targetContextId);
			copies.add(copy);
			pending.add(new String[] { id, copy });
		}
		while (!pending.isEmpty()) {
			String[] next = pending.poll();
			Optional<Cut> original = registry.get(next[0], Cut.class);
			if (original.isEmpty()) {
				continue;
			}
			for (String child : new ArrayList<>(original.get().children())) {
				pending.add(new String[] { child, copyShallow(child, next[1]) });
			}
		}
		logger.debug("Iterated {} object(s) into {}", selection.size(), targetContextId);
		return copies;
	}

	private String copyShallow(String id, String parentId) {
		GraphObject original = registry.get(id).orElseThrow();
		GraphObject copy;
		if (original instanceof Predicate predicate) {
			Predicate duplicate = new Predicate(predicate.label(), predicate.arity(), predicate.kind(),
					predicate.isFunctional());
			predicate.hooks().forEach((hook, lineId) -> {
				if (lineId != null) {
					duplicate.bind(hook, lineId);
				}
			});
			copy = duplicate;
		} else if (original instanceof Cut) {
			copy = new Cut();
		} else {
			throw new StructuralException("Cannot copy " + original);
		}
		registry.add(copy);
		registry.attach(parentId, copy.id());
		return copy.id();
	}

	/**
	 * Removes a copy of a graph whose original occurs in the same or an enclosing context.
	 */
	public void deiterate(List<String> selection, List<String> originalSelection) {
		if (!validator.canDeiterate(selection, originalSelection)) {
			throw new RuleViolationException("deiterate", "Deiteration not valid");
		}
		removeSelection(selection);
		logger.debug("Deiterated {} object(s)", selection.size());
	}

	/**
	 * Erases the selection, with everything nested inside it, from a positive context.
	 * Lines that no remaining hook is bound to are deleted with their ligatures.
	 */
	public void erase(List<String> selection) {
		if (!validator.canErase(selection)) {
			throw new RuleViolationException("erase", "Erasure is only allowed in a positive context");
		}
		removeSelection(selection);
		logger.debug("Erased {} object(s)", selection.size());
	}

	/**
	 * Inserts a predicate into a negative context.
	 */
	public String insertPredicate(String label, int arity, String contextId) {
		if (!validator.canInsert(contextId)) {
			throw new RuleViolationException("insert", "Insertion is only allowed in a negative context");
		}
		return addPredicate(label, arity, contextId);
	}

	private void removeSelection(List<String> selection) {
		for (String id : selection) {
			requireSelectable(id);
		}
		Set<String> touchedLines = new LinkedHashSet<>();
		Deque<String> pending = new ArrayDeque<>(selection);
		List<String> doomed = new ArrayList<>();
		while (!pending.isEmpty()) {
			String id = pending.poll();
			GraphObject obj = registry.get(id).orElse(null);
			if (obj instanceof Context context) {
				pending.addAll(context.children());
			} else if (obj instanceof Predicate predicate) {
				predicate.hooks().values().stream().filter(Objects::nonNull).forEach(touchedLines::add);
			}
			doomed.add(id);
		}
		for (String id : doomed) {
			registry.remove(id);
		}
		for (String lineId : touchedLines) {
			if (isReferenced(lineId, null)) {
				pruneLigatures(lineId);
			} else {
				deleteLine(lineId);
			}
		}
		refreshTraversedCuts();
	}

	/**
	 * Replaces each ligature of the line that attaches a removed predicate with one holding only
	 * the surviving attachments, or drops it when none survive.
	 */
	private void pruneLigatures(String lineId) {
		LineOfIdentity line = line(lineId);
		for (String ligatureId : new ArrayList<>(line.ligatures())) {
			Ligature ligature = registry.get(ligatureId, Ligature.class).orElse(null);
			if (ligature == null) {
				continue;
			}
			List<HookRef> surviving = ligature.attachments().stream()
					.filter(attachment -> registry.contains(attachment.predicateId()))
					.toList();
			if (surviving.size() == ligature.attachments().size()) {
				continue;
			}
			line.removeLigature(ligatureId);
			registry.remove(ligatureId);
			if (!surviving.isEmpty()) {
				Ligature replacement = new Ligature(lineId, surviving);
				registry.add(replacement);
				line.addLigature(replacement.id());
			}
		}
	}

	private boolean isReferenced(String lineId, String exceptPredicateId) {
		return registry.objectsOf(Predicate.class).stream()
				.anyMatch(p -> !p.id().equals(exceptPredicateId) && p.references(lineId));
	}

	private void deleteLine(String lineId) {
		registry.get(lineId, LineOfIdentity.class).ifPresent(line -> {
			for (String ligatureId : line.ligatures()) {
				registry.remove(ligatureId);
			}
			registry.remove(lineId);
		});
	}

	/**
	 * Functional property: two applications of the same function to the same inputs denote
	 * the same individual, so their outputs are joined.
	 *
	 * @return the id of the ligature joining the outputs
	 */
	public String applyFunctionalPropertyRule(String firstPredicateId, String secondPredicateId) {
		if (!validator.canApplyFunctionalPropertyRule(firstPredicateId, secondPredicateId)) {
			throw new RuleViolationException("functional property",
					"Cannot apply functional property rule to " + firstPredicateId + " and " + secondPredicateId);
		}
		Predicate first = predicate(firstPredicateId);
		int output = first.outputHook();
		String ligature = connect(HookRef.of(firstPredicateId, output), HookRef.of(secondPredicateId, output));
		logger.debug("Applied functional property rule to {} and {}", firstPredicateId, secondPredicateId);
		return ligature;
	}

	/**
	 * Total function: a function applied to existing individuals yields an individual. Adds a
	 * functional predicate whose inputs are the given lines and whose output is a fresh line.
	 *
	 * @return the id of the new functional predicate
	 */
	public String applyTotalFunctionRule(String label, int arity, List<String> inputLineIds, String parentId) {
		List<String> inputs = inputLineIds != null ? inputLineIds : List.of();
		if (arity < 1 || inputs.size() != arity - 1) {
			throw new RuleViolationException("total function",
					"Function " + label + " of arity " + arity + " needs " + Math.max(arity - 1, 0) + " input line(s)");
		}
		for (String lineId : inputs) {
			if (registry.get(lineId, LineOfIdentity.class).isEmpty()) {
				throw new RuleViolationException("total function", "Input line not found: " + lineId);
			}
		}
		String functionId = addPredicate(label, arity, parentId, PredicateKind.RELATION, true);
		for (int i = 0; i < inputs.size(); i++) {
			attach(inputs.get(i), List.of(HookRef.of(functionId, i + 1)));
		}
		attach(addLine(), List.of(HookRef.of(functionId, arity)));
		logger.debug("Applied total function rule for {}", label);
		return functionId;
	}

	public String addConstant(String name) {
		return addConstant(name, SheetOfAssertion.ID);
	}

	/**
	 * Existence of constants: a named individual may be asserted anywhere, as a unary
	 * constant predicate on its own line of identity.
	 */
	public String addConstant(String name, String parentId) {
		String predicateId = addPredicate(name, 1, parentId, PredicateKind.CONSTANT, false);
		connect(HookRef.of(predicateId, 1));
		return predicateId;
	}

	/**
	 * Erases a constant that stands alone on its line.
	 *
	 * @throws RuleViolationException if the target is not a constant or its line joins other hooks
	 */
	public void eraseConstant(String predicateId) {
		Predicate predicate = registry.get(predicateId, Predicate.class)
				.filter(Predicate::isConstant)
				.orElseThrow(() -> new RuleViolationException("erase constant", "Target is not a constant."));
		String lineId = predicate.hooks().get(1);
		if (lineId != null) {
			LineOfIdentity line = registry.get(lineId, LineOfIdentity.class).orElse(null);
			Ligature ligature = line != null && line.ligatures().size() == 1
					? registry.get(line.ligatures().iterator().next(), Ligature.class).orElse(null)
					: null;
			if (ligature == null || ligature.attachments().size() != 1 || isReferenced(lineId, predicateId)) {
				throw new RuleViolationException("erase constant",
						"Cannot erase constant; it is connected to other predicates.");
			}
			registry.remove(ligature.id());
			registry.remove(lineId);
		}
		registry.remove(predicateId);
		logger.debug("Erased constant {}", predicate.label());
	}

	// ---------------------------------------------------------------------
	// Helpers
	// ---------------------------------------------------------------------

	private void requireContext(String contextId) {
		if (registry.get(contextId, Context.class).isEmpty()) {
			throw new StructuralException("Parent context not found or invalid: " + contextId);
		}
	}

	/**
	 * @return the pairs whose predicate exists, in the order given
	 */
	private List<HookRef> resolveHooks(List<HookRef> pairs) {
		if (pairs == null || pairs.isEmpty()) {
			throw new IllegalArgumentException("At least one hook is required");
		}
		List<HookRef> resolved = new ArrayList<>();
		for (HookRef pair : pairs) {
			Optional<Predicate> predicate = registry.get(pair.predicateId(), Predicate.class);
			if (predicate.isEmpty()) {
				logger.warn("Skipping hook {}: predicate not found", pair);
				continue;
			}
			if (!predicate.get().hasHook(pair.index())) {
				throw new StructuralException("Hook " + pair.index() + " is out of range for " + predicate.get());
			}
			resolved.add(pair);
		}
		if (resolved.isEmpty()) {
			throw new StructuralException("None of the hooks " + pairs + " belongs to a known predicate");
		}
		return resolved;
	}

	private void requireSelectable(String id) {
		GraphObject obj = registry.get(id)
				.orElseThrow(() -> new StructuralException("Object not found: " + id));
		if (!(obj instanceof Predicate) && !(obj instanceof Cut)) {
			throw new StructuralException("Only predicates and cuts can be selected: " + obj);
		}
	}

	private String commonParent(List<String> selection) {
		String parent = null;
		for (String id : selection) {
			requireSelectable(id);
			String own = parentOf(id)
					.orElseThrow(() -> new StructuralException("Object " + id + " has no parent context"));
			if (parent == null) {
				parent = own;
			} else if (!parent.equals(own)) {
				throw new StructuralException("Selected objects do not share one context");
			}
		}
		return parent;
	}

	private Predicate predicate(String id) {
		return registry.get(id, Predicate.class)
				.orElseThrow(() -> new StructuralException("Predicate not found: " + id));
	}

	private LineOfIdentity line(String id) {
		return registry.get(id, LineOfIdentity.class)
				.orElseThrow(() -> new StructuralException("Line of identity not found: " + id));
	}
}
