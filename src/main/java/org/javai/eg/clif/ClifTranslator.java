package org.javai.eg.clif;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import org.javai.eg.config.EgSettings;
import org.javai.eg.config.EgSettingsLoader;
import org.javai.eg.model.Context;
import org.javai.eg.model.ContextTree;
import org.javai.eg.model.Cut;
import org.javai.eg.model.EntityRegistry;
import org.javai.eg.model.GraphObject;
import org.javai.eg.model.HookRef;
import org.javai.eg.model.Ligature;
import org.javai.eg.model.LineOfIdentity;
import org.javai.eg.model.Predicate;
import org.javai.eg.model.SheetOfAssertion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates an existential graph into canonical CLIF text.
 *
 * <p>Each context becomes a conjunction of its predicates and negated cuts. A line of identity
 * is quantified at its scope: the lowest context enclosing every predicate it joins. Variables
 * are named {@code ?v1}, {@code ?v2}, ... in order of discovery.</p>
 *
 * <p>Children are visited in order of their name-free clause shape, with ties kept in insertion
 * order, and conjuncts are written in that same order. Parsing the output therefore inserts the
 * children in the order they were visited, so translating the parsed graph reproduces the text.
 * Quantified variables are listed in the order they were named.</p>
 */
public class ClifTranslator {

	private static final Logger logger = LoggerFactory.getLogger(ClifTranslator.class);

	private static final String UNBOUND = "unbound:";

	private final EntityRegistry registry;
	private final ContextTree tree;
	private final EgSettings settings;

	// per translation pass
	private final Map<String, String> variables = new HashMap<>();
	private final Map<String, String> scopes = new HashMap<>();
	private final Map<String, Set<String>> boundContexts = new HashMap<>();
	private final Map<String, String> shapes = new HashMap<>();
	private int counter;

	/**
	 * Creates a translator configured from the bundled {@code eg-settings.yaml}.
	 */
	public ClifTranslator(EntityRegistry registry) {
		this(registry, new EgSettingsLoader().loadDefault());
	}

	public ClifTranslator(EntityRegistry registry, EgSettings settings) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		this.tree = new ContextTree(registry);
	}

	/**
	 * @return the CLIF text of the whole graph, or the empty string for an empty sheet
	 */
	public String translate() {
		reset();
		indexHooks();
		String clif = translateContext(registry.sheet());
		logger.debug("Translated graph with {} variable(s)", counter);
		return clif;
	}

	private void reset() {
		variables.clear();
		scopes.clear();
		boundContexts.clear();
		shapes.clear();
		counter = 0;
	}

	private void indexHooks() {
		for (Predicate predicate : registry.objectsOf(Predicate.class)) {
			String parent = tree.parentOf(predicate.id()).orElse(null);
			if (parent == null) {
				continue;
			}
			predicate.hooks().forEach((hook, lineId) -> {
				if (lineId != null) {
					boundContexts.computeIfAbsent(lineId, k -> new LinkedHashSet<>()).add(parent);
				}
			});
		}
	}

	private String translateContext(Context context) {
		List<GraphObject> children = orderedChildren(context);

		List<String> quantified = new ArrayList<>();
		for (String line : discoverLines(children)) {
			if (context.id().equals(scopeOf(line)) && !variables.containsKey(line)) {
				String name = settings.variablePrefix() + (++counter);
				variables.put(line, name);
				quantified.add(name);
			}
		}

		List<String> clauses = new ArrayList<>();
		for (GraphObject child : children) {
			if (child instanceof Predicate predicate) {
				clauses.add(render(predicate, this::variableFor));
			} else if (child instanceof Cut cut) {
				String body = translateContext(cut);
				clauses.add("(not " + (body.isEmpty() ? "(and)" : body) + ")");
			}
		}

		String body = switch (clauses.size()) {
			case 0 -> "";
			case 1 -> clauses.get(0);
			default -> "(and " + String.join(" ", clauses) + ")";
		};
		if (body.isEmpty() || quantified.isEmpty()) {
			return body;
		}
		return "(exists (" + String.join(" ", quantified) + ") " + body + ")";
	}

	/**
	 * Breadth-first over the subgraph below the given children, collecting line keys in order
	 * of first discovery.
	 */
	private List<String> discoverLines(List<GraphObject> children) {
		Set<String> found = new LinkedHashSet<>();
		Deque<List<GraphObject>> pending = new ArrayDeque<>();
		pending.add(children);
		while (!pending.isEmpty()) {
			for (GraphObject child : pending.poll()) {
				if (child instanceof Predicate predicate) {
					predicate.hooks().forEach((hook, lineId) -> found.add(lineKey(predicate, hook, lineId)));
				} else if (child instanceof Cut cut) {
					pending.add(orderedChildren(cut));
				}
			}
		}
		return new ArrayList<>(found);
	}

	private String lineKey(Predicate predicate, int hook, String lineId) {
		return lineId != null ? lineId : UNBOUND + predicate.id() + ":" + hook;
	}

	/**
	 * Scope of a line: the lowest common ancestor of the contexts of every predicate joined to
	 * it, through its ligatures or through a hook binding. An unbound hook is scoped at its own
	 * predicate's context.
	 */
	private String scopeOf(String lineKey) {
		return scopes.computeIfAbsent(lineKey, key -> {
			Set<String> contexts = new LinkedHashSet<>();
			if (key.startsWith(UNBOUND)) {
				String predicateId = key.substring(UNBOUND.length(), key.lastIndexOf(':'));
				tree.parentOf(predicateId).ifPresent(contexts::add);
			} else {
				registry.get(key, LineOfIdentity.class).ifPresent(line -> {
					for (String ligatureId : line.ligatures()) {
						registry.get(ligatureId, Ligature.class).ifPresent(ligature -> {
							for (HookRef attachment : ligature.attachments()) {
								if (registry.contains(attachment.predicateId())) {
									tree.parentOf(attachment.predicateId()).ifPresent(contexts::add);
								}
							}
						});
					}
				});
				contexts.addAll(boundContexts.getOrDefault(key, Set.of()));
			}
			return tree.lowestCommonAncestor(contexts).orElse(SheetOfAssertion.ID);
		});
	}

	private String variableFor(String lineKey) {
		return variables.computeIfAbsent(lineKey, k -> settings.variablePrefix() + (++counter));
	}

	private String render(Predicate predicate, UnaryOperator<String> namer) {
		List<String> terms = new ArrayList<>();
		predicate.hooks().forEach((hook, lineId) -> terms.add(namer.apply(lineKey(predicate, hook, lineId))));
		if (predicate.isFunctional()) {
			String output = terms.remove(terms.size() - 1);
			String call = terms.isEmpty()
					? "(" + predicate.label() + ")"
					: "(" + predicate.label() + " " + String.join(" ", terms) + ")";
			return "(= " + output + " " + call + ")";
		}
		if (terms.isEmpty()) {
			return predicate.label();
		}
		return "(" + predicate.label() + " " + String.join(" ", terms) + ")";
	}

	private String sortedConjunction(List<String> clauses) {
		if (clauses.isEmpty()) {
			return "";
		}
		if (clauses.size() == 1) {
			return clauses.get(0);
		}
		List<String> sorted = new ArrayList<>(clauses);
		Collections.sort(sorted);
		return "(and " + String.join(" ", sorted) + ")";
	}

	// ---------------------------------------------------------------------
	// Canonical child order
	// ---------------------------------------------------------------------

	private List<GraphObject> orderedChildren(Context context) {
		List<GraphObject> children = context.children().stream()
				.map(registry::get)
				.flatMap(Optional::stream)
				.collect(Collectors.toCollection(ArrayList::new));
		children.sort(Comparator.comparing(this::shapeOf));
		return children;
	}

	/**
	 * The clause an object would produce with every variable written as {@code ?}.
	 */
	private String shapeOf(GraphObject obj) {
		String cached = shapes.get(obj.id());
		if (cached != null) {
			return cached;
		}
		String shape;
		if (obj instanceof Predicate predicate) {
			shape = render(predicate, key -> "?");
		} else if (obj instanceof Cut cut) {
			List<String> inner = new ArrayList<>();
			for (String childId : cut.children()) {
				registry.get(childId).ifPresent(child -> inner.add(shapeOf(child)));
			}
			shape = "(not " + (inner.isEmpty() ? "(and)" : sortedConjunction(inner)) + ")";
		} else {
			shape = "";
		}
		shapes.put(obj.id(), shape);
		return shape;
	}
}
