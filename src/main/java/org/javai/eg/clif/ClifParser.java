package org.javai.eg.clif;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.eg.config.EgSettings;
import org.javai.eg.config.EgSettingsLoader;
import org.javai.eg.editor.EgEditor;
import org.javai.eg.model.Context;
import org.javai.eg.model.HookRef;
import org.javai.eg.model.Predicate;
import org.javai.eg.model.PredicateKind;
import org.javai.eg.model.SheetOfAssertion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads CLIF text and builds the corresponding existential graph through an {@link EgEditor}.
 *
 * <p>Supported grammar:</p>
 * <pre>
 * expr := name
 *       | (exists (var...) expr)
 *       | (and expr...)
 *       | (not expr)
 *       | (= var var)
 *       | (= var (fn term...))
 *       | (pred term...)
 * </pre>
 *
 * <p>Negation becomes a cut, conjunction places its conjuncts side by side, and quantification
 * is left implicit in the lines of identity. Each constant argument becomes a unary constant
 * predicate joined to the argument's hook by a line of identity.</p>
 *
 * <p>The whole expression is checked against the grammar before any entity is created, so a
 * failed parse leaves the graph unchanged. Failures are reported in the returned
 * {@link ClifParseResult}, never thrown.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * EgEditor editor = new EgEditor();
 * ClifParseResult result = new ClifParser(editor).parse("(exists (?x) (and (P ?x) (not (Q ?x))))");
 * </pre>
 */
public class ClifParser {

	private static final Logger logger = LoggerFactory.getLogger(ClifParser.class);

	private static final Set<String> KEYWORDS = Set.of("exists", "and", "not", "=");
	private static final Set<String> UNSUPPORTED = Set.of("or", "forall", "if", "iff");

	private final EgEditor editor;
	private final EgSettings settings;

	private final Map<String, String> variableMap = new LinkedHashMap<>();
	private final Map<String, String> constantPredicates = new LinkedHashMap<>();
	private final Map<String, String> argumentConstants = new HashMap<>();
	private final Set<HookRef> boundHooks = new LinkedHashSet<>();
	private final Map<String, String> equated = new HashMap<>();
	private final Map<String, String> classLines = new HashMap<>();
	private final Map<String, HookRef> firstUses = new HashMap<>();

	/**
	 * Creates a parser configured from the bundled {@code eg-settings.yaml}.
	 */
	public ClifParser(EgEditor editor) {
		this(editor, new EgSettingsLoader().loadDefault());
	}

	public ClifParser(EgEditor editor, EgSettings settings) {
		this.editor = Objects.requireNonNull(editor, "editor must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
	}

	public ClifParseResult parse(String clif) {
		return parse(clif, SheetOfAssertion.ID);
	}

	/**
	 * Parses {@code clif} and builds its graph inside {@code contextId}.
	 */
	public ClifParseResult parse(String clif, String contextId) {
		reset();
		try {
			List<ClifToken> tokens = new ClifTokenizer(clif).tokenize();
			Sexp expression = new SexpReader(tokens, settings.maxNestingDepth()).read();
			check(expression);
			if (editor.registry().get(contextId, Context.class).isEmpty()) {
				throw new ClifParseException("Target context not found: " + contextId);
			}
			collectEqualities(expression);
			ClifNode result = build(expression, contextId);
			logger.debug("Parsed CLIF into {} with {} variable(s) and {} constant(s)",
					contextId, variableMap.size(), constantPredicates.size());
			return ClifParseResult.success(result, variableMap, constantPredicates, hookConnections());
		} catch (ClifParseException e) {
			logger.debug("CLIF parse failed: {}", e.getMessage());
			return ClifParseResult.failure(e.getMessage());
		}
	}

	/**
	 * Classifies a term: names starting with {@code ?} and single uppercase letters are
	 * variables; names that are lowercase or start lowercase are constants; anything else is a
	 * variable.
	 */
	static boolean isConstant(String token) {
		if (token.isEmpty() || token.startsWith("?")) {
			return false;
		}
		if (token.length() == 1 && Character.isUpperCase(token.charAt(0))) {
			return false;
		}
		return isLowerCase(token) || (Character.isLowerCase(token.charAt(0)) && token.length() > 1);
	}

	private static boolean isLowerCase(String token) {
		boolean cased = false;
		for (int i = 0; i < token.length(); i++) {
			char c = token.charAt(i);
			if (Character.isUpperCase(c)) {
				return false;
			}
			if (Character.isLowerCase(c)) {
				cased = true;
			}
		}
		return cased;
	}

	private void reset() {
		variableMap.clear();
		constantPredicates.clear();
		argumentConstants.clear();
		boundHooks.clear();
		equated.clear();
		classLines.clear();
		firstUses.clear();
	}

	// ---------------------------------------------------------------------
	// Grammar check
	// ---------------------------------------------------------------------

	private void check(Sexp node) {
		if (node.isName()) {
			if (KEYWORDS.contains(node.name()) || UNSUPPORTED.contains(node.name())) {
				throw new ClifParseException("Unexpected keyword '" + node.name() + "' at position " + node.position());
			}
			return;
		}
		if (node.size() == 0) {
			throw new ClifParseException("Empty parentheses at position " + node.position());
		}
		String head = node.head();
		if (head == null) {
			throw new ClifParseException("Expected a name after '(' at position " + node.position());
		}
		if (UNSUPPORTED.contains(head)) {
			throw new ClifParseException("Unsupported connective '" + head + "' at position " + node.position()
					+ ": only exists, and, not and = are supported");
		}
		switch (head) {
			case "exists" -> {
				if (node.size() != 3 || !node.item(1).isList() || node.item(1).size() == 0
						|| !allNames(node.item(1).items(), 0)) {
					throw new ClifParseException("Malformed 'exists' expression at position " + node.position());
				}
				check(node.item(2));
			}
			case "and" -> {
				for (int i = 1; i < node.size(); i++) {
					check(node.item(i));
				}
			}
			case "not" -> {
				if (node.size() != 2) {
					throw new ClifParseException("Malformed 'not' expression at position " + node.position());
				}
				check(node.item(1));
			}
			case "=" -> {
				if (node.size() != 3) {
					throw new ClifParseException("Equality requires exactly two arguments at position " + node.position());
				}
				Sexp right = node.item(2);
				boolean function = right.isList() && right.head() != null && !KEYWORDS.contains(right.head())
						&& !UNSUPPORTED.contains(right.head()) && allNames(right.items(), 1);
				if (!node.item(1).isName() || !(right.isName() || function)) {
					throw new ClifParseException("Malformed '=' expression at position " + node.position());
				}
			}
			default -> {
				if (!allNames(node.items(), 1)) {
					throw new ClifParseException("Arguments of '" + head + "' must be names at position " + node.position());
				}
			}
		}
	}

	private boolean allNames(List<Sexp> items, int from) {
		for (int i = from; i < items.size(); i++) {
			if (!items.get(i).isName()) {
				return false;
			}
		}
		return true;
	}

	private void collectEqualities(Sexp node) {
		if (node.isName()) {
			return;
		}
		if ("=".equals(node.head()) && node.item(2).isName()) {
			String left = representative(node.item(1).name());
			String right = representative(node.item(2).name());
			if (!left.equals(right)) {
				equated.put(right, left);
			}
			return;
		}
		for (Sexp item : node.items()) {
			collectEqualities(item);
		}
	}

	private String representative(String variable) {
		String current = variable;
		while (equated.containsKey(current)) {
			current = equated.get(current);
		}
		return current;
	}

	// ---------------------------------------------------------------------
	// Graph construction
	// ---------------------------------------------------------------------

	private ClifNode build(Sexp node, String contextId) {
		if (node.isName()) {
			String predicateId = editor.addPredicate(node.name(), 0, contextId);
			constantPredicates.putIfAbsent(node.name(), predicateId);
			return new ClifNode.Constant(node.name(), predicateId);
		}
		String head = node.head();
		return switch (head) {
			case "exists" -> {
				List<String> variables = new ArrayList<>();
				for (Sexp variable : node.item(1).items()) {
					variables.add(variable.name());
					lineFor(variable.name());
				}
				yield new ClifNode.Exists(variables, build(node.item(2), contextId));
			}
			case "and" -> {
				List<ClifNode> conjuncts = new ArrayList<>();
				for (int i = 1; i < node.size(); i++) {
					conjuncts.add(build(node.item(i), contextId));
				}
				yield new ClifNode.And(conjuncts);
			}
			case "not" -> {
				String cutId = editor.addCut(contextId);
				yield new ClifNode.Not(cutId, build(node.item(1), cutId));
			}
			case "=" -> node.item(2).isName()
					? buildEquality(node.item(1).name(), node.item(2).name())
					: buildFunction(node.item(1).name(), node.item(2), contextId);
			default -> buildAtom(node, contextId);
		};
	}

	private ClifNode buildEquality(String left, String right) {
		String lineId = lineFor(left);
		lineFor(right);
		return new ClifNode.Equality(left, right, lineId);
	}

	private ClifNode buildAtom(Sexp node, String contextId) {
		int arity = node.size() - 1;
		String predicateId = editor.addPredicate(node.head(), arity, contextId);
		List<ClifNode.Argument> arguments = new ArrayList<>();
		for (int hook = 1; hook <= arity; hook++) {
			arguments.add(bindTerm(predicateId, hook, node.item(hook).name(), contextId));
		}
		return new ClifNode.Atom(node.head(), predicateId, arguments);
	}

	private ClifNode buildFunction(String output, Sexp application, String contextId) {
		int inputs = application.size() - 1;
		int arity = inputs + 1;
		String predicateId = editor.addPredicate(application.head(), arity, contextId, PredicateKind.RELATION, true);
		List<ClifNode.Argument> arguments = new ArrayList<>();
		for (int hook = 1; hook <= inputs; hook++) {
			arguments.add(bindTerm(predicateId, hook, application.item(hook).name(), contextId));
		}
		ClifNode.Argument result = bindVariable(predicateId, arity, output);
		return new ClifNode.Function(application.head(), predicateId, arguments, result);
	}

	private ClifNode.Argument bindTerm(String predicateId, int hook, String term, String contextId) {
		if (!isConstant(term)) {
			return bindVariable(predicateId, hook, term);
		}
		String constantId = argumentConstants.get(term);
		if (constantId == null) {
			constantId = editor.addPredicate(constantLabel(term), 1, contextId, PredicateKind.CONSTANT, false);
			argumentConstants.put(term, constantId);
			constantPredicates.put(term, constantId);
		}
		HookRef constantHook = HookRef.of(constantId, 1);
		HookRef hookRef = HookRef.of(predicateId, hook);
		editor.connect(constantHook, hookRef);
		boundHooks.add(constantHook);
		boundHooks.add(hookRef);
		return new ClifNode.Argument(term, true, hook, currentLine(hookRef), constantId);
	}

	private ClifNode.Argument bindVariable(String predicateId, int hook, String variable) {
		String lineId = lineFor(variable);
		HookRef hookRef = HookRef.of(predicateId, hook);
		String representative = representative(variable);
		HookRef firstUse = firstUses.putIfAbsent(representative, hookRef);
		editor.attach(lineId, firstUse == null ? List.of(hookRef) : List.of(firstUse, hookRef));
		boundHooks.add(hookRef);
		return new ClifNode.Argument(variable, false, hook, lineId, null);
	}

	private String lineFor(String variable) {
		String lineId = classLines.computeIfAbsent(representative(variable), v -> editor.addLine());
		variableMap.put(variable, lineId);
		return lineId;
	}

	private String constantLabel(String term) {
		if (!settings.capitalizeConstantLabels()) {
			return term;
		}
		return Character.toUpperCase(term.charAt(0)) + term.substring(1);
	}

	private String currentLine(HookRef hookRef) {
		return editor.registry().get(hookRef.predicateId(), Predicate.class)
				.map(predicate -> predicate.hooks().get(hookRef.index()))
				.orElse(null);
	}

	private Map<HookRef, String> hookConnections() {
		Map<HookRef, String> connections = new LinkedHashMap<>();
		for (HookRef hookRef : boundHooks) {
			String lineId = currentLine(hookRef);
			if (lineId != null) {
				connections.put(hookRef, lineId);
			}
		}
		return connections;
	}
}
