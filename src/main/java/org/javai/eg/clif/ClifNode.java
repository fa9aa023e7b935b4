package org.javai.eg.clif;

import java.util.List;

/**
 * Typed result tree of a CLIF parse. Each node carries the ids of the graph entities it
 * produced so a renderer can place them.
 */
public sealed interface ClifNode {

	enum NodeType {
		CONSTANT,
		PREDICATE,
		FUNCTION,
		AND,
		NOT,
		EXISTS,
		EQUALITY
	}

	NodeType type();

	/**
	 * A bare name, asserted as a nullary predicate.
	 */
	record Constant(String name, String predicateId) implements ClifNode {
		@Override
		public NodeType type() {
			return NodeType.CONSTANT;
		}
	}

	/**
	 * An atomic sentence {@code (name term...)}.
	 */
	record Atom(String name, String predicateId, List<Argument> arguments) implements ClifNode {
		public Atom {
			arguments = List.copyOf(arguments);
		}

		public int arity() {
			return arguments.size();
		}

		@Override
		public NodeType type() {
			return NodeType.PREDICATE;
		}
	}

	/**
	 * A function application equated to a variable, {@code (= out (name term...))}.
	 */
	record Function(String name, String predicateId, List<Argument> inputs, Argument output) implements ClifNode {
		public Function {
			inputs = List.copyOf(inputs);
		}

		@Override
		public NodeType type() {
			return NodeType.FUNCTION;
		}
	}

	record And(List<ClifNode> conjuncts) implements ClifNode {
		public And {
			conjuncts = List.copyOf(conjuncts);
		}

		@Override
		public NodeType type() {
			return NodeType.AND;
		}
	}

	record Not(String cutId, ClifNode negated) implements ClifNode {
		@Override
		public NodeType type() {
			return NodeType.NOT;
		}
	}

	record Exists(List<String> variables, ClifNode body) implements ClifNode {
		public Exists {
			variables = List.copyOf(variables);
		}

		@Override
		public NodeType type() {
			return NodeType.EXISTS;
		}
	}

	/**
	 * {@code (= a b)}: both names denote the individual on {@code sharedLineId}.
	 */
	record Equality(String variable1, String variable2, String sharedLineId) implements ClifNode {
		@Override
		public NodeType type() {
			return NodeType.EQUALITY;
		}
	}

	/**
	 * One argument of an atom or function.
	 *
	 * @param name the term as written
	 * @param constant whether the term was read as a constant
	 * @param hookIndex the hook of the enclosing predicate bound to the term
	 * @param lineId the line bound to that hook
	 * @param constantPredicateId the constant's own predicate, or null for variables
	 */
	record Argument(String name, boolean constant, int hookIndex, String lineId, String constantPredicateId) {
	}
}
