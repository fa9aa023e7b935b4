package org.javai.eg.clif;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds a single {@link Sexp} from CLIF tokens.
 *
 * <p>Reading uses an explicit stack rather than recursion; nesting deeper than the
 * configured limit is rejected.</p>
 */
public class SexpReader {

	private final List<ClifToken> tokens;
	private final int maxDepth;

	public SexpReader(List<ClifToken> tokens, int maxDepth) {
		this.tokens = tokens != null ? tokens : List.of();
		this.maxDepth = maxDepth;
	}

	/**
	 * @return the one expression held by the tokens
	 * @throws ClifParseException if there is no expression, more than one, or nesting is too deep
	 */
	public Sexp read() {
		Deque<Frame> open = new ArrayDeque<>();
		Sexp result = null;

		for (ClifToken token : tokens) {
			switch (token.type()) {
				case LPAREN -> {
					if (open.size() >= maxDepth) {
						throw new ClifParseException(
								"Expression nesting exceeds the maximum depth of " + maxDepth + " at position " + token.position());
					}
					if (open.isEmpty() && result != null) {
						throw unexpectedTrailing(token);
					}
					open.push(new Frame(token.position()));
				}
				case RPAREN -> {
					if (open.isEmpty()) {
						throw new ClifParseException("Unmatched closing parenthesis at position " + token.position());
					}
					Frame frame = open.pop();
					Sexp list = Sexp.list(frame.items, frame.position);
					if (open.isEmpty()) {
						result = list;
					} else {
						open.peek().items.add(list);
					}
				}
				case NAME -> {
					Sexp name = Sexp.name(token.value(), token.position());
					if (!open.isEmpty()) {
						open.peek().items.add(name);
					} else if (result == null) {
						result = name;
					} else {
						throw unexpectedTrailing(token);
					}
				}
				case EOF -> {
					// end of input
				}
			}
		}

		if (!open.isEmpty()) {
			throw new ClifParseException("Unmatched opening parenthesis at position " + open.peek().position);
		}
		if (result == null) {
			throw new ClifParseException("Empty expression");
		}
		return result;
	}

	private ClifParseException unexpectedTrailing(ClifToken token) {
		return new ClifParseException(
				"Unexpected input after the expression at position " + token.position() + ": " + token.value());
	}

	private static final class Frame {
		private final int position;
		private final List<Sexp> items = new ArrayList<>();

		private Frame(int position) {
			this.position = position;
		}
	}
}
