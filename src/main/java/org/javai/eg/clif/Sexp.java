package org.javai.eg.clif;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raw S-expression read from CLIF text, before any grammar is applied.
 *
 * A node is either:
 * - a name (atom) - has a name and no items
 * - a list - has items and no name
 */
public record Sexp(String name, List<Sexp> items, int position) {

	public static Sexp name(String name, int position) {
		return new Sexp(name, List.of(), position);
	}

	public static Sexp list(List<Sexp> items, int position) {
		return new Sexp(null, List.copyOf(items), position);
	}

	public boolean isName() {
		return name != null;
	}

	public boolean isList() {
		return name == null;
	}

	/**
	 * @return the name at the head of a list, or null for names and lists not starting with a name
	 */
	public String head() {
		return isList() && !items.isEmpty() && items.get(0).isName() ? items.get(0).name() : null;
	}

	public int size() {
		return items.size();
	}

	public Sexp item(int index) {
		return items.get(index);
	}

	@Override
	public String toString() {
		if (isName()) {
			return name;
		}
		return items.stream().map(Sexp::toString).collect(Collectors.joining(" ", "(", ")"));
	}
}
