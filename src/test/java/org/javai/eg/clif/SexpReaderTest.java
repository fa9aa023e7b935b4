package org.javai.eg.clif;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;

class SexpReaderTest {

	private Sexp read(String input, int maxDepth) {
		return new SexpReader(new ClifTokenizer(input).tokenize(), maxDepth).read();
	}

	@Test
	void readsNestedLists() {
		Sexp sexp = read("(exists (?x) (P ?x))", 10);

		assertThat(sexp.isList()).isTrue();
		assertThat(sexp.head()).isEqualTo("exists");
		assertThat(sexp.size()).isEqualTo(3);
		assertThat(sexp.item(1).isList()).isTrue();
		assertThat(sexp.item(1).item(0).name()).isEqualTo("?x");
		assertThat(sexp.item(2).head()).isEqualTo("P");
	}

	@Test
	void readsBareName() {
		Sexp sexp = read("Raining", 10);

		assertThat(sexp.isName()).isTrue();
		assertThat(sexp.name()).isEqualTo("Raining");
	}

	@Test
	void listWithoutNameHasNoHead() {
		Sexp sexp = read("((P) ?x)", 10);

		assertThat(sexp.head()).isNull();
	}

	@Test
	void trailingExpressionRejected() {
		assertThatThrownBy(() -> read("(P ?x) (Q ?x)", 10))
				.isInstanceOf(ClifParseException.class)
				.hasMessageStartingWith("Unexpected input after the expression at position 7");
	}

	@Test
	void trailingNameRejected() {
		assertThatThrownBy(() -> read("P Q", 10))
				.isInstanceOf(ClifParseException.class)
				.hasMessageContaining("Unexpected input");
	}

	@Test
	void nestingBeyondLimitRejected() {
		assertThat(read("(not (not (P)))", 3).head()).isEqualTo("not");

		assertThatThrownBy(() -> read("(not (not (not (P))))", 3))
				.isInstanceOf(ClifParseException.class)
				.hasMessageContaining("maximum depth of 3");
	}

	@Test
	void deepNestingReadWithoutRecursion() {
		int depth = 5000;
		String input = "(not ".repeat(depth) + "P" + ")".repeat(depth);

		Sexp sexp = read(input, depth);

		assertThat(sexp.head()).isEqualTo("not");
	}
}
