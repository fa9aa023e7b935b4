package org.javai.eg.clif;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import org.junit.jupiter.api.Test;

class ClifTokenizerTest {

	@Test
	void tokenizesNestedExpression() {
		List<ClifToken> tokens = new ClifTokenizer("(not (P ?x))").tokenize();

		assertThat(tokens).extracting(ClifToken::type).containsExactly(
				ClifToken.TokenType.LPAREN,
				ClifToken.TokenType.NAME,
				ClifToken.TokenType.LPAREN,
				ClifToken.TokenType.NAME,
				ClifToken.TokenType.NAME,
				ClifToken.TokenType.RPAREN,
				ClifToken.TokenType.RPAREN,
				ClifToken.TokenType.EOF);
		assertThat(tokens.get(3).value()).isEqualTo("P");
		assertThat(tokens.get(4).value()).isEqualTo("?x");
		assertThat(tokens.get(4).position()).isEqualTo(8);
	}

	@Test
	void skipsCommentsAndCollapsesWhitespace() {
		List<ClifToken> tokens = new ClifTokenizer("; a comment\n(P\n\t  ?x) ; trailing").tokenize();

		assertThat(tokens).extracting(ClifToken::value).containsExactly("(", "P", "?x", ")", "");
	}

	@Test
	void bareNameIsSingleToken() {
		assertThat(new ClifTokenizer("  Raining  ").tokenize())
				.extracting(ClifToken::value)
				.containsExactly("Raining", "");
	}

	@Test
	void emptyInputRejected() {
		assertThatThrownBy(() -> new ClifTokenizer("   ; only a comment").tokenize())
				.isInstanceOf(ClifParseException.class)
				.hasMessage("Empty expression");
		assertThatThrownBy(() -> new ClifTokenizer(null).tokenize())
				.isInstanceOf(ClifParseException.class);
	}

	@Test
	void unmatchedClosingParenthesisRejected() {
		assertThatThrownBy(() -> new ClifTokenizer("(P ?x))").tokenize())
				.isInstanceOf(ClifParseException.class)
				.hasMessage("Unmatched closing parenthesis at position 6");
	}

	@Test
	void unmatchedOpeningParenthesisRejected() {
		assertThatThrownBy(() -> new ClifTokenizer("(and (P ?x)").tokenize())
				.isInstanceOf(ClifParseException.class)
				.hasMessage("Unmatched opening parenthesis");
	}
}
