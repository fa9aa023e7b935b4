package org.javai.eg.clif;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for CLIF text.
 * Strips {@code ;} line comments, splits on whitespace and parentheses and checks that
 * parentheses balance.
 */
public class ClifTokenizer {

	private final String input;
	private int pos = 0;

	public ClifTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws ClifParseException if the input is empty or parentheses do not balance
	 */
	public List<ClifToken> tokenize() {
		List<ClifToken> tokens = new ArrayList<>();
		int depth = 0;

		while (!isAtEnd()) {
			skipWhitespaceAndComments();
			if (isAtEnd()) break;

			ClifToken token = nextToken();
			if (token.isType(ClifToken.TokenType.LPAREN)) {
				depth++;
			} else if (token.isType(ClifToken.TokenType.RPAREN)) {
				depth--;
				if (depth < 0) {
					throw new ClifParseException("Unmatched closing parenthesis at position " + token.position());
				}
			}
			tokens.add(token);
		}

		if (tokens.isEmpty()) {
			throw new ClifParseException("Empty expression");
		}
		if (depth != 0) {
			throw new ClifParseException("Unmatched opening parenthesis");
		}

		tokens.add(new ClifToken(ClifToken.TokenType.EOF, "", pos));
		return tokens;
	}

	private ClifToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '(' -> {
				advance();
				yield new ClifToken(ClifToken.TokenType.LPAREN, "(", start);
			}
			case ')' -> {
				advance();
				yield new ClifToken(ClifToken.TokenType.RPAREN, ")", start);
			}
			default -> scanName();
		};
	}

	private ClifToken scanName() {
		int start = pos;

		while (!isAtEnd() && isNameChar(peek())) {
			advance();
		}

		return new ClifToken(ClifToken.TokenType.NAME, input.substring(start, pos), start);
	}

	private void skipWhitespaceAndComments() {
		while (!isAtEnd()) {
			char c = peek();
			if (Character.isWhitespace(c)) {
				advance();
			} else if (c == ';') {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			} else {
				return;
			}
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isNameChar(char c) {
		return c != '(' && c != ')' && c != ';' && !Character.isWhitespace(c);
	}
}
