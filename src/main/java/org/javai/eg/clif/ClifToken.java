package org.javai.eg.clif;

/**
 * Represents a token of CLIF text.
 *
 * @param type the token type
 * @param value the token text
 * @param position the character position in the input string
 */
public record ClifToken(TokenType type, String value, int position) {

	public enum TokenType {
		LPAREN,    // (
		RPAREN,    // )
		NAME,      // any run of characters other than whitespace and parentheses
		EOF        // end of input
	}

	@Override
	public String toString() {
		return type == TokenType.NAME ? "NAME(" + value + ")" : type.toString();
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}
}
