package org.javai.eg.config;

/**
 * Tunables of the CLIF parser and translator.
 *
 * @param variablePrefix prefix of the variable names generated by the translator
 * @param maxNestingDepth deepest parenthesis nesting the parser accepts
 * @param capitalizeConstantLabels whether constant arguments become predicates with a capitalised label
 */
public record EgSettings(String variablePrefix, int maxNestingDepth, boolean capitalizeConstantLabels) {

	public static final String DEFAULT_VARIABLE_PREFIX = "?v";
	public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

	public EgSettings {
		if (variablePrefix == null || variablePrefix.isBlank()) {
			throw new IllegalArgumentException("Variable prefix cannot be null or blank");
		}
		if (variablePrefix.contains("(") || variablePrefix.contains(")") || variablePrefix.contains(" ")) {
			throw new IllegalArgumentException("Variable prefix cannot contain parentheses or spaces: " + variablePrefix);
		}
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("Max nesting depth must be positive: " + maxNestingDepth);
		}
	}

	public static EgSettings defaults() {
		return new EgSettings(DEFAULT_VARIABLE_PREFIX, DEFAULT_MAX_NESTING_DEPTH, true);
	}

	public EgSettings withVariablePrefix(String prefix) {
		return new EgSettings(prefix, maxNestingDepth, capitalizeConstantLabels);
	}

	public EgSettings withMaxNestingDepth(int depth) {
		return new EgSettings(variablePrefix, depth, capitalizeConstantLabels);
	}
}
