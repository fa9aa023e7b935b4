package org.javai.eg.clif;

import java.util.Map;
import org.javai.eg.model.HookRef;

/**
 * Outcome of parsing CLIF text into a graph.
 *
 * <p>On failure {@link #result()} is null, {@link #error()} describes the problem and the
 * maps are empty; the graph was not modified.</p>
 *
 * @param success whether the text was parsed and the graph built
 * @param result the typed parse tree
 * @param error the failure message, or null on success
 * @param variableMap variable name to line id
 * @param constantPredicates constant name to the id of its predicate
 * @param hookConnections each hook bound during the parse to its line id
 */
public record ClifParseResult(
		boolean success,
		ClifNode result,
		String error,
		Map<String, String> variableMap,
		Map<String, String> constantPredicates,
		Map<HookRef, String> hookConnections
) {

	public ClifParseResult {
		variableMap = variableMap != null ? Map.copyOf(variableMap) : Map.of();
		constantPredicates = constantPredicates != null ? Map.copyOf(constantPredicates) : Map.of();
		hookConnections = hookConnections != null ? Map.copyOf(hookConnections) : Map.of();
	}

	public static ClifParseResult success(ClifNode result, Map<String, String> variableMap,
			Map<String, String> constantPredicates, Map<HookRef, String> hookConnections) {
		return new ClifParseResult(true, result, null, variableMap, constantPredicates, hookConnections);
	}

	public static ClifParseResult failure(String error) {
		return new ClifParseResult(false, null, error, Map.of(), Map.of(), Map.of());
	}
}
