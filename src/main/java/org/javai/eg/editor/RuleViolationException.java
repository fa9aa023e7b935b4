package org.javai.eg.editor;

import org.javai.eg.model.EgException;

/**
 * Thrown when a transformation rule is applied where its precondition does not hold.
 * The graph is left as it was before the call.
 */
public class RuleViolationException extends EgException {

	private final String rule;

	public RuleViolationException(String rule, String message) {
		super(message);
		this.rule = rule;
	}

	/**
	 * @return the name of the rule that was refused
	 */
	public String rule() {
		return rule;
	}
}
