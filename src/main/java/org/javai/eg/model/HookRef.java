package org.javai.eg.model;

import java.util.Objects;

/**
 * Names one hook of one predicate.
 *
 * @param predicateId the predicate owning the hook
 * @param index the 1-based hook index
 */
public record HookRef(String predicateId, int index) {

	public HookRef {
		Objects.requireNonNull(predicateId, "predicateId must not be null");
	}

	public static HookRef of(String predicateId, int index) {
		return new HookRef(predicateId, index);
	}

	@Override
	public String toString() {
		return predicateId + "#" + index;
	}
}
