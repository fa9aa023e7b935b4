package org.javai.eg.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Record of one joining event: the hooks joined together, the line they currently
 * realize and the cuts the connection passes through.
 *
 * <p>Attachments are fixed at creation and are not rewritten when the line is later
 * merged into another one.</p>
 */
public final class Ligature implements GraphObject {

	private final String id;
	private final List<HookRef> attachments;
	private String lineId;
	private Set<String> traversedCuts = Set.of();

	public Ligature(String lineId, List<HookRef> attachments) {
		this(null, lineId, attachments);
	}

	public Ligature(String id, String lineId, List<HookRef> attachments) {
		this.id = id != null ? id : GraphObject.newId();
		this.lineId = Objects.requireNonNull(lineId, "lineId must not be null");
		this.attachments = attachments != null ? List.copyOf(attachments) : List.of();
	}

	@Override
	public String id() {
		return id;
	}

	public List<HookRef> attachments() {
		return attachments;
	}

	public String lineId() {
		return lineId;
	}

	public void relinkTo(String lineId) {
		this.lineId = Objects.requireNonNull(lineId, "lineId must not be null");
	}

	public Set<String> traversedCuts() {
		return traversedCuts;
	}

	public void traversedCuts(Collection<String> cutIds) {
		this.traversedCuts = Collections.unmodifiableSet(new LinkedHashSet<>(cutIds));
	}

	@Override
	public String toString() {
		return "Ligature[" + id + ", line=" + lineId + ", attachments=" + attachments + "]";
	}
}
