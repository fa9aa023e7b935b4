package org.javai.eg.model;

public class DuplicateIdException extends StructuralException {

	private final String duplicateId;

	public DuplicateIdException(String duplicateId) {
		super("Object with id " + duplicateId + " already exists.");
		this.duplicateId = duplicateId;
	}

	public String duplicateId() {
		return duplicateId;
	}
}
