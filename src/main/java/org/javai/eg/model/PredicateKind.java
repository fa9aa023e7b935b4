package org.javai.eg.model;

public enum PredicateKind {
	RELATION,
	CONSTANT
}
