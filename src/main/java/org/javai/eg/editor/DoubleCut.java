package org.javai.eg.editor;

/**
 * The pair of cuts created by {@link EgEditor#insertDoubleCut}.
 *
 * @param outerCutId the cut placed in the original context
 * @param innerCutId the cut nested directly inside the outer one
 */
public record DoubleCut(String outerCutId, String innerCutId) {
}
