package com.phillippitts.culinara.domain;

/**
 * Which sources were consulted to build a response.
 *
 * @param usedDatabase true when the vector store was queried successfully
 * @param usedWeb      true when the web fallback ran
 */
public record SourceProvenance(boolean usedDatabase, boolean usedWeb) {

    public static final SourceProvenance NONE = new SourceProvenance(false, false);
}
