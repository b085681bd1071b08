package com.phillippitts.culinara.domain;

/**
 * Where a candidate came from. Declaration order is the ranking tie-break order:
 * database results precede web results when scores are equal.
 */
public enum Provenance {
    FROM_DATABASE,
    FROM_WEB
}
