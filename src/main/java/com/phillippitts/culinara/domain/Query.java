package com.phillippitts.culinara.domain;

/**
 * A natural-language recipe query. Immutable once received.
 *
 * <p>Validation happens in {@link com.phillippitts.culinara.service.validation.QueryValidator}
 * so that malformed queries surface as
 * {@link com.phillippitts.culinara.exception.InvalidQueryException} rather than as
 * construction failures deep inside a controller.
 *
 * @param text        free-text query
 * @param preferences structured preferences, never null
 */
public record Query(String text, Preferences preferences) {

    public Query {
        preferences = preferences == null ? Preferences.NONE : preferences;
    }

    public static Query of(String text) {
        return new Query(text, Preferences.NONE);
    }
}
