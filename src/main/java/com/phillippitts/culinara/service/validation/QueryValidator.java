package com.phillippitts.culinara.service.validation;

import com.phillippitts.culinara.config.properties.QueryProperties;
import com.phillippitts.culinara.domain.Query;
import com.phillippitts.culinara.exception.InvalidQueryException;
import org.springframework.stereotype.Component;

/**
 * Validates recipe queries before any source is consulted.
 */
@Component
public class QueryValidator {
    private final QueryProperties props;

    public QueryValidator(QueryProperties props) {
        this.props = props;
    }

    /**
     * Validate a query.
     * @param query incoming query
     * @throws InvalidQueryException when the text is missing or too long, or servings is not positive
     */
    public void validate(Query query) {
        if (query == null) {
            throw new InvalidQueryException("query is null");
        }
        String text = query.text();
        if (text == null || text.isBlank()) {
            throw new InvalidQueryException("query text is empty");
        }
        if (text.length() > props.getMaxQueryLength()) {
            throw new InvalidQueryException("query text is " + text.length()
                    + " characters. Max: " + props.getMaxQueryLength());
        }
        Integer servings = query.preferences().servings();
        if (servings != null && servings <= 0) {
            throw new InvalidQueryException("servings must be positive, got: " + servings);
        }
    }
}
