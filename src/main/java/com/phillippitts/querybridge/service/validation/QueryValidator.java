package com.phillippitts.querybridge.service.validation;

import com.phillippitts.querybridge.config.properties.QueryValidationProperties;
import com.phillippitts.querybridge.domain.ContextTurn;
import com.phillippitts.querybridge.exception.QueryValidationException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Validates query text and conversation context before anything is queued or sent to the worker.
 */
@Component
public class QueryValidator {
    private final QueryValidationProperties props;

    public QueryValidator(QueryValidationProperties props) {
        this.props = props;
    }

    /**
     * @param query raw query text
     * @param context prior turns (may be null)
     * @throws QueryValidationException when any limit is violated
     */
    public void validate(String query, List<ContextTurn> context) {
        if (query == null || query.isBlank()) {
            throw new QueryValidationException("Query must be a non-empty string");
        }
        if (query.length() > props.maxLength()) {
            throw new QueryValidationException("Query exceeds maximum length of "
                    + props.maxLength() + " characters (got " + query.length() + ")");
        }
        if (context == null) {
            return;
        }
        if (context.size() > props.maxContextTurns()) {
            throw new QueryValidationException("Context exceeds maximum of "
                    + props.maxContextTurns() + " turns (got " + context.size() + ")");
        }
        for (int i = 0; i < context.size(); i++) {
            if (context.get(i) == null) {
                throw new QueryValidationException("Context turn " + i + " is null");
            }
        }
    }
}
