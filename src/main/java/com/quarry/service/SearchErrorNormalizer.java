package com.quarry.service;

import com.quarry.backend.SearchBackendException;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeoutException;

/**
 * Turns transport failures into a single user-facing {@link QueryExecutionException}.
 *
 * Message precedence: remapped error code, backend message, HTTP status text.
 * A backend detail string is appended in parentheses.
 */
@Component
public class SearchErrorNormalizer {

    private final SearchErrorMessages errorMessages;

    public SearchErrorNormalizer(SearchErrorMessages errorMessages) {
        this.errorMessages = errorMessages;
    }

    public QueryExecutionException normalize(Throwable error) {
        if (error instanceof QueryExecutionException queryError) {
            return queryError;
        }
        if (error instanceof TimeoutException) {
            return new QueryExecutionException("Search request timed out", error);
        }
        if (!(error instanceof SearchBackendException backendError)) {
            String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            return new QueryExecutionException(message, error);
        }

        String message;
        String detail = null;
        if (backendError.hasBody()) {
            message = backendError.getBackendMessage();
            detail = backendError.getDetail();
        } else {
            message = backendError.getStatusText();
        }

        String remapped = errorMessages.forCode(backendError.getCode());
        if (remapped != null) {
            message = remapped;
        }
        if (message == null || message.isBlank()) {
            message = backendError.getMessage();
        }

        return new QueryExecutionException(message + (detail != null ? " ( " + detail + " ) " : ""), error);
    }
}
