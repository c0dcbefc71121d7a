package com.al.graphsubscriptions.service.graph;

import com.al.graphsubscriptions.exception.GraphApiException;
import com.al.graphsubscriptions.exception.GraphRequestRejectedException;
import com.al.graphsubscriptions.exception.GraphResourceNotFoundException;
import com.al.graphsubscriptions.exception.GraphTransientException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Maps RestTemplate failures onto the not-found / transient / rejected taxonomy.
 */
public final class GraphErrorClassifier {

    private GraphErrorClassifier() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    public static GraphApiException classify(String operation, RestClientException e) {
        if (e instanceof RestClientResponseException) {
            RestClientResponseException response = (RestClientResponseException) e;
            int status = response.getStatusCode().value();
            String message = operation + " failed with HTTP " + status + ": " + summarize(response);
            return classifyStatus(status, message, e);
        }
        // ResourceAccessException (connection refused, read timeout) and anything without a response
        return new GraphTransientException(operation + " failed: " + e.getMessage(), 0, e);
    }

    public static GraphApiException classifyStatus(int status, String message, Throwable cause) {
        if (status == 404) {
            return new GraphResourceNotFoundException(message, cause);
        }
        if (status == 408 || status == 429 || status >= 500) {
            return new GraphTransientException(message, status, cause);
        }
        if (status >= 400) {
            return new GraphRequestRejectedException(message, status, cause);
        }
        return new GraphTransientException(message, status, cause);
    }

    private static String summarize(RestClientResponseException e) {
        String body = e.getResponseBodyAsString();
        if (body == null || body.isBlank()) {
            return e.getStatusText();
        }
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
