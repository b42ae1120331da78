package com.txradar.external;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Decides which client failures are worth another attempt: connection errors, timeouts, 429 and 5xx.
 */
final class TransientHttpErrors {

    private TransientHttpErrors() {
    }

    static boolean isTransient(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof WebClientRequestException) {
                return true;
            }
            if (t instanceof WebClientResponseException response) {
                int status = response.getStatusCode().value();
                return status == 429 || status >= 500;
            }
        }
        return false;
    }
}
