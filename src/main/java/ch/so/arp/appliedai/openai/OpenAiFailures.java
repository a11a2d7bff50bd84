package ch.so.arp.appliedai.openai;

import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import ch.so.arp.appliedai.error.AssistantException;
import ch.so.arp.appliedai.error.FailureKind;

/**
 * Maps OpenAI transport failures onto the service's {@link FailureKind}s.
 */
final class OpenAiFailures {

    private OpenAiFailures() {
    }

    /**
     * Classify a failed call. Rejected credentials, throttling and other
     * client errors keep their own kinds; server errors and I/O problems
     * become {@code unavailableKind}.
     */
    static AssistantException classify(String operation, RestClientException ex, FailureKind unavailableKind) {
        if (ex instanceof RestClientResponseException responseException) {
            HttpStatusCode status = responseException.getStatusCode();
            String message = operation + " failed with HTTP " + status.value();
            if (status.value() == 401 || status.value() == 403) {
                return new AssistantException(FailureKind.UNAUTHORIZED, message, ex);
            }
            if (status.value() == 429) {
                return new AssistantException(FailureKind.RATE_LIMITED, message, ex);
            }
            if (status.is4xxClientError()) {
                return new AssistantException(FailureKind.BAD_UPSTREAM_REQUEST, message, ex);
            }
            return new AssistantException(unavailableKind, message, ex);
        }
        return new AssistantException(unavailableKind, operation + " failed: " + ex.getMessage(), ex);
    }
}
