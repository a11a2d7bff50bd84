package ch.so.arp.appliedai.error;

import org.springframework.http.HttpStatus;

/**
 * Stable failure classification surfaced to callers. Each kind owns a
 * machine-readable code and a distinct HTTP status so that operators can tell
 * local faults, upstream outages and throttling apart.
 */
public enum FailureKind {

    INVALID_INPUT("invalid_input", HttpStatus.BAD_REQUEST, "Invalid input"),
    NOT_FOUND("not_found", HttpStatus.NOT_FOUND, "Resource not found"),
    STORAGE_UNAVAILABLE("storage_unavailable", HttpStatus.SERVICE_UNAVAILABLE, "Storage unavailable"),
    EMBEDDING_UNAVAILABLE("embedding_unavailable", HttpStatus.FAILED_DEPENDENCY, "Embedding backend unavailable"),
    UNAUTHORIZED("upstream_unauthorized", HttpStatus.UNAUTHORIZED, "Upstream rejected credentials"),
    RATE_LIMITED("rate_limited", HttpStatus.TOO_MANY_REQUESTS, "Upstream rate limit exceeded"),
    BAD_UPSTREAM_REQUEST("bad_upstream_request", HttpStatus.INTERNAL_SERVER_ERROR, "Upstream rejected the request"),
    UPSTREAM_UNAVAILABLE("upstream_unavailable", HttpStatus.BAD_GATEWAY, "Generation backend unavailable");

    private final String code;
    private final HttpStatus status;
    private final String title;

    FailureKind(String code, HttpStatus status, String title) {
        this.code = code;
        this.status = status;
        this.title = title;
    }

    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }

    public String title() {
        return title;
    }
}
