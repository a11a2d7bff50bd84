package ch.so.arp.appliedai.error;

import java.util.Objects;

/**
 * Unchecked failure carrying a {@link FailureKind}. Raised by every layer of
 * the service and never retried locally.
 */
public class AssistantException extends RuntimeException {

    private final FailureKind kind;

    public AssistantException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public AssistantException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FailureKind getKind() {
        return kind;
    }

    public static AssistantException invalidInput(String message) {
        return new AssistantException(FailureKind.INVALID_INPUT, message);
    }

    public static AssistantException notFound(String message) {
        return new AssistantException(FailureKind.NOT_FOUND, message);
    }
}
