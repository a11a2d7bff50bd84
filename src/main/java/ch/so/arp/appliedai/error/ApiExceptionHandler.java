package ch.so.arp.appliedai.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Translates classified failures into problem responses. The body only ever
 * contains the fixed title and code of the {@link FailureKind}; exception
 * messages stay in the log.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String ERROR_PROPERTY = "error";

    @ExceptionHandler(AssistantException.class)
    public ProblemDetail handleAssistantException(AssistantException ex) {
        LOGGER.warn("Request failed with {}: {}", ex.getKind(), ex.getMessage());
        return toProblem(ex.getKind());
    }

    @ExceptionHandler({ MethodArgumentNotValidException.class, HttpMessageNotReadableException.class })
    public ProblemDetail handleInvalidRequest(Exception ex) {
        LOGGER.debug("Rejected malformed request: {}", ex.getMessage());
        return toProblem(FailureKind.INVALID_INPUT);
    }

    static ProblemDetail toProblem(FailureKind kind) {
        ProblemDetail problem = ProblemDetail.forStatus(kind.status());
        problem.setTitle(kind.title());
        problem.setProperty(ERROR_PROPERTY, kind.code());
        return problem;
    }
}
