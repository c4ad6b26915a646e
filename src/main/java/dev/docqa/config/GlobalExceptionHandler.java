package dev.docqa.config;

import dev.docqa.failure.DependencyUnavailableException;
import dev.docqa.failure.JobFailureException;
import dev.docqa.failure.PersistenceFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Invalid input ({@link IllegalArgumentException}, e.g. a malformed artifact name) is a 400.
 * A submission that fails because storage or the job queue is down is a 503 carrying the job error
 * code.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler({DependencyUnavailableException.class, PersistenceFailureException.class})
  ProblemDetail handleUnavailable(JobFailureException ex) {
    log.warn("Rejecting request: {}", ex.getMessage());
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    problem.setProperty("code", ex.code().name());
    return problem;
  }
}
