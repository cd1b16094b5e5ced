package dev.ragservice.config;

import dev.ragservice.search.RetrievalFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Invalid input ({@link IllegalArgumentException} from request records) maps to 400. A search
 * in which every retrieval branch failed maps to 503, since the index is unavailable rather than
 * the request being wrong.
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

  /**
   * Maps {@link RetrievalFailureException} to a 503 Service Unavailable Problem Detail listing the
   * failed branches.
   *
   * @param ex the failure raised by the search orchestrator
   * @return a Problem Detail with HTTP 503 status
   */
  @ExceptionHandler(RetrievalFailureException.class)
  ProblemDetail handleRetrievalFailure(RetrievalFailureException ex) {
    log.error("Search unavailable: {}", ex.getMessage());
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.SERVICE_UNAVAILABLE, "Search is temporarily unavailable");
    problem.setProperty("branches", ex.getBranchFailures());
    return problem;
  }
}
