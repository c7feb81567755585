package dev.lingx.config;

import dev.lingx.quality.EvaluatorUnavailableException;
import dev.lingx.quality.QualityConfigValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Config validation failures become 400 with an {@code errors} property listing each
 * violation; any other {@link IllegalArgumentException} becomes a plain 400. A score request that
 * needs an evaluator when none is configured becomes 503.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(QualityConfigValidationException.class)
  ProblemDetail handleConfigValidation(QualityConfigValidationException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setTitle("Invalid quality config");
    problem.setProperty("errors", ex.getErrors());
    return problem;
  }

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

  @ExceptionHandler(EvaluatorUnavailableException.class)
  ProblemDetail handleEvaluatorUnavailable(EvaluatorUnavailableException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    problem.setTitle("Quality evaluator unavailable");
    return problem;
  }
}
