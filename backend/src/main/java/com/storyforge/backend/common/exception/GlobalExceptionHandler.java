package com.storyforge.backend.common.exception;

import com.storyforge.backend.conversation.error.ConversationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

/** Renders failures of the synchronous endpoints as {@link ProblemDetail} with an {@code error}. */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  static final String ERROR_PROPERTY = "error";

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("An unexpected error occurred. Please retry later.");
    problem.setProperty(ERROR_PROPERTY, problem.getDetail());
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler(ConversationException.class)
  public ResponseEntity<ProblemDetail> handleConversationException(ConversationException ex) {
    HttpStatus status = ex.kind().status();
    if (status.is5xxServerError()) {
      log.warn("Request failed [{}]: {}", ex.kind(), ex.getMessage());
    } else {
      log.debug("Request rejected [{}]: {}", ex.kind(), ex.getMessage());
    }
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    problem.setTitle(ex.kind().name());
    problem.setProperty(ERROR_PROPERTY, ex.getMessage());
    return ResponseEntity.status(status).body(problem);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
  public ResponseEntity<ProblemDetail> handleValidationErrors(Exception ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(resolveValidationMessage(ex));
    problem.setProperty(ERROR_PROPERTY, problem.getDetail());
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail("Invalid value for parameter '" + ex.getName() + "'");
    problem.setProperty(ERROR_PROPERTY, problem.getDetail());
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    ProblemDetail problem = ex.getBody();
    problem.setProperty(ERROR_PROPERTY, ex.getReason());
    return ResponseEntity.status(ex.getStatusCode()).body(problem);
  }

  private String resolveValidationMessage(Exception ex) {
    if (ex instanceof MethodArgumentNotValidException methodArgumentNotValidException) {
      return methodArgumentNotValidException
          .getBindingResult()
          .getFieldErrors()
          .stream()
          .findFirst()
          .map(error -> error.getField() + " " + (error.getDefaultMessage() != null ? error.getDefaultMessage() : "is invalid"))
          .orElse("Invalid request payload");
    }
    if (ex instanceof BindException bindException) {
      return bindException
          .getBindingResult()
          .getAllErrors()
          .stream()
          .findFirst()
          .map(error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid request payload")
          .orElse("Invalid request payload");
    }
    return "Invalid request payload";
  }
}
