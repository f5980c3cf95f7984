package com.marketfeed.gateway.config;

import com.marketfeed.stream.error.CollaboratorUnavailableException;
import com.marketfeed.stream.error.RateLimitedException;
import com.marketfeed.stream.error.ResourceExhaustedException;
import com.marketfeed.stream.error.ValidationFailedException;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private static final String TYPE_PREFIX = "/problems/";

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request validation failed");
    problem.setType(URI.create(TYPE_PREFIX + "validation-error"));
    problem.setTitle("Validation Error");
    problem.setProperty(
        "errors",
        ex.getFieldErrors().stream()
            .map(
                fe ->
                    new FieldError(
                        fe.getField(),
                        fe.getDefaultMessage(),
                        String.valueOf(fe.getRejectedValue())))
            .toList());
    return problem;
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request body is not readable");
    problem.setType(URI.create(TYPE_PREFIX + "malformed-request"));
    problem.setTitle("Malformed Request");
    return problem;
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ProblemDetail handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "method-not-allowed"));
    problem.setTitle("Method Not Allowed");
    return problem;
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ProblemDetail handleNotFound(NoResourceFoundException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "not-found"));
    problem.setTitle("Not Found");
    return problem;
  }

  @ExceptionHandler(ValidationFailedException.class)
  public ProblemDetail handleDataValidation(ValidationFailedException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "data-validation-failed"));
    problem.setTitle("Data Validation Failed");
    problem.setProperty("code", ex.code());
    return problem;
  }

  @ExceptionHandler(RateLimitedException.class)
  public ResponseEntity<ProblemDetail> handleRateLimited(RateLimitedException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "rate-limited"));
    problem.setTitle("Rate Limited");
    problem.setProperty("code", ex.code());
    problem.setProperty("retryAfterSeconds", ex.retryAfterSeconds());
    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.retryAfterSeconds()))
        .body(problem);
  }

  @ExceptionHandler(ResourceExhaustedException.class)
  public ProblemDetail handleResourceExhausted(ResourceExhaustedException ex) {
    log.warn("Connection capacity exhausted limit={} current={}", ex.limit(), ex.current());
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "resource-exhausted"));
    problem.setTitle("Resource Exhausted");
    problem.setProperty("code", ex.code());
    problem.setProperty("limit", ex.limit());
    return problem;
  }

  @ExceptionHandler(CollaboratorUnavailableException.class)
  public ProblemDetail handleCollaboratorUnavailable(CollaboratorUnavailableException ex) {
    log.warn(
        "Collaborator unavailable collaborator={} error={}", ex.collaborator(), ex.getMessage());
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.SERVICE_UNAVAILABLE, "Upstream feed is temporarily unavailable");
    problem.setType(URI.create(TYPE_PREFIX + "collaborator-unavailable"));
    problem.setTitle("Service Unavailable");
    problem.setProperty("code", ex.code());
    problem.setProperty("collaborator", ex.collaborator());
    return problem;
  }

  @ExceptionHandler(Exception.class)
  public ProblemDetail handleUnexpected(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred. Please try again later.");
    problem.setType(URI.create(TYPE_PREFIX + "internal-error"));
    problem.setTitle("Internal Server Error");
    return problem;
  }

  private record FieldError(String field, String message, String rejectedValue) {}
}
