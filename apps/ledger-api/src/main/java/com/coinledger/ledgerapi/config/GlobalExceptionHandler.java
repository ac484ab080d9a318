package com.coinledger.ledgerapi.config;

import com.coinledger.domain.ledger.AccountNotFoundException;
import com.coinledger.domain.ledger.InsufficientHoldingsException;
import com.coinledger.domain.ledger.LedgerDomainException;
import com.coinledger.domain.ledger.LedgerErrorCode;
import java.net.URI;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
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
    problem.setProperty("code", LedgerErrorCode.INVALID_INPUT);
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
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Malformed request body");
    problem.setType(URI.create(TYPE_PREFIX + "malformed-body"));
    problem.setTitle("Malformed Body");
    problem.setProperty("code", LedgerErrorCode.INVALID_INPUT);
    return problem;
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ProblemDetail handleMissingParam(MissingServletRequestParameterException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "missing-parameter"));
    problem.setTitle("Missing Parameter");
    return problem;
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    String detail =
        String.format(
            "Parameter '%s' should be of type '%s'",
            ex.getName(),
            ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown");
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
    problem.setType(URI.create(TYPE_PREFIX + "type-mismatch"));
    problem.setTitle("Type Mismatch");
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
  public ProblemDetail handleNoResource(NoResourceFoundException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "not-found"));
    problem.setTitle("Not Found");
    return problem;
  }

  @ExceptionHandler(LedgerDomainException.class)
  public ProblemDetail handleLedgerDomain(LedgerDomainException ex) {
    LedgerErrorCode code = ex.code();
    HttpStatus status = statusOf(code);
    if (code == LedgerErrorCode.CONFLICT) {
      log.warn("Ledger conflict: {}", ex.getMessage());
    }
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    String slug = code.name().toLowerCase(Locale.ROOT).replace('_', '-');
    problem.setType(URI.create(TYPE_PREFIX + slug));
    problem.setTitle(titleOf(code));
    problem.setProperty("code", code);
    if (ex instanceof AccountNotFoundException accountNotFound) {
      problem.setProperty("knownAccounts", accountNotFound.knownAccounts());
    }
    if (ex instanceof InsufficientHoldingsException insufficient) {
      problem.setProperty("asset", insufficient.asset());
      problem.setProperty("requested", insufficient.requested());
      problem.setProperty("available", insufficient.available());
    }
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

  static HttpStatus statusOf(LedgerErrorCode code) {
    return switch (code) {
      case NOT_FOUND -> HttpStatus.NOT_FOUND;
      case ALREADY_EXISTS, INSUFFICIENT_HOLDINGS, CONFLICT -> HttpStatus.CONFLICT;
      case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
      case ARITHMETIC_ERROR, RATE_UNAVAILABLE -> HttpStatus.UNPROCESSABLE_ENTITY;
    };
  }

  private static String titleOf(LedgerErrorCode code) {
    return switch (code) {
      case NOT_FOUND -> "Not Found";
      case ALREADY_EXISTS -> "Already Exists";
      case INVALID_INPUT -> "Invalid Input";
      case INSUFFICIENT_HOLDINGS -> "Insufficient Holdings";
      case ARITHMETIC_ERROR -> "Arithmetic Error";
      case RATE_UNAVAILABLE -> "Rate Unavailable";
      case CONFLICT -> "Conflict";
    };
  }

  private record FieldError(String field, String message, String rejectedValue) {}
}
