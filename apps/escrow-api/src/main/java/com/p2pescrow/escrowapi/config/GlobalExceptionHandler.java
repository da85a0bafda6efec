package com.p2pescrow.escrowapi.config;

import com.p2pescrow.domain.balance.BalanceDomainException;
import com.p2pescrow.domain.balance.InsufficientBalanceException;
import com.p2pescrow.domain.escrow.EscrowDomainException;
import com.p2pescrow.domain.escrow.EscrowErrorCode;
import com.p2pescrow.escrowapi.ledger.LedgerTransferException;
import java.net.URI;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.AuthenticationException;
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

  @ExceptionHandler(EscrowDomainException.class)
  public ProblemDetail handleEscrowDomain(EscrowDomainException ex) {
    EscrowErrorCode code = ex.code();
    HttpStatus status =
        switch (code.category()) {
          case VALIDATION -> HttpStatus.BAD_REQUEST;
          case AUTHORIZATION -> HttpStatus.FORBIDDEN;
          case NOT_FOUND -> HttpStatus.NOT_FOUND;
          case STATE, RESOURCE, TIMING -> HttpStatus.CONFLICT;
          case EXTERNAL -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + slug(code)));
    problem.setTitle("Escrow Error");
    problem.setProperty("code", code.name());
    problem.setProperty("category", code.category().name());
    return problem;
  }

  @ExceptionHandler(InsufficientBalanceException.class)
  public ProblemDetail handleInsufficientBalance(InsufficientBalanceException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + slug(EscrowErrorCode.INSUFFICIENT_BALANCE)));
    problem.setTitle("Balance Error");
    problem.setProperty("code", EscrowErrorCode.INSUFFICIENT_BALANCE.name());
    problem.setProperty("requested", ex.requested());
    problem.setProperty("available", ex.available());
    return problem;
  }

  /** Any other balance failure means bookkeeping drifted; requests are validated upstream. */
  @ExceptionHandler(BalanceDomainException.class)
  public ProblemDetail handleBalanceInvariant(BalanceDomainException ex) {
    return handleUnexpected(ex);
  }

  @ExceptionHandler(LedgerTransferException.class)
  public ProblemDetail handleLedgerTransfer(LedgerTransferException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + slug(EscrowErrorCode.TRANSFER_FAILED)));
    problem.setTitle("Settlement Transfer Failed");
    problem.setProperty("code", EscrowErrorCode.TRANSFER_FAILED.name());
    problem.setProperty("reason", ex.reason().name());
    return problem;
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request validation failed");
    problem.setType(URI.create(TYPE_PREFIX + "validation-error"));
    problem.setTitle("Validation Error");
    problem.setProperty("code", EscrowErrorCode.INVALID_INPUT.name());
    problem.setProperty(
        "errors",
        ex.getFieldErrors().stream()
            .map(fe -> new FieldError(fe.getField(), fe.getDefaultMessage()))
            .toList());
    return problem;
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Malformed request body");
    problem.setType(URI.create(TYPE_PREFIX + "malformed-body"));
    problem.setTitle("Malformed Request");
    problem.setProperty("code", EscrowErrorCode.INVALID_INPUT.name());
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
  public ProblemDetail handleNotFound(NoResourceFoundException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
    problem.setType(URI.create(TYPE_PREFIX + "not-found"));
    problem.setTitle("Not Found");
    return problem;
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ProblemDetail handleAccessDenied(AccessDeniedException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.FORBIDDEN, "You do not have permission to access this resource");
    problem.setType(URI.create(TYPE_PREFIX + "access-denied"));
    problem.setTitle("Access Denied");
    return problem;
  }

  @ExceptionHandler({
    AuthenticationException.class,
    AuthenticationCredentialsNotFoundException.class
  })
  public ProblemDetail handleAuthentication(Exception ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.UNAUTHORIZED, "Authentication is required to access this resource");
    problem.setType(URI.create(TYPE_PREFIX + "unauthorized"));
    problem.setTitle("Unauthorized");
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

  private static String slug(EscrowErrorCode code) {
    return code.name().toLowerCase(Locale.ROOT).replace('_', '-');
  }

  private record FieldError(String field, String message) {}
}
