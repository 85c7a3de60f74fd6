package io.invoicemart.marketplace.exception;

import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  static final String ACTIVE_OFFER_INDEX = "uq_offers_active_lender";
  static final String ACCEPTED_OFFER_INDEX = "uq_offers_accepted_invoice";

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(
      ForbiddenException ex, HttpServletRequest request) {
    log.warn(
        "Forbidden: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    var problem =
        Problems.create(
            HttpStatus.CONFLICT,
            ErrorKind.CONCURRENT_MODIFICATION,
            "Concurrent modification",
            "Resource was modified concurrently. Please retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleIntegrityViolation(
      DataIntegrityViolationException ex) {
    String message = ex.getMostSpecificCause().getMessage();
    if (message != null && message.contains(ACTIVE_OFFER_INDEX)) {
      log.info("Duplicate active offer rejected by unique index");
      return ResponseEntity.status(HttpStatus.CONFLICT)
          .body(ResourceConflictException.duplicateActiveOffer().getBody());
    }
    if (message != null && message.contains(ACCEPTED_OFFER_INDEX)) {
      log.warn("Second acceptance rejected by unique index");
      var problem =
          Problems.create(
              HttpStatus.CONFLICT,
              ErrorKind.OFFER_NOT_ACTIONABLE,
              "Offer cannot be accepted",
              "Another offer on this invoice has already been accepted");
      return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }
    log.error("Data integrity violation: {}", message);
    var problem =
        Problems.create(
            HttpStatus.CONFLICT,
            ErrorKind.CONCURRENT_MODIFICATION,
            "Data conflict",
            "The request conflicts with the current state of the resource");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  @Override
  protected ResponseEntity<Object> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    var fieldErrors = new LinkedHashMap<String, String>();
    ex.getBindingResult()
        .getFieldErrors()
        .forEach(error -> fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));
    var problem =
        Problems.create(
            HttpStatus.BAD_REQUEST,
            ErrorKind.INVALID_REQUEST,
            "Validation failed",
            "Request has " + ex.getErrorCount() + " invalid field(s)");
    problem.setProperty("errors", fieldErrors);
    return ResponseEntity.badRequest().headers(headers).body(problem);
  }
}
