package io.invoicemart.marketplace.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(ErrorKind kind, String title, String detail) {
    super(HttpStatus.CONFLICT, Problems.create(HttpStatus.CONFLICT, kind, title, detail), null);
  }

  public static ResourceConflictException duplicateActiveOffer() {
    return new ResourceConflictException(
        ErrorKind.DUPLICATE_ACTIVE_OFFER,
        "Duplicate active offer",
        "You already have an active offer on this invoice");
  }

  public static ResourceConflictException operationInProgress(String operation) {
    return new ResourceConflictException(
        ErrorKind.OPERATION_IN_PROGRESS,
        "Operation in progress",
        "Another " + operation + " is in progress for this invoice. Please retry.");
  }
}
