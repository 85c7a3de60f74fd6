package io.invoicemart.marketplace.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** A lifecycle transition was requested while the entity's guard does not allow it. */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(
        HttpStatus.CONFLICT,
        Problems.create(HttpStatus.CONFLICT, ErrorKind.INVALID_STATE_TRANSITION, title, detail),
        null);
  }
}
