package io.invoicemart.marketplace.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** Request content failed a domain validation rule (dates, amounts, file types). */
public class InvalidRequestException extends ErrorResponseException {

  public InvalidRequestException(String title, String detail) {
    super(
        HttpStatus.BAD_REQUEST,
        Problems.create(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_REQUEST, title, detail),
        null);
  }
}
