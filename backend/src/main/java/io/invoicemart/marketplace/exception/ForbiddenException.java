package io.invoicemart.marketplace.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class ForbiddenException extends ErrorResponseException {

  public ForbiddenException(String title, String detail) {
    super(
        HttpStatus.FORBIDDEN,
        Problems.create(HttpStatus.FORBIDDEN, ErrorKind.NOT_AUTHORIZED, title, detail),
        null);
  }
}
