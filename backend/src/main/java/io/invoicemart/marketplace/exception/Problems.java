package io.invoicemart.marketplace.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

final class Problems {

  static final String KIND = "kind";

  private Problems() {}

  static ProblemDetail create(HttpStatus status, ErrorKind kind, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty(KIND, kind.name());
    return problem;
  }
}
