package io.invoicemart.marketplace.exception;

import java.math.BigDecimal;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * An offer violates a constraint derived from the invoice's marketplace funding terms. The problem
 * body carries the applicable {@code limit} and the caller's {@code requested} value so a client
 * can explain the rejection.
 */
public class BiddingConstraintException extends ErrorResponseException {

  private final ErrorKind kind;

  private BiddingConstraintException(HttpStatus status, ErrorKind kind, ProblemDetail problem) {
    super(status, problem, null);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public static BiddingConstraintException invoiceNotAvailable(UUID invoiceId, String status) {
    var problem =
        Problems.create(
            HttpStatus.CONFLICT,
            ErrorKind.INVOICE_NOT_AVAILABLE,
            "Invoice not available",
            "Invoice " + invoiceId + " is not available for funding (status " + status + ")");
    problem.setProperty("status", status);
    return new BiddingConstraintException(
        HttpStatus.CONFLICT, ErrorKind.INVOICE_NOT_AVAILABLE, problem);
  }

  public static BiddingConstraintException fundingTermsNotSet(UUID invoiceId) {
    var problem =
        Problems.create(
            HttpStatus.UNPROCESSABLE_ENTITY,
            ErrorKind.FUNDING_TERMS_NOT_SET,
            "Funding terms not set",
            "Invoice " + invoiceId + " has no marketplace funding terms; it cannot receive offers");
    return new BiddingConstraintException(
        HttpStatus.UNPROCESSABLE_ENTITY, ErrorKind.FUNDING_TERMS_NOT_SET, problem);
  }

  public static BiddingConstraintException interestRateMismatch(
      BigDecimal required, BigDecimal requested) {
    var problem =
        Problems.create(
            HttpStatus.UNPROCESSABLE_ENTITY,
            ErrorKind.INTEREST_RATE_MISMATCH,
            "Interest rate mismatch",
            "Interest rate must be "
                + required.toPlainString()
                + "% as set for this invoice; requested "
                + requested.toPlainString()
                + "%");
    problem.setProperty("limit", required);
    problem.setProperty("requested", requested);
    return new BiddingConstraintException(
        HttpStatus.UNPROCESSABLE_ENTITY, ErrorKind.INTEREST_RATE_MISMATCH, problem);
  }

  public static BiddingConstraintException tenureExceedsLimit(
      int maxTenure, int requested, long daysUntilDue) {
    var problem =
        Problems.create(
            HttpStatus.UNPROCESSABLE_ENTITY,
            ErrorKind.TENURE_EXCEEDS_LIMIT,
            "Tenure exceeds limit",
            "Tenure of "
                + requested
                + " days exceeds the maximum of "
                + maxTenure
                + " days for this invoice");
    problem.setProperty("limit", maxTenure);
    problem.setProperty("requested", requested);
    problem.setProperty("daysUntilDue", daysUntilDue);
    return new BiddingConstraintException(
        HttpStatus.UNPROCESSABLE_ENTITY, ErrorKind.TENURE_EXCEEDS_LIMIT, problem);
  }

  public static BiddingConstraintException fundingAmountExceedsLimit(
      BigDecimal maxFundingAmount, BigDecimal requested, int maxAllowedPercentage) {
    var problem =
        Problems.create(
            HttpStatus.UNPROCESSABLE_ENTITY,
            ErrorKind.FUNDING_AMOUNT_EXCEEDS_LIMIT,
            "Funding amount exceeds limit",
            "Requested funding of "
                + requested.toPlainString()
                + " exceeds the maximum of "
                + maxFundingAmount.toPlainString()
                + " ("
                + maxAllowedPercentage
                + "% of the invoice)");
    problem.setProperty("limit", maxFundingAmount);
    problem.setProperty("requested", requested);
    problem.setProperty("maxAllowedPercentage", maxAllowedPercentage);
    return new BiddingConstraintException(
        HttpStatus.UNPROCESSABLE_ENTITY, ErrorKind.FUNDING_AMOUNT_EXCEEDS_LIMIT, problem);
  }
}
