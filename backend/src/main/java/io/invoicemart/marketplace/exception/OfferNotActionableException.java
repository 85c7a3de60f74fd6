package io.invoicemart.marketplace.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** Accept, reject or withdraw was attempted on an offer that is no longer pending or is expired. */
public class OfferNotActionableException extends ErrorResponseException {

  public OfferNotActionableException(UUID offerId, String action, String currentState) {
    super(
        HttpStatus.CONFLICT,
        Problems.create(
            HttpStatus.CONFLICT,
            ErrorKind.OFFER_NOT_ACTIONABLE,
            "Offer cannot be " + action,
            "Offer " + offerId + " cannot be " + action + " in state " + currentState),
        null);
    getBody().setProperty("offerId", offerId);
    getBody().setProperty("state", currentState);
  }
}
