package io.invoicemart.marketplace.document;

import java.util.Locale;

/** Lifecycle stage that governs who may see an invoice's stored documents. */
public enum DocumentStage {
  DRAFT,
  SUBMITTED,
  APPROVED,
  VERIFIED,
  LISTED,
  FUNDED;

  public String tagValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
