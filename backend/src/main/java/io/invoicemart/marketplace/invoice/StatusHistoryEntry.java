package io.invoicemart.marketplace.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import java.time.Instant;
import java.util.UUID;

/** One immutable entry of an invoice's audit trail. */
@Embeddable
public class StatusHistoryEntry {

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvoiceStatus status;

  @Column(name = "changed_at", nullable = false, updatable = false)
  private Instant changedAt;

  @Column(name = "changed_by", nullable = false, updatable = false)
  private UUID changedBy;

  @Column(name = "notes", length = 1000, updatable = false)
  private String notes;

  protected StatusHistoryEntry() {}

  StatusHistoryEntry(InvoiceStatus status, Instant changedAt, UUID changedBy, String notes) {
    this.status = status;
    this.changedAt = changedAt;
    this.changedBy = changedBy;
    this.notes = notes;
  }

  public InvoiceStatus getStatus() {
    return status;
  }

  public Instant getChangedAt() {
    return changedAt;
  }

  public UUID getChangedBy() {
    return changedBy;
  }

  public String getNotes() {
    return notes;
  }
}
