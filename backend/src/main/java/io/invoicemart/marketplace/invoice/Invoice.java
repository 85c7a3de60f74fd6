package io.invoicemart.marketplace.invoice;

import io.invoicemart.marketplace.exception.InvalidRequestException;
import io.invoicemart.marketplace.exception.InvalidStateException;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A seller's financing request against an anchor's obligation.
 *
 * <p>Lifecycle: DRAFT → SUBMITTED → ANCHOR_APPROVED → ADMIN_VERIFIED → LISTED → FUNDED → REPAID
 * → SETTLED, with REJECTED reachable from SUBMITTED (anchor) and ANCHOR_APPROVED (admin). Every
 * transition is checked against {@link InvoiceStatus#canTransitionTo} before any field changes
 * and appends one entry to the status history, which is never rewritten.
 */
@Entity
@Table(name = "invoices")
public class Invoice {

  static final String DEFAULT_CURRENCY = "NGN";
  static final String DEFAULT_ANCHOR_REJECTION = "Rejected by anchor";
  static final String DEFAULT_ADMIN_REJECTION = "Rejected by admin";

  private static final BigDecimal HUNDRED = new BigDecimal("100");
  private static final BigDecimal DAYS_PER_YEAR = new BigDecimal("365");

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "invoice_number", nullable = false, length = 50)
  private String invoiceNumber;

  @Column(name = "seller_id", nullable = false)
  private UUID sellerId;

  @Column(name = "anchor_id", nullable = false)
  private UUID anchorId;

  @Column(name = "amount", precision = 14, scale = 2, nullable = false)
  private BigDecimal amount;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "issue_date", nullable = false)
  private LocalDate issueDate;

  @Column(name = "due_date", nullable = false)
  private LocalDate dueDate;

  @Column(name = "description", length = 1000)
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvoiceStatus status = InvoiceStatus.DRAFT;

  @Embedded private InvoiceDocument primaryDocument;

  @ElementCollection(fetch = FetchType.LAZY)
  @CollectionTable(
      name = "invoice_supporting_documents",
      joinColumns = @JoinColumn(name = "invoice_id"))
  @OrderColumn(name = "position")
  private List<SupportingDocument> supportingDocuments = new ArrayList<>();

  @Embedded private MarketplaceFundingTerms fundingTerms;

  @Column(name = "submitted_at")
  private Instant submittedAt;

  @Column(name = "anchor_approval_date")
  private Instant anchorApprovalDate;

  @Column(name = "anchor_approval_notes", length = 1000)
  private String anchorApprovalNotes;

  @Column(name = "anchor_rejection_date")
  private Instant anchorRejectionDate;

  @Column(name = "anchor_rejection_reason", length = 1000)
  private String anchorRejectionReason;

  @Column(name = "admin_verification_date")
  private Instant adminVerificationDate;

  @Column(name = "admin_verification_notes", length = 1000)
  private String adminVerificationNotes;

  @Column(name = "admin_rejection_date")
  private Instant adminRejectionDate;

  @Column(name = "admin_rejection_reason", length = 1000)
  private String adminRejectionReason;

  @Column(name = "verified_by")
  private UUID verifiedBy;

  @Column(name = "listed_at")
  private Instant listedAt;

  @Column(name = "funded_at")
  private Instant fundedAt;

  @Column(name = "funded_by")
  private UUID fundedBy;

  @Column(name = "accepted_offer_id")
  private UUID acceptedOfferId;

  @Column(name = "funding_amount", precision = 14, scale = 2)
  private BigDecimal fundingAmount;

  @Column(name = "interest_rate", precision = 5, scale = 2)
  private BigDecimal interestRate;

  @Column(name = "total_repayment_amount", precision = 14, scale = 2)
  private BigDecimal totalRepaymentAmount;

  @Column(name = "repaid_amount", precision = 14, scale = 2)
  private BigDecimal repaidAmount;

  @Column(name = "repayment_date")
  private Instant repaymentDate;

  @Column(name = "settlement_date")
  private Instant settlementDate;

  @ElementCollection(fetch = FetchType.LAZY)
  @CollectionTable(
      name = "invoice_status_history",
      joinColumns = @JoinColumn(name = "invoice_id"))
  @OrderColumn(name = "sequence")
  private List<StatusHistoryEntry> statusHistory = new ArrayList<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Invoice() {}

  public Invoice(
      UUID sellerId,
      UUID anchorId,
      String invoiceNumber,
      BigDecimal amount,
      String currency,
      LocalDate issueDate,
      LocalDate dueDate,
      String description,
      Instant now) {
    validateDetails(amount, issueDate, dueDate, utcDate(now));
    this.sellerId = sellerId;
    this.anchorId = anchorId;
    this.invoiceNumber = invoiceNumber;
    this.amount = amount;
    this.currency = currency != null ? currency : DEFAULT_CURRENCY;
    this.issueDate = issueDate;
    this.dueDate = dueDate;
    this.description = description;
    this.createdAt = now;
    this.updatedAt = this.createdAt;
    record(sellerId, "Invoice created");
  }

  // --- Guards ---

  public boolean canBeEdited() {
    return status.isEditable();
  }

  public boolean canBeSubmitted() {
    return status.canTransitionTo(InvoiceStatus.SUBMITTED) && primaryDocument != null;
  }

  public boolean canBeApprovedByAnchor() {
    return status.canTransitionTo(InvoiceStatus.ANCHOR_APPROVED);
  }

  public boolean canBeVerifiedByAdmin() {
    return status.canTransitionTo(InvoiceStatus.ADMIN_VERIFIED);
  }

  public boolean canBeListed() {
    return status.canTransitionTo(InvoiceStatus.LISTED);
  }

  public boolean canBeFunded() {
    return status.canTransitionTo(InvoiceStatus.FUNDED);
  }

  public boolean canBeDeleted() {
    return status == InvoiceStatus.DRAFT;
  }

  // --- Edits (DRAFT or REJECTED only) ---

  /**
   * Replaces the invoice details. Funding terms that no longer fit the new amount or due date are
   * dropped and must be set again on approval or verification.
   */
  public void updateDetails(
      UUID anchorId,
      BigDecimal amount,
      String currency,
      LocalDate issueDate,
      LocalDate dueDate,
      String description,
      Instant now) {
    requireEditable("update");
    LocalDate today = utcDate(now);
    validateDetails(amount, issueDate, dueDate, today);
    this.anchorId = anchorId;
    this.amount = amount;
    this.currency = currency != null ? currency : this.currency;
    this.issueDate = issueDate;
    this.dueDate = dueDate;
    this.description = description;
    if (fundingTerms != null && !fundingTerms.fits(amount, daysUntilDue(today))) {
      this.fundingTerms = null;
    }
    this.updatedAt = now;
  }

  /** Replaces the primary document and returns the one it replaced, if any. */
  public Optional<InvoiceDocument> attachPrimaryDocument(InvoiceDocument document, Instant now) {
    requireEditable("upload a document to");
    var previous = Optional.ofNullable(primaryDocument);
    this.primaryDocument = document;
    this.updatedAt = now;
    return previous;
  }

  public void addSupportingDocument(SupportingDocument document, int maxDocuments, Instant now) {
    requireEditable("add documents to");
    if (supportingDocuments.size() >= maxDocuments) {
      throw new InvalidRequestException(
          "Too many documents",
          "An invoice can carry at most " + maxDocuments + " supporting documents");
    }
    supportingDocuments.add(document);
    this.updatedAt = now;
  }

  public Optional<SupportingDocument> removeSupportingDocument(UUID documentId, Instant now) {
    requireEditable("remove documents from");
    var removed =
        supportingDocuments.stream()
            .filter(d -> d.getDocumentId().equals(documentId))
            .findFirst();
    removed.ifPresent(
        d -> {
          supportingDocuments.remove(d);
          this.updatedAt = now;
        });
    return removed;
  }

  // --- Transitions ---

  public void submit(UUID sellerId, Instant now) {
    if (!canBeSubmitted()) {
      throw new InvalidStateException(
          "Invalid invoice status",
          primaryDocument == null && status.isEditable()
              ? "Invoice must have a primary document before it can be submitted"
              : "Cannot submit invoice in status " + status + ". Must be DRAFT or REJECTED.");
    }
    transitionTo(InvoiceStatus.SUBMITTED, sellerId, null, now);
    this.submittedAt = updatedAt;
  }

  /**
   * Anchor approval. Terms passed along are validated against this invoice and become its
   * marketplace funding terms.
   */
  public void approveByAnchor(
      UUID anchorId, String notes, MarketplaceFundingTerms terms, Instant now) {
    requireTransition(InvoiceStatus.ANCHOR_APPROVED, "approve");
    if (terms != null) {
      terms.validateFor(amount, daysUntilDue(utcDate(now)));
    }
    transitionTo(InvoiceStatus.ANCHOR_APPROVED, anchorId, notes, now);
    this.anchorApprovalDate = updatedAt;
    this.anchorApprovalNotes = notes;
    this.anchorRejectionReason = null;
    if (terms != null) {
      this.fundingTerms = terms;
    }
  }

  public void rejectByAnchor(UUID anchorId, String reason, Instant now) {
    if (!canBeApprovedByAnchor()) {
      throw invalidTransition("reject", "SUBMITTED");
    }
    String effectiveReason = orDefault(reason, DEFAULT_ANCHOR_REJECTION);
    transitionTo(InvoiceStatus.REJECTED, anchorId, effectiveReason, now);
    this.anchorRejectionDate = updatedAt;
    this.anchorRejectionReason = effectiveReason;
    this.anchorApprovalNotes = null;
  }

  /** Admin verification. Terms passed here override any set by the anchor. */
  public void verifyByAdmin(
      UUID adminId, String notes, MarketplaceFundingTerms terms, Instant now) {
    requireTransition(InvoiceStatus.ADMIN_VERIFIED, "verify");
    if (terms != null) {
      terms.validateFor(amount, daysUntilDue(utcDate(now)));
    }
    transitionTo(InvoiceStatus.ADMIN_VERIFIED, adminId, notes, now);
    this.adminVerificationDate = updatedAt;
    this.adminVerificationNotes = notes;
    this.adminRejectionReason = null;
    this.verifiedBy = adminId;
    if (terms != null) {
      this.fundingTerms = terms;
    }
  }

  public void rejectByAdmin(UUID adminId, String reason, Instant now) {
    if (!canBeVerifiedByAdmin()) {
      throw invalidTransition("reject", "ANCHOR_APPROVED");
    }
    String effectiveReason = orDefault(reason, DEFAULT_ADMIN_REJECTION);
    transitionTo(InvoiceStatus.REJECTED, adminId, effectiveReason, now);
    this.adminRejectionDate = updatedAt;
    this.adminRejectionReason = effectiveReason;
    this.adminVerificationNotes = null;
    this.verifiedBy = adminId;
  }

  /** Opens the invoice for bidding, which needs complete terms that still fit the invoice. */
  public void list(UUID adminId, Instant now) {
    requireTransition(InvoiceStatus.LISTED, "list");
    if (fundingTerms == null || !fundingTerms.isComplete()) {
      throw new InvalidStateException(
          "Funding terms not set",
          "Invoice " + id + " needs a maximum funding amount and interest rate to be listed");
    }
    if (!fundingTerms.fits(amount, daysUntilDue(utcDate(now)))) {
      throw new InvalidStateException(
          "Funding terms out of date",
          "Funding terms of invoice " + id + " no longer fit its amount or due date");
    }
    transitionTo(InvoiceStatus.LISTED, adminId, "Listed on marketplace", now);
    this.listedAt = updatedAt;
  }

  /**
   * Funds the invoice from an accepted offer. Repayment is simple daily interest from funding until
   * the due date.
   */
  public void fund(
      UUID lenderId,
      UUID offerId,
      BigDecimal fundingAmount,
      BigDecimal interestRate,
      Instant now) {
    requireTransition(InvoiceStatus.FUNDED, "fund");
    transitionTo(InvoiceStatus.FUNDED, lenderId, "Funded by accepted offer " + offerId, now);
    this.fundedAt = updatedAt;
    this.fundedBy = lenderId;
    this.acceptedOfferId = offerId;
    this.fundingAmount = fundingAmount;
    this.interestRate = interestRate;
    long daysHeld = Math.max(0, daysUntilDue(utcDate(now)));
    this.totalRepaymentAmount = totalRepayment(fundingAmount, interestRate, daysHeld);
  }

  public void markRepaid(UUID adminId, BigDecimal repaidAmount, Instant now) {
    requireTransition(InvoiceStatus.REPAID, "mark repaid");
    transitionTo(InvoiceStatus.REPAID, adminId, null, now);
    this.repaymentDate = updatedAt;
    this.repaidAmount = repaidAmount != null ? repaidAmount : totalRepaymentAmount;
  }

  public void markSettled(UUID adminId, Instant now) {
    requireTransition(InvoiceStatus.SETTLED, "settle");
    transitionTo(InvoiceStatus.SETTLED, adminId, null, now);
    this.settlementDate = updatedAt;
  }

  // --- Derived ---

  public long daysUntilDue(LocalDate today) {
    return ChronoUnit.DAYS.between(today, dueDate);
  }

  public boolean isOverdue(LocalDate today) {
    return today.isAfter(dueDate)
        && status != InvoiceStatus.REPAID
        && status != InvoiceStatus.SETTLED;
  }

  /** Share of the face amount advanced by the funding lender, or null before funding. */
  public BigDecimal fundingPercentage() {
    if (fundingAmount == null || amount.signum() == 0) {
      return null;
    }
    return fundingAmount.multiply(HUNDRED).divide(amount, 2, RoundingMode.HALF_UP);
  }

  public BigDecimal repaymentProgress() {
    if (repaidAmount == null
        || totalRepaymentAmount == null
        || totalRepaymentAmount.signum() == 0) {
      return BigDecimal.ZERO;
    }
    return repaidAmount.multiply(HUNDRED).divide(totalRepaymentAmount, 2, RoundingMode.HALF_UP);
  }

  static BigDecimal totalRepayment(BigDecimal principal, BigDecimal annualRate, long days) {
    BigDecimal interest =
        principal
            .multiply(annualRate)
            .multiply(BigDecimal.valueOf(days))
            .divide(DAYS_PER_YEAR.multiply(HUNDRED), 2, RoundingMode.HALF_UP);
    return principal.add(interest).setScale(2, RoundingMode.HALF_UP);
  }

  private static String orDefault(String reason, String fallback) {
    return reason != null && !reason.isBlank() ? reason : fallback;
  }

  private void requireEditable(String action) {
    if (!canBeEdited()) {
      throw new InvalidStateException(
          "Invalid invoice status",
          "Cannot " + action + " invoice in status " + status + ". Must be DRAFT or REJECTED.");
    }
  }

  private void requireTransition(InvoiceStatus target, String action) {
    if (!status.canTransitionTo(target)) {
      throw invalidTransition(action, expectedSourceFor(target));
    }
  }

  private InvalidStateException invalidTransition(String action, String expected) {
    return new InvalidStateException(
        "Invalid invoice status",
        "Cannot " + action + " invoice in status " + status + ". Must be " + expected + ".");
  }

  private static String expectedSourceFor(InvoiceStatus target) {
    var sources = new ArrayList<String>();
    for (InvoiceStatus candidate : InvoiceStatus.values()) {
      if (candidate.canTransitionTo(target)) {
        sources.add(candidate.name());
      }
    }
    return String.join(" or ", sources);
  }

  private void transitionTo(InvoiceStatus target, UUID actor, String notes, Instant now) {
    this.status = target;
    this.updatedAt = now;
    record(actor, notes);
  }

  private static LocalDate utcDate(Instant instant) {
    return LocalDate.ofInstant(instant, ZoneOffset.UTC);
  }

  private void record(UUID actor, String notes) {
    statusHistory.add(new StatusHistoryEntry(status, updatedAt, actor, notes));
  }

  private static void validateDetails(
      BigDecimal amount, LocalDate issueDate, LocalDate dueDate, LocalDate today) {
    if (amount == null || amount.signum() <= 0) {
      throw new InvalidRequestException("Invalid amount", "Invoice amount must be positive");
    }
    if (issueDate.isAfter(today)) {
      throw new InvalidRequestException("Invalid issue date", "Issue date cannot be in the future");
    }
    if (!dueDate.isAfter(issueDate)) {
      throw new InvalidRequestException("Invalid due date", "Due date must be after issue date");
    }
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public long getVersion() {
    return version;
  }

  public String getInvoiceNumber() {
    return invoiceNumber;
  }

  public UUID getSellerId() {
    return sellerId;
  }

  public UUID getAnchorId() {
    return anchorId;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public String getCurrency() {
    return currency;
  }

  public LocalDate getIssueDate() {
    return issueDate;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public String getDescription() {
    return description;
  }

  public InvoiceStatus getStatus() {
    return status;
  }

  public InvoiceDocument getPrimaryDocument() {
    return primaryDocument;
  }

  public List<SupportingDocument> getSupportingDocuments() {
    return Collections.unmodifiableList(supportingDocuments);
  }

  public MarketplaceFundingTerms getFundingTerms() {
    return fundingTerms;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public Instant getAnchorApprovalDate() {
    return anchorApprovalDate;
  }

  public String getAnchorApprovalNotes() {
    return anchorApprovalNotes;
  }

  public Instant getAnchorRejectionDate() {
    return anchorRejectionDate;
  }

  public String getAnchorRejectionReason() {
    return anchorRejectionReason;
  }

  public Instant getAdminVerificationDate() {
    return adminVerificationDate;
  }

  public String getAdminVerificationNotes() {
    return adminVerificationNotes;
  }

  public Instant getAdminRejectionDate() {
    return adminRejectionDate;
  }

  public String getAdminRejectionReason() {
    return adminRejectionReason;
  }

  public UUID getVerifiedBy() {
    return verifiedBy;
  }

  public Instant getListedAt() {
    return listedAt;
  }

  public Instant getFundedAt() {
    return fundedAt;
  }

  public UUID getFundedBy() {
    return fundedBy;
  }

  public UUID getAcceptedOfferId() {
    return acceptedOfferId;
  }

  public BigDecimal getFundingAmount() {
    return fundingAmount;
  }

  public BigDecimal getInterestRate() {
    return interestRate;
  }

  public BigDecimal getTotalRepaymentAmount() {
    return totalRepaymentAmount;
  }

  public BigDecimal getRepaidAmount() {
    return repaidAmount;
  }

  public Instant getRepaymentDate() {
    return repaymentDate;
  }

  public Instant getSettlementDate() {
    return settlementDate;
  }

  public List<StatusHistoryEntry> getStatusHistory() {
    return Collections.unmodifiableList(statusHistory);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
