package io.invoicemart.marketplace.offer;

import io.invoicemart.marketplace.exception.OfferNotActionableException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A lender's bid against one listed invoice.
 *
 * <p>An offer past {@code expiresAt} is inert: every guard treats it as expired whether or not the
 * sweep has marked it EXPIRED yet. The {@code @Version} column makes each terminal transition a
 * conditional update that fails if the offer changed since it was read.
 */
@Entity
@Table(name = "offers")
public class Offer {

  private static final BigDecimal DAYS_PER_YEAR = new BigDecimal("365");

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "invoice_id", nullable = false, updatable = false)
  private UUID invoiceId;

  @Column(name = "seller_id", nullable = false, updatable = false)
  private UUID sellerId;

  @Column(name = "lender_id", nullable = false, updatable = false)
  private UUID lenderId;

  @Column(name = "amount", precision = 14, scale = 2, nullable = false)
  private BigDecimal amount;

  @Column(name = "interest_rate", precision = 5, scale = 2, nullable = false)
  private BigDecimal interestRate;

  @Column(name = "funding_percentage", precision = 5, scale = 2, nullable = false)
  private BigDecimal fundingPercentage;

  @Column(name = "tenure", nullable = false)
  private int tenure;

  @Column(name = "daily_interest_rate", precision = 14, scale = 10, nullable = false)
  private BigDecimal dailyInterestRate;

  @Column(name = "total_interest_amount", precision = 14, scale = 2, nullable = false)
  private BigDecimal totalInterestAmount;

  @Column(name = "total_repayment_amount", precision = 14, scale = 2, nullable = false)
  private BigDecimal totalRepaymentAmount;

  @Column(name = "terms", length = 2000)
  private String terms;

  @Column(name = "lender_notes", length = 1000)
  private String lenderNotes;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private OfferStatus status = OfferStatus.PENDING;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "accepted_at")
  private Instant acceptedAt;

  @Column(name = "acceptance_notes", length = 500)
  private String acceptanceNotes;

  @Column(name = "rejected_at")
  private Instant rejectedAt;

  @Column(name = "rejection_reason", length = 500)
  private String rejectionReason;

  @Column(name = "withdrawn_at")
  private Instant withdrawnAt;

  @Column(name = "withdrawal_reason", length = 500)
  private String withdrawalReason;

  @Column(name = "expired_at")
  private Instant expiredAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Offer() {}

  public Offer(
      UUID invoiceId,
      UUID sellerId,
      UUID lenderId,
      BidQuote quote,
      String terms,
      String lenderNotes,
      Instant expiresAt,
      Instant now) {
    this.invoiceId = invoiceId;
    this.sellerId = sellerId;
    this.lenderId = lenderId;
    this.amount = quote.fundingAmount();
    this.interestRate = quote.interestRate();
    this.fundingPercentage = quote.fundingPercentage();
    this.tenure = quote.tenure();
    this.dailyInterestRate = quote.dailyInterestRate();
    this.totalInterestAmount = quote.totalInterestAmount();
    this.totalRepaymentAmount = quote.totalRepaymentAmount();
    this.terms = terms;
    this.lenderNotes = lenderNotes;
    this.expiresAt = expiresAt;
    this.createdAt = now;
    this.updatedAt = now;
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt);
  }

  /** Pending and not past expiry. */
  public boolean isActive(Instant now) {
    return status == OfferStatus.PENDING && !isExpired(now);
  }

  public boolean canBeAccepted(Instant now) {
    return isActive(now);
  }

  public boolean canBeRejected(Instant now) {
    return isActive(now);
  }

  public boolean canBeWithdrawn(Instant now) {
    return isActive(now);
  }

  public void accept(String notes, Instant now) {
    requireActionable(canBeAccepted(now), "accepted", now);
    this.status = OfferStatus.ACCEPTED;
    this.acceptedAt = now;
    this.acceptanceNotes = notes;
    this.updatedAt = now;
  }

  public void reject(String reason, Instant now) {
    requireActionable(canBeRejected(now), "rejected", now);
    this.status = OfferStatus.REJECTED;
    this.rejectedAt = now;
    this.rejectionReason = reason;
    this.updatedAt = now;
  }

  public void withdraw(String reason, Instant now) {
    requireActionable(canBeWithdrawn(now), "withdrawn", now);
    this.status = OfferStatus.WITHDRAWN;
    this.withdrawnAt = now;
    this.withdrawalReason = reason;
    this.updatedAt = now;
  }

  /** Physically records an expiry that guards already honour. */
  public void markExpired(Instant now) {
    if (status != OfferStatus.PENDING || !isExpired(now)) {
      throw new OfferNotActionableException(id, "expired", describeState(now));
    }
    this.status = OfferStatus.EXPIRED;
    this.expiredAt = now;
    this.updatedAt = now;
  }

  /** Whole minutes left before expiry; zero once expired or no longer pending. */
  public long timeUntilExpiryMinutes(Instant now) {
    if (!isActive(now)) {
      return 0;
    }
    return Duration.between(now, expiresAt).toMinutes();
  }

  /** interestRate × 365 / tenure. */
  public BigDecimal effectiveAnnualRate() {
    return interestRate
        .multiply(DAYS_PER_YEAR)
        .divide(BigDecimal.valueOf(tenure), 4, RoundingMode.HALF_UP);
  }

  public String describeState(Instant now) {
    if (status == OfferStatus.PENDING && isExpired(now)) {
      return "PENDING (expired at " + expiresAt + ")";
    }
    return status.name();
  }

  private void requireActionable(boolean allowed, String action, Instant now) {
    if (!allowed) {
      throw new OfferNotActionableException(id, action, describeState(now));
    }
  }

  public UUID getId() {
    return id;
  }

  public long getVersion() {
    return version;
  }

  public UUID getInvoiceId() {
    return invoiceId;
  }

  public UUID getSellerId() {
    return sellerId;
  }

  public UUID getLenderId() {
    return lenderId;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public BigDecimal getInterestRate() {
    return interestRate;
  }

  public BigDecimal getFundingPercentage() {
    return fundingPercentage;
  }

  public int getTenure() {
    return tenure;
  }

  public BigDecimal getDailyInterestRate() {
    return dailyInterestRate;
  }

  public BigDecimal getTotalInterestAmount() {
    return totalInterestAmount;
  }

  public BigDecimal getTotalRepaymentAmount() {
    return totalRepaymentAmount;
  }

  public String getTerms() {
    return terms;
  }

  public String getLenderNotes() {
    return lenderNotes;
  }

  public OfferStatus getStatus() {
    return status;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getAcceptedAt() {
    return acceptedAt;
  }

  public String getAcceptanceNotes() {
    return acceptanceNotes;
  }

  public Instant getRejectedAt() {
    return rejectedAt;
  }

  public String getRejectionReason() {
    return rejectionReason;
  }

  public Instant getWithdrawnAt() {
    return withdrawnAt;
  }

  public String getWithdrawalReason() {
    return withdrawalReason;
  }

  public Instant getExpiredAt() {
    return expiredAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
