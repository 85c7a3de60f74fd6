package io.invoicemart.marketplace.offer;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OfferRepository extends JpaRepository<Offer, UUID> {

  List<Offer> findByInvoiceIdAndLenderIdAndStatus(
      UUID invoiceId, UUID lenderId, OfferStatus status);

  List<Offer> findByInvoiceIdAndStatus(UUID invoiceId, OfferStatus status);

  Page<Offer> findByInvoiceId(UUID invoiceId, Pageable pageable);

  Page<Offer> findByInvoiceIdAndStatus(UUID invoiceId, OfferStatus status, Pageable pageable);

  long countByInvoiceIdAndStatus(UUID invoiceId, OfferStatus status);

  /** Drives the expiry sweep over the (status, expires_at) index. */
  List<Offer> findByStatusAndExpiresAtBefore(OfferStatus status, Instant now, Pageable pageable);

  @Query(
      """
      SELECT o FROM Offer o
      WHERE o.lenderId = :lenderId
        AND (:status IS NULL OR o.status = :status)
      """)
  Page<Offer> findByLender(
      @Param("lenderId") UUID lenderId,
      @Param("status") OfferStatus status,
      Pageable pageable);

  List<Offer> findByLenderId(UUID lenderId);

  @Query(
      """
      SELECT o.invoiceId, COUNT(o), MIN(o.interestRate) FROM Offer o
      WHERE o.invoiceId IN :invoiceIds
        AND o.status = io.invoicemart.marketplace.offer.OfferStatus.PENDING
        AND o.expiresAt > :now
      GROUP BY o.invoiceId
      """)
  List<Object[]> summarizeActiveOffers(
      @Param("invoiceIds") Collection<UUID> invoiceIds, @Param("now") Instant now);

  @Query(
      """
      SELECT DISTINCT o.invoiceId FROM Offer o
      WHERE o.invoiceId IN :invoiceIds
        AND o.lenderId = :lenderId
        AND o.status = io.invoicemart.marketplace.offer.OfferStatus.PENDING
        AND o.expiresAt > :now
      """)
  List<UUID> findInvoicesWithActiveOfferFrom(
      @Param("invoiceIds") Collection<UUID> invoiceIds,
      @Param("lenderId") UUID lenderId,
      @Param("now") Instant now);

  /**
   * Rejects every still-pending offer on the invoice other than {@code acceptedOfferId} in one
   * statement. Pending entities are flushed first so the statement sees the acceptance.
   */
  @Modifying(flushAutomatically = true)
  @Query(
      """
      UPDATE Offer o
      SET o.status = io.invoicemart.marketplace.offer.OfferStatus.REJECTED,
          o.rejectedAt = :now,
          o.rejectionReason = :reason,
          o.updatedAt = :now,
          o.version = o.version + 1
      WHERE o.invoiceId = :invoiceId
        AND o.status = io.invoicemart.marketplace.offer.OfferStatus.PENDING
        AND o.id <> :acceptedOfferId
      """)
  int rejectPendingSiblings(
      @Param("invoiceId") UUID invoiceId,
      @Param("acceptedOfferId") UUID acceptedOfferId,
      @Param("reason") String reason,
      @Param("now") Instant now);
}
