package io.invoicemart.marketplace.invoice;

import jakarta.persistence.LockModeType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

  /** Shared row lock: concurrent bids proceed together but wait for an in-flight acceptance. */
  @Lock(LockModeType.PESSIMISTIC_READ)
  @Query("SELECT i FROM Invoice i WHERE i.id = :id")
  Optional<Invoice> findByIdForShare(@Param("id") UUID id);

  /** Exclusive row lock held for the whole acceptance cascade. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT i FROM Invoice i WHERE i.id = :id")
  Optional<Invoice> findByIdForUpdate(@Param("id") UUID id);

  boolean existsBySellerIdAndInvoiceNumber(UUID sellerId, String invoiceNumber);

  @Query(
      """
      SELECT i FROM Invoice i
      WHERE i.sellerId = :sellerId
        AND (:status IS NULL OR i.status = :status)
      """)
  Page<Invoice> findBySeller(
      @Param("sellerId") UUID sellerId,
      @Param("status") InvoiceStatus status,
      Pageable pageable);

  Page<Invoice> findByAnchorIdAndStatus(UUID anchorId, InvoiceStatus status, Pageable pageable);

  Page<Invoice> findByStatus(InvoiceStatus status, Pageable pageable);

  /** Marketplace browse: listed invoices not yet due, narrowed by optional filters. */
  @Query(
      """
      SELECT i FROM Invoice i
      WHERE i.status = io.invoicemart.marketplace.invoice.InvoiceStatus.LISTED
        AND i.dueDate > :today
        AND (:minAmount IS NULL OR i.amount >= :minAmount)
        AND (:maxAmount IS NULL OR i.amount <= :maxAmount)
        AND (:dueFrom IS NULL OR i.dueDate >= :dueFrom)
        AND (:dueTo IS NULL OR i.dueDate <= :dueTo)
        AND (:anchorId IS NULL OR i.anchorId = :anchorId)
        AND (:currency IS NULL OR i.currency = :currency)
      """)
  Page<Invoice> findListed(
      @Param("today") LocalDate today,
      @Param("minAmount") BigDecimal minAmount,
      @Param("maxAmount") BigDecimal maxAmount,
      @Param("dueFrom") LocalDate dueFrom,
      @Param("dueTo") LocalDate dueTo,
      @Param("anchorId") UUID anchorId,
      @Param("currency") String currency,
      Pageable pageable);
}
