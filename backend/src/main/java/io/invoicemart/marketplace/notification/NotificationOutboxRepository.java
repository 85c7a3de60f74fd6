package io.invoicemart.marketplace.notification;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

public interface NotificationOutboxRepository extends JpaRepository<NotificationOutbox, UUID> {

  /**
   * Claims items due for delivery. Rows locked by another dispatcher are skipped, so concurrent
   * instances never deliver the same item in parallel.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
  @Query(
      """
      SELECT o FROM NotificationOutbox o
      WHERE o.status = :pending
         OR (o.status = :retry AND o.nextRetryAt <= :now)
      ORDER BY o.createdAt ASC
      """)
  List<NotificationOutbox> claimDue(
      @Param("pending") OutboxStatus pending,
      @Param("retry") OutboxStatus retry,
      @Param("now") Instant now,
      Pageable pageable);

  default List<NotificationOutbox> claimDue(Instant now, Pageable pageable) {
    return claimDue(OutboxStatus.PENDING, OutboxStatus.RETRY_SCHEDULED, now, pageable);
  }

  List<NotificationOutbox> findByRecipientIdOrderByCreatedAtDesc(UUID recipientId, Pageable page);

  @Modifying
  @Query("DELETE FROM NotificationOutbox o WHERE o.status = :status AND o.sentAt < :cutoff")
  int deleteByStatusAndSentAtBefore(
      @Param("status") OutboxStatus status, @Param("cutoff") Instant cutoff);
}
