package io.invoicemart.marketplace.invoice;

import io.invoicemart.marketplace.config.DocumentProperties;
import io.invoicemart.marketplace.document.DocumentKeys;
import io.invoicemart.marketplace.document.DocumentStorage;
import io.invoicemart.marketplace.exception.ErrorKind;
import io.invoicemart.marketplace.exception.ForbiddenException;
import io.invoicemart.marketplace.exception.InvalidRequestException;
import io.invoicemart.marketplace.exception.InvalidStateException;
import io.invoicemart.marketplace.exception.ResourceConflictException;
import io.invoicemart.marketplace.exception.ResourceNotFoundException;
import io.invoicemart.marketplace.notification.MarketplaceNotifier;
import io.invoicemart.marketplace.party.PartyService;
import io.invoicemart.marketplace.web.Actor;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Invoice lifecycle operations. Each transition is guarded by the entity, appends to its status
 * history, enqueues the notifications it implies and publishes an {@link
 * InvoiceStatusChangedEvent} for post-commit cache and realtime work.
 */
@Service
public class InvoiceService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceService.class);

  private final InvoiceRepository invoiceRepository;
  private final PartyService partyService;
  private final DocumentStorage documentStorage;
  private final DocumentProperties documentProperties;
  private final MarketplaceNotifier notifier;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public InvoiceService(
      InvoiceRepository invoiceRepository,
      PartyService partyService,
      DocumentStorage documentStorage,
      DocumentProperties documentProperties,
      MarketplaceNotifier notifier,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.invoiceRepository = invoiceRepository;
    this.partyService = partyService;
    this.documentStorage = documentStorage;
    this.documentProperties = documentProperties;
    this.notifier = notifier;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  // --- Seller: drafting ---

  @Transactional
  public Invoice createInvoice(
      UUID sellerId,
      UUID anchorId,
      String invoiceNumber,
      BigDecimal amount,
      String currency,
      LocalDate issueDate,
      LocalDate dueDate,
      String description) {
    partyService.requireAnchor(anchorId);
    if (invoiceRepository.existsBySellerIdAndInvoiceNumber(sellerId, invoiceNumber)) {
      throw new ResourceConflictException(
          ErrorKind.INVALID_REQUEST,
          "Duplicate invoice number",
          "You already have an invoice numbered " + invoiceNumber);
    }
    var invoice =
        invoiceRepository.save(
            new Invoice(
                sellerId,
                anchorId,
                invoiceNumber,
                amount,
                currency,
                issueDate,
                dueDate,
                description,
                clock.instant()));
    log.info("Seller {} created invoice {} ({})", sellerId, invoice.getId(), invoiceNumber);
    return invoice;
  }

  @Transactional
  public Invoice updateInvoice(
      UUID sellerId,
      UUID invoiceId,
      UUID anchorId,
      BigDecimal amount,
      String currency,
      LocalDate issueDate,
      LocalDate dueDate,
      String description) {
    var invoice = requireOwned(sellerId, invoiceId);
    if (!anchorId.equals(invoice.getAnchorId())) {
      partyService.requireAnchor(anchorId);
    }
    invoice.updateDetails(
        anchorId, amount, currency, issueDate, dueDate, description, clock.instant());
    invoice = invoiceRepository.save(invoice);
    publishEdit(invoice, sellerId);
    return invoice;
  }

  /** Only drafts can be deleted; their stored documents go with them. */
  @Transactional
  public void deleteInvoice(UUID sellerId, UUID invoiceId) {
    var invoice = requireOwned(sellerId, invoiceId);
    if (!invoice.canBeDeleted()) {
      throw new InvalidStateException(
          "Invalid invoice status",
          "Cannot delete invoice in status " + invoice.getStatus() + ". Must be DRAFT.");
    }
    var removal = InvoiceStatusChangedEvent.of(invoice, invoice.getStatus(), sellerId);
    invoiceRepository.delete(invoice);
    eventPublisher.publishEvent(new DocumentsDiscardedEvent(invoiceId, removal.documentKeys()));
    eventPublisher.publishEvent(removal);
    log.info("Seller {} deleted draft invoice {}", sellerId, invoiceId);
  }

  @Transactional
  public Invoice uploadPrimaryDocument(
      UUID sellerId, UUID invoiceId, String fileName, String contentType, byte[] content) {
    var invoice = requireOwned(sellerId, invoiceId);
    requireEditable(invoice, "upload a document to");
    validateUpload(contentType, content);

    var stored =
        documentStorage.upload(DocumentKeys.primary(invoiceId, fileName), content, contentType);
    Optional<InvoiceDocument> previous;
    try {
      previous =
          invoice.attachPrimaryDocument(
              new InvoiceDocument(
                  stored.storageKey(), fileName, stored.contentType(), stored.sizeBytes()),
              clock.instant());
      invoice = invoiceRepository.saveAndFlush(invoice);
    } catch (RuntimeException e) {
      log.warn("Save failed after upload, deleting orphaned object: {}", stored.storageKey());
      documentStorage.delete(stored.storageKey());
      throw e;
    }
    previous.ifPresent(
        old ->
            eventPublisher.publishEvent(
                new DocumentsDiscardedEvent(invoiceId, List.of(old.getStorageKey()))));
    publishEdit(invoice, sellerId);
    log.info("Primary document {} attached to invoice {}", stored.storageKey(), invoiceId);
    return invoice;
  }

  @Transactional
  public SupportingDocument addSupportingDocument(
      UUID sellerId,
      UUID invoiceId,
      SupportingDocumentType type,
      String description,
      String fileName,
      String contentType,
      byte[] content) {
    var invoice = requireOwned(sellerId, invoiceId);
    requireEditable(invoice, "add documents to");
    if (invoice.getSupportingDocuments().size() >= documentProperties.maxSupportingDocuments()) {
      throw new InvalidRequestException(
          "Too many documents",
          "An invoice can carry at most "
              + documentProperties.maxSupportingDocuments()
              + " supporting documents");
    }
    validateUpload(contentType, content);

    var stored =
        documentStorage.upload(DocumentKeys.supporting(invoiceId, fileName), content, contentType);
    var document =
        new SupportingDocument(
            type,
            stored.storageKey(),
            fileName,
            stored.contentType(),
            stored.sizeBytes(),
            description);
    try {
      invoice.addSupportingDocument(
          document, documentProperties.maxSupportingDocuments(), clock.instant());
      invoice = invoiceRepository.saveAndFlush(invoice);
    } catch (RuntimeException e) {
      log.warn("Save failed after upload, deleting orphaned object: {}", stored.storageKey());
      documentStorage.delete(stored.storageKey());
      throw e;
    }
    publishEdit(invoice, sellerId);
    return document;
  }

  @Transactional
  public void removeSupportingDocument(UUID sellerId, UUID invoiceId, UUID documentId) {
    var invoice = requireOwned(sellerId, invoiceId);
    var removed =
        invoice
            .removeSupportingDocument(documentId, clock.instant())
            .orElseThrow(() -> new ResourceNotFoundException("SupportingDocument", documentId));
    invoice = invoiceRepository.save(invoice);
    eventPublisher.publishEvent(
        new DocumentsDiscardedEvent(invoiceId, List.of(removed.getStorageKey())));
    publishEdit(invoice, sellerId);
  }

  // --- Lifecycle transitions ---

  @Transactional
  public Invoice submitInvoice(UUID sellerId, UUID invoiceId) {
    var invoice = requireOwned(sellerId, invoiceId);
    var from = invoice.getStatus();
    invoice.submit(sellerId, clock.instant());
    invoice = invoiceRepository.save(invoice);

    notifier.invoiceAwaitingApproval(invoice);
    publishTransition(invoice, from, sellerId);
    return invoice;
  }

  @Transactional
  public Invoice approveByAnchor(
      UUID anchorId, UUID invoiceId, String notes, MarketplaceFundingTerms terms) {
    var invoice = requireForAnchor(anchorId, invoiceId);
    var from = invoice.getStatus();
    invoice.approveByAnchor(anchorId, notes, terms, clock.instant());
    invoice = invoiceRepository.save(invoice);

    notifier.invoiceStatusChanged(invoice, notes);
    publishTransition(invoice, from, anchorId);
    return invoice;
  }

  @Transactional
  public Invoice rejectByAnchor(UUID anchorId, UUID invoiceId, String reason) {
    var invoice = requireForAnchor(anchorId, invoiceId);
    var from = invoice.getStatus();
    invoice.rejectByAnchor(anchorId, reason, clock.instant());
    invoice = invoiceRepository.save(invoice);

    notifier.invoiceStatusChanged(invoice, invoice.getAnchorRejectionReason());
    publishTransition(invoice, from, anchorId);
    return invoice;
  }

  @Transactional
  public Invoice verifyByAdmin(
      UUID adminId, UUID invoiceId, String notes, MarketplaceFundingTerms terms) {
    var invoice = requireInvoice(invoiceId);
    var from = invoice.getStatus();
    invoice.verifyByAdmin(adminId, notes, terms, clock.instant());
    invoice = invoiceRepository.save(invoice);

    notifier.invoiceStatusChanged(invoice, notes);
    publishTransition(invoice, from, adminId);
    return invoice;
  }

  @Transactional
  public Invoice rejectByAdmin(UUID adminId, UUID invoiceId, String reason) {
    var invoice = requireInvoice(invoiceId);
    var from = invoice.getStatus();
    invoice.rejectByAdmin(adminId, reason, clock.instant());
    invoice = invoiceRepository.save(invoice);

    notifier.invoiceStatusChanged(invoice, invoice.getAdminRejectionReason());
    publishTransition(invoice, from, adminId);
    return invoice;
  }

  /** Opens the invoice for bidding. Bidding needs funding terms that fit the invoice. */
  @Transactional
  public Invoice listInvoice(UUID adminId, UUID invoiceId) {
    var invoice = requireInvoice(invoiceId);
    var from = invoice.getStatus();
    invoice.list(adminId, clock.instant());
    invoice = invoiceRepository.save(invoice);

    notifier.invoiceStatusChanged(invoice, "Your invoice is now visible to lenders.");
    publishTransition(invoice, from, adminId);
    return invoice;
  }

  @Transactional
  public Invoice markRepaid(UUID adminId, UUID invoiceId, BigDecimal repaidAmount) {
    var invoice = requireInvoice(invoiceId);
    var from = invoice.getStatus();
    invoice.markRepaid(adminId, repaidAmount, clock.instant());
    invoice = invoiceRepository.save(invoice);

    notifier.invoiceStatusChanged(invoice, null);
    publishTransition(invoice, from, adminId);
    return invoice;
  }

  @Transactional
  public Invoice markSettled(UUID adminId, UUID invoiceId) {
    var invoice = requireInvoice(invoiceId);
    var from = invoice.getStatus();
    invoice.markSettled(adminId, clock.instant());
    invoice = invoiceRepository.save(invoice);

    notifier.invoiceStatusChanged(invoice, null);
    publishTransition(invoice, from, adminId);
    return invoice;
  }

  // --- Reads ---

  @Transactional(readOnly = true)
  public Invoice getInvoice(Actor actor, UUID invoiceId) {
    var invoice = requireInvoice(invoiceId);
    if (!InvoiceVisibility.canView(actor, invoice)) {
      throw new ForbiddenException(
          "Cannot view invoice", "Invoice " + invoiceId + " is not visible to you");
    }
    return invoice;
  }

  @Transactional(readOnly = true)
  public List<StatusHistoryEntry> statusHistory(Actor actor, UUID invoiceId) {
    return new ArrayList<>(getInvoice(actor, invoiceId).getStatusHistory());
  }

  // --- Helpers ---

  /** Edits keep the status; the event still drives read-model invalidation. */
  private void publishEdit(Invoice invoice, UUID sellerId) {
    eventPublisher.publishEvent(
        InvoiceStatusChangedEvent.of(invoice, invoice.getStatus(), sellerId));
  }

  private void publishTransition(Invoice invoice, InvoiceStatus from, UUID actorId) {
    eventPublisher.publishEvent(InvoiceStatusChangedEvent.of(invoice, from, actorId));
    log.info(
        "Invoice {} moved {} -> {} by {}", invoice.getId(), from, invoice.getStatus(), actorId);
  }

  private void validateUpload(String contentType, byte[] content) {
    if (content == null || content.length == 0) {
      throw new InvalidRequestException("Empty file", "Uploaded file is empty");
    }
    if (content.length > documentProperties.maxFileSize().toBytes()) {
      throw new InvalidRequestException(
          "File too large",
          "File size exceeds the " + documentProperties.maxFileSize().toMegabytes() + "MB limit");
    }
    if (!documentProperties.isAllowed(contentType)) {
      throw new InvalidRequestException(
          "Unsupported file type",
          "Only " + String.join(", ", documentProperties.allowedContentTypes()) + " are accepted");
    }
  }

  private static void requireEditable(Invoice invoice, String action) {
    if (!invoice.canBeEdited()) {
      throw new InvalidStateException(
          "Invalid invoice status",
          "Cannot "
              + action
              + " invoice in status "
              + invoice.getStatus()
              + ". Must be DRAFT or REJECTED.");
    }
  }

  private Invoice requireOwned(UUID sellerId, UUID invoiceId) {
    var invoice = requireInvoice(invoiceId);
    if (!invoice.getSellerId().equals(sellerId)) {
      throw new ForbiddenException(
          "Cannot modify invoice", "Invoice " + invoiceId + " belongs to another seller");
    }
    return invoice;
  }

  private Invoice requireForAnchor(UUID anchorId, UUID invoiceId) {
    var invoice = requireInvoice(invoiceId);
    if (!anchorId.equals(invoice.getAnchorId())) {
      throw new ForbiddenException(
          "Cannot review invoice", "Invoice " + invoiceId + " is not addressed to you");
    }
    return invoice;
  }

  private Invoice requireInvoice(UUID invoiceId) {
    return invoiceRepository
        .findById(invoiceId)
        .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
  }
}
