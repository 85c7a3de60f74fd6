package io.invoicemart.marketplace.invoice;

import io.invoicemart.marketplace.exception.InvalidRequestException;
import io.invoicemart.marketplace.invoice.dto.InvoiceResponse;
import io.invoicemart.marketplace.invoice.dto.InvoiceResponse.SupportingDocumentView;
import io.invoicemart.marketplace.party.PartyRole;
import io.invoicemart.marketplace.web.Actor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
public class InvoiceController {

  private final InvoiceService invoiceService;
  private final Clock clock;

  public InvoiceController(InvoiceService invoiceService, Clock clock) {
    this.invoiceService = invoiceService;
    this.clock = clock;
  }

  // --- Seller ---

  @PostMapping("/api/invoices")
  public ResponseEntity<InvoiceResponse> createInvoice(
      Actor actor, @Valid @RequestBody InvoiceRequest request) {
    actor.requireRole(PartyRole.SELLER);
    var invoice =
        invoiceService.createInvoice(
            actor.id(),
            request.anchorId(),
            request.invoiceNumber(),
            request.amount(),
            request.currency(),
            request.issueDate(),
            request.dueDate(),
            request.description());
    return ResponseEntity.created(URI.create("/api/invoices/" + invoice.getId()))
        .body(toResponse(invoice));
  }

  @PutMapping("/api/invoices/{id}")
  public ResponseEntity<InvoiceResponse> updateInvoice(
      Actor actor, @PathVariable UUID id, @Valid @RequestBody InvoiceRequest request) {
    actor.requireRole(PartyRole.SELLER);
    var invoice =
        invoiceService.updateInvoice(
            actor.id(),
            id,
            request.anchorId(),
            request.amount(),
            request.currency(),
            request.issueDate(),
            request.dueDate(),
            request.description());
    return ResponseEntity.ok(toResponse(invoice));
  }

  @DeleteMapping("/api/invoices/{id}")
  public ResponseEntity<Void> deleteInvoice(Actor actor, @PathVariable UUID id) {
    actor.requireRole(PartyRole.SELLER);
    invoiceService.deleteInvoice(actor.id(), id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping(
      value = "/api/invoices/{id}/document",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<InvoiceResponse> uploadDocument(
      Actor actor, @PathVariable UUID id, @RequestParam("file") MultipartFile file) {
    actor.requireRole(PartyRole.SELLER);
    var invoice =
        invoiceService.uploadPrimaryDocument(
            actor.id(), id, file.getOriginalFilename(), file.getContentType(), bytesOf(file));
    return ResponseEntity.ok(toResponse(invoice));
  }

  @PostMapping(
      value = "/api/invoices/{id}/supporting-documents",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<SupportingDocumentView> addSupportingDocument(
      Actor actor,
      @PathVariable UUID id,
      @RequestParam("file") MultipartFile file,
      @RequestParam("type") SupportingDocumentType type,
      @RequestParam(value = "description", required = false) String description) {
    actor.requireRole(PartyRole.SELLER);
    var document =
        invoiceService.addSupportingDocument(
            actor.id(),
            id,
            type,
            description,
            file.getOriginalFilename(),
            file.getContentType(),
            bytesOf(file));
    return ResponseEntity.created(
            URI.create(
                "/api/invoices/" + id + "/supporting-documents/" + document.getDocumentId()))
        .body(SupportingDocumentView.from(document));
  }

  @DeleteMapping("/api/invoices/{id}/supporting-documents/{documentId}")
  public ResponseEntity<Void> removeSupportingDocument(
      Actor actor, @PathVariable UUID id, @PathVariable UUID documentId) {
    actor.requireRole(PartyRole.SELLER);
    invoiceService.removeSupportingDocument(actor.id(), id, documentId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/api/invoices/{id}/submit")
  public ResponseEntity<InvoiceResponse> submitInvoice(Actor actor, @PathVariable UUID id) {
    actor.requireRole(PartyRole.SELLER);
    return ResponseEntity.ok(toResponse(invoiceService.submitInvoice(actor.id(), id)));
  }

  // --- Anchor ---

  @PostMapping("/api/anchor/invoices/{id}/decision")
  public ResponseEntity<InvoiceResponse> anchorDecision(
      Actor actor, @PathVariable UUID id, @Valid @RequestBody AnchorDecisionRequest request) {
    actor.requireRole(PartyRole.ANCHOR);
    var terms = FundingTermsRequest.toTerms(request.fundingTerms());
    var invoice =
        "approve".equals(request.decision())
            ? invoiceService.approveByAnchor(actor.id(), id, request.notes(), terms)
            : invoiceService.rejectByAnchor(actor.id(), id, request.notes());
    return ResponseEntity.ok(toResponse(invoice));
  }

  // --- Admin ---

  @PostMapping("/api/admin/invoices/{id}/decision")
  public ResponseEntity<InvoiceResponse> adminDecision(
      Actor actor, @PathVariable UUID id, @Valid @RequestBody AdminDecisionRequest request) {
    actor.requireRole(PartyRole.ADMIN);
    var terms = FundingTermsRequest.toTerms(request.fundingTerms());
    var invoice =
        "verify".equals(request.decision())
            ? invoiceService.verifyByAdmin(actor.id(), id, request.notes(), terms)
            : invoiceService.rejectByAdmin(actor.id(), id, request.notes());
    return ResponseEntity.ok(toResponse(invoice));
  }

  @PostMapping("/api/admin/invoices/{id}/list")
  public ResponseEntity<InvoiceResponse> listInvoice(Actor actor, @PathVariable UUID id) {
    actor.requireRole(PartyRole.ADMIN);
    return ResponseEntity.ok(toResponse(invoiceService.listInvoice(actor.id(), id)));
  }

  @PostMapping("/api/admin/invoices/{id}/repaid")
  public ResponseEntity<InvoiceResponse> markRepaid(
      Actor actor,
      @PathVariable UUID id,
      @Valid @RequestBody(required = false) RepaidRequest body) {
    actor.requireRole(PartyRole.ADMIN);
    BigDecimal repaidAmount = body != null ? body.repaidAmount() : null;
    return ResponseEntity.ok(toResponse(invoiceService.markRepaid(actor.id(), id, repaidAmount)));
  }

  @PostMapping("/api/admin/invoices/{id}/settled")
  public ResponseEntity<InvoiceResponse> markSettled(Actor actor, @PathVariable UUID id) {
    actor.requireRole(PartyRole.ADMIN);
    return ResponseEntity.ok(toResponse(invoiceService.markSettled(actor.id(), id)));
  }

  // --- Shared ---

  @GetMapping("/api/invoices/{id}/history")
  public ResponseEntity<List<StatusHistoryResponse>> statusHistory(
      Actor actor, @PathVariable UUID id) {
    var history = invoiceService.statusHistory(actor, id);
    return ResponseEntity.ok(history.stream().map(StatusHistoryResponse::from).toList());
  }

  private InvoiceResponse toResponse(Invoice invoice) {
    return InvoiceResponse.from(invoice, LocalDate.now(clock));
  }

  private static byte[] bytesOf(MultipartFile file) {
    try {
      return file.getBytes();
    } catch (IOException e) {
      throw new InvalidRequestException("Unreadable upload", "The uploaded file could not be read");
    }
  }

  // --- DTOs ---

  public record InvoiceRequest(
      @NotNull(message = "anchorId is required") UUID anchorId,
      @NotBlank(message = "invoiceNumber is required")
          @Size(max = 50, message = "invoiceNumber must not exceed 50 characters")
          String invoiceNumber,
      @NotNull(message = "amount is required") @Positive(message = "amount must be positive")
          BigDecimal amount,
      @Pattern(regexp = "^[A-Z]{3}$", message = "currency must be a 3-letter ISO code")
          String currency,
      @NotNull(message = "issueDate is required") LocalDate issueDate,
      @NotNull(message = "dueDate is required") LocalDate dueDate,
      @Size(max = 1000, message = "description must not exceed 1000 characters")
          String description) {}

  public record FundingTermsRequest(
      @Positive(message = "maxFundingAmount must be positive") BigDecimal maxFundingAmount,
      @DecimalMin(value = "0.0", message = "recommendedInterestRate must not be negative")
          @DecimalMax(value = "50.0", message = "recommendedInterestRate must not exceed 50")
          BigDecimal recommendedInterestRate,
      @Min(value = 1, message = "maxTenure must be at least 1 day")
          @Max(value = 365, message = "maxTenure must not exceed 365 days")
          Integer maxTenure) {

    static MarketplaceFundingTerms toTerms(FundingTermsRequest request) {
      if (request == null) {
        return null;
      }
      return new MarketplaceFundingTerms(
          request.maxFundingAmount(), request.recommendedInterestRate(), request.maxTenure());
    }
  }

  public record AnchorDecisionRequest(
      @NotBlank(message = "decision is required")
          @Pattern(regexp = "approve|reject", message = "decision must be approve or reject")
          String decision,
      @Size(max = 1000, message = "notes must not exceed 1000 characters") String notes,
      @Valid FundingTermsRequest fundingTerms) {}

  public record AdminDecisionRequest(
      @NotBlank(message = "decision is required")
          @Pattern(regexp = "verify|reject", message = "decision must be verify or reject")
          String decision,
      @Size(max = 1000, message = "notes must not exceed 1000 characters") String notes,
      @Valid FundingTermsRequest fundingTerms) {}

  public record RepaidRequest(
      @Positive(message = "repaidAmount must be positive") BigDecimal repaidAmount) {}

  public record StatusHistoryResponse(
      InvoiceStatus status, Instant changedAt, UUID changedBy, String notes) {

    static StatusHistoryResponse from(StatusHistoryEntry entry) {
      return new StatusHistoryResponse(
          entry.getStatus(), entry.getChangedAt(), entry.getChangedBy(), entry.getNotes());
    }
  }
}
