package io.invoicemart.marketplace.invoice.dto;

import io.invoicemart.marketplace.invoice.Invoice;
import io.invoicemart.marketplace.invoice.InvoiceDocument;
import io.invoicemart.marketplace.invoice.InvoiceStatus;
import io.invoicemart.marketplace.invoice.MarketplaceFundingTerms;
import io.invoicemart.marketplace.invoice.SupportingDocument;
import io.invoicemart.marketplace.invoice.SupportingDocumentType;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/** Invoice as returned to clients and cached in read models, with derived values at build time. */
public record InvoiceResponse(
    UUID id,
    String invoiceNumber,
    UUID sellerId,
    UUID anchorId,
    BigDecimal amount,
    String currency,
    LocalDate issueDate,
    LocalDate dueDate,
    String description,
    InvoiceStatus status,
    long daysUntilDue,
    boolean overdue,
    FundingTermsView fundingTerms,
    DocumentView primaryDocument,
    List<SupportingDocumentView> supportingDocuments,
    Instant submittedAt,
    Instant anchorApprovalDate,
    String anchorApprovalNotes,
    Instant anchorRejectionDate,
    String anchorRejectionReason,
    Instant adminVerificationDate,
    String adminVerificationNotes,
    Instant adminRejectionDate,
    String adminRejectionReason,
    UUID verifiedBy,
    Instant listedAt,
    Instant fundedAt,
    UUID fundedBy,
    UUID acceptedOfferId,
    BigDecimal fundingAmount,
    BigDecimal interestRate,
    BigDecimal fundingPercentage,
    BigDecimal totalRepaymentAmount,
    BigDecimal repaidAmount,
    BigDecimal repaymentProgress,
    Instant repaymentDate,
    Instant settlementDate,
    Instant createdAt,
    Instant updatedAt) {

  public static InvoiceResponse from(Invoice invoice, LocalDate today) {
    return new InvoiceResponse(
        invoice.getId(),
        invoice.getInvoiceNumber(),
        invoice.getSellerId(),
        invoice.getAnchorId(),
        invoice.getAmount(),
        invoice.getCurrency(),
        invoice.getIssueDate(),
        invoice.getDueDate(),
        invoice.getDescription(),
        invoice.getStatus(),
        invoice.daysUntilDue(today),
        invoice.isOverdue(today),
        FundingTermsView.from(invoice.getFundingTerms()),
        DocumentView.from(invoice.getPrimaryDocument()),
        invoice.getSupportingDocuments().stream().map(SupportingDocumentView::from).toList(),
        invoice.getSubmittedAt(),
        invoice.getAnchorApprovalDate(),
        invoice.getAnchorApprovalNotes(),
        invoice.getAnchorRejectionDate(),
        invoice.getAnchorRejectionReason(),
        invoice.getAdminVerificationDate(),
        invoice.getAdminVerificationNotes(),
        invoice.getAdminRejectionDate(),
        invoice.getAdminRejectionReason(),
        invoice.getVerifiedBy(),
        invoice.getListedAt(),
        invoice.getFundedAt(),
        invoice.getFundedBy(),
        invoice.getAcceptedOfferId(),
        invoice.getFundingAmount(),
        invoice.getInterestRate(),
        invoice.fundingPercentage(),
        invoice.getTotalRepaymentAmount(),
        invoice.getRepaidAmount(),
        invoice.repaymentProgress(),
        invoice.getRepaymentDate(),
        invoice.getSettlementDate(),
        invoice.getCreatedAt(),
        invoice.getUpdatedAt());
  }

  public record FundingTermsView(
      BigDecimal maxFundingAmount, BigDecimal recommendedInterestRate, Integer maxTenure) {

    static FundingTermsView from(MarketplaceFundingTerms terms) {
      if (terms == null) {
        return null;
      }
      return new FundingTermsView(
          terms.getMaxFundingAmount(), terms.getRecommendedInterestRate(), terms.getMaxTenure());
    }
  }

  public record DocumentView(
      String storageKey, String fileName, String contentType, Long sizeBytes, Instant uploadedAt) {

    static DocumentView from(InvoiceDocument document) {
      if (document == null || document.getStorageKey() == null) {
        return null;
      }
      return new DocumentView(
          document.getStorageKey(),
          document.getFileName(),
          document.getContentType(),
          document.getSizeBytes(),
          document.getUploadedAt());
    }
  }

  public record SupportingDocumentView(
      UUID documentId,
      SupportingDocumentType type,
      String fileName,
      String contentType,
      long sizeBytes,
      String description,
      Instant uploadedAt) {

    public static SupportingDocumentView from(SupportingDocument document) {
      return new SupportingDocumentView(
          document.getDocumentId(),
          document.getType(),
          document.getFileName(),
          document.getContentType(),
          document.getSizeBytes(),
          document.getDescription(),
          document.getUploadedAt());
    }
  }
}
