package io.invoicemart.marketplace.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.time.Instant;

/** The invoice's primary document as stored by the document storage collaborator. */
@Embeddable
public class InvoiceDocument {

  @Column(name = "document_storage_key", length = 500)
  private String storageKey;

  @Column(name = "document_file_name", length = 255)
  private String fileName;

  @Column(name = "document_content_type", length = 100)
  private String contentType;

  @Column(name = "document_size_bytes")
  private Long sizeBytes;

  @Column(name = "document_uploaded_at")
  private Instant uploadedAt;

  protected InvoiceDocument() {}

  public InvoiceDocument(String storageKey, String fileName, String contentType, long sizeBytes) {
    this.storageKey = storageKey;
    this.fileName = fileName;
    this.contentType = contentType;
    this.sizeBytes = sizeBytes;
    this.uploadedAt = Instant.now();
  }

  public String getStorageKey() {
    return storageKey;
  }

  public String getFileName() {
    return fileName;
  }

  public String getContentType() {
    return contentType;
  }

  public Long getSizeBytes() {
    return sizeBytes;
  }

  public Instant getUploadedAt() {
    return uploadedAt;
  }
}
