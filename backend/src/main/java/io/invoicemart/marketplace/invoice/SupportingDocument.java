package io.invoicemart.marketplace.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import java.time.Instant;
import java.util.UUID;

@Embeddable
public class SupportingDocument {

  @Column(name = "document_id", nullable = false)
  private UUID documentId;

  @Enumerated(EnumType.STRING)
  @Column(name = "document_type", nullable = false, length = 30)
  private SupportingDocumentType type;

  @Column(name = "storage_key", nullable = false, length = 500)
  private String storageKey;

  @Column(name = "file_name", nullable = false, length = 255)
  private String fileName;

  @Column(name = "content_type", nullable = false, length = 100)
  private String contentType;

  @Column(name = "size_bytes", nullable = false)
  private long sizeBytes;

  @Column(name = "description", length = 500)
  private String description;

  @Column(name = "uploaded_at", nullable = false)
  private Instant uploadedAt;

  protected SupportingDocument() {}

  public SupportingDocument(
      SupportingDocumentType type,
      String storageKey,
      String fileName,
      String contentType,
      long sizeBytes,
      String description) {
    this.documentId = UUID.randomUUID();
    this.type = type;
    this.storageKey = storageKey;
    this.fileName = fileName;
    this.contentType = contentType;
    this.sizeBytes = sizeBytes;
    this.description = description;
    this.uploadedAt = Instant.now();
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public SupportingDocumentType getType() {
    return type;
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

  public long getSizeBytes() {
    return sizeBytes;
  }

  public String getDescription() {
    return description;
  }

  public Instant getUploadedAt() {
    return uploadedAt;
  }
}
