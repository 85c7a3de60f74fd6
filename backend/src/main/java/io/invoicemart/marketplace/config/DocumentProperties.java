package io.invoicemart.marketplace.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Upload limits for invoice documents.
 *
 * @param maxFileSize largest accepted upload
 * @param allowedContentTypes accepted mime types
 * @param maxSupportingDocuments supporting documents allowed per invoice
 */
@ConfigurationProperties(prefix = "marketplace.documents")
public record DocumentProperties(
    DataSize maxFileSize, List<String> allowedContentTypes, int maxSupportingDocuments) {

  public DocumentProperties {
    if (maxFileSize == null) {
      maxFileSize = DataSize.ofMegabytes(5);
    }
    if (allowedContentTypes == null || allowedContentTypes.isEmpty()) {
      allowedContentTypes = List.of("application/pdf", "image/jpeg", "image/jpg", "image/png");
    }
    if (maxSupportingDocuments <= 0) {
      maxSupportingDocuments = 10;
    }
  }

  public boolean isAllowed(String contentType) {
    return contentType != null && allowedContentTypes.contains(contentType.toLowerCase());
  }
}
