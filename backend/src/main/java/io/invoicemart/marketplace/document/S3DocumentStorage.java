package io.invoicemart.marketplace.document;

import io.invoicemart.marketplace.config.S3Config.S3Properties;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectTaggingRequest;
import software.amazon.awssdk.services.s3.model.Tag;
import software.amazon.awssdk.services.s3.model.Tagging;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/**
 * S3 implementation of {@link DocumentStorage}. Visibility is carried as a {@code stage} object
 * tag that bucket policies key off. All AWS SDK types are confined to this class.
 */
@Component
@ConditionalOnProperty(
    name = "marketplace.storage.provider",
    havingValue = "s3",
    matchIfMissing = true)
public class S3DocumentStorage implements DocumentStorage {

  private static final Logger log = LoggerFactory.getLogger(S3DocumentStorage.class);

  static final String STAGE_TAG = "stage";

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;
  private final String bucketName;

  public S3DocumentStorage(
      S3Client s3Client, S3Presigner s3Presigner, S3Properties s3Properties) {
    this.s3Client = s3Client;
    this.s3Presigner = s3Presigner;
    this.bucketName = s3Properties.bucketName();
  }

  @Override
  public StoredDocument upload(String key, byte[] content, String contentType) {
    validateKey(key);
    var putRequest =
        PutObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .contentType(contentType)
            .tagging(STAGE_TAG + "=" + DocumentStage.DRAFT.tagValue())
            .build();
    s3Client.putObject(putRequest, RequestBody.fromBytes(content));
    log.debug("Stored document {} ({} bytes)", key, content.length);
    return new StoredDocument(key, contentType, content.length);
  }

  @Override
  public void delete(String key) {
    try {
      var deleteRequest = DeleteObjectRequest.builder().bucket(bucketName).key(key).build();
      s3Client.deleteObject(deleteRequest);
    } catch (Exception e) {
      log.warn("Best-effort S3 deletion failed for key={}: {}", key, e.getMessage());
    }
  }

  @Override
  public void updateVisibility(String key, DocumentStage stage) {
    try {
      var request =
          PutObjectTaggingRequest.builder()
              .bucket(bucketName)
              .key(key)
              .tagging(stageTagging(stage))
              .build();
      s3Client.putObjectTagging(request);
    } catch (Exception e) {
      log.warn("Visibility update to {} failed for key={}: {}", stage, key, e.getMessage());
    }
  }

  @Override
  public PresignedUrl generateDownloadUrl(String key, Duration expiry) {
    validateKey(key);
    var getRequest = GetObjectRequest.builder().bucket(bucketName).key(key).build();
    var presignRequest =
        GetObjectPresignRequest.builder()
            .signatureDuration(expiry)
            .getObjectRequest(getRequest)
            .build();
    var presigned = s3Presigner.presignGetObject(presignRequest);
    return new PresignedUrl(presigned.url().toExternalForm(), Instant.now().plus(expiry));
  }

  private static Tagging stageTagging(DocumentStage stage) {
    return Tagging.builder()
        .tagSet(Tag.builder().key(STAGE_TAG).value(stage.tagValue()).build())
        .build();
  }

  private static void validateKey(String key) {
    if (!DocumentKeys.isValid(key)) {
      throw new IllegalArgumentException("Invalid storage key format");
    }
  }
}
