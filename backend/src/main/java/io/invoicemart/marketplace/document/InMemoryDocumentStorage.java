package io.invoicemart.marketplace.document;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Process-local document store for development and tests. */
@Component
@ConditionalOnProperty(name = "marketplace.storage.provider", havingValue = "memory")
public class InMemoryDocumentStorage implements DocumentStorage {

  private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStorage.class);

  private final Map<String, Entry> objects = new ConcurrentHashMap<>();

  @Override
  public StoredDocument upload(String key, byte[] content, String contentType) {
    if (!DocumentKeys.isValid(key)) {
      throw new IllegalArgumentException("Invalid storage key format");
    }
    objects.put(key, new Entry(content.clone(), contentType, DocumentStage.DRAFT));
    return new StoredDocument(key, contentType, content.length);
  }

  @Override
  public void delete(String key) {
    objects.remove(key);
  }

  @Override
  public void updateVisibility(String key, DocumentStage stage) {
    var updated = objects.computeIfPresent(key, (k, e) -> e.withStage(stage));
    if (updated == null) {
      log.warn("Visibility update to {} for unknown key {}", stage, key);
    }
  }

  @Override
  public PresignedUrl generateDownloadUrl(String key, Duration expiry) {
    return new PresignedUrl("memory://" + key, Instant.now().plus(expiry));
  }

  public Optional<DocumentStage> stageOf(String key) {
    return Optional.ofNullable(objects.get(key)).map(Entry::stage);
  }

  public boolean contains(String key) {
    return objects.containsKey(key);
  }

  private record Entry(byte[] content, String contentType, DocumentStage stage) {

    Entry withStage(DocumentStage newStage) {
      return new Entry(content, contentType, newStage);
    }
  }
}
