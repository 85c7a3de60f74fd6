package io.invoicemart.marketplace.document;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/** Storage key layout: {@code invoices/{invoiceId}/{primary|supporting}/{uuid}-{fileName}}. */
public final class DocumentKeys {

  static final Pattern KEY_PATTERN =
      Pattern.compile("^invoices/[0-9a-f-]{36}/(primary|supporting)/[^/]+$");

  private DocumentKeys() {}

  public static String primary(UUID invoiceId, String fileName) {
    return "invoices/" + invoiceId + "/primary/" + UUID.randomUUID() + "-" + sanitize(fileName);
  }

  public static String supporting(UUID invoiceId, String fileName) {
    return "invoices/" + invoiceId + "/supporting/" + UUID.randomUUID() + "-" + sanitize(fileName);
  }

  static boolean isValid(String key) {
    return key != null && KEY_PATTERN.matcher(key).matches();
  }

  static String sanitize(String fileName) {
    if (fileName == null || fileName.isBlank()) {
      return "document";
    }
    String cleaned = fileName.replaceAll("[^A-Za-z0-9._-]", "_").toLowerCase(Locale.ROOT);
    return cleaned.length() > 100 ? cleaned.substring(cleaned.length() - 100) : cleaned;
  }
}
