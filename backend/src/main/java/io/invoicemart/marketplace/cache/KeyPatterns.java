package io.invoicemart.marketplace.cache;

import java.util.regex.Pattern;

final class KeyPatterns {

  private KeyPatterns() {}

  /** Translates a Redis-style glob ({@code *} and {@code ?}) into an anchored regex. */
  static Pattern compile(String glob) {
    var regex = new StringBuilder("^");
    for (char c : glob.toCharArray()) {
      switch (c) {
        case '*' -> regex.append(".*");
        case '?' -> regex.append('.');
        default -> regex.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return Pattern.compile(regex.append('$').toString());
  }
}
