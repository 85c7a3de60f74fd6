package io.invoicemart.marketplace.marketplace.dto;

import io.invoicemart.marketplace.exception.InvalidRequestException;
import java.util.Set;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * Page and sort parameters as received from clients. Part of every list cache key, so it is a
 * plain value with no framework types.
 */
public record PageQuery(int page, int size, String sortBy, String direction) {

  public static final int MAX_PAGE_SIZE = 100;

  public PageQuery {
    if (page < 0) {
      page = 0;
    }
    if (size <= 0) {
      size = 20;
    }
    size = Math.min(size, MAX_PAGE_SIZE);
    direction = "asc".equalsIgnoreCase(direction) ? "asc" : "desc";
  }

  public Pageable toPageable(Set<String> sortable, String defaultSort) {
    String field = sortBy == null || sortBy.isBlank() ? defaultSort : sortBy;
    if (!sortable.contains(field)) {
      throw new InvalidRequestException(
          "Invalid sort field", "Sort by one of " + String.join(", ", sortable));
    }
    Sort.Direction dir = "asc".equals(direction) ? Sort.Direction.ASC : Sort.Direction.DESC;
    return PageRequest.of(page, size, Sort.by(dir, field));
  }

  public Pageable toPageable(Sort sort) {
    return PageRequest.of(page, size, sort);
  }
}
