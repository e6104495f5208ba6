package com.codeheadsystems.tenancy.validator;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the comma-separated permitted-origins setting.
 */
public final class PermittedOrigins {

  private PermittedOrigins() {
  }

  /**
   * Splits on {@code ,}, trims each entry and drops empty ones, preserving order.
   *
   * @param csv the setting, may be null
   * @return the patterns; empty for null or blank input, which means "no restriction"
   */
  public static List<String> parse(String csv) {
    if (csv == null || csv.isEmpty()) {
      return List.of();
    }
    List<String> origins = new ArrayList<>();
    for (String entry : csv.split(",")) {
      String trimmed = entry.trim();
      if (!trimmed.isEmpty()) {
        origins.add(trimmed);
      }
    }
    return List.copyOf(origins);
  }
}
