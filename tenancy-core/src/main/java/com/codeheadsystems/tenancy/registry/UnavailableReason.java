package com.codeheadsystems.tenancy.registry;

/**
 * Closed set of policy reasons a subdomain cannot be claimed.
 * <p>
 * These are expected, user-facing outcomes and are returned, never thrown.
 * {@link #QUOTA_EXCEEDED} is only produced by {@link SubdomainRegistry#createClaim}; the
 * availability check itself is owner-agnostic.
 */
public enum UnavailableReason {

  RESERVED("reserved"),
  PREALLOCATED("preallocated"),
  CLAIMED("claimed"),
  TOO_SHORT("too_short"),
  TOO_LONG("too_long"),
  INVALID_FORMAT("invalid_format"),
  QUOTA_EXCEEDED("quota_exceeded");

  private final String code;

  UnavailableReason(String code) {
    this.code = code;
  }

  /**
   * Wire code for this reason, e.g. {@code "too_short"}.
   *
   * @return the code
   */
  public String code() {
    return code;
  }

  /**
   * True for reasons caused by the shape of the name rather than by registry state.
   *
   * @return whether the name itself is malformed
   */
  public boolean isFormatViolation() {
    return this == TOO_SHORT || this == TOO_LONG || this == INVALID_FORMAT;
  }
}
