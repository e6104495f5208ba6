package com.codeheadsystems.tenancy.flow;

/**
 * Chosen email verification strategy.
 *
 * @param strategy       {@code email_link}, {@code email_code}, or null when none is supported
 * @param emailAddressId target email address id, or null
 */
public record EmailVerification(String strategy, String emailAddressId) {

  public static final String EMAIL_LINK = "email_link";
  public static final String EMAIL_CODE = "email_code";

  private static final EmailVerification NONE = new EmailVerification(null, null);

  public static EmailVerification none() {
    return NONE;
  }

  public boolean isSupported() {
    return strategy != null;
  }
}
