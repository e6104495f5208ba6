package com.codeheadsystems.tenancy.validator;

/**
 * Result of {@link TimingValidator#validate}.
 *
 * @param valid  whether the token is inside its validity window
 * @param reason {@code "expired"} or {@code "not_yet_valid"} when invalid, otherwise null
 */
public record TimingResult(boolean valid, String reason) {

  public static final String EXPIRED = "expired";
  public static final String NOT_YET_VALID = "not_yet_valid";

  private static final TimingResult VALID = new TimingResult(true, null);

  public static TimingResult ok() {
    return VALID;
  }

  public static TimingResult invalid(String reason) {
    return new TimingResult(false, reason);
  }
}
