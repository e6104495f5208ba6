package com.codeheadsystems.tenancy.flow;

/**
 * Result of an external passkey ceremony.
 *
 * @param success   the ceremony completed and was verified
 * @param cancelled the user dismissed the ceremony
 */
public record PasskeyOutcome(boolean success, boolean cancelled) {

  public static PasskeyOutcome succeeded() {
    return new PasskeyOutcome(true, false);
  }

  public static PasskeyOutcome failed() {
    return new PasskeyOutcome(false, false);
  }

  public static PasskeyOutcome cancelledByUser() {
    return new PasskeyOutcome(false, true);
  }
}
