package com.codeheadsystems.tenancy.flow;

/**
 * Passkey signin with email fallback.
 */
public enum SigninState {
  PASSKEY("passkey"),
  EMAIL("email"),
  VERIFY_LINK("verify_link"),
  VERIFY_CODE("verify_code"),
  COMPLETE("complete");

  private final String code;

  SigninState(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
