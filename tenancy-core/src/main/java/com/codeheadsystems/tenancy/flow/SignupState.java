package com.codeheadsystems.tenancy.flow;

/**
 * Passkey signup: {@code email -> verify -> passkey -> claiming -> done}.
 */
public enum SignupState {
  EMAIL("email"),
  VERIFY("verify"),
  PASSKEY("passkey"),
  CLAIMING("claiming"),
  DONE("done");

  private final String code;

  SignupState(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
