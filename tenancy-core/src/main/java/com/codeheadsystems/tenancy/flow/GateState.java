package com.codeheadsystems.tenancy.flow;

/**
 * Passkey gate and claim prompt states.
 */
public enum GateState {
  CHECKING("checking"),
  PASSKEY("passkey"),
  CLAIM("claim"),
  READY("ready");

  private final String code;

  GateState(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
