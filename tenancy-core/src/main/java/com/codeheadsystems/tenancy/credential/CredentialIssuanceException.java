package com.codeheadsystems.tenancy.credential;

/**
 * Thrown when key material cannot be generated, exported or signed.
 */
public class CredentialIssuanceException extends RuntimeException {

  public CredentialIssuanceException(String message, Throwable cause) {
    super(message, cause);
  }
}
