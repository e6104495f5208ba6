package com.codeheadsystems.tenancy.registry;

/**
 * Thrown when the registry cannot be read from or written to its durable store.
 */
public class RegistryPersistenceException extends RuntimeException {

  public RegistryPersistenceException(String message) {
    super(message);
  }

  public RegistryPersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
