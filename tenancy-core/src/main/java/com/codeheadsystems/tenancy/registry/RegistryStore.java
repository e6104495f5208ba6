package com.codeheadsystems.tenancy.registry;

/**
 * Durable storage for the subdomain registry.
 * <p>
 * {@link SubdomainRegistry} calls {@link #save} while holding its write lock, after applying a
 * mutation in memory. A save that returns normally commits the mutation. A save that throws
 * {@link RegistryPersistenceException} causes the registry to roll the mutation back, so
 * implementations must not leave a partially written state behind.
 */
public interface RegistryStore {

  /**
   * Loads the last committed registry state.
   *
   * @return the stored snapshot, or {@link RegistrySnapshot#empty()} if nothing has been stored
   * @throws RegistryPersistenceException if stored state exists but cannot be read
   */
  RegistrySnapshot load();

  /**
   * Durably replaces the stored registry state.
   *
   * @param snapshot the full registry state to persist
   * @throws RegistryPersistenceException if the write did not complete
   */
  void save(RegistrySnapshot snapshot);
}
