package com.codeheadsystems.tenancy.registry;

import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link RegistryStore} holding the last saved snapshot in memory.
 * <p>
 * All claims are lost on restart. Suitable for development and testing only.
 */
public class InMemoryRegistryStore implements RegistryStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRegistryStore.class);

  private final AtomicReference<RegistrySnapshot> current;

  public InMemoryRegistryStore() {
    this(RegistrySnapshot.empty());
  }

  public InMemoryRegistryStore(RegistrySnapshot initial) {
    this.current = new AtomicReference<>(initial);
    log.warn("Using InMemoryRegistryStore: subdomain claims will NOT survive restarts.");
  }

  @Override
  public RegistrySnapshot load() {
    return current.get();
  }

  @Override
  public void save(RegistrySnapshot snapshot) {
    current.set(snapshot);
    log.debug("Saved registry snapshot with {} claim(s)", snapshot.claims().size());
  }
}
