package com.codeheadsystems.tenancy.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.tenancy.registry.RegistryStore;
import com.codeheadsystems.tenancy.registry.SubdomainRegistry;

/**
 * Health check that reports the registry's claim count and backing store.
 */
public class RegistryHealthCheck extends HealthCheck {

  public static final String NAME = "subdomain-registry";

  private final SubdomainRegistry registry;
  private final RegistryStore store;

  /**
   * Instantiates a new registry health check.
   *
   * @param registry the registry
   * @param store    the store the registry saves to
   */
  public RegistryHealthCheck(SubdomainRegistry registry, RegistryStore store) {
    this.registry = registry;
    this.store = store;
  }

  @Override
  protected Result check() {
    return Result.healthy("claims=%d, store=%s", registry.claimCount(), store.getClass().getSimpleName());
  }
}
