package com.codeheadsystems.tenancy.registry;

import java.util.Map;
import java.util.Set;

/**
 * Immutable, point-in-time copy of the registry aggregate. This is the unit a {@link RegistryStore}
 * persists and the unit readers observe.
 *
 * @param claims       subdomain to claim
 * @param reserved     names that can never be claimed
 * @param preallocated subdomain to owner, outside the claim/release path
 * @param quotas       owner to number of subdomains allowed by their subscription
 */
public record RegistrySnapshot(Map<String, Claim> claims,
                               Set<String> reserved,
                               Map<String, String> preallocated,
                               Map<String, Integer> quotas) {

  public RegistrySnapshot {
    claims = Map.copyOf(claims);
    reserved = Set.copyOf(reserved);
    preallocated = Map.copyOf(preallocated);
    quotas = Map.copyOf(quotas);
  }

  /**
   * An empty registry with no claims and no policy.
   *
   * @return the snapshot
   */
  public static RegistrySnapshot empty() {
    return new RegistrySnapshot(Map.of(), Set.of(), Map.of(), Map.of());
  }
}
