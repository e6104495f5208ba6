package com.codeheadsystems.tenancy.registry;

import java.time.Instant;
import java.util.Objects;

/**
 * One tenant's ownership of one subdomain.
 *
 * @param subdomain normalized (lowercase, trimmed) subdomain name
 * @param ownerId   opaque tenant / user identifier
 * @param claimedAt when the claim was created; never mutated
 */
public record Claim(String subdomain, String ownerId, Instant claimedAt) {

  public Claim {
    Objects.requireNonNull(subdomain, "subdomain");
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(claimedAt, "claimedAt");
  }
}
