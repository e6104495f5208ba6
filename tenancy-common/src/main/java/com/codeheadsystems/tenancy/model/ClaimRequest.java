package com.codeheadsystems.tenancy.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a subdomain claim.
 * <p>
 * The owner is taken from the verified bearer token. A client-supplied {@code ownerId} is accepted
 * for compatibility and ignored.
 * <p>
 * Used by: {@code POST /claim}
 *
 * @param subdomain requested subdomain, normalized server-side
 * @param ownerId   ignored
 */
public record ClaimRequest(
    @JsonProperty("subdomain") String subdomain,
    @JsonProperty("ownerId") String ownerId) {

  public ClaimRequest(String subdomain) {
    this(subdomain, null);
  }
}
