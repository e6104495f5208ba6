package com.codeheadsystems.tenancy.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the outcome of a claim.
 * <p>
 * Used by: {@code POST /claim} response
 *
 * @param success   whether the caller now owns the subdomain
 * @param subdomain the normalized subdomain on success
 * @param error     reason code on failure
 * @param ownerId   existing owner when the error is {@code claimed} or {@code preallocated}
 * @param current   claims the caller holds, only for {@code quota_exceeded}
 * @param quota     claims the caller may hold, only for {@code quota_exceeded}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClaimResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("subdomain") String subdomain,
    @JsonProperty("error") String error,
    @JsonProperty("ownerId") String ownerId,
    @JsonProperty("current") Integer current,
    @JsonProperty("quota") Integer quota) {

  public static ClaimResponse claimed(String subdomain) {
    return new ClaimResponse(true, subdomain, null, null, null, null);
  }

  public static ClaimResponse rejected(String error, String ownerId) {
    return new ClaimResponse(false, null, error, ownerId, null, null);
  }

  public static ClaimResponse overQuota(String error, int current, int quota) {
    return new ClaimResponse(false, null, error, null, current, quota);
  }
}
