package com.codeheadsystems.tenancy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The authenticated owner's subdomains and allotment.
 * <p>
 * Used by: {@code GET /api/claims} response
 *
 * @param ownerId    the authenticated owner
 * @param subdomains owned subdomains, newest claim first
 * @param quota      number of subdomains the owner may hold
 */
public record OwnerClaimsResponse(
    @JsonProperty("ownerId") String ownerId,
    @JsonProperty("subdomains") List<String> subdomains,
    @JsonProperty("quota") int quota) {
}
