package com.codeheadsystems.tenancy.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One active claim in a {@link RegistryDocument}. Registry files that name the owner
 * {@code userId} are read as well.
 *
 * @param ownerId   the owner
 * @param claimedAt ISO-8601 instant the claim was created
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClaimEntry(
    @JsonProperty("ownerId") @JsonAlias("userId") String ownerId,
    @JsonProperty("claimedAt") String claimedAt) {
}
