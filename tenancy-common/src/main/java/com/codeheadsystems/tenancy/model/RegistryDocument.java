package com.codeheadsystems.tenancy.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON form of the whole registry. Served read-only at {@code GET /registry.json} and used as the
 * on-disk format of the file-backed registry store.
 * <p>
 * Maps are sorted by key so the document is stable across writes.
 *
 * @param claims       subdomain to claim
 * @param reserved     names that can never be claimed, sorted
 * @param preallocated subdomain to owner for claims managed outside this API
 * @param quotas       owner to allowed number of claims
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegistryDocument(
    @JsonProperty("claims") Map<String, ClaimEntry> claims,
    @JsonProperty("reserved") List<String> reserved,
    @JsonProperty("preallocated") Map<String, String> preallocated,
    @JsonProperty("quotas") Map<String, Integer> quotas) {

  public RegistryDocument {
    claims = sorted(claims);
    reserved = reserved == null ? List.of() : reserved.stream().sorted().toList();
    preallocated = sorted(preallocated);
    quotas = sorted(quotas);
  }

  private static <V> Map<String, V> sorted(Map<String, V> map) {
    return map == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(map));
  }
}
