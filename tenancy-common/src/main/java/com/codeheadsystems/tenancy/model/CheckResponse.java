package com.codeheadsystems.tenancy.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a subdomain availability check.
 * <p>
 * Used by: {@code GET /check/{subdomain}} response
 *
 * @param available whether the subdomain can be claimed right now
 * @param reason    machine-readable reason code when unavailable ({@code reserved}, {@code claimed},
 *                  {@code too_short}, ...); omitted when available
 * @param ownerId   current owner when the reason is {@code claimed} or {@code preallocated}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckResponse(
    @JsonProperty("available") boolean available,
    @JsonProperty("reason") String reason,
    @JsonProperty("ownerId") String ownerId) {
}
