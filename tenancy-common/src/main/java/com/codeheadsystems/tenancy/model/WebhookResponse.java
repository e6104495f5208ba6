package com.codeheadsystems.tenancy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Acknowledgement of a billing webhook event.
 * <p>
 * Used by: {@code POST /webhook} response
 *
 * @param received always true once the signature was accepted
 * @param released subdomains released by the event, newest first; empty for events that release nothing
 */
public record WebhookResponse(
    @JsonProperty("received") boolean received,
    @JsonProperty("released") List<String> released) {

  public WebhookResponse {
    released = released == null ? List.of() : List.copyOf(released);
  }

  public static WebhookResponse acknowledged(List<String> released) {
    return new WebhookResponse(true, released);
  }
}
