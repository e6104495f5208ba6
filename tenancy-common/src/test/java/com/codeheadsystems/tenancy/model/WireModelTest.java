package com.codeheadsystems.tenancy.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WireModelTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void checkResponse_available_omitsReasonAndOwner() throws Exception {
    JsonNode json = mapper.valueToTree(new CheckResponse(true, null, null));

    assertThat(json.get("available").asBoolean()).isTrue();
    assertThat(json.has("reason")).isFalse();
    assertThat(json.has("ownerId")).isFalse();
  }

  @Test
  void checkResponse_claimed_carriesOwner() {
    JsonNode json = mapper.valueToTree(new CheckResponse(false, "claimed", "user_1"));

    assertThat(json.get("reason").asText()).isEqualTo("claimed");
    assertThat(json.get("ownerId").asText()).isEqualTo("user_1");
  }

  @Test
  void claimRequest_readsWithOrWithoutOwner() throws Exception {
    assertThat(mapper.readValue("{\"subdomain\":\"my-site\"}", ClaimRequest.class))
        .isEqualTo(new ClaimRequest("my-site"));
    assertThat(mapper.readValue("{\"subdomain\":\"my-site\",\"ownerId\":\"u\"}", ClaimRequest.class).ownerId())
        .isEqualTo("u");
  }

  @Test
  void claimResponse_shapes() {
    JsonNode ok = mapper.valueToTree(ClaimResponse.claimed("my-site"));
    assertThat(ok.get("success").asBoolean()).isTrue();
    assertThat(ok.get("subdomain").asText()).isEqualTo("my-site");
    assertThat(ok.has("error")).isFalse();

    JsonNode quota = mapper.valueToTree(ClaimResponse.overQuota("quota_exceeded", 2, 2));
    assertThat(quota.get("success").asBoolean()).isFalse();
    assertThat(quota.get("error").asText()).isEqualTo("quota_exceeded");
    assertThat(quota.get("current").asInt()).isEqualTo(2);
    assertThat(quota.get("quota").asInt()).isEqualTo(2);
  }

  @Test
  void webhookResponse_nullReleased_isEmptyList() {
    assertThat(new WebhookResponse(true, null).released()).isEmpty();
    assertThat(mapper.valueToTree(WebhookResponse.acknowledged(List.of("a", "b"))).toString())
        .isEqualTo("{\"received\":true,\"released\":[\"a\",\"b\"]}");
  }

  @Test
  void registryDocument_isSortedAndReadable() throws Exception {
    RegistryDocument document = new RegistryDocument(
        Map.of("zeta", new ClaimEntry("user_1", "2026-01-01T00:00:00Z"),
            "alpha", new ClaimEntry("user_2", "2026-01-02T00:00:00Z")),
        List.of("www", "admin"),
        Map.of("acme", "user_9"),
        null);

    String json = mapper.writeValueAsString(document);

    assertThat(document.claims().keySet()).containsExactly("alpha", "zeta");
    assertThat(document.reserved()).containsExactly("admin", "www");
    assertThat(document.quotas()).isEmpty();
    assertThat(mapper.readValue(json, RegistryDocument.class)).isEqualTo(document);
  }
}
