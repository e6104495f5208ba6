package com.codeheadsystems.tenancy.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.codeheadsystems.tenancy.server.auth.PemKeys;
import com.codeheadsystems.tenancy.server.webhook.WebhookVerifier;
import io.dropwizard.testing.ConfigOverride;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * End-to-end tests over HTTP: availability checks, authenticated claims, signed billing webhooks,
 * the public registry read and the {@code @Auth} protected claims listing.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class TenancyBundleIntegrationTest {

  private static final String WEBHOOK_SECRET = "whsec_aW50ZWdyYXRpb24td2ViaG9vay1zaWduaW5nLWtleSE=";
  private static final String ORIGIN = "https://app.vibes.test";
  private static final KeyPair IDENTITY_PROVIDER_KEYS = generateRsaKeyPair();

  static final DropwizardAppExtension<TenancyConfiguration> APP =
      new DropwizardAppExtension<>(
          TenancyApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"),
          ConfigOverride.config("identityProviderPublicKeyPem",
              PemKeys.toPem(IDENTITY_PROVIDER_KEYS.getPublic()).replace("\n", "")));

  private final ObjectMapper mapper = new ObjectMapper();
  private final WebhookVerifier webhookSigner = new WebhookVerifier(WEBHOOK_SECRET, Clock.systemUTC());
  private HttpClient httpClient;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
  }

  // ─── /check ─────────────────────────────────────────────────────────────

  @Test
  void check_availableName_returnsAvailable() throws Exception {
    HttpResponse<String> response = get("/check/fresh-name", null);

    assertThat(response.statusCode()).isEqualTo(200);
    JsonNode body = mapper.readTree(response.body());
    assertThat(body.get("available").asBoolean()).isTrue();
    assertThat(body.has("reason")).isFalse();
  }

  @Test
  void check_preallocatedName_returnsOwner() throws Exception {
    JsonNode body = mapper.readTree(get("/check/ACME", null).body());

    assertThat(body.get("available").asBoolean()).isFalse();
    assertThat(body.get("reason").asText()).isEqualTo("preallocated");
    assertThat(body.get("ownerId").asText()).isEqualTo("user_9");
  }

  // ─── CORS ────────────────────────────────────────────────────────────────

  @Test
  void preflight_fromPermittedOrigin_returns204WithCorsHeaders() throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/claim"))
        .header("Origin", "https://site.vibes.test")
        .header("Access-Control-Request-Method", "POST")
        .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
        .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(204);
    assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).contains("https://site.vibes.test");
    assertThat(response.headers().firstValue("Access-Control-Allow-Methods")).contains("GET, POST, OPTIONS");
    assertThat(response.headers().firstValue("Access-Control-Allow-Headers"))
        .contains("Content-Type, Authorization");
  }

  @Test
  void check_fromPermittedOrigin_echoesOrigin() throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/check/foo-bar"))
        .header("Origin", "https://site.vibes.test")
        .GET()
        .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).contains("https://site.vibes.test");
  }

  @Test
  void check_fromForeignOrigin_doesNotEchoOrigin() throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/check/foo-bar"))
        .header("Origin", "https://evil.test")
        .GET()
        .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).contains("https://*.vibes.test");
  }

  // ─── /claim ─────────────────────────────────────────────────────────────

  @Test
  void claim_withValidToken_returns201ThenCheckShowsOwner() throws Exception {
    HttpResponse<String> response = postClaim("claimed-site", token("user_claim", ORIGIN));

    assertThat(response.statusCode()).isEqualTo(201);
    assertThat(mapper.readTree(response.body()).get("subdomain").asText()).isEqualTo("claimed-site");

    JsonNode check = mapper.readTree(get("/check/claimed-site", null).body());
    assertThat(check.get("reason").asText()).isEqualTo("claimed");
    assertThat(check.get("ownerId").asText()).isEqualTo("user_claim");
  }

  @Test
  void claim_sameNameAgainBySameOwner_isIdempotent() throws Exception {
    String token = token("user_repeat", ORIGIN);
    postClaim("repeat-site", token);

    assertThat(postClaim("repeat-site", token).statusCode()).isEqualTo(201);
  }

  @Test
  void claim_takenByAnotherOwner_returns409() throws Exception {
    postClaim("contested-site", token("user_first", ORIGIN));

    HttpResponse<String> response = postClaim("contested-site", token("user_second", ORIGIN));

    assertThat(response.statusCode()).isEqualTo(409);
    JsonNode body = mapper.readTree(response.body());
    assertThat(body.get("success").asBoolean()).isFalse();
    assertThat(body.get("error").asText()).isEqualTo("claimed");
  }

  @Test
  void claim_reservedName_returns409() throws Exception {
    assertThat(postClaim("admin", token("user_reserved", ORIGIN)).statusCode()).isEqualTo(409);
  }

  @Test
  void claim_malformedName_returns400() throws Exception {
    HttpResponse<String> response = postClaim("no_underscores", token("user_format", ORIGIN));

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(mapper.readTree(response.body()).get("error").asText()).isEqualTo("invalid_format");
  }

  @Test
  void claim_beyondDefaultQuota_returns402() throws Exception {
    String token = token("user_quota", ORIGIN);
    postClaim("quota-one", token);
    postClaim("quota-two", token);
    postClaim("quota-three", token);

    HttpResponse<String> response = postClaim("quota-four", token);

    assertThat(response.statusCode()).isEqualTo(402);
    assertThat(mapper.readTree(response.body()).get("quota").asInt()).isEqualTo(3);
  }

  @Test
  void claim_withoutToken_returns401() throws Exception {
    assertThat(postClaim("anonymous-site", null).statusCode()).isEqualTo(401);
  }

  @Test
  void claim_withTokenForForeignOrigin_returns401() throws Exception {
    assertThat(postClaim("foreign-site", token("user_foreign", "https://evil.test")).statusCode())
        .isEqualTo(401);
  }

  @Test
  void claim_withExpiredToken_returns401() throws Exception {
    String expired = JWT.create()
        .withSubject("user_expired")
        .withClaim("azp", ORIGIN)
        .withExpiresAt(Instant.now().minusSeconds(60))
        .sign(algorithm());

    assertThat(postClaim("expired-site", expired).statusCode()).isEqualTo(401);
  }

  // ─── /webhook ───────────────────────────────────────────────────────────

  @Test
  void webhook_subscriptionDeleted_releasesOwnersClaims() throws Exception {
    postClaim("billing-site", token("user_billing", ORIGIN));
    String event = "{\"type\":\"subscription.deleted\",\"data\":{\"user_id\":\"user_billing\"}}";

    HttpResponse<String> response = postWebhook(event, true);

    assertThat(response.statusCode()).isEqualTo(200);
    JsonNode body = mapper.readTree(response.body());
    assertThat(body.get("received").asBoolean()).isTrue();
    assertThat(body.get("released").get(0).asText()).isEqualTo("billing-site");
    assertThat(mapper.readTree(get("/check/billing-site", null).body()).get("available").asBoolean()).isTrue();
  }

  @Test
  void webhook_badSignature_returns401() throws Exception {
    String event = "{\"type\":\"subscription.deleted\",\"data\":{\"user_id\":\"user_billing\"}}";

    assertThat(postWebhook(event, false).statusCode()).isEqualTo(401);
  }

  // ─── /registry.json and /api/claims ─────────────────────────────────────

  @Test
  void registryJson_listsPolicyAndClaims() throws Exception {
    postClaim("listed-site", token("user_listed", ORIGIN));

    JsonNode body = mapper.readTree(get("/registry.json", null).body());

    assertThat(body.get("claims").get("listed-site").get("ownerId").asText()).isEqualTo("user_listed");
    assertThat(body.get("reserved").toString()).contains("admin");
    assertThat(body.get("preallocated").get("acme").asText()).isEqualTo("user_9");
  }

  @Test
  void ownerClaims_withToken_listsOwnSubdomains() throws Exception {
    String token = token("user_listing", ORIGIN);
    postClaim("mine-one", token);

    HttpResponse<String> response = get("/api/claims", token);

    assertThat(response.statusCode()).isEqualTo(200);
    JsonNode body = mapper.readTree(response.body());
    assertThat(body.get("ownerId").asText()).isEqualTo("user_listing");
    assertThat(body.get("subdomains").get(0).asText()).isEqualTo("mine-one");
  }

  @Test
  void ownerClaims_withoutToken_returns401() throws Exception {
    assertThat(get("/api/claims", null).statusCode()).isEqualTo(401);
  }

  @Test
  void healthCheck_reportsRegistry() throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(String.format("http://localhost:%d/healthcheck", APP.getAdminPort())))
        .GET()
        .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    assertThat(response.body()).contains("subdomain-registry");
  }

  private HttpResponse<String> get(String path, String token) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(baseUrl() + path)).GET();
    if (token != null) {
      builder.header("Authorization", "Bearer " + token);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private HttpResponse<String> postClaim(String subdomain, String token) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/claim"))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString("{\"subdomain\":\"" + subdomain + "\"}"));
    if (token != null) {
      builder.header("Authorization", "Bearer " + token);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private HttpResponse<String> postWebhook(String event, boolean validSignature) throws Exception {
    byte[] body = event.getBytes(StandardCharsets.UTF_8);
    long timestamp = Instant.now().getEpochSecond();
    String signature = validSignature ? webhookSigner.sign("msg_it", timestamp, body) : "v1,AAAA";
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/webhook"))
        .header("Content-Type", "application/json")
        .header(WebhookVerifier.ID_HEADER, "msg_it")
        .header(WebhookVerifier.TIMESTAMP_HEADER, Long.toString(timestamp))
        .header(WebhookVerifier.SIGNATURE_HEADER, signature)
        .POST(HttpRequest.BodyPublishers.ofByteArray(body))
        .build();
    return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
  }

  private static String token(String subject, String azp) {
    return JWT.create()
        .withSubject(subject)
        .withClaim("azp", azp)
        .withExpiresAt(Instant.now().plusSeconds(300))
        .sign(algorithm());
  }

  private static Algorithm algorithm() {
    return Algorithm.RSA256((RSAPublicKey) IDENTITY_PROVIDER_KEYS.getPublic(),
        (RSAPrivateKey) IDENTITY_PROVIDER_KEYS.getPrivate());
  }

  private static KeyPair generateRsaKeyPair() {
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
      generator.initialize(2048);
      return generator.generateKeyPair();
    } catch (Exception e) {
      throw new IllegalStateException(e);
    }
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}
