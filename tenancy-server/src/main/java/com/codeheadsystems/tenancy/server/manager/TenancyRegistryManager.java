package com.codeheadsystems.tenancy.server.manager;

import com.codeheadsystems.tenancy.model.CheckResponse;
import com.codeheadsystems.tenancy.model.ClaimRequest;
import com.codeheadsystems.tenancy.model.ClaimResponse;
import com.codeheadsystems.tenancy.model.OwnerClaimsResponse;
import com.codeheadsystems.tenancy.model.RegistryDocument;
import com.codeheadsystems.tenancy.model.WebhookResponse;
import com.codeheadsystems.tenancy.registry.Availability;
import com.codeheadsystems.tenancy.registry.ClaimResult;
import com.codeheadsystems.tenancy.registry.SubdomainRegistry;
import com.codeheadsystems.tenancy.registry.SubscriptionChange;
import com.codeheadsystems.tenancy.registry.UnavailableReason;
import com.codeheadsystems.tenancy.server.auth.BearerTokenVerifier;
import com.codeheadsystems.tenancy.server.store.RegistryDocuments;
import com.codeheadsystems.tenancy.server.webhook.WebhookVerifier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service behind the registry HTTP surface.
 * <p>
 * Keeps all request handling here so the JAX-RS resources only translate exceptions into HTTP
 * responses.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException} : bad / missing request data → HTTP 400</li>
 *   <li>{@link SecurityException}        : missing or rejected credentials → HTTP 401</li>
 *   <li>{@link IllegalStateException}    : a required secret is not configured → HTTP 503</li>
 * </ul>
 * A {@link com.codeheadsystems.tenancy.registry.RegistryPersistenceException} is not part of the
 * contract; it means the registry could not be saved and should surface as a server error.
 */
public class TenancyRegistryManager {

  public static final String SUBSCRIPTION_CREATED = "subscription.created";
  public static final String SUBSCRIPTION_UPDATED = "subscription.updated";
  public static final String SUBSCRIPTION_DELETED = "subscription.deleted";

  private static final Logger log = LoggerFactory.getLogger(TenancyRegistryManager.class);

  private final SubdomainRegistry registry;
  private final BearerTokenVerifier tokenVerifier;
  private final WebhookVerifier webhookVerifier;
  private final ObjectMapper mapper;

  /**
   * Instantiates a new tenancy registry manager.
   *
   * @param registry        the registry
   * @param tokenVerifier   verifies tenant bearer tokens
   * @param webhookVerifier verifies billing webhook signatures
   * @param mapper          parses webhook payloads
   */
  public TenancyRegistryManager(SubdomainRegistry registry,
                                BearerTokenVerifier tokenVerifier,
                                WebhookVerifier webhookVerifier,
                                ObjectMapper mapper) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.tokenVerifier = Objects.requireNonNull(tokenVerifier, "tokenVerifier");
    this.webhookVerifier = Objects.requireNonNull(webhookVerifier, "webhookVerifier");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Public availability check.
   *
   * @param subdomain requested name
   * @return the availability
   * @throws IllegalArgumentException if the name is missing
   */
  public CheckResponse check(String subdomain) {
    if (subdomain == null) {
      throw new IllegalArgumentException("Missing required field: subdomain");
    }
    Availability availability = registry.checkAvailability(subdomain);
    log.debug("check({}) -> {}", subdomain, availability);
    return new CheckResponse(
        availability.available(),
        availability.reason() == null ? null : availability.reason().code(),
        availability.ownerId());
  }

  /**
   * Claims a subdomain for the token's subject. Claiming a name the caller already owns succeeds
   * without changing anything.
   *
   * @param req         the claim; any {@code ownerId} in it is ignored
   * @param bearerToken the JWT bearer token (without "Bearer " prefix)
   * @return the response and its status
   * @throws IllegalArgumentException if the subdomain is missing
   * @throws SecurityException        if the token is missing or rejected
   */
  public ClaimOutcome claim(ClaimRequest req, String bearerToken) {
    if (bearerToken == null || bearerToken.isBlank()) {
      throw new SecurityException("Authentication required");
    }
    String ownerId = tokenVerifier.verify(bearerToken)
        .map(BearerTokenVerifier.VerifiedToken::subject)
        .orElseThrow(() -> new SecurityException("Authentication failed"));
    if (req == null || req.subdomain() == null) {
      throw new IllegalArgumentException("Missing required field: subdomain");
    }
    if (req.ownerId() != null && !req.ownerId().equals(ownerId)) {
      log.debug("Ignoring client-supplied ownerId for claim by {}", ownerId);
    }

    ClaimResult result = registry.createClaim(req.subdomain(), ownerId);
    if (result.success()) {
      return new ClaimOutcome(ClaimOutcome.CREATED, ClaimResponse.claimed(result.subdomain()));
    }
    UnavailableReason reason = result.error();
    if (reason == UnavailableReason.CLAIMED && ownerId.equals(result.ownerId())) {
      return new ClaimOutcome(ClaimOutcome.CREATED,
          ClaimResponse.claimed(SubdomainRegistry.normalize(req.subdomain())));
    }
    if (reason == UnavailableReason.QUOTA_EXCEEDED) {
      return new ClaimOutcome(ClaimOutcome.PAYMENT_REQUIRED, ClaimResponse.overQuota(reason.code(),
          registry.getUserClaims(ownerId).size(), registry.quotaFor(ownerId)));
    }
    int status = reason.isFormatViolation() ? ClaimOutcome.BAD_REQUEST : ClaimOutcome.CONFLICT;
    return new ClaimOutcome(status, ClaimResponse.rejected(reason.code(), result.ownerId()));
  }

  /**
   * Applies a signed billing event.
   * <p>
   * {@value #SUBSCRIPTION_CREATED} and {@value #SUBSCRIPTION_UPDATED} set the owner's quantity
   * from {@code data.quantity} (1 when absent); {@value #SUBSCRIPTION_DELETED} sets it to 0. Other
   * event types are acknowledged without effect.
   *
   * @param id        {@code svix-id} header
   * @param timestamp {@code svix-timestamp} header
   * @param signature {@code svix-signature} header
   * @param body      raw request body
   * @return the acknowledgement with the released subdomains
   * @throws SecurityException        if the signature does not verify
   * @throws IllegalStateException    if no webhook secret is configured
   * @throws IllegalArgumentException if the payload is malformed or names no user
   */
  public WebhookResponse handleWebhook(String id, String timestamp, String signature, byte[] body) {
    byte[] payload = body == null ? new byte[0] : body;
    webhookVerifier.verify(id, timestamp, signature, payload);

    JsonNode event;
    try {
      event = mapper.readTree(payload);
    } catch (IOException e) {
      throw new IllegalArgumentException("Malformed webhook payload", e);
    }
    if (event == null || !event.isObject()) {
      throw new IllegalArgumentException("Malformed webhook payload");
    }

    String type = event.path("type").asText("");
    JsonNode data = event.path("data");
    int quantity;
    switch (type) {
      case SUBSCRIPTION_CREATED, SUBSCRIPTION_UPDATED -> quantity = quantityOf(data);
      case SUBSCRIPTION_DELETED -> quantity = 0;
      default -> {
        log.debug("Ignoring webhook {} of type '{}'", id, type);
        return WebhookResponse.acknowledged(List.of());
      }
    }

    String userId = userIdOf(data);
    SubscriptionChange change = registry.processSubscriptionChange(userId, quantity);
    log.info("Webhook {} ({}) for {}: quantity={}, released={}", id, type, userId, quantity, change.released());
    return WebhookResponse.acknowledged(change.released());
  }

  /**
   * Consistent copy of the registry for public reading.
   *
   * @return the registry document
   */
  public RegistryDocument registryDocument() {
    return RegistryDocuments.toDocument(registry.snapshot());
  }

  /**
   * Subdomains held by an authenticated owner.
   *
   * @param ownerId the owner
   * @return the owner's subdomains and quota
   */
  public OwnerClaimsResponse ownerClaims(String ownerId) {
    return new OwnerClaimsResponse(ownerId, registry.getUserClaims(ownerId), registry.quotaFor(ownerId));
  }

  private static int quantityOf(JsonNode data) {
    JsonNode quantity = data.path("quantity");
    if (quantity.isMissingNode() || quantity.isNull()) {
      return 1;
    }
    if (!quantity.isIntegralNumber() || !quantity.canConvertToInt() || quantity.asInt() < 0) {
      throw new IllegalArgumentException("Invalid subscription quantity: " + quantity);
    }
    return quantity.asInt();
  }

  private static String userIdOf(JsonNode data) {
    String userId = data.path("user_id").asText(null);
    if (userId == null || userId.isBlank()) {
      userId = data.path("payer").path("user_id").asText(null);
    }
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("Webhook event has no user_id");
    }
    return userId;
  }
}
