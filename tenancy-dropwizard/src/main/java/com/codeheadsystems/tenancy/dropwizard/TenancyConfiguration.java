package com.codeheadsystems.tenancy.dropwizard;

import com.codeheadsystems.tenancy.registry.SubdomainRegistry;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dropwizard configuration for the subdomain registry service.
 * <p>
 * For production, set {@code registryPath} so claims survive restarts and {@code webhookSecret} so
 * billing events are accepted. {@code identityProviderPublicKeyPem} is always required; it is the
 * key the identity provider signs tenant tokens with.
 */
public class TenancyConfiguration extends Configuration {

  /**
   * Comma-separated origin patterns a token's {@code azp} must match, e.g.
   * {@code https://*.example.com,http://localhost:3000}. Empty places no restriction.
   */
  private String permittedOrigins = "";

  /**
   * Names that can never be claimed.
   */
  @NotNull
  private List<String> reservedSubdomains = new ArrayList<>();

  /**
   * Subdomain to owner bindings managed outside the claim API.
   */
  @NotNull
  private Map<String, String> preallocatedSubdomains = new LinkedHashMap<>();

  /**
   * JSON file holding the registry. Leave empty for an in-memory registry (dev only: all claims
   * are lost on restart).
   */
  private String registryPath = "";

  /**
   * PEM-encoded RS256 public key of the identity provider.
   */
  @NotEmpty
  private String identityProviderPublicKeyPem;

  /**
   * Standard Webhooks signing secret ({@code whsec_...}). Leave empty to refuse all webhooks.
   */
  private String webhookSecret = "";

  /**
   * Claims allowed for an owner with no recorded subscription quantity. The default effectively
   * disables billing limits.
   */
  @Min(0)
  private int defaultQuota = SubdomainRegistry.DEFAULT_QUOTA;

  /**
   * Gets permitted origins.
   *
   * @return the comma-separated permitted origins
   */
  @JsonProperty
  public String getPermittedOrigins() {
    return permittedOrigins;
  }

  /**
   * Sets permitted origins.
   *
   * @param permittedOrigins the comma-separated permitted origins
   */
  @JsonProperty
  public void setPermittedOrigins(String permittedOrigins) {
    this.permittedOrigins = permittedOrigins;
  }

  @JsonProperty
  public List<String> getReservedSubdomains() {
    return reservedSubdomains;
  }

  @JsonProperty
  public void setReservedSubdomains(List<String> reservedSubdomains) {
    this.reservedSubdomains = reservedSubdomains;
  }

  @JsonProperty
  public Map<String, String> getPreallocatedSubdomains() {
    return preallocatedSubdomains;
  }

  @JsonProperty
  public void setPreallocatedSubdomains(Map<String, String> preallocatedSubdomains) {
    this.preallocatedSubdomains = preallocatedSubdomains;
  }

  /**
   * Gets registry path.
   *
   * @return the registry file path, empty for in-memory
   */
  @JsonProperty
  public String getRegistryPath() {
    return registryPath;
  }

  /**
   * Sets registry path.
   *
   * @param registryPath the registry file path
   */
  @JsonProperty
  public void setRegistryPath(String registryPath) {
    this.registryPath = registryPath;
  }

  @JsonProperty
  public String getIdentityProviderPublicKeyPem() {
    return identityProviderPublicKeyPem;
  }

  @JsonProperty
  public void setIdentityProviderPublicKeyPem(String identityProviderPublicKeyPem) {
    this.identityProviderPublicKeyPem = identityProviderPublicKeyPem;
  }

  @JsonProperty
  public String getWebhookSecret() {
    return webhookSecret;
  }

  @JsonProperty
  public void setWebhookSecret(String webhookSecret) {
    this.webhookSecret = webhookSecret;
  }

  /**
   * Gets default quota.
   *
   * @return the default quota
   */
  @JsonProperty
  public int getDefaultQuota() {
    return defaultQuota;
  }

  /**
   * Sets default quota.
   *
   * @param defaultQuota the default quota
   */
  @JsonProperty
  public void setDefaultQuota(int defaultQuota) {
    this.defaultQuota = defaultQuota;
  }
}
