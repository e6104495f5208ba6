package com.codeheadsystems.tenancy.dropwizard;

import com.codeheadsystems.tenancy.dropwizard.auth.TenancyAuthenticator;
import com.codeheadsystems.tenancy.dropwizard.auth.TenancyPrincipal;
import com.codeheadsystems.tenancy.dropwizard.health.RegistryHealthCheck;
import com.codeheadsystems.tenancy.dropwizard.resource.OwnerClaimsResource;
import com.codeheadsystems.tenancy.registry.InMemoryRegistryStore;
import com.codeheadsystems.tenancy.registry.RegistryStore;
import com.codeheadsystems.tenancy.registry.SubdomainRegistry;
import com.codeheadsystems.tenancy.server.auth.BearerTokenVerifier;
import com.codeheadsystems.tenancy.server.auth.PemKeys;
import com.codeheadsystems.tenancy.server.manager.TenancyRegistryManager;
import com.codeheadsystems.tenancy.server.resource.CorsFilter;
import com.codeheadsystems.tenancy.server.resource.RegistryResource;
import com.codeheadsystems.tenancy.server.resource.WebhookResource;
import com.codeheadsystems.tenancy.server.store.FileRegistryStore;
import com.codeheadsystems.tenancy.server.webhook.WebhookVerifier;
import com.codeheadsystems.tenancy.validator.PermittedOrigins;
import com.codeheadsystems.tenancy.validator.TimingValidator;
import com.codeheadsystems.tenancy.validator.TokenAuthorizer;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the subdomain registry into an existing Dropwizard application.
 * <p>
 * Registers the registry and webhook JAX-RS resources, a CORS filter for the permitted origins, the
 * {@code subdomain-registry} health check and a bearer-token authentication filter so
 * applications can protect their own routes with {@code @Auth TenancyPrincipal}. Requires a
 * {@link TenancyConfiguration} block in the application's YAML config.
 * <p>
 * With the store chosen from {@code registryPath}:
 * <pre>{@code
 *   bootstrap.addBundle(new TenancyBundle<>());
 * }</pre>
 * <p>
 * Or with a custom store:
 * <pre>{@code
 *   bootstrap.addBundle(new TenancyBundle<>(myRegistryStore));
 * }</pre>
 */
@Singleton
public class TenancyBundle<C extends TenancyConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(TenancyBundle.class);

  private final RegistryStore suppliedStore;
  private SubdomainRegistry registry;

  /**
   * Creates a bundle whose store is chosen from {@code registryPath}: a JSON file when set,
   * otherwise in memory.
   */
  public TenancyBundle() {
    this.suppliedStore = null;
  }

  /**
   * Creates a bundle backed by the supplied store. {@code registryPath} is ignored.
   *
   * @param registryStore the store
   */
  @Inject
  public TenancyBundle(RegistryStore registryStore) {
    this.suppliedStore = registryStore;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    RegistryStore store = suppliedStore != null ? suppliedStore : buildStore(configuration);
    registry = new SubdomainRegistry(
        store,
        new HashSet<>(configuration.getReservedSubdomains()),
        configuration.getPreallocatedSubdomains(),
        configuration.getDefaultQuota(),
        Clock.systemUTC());

    List<String> origins = PermittedOrigins.parse(configuration.getPermittedOrigins());
    if (origins.isEmpty()) {
      log.warn("No permittedOrigins configured; tokens issued for any origin will be accepted.");
    }
    BearerTokenVerifier tokenVerifier = new BearerTokenVerifier(
        PemKeys.rsaPublicKey(configuration.getIdentityProviderPublicKeyPem()),
        new TokenAuthorizer(origins, new TimingValidator()));
    WebhookVerifier webhookVerifier = new WebhookVerifier(configuration.getWebhookSecret(), Clock.systemUTC());
    TenancyRegistryManager manager = new TenancyRegistryManager(
        registry, tokenVerifier, webhookVerifier, environment.getObjectMapper());

    environment.jersey().register(new CorsFilter(origins));
    environment.jersey().register(new RegistryResource(manager));
    environment.jersey().register(new WebhookResource(manager));
    environment.healthChecks().register(RegistryHealthCheck.NAME, new RegistryHealthCheck(registry, store));

    // Bearer auth filter for @Auth TenancyPrincipal
    TenancyAuthenticator authenticator = new TenancyAuthenticator(tokenVerifier);
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<TenancyPrincipal>()
            .setAuthenticator(authenticator)
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(TenancyPrincipal.class));
    environment.jersey().register(new OwnerClaimsResource(manager));
  }

  /**
   * The registry built by {@link #run}, for applications that drive claims directly, e.g. through
   * a {@code SignupCoordinator}.
   *
   * @return the registry
   * @throws IllegalStateException if the bundle has not run yet
   */
  public SubdomainRegistry getRegistry() {
    if (registry == null) {
      throw new IllegalStateException("TenancyBundle has not run yet");
    }
    return registry;
  }

  private RegistryStore buildStore(C configuration) {
    String path = configuration.getRegistryPath();
    if (path == null || path.isBlank()) {
      log.warn("""
          #################################################################
          # WARNING: No registryPath configured. Subdomain claims are     #
          # kept in memory and will be lost on restart.                   #
          # Do not use in production.                                     #
          #################################################################
          """);
      return new InMemoryRegistryStore();
    }
    return new FileRegistryStore(Path.of(path));
  }
}
