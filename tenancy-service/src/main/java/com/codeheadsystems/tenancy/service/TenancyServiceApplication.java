package com.codeheadsystems.tenancy.service;

import com.codeheadsystems.tenancy.dropwizard.TenancyBundle;
import com.codeheadsystems.tenancy.dropwizard.TenancyConfiguration;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable subdomain registry service. Reads {@code config.yml}, with {@code ${ENV_VAR:-default}}
 * substitution so deployments can override individual keys through the environment.
 *
 * <pre>
 *   java -jar tenancy-service.jar server config.yml
 * </pre>
 */
public class TenancyServiceApplication extends Application<TenancyConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new TenancyServiceApplication().run(args);
  }

  @Override
  public String getName() {
    return "tenancy-service";
  }

  @Override
  public void initialize(Bootstrap<TenancyConfiguration> bootstrap) {
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)
        )
    );
    bootstrap.addBundle(new TenancyBundle<>());
  }

  @Override
  public void run(TenancyConfiguration configuration, Environment environment) {
    // Resources, auth and health checks come from TenancyBundle
  }
}
