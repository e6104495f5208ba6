package com.codeheadsystems.tenancy.credential;

/**
 * Distinguished-name fields for the device CA certificate.
 *
 * @param commonName   issuer and subject common name
 * @param organization organization name
 * @param locality     locality name
 * @param state        state or province name
 */
public record DeviceCaOptions(String commonName, String organization, String locality, String state) {

  public static final String DEFAULT_COMMON_NAME = "Docker Dev CA";
  public static final String DEFAULT_ORGANIZATION = "Vibes DIY Development";
  public static final String DEFAULT_LOCALITY = "Local";
  public static final String DEFAULT_STATE = "Development";

  public static DeviceCaOptions defaults() {
    return new DeviceCaOptions(DEFAULT_COMMON_NAME, DEFAULT_ORGANIZATION, DEFAULT_LOCALITY, DEFAULT_STATE);
  }

  public DeviceCaOptions withCommonName(String value) {
    return new DeviceCaOptions(value, organization, locality, state);
  }

  public DeviceCaOptions withOrganization(String value) {
    return new DeviceCaOptions(commonName, value, locality, state);
  }

  public DeviceCaOptions withLocality(String value) {
    return new DeviceCaOptions(commonName, organization, value, state);
  }

  public DeviceCaOptions withState(String value) {
    return new DeviceCaOptions(commonName, organization, locality, value);
  }
}
