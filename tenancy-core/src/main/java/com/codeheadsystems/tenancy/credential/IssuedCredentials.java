package com.codeheadsystems.tenancy.credential;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full output of credential issuance for one deployment.
 *
 * @param session  session key tokens shared with the sync backend
 * @param deviceCa device CA private key and certificate
 */
public record IssuedCredentials(SessionTokens session, DeviceCaKeys deviceCa) {

  /**
   * Entries in credentials-file order.
   *
   * @return key to value
   */
  public Map<String, String> toEntries() {
    Map<String, String> entries = new LinkedHashMap<>();
    entries.put(CredentialsFile.SESSION_TOKEN_PUBLIC, session.publicToken());
    entries.put(CredentialsFile.SESSION_TOKEN_SECRET, session.privateToken());
    entries.put(CredentialsFile.DEVICE_CA_PRIVATE_KEY, deviceCa.privateToken());
    entries.put(CredentialsFile.DEVICE_CA_CERT, deviceCa.certificate());
    return entries;
  }

  /**
   * Rebuilds credentials from credentials-file entries.
   *
   * @param entries parsed file
   * @return the credentials
   * @throws IllegalArgumentException if any of the four keys is missing or empty
   */
  public static IssuedCredentials fromEntries(Map<String, String> entries) {
    return new IssuedCredentials(
        new SessionTokens(
            require(entries, CredentialsFile.SESSION_TOKEN_PUBLIC),
            require(entries, CredentialsFile.SESSION_TOKEN_SECRET)),
        new DeviceCaKeys(
            require(entries, CredentialsFile.DEVICE_CA_PRIVATE_KEY),
            require(entries, CredentialsFile.DEVICE_CA_CERT)));
  }

  private static String require(Map<String, String> entries, String key) {
    String value = entries.get(key);
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("Missing credential: " + key);
    }
    return value;
  }
}
