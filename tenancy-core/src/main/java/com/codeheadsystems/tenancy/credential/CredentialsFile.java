package com.codeheadsystems.tenancy.credential;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat {@code KEY=value} text format used to hand issued credentials from the operator who
 * generated them to the service that deploys them.
 * <p>
 * On read, blank lines and lines starting with {@code #} are skipped, lines without {@code =} are
 * ignored, each line is split on its first {@code =}, and keys and values are trimmed.
 */
public final class CredentialsFile {

  public static final String SESSION_TOKEN_PUBLIC = "CLOUD_SESSION_TOKEN_PUBLIC";
  public static final String SESSION_TOKEN_SECRET = "CLOUD_SESSION_TOKEN_SECRET";
  public static final String DEVICE_CA_PRIVATE_KEY = "DEVICE_ID_CA_PRIV_KEY";
  public static final String DEVICE_CA_CERT = "DEVICE_ID_CA_CERT";

  private CredentialsFile() {
  }

  /**
   * Renders entries, one {@code KEY=value} per line.
   *
   * @param entries key to value, written in iteration order
   * @return the file content
   */
  public static String format(Map<String, String> entries) {
    StringBuilder out = new StringBuilder();
    entries.forEach((key, value) -> out.append(key).append('=').append(value).append('\n'));
    return out.toString();
  }

  /**
   * Parses file content.
   *
   * @param content the file content
   * @return key to value in file order; later duplicates win
   */
  public static Map<String, String> parse(String content) {
    Map<String, String> entries = new LinkedHashMap<>();
    for (String line : content.split("\\R")) {
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      int eq = trimmed.indexOf('=');
      if (eq < 0) {
        continue;
      }
      entries.put(trimmed.substring(0, eq).trim(), trimmed.substring(eq + 1).trim());
    }
    return entries;
  }

  /**
   * Writes credentials to a file, replacing any existing content.
   *
   * @param path        target file
   * @param credentials the credentials
   */
  public static void write(Path path, IssuedCredentials credentials) {
    try {
      Files.writeString(path, format(credentials.toEntries()), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write credentials to " + path, e);
    }
  }

  /**
   * Reads credentials from a file.
   *
   * @param path source file
   * @return the credentials
   * @throws IllegalArgumentException if any required key is missing
   */
  public static IssuedCredentials read(Path path) {
    try {
      return IssuedCredentials.fromEntries(parse(Files.readString(path, StandardCharsets.UTF_8)));
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read credentials from " + path, e);
    }
  }
}
