package com.codeheadsystems.tenancy.server.auth;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Reads PEM-encoded public keys.
 */
public final class PemKeys {

  private PemKeys() {
  }

  /**
   * Parses an X.509 {@code SubjectPublicKeyInfo} RSA key in PEM form. The
   * {@code -----BEGIN/END PUBLIC KEY-----} markers are optional and line breaks are ignored, so a
   * key squashed onto one line in an environment variable still parses.
   *
   * @param pem the PEM text
   * @return the RSA public key
   * @throws IllegalArgumentException if the text is empty, not base64, or not an RSA public key
   */
  public static RSAPublicKey rsaPublicKey(String pem) {
    if (pem == null || pem.isBlank()) {
      throw new IllegalArgumentException("Public key PEM is empty");
    }
    String body = pem
        .replace("\\n", "\n")
        .replaceAll("-----(BEGIN|END) [A-Z ]+-----", "")
        .replaceAll("\\s", "");
    try {
      PublicKey key = KeyFactory.getInstance("RSA")
          .generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(body)));
      return (RSAPublicKey) key;
    } catch (IllegalArgumentException | GeneralSecurityException e) {
      throw new IllegalArgumentException("Public key PEM is not a valid RSA public key", e);
    }
  }

  /**
   * Renders a public key as PEM.
   *
   * @param key the key
   * @return PEM text with 64-character lines
   */
  public static String toPem(PublicKey key) {
    String body = Base64.getMimeEncoder(64, new byte[]{'\n'}).encodeToString(key.getEncoded());
    return "-----BEGIN PUBLIC KEY-----\n" + body + "\n-----END PUBLIC KEY-----\n";
  }
}
