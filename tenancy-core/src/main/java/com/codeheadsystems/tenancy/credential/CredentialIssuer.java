package com.codeheadsystems.tenancy.credential;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTCreationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates the key material a deployment shares with its sync backend.
 * <p>
 * Key generation is CPU-bound; run this at setup time, never on a request path. Output is meant
 * to be written once to durable configuration (see {@link CredentialsFile}) and only ever
 * regenerated wholesale.
 */
public class CredentialIssuer {

  public static final String CERTIFICATE_TYPE = "CERT+JWT";
  public static final String CERTIFICATE_AUDIENCE = "certificate-users";
  public static final String CERTIFICATE_CLAIM = "certificate";
  public static final Duration CERTIFICATE_VALIDITY = Duration.ofDays(365);

  static final int RANDOM_ID_BYTES = 32;
  static final String COUNTRY = "WD";

  private static final Logger log = LoggerFactory.getLogger(CredentialIssuer.class);
  private static final String CURVE = "secp256r1";

  private final RandomProvider randomProvider;
  private final Clock clock;
  private final ObjectMapper mapper;

  public CredentialIssuer() {
    this(new RandomProvider(), Clock.systemUTC(), new ObjectMapper());
  }

  /**
   * Instantiates a new credential issuer.
   *
   * @param randomProvider source of key and identifier randomness
   * @param clock          source of the certificate validity window
   * @param mapper         JSON serializer for JWKs
   */
  public CredentialIssuer(RandomProvider randomProvider, Clock clock, ObjectMapper mapper) {
    this.randomProvider = Objects.requireNonNull(randomProvider, "randomProvider");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Generates an ES256 session key pair and encodes both halves as JWK tokens.
   *
   * @return the public and private tokens
   */
  public SessionTokens generateSessionTokens() {
    KeyPair keyPair = generateKeyPair();
    ECPublicKey publicKey = (ECPublicKey) keyPair.getPublic();
    ECPrivateKey privateKey = (ECPrivateKey) keyPair.getPrivate();
    log.debug("Generated session key pair");
    return new SessionTokens(
        JwkTokens.toToken(mapper, JwkTokens.publicJwk(publicKey)),
        JwkTokens.toToken(mapper, JwkTokens.privateJwk(publicKey, privateKey)));
  }

  /**
   * Generates an independent device CA key pair and a self-signed {@code CERT+JWT} certificate,
   * valid for one year from now.
   *
   * @param options distinguished-name fields
   * @return the CA private key token and the certificate
   */
  public DeviceCaKeys generateDeviceCaKeys(DeviceCaOptions options) {
    KeyPair keyPair = generateKeyPair();
    ECPublicKey publicKey = (ECPublicKey) keyPair.getPublic();
    ECPrivateKey privateKey = (ECPrivateKey) keyPair.getPrivate();

    Instant notBefore = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant notAfter = notBefore.plus(CERTIFICATE_VALIDITY);

    Map<String, Object> header = new LinkedHashMap<>();
    header.put("typ", CERTIFICATE_TYPE);
    header.put("x5c", List.of());

    String certificate;
    try {
      certificate = JWT.create()
          .withHeader(header)
          .withKeyId(randomId())
          .withIssuer(options.commonName())
          .withSubject(options.commonName())
          .withAudience(CERTIFICATE_AUDIENCE)
          .withIssuedAt(notBefore)
          .withNotBefore(notBefore)
          .withExpiresAt(notAfter)
          .withJWTId(randomId())
          .withClaim(CERTIFICATE_CLAIM, certificateBody(options, publicKey, notBefore, notAfter))
          .sign(Algorithm.ECDSA256(publicKey, privateKey));
    } catch (JWTCreationException e) {
      throw new CredentialIssuanceException("Unable to sign device CA certificate", e);
    }

    log.info("Issued device CA certificate for '{}' valid until {}", options.commonName(), notAfter);
    return new DeviceCaKeys(JwkTokens.toToken(mapper, JwkTokens.privateJwk(publicKey, privateKey)), certificate);
  }

  /**
   * Generates both the session tokens and the device CA in one go.
   *
   * @param options distinguished-name fields for the CA
   * @return everything a deployment needs
   */
  public IssuedCredentials issue(DeviceCaOptions options) {
    return new IssuedCredentials(generateSessionTokens(), generateDeviceCaKeys(options));
  }

  private Map<String, Object> certificateBody(DeviceCaOptions options, ECPublicKey publicKey,
                                              Instant notBefore, Instant notAfter) {
    Map<String, Object> name = new LinkedHashMap<>();
    name.put("commonName", options.commonName());
    name.put("organization", options.organization());
    name.put("locality", options.locality());
    name.put("stateOrProvinceName", options.state());
    name.put("countryName", COUNTRY);

    Map<String, Object> validity = new LinkedHashMap<>();
    validity.put("notBefore", notBefore.toString());
    validity.put("notAfter", notAfter.toString());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("version", "3");
    body.put("serialNumber", randomId());
    body.put("subject", name);
    body.put("issuer", name);
    body.put("validity", validity);
    body.put("subjectPublicKeyInfo", JwkTokens.coordinates(publicKey));
    body.put("signatureAlgorithm", "ES256");
    body.put("keyUsage", List.of("digitalSignature", "keyEncipherment"));
    body.put("extendedKeyUsage", List.of("serverAuth"));
    return body;
  }

  private String randomId() {
    return Base58.encode(randomProvider.randomBytes(RANDOM_ID_BYTES));
  }

  private KeyPair generateKeyPair() {
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
      generator.initialize(new ECGenParameterSpec(CURVE), randomProvider.random());
      return generator.generateKeyPair();
    } catch (GeneralSecurityException e) {
      throw new CredentialIssuanceException("Unable to generate P-256 key pair", e);
    }
  }
}
