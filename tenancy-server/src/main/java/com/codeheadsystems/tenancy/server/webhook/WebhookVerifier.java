package com.codeheadsystems.tenancy.server.webhook;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies Standard Webhooks (Svix) signatures on billing events.
 * <p>
 * The signed content is {@code id + "." + timestamp + "." + body}. The signature header holds one
 * or more space-separated {@code v1,<base64 HMAC-SHA256>} entries, any of which may match.
 * Timestamps more than {@link #TOLERANCE} away from now are rejected to bound replays.
 */
public class WebhookVerifier {

  public static final String ID_HEADER = "svix-id";
  public static final String TIMESTAMP_HEADER = "svix-timestamp";
  public static final String SIGNATURE_HEADER = "svix-signature";
  public static final Duration TOLERANCE = Duration.ofMinutes(5);

  static final String SECRET_PREFIX = "whsec_";
  static final String VERSION = "v1";

  private static final Logger log = LoggerFactory.getLogger(WebhookVerifier.class);

  private final byte[] key;
  private final Clock clock;

  /**
   * Instantiates a new webhook verifier.
   *
   * @param secret signing secret, {@code whsec_} followed by base64; null or empty disables
   *               verification so every event is refused
   * @param clock  source of the current time for the tolerance check
   * @throws IllegalArgumentException if the secret is not valid base64
   */
  public WebhookVerifier(String secret, Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    if (secret == null || secret.isBlank()) {
      this.key = null;
      log.warn("No webhook secret configured: billing webhooks will be refused.");
      return;
    }
    String encoded = secret.startsWith(SECRET_PREFIX) ? secret.substring(SECRET_PREFIX.length()) : secret;
    try {
      this.key = Base64.getDecoder().decode(encoded.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Webhook secret is not valid base64", e);
    }
  }

  public boolean isConfigured() {
    return key != null;
  }

  /**
   * Verifies an event.
   *
   * @param id              {@value #ID_HEADER} header
   * @param timestamp       {@value #TIMESTAMP_HEADER} header, epoch seconds
   * @param signatureHeader {@value #SIGNATURE_HEADER} header
   * @param body            raw request body
   * @throws IllegalStateException if no secret is configured
   * @throws SecurityException     if a header is missing, the timestamp is out of tolerance, or no
   *                               signature matches
   */
  public void verify(String id, String timestamp, String signatureHeader, byte[] body) {
    if (!isConfigured()) {
      throw new IllegalStateException("Webhook secret not configured");
    }
    if (isBlank(id) || isBlank(timestamp) || isBlank(signatureHeader)) {
      throw new SecurityException("Missing webhook signature headers");
    }
    long sentAt;
    try {
      sentAt = Long.parseLong(timestamp.trim());
    } catch (NumberFormatException e) {
      throw new SecurityException("Invalid webhook timestamp");
    }
    long now = clock.instant().getEpochSecond();
    if (Math.abs(now - sentAt) > TOLERANCE.getSeconds()) {
      log.debug("Webhook {} rejected: timestamp {} outside tolerance of {}", id, sentAt, now);
      throw new SecurityException("Webhook timestamp outside tolerance");
    }

    byte[] expected = mac(id, sentAt, body);
    for (String entry : signatureHeader.trim().split(" +")) {
      int comma = entry.indexOf(',');
      if (comma < 0 || !VERSION.equals(entry.substring(0, comma))) {
        continue;
      }
      byte[] candidate;
      try {
        candidate = Base64.getDecoder().decode(entry.substring(comma + 1));
      } catch (IllegalArgumentException e) {
        continue;
      }
      if (MessageDigest.isEqual(expected, candidate)) {
        return;
      }
    }
    log.debug("Webhook {} rejected: no matching signature", id);
    throw new SecurityException("Webhook signature mismatch");
  }

  /**
   * Computes the signature header value for an event.
   *
   * @param id        event id
   * @param timestamp epoch seconds
   * @param body      raw body
   * @return {@code v1,<base64>}
   * @throws IllegalStateException if no secret is configured
   */
  public String sign(String id, long timestamp, byte[] body) {
    if (!isConfigured()) {
      throw new IllegalStateException("Webhook secret not configured");
    }
    return VERSION + "," + Base64.getEncoder().encodeToString(mac(id, timestamp, body));
  }

  private byte[] mac(String id, long timestamp, byte[] body) {
    HMac hmac = new HMac(new SHA256Digest());
    hmac.init(new KeyParameter(key));
    byte[] prefix = (id + "." + timestamp + ".").getBytes(StandardCharsets.UTF_8);
    hmac.update(prefix, 0, prefix.length);
    hmac.update(body, 0, body.length);
    byte[] out = new byte[hmac.getMacSize()];
    hmac.doFinal(out, 0);
    return out;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
