package com.codeheadsystems.tenancy.credential;

import java.math.BigInteger;
import org.bouncycastle.util.BigIntegers;

/**
 * Bitcoin-alphabet base58 encoding (the multibase {@code base58btc} flavour).
 * <p>
 * Each leading zero byte becomes a literal {@code '1'}, followed by the big-endian base-58 digits
 * of the value of the whole input. A zero value is written as the single digit {@code '1'}, so
 * {@code []} encodes as {@code "1"} and {@code [0]} as {@code "11"}.
 */
public final class Base58 {

  static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";

  private static final BigInteger BASE = BigInteger.valueOf(58);

  private Base58() {
  }

  /**
   * Encodes bytes as base58.
   *
   * @param bytes the input
   * @return the encoded string, never empty
   */
  public static String encode(byte[] bytes) {
    StringBuilder out = new StringBuilder();
    for (byte b : bytes) {
      if (b != 0) {
        break;
      }
      out.append(ALPHABET.charAt(0));
    }

    BigInteger value = new BigInteger(1, bytes);
    if (value.signum() == 0) {
      return out.append(ALPHABET.charAt(0)).toString();
    }
    StringBuilder digits = new StringBuilder();
    while (value.signum() > 0) {
      BigInteger[] qr = value.divideAndRemainder(BASE);
      digits.append(ALPHABET.charAt(qr[1].intValue()));
      value = qr[0];
    }
    return out.append(digits.reverse()).toString();
  }

  /**
   * Decodes base58 produced by {@link #encode}.
   *
   * @param encoded the base58 text
   * @return the bytes
   * @throws IllegalArgumentException on characters outside the alphabet
   */
  public static byte[] decode(String encoded) {
    int leadingOnes = 0;
    while (leadingOnes < encoded.length() && encoded.charAt(leadingOnes) == ALPHABET.charAt(0)) {
      leadingOnes++;
    }
    // A lone trailing '1' is the zero-value digit, not a leading zero byte.
    int zeroBytes = leadingOnes == encoded.length() ? Math.max(0, leadingOnes - 1) : leadingOnes;

    BigInteger value = BigInteger.ZERO;
    for (int i = leadingOnes; i < encoded.length(); i++) {
      int digit = ALPHABET.indexOf(encoded.charAt(i));
      if (digit < 0) {
        throw new IllegalArgumentException("Invalid base58 character: " + encoded.charAt(i));
      }
      value = value.multiply(BASE).add(BigInteger.valueOf(digit));
    }
    byte[] magnitude = value.signum() == 0 ? new byte[0] : BigIntegers.asUnsignedByteArray(value);
    byte[] out = new byte[zeroBytes + magnitude.length];
    System.arraycopy(magnitude, 0, out, zeroBytes, magnitude.length);
    return out;
  }
}
