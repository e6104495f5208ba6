package com.codeheadsystems.tenancy.credential;

/**
 * Device certificate authority key and its self-signed certificate.
 *
 * @param privateToken CA private key as a portable JWK token
 * @param certificate  three-part {@code CERT+JWT} signed by the CA key
 */
public record DeviceCaKeys(String privateToken, String certificate) {
}
