package com.codeheadsystems.tenancy.server.manager;

import com.codeheadsystems.tenancy.model.ClaimResponse;

/**
 * Claim response body together with the HTTP status it should be sent with.
 *
 * @param status   201 on success, 400 for a malformed name, 402 over quota, 409 when taken
 * @param response the body
 */
public record ClaimOutcome(int status, ClaimResponse response) {

  public static final int CREATED = 201;
  public static final int BAD_REQUEST = 400;
  public static final int PAYMENT_REQUIRED = 402;
  public static final int CONFLICT = 409;
}
