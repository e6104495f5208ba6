package com.codeheadsystems.tenancy.flow;

/**
 * What the flows need to know about a signed-in user.
 *
 * @param userId       identity provider user id
 * @param passkeyCount number of passkeys registered for the user
 */
public record FlowUser(String userId, int passkeyCount) {

  public boolean hasPasskey() {
    return passkeyCount > 0;
  }
}
