package com.codeheadsystems.tenancy.registry;

import java.util.List;

/**
 * Outcome of a subscription quantity change.
 *
 * @param ownerId     the owner whose subscription changed
 * @param newQuantity the new number of subdomains the owner may hold
 * @param released    subdomains released, newest claim first; empty when nothing was over quota
 */
public record SubscriptionChange(String ownerId, int newQuantity, List<String> released) {

  public SubscriptionChange {
    released = List.copyOf(released);
  }
}
