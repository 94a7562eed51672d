package com.chainindexer.ingest.service;

import java.util.List;

/** Address list of the external subscription before and after one full-replacement edit. */
public record SubscriptionChange(List<String> previousAddresses, List<String> updatedAddresses) {

  public SubscriptionChange {
    previousAddresses = List.copyOf(previousAddresses);
    updatedAddresses = List.copyOf(updatedAddresses);
  }
}
