package com.slack.querier.client;

/** Hands out clients for ingester addresses. */
public interface ReplicaClientPool {

  /**
   * Returns a client for the address, creating one if needed.
   *
   * @throws ReplicaUnavailableException if no connection can be established
   */
  ReplicaClient getClientFor(String address);
}
