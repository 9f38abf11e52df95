package com.slack.querier.testlib;

import com.slack.querier.client.ReplicaClient;
import com.slack.querier.client.ReplicaClientPool;
import com.slack.querier.client.ReplicaUnavailableException;
import java.util.HashMap;
import java.util.Map;

/** Hands out pre-registered clients, failing for any address that was not registered. */
public class MapReplicaClientPool implements ReplicaClientPool {
  private final Map<String, ReplicaClient> clients = new HashMap<>();

  public MapReplicaClientPool register(String address, ReplicaClient client) {
    clients.put(address, client);
    return this;
  }

  @Override
  public ReplicaClient getClientFor(String address) {
    ReplicaClient client = clients.get(address);
    if (client == null) {
      throw new ReplicaUnavailableException(address, "No client registered for " + address);
    }
    return client;
  }
}
