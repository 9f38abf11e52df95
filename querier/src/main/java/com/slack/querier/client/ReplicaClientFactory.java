package com.slack.querier.client;

import java.io.IOException;

@FunctionalInterface
public interface ReplicaClientFactory {
  ReplicaClient create(String address) throws IOException;
}
