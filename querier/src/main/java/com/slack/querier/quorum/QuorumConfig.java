package com.slack.querier.quorum;

/**
 * Options for a quorum read. With minimizeRequests only the minimum number of replicas (or zones)
 * needed for quorum are queried up front, and another one is added each time one of them fails.
 */
public record QuorumConfig(boolean minimizeRequests) {

  public static QuorumConfig defaultConfig() {
    return new QuorumConfig(false);
  }

  public static QuorumConfig minimizingRequests() {
    return new QuorumConfig(true);
  }
}
