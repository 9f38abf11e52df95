package com.slack.querier.config;

/** Resolves how many partitions a tenant's shuffle shard spans. */
@FunctionalInterface
public interface ShardCountLookup {
  int shardCountForTenant(String tenantId);
}
