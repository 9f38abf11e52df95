package com.slack.querier.config;

/** Looks the shard count up in the tenant limits, falling back to the default shard size. */
public class LimitsShardCountLookup implements ShardCountLookup {
  private final QuerierConfigs.TenantLimitsConfig tenantLimits;

  public LimitsShardCountLookup(QuerierConfigs.TenantLimitsConfig tenantLimits) {
    this.tenantLimits = tenantLimits;
  }

  @Override
  public int shardCountForTenant(String tenantId) {
    return tenantLimits
        .getIngestionPartitionsShardSizeOverrides()
        .getOrDefault(tenantId, tenantLimits.getDefaultIngestionPartitionsShardSize());
  }
}
