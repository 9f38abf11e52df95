package com.slack.querier.config;

import java.util.HashMap;
import java.util.Map;

/** Configuration objects bound from the querier yaml/json config. */
public class QuerierConfigs {

  private QuerierConfigs() {}

  public static class QuerierConfig {
    // Query the partition ingesters owning the tenant's shuffle shard instead of the whole ring
    private boolean queryPartitionIngesters = false;
    // How far back partition ownership is considered when resolving the tenant's shuffle shard
    private long queryIngestersWithinMs = 3 * 60 * 60 * 1000L;
    // Applied to queries that don't carry a deadline of their own
    private long defaultQueryTimeoutMs = 30_000;
    private TenantLimitsConfig tenantLimits = new TenantLimitsConfig();

    public boolean getQueryPartitionIngesters() {
      return queryPartitionIngesters;
    }

    public void setQueryPartitionIngesters(boolean queryPartitionIngesters) {
      this.queryPartitionIngesters = queryPartitionIngesters;
    }

    public long getQueryIngestersWithinMs() {
      return queryIngestersWithinMs;
    }

    public void setQueryIngestersWithinMs(long queryIngestersWithinMs) {
      this.queryIngestersWithinMs = queryIngestersWithinMs;
    }

    public long getDefaultQueryTimeoutMs() {
      return defaultQueryTimeoutMs;
    }

    public void setDefaultQueryTimeoutMs(long defaultQueryTimeoutMs) {
      this.defaultQueryTimeoutMs = defaultQueryTimeoutMs;
    }

    public TenantLimitsConfig getTenantLimits() {
      return tenantLimits;
    }

    public void setTenantLimits(TenantLimitsConfig tenantLimits) {
      this.tenantLimits = tenantLimits;
    }
  }

  public static class TenantLimitsConfig {
    private int defaultIngestionPartitionsShardSize = 1;
    private Map<String, Integer> ingestionPartitionsShardSizeOverrides = new HashMap<>();

    public int getDefaultIngestionPartitionsShardSize() {
      return defaultIngestionPartitionsShardSize;
    }

    public void setDefaultIngestionPartitionsShardSize(int defaultIngestionPartitionsShardSize) {
      this.defaultIngestionPartitionsShardSize = defaultIngestionPartitionsShardSize;
    }

    public Map<String, Integer> getIngestionPartitionsShardSizeOverrides() {
      return ingestionPartitionsShardSizeOverrides;
    }

    public void setIngestionPartitionsShardSizeOverrides(
        Map<String, Integer> ingestionPartitionsShardSizeOverrides) {
      this.ingestionPartitionsShardSizeOverrides = ingestionPartitionsShardSizeOverrides;
    }
  }
}
