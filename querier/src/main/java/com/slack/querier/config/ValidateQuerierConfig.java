package com.slack.querier.config;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Map;

public class ValidateQuerierConfig {

  /**
   * ValidateConfig ensures that the config values are consistent with each other. The classes
   * using a config value are still expected to check it at the point of use.
   */
  public static void validateConfig(QuerierConfigs.QuerierConfig querierConfig) {
    checkArgument(
        querierConfig.getDefaultQueryTimeoutMs() >= 1000,
        "QuerierConfig defaultQueryTimeoutMs cannot be less than 1000ms");
    if (querierConfig.getQueryPartitionIngesters()) {
      checkArgument(
          querierConfig.getQueryIngestersWithinMs() > 0,
          "QuerierConfig queryIngestersWithinMs must be positive when querying partition ingesters");
    }
    validateTenantLimits(querierConfig.getTenantLimits());
  }

  private static void validateTenantLimits(QuerierConfigs.TenantLimitsConfig tenantLimits) {
    checkArgument(tenantLimits != null, "QuerierConfig tenantLimits cannot be null");
    checkArgument(
        tenantLimits.getDefaultIngestionPartitionsShardSize() > 0,
        "TenantLimitsConfig defaultIngestionPartitionsShardSize must be positive");
    for (Map.Entry<String, Integer> override :
        tenantLimits.getIngestionPartitionsShardSizeOverrides().entrySet()) {
      checkArgument(
          override.getValue() != null && override.getValue() > 0,
          "TenantLimitsConfig shard size override for tenant %s must be positive",
          override.getKey());
    }
  }
}
