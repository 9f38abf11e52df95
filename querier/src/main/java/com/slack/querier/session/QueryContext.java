package com.slack.querier.session;

import com.google.common.base.Strings;
import java.time.Instant;
import java.util.Optional;

/**
 * Request scoped state of a logical query. One context is created per incoming request and passed
 * to every querier call made on behalf of that request, which lets consecutive calls share the
 * {@link PartitionContext}.
 */
public class QueryContext {
  private final String tenantId;
  private final PartitionContext partitionContext;
  private final Instant deadline;
  private final QueryStats stats;

  private QueryContext(
      String tenantId, PartitionContext partitionContext, Instant deadline, QueryStats stats) {
    this.tenantId = tenantId;
    this.partitionContext = partitionContext;
    this.deadline = deadline;
    this.stats = stats;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** A context for the given tenant, with no deadline of its own. */
  public static QueryContext forTenant(String tenantId) {
    return builder().tenantId(tenantId).build();
  }

  /**
   * Returns the id of the tenant issuing the query.
   *
   * @throws IdentityResolutionException if the request carries no tenant
   */
  public String tenantId() {
    if (Strings.isNullOrEmpty(tenantId)) {
      throw new IdentityResolutionException("no org id");
    }
    return tenantId;
  }

  public PartitionContext partitionContext() {
    return partitionContext;
  }

  public Optional<Instant> deadline() {
    return Optional.ofNullable(deadline);
  }

  public QueryStats stats() {
    return stats;
  }

  public static class Builder {
    private String tenantId;
    private PartitionContext partitionContext;
    private Instant deadline;
    private QueryStats stats;

    public Builder tenantId(String tenantId) {
      this.tenantId = tenantId;
      return this;
    }

    public Builder partitionContext(PartitionContext partitionContext) {
      this.partitionContext = partitionContext;
      return this;
    }

    public Builder deadline(Instant deadline) {
      this.deadline = deadline;
      return this;
    }

    public Builder stats(QueryStats stats) {
      this.stats = stats;
      return this;
    }

    public QueryContext build() {
      return new QueryContext(
          tenantId,
          partitionContext == null ? new PartitionContext() : partitionContext,
          deadline,
          stats == null ? new QueryStats() : stats);
    }
  }
}
